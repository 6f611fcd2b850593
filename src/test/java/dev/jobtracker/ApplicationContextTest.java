package dev.jobtracker;

import dev.jobtracker.ai.ExtractionClient;
import dev.jobtracker.ai.GeminiExtractionClient;
import dev.jobtracker.fetch.PageFetcher;
import dev.jobtracker.service.SchedulerService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ApplicationContextTest {

  @MockitoBean
  private PipelineRunner pipelineRunner;

  @MockitoBean
  private ExitManager exitManager;

  @Autowired
  private ExtractionClient extractionClient;

  @Autowired
  private List<PageFetcher> pageFetchers;

  @Autowired
  private SchedulerService schedulerService;

  @Autowired
  private ThreadPoolTaskScheduler pipelineTaskScheduler;

  @Test
  void contextLoads() {
    assertThat(extractionClient).isInstanceOf(GeminiExtractionClient.class);
    assertThat(extractionClient.isConfigured()).isTrue();
    assertThat(pageFetchers).hasSize(2);
    assertThat(schedulerService.state().nextRunAt()).isNull();
  }

  @Test
  void pipelineTaskSchedulerIsInitializedByTheContext() {
    assertThat(pipelineTaskScheduler.getScheduledExecutor()).isNotNull();
    assertThat(pipelineTaskScheduler.getThreadNamePrefix()).isEqualTo("pipeline-scheduler-");
  }
}

package dev.jobtracker;

import dev.jobtracker.config.TrackerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobTrackerApplicationTests {

  @Mock
  private PipelineRunner pipelineRunner;

  @Mock
  private ExitManager exitManager;

  private TrackerProperties properties;

  @BeforeEach
  void setUp() {
    properties = new TrackerProperties();
    properties.setRunOnce(true);
  }

  @Test
  void shouldRunPipelineAndExitWithItsStatus() {
    JobTrackerApplication app = new JobTrackerApplication(properties, pipelineRunner, exitManager);

    when(pipelineRunner.execute()).thenReturn(0);

    app.run();

    verify(pipelineRunner).execute();
    verify(exitManager).exit(0);
  }

  @Test
  void shouldExitWithErrorWhenRunFails() {
    JobTrackerApplication app = new JobTrackerApplication(properties, pipelineRunner, exitManager);

    when(pipelineRunner.execute()).thenReturn(1);

    app.run();

    verify(exitManager).exit(1);
  }

  @Test
  void shouldHandleExceptionAndExitWithError() {
    JobTrackerApplication app = new JobTrackerApplication(properties, pipelineRunner, exitManager);

    when(pipelineRunner.execute()).thenThrow(new RuntimeException("Fatal"));

    app.run();

    verify(exitManager).exit(1);
  }

  @Test
  void shouldKeepServingWhenNotInRunOnceMode() {
    properties.setRunOnce(false);
    JobTrackerApplication app = new JobTrackerApplication(properties, pipelineRunner, exitManager);

    app.run();

    verifyNoInteractions(pipelineRunner, exitManager);
  }
}

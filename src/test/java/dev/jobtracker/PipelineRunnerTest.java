package dev.jobtracker;

import dev.jobtracker.model.NotificationStatus;
import dev.jobtracker.model.RunStatus;
import dev.jobtracker.model.RunSummary;
import dev.jobtracker.model.RunTrigger;
import dev.jobtracker.service.PipelineAlreadyRunningException;
import dev.jobtracker.service.SchedulerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PipelineRunnerTest {

  @Mock
  private SchedulerService schedulerService;

  @InjectMocks
  private PipelineRunner pipelineRunner;

  @BeforeEach
  @SuppressWarnings("null")
  void setUp() {
    ReflectionTestUtils.setField(pipelineRunner, "metricsWaitSeconds", 0);
  }

  private static RunSummary summary(RunStatus status) {
    LocalDateTime now = LocalDateTime.now();
    return new RunSummary(1L, RunTrigger.MANUAL, status, now, now, 2, 2, NotificationStatus.DELIVERED,
        false, null, status == RunStatus.FAILED ? "database is locked" : null, List.of());
  }

  @Test
  void execute_completedRun_returnsZero() {
    // Arrange
    when(schedulerService.runNow(RunTrigger.MANUAL)).thenReturn(summary(RunStatus.COMPLETED));

    // Act
    int result = pipelineRunner.execute();

    // Assert
    assertEquals(0, result);
    verify(schedulerService).runNow(RunTrigger.MANUAL);
  }

  @Test
  void execute_failedRun_returnsOne() {
    // Arrange
    when(schedulerService.runNow(RunTrigger.MANUAL)).thenReturn(summary(RunStatus.FAILED));

    // Act
    int result = pipelineRunner.execute();

    // Assert
    assertEquals(1, result);
  }

  @Test
  void execute_nullSummary_returnsOne() {
    // Arrange
    when(schedulerService.runNow(RunTrigger.MANUAL)).thenReturn(null);

    // Act
    int result = pipelineRunner.execute();

    // Assert
    assertEquals(1, result);
  }

  @Test
  void execute_alreadyRunning_returnsOne() {
    // Arrange
    when(schedulerService.runNow(RunTrigger.MANUAL)).thenThrow(new PipelineAlreadyRunningException());

    // Act
    int result = pipelineRunner.execute();

    // Assert
    assertEquals(1, result);
  }

  @Test
  void execute_unexpectedFailure_propagates() {
    // Arrange
    when(schedulerService.runNow(RunTrigger.MANUAL)).thenThrow(new IllegalStateException("boom"));

    // Act & Assert
    assertThrows(IllegalStateException.class, () -> pipelineRunner.execute());
  }

  @Test
  @SuppressWarnings("null")
  void execute_withWait_completes() {
    ReflectionTestUtils.setField(pipelineRunner, "metricsWaitSeconds", 1);
    when(schedulerService.runNow(RunTrigger.MANUAL)).thenReturn(summary(RunStatus.COMPLETED));

    assertEquals(0, pipelineRunner.execute());

    verify(schedulerService).runNow(RunTrigger.MANUAL);
  }
}

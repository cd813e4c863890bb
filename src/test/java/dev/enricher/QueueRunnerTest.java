package dev.enricher;

import dev.enricher.config.QueueConfig;
import dev.enricher.queue.JobQueueService;
import dev.enricher.queue.JobWorkerPool;
import dev.enricher.queue.QueueStats;
import dev.enricher.service.ProviderConfigService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QueueRunnerTest {

  @Mock
  private ProviderConfigService providerConfigService;

  @Mock
  private JobQueueService queue;

  @Mock
  private JobWorkerPool workerPool;

  private QueueConfig queueConfig;
  private QueueRunner queueRunner;

  @BeforeEach
  void setUp() {
    queueConfig = new QueueConfig();
    queueRunner = new QueueRunner(providerConfigService, queue, workerPool, queueConfig);
  }

  @Test
  void start_recoversBeforeStartingWorkers() {
    // Arrange
    when(queue.getStats()).thenReturn(new QueueStats(4, 0, 1, 0, 0, 0));

    // Act
    queueRunner.start();

    // Assert
    InOrder order = inOrder(providerConfigService, queue, workerPool);
    order.verify(providerConfigService).syncRegisteredProviders();
    order.verify(queue).recoverStuckJobs();
    order.verify(workerPool).start();
  }

  @Test
  void start_autoStartDisabled_leavesWorkersIdle() {
    // Arrange
    queueConfig.setAutoStart(false);
    when(queue.getStats()).thenReturn(new QueueStats(0, 0, 0, 0, 0, 0));

    // Act
    queueRunner.start();

    // Assert
    verify(workerPool, never()).start();
  }

  @Test
  void start_storageFailure_throwsIllegalState() {
    // Arrange
    when(providerConfigService.syncRegisteredProviders())
        .thenThrow(new DataAccessResourceFailureException("unable to open database file"));

    // Act & Assert
    assertThrows(IllegalStateException.class, () -> queueRunner.start());
    verify(workerPool, never()).start();
  }
}

package dev.enricher;

import dev.enricher.config.QueueConfig;
import dev.enricher.queue.JobQueueService;
import dev.enricher.queue.JobWorkerPool;
import dev.enricher.queue.QueueStats;
import dev.enricher.service.ProviderConfigService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Brings the queue up: provider configuration sync, crash recovery, then the worker pool.
 * Separated from the main Application class for testability.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueueRunner {

  private static final String SEPARATOR = "========================================";

  private final ProviderConfigService providerConfigService;
  private final JobQueueService queue;
  private final JobWorkerPool workerPool;
  private final QueueConfig queueConfig;

  public void start() {
    log.info(SEPARATOR);
    log.info("Media Enricher Starting");
    log.info(SEPARATOR);

    try {
      int providers = providerConfigService.syncRegisteredProviders();
      int recovered = queue.recoverStuckJobs();
      QueueStats stats = queue.getStats();

      log.info("Provider configurations created: {}", providers);
      log.info("Stuck jobs requeued: {}", recovered);
      log.info("Queue: {} pending, {} retrying", stats.pending(), stats.retrying());

      if (!queueConfig.isAutoStart()) {
        log.info("Worker auto-start disabled");
        return;
      }
      workerPool.start();
      log.info(SEPARATOR);
    } catch (Exception e) {
      log.error("Queue startup failed: {}", e.getMessage(), e);
      throw new IllegalStateException("Queue startup failed", e);
    }
  }
}

package dev.enricher.queue.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.enricher.config.QueueConfig;
import dev.enricher.entity.Job;
import dev.enricher.queue.JobQueueService;
import dev.enricher.service.AssetDownloader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CleanupJobHandlerTest {

    @Mock
    private JobQueueService queue;

    @Mock
    private AssetDownloader downloader;

    @Test
    void shouldApplyRetentionAndSweepTempFiles() {
        QueueConfig config = new QueueConfig();
        config.setCompletedRetentionDays(3);
        config.setFailedRetentionDays(14);
        when(queue.cleanupHistory(3, 14)).thenReturn(5);
        when(downloader.sweepStaleTempFiles()).thenReturn(2);

        CleanupJobHandler handler = new CleanupJobHandler(queue, downloader, config);

        StepVerifier.create(handler.handle(Job.builder().build(), new ObjectMapper().createObjectNode().put("manual", true)))
                .expectNext("history 5, temp files 2")
                .verifyComplete();
    }
}

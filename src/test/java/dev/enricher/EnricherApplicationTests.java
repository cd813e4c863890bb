package dev.enricher;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.ArgumentMatchers.anyInt;

@ExtendWith(MockitoExtension.class)
class EnricherApplicationTests {

  @Mock
  private QueueRunner queueRunner;

  @Mock
  private ExitManager exitManager;

  @Test
  void shouldStartQueueWithoutExiting() {
    EnricherApplication app = new EnricherApplication(queueRunner, exitManager);

    app.run();

    verify(queueRunner).start();
    verify(exitManager, never()).exit(anyInt());
  }

  @Test
  void shouldExitWithErrorWhenStartupFails() {
    EnricherApplication app = new EnricherApplication(queueRunner, exitManager);

    doThrow(new IllegalStateException("Queue startup failed")).when(queueRunner).start();

    app.run();

    verify(exitManager).exit(1);
  }
}

package dev.enricher;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Shuts the application down with an exit status. Disabled by {@code app.exit-enabled=false},
 * which the test profile sets so a failure cannot kill the test runner.
 */
@Slf4j
@Component
public class ExitManager {

  private final ApplicationContext context;
  private final boolean exitEnabled;

  public ExitManager(ApplicationContext context, @Value("${app.exit-enabled:true}") boolean exitEnabled) {
    this.context = context;
    this.exitEnabled = exitEnabled;
  }

  public void exit(int status) {
    if (!exitEnabled) {
      log.warn("Exit with status {} suppressed", status);
      return;
    }
    int code = SpringApplication.exit(context, () -> status);
    terminate(code);
  }

  protected void terminate(int code) {
    System.exit(code);
  }
}

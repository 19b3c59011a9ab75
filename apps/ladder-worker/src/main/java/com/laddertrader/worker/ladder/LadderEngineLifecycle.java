package com.laddertrader.worker.ladder;

import com.laddertrader.engine.ladder.LadderConfigurationException;
import com.laddertrader.engine.ladder.LadderEngine;
import com.laddertrader.integration.nonkyc.NonkycApiException;
import jakarta.annotation.PreDestroy;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationContext;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Starts the ladder once the context is ready and stops it on shutdown. A startup failure ends the
 * process: exit code 2 for an unprofitable or invalid configuration, 1 for a venue failure.
 */
@Component
public class LadderEngineLifecycle {
  static final int CONFIGURATION_EXIT_CODE = 2;
  static final int VENUE_EXIT_CODE = 1;

  private static final Logger log = LoggerFactory.getLogger(LadderEngineLifecycle.class);

  private final LadderEngine engine;
  private final IntConsumer exitHandler;

  @Autowired
  public LadderEngineLifecycle(LadderEngine engine, ApplicationContext applicationContext) {
    this(engine, code -> System.exit(SpringApplication.exit(applicationContext, () -> code)));
  }

  LadderEngineLifecycle(LadderEngine engine, IntConsumer exitHandler) {
    this.engine = engine;
    this.exitHandler = exitHandler;
  }

  @EventListener(ApplicationReadyEvent.class)
  @Order(0)
  public void start() {
    try {
      engine.start();
      log.info(
          "Ladder engine started symbol={} mode={} running={}",
          engine.config().symbol().venueSymbol(),
          engine.config().runMode().value(),
          engine.isRunning());
    } catch (LadderConfigurationException ex) {
      log.error("Ladder configuration rejected error={}", ex.getMessage());
      exitHandler.accept(CONFIGURATION_EXIT_CODE);
    } catch (NonkycApiException ex) {
      log.error(
          "Ladder engine failed to start kind={} status={} error={}",
          ex.kind(),
          ex.httpStatus(),
          ex.getMessage());
      exitHandler.accept(VENUE_EXIT_CODE);
    }
  }

  @PreDestroy
  public void stop() {
    engine.stop();
  }
}

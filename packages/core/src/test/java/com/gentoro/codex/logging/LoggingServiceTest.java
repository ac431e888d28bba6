package com.gentoro.codex.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Map;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingServiceTest {

  @Test
  void readsLevelsAndSkipsUnknownOnes() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("logging.level.root", "warn");
    cfg.setProperty("logging.level.com.gentoro.codex.demo", "DEBUG");
    cfg.setProperty("logging.level.com.gentoro.codex.other", "LOUD");

    assertEquals(
        Map.of("root", Level.WARN, "com.gentoro.codex.demo", Level.DEBUG),
        LoggingService.levels(cfg));
  }

  @Test
  void appliesLevelsToLogback() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("logging.level.com.gentoro.codex.demo", "TRACE");

    assertEquals(1, LoggingService.applyConfiguration(cfg));
    LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
    assertEquals(Level.TRACE, ctx.getLogger("com.gentoro.codex.demo").getLevel());
  }
}

package com.gentoro.meshrender.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingServiceTest {

  @Test
  void appliesConfiguredLevels() {
    BaseConfiguration config = new BaseConfiguration();
    config.addProperty("logging.level.com..gentoro..meshrender..worker", "DEBUG");
    config.addProperty("logging.level.some..noisy..lib", "not-a-level");

    LoggingService.applyConfiguration(config);

    LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    assertEquals(Level.DEBUG, context.getLogger("com.gentoro.meshrender.worker").getLevel());
    assertNull(context.getLogger("some.noisy.lib").getLevel());
    context.getLogger("com.gentoro.meshrender.worker").setLevel(null);
  }

  @Test
  void nullConfigurationIsIgnored() {
    assertDoesNotThrow(() -> LoggingService.applyConfiguration(null));
  }
}

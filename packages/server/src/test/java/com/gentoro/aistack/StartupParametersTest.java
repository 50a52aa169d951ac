package com.gentoro.aistack;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  @DisplayName("Defaults to server mode with the bundled configuration")
  void defaults() {
    StartupParameters params = new StartupParameters(new String[0]);
    assertEquals("server", params.mode());
    assertEquals("classpath:application.yaml", params.configFile());
  }

  @Test
  @DisplayName("Named arguments override defaults, flags without value are present")
  void arguments() {
    StartupParameters params =
        new StartupParameters(
            new String[] {"--mode", "validate", "stray", "--config-file", "/etc/a.yaml", "--dry"});
    assertEquals("validate", params.mode());
    assertEquals("/etc/a.yaml", params.configFile());
    assertTrue(params.isParameterPresent("dry"));
    assertTrue(params.getOptionalParameter("dry", String.class).isEmpty());
    assertFalse(params.isParameterPresent("stray"));
  }

  @Test
  @DisplayName("Unknown modes and blank configuration locations are rejected")
  void invalid() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--mode", "serve"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--config-file"}));
  }
}

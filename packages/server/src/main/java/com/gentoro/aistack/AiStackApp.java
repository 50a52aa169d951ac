package com.gentoro.aistack;

import com.gentoro.aistack.utility.JacksonUtility;
import java.util.Map;

public class AiStackApp {

  private static final org.slf4j.Logger log =
      com.gentoro.aistack.logging.LoggingService.getLogger(AiStackApp.class);

  public static void main(String[] args) {
    StartupParameters parameters;
    try {
      parameters = new StartupParameters(args);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.err.println(StartupParameters.usage());
      System.exit(2);
      return;
    }
    if ("help".equals(parameters.mode())) {
      System.out.println(StartupParameters.usage());
      return;
    }

    AiStack stack = new AiStack(parameters);
    try {
      stack.initialize();
      if ("validate".equals(parameters.mode())) {
        System.out.println(
            JacksonUtility.toYaml(
                Map.of(
                    "image_name", String.valueOf(stack.manifest().imageName()),
                    "providers", stack.describeProviders())));
        stack.shutdown();
        return;
      }
      stack.startServer();
      stack.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      stack.shutdown();
      System.exit(1);
    }
  }
}

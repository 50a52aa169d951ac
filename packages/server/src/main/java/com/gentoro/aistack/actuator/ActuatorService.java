package com.gentoro.aistack.actuator;

import com.gentoro.aistack.AiStack;
import com.gentoro.aistack.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Map;
import java.util.function.Supplier;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Operational endpoints, in the manner of Spring Boot's actuator.
 *
 * <ul>
 *   <li>{@code /actuator/health}: {@code {"status":"UP"}}
 *   <li>{@code /actuator/providers}: the bound providers per capability group
 * </ul>
 */
public class ActuatorService {
  private static final org.slf4j.Logger log =
      com.gentoro.aistack.logging.LoggingService.getLogger(ActuatorService.class);

  private final AiStack aiStack;

  public ActuatorService(AiStack aiStack) {
    this.aiStack = aiStack;
  }

  /** Register the actuator servlets with the shared Jetty context handler. */
  public void register() {
    var handler = aiStack.httpServer().getContextHandler();
    handler.addServlet(
        new ServletHolder(new JsonServlet(() -> JacksonUtility.toJson(Map.of("status", "UP")))),
        "/actuator/health");
    handler.addServlet(
        new ServletHolder(
            new JsonServlet(
                () -> JacksonUtility.toJson(Map.of("providers", aiStack.describeProviders())))),
        "/actuator/providers");
    log.info("Actuator endpoints registered at /actuator/health and /actuator/providers");
  }

  private static class JsonServlet extends HttpServlet {
    private final transient Supplier<String> payload;

    JsonServlet(Supplier<String> payload) {
      this.payload = payload;
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      resp.setStatus(200);
      resp.setContentType("application/json");
      try (PrintWriter out = resp.getWriter()) {
        out.print(payload.get());
      }
    }
  }
}

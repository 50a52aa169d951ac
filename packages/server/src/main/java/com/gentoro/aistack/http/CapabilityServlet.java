package com.gentoro.aistack.http;

import com.gentoro.aistack.apis.Empty;
import com.gentoro.aistack.exception.ErrorDetails;
import com.gentoro.aistack.exception.ExceptionUtil;
import com.gentoro.aistack.exception.RoutingException;
import com.gentoro.aistack.exception.StackErrorCode;
import com.gentoro.aistack.exception.StackException;
import com.gentoro.aistack.router.RequestRouter;
import com.gentoro.aistack.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.stream.Collectors;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Capability endpoint: {@code POST /<api>/<operation>} with a JSON body, answered with the JSON
 * result or an {@link ErrorDetails} document. This is the surface remote stacks talk to, so a
 * provider behaves the same whether it is called in-process or over HTTP.
 */
public class CapabilityServlet extends HttpServlet {
  private static final org.slf4j.Logger log =
      com.gentoro.aistack.logging.LoggingService.getLogger(CapabilityServlet.class);

  private final transient RequestRouter router;

  public CapabilityServlet(RequestRouter router) {
    this.router = router;
  }

  /** Register the endpoint at the root of the context; more specific mappings win. */
  public static void register(ServletContextHandler contextHandler, RequestRouter router) {
    contextHandler.addServlet(new ServletHolder(new CapabilityServlet(router)), "/*");
    log.info("Capability endpoint registered at /<api>/<operation>");
  }

  @Override
  protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    if (!"POST".equalsIgnoreCase(req.getMethod())) {
      resp.setHeader("Allow", "POST");
      writeError(
          resp,
          HttpServletResponse.SC_METHOD_NOT_ALLOWED,
          new RoutingException(
              StackErrorCode.UNKNOWN_OPERATION,
              "Method %s is not allowed, use POST".formatted(req.getMethod())));
      return;
    }

    String path = req.getPathInfo() == null ? "" : req.getPathInfo();
    String[] segments = path.startsWith("/") ? path.substring(1).split("/") : path.split("/");
    if (segments.length != 2 || segments[0].isBlank() || segments[1].isBlank()) {
      StackException e =
          new RoutingException(
              StackErrorCode.UNKNOWN_OPERATION,
              "Expected /<api>/<operation>, got '%s'".formatted(path),
              Map.of("path", path));
      writeError(resp, statusFor(e.getCode()), e);
      return;
    }

    String body;
    try (BufferedReader reader = req.getReader()) {
      body = reader.lines().collect(Collectors.joining("\n"));
    }

    try {
      Object result = router.dispatch(segments[0], segments[1], JacksonUtility.readTree(body));
      String json =
          result == null || result instanceof Empty ? "{}" : JacksonUtility.toJson(result);
      write(resp, HttpServletResponse.SC_OK, json);
    } catch (StackException e) {
      int status = statusFor(e.getCode());
      if (e.getCode().isBackendFailure()) {
        log.warn(
            "{}/{} failed with {}: {} at {}",
            segments[0],
            segments[1],
            e.getCode(),
            e.getMessage(),
            ExceptionUtil.formatCompactStackTrace(e.getCause() == null ? e : e.getCause(), 5));
      } else {
        log.debug(
            "{}/{} rejected with {}: {}", segments[0], segments[1], e.getCode(), e.getMessage());
      }
      writeError(resp, status, e);
    } catch (RuntimeException e) {
      log.error("Unexpected failure serving {}/{}", segments[0], segments[1], e);
      writeError(resp, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, e);
    }
  }

  static int statusFor(StackErrorCode code) {
    return switch (code) {
      case NOT_FOUND, UNKNOWN_OPERATION -> HttpServletResponse.SC_NOT_FOUND;
      case DUPLICATE_BANK, DUPLICATE_DOCUMENT_ID -> HttpServletResponse.SC_CONFLICT;
      case UNSUPPORTED_FEATURE -> HttpServletResponse.SC_NOT_IMPLEMENTED;
      case TIMEOUT -> HttpServletResponse.SC_GATEWAY_TIMEOUT;
      case UPSTREAM_ERROR, TRANSPORT_ERROR, IO_ERROR -> HttpServletResponse.SC_BAD_GATEWAY;
      default -> code.isBackendFailure()
          ? HttpServletResponse.SC_INTERNAL_SERVER_ERROR
          : HttpServletResponse.SC_BAD_REQUEST;
    };
  }

  private static void writeError(HttpServletResponse resp, int status, Throwable t)
      throws IOException {
    ErrorDetails details = ExceptionUtil.toErrorDetails(t);
    write(resp, status, JacksonUtility.toJson(details));
  }

  private static void write(HttpServletResponse resp, int status, String json) throws IOException {
    resp.setStatus(status);
    resp.setContentType("application/json");
    resp.setCharacterEncoding(StandardCharsets.UTF_8.name());
    try (PrintWriter out = resp.getWriter()) {
      out.print(json);
    }
  }
}

package com.gentoro.aistack.providers.telemetry;

import com.gentoro.aistack.apis.telemetry.LogEventRequest;
import com.gentoro.aistack.apis.telemetry.Span;
import com.gentoro.aistack.apis.telemetry.Telemetry;
import com.gentoro.aistack.apis.telemetry.TelemetryEvent;
import com.gentoro.aistack.apis.telemetry.Trace;
import com.gentoro.aistack.apis.telemetry.TraceRef;
import com.gentoro.aistack.exception.ConfigException;
import com.gentoro.aistack.exception.NotFoundException;
import com.gentoro.aistack.exception.ValidationException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;

/**
 * Inline telemetry provider. Events are written to the application log through SLF4J; span
 * events are also folded into a bounded in-memory trace store, least recently touched trace
 * evicted first.
 */
public class TelemetryService implements Telemetry {
  private static final Logger log =
      com.gentoro.aistack.logging.LoggingService.getLogger(TelemetryService.class);

  public static final int DEFAULT_MAX_TRACES = 1000;

  private final Map<String, Map<String, Span>> traces;

  public TelemetryService(int maxTraces) {
    if (maxTraces <= 0) {
      throw new ConfigException("maxTraces must be positive: " + maxTraces);
    }
    this.traces =
        new LinkedHashMap<>(16, 0.75f, true) {
          @Override
          protected boolean removeEldestEntry(Map.Entry<String, Map<String, Span>> eldest) {
            return size() > maxTraces;
          }
        };
  }

  @Override
  public void logEvent(LogEventRequest request) {
    TelemetryEvent event = request == null ? null : request.event();
    if (event == null || event.type() == null) {
      throw new ValidationException("log_event requires an event with a type");
    }
    switch (event.type()) {
      case UNSTRUCTURED_LOG -> logMessage(event);
      case METRIC -> logMetric(event);
      case SPAN_START -> startSpan(event);
      case SPAN_END -> endSpan(event);
    }
  }

  private void logMessage(TelemetryEvent event) {
    if (event.message() == null) {
      throw new ValidationException("unstructured_log events require a message");
    }
    TelemetryEvent.Severity severity =
        event.severity() == null ? TelemetryEvent.Severity.INFO : event.severity();
    String trace = event.traceId() == null ? "-" : event.traceId();
    switch (severity) {
      case VERBOSE -> log.trace("[trace={}] {}", trace, event.message());
      case DEBUG -> log.debug("[trace={}] {}", trace, event.message());
      case INFO -> log.info("[trace={}] {}", trace, event.message());
      case WARN -> log.warn("[trace={}] {}", trace, event.message());
      case ERROR, CRITICAL -> log.error("[trace={}] {} {}", trace, severity, event.message());
    }
  }

  private void logMetric(TelemetryEvent event) {
    if (event.name() == null || event.value() == null) {
      throw new ValidationException("metric events require a name and a value");
    }
    log.info(
        "[trace={}] metric {}={}{} {}",
        event.traceId() == null ? "-" : event.traceId(),
        event.name(),
        event.value(),
        event.unit() == null ? "" : " " + event.unit(),
        event.attributes() == null ? Map.of() : event.attributes());
  }

  private void startSpan(TelemetryEvent event) {
    requireSpanIds(event);
    Span span =
        new Span(
            event.spanId(),
            event.parentSpanId(),
            event.name(),
            event.timestamp(),
            0L,
            null,
            event.attributes() == null ? Map.of() : Map.copyOf(event.attributes()));
    synchronized (traces) {
      traces.computeIfAbsent(event.traceId(), k -> new LinkedHashMap<>()).put(span.spanId(), span);
    }
    log.debug("Span {} '{}' started in trace {}", event.spanId(), event.name(), event.traceId());
  }

  private void endSpan(TelemetryEvent event) {
    requireSpanIds(event);
    synchronized (traces) {
      Map<String, Span> spans = traces.get(event.traceId());
      Span open = spans == null ? null : spans.get(event.spanId());
      if (open == null) {
        throw new NotFoundException(
            "Span not started: " + event.spanId(),
            Map.of("trace_id", event.traceId(), "span_id", event.spanId()));
      }
      spans.put(
          open.spanId(),
          new Span(
              open.spanId(),
              open.parentSpanId(),
              open.name(),
              open.startTime(),
              event.timestamp(),
              event.status() == null ? TelemetryEvent.SpanStatus.OK : event.status(),
              open.attributes()));
    }
    log.debug("Span {} ended in trace {}", event.spanId(), event.traceId());
  }

  private static void requireSpanIds(TelemetryEvent event) {
    if (event.traceId() == null || event.spanId() == null) {
      throw new ValidationException("span events require trace_id and span_id");
    }
  }

  @Override
  public Trace getTrace(TraceRef ref) {
    if (ref == null || ref.traceId() == null) {
      throw new ValidationException("trace_id is required");
    }
    List<Span> spans;
    synchronized (traces) {
      Map<String, Span> stored = traces.get(ref.traceId());
      if (stored == null) {
        throw new NotFoundException(
            "Trace not found: " + ref.traceId(), Map.of("trace_id", ref.traceId()));
      }
      spans = new ArrayList<>(stored.values());
    }
    spans.sort(Comparator.comparingLong(Span::startTime));
    String root =
        spans.stream()
            .filter(s -> s.parentSpanId() == null)
            .map(Span::spanId)
            .findFirst()
            .orElse(spans.get(0).spanId());
    long start = spans.stream().mapToLong(Span::startTime).min().orElse(0L);
    long end = spans.stream().mapToLong(Span::endTime).max().orElse(0L);
    return new Trace(ref.traceId(), root, start, end, spans);
  }
}

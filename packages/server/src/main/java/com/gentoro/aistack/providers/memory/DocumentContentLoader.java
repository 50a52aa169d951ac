package com.gentoro.aistack.providers.memory;

import com.gentoro.aistack.apis.memory.MemoryBankDocument;
import com.gentoro.aistack.exception.AdapterException;
import com.gentoro.aistack.exception.ChunkingException;
import com.gentoro.aistack.exception.IoException;
import com.gentoro.aistack.exception.StackErrorCode;
import com.gentoro.aistack.exception.ValidationException;
import com.gentoro.aistack.http.OkHttpFactory;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Resolves the text of a document: inline {@code content}, or the body behind a {@code uri}
 * ({@code http(s)}, {@code data:} and {@code file:}). Only textual mime types are indexed.
 *
 * <p>{@code file:} uris are refused unless the file lies under one of the allowed roots (none by
 * default); symbolic links are resolved before the check. {@code http(s)} uris may be limited to a
 * set of hosts; redirects are not followed.
 */
public class DocumentContentLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.aistack.logging.LoggingService.getLogger(DocumentContentLoader.class);

  static final String DEFAULT_MIME_TYPE = "text/plain";

  private static final Set<String> TEXTUAL_APPLICATION_TYPES =
      Set.of(
          "application/json",
          "application/xml",
          "application/yaml",
          "application/x-yaml",
          "application/javascript",
          "application/x-ndjson",
          "application/csv",
          "application/markdown");

  private static final Map<String, String> EXTENSION_TYPES =
      Map.of(
          "txt", "text/plain",
          "md", "text/markdown",
          "json", "application/json",
          "csv", "text/csv",
          "html", "text/html",
          "htm", "text/html",
          "xml", "application/xml",
          "yaml", "application/yaml",
          "yml", "application/yaml",
          "pdf", "application/pdf");

  private final Duration fetchTimeout;
  private final List<Path> allowedFileRoots;
  private final Set<String> allowedUrlHosts;
  private volatile OkHttpClient http;

  /** Loader without file access and without host restrictions. */
  public DocumentContentLoader(Duration fetchTimeout) {
    this(fetchTimeout, List.of(), Set.of());
  }

  /**
   * @param allowedFileRoots directories {@code file:} uris may read from; empty disables them
   * @param allowedUrlHosts hosts {@code http(s)} uris may reach; empty allows any host
   */
  public DocumentContentLoader(
      Duration fetchTimeout, List<Path> allowedFileRoots, Set<String> allowedUrlHosts) {
    this.fetchTimeout = fetchTimeout;
    this.allowedFileRoots =
        allowedFileRoots.stream().map(p -> p.toAbsolutePath().normalize()).toList();
    this.allowedUrlHosts =
        allowedUrlHosts.stream().map(h -> h.toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
  }

  /** Text of a document and the mime type it was accepted under. */
  public record LoadedContent(String text, String mimeType) {}

  public LoadedContent load(MemoryBankDocument document) {
    boolean hasContent = document.content() != null;
    boolean hasUri = document.uri() != null && !document.uri().isBlank();
    if (hasContent == hasUri) {
      throw new ValidationException(
          "Document '%s' must set exactly one of content or uri".formatted(document.documentId()));
    }
    if (hasContent) {
      String mime = mimeOrDefault(document.mimeType(), DEFAULT_MIME_TYPE);
      requireTextual(document, mime);
      return new LoadedContent(document.content(), mime);
    }

    String uri = document.uri().trim();
    int colon = uri.indexOf(':');
    String scheme = colon < 0 ? "" : uri.substring(0, colon).toLowerCase(Locale.ROOT);
    return switch (scheme) {
      case "data" -> fromDataUri(document, uri);
      case "http", "https" -> fromHttp(document, uri);
      case "file" -> fromFile(document, uri);
      default -> throw new ValidationException(
          "Unsupported uri scheme '%s' for document '%s'".formatted(scheme, document.documentId()));
    };
  }

  private LoadedContent fromDataUri(MemoryBankDocument document, String uri) {
    int comma = uri.indexOf(',');
    if (comma < 0) {
      throw new ValidationException("Malformed data uri for document " + document.documentId());
    }
    String header = uri.substring("data:".length(), comma);
    String payload = uri.substring(comma + 1);
    boolean base64 = header.endsWith(";base64");
    String mediaType = base64 ? header.substring(0, header.length() - ";base64".length()) : header;
    String mime = mimeOrDefault(document.mimeType(), mediaType.isBlank() ? null : mediaType);
    mime = mimeOrDefault(mime, DEFAULT_MIME_TYPE);
    requireTextual(document, mime);
    Charset charset = charsetOf(mediaType);
    try {
      byte[] bytes =
          base64
              ? Base64.getDecoder().decode(payload)
              : URLDecoder.decode(payload, StandardCharsets.UTF_8).getBytes(StandardCharsets.UTF_8);
      return new LoadedContent(decodeText(document, bytes, charset), mime);
    } catch (IllegalArgumentException e) {
      throw new ValidationException(
          "Malformed data uri payload for document " + document.documentId(), e);
    }
  }

  private LoadedContent fromFile(MemoryBankDocument document, String uri) {
    if (allowedFileRoots.isEmpty()) {
      throw new ValidationException(
          "file: uris are not enabled; refusing document " + document.documentId());
    }
    Path path;
    try {
      path = Path.of(URI.create(uri)).toAbsolutePath().normalize();
    } catch (IllegalArgumentException | FileSystemNotFoundException e) {
      throw new ValidationException("Malformed file uri: " + uri, e);
    }
    requireUnderAllowedRoot(document, path);
    Path real;
    try {
      real = path.toRealPath();
    } catch (IOException e) {
      throw new IoException("Failed to read document " + document.documentId() + " from " + uri, e);
    }
    requireUnderAllowedRoot(document, real);
    if (!Files.isRegularFile(real)) {
      throw new ValidationException(
          "Document " + document.documentId() + " does not point at a regular file");
    }
    Path name = real.getFileName();
    String mime =
        mimeOrDefault(document.mimeType(), name == null ? null : guessMime(name.toString()));
    mime = mimeOrDefault(mime, DEFAULT_MIME_TYPE);
    requireTextual(document, mime);
    try {
      byte[] bytes = Files.readAllBytes(real);
      return new LoadedContent(decodeText(document, bytes, StandardCharsets.UTF_8), mime);
    } catch (IOException e) {
      throw new IoException("Failed to read document " + document.documentId() + " from " + uri, e);
    }
  }

  private void requireUnderAllowedRoot(MemoryBankDocument document, Path path) {
    for (Path root : allowedFileRoots) {
      if (path.startsWith(root) || path.startsWith(realOrSelf(root))) {
        return;
      }
    }
    log.warn("Refusing document {} outside the allowed file roots", document.documentId());
    throw new ValidationException(
        "Document " + document.documentId() + " is outside the allowed file roots");
  }

  private static Path realOrSelf(Path root) {
    try {
      return root.toRealPath();
    } catch (IOException e) {
      return root;
    }
  }

  private LoadedContent fromHttp(MemoryBankDocument document, String uri) {
    HttpUrl url = HttpUrl.parse(uri);
    if (url == null) {
      throw new ValidationException("Malformed http uri: " + uri);
    }
    if (!allowedUrlHosts.isEmpty() && !allowedUrlHosts.contains(url.host())) {
      throw new ValidationException(
          "Host " + url.host() + " is not allowed for document " + document.documentId());
    }
    Request request = new Request.Builder().url(url).get().build();
    try (Response response = client().newCall(request).execute()) {
      ResponseBody body = response.body();
      String text = body == null ? "" : body.string();
      if (!response.isSuccessful()) {
        throw AdapterException.upstream(response.code(), text)
            .annotate("document_id", document.documentId())
            .annotate("uri", uri);
      }
      String contentType = response.header("Content-Type");
      String mime = mimeOrDefault(document.mimeType(), contentType);
      mime = mimeOrDefault(mime, guessMime(uri));
      mime = mimeOrDefault(mime, DEFAULT_MIME_TYPE);
      requireTextual(document, mime);
      return new LoadedContent(text, mime);
    } catch (InterruptedIOException e) {
      throw new AdapterException(
          StackErrorCode.TIMEOUT,
          "Timed out fetching document " + document.documentId(),
          Map.of("uri", uri),
          e);
    } catch (IOException e) {
      throw new AdapterException(
          StackErrorCode.TRANSPORT_ERROR,
          "Failed to fetch document " + document.documentId(),
          Map.of("uri", uri),
          e);
    }
  }

  private OkHttpClient client() {
    if (http == null) {
      synchronized (this) {
        if (http == null) {
          http = OkHttpFactory.create(fetchTimeout);
        }
      }
    }
    return http;
  }

  private static String decodeText(MemoryBankDocument document, byte[] bytes, Charset charset) {
    for (byte b : bytes) {
      if (b == 0) {
        throw new ChunkingException(
            StackErrorCode.CHUNKING_ERROR,
            "Document '%s' is binary content".formatted(document.documentId()),
            Map.of("document_id", String.valueOf(document.documentId())));
      }
    }
    return new String(bytes, charset);
  }

  static boolean isTextual(String mimeType) {
    String base = baseType(mimeType);
    return base.startsWith("text/")
        || TEXTUAL_APPLICATION_TYPES.contains(base)
        || base.endsWith("+json")
        || base.endsWith("+xml");
  }

  private static void requireTextual(MemoryBankDocument document, String mime) {
    if (!isTextual(mime)) {
      log.debug("Rejecting document {} with mime type {}", document.documentId(), mime);
      throw new ChunkingException(
          StackErrorCode.CHUNKING_ERROR,
          "Document '%s' has non-textual mime type %s".formatted(document.documentId(), mime),
          Map.of("document_id", String.valueOf(document.documentId()), "mime_type", mime));
    }
  }

  private static String guessMime(String name) {
    if (name == null) return null;
    String path = name;
    int query = path.indexOf('?');
    if (query >= 0) path = path.substring(0, query);
    int dot = path.lastIndexOf('.');
    int slash = path.lastIndexOf('/');
    if (dot < 0 || dot < slash) return null;
    return EXTENSION_TYPES.get(path.substring(dot + 1).toLowerCase(Locale.ROOT));
  }

  private static String mimeOrDefault(String mime, String fallback) {
    return mime == null || mime.isBlank() ? fallback : mime.trim();
  }

  private static String baseType(String mimeType) {
    String base = mimeType;
    int semi = base.indexOf(';');
    if (semi >= 0) base = base.substring(0, semi);
    return base.trim().toLowerCase(Locale.ROOT);
  }

  private static Charset charsetOf(String mediaType) {
    for (String part : mediaType.split(";")) {
      String p = part.trim();
      if (p.toLowerCase(Locale.ROOT).startsWith("charset=")) {
        try {
          return Charset.forName(p.substring("charset=".length()));
        } catch (IllegalArgumentException e) {
          throw new ValidationException("Unsupported charset in data uri: " + p, e);
        }
      }
    }
    return StandardCharsets.UTF_8;
  }
}

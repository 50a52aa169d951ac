package com.gentoro.aistack.testing;

import com.gentoro.aistack.http.EmbeddedJettyServer;
import java.util.function.Consumer;
import okhttp3.HttpUrl;
import org.apache.commons.configuration2.BaseConfiguration;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;

/** Starts an embedded server on a free loopback port. */
public final class TestHttp {
  private TestHttp() {}

  public static EmbeddedJettyServer start(Consumer<ServletContextHandler> setup) throws Exception {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("http.hostname", "127.0.0.1");
    config.setProperty("http.port", 0);
    EmbeddedJettyServer server = new EmbeddedJettyServer(config);
    server.prepare();
    setup.accept(server.getContextHandler());
    server.start();
    return server;
  }

  public static HttpUrl baseUrl(EmbeddedJettyServer server) {
    return HttpUrl.get("http://127.0.0.1:" + server.getPort() + "/");
  }
}

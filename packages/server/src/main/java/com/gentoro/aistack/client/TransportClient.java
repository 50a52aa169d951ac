package com.gentoro.aistack.client;

/**
 * Base of the typed capability clients. Closing a client closes its transport when the transport
 * owns resources, such as the HTTP connection pool of a remote stack.
 */
public abstract class TransportClient implements AutoCloseable {
  protected final CapabilityTransport transport;

  protected TransportClient(CapabilityTransport transport) {
    this.transport = transport;
  }

  public CapabilityTransport transport() {
    return transport;
  }

  @Override
  public void close() throws Exception {
    if (transport instanceof AutoCloseable closeable) {
      closeable.close();
    }
  }
}

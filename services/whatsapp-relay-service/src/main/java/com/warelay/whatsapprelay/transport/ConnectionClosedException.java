package com.warelay.whatsapprelay.transport;

/** The handle's socket is closed or was never opened; the request may succeed after a restart. */
public class ConnectionClosedException extends TransportException {
  public ConnectionClosedException(String message) {
    super(message);
  }
}

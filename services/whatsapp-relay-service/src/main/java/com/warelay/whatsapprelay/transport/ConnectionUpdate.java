package com.warelay.whatsapprelay.transport;

/**
 * Connection-state change. Any field may be null: a QR challenge usually arrives without a
 * connection status, and {@code lastDisconnect} is only set together with {@link
 * ConnectionStatus#CLOSE}.
 */
public record ConnectionUpdate(
    ConnectionStatus connection, String qr, DisconnectInfo lastDisconnect) {

  public static ConnectionUpdate qr(String qr) {
    return new ConnectionUpdate(null, qr, null);
  }

  public static ConnectionUpdate open() {
    return new ConnectionUpdate(ConnectionStatus.OPEN, null, null);
  }

  public static ConnectionUpdate closed(Integer statusCode, String message) {
    return new ConnectionUpdate(
        ConnectionStatus.CLOSE, null, new DisconnectInfo(statusCode, message));
  }

  public boolean hasQr() {
    return qr != null && !qr.isEmpty();
  }
}

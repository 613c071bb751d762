package com.warelay.whatsapprelay.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.warelay.whatsapprelay.transport.content.MessageContent;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Fallback used when no transport implementation is on the classpath. Every connection attempt is
 * reported as closed with a permanent reason, so the session gives up instead of retrying.
 */
@Slf4j
public class UnavailableTransportConnector implements TransportConnector {

  /** Reported like a removed device so the session does not schedule reconnects. */
  static final int STATUS = 401;

  static final String REASON = "No WhatsApp transport is configured";

  @Override
  public TransportSession connect(JsonNode credentials, TransportEventListener listener) {
    log.warn("No WhatsApp transport is configured; session cannot connect");
    listener.connectionUpdated(ConnectionUpdate.closed(STATUS, REASON));
    return new ClosedSession();
  }

  private static final class ClosedSession implements TransportSession {

    private static ConnectionClosedException closed() {
      return new ConnectionClosedException(REASON);
    }

    @Override
    public JsonNode send(String chatId, MessageContent content, Map<String, Object> options) {
      throw closed();
    }

    @Override
    public void sendPresenceUpdate(Presence presence, String chatId) {
      throw closed();
    }

    @Override
    public void presenceSubscribe(String chatId) {
      throw closed();
    }

    @Override
    public void readMessages(List<MessageKey> keys) {
      throw closed();
    }

    @Override
    public JsonNode fetchStatus(String chatId) {
      throw closed();
    }

    @Override
    public String profilePictureUrl(String chatId) {
      throw closed();
    }

    @Override
    public JsonNode resolveId(String number) {
      throw closed();
    }

    @Override
    public void rejectCall(String callId, String from) {
      throw closed();
    }

    @Override
    public byte[] downloadMedia(JsonNode message) {
      throw closed();
    }

    @Override
    public void logout() {
      throw closed();
    }

    @Override
    public void close() {}

    @Override
    public SocketState socketState() {
      return SocketState.CLOSED;
    }
  }
}

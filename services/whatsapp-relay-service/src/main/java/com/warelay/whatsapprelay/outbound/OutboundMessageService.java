package com.warelay.whatsapprelay.outbound;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.warelay.whatsapprelay.model.MessageRequest;
import com.warelay.whatsapprelay.session.SessionConnectionManager;
import com.warelay.whatsapprelay.transport.ConnectionClosedException;
import com.warelay.whatsapprelay.transport.content.MessageContent;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Sends outbound messages through the active session.
 *
 * <p>Never throws: an invalid request or a failed send yields an empty JSON object. A send that
 * fails because the connection is closed is retried once after asking the session manager to
 * reconnect.
 */
@Service
@Slf4j
public class OutboundMessageService {

  private final SessionConnectionManager session;
  private final OutboundContentFactory contentFactory;

  public OutboundMessageService(
      SessionConnectionManager session, OutboundContentFactory contentFactory) {
    this.session = session;
    this.contentFactory = contentFactory;
  }

  public JsonNode sendText(String chatId, String text) {
    return send(MessageRequest.text(chatId, text));
  }

  public JsonNode send(MessageRequest request) {
    String chatId = request == null || request.chatId() == null ? "" : request.chatId().trim();
    if (chatId.isEmpty()) {
      log.warn("Outbound message without chatId ignored");
      return empty();
    }

    Optional<MessageContent> content;
    try {
      content = contentFactory.build(request);
    } catch (IllegalArgumentException e) {
      log.warn("Outbound message to {} has invalid content: {}", chatId, e.getMessage());
      return empty();
    }
    if (content.isEmpty()) {
      log.warn("Outbound message to {} has no content", chatId);
      return empty();
    }

    Map<String, Object> options = request.options() == null ? Map.of() : request.options();
    try {
      return orEmpty(session.requireSession().send(chatId, content.get(), options));
    } catch (RuntimeException e) {
      if (!isConnectionClosed(e)) {
        log.warn("Send to {} failed: {}", chatId, e.getMessage());
        return empty();
      }
      log.warn("Send to {} hit a closed connection, reconnecting: {}", chatId, e.getMessage());
    }

    session.ensureConnected();
    try {
      return orEmpty(session.requireSession().send(chatId, content.get(), options));
    } catch (RuntimeException e) {
      log.warn("Retry of send to {} failed: {}", chatId, e.getMessage());
      return empty();
    }
  }

  static boolean isConnectionClosed(Throwable e) {
    if (e instanceof ConnectionClosedException) {
      return true;
    }
    String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
    return message.contains("connection closed") || message.contains("not connected");
  }

  private static JsonNode orEmpty(JsonNode result) {
    return result == null ? empty() : result;
  }

  private static JsonNode empty() {
    return JsonNodeFactory.instance.objectNode();
  }
}

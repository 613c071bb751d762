package com.warelay.whatsapprelay.transport;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/** Events emitted by one transport handle. */
public interface TransportEventListener {

  void credentialsUpdated(JsonNode credentials);

  void connectionUpdated(ConnectionUpdate update);

  /** One upsert batch; each element carries {@code key}, {@code message}, timestamps etc. */
  void messagesReceived(List<JsonNode> messages);

  void callReceived(JsonNode call);

  /** Payload with optional {@code chats} and {@code contacts} arrays. */
  void historySynced(JsonNode history);
}

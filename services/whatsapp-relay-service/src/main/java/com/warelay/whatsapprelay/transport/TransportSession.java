package com.warelay.whatsapprelay.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.warelay.whatsapprelay.transport.content.MessageContent;
import java.util.List;
import java.util.Map;

/**
 * A live handle to the chat network.
 *
 * <p>Methods throw {@link TransportException} (or its subclass {@link ConnectionClosedException})
 * when the underlying socket cannot serve the request.
 */
public interface TransportSession {

  JsonNode send(String chatId, MessageContent content, Map<String, Object> options);

  void sendPresenceUpdate(Presence presence, String chatId);

  void presenceSubscribe(String chatId);

  void readMessages(List<MessageKey> keys);

  JsonNode fetchStatus(String chatId);

  String profilePictureUrl(String chatId);

  /** Returns the network id registered for a phone number, or {@code null} if unknown. */
  JsonNode resolveId(String number);

  void rejectCall(String callId, String from);

  /** Downloads and decrypts the media attached to a raw inbound message. */
  byte[] downloadMedia(JsonNode message);

  void logout();

  void close();

  /** Socket state if the transport exposes one, otherwise {@code null}. */
  SocketState socketState();
}

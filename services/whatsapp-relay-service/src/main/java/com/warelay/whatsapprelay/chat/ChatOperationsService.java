package com.warelay.whatsapprelay.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.warelay.whatsapprelay.inbound.Jids;
import com.warelay.whatsapprelay.model.ReadMessagesRequest;
import com.warelay.whatsapprelay.model.ReadMessagesResponse;
import com.warelay.whatsapprelay.session.SessionConnectionManager;
import com.warelay.whatsapprelay.store.ChatSnapshotStore;
import com.warelay.whatsapprelay.transport.MessageKey;
import com.warelay.whatsapprelay.transport.Presence;
import com.warelay.whatsapprelay.transport.TransportSession;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Session operations behind the REST API. Every call is best-effort: transport failures are
 * logged and turned into an empty result.
 */
@Service
@Slf4j
public class ChatOperationsService {

  private final SessionConnectionManager session;
  private final ChatSnapshotStore snapshots;

  public ChatOperationsService(SessionConnectionManager session, ChatSnapshotStore snapshots) {
    this.session = session;
    this.snapshots = snapshots;
  }

  /**
   * Announces the account as available, subscribes to the chat's presence and then sends the
   * requested presence.
   *
   * @return false if the action is unknown or the transport failed
   */
  public boolean simulatePresence(String chatId, String action) {
    Presence presence = Presence.fromCode(action);
    if (presence == null) {
      log.warn("Ignoring unknown presence action '{}'", action);
      return false;
    }
    if (chatId == null || chatId.isBlank()) {
      log.warn("Ignoring presence action without chatId");
      return false;
    }
    String jid = Jids.normalize(chatId.trim());
    try {
      announce(session.requireSession(), presence, jid);
      return true;
    } catch (RuntimeException e) {
      log.warn("Presence {} for {} failed: {}", presence.code(), jid, e.getMessage());
      return false;
    }
  }

  /** Marks the given messages read; keys missing the chat or message id are dropped first. */
  public ReadMessagesResponse readMessages(ReadMessagesRequest request) {
    if (request == null || request.keys() == null) {
      return ReadMessagesResponse.none();
    }
    List<MessageKey> keys =
        request.keys().stream()
            .filter(k -> k != null && notBlank(k.remoteJid()) && notBlank(k.id()))
            .toList();
    if (keys.isEmpty()) {
      return ReadMessagesResponse.none();
    }

    TransportSession client;
    try {
      client = session.requireSession();
      client.readMessages(keys);
    } catch (RuntimeException e) {
      log.warn("Marking {} messages read failed: {}", keys.size(), e.getMessage());
      return ReadMessagesResponse.none();
    }

    if (notBlank(request.presence())) {
      Presence presence = Presence.fromCode(request.presence());
      String jid = notBlank(request.jid()) ? request.jid().trim() : keys.get(0).remoteJid();
      if (presence == null) {
        log.warn("Ignoring unknown presence '{}' after read", request.presence());
      } else {
        try {
          announce(client, presence, Jids.normalize(jid));
        } catch (RuntimeException e) {
          log.warn("Presence after read for {} failed: {}", jid, e.getMessage());
        }
      }
    }
    return new ReadMessagesResponse(keys.size(), keys);
  }

  public Map<String, Object> profileStatus(String chatId) {
    try {
      JsonNode status = session.requireSession().fetchStatus(Jids.normalize(chatId));
      return Map.of("status", status == null ? JsonNodeFactory.instance.nullNode() : status);
    } catch (RuntimeException e) {
      log.warn("Fetching status of {} failed: {}", chatId, e.getMessage());
      return Map.of();
    }
  }

  public Map<String, Object> profilePicture(String chatId) {
    try {
      String url = session.requireSession().profilePictureUrl(Jids.normalize(chatId));
      return url == null ? Map.of() : Map.of("url", url);
    } catch (RuntimeException e) {
      log.warn("Fetching profile picture of {} failed: {}", chatId, e.getMessage());
      return Map.of();
    }
  }

  public List<JsonNode> listChats() {
    return snapshots.chats();
  }

  public List<JsonNode> listContacts() {
    return snapshots.contacts();
  }

  /** Looks up the network id of a phone number; empty object when unknown or on failure. */
  public JsonNode resolveNumber(String number) {
    String digits = number == null ? "" : number.replaceAll("[^0-9]", "");
    if (digits.isEmpty()) {
      return JsonNodeFactory.instance.objectNode();
    }
    try {
      JsonNode result = session.requireSession().resolveId(digits);
      return result == null ? JsonNodeFactory.instance.objectNode() : result;
    } catch (RuntimeException e) {
      log.warn("Resolving number {} failed: {}", digits, e.getMessage());
      return JsonNodeFactory.instance.objectNode();
    }
  }

  /** Goes online, subscribes to the chat's presence, then shows {@code presence} there. */
  private static void announce(TransportSession client, Presence presence, String jid) {
    client.sendPresenceUpdate(Presence.AVAILABLE, jid);
    client.presenceSubscribe(jid);
    client.sendPresenceUpdate(presence, jid);
  }

  private static boolean notBlank(String s) {
    return s != null && !s.isBlank();
  }
}

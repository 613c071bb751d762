package com.warelay.whatsapprelay.store;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/** Flat cache of chats and contacts received through history sync. */
public record ChatSnapshot(List<JsonNode> chats, List<JsonNode> contacts) {

  public ChatSnapshot {
    chats = chats == null ? List.of() : List.copyOf(chats);
    contacts = contacts == null ? List.of() : List.copyOf(contacts);
  }

  public static ChatSnapshot empty() {
    return new ChatSnapshot(List.of(), List.of());
  }
}

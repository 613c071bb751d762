package com.warelay.whatsapprelay.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warelay.whatsapprelay.config.RelayProperties;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * JSON document {@code {chats: [], contacts: []}} on disk.
 *
 * <p>History batches are appended without de-duplication; the file is a best-effort cache for the
 * chat/contact listing, not a source of truth.
 */
@Service
@Slf4j
public class ChatSnapshotStore {

  private final ObjectMapper mapper;
  private final Path file;

  @Autowired
  public ChatSnapshotStore(ObjectMapper mapper, RelayProperties properties) {
    this(mapper, Path.of(properties.storage().snapshotFile()));
  }

  ChatSnapshotStore(ObjectMapper mapper, Path file) {
    this.mapper = mapper;
    this.file = file.toAbsolutePath();
  }

  public synchronized ChatSnapshot read() {
    if (!Files.isRegularFile(file)) {
      return ChatSnapshot.empty();
    }
    try {
      return mapper.readValue(file.toFile(), ChatSnapshot.class);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read chat snapshot " + file, e);
    }
  }

  /** Appends the {@code chats} and {@code contacts} arrays of a history-sync payload. */
  public synchronized ChatSnapshot append(JsonNode history) {
    ChatSnapshot current = read();
    List<JsonNode> chats = new ArrayList<>(current.chats());
    List<JsonNode> contacts = new ArrayList<>(current.contacts());
    addAll(chats, history.path("chats"));
    addAll(contacts, history.path("contacts"));

    ChatSnapshot next = new ChatSnapshot(chats, contacts);
    write(next);
    log.debug(
        "History sync stored chats={} contacts={}", next.chats().size(), next.contacts().size());
    return next;
  }

  public List<JsonNode> chats() {
    try {
      return read().chats();
    } catch (RuntimeException e) {
      log.warn("Failed to list chats: {}", e.getMessage());
      return List.of();
    }
  }

  public List<JsonNode> contacts() {
    try {
      return read().contacts();
    } catch (RuntimeException e) {
      log.warn("Failed to list contacts: {}", e.getMessage());
      return List.of();
    }
  }

  private void write(ChatSnapshot snapshot) {
    try {
      Path parent = file.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), snapshot);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write chat snapshot " + file, e);
    }
  }

  private static void addAll(List<JsonNode> target, JsonNode array) {
    if (!array.isArray()) {
      return;
    }
    for (JsonNode item : array) {
      target.add(item);
    }
  }
}

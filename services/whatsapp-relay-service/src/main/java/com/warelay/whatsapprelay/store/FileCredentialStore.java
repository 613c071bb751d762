package com.warelay.whatsapprelay.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warelay.whatsapprelay.config.RelayProperties;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Stores credentials as {@code creds.json} inside the configured credentials folder. */
@Component
@Slf4j
public class FileCredentialStore implements CredentialStore {

  static final String CREDS_FILE = "creds.json";

  private final ObjectMapper mapper;
  private final Path folder;

  @Autowired
  public FileCredentialStore(ObjectMapper mapper, RelayProperties properties) {
    this(mapper, Path.of(properties.session().credentialsFolder()));
  }

  FileCredentialStore(ObjectMapper mapper, Path folder) {
    this.mapper = mapper;
    this.folder = folder.toAbsolutePath();
  }

  @Override
  public boolean hasSavedSession() {
    return Files.isDirectory(folder) && Files.isRegularFile(folder.resolve(CREDS_FILE));
  }

  @Override
  public synchronized JsonNode load() {
    Path file = folder.resolve(CREDS_FILE);
    if (!Files.isRegularFile(file)) {
      return mapper.createObjectNode();
    }
    try {
      return mapper.readTree(file.toFile());
    } catch (IOException e) {
      log.warn("Failed to read credentials from {}: {}", file, e.getMessage());
      return mapper.createObjectNode();
    }
  }

  @Override
  public synchronized void save(JsonNode credentials) {
    if (credentials == null) {
      return;
    }
    try {
      Files.createDirectories(folder);
      mapper.writeValue(folder.resolve(CREDS_FILE).toFile(), credentials);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to persist credentials to " + folder, e);
    }
  }
}

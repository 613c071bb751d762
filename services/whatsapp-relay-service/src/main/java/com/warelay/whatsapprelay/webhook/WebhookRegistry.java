package com.warelay.whatsapprelay.webhook;

import com.warelay.whatsapprelay.common.web.NotFoundException;
import com.warelay.whatsapprelay.config.RelayProperties;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Ordered, de-duplicated list of subscriber URLs kept in a newline-delimited file.
 *
 * <p>Every operation reads and rewrites the whole file, which keeps the on-disk copy the single
 * source of truth and allows the file to be edited by hand between restarts.
 */
@Service
@Slf4j
public class WebhookRegistry {

  private final Path file;

  @Autowired
  public WebhookRegistry(RelayProperties properties) {
    this(Path.of(properties.webhook().storageFile()));
  }

  public WebhookRegistry(Path file) {
    this.file = file.toAbsolutePath();
    ensureFileExists();
  }

  public synchronized List<String> list() {
    return List.copyOf(read());
  }

  /**
   * Adds a URL after trimming it.
   *
   * @return false when the URL is empty or already registered
   */
  public synchronized boolean insert(String url) {
    String normalized = url == null ? "" : url.trim();
    if (normalized.isEmpty()) {
      return false;
    }
    List<String> urls = read();
    if (urls.contains(normalized)) {
      return false;
    }
    urls.add(normalized);
    write(urls);
    log.info("Webhook registered url={}", normalized);
    return true;
  }

  /** Inserts every URL in order; returns how many were new. */
  public synchronized int insertAll(Collection<String> candidates) {
    int added = 0;
    for (String url : candidates) {
      if (insert(url)) {
        added++;
      }
    }
    return added;
  }

  /**
   * Removes the entry at a 0-based position.
   *
   * @throws NotFoundException if the index is out of range
   */
  public synchronized String delete(int index) {
    List<String> urls = read();
    if (index < 0 || index >= urls.size()) {
      throw NotFoundException.webhookIndex(index);
    }
    String removed = urls.remove(index);
    write(urls);
    log.info("Webhook removed url={}", removed);
    return removed;
  }

  private List<String> read() {
    try {
      List<String> urls = new ArrayList<>();
      for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
        String url = line.trim();
        if (!url.isEmpty() && !urls.contains(url)) {
          urls.add(url);
        }
      }
      return urls;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read webhooks from " + file, e);
    }
  }

  private void write(List<String> urls) {
    try {
      Files.writeString(file, String.join("\n", urls), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write webhooks to " + file, e);
    }
  }

  private void ensureFileExists() {
    try {
      if (!Files.exists(file)) {
        Path parent = file.getParent();
        if (parent != null) {
          Files.createDirectories(parent);
        }
        Files.writeString(file, "", StandardCharsets.UTF_8);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create webhook file " + file, e);
    }
  }
}

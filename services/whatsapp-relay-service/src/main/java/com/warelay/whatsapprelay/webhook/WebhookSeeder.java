package com.warelay.whatsapprelay.webhook;

import com.warelay.whatsapprelay.config.RelayProperties;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Registers the subscribers listed in {@code relay.webhook.urls} and the optional URL file. */
@Component
@Order(0)
@Slf4j
public class WebhookSeeder implements ApplicationRunner {

  private final WebhookRegistry registry;
  private final RelayProperties.Webhook props;

  public WebhookSeeder(WebhookRegistry registry, RelayProperties properties) {
    this.registry = registry;
    this.props = properties.webhook();
  }

  @Override
  public void run(ApplicationArguments args) {
    Set<String> urls = new LinkedHashSet<>(parseUrls(props.urls()));
    if (!props.urlsFile().isEmpty()) {
      Path path = Path.of(props.urlsFile());
      try {
        urls.addAll(parseUrls(Files.readString(path, StandardCharsets.UTF_8)));
      } catch (IOException e) {
        log.warn("Failed to read webhook file {}: {}", path, e.getMessage());
      }
    }
    if (urls.isEmpty()) {
      return;
    }
    int added = registry.insertAll(urls);
    log.info("Webhooks from configuration: {} listed, {} new", urls.size(), added);
  }

  /** Splits on newlines, commas and semicolons; blanks are skipped, order is kept. */
  static Set<String> parseUrls(String raw) {
    Set<String> out = new LinkedHashSet<>();
    if (raw == null || raw.isBlank()) {
      return out;
    }
    for (String part : raw.split("[\\r\\n,;]+")) {
      String url = part.trim();
      if (!url.isEmpty()) {
        out.add(url);
      }
    }
    return out;
  }
}

package com.warelay.whatsapprelay.inbound;

import com.fasterxml.jackson.databind.JsonNode;
import com.warelay.whatsapprelay.config.RelayProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Filters raw network messages and turns the survivors into {@link InboundMessage}s.
 *
 * <p>Filters run in a fixed order: broadcast origin, own messages, allowlist, age. Only text and
 * audio are relayed; any other attachment drops the message before its media is downloaded.
 */
@Component
@Slf4j
public class InboundMessageClassifier {

  /** Timestamps below this value are seconds, not milliseconds. */
  static final long SECONDS_THRESHOLD = 1_000_000_000_000L;

  private static final List<String> MEDIA_CONTAINERS =
      List.of("imageMessage", "audioMessage", "videoMessage", "documentMessage");

  private static final List<String> CONTEXT_CONTAINERS =
      List.of(
          "extendedTextMessage",
          "imageMessage",
          "videoMessage",
          "documentMessage",
          "audioMessage",
          "stickerMessage");

  private final Clock clock;
  private final Duration maxAge;
  private final Set<String> authorizedIds;

  @Autowired
  public InboundMessageClassifier(Clock clock, RelayProperties properties) {
    this(
        clock,
        properties.inbound().maxMessageAge(),
        parseAllowlist(properties.inbound().authorizedIds()));
  }

  InboundMessageClassifier(Clock clock, Duration maxAge, Set<String> authorizedIds) {
    this.clock = clock;
    this.maxAge = maxAge;
    this.authorizedIds = Set.copyOf(authorizedIds);
  }

  /**
   * @param mediaDownloader fetches the attachment bytes of the raw message; only called for
   *     messages that are going to be relayed
   */
  public Optional<InboundMessage> classify(
      JsonNode raw, Function<JsonNode, byte[]> mediaDownloader) {
    JsonNode key = raw.path("key");
    JsonNode content = raw.path("message");
    String messageId = key.path("id").asText("");

    if (!content.isObject()) {
      return skip(messageId, "no_content");
    }

    String from = key.path("remoteJid").asText("");
    if (Jids.isBroadcastOrigin(from)) {
      return skip(messageId, "broadcast");
    }
    if (key.path("fromMe").asBoolean(false)) {
      return skip(messageId, "from_me");
    }

    String participant = textOrNull(key.path("participant"));
    if (!isAuthorized(from, participant)) {
      return skip(messageId, "not_authorized");
    }

    Instant timestamp = timestampOf(raw.path("messageTimestamp"));
    if (isStale(timestamp)) {
      return skip(messageId, "stale");
    }

    MessageBody body;
    MediaContainer media = findMediaContainer(content);
    if (media != null) {
      String mimeType = media.node().path("mimetype").asText("");
      if (!media.isAudio()) {
        return skip(messageId, "unsupported_media " + mimeType);
      }
      byte[] bytes = mediaDownloader.apply(raw);
      body =
          new MediaBody(
              mimeType,
              media.node().path("caption").asText(""),
              Base64.getEncoder().encodeToString(bytes == null ? new byte[0] : bytes));
    } else {
      String text = content.path("conversation").asText("");
      if (text.isEmpty()) {
        text = content.path("extendedTextMessage").path("text").asText("");
      }
      if (text.isEmpty()) {
        return skip(messageId, "no_text");
      }
      body = new TextBody(text);
    }

    return Optional.of(
        new InboundMessage(
            from,
            false,
            participant,
            messageId,
            timestamp,
            raw.path("pushName").asText(""),
            body,
            replyIdOf(content)));
  }

  boolean isAuthorized(String from, String participant) {
    if (authorizedIds.isEmpty()) {
      return true;
    }
    if (from != null && authorizedIds.contains(from.toLowerCase(Locale.ROOT))) {
      return true;
    }
    return participant != null && authorizedIds.contains(participant.toLowerCase(Locale.ROOT));
  }

  /** A missing timestamp never counts as stale. */
  boolean isStale(Instant timestamp) {
    if (timestamp == null) {
      return false;
    }
    return clock.millis() - timestamp.toEpochMilli() > maxAge.toMillis();
  }

  /**
   * Reads {@code messageTimestamp}, which arrives as a number, a numeric string or a 64-bit
   * {@code {low, high}} object; returns null when absent or not positive.
   */
  static Instant timestampOf(JsonNode node) {
    long value = 0;
    if (node.isNumber()) {
      value = node.asLong();
    } else if (node.isTextual()) {
      try {
        value = (long) Double.parseDouble(node.asText().trim());
      } catch (NumberFormatException e) {
        value = 0;
      }
    } else if (node.isObject() && node.has("low")) {
      long low = node.path("low").asLong() & 0xffffffffL;
      long high = node.path("high").asLong();
      value = (high << 32) | low;
    }
    if (value <= 0) {
      return null;
    }
    return Instant.ofEpochMilli(value < SECONDS_THRESHOLD ? value * 1000 : value);
  }

  static Set<String> parseAllowlist(String raw) {
    Set<String> ids = new LinkedHashSet<>();
    if (raw == null || raw.isBlank()) {
      return ids;
    }
    for (String part : raw.split("[\\r\\n,;]+")) {
      String id = part.trim().toLowerCase(Locale.ROOT);
      if (!id.isEmpty()) {
        ids.add(id);
      }
    }
    return ids;
  }

  private static MediaContainer findMediaContainer(JsonNode content) {
    for (String name : MEDIA_CONTAINERS) {
      JsonNode node = content.path(name);
      if (node.isObject()) {
        return new MediaContainer(name, node);
      }
    }
    JsonNode wrapped = content.path("documentWithCaptionMessage").path("message");
    JsonNode document = wrapped.path("documentMessage");
    return document.isObject() ? new MediaContainer("documentMessage", document) : null;
  }

  private static String replyIdOf(JsonNode content) {
    for (String name : CONTEXT_CONTAINERS) {
      JsonNode contextInfo = content.path(name).path("contextInfo");
      if (contextInfo.isObject()) {
        return textOrNull(contextInfo.path("stanzaId"));
      }
    }
    return null;
  }

  private static String textOrNull(JsonNode node) {
    String text = node.asText("");
    return text.isEmpty() ? null : text;
  }

  private static Optional<InboundMessage> skip(String messageId, String reason) {
    log.debug("Skipping inbound message id={} reason={}", messageId, reason);
    return Optional.empty();
  }

  private record MediaContainer(String name, JsonNode node) {
    /** Decided by the container alone; an audio file sent as a document stays a document. */
    boolean isAudio() {
      return "audioMessage".equals(name);
    }
  }
}

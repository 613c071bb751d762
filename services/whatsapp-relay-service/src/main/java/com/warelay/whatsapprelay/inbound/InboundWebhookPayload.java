package com.warelay.whatsapprelay.inbound;

import com.fasterxml.jackson.annotation.JsonInclude;

/** JSON posted to subscribers for every relayed message; {@code type} is "text" or "audio". */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InboundWebhookPayload(
    String from,
    String pushName,
    String type,
    String message,
    MediaBody media,
    String messageId,
    String replyToMessageId) {

  public static InboundWebhookPayload of(InboundMessage m) {
    if (m.body() instanceof MediaBody media) {
      return new InboundWebhookPayload(
          m.remoteId(), m.pushName(), "audio", null, media, m.messageId(), m.replyToMessageId());
    }
    String text = m.body() instanceof TextBody t ? t.content() : "";
    return new InboundWebhookPayload(
        m.remoteId(), m.pushName(), "text", text, null, m.messageId(), m.replyToMessageId());
  }
}

package com.warelay.whatsapprelay.inbound;

/** Downloaded attachment; {@code base64} holds the raw bytes. */
public record MediaBody(String mimeType, String caption, String base64) implements MessageBody {}

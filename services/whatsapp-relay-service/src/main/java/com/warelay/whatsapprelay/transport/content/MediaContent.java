package com.warelay.whatsapprelay.transport.content;

/**
 * Binary attachment. {@code ptt} marks audio as a voice note, {@code gifPlayback} makes a video
 * loop; optional fields are null when the caller did not set them.
 */
public record MediaContent(
    MediaKind kind,
    byte[] data,
    String caption,
    String mimetype,
    String fileName,
    Boolean ptt,
    Boolean gifPlayback)
    implements MessageContent {
  @Override
  public ContentType type() {
    return ContentType.MEDIA;
  }
}

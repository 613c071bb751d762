package com.warelay.whatsapprelay.model;

import java.util.List;
import java.util.Map;

/**
 * Outbound message as accepted by the API. At most one of media, location, poll and contact is
 * used, in that order of precedence; without any of them the text is sent.
 */
public record MessageRequest(
    String chatId,
    String text,
    MediaRequest media,
    LocationRequest location,
    PollRequest poll,
    ContactRequest contact,
    Map<String, Object> options) {

  public static MessageRequest text(String chatId, String text) {
    return new MessageRequest(chatId, text, null, null, null, null, Map.of());
  }

  /**
   * @param type media kind: image, video, audio, document or sticker
   * @param data base64 payload
   * @param ptt send audio as a voice note
   * @param gifPlayback loop a video like a GIF
   */
  public record MediaRequest(
      String type,
      String data,
      String caption,
      String mimetype,
      String filename,
      Boolean ptt,
      Boolean gifPlayback) {}

  public record LocationRequest(
      String name, String address, String url, Double latitude, Double longitude) {}

  public record PollRequest(String name, List<String> options, Boolean allowMultipleAnswers) {}

  public record ContactRequest(String firstname, String lastname, String email, String phone) {}
}

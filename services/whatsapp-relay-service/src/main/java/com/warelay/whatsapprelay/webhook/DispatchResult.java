package com.warelay.whatsapprelay.webhook;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of one POST to one subscriber.
 *
 * @param statusCode HTTP status, or null when no response was received
 * @param response parsed JSON body, or null when the body was empty or not JSON
 */
public record DispatchResult(
    String url, boolean succeeded, Integer statusCode, JsonNode response) {

  public static DispatchResult success(String url, int statusCode, JsonNode response) {
    return new DispatchResult(url, true, statusCode, response);
  }

  public static DispatchResult failed(String url, Integer statusCode) {
    return new DispatchResult(url, false, statusCode, null);
  }

  /** Non-empty string found at {@code field} of a successful response, otherwise null. */
  public String textAt(String field) {
    if (!succeeded || response == null) {
      return null;
    }
    JsonNode node = response.path(field);
    if (!node.isTextual()) {
      return null;
    }
    String text = node.asText();
    return text.isEmpty() ? null : text;
  }
}

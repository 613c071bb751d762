package com.warelay.whatsapprelay.common.web;

/** Addressed entry does not exist; rendered as 404 by {@link ApiExceptionHandler}. */
public class NotFoundException extends RuntimeException {

  public NotFoundException(String message) {
    super(message);
  }

  public static NotFoundException webhookIndex(int index) {
    return new NotFoundException("Webhook at index " + index + " not found");
  }
}

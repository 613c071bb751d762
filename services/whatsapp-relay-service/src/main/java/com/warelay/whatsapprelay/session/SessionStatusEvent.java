package com.warelay.whatsapprelay.session;

/**
 * Published on the application event bus whenever the session has something to show on the
 * status page: a QR challenge ({@code qr} set, {@code text} empty) or a status line.
 */
public record SessionStatusEvent(String qr, String text) {

  public static SessionStatusEvent qr(String qr) {
    return new SessionStatusEvent(qr, "");
  }

  public static SessionStatusEvent text(String text) {
    return new SessionStatusEvent("", text);
  }
}

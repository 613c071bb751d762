package com.warelay.whatsapprelay.transport.content;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum MediaKind {
  IMAGE("image"),
  VIDEO("video"),
  AUDIO("audio"),
  DOCUMENT("document"),
  STICKER("sticker");

  private final String code;

  MediaKind(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }

  public static MediaKind fromCode(String code) {
    if (code == null) return null;
    String c = code.trim().toLowerCase(Locale.ROOT);
    for (MediaKind k : values()) {
      if (k.code.equals(c)) {
        return k;
      }
    }
    return null;
  }
}

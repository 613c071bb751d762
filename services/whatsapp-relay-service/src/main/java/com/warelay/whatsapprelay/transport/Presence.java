package com.warelay.whatsapprelay.transport;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Presence {
  UNAVAILABLE("unavailable"),
  AVAILABLE("available"),
  COMPOSING("composing"),
  RECORDING("recording"),
  PAUSED("paused");

  private final String code;

  Presence(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }

  /** Returns null for unknown codes so callers can log and ignore them. */
  @JsonCreator
  public static Presence fromCode(String code) {
    if (code == null) return null;
    String c = code.trim().toLowerCase(Locale.ROOT);
    for (Presence p : values()) {
      if (p.code.equals(c)) {
        return p;
      }
    }
    return null;
  }
}

package com.warelay.whatsapprelay.session;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecoveryAction {
  ALREADY_ALIVE("already_alive"),
  RECONNECT_SCHEDULED("reconnect_scheduled"),
  REFRESH_IN_PROGRESS("refresh_in_progress"),
  START_CALLED("start_called"),
  START_FAILED("start_failed");

  private final String code;

  RecoveryAction(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }
}

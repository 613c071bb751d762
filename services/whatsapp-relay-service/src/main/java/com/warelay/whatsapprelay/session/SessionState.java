package com.warelay.whatsapprelay.session;

public enum SessionState {
  DISCONNECTED,
  CONNECTING,
  AWAITING_SCAN,
  CONNECTED,
  CLOSING
}

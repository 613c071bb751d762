package com.warelay.whatsapprelay.transport;

public enum ConnectionStatus {
  CONNECTING,
  OPEN,
  CLOSE
}

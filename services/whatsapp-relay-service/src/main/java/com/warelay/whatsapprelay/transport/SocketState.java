package com.warelay.whatsapprelay.transport;

public enum SocketState {
  CONNECTING,
  OPEN,
  CLOSING,
  CLOSED
}

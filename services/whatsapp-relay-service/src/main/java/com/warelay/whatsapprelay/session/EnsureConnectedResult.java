package com.warelay.whatsapprelay.session;

import com.warelay.whatsapprelay.transport.SocketState;

public record EnsureConnectedResult(
    boolean alive,
    boolean connected,
    boolean hasClient,
    boolean reconnectScheduled,
    SocketState socketState,
    RecoveryAction action) {

  public static EnsureConnectedResult of(ConnectionHealth health, RecoveryAction action) {
    return new EnsureConnectedResult(
        health.alive(),
        health.connected(),
        health.hasClient(),
        health.reconnectScheduled(),
        health.socketState(),
        action);
  }
}

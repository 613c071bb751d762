package com.warelay.whatsapprelay.session;

import com.warelay.whatsapprelay.transport.SocketState;

/**
 * Point-in-time view of the session.
 *
 * @param alive {@code connected && hasClient} and the socket is open (or its state is unknown)
 * @param socketState null when there is no handle or the transport does not expose it
 */
public record ConnectionHealth(
    boolean alive,
    boolean connected,
    boolean hasClient,
    boolean reconnectScheduled,
    SocketState socketState) {}

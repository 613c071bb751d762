package com.warelay.whatsapprelay.transport;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Opens sessions against the chat network.
 *
 * <p>Every call creates a fresh handle. The handle must deliver all of its events to the given
 * listener; the caller is responsible for discarding events from handles it has superseded.
 */
public interface TransportConnector {

  /**
   * @param credentials previously persisted credentials, or an empty object node for a new pairing
   * @param listener receives every event produced by the new handle
   */
  TransportSession connect(JsonNode credentials, TransportEventListener listener);
}

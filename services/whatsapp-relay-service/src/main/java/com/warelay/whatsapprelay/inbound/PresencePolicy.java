package com.warelay.whatsapprelay.inbound;

import com.warelay.whatsapprelay.config.RelayProperties;
import java.time.Duration;

/**
 * Typing indicator shown to the sender while subscribers are consulted: "composing" stays on for
 * at least {@code minRoundTrip}, then "paused" is sent and the reply follows after {@code
 * pauseDelay}.
 */
public record PresencePolicy(Duration minRoundTrip, Duration pauseDelay) {

  public static PresencePolicy from(RelayProperties.Presence presence) {
    return new PresencePolicy(presence.minRoundTrip(), presence.pauseDelay());
  }

  /** Time still to wait after a round trip of {@code elapsed}; never negative. */
  public Duration remainingAfter(Duration elapsed) {
    Duration remaining = minRoundTrip.minus(elapsed);
    return remaining.isNegative() ? Duration.ZERO : remaining;
  }
}

package com.warelay.whatsapprelay.common;

import java.time.Duration;

/** Blocking delay used by the session and inbound timing policies; tests substitute a no-op. */
@FunctionalInterface
public interface Pause {

  Pause THREAD_SLEEP =
      duration -> {
        if (duration == null || duration.isZero() || duration.isNegative()) {
          return;
        }
        try {
          Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      };

  void sleep(Duration duration);
}

package com.warelay.whatsapprelay.session;

import java.time.Duration;
import java.util.List;

/** Fixed reconnect schedule; attempts past the end of the table reuse its last entry. */
public final class ReconnectBackoff {

  private final List<Duration> schedule;
  private final int maxAttempts;

  public ReconnectBackoff(List<Duration> schedule, int maxAttempts) {
    if (schedule == null || schedule.isEmpty()) {
      throw new IllegalArgumentException("Backoff schedule must not be empty");
    }
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException("maxAttempts must be positive");
    }
    this.schedule = List.copyOf(schedule);
    this.maxAttempts = maxAttempts;
  }

  /** Delay before the given 1-based attempt. */
  public Duration delayFor(int attempt) {
    int index = Math.max(0, Math.min(attempt - 1, schedule.size() - 1));
    return schedule.get(index);
  }

  /** True once {@code attemptsMade} retries have been spent. */
  public boolean isExhausted(int attemptsMade) {
    return attemptsMade >= maxAttempts;
  }

  public int maxAttempts() {
    return maxAttempts;
  }
}

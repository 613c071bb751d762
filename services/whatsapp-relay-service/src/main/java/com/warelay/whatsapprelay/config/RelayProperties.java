package com.warelay.whatsapprelay.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Typed view of the {@code relay.*} settings; missing values fall back to production defaults. */
@ConfigurationProperties(prefix = "relay")
public record RelayProperties(Session session, Inbound inbound, Webhook webhook, Storage storage) {

  public RelayProperties {
    session = session == null ? Session.defaults() : session;
    inbound = inbound == null ? Inbound.defaults() : inbound;
    webhook = webhook == null ? Webhook.defaults() : webhook;
    storage = storage == null ? Storage.defaults() : storage;
  }

  public static RelayProperties defaults() {
    return new RelayProperties(null, null, null, null);
  }

  /**
   * @param reconnectBackoff delays before each reconnect attempt; the last entry repeats
   * @param refreshRestartDelay pause between closing the socket and restarting during a forced
   *     refresh
   */
  public record Session(
      String credentialsFolder,
      boolean autoStart,
      boolean autoRecover,
      Duration autoRecoverInterval,
      Duration refreshInterval,
      Duration refreshRestartDelay,
      List<Duration> reconnectBackoff,
      int maxReconnectAttempts) {

    static final Duration MIN_AUTO_RECOVER_INTERVAL = Duration.ofSeconds(5);
    static final Duration MIN_REFRESH_INTERVAL = Duration.ofMinutes(1);

    public Session {
      if (credentialsFolder == null || credentialsFolder.isBlank()) {
        credentialsFolder = "auth_info";
      }
      autoRecoverInterval =
          atLeast(autoRecoverInterval, Duration.ofSeconds(30), MIN_AUTO_RECOVER_INTERVAL);
      refreshInterval = atLeast(refreshInterval, Duration.ofMinutes(10), MIN_REFRESH_INTERVAL);
      refreshRestartDelay =
          refreshRestartDelay == null ? Duration.ofSeconds(2) : refreshRestartDelay;
      reconnectBackoff =
          reconnectBackoff == null || reconnectBackoff.isEmpty()
              ? List.of(
                  Duration.ofMillis(1000),
                  Duration.ofMillis(2000),
                  Duration.ofMillis(2500),
                  Duration.ofMillis(3000),
                  Duration.ofMillis(4000))
              : List.copyOf(reconnectBackoff);
      maxReconnectAttempts = maxReconnectAttempts <= 0 ? 5 : maxReconnectAttempts;
    }

    static Session defaults() {
      return new Session(null, true, false, null, null, null, null, 0);
    }
  }

  /**
   * @param authorizedIds raw allowlist, entries separated by newline, comma or semicolon; empty
   *     means every sender is accepted
   */
  public record Inbound(
      Duration maxMessageAge, String authorizedIds, int queueCapacity, Presence presence) {

    public Inbound {
      maxMessageAge = maxMessageAge == null ? Duration.ofSeconds(60) : maxMessageAge;
      authorizedIds = authorizedIds == null ? "" : authorizedIds;
      queueCapacity = queueCapacity <= 0 ? 1000 : queueCapacity;
      presence = presence == null ? Presence.defaults() : presence;
    }

    static Inbound defaults() {
      return new Inbound(null, null, 0, null);
    }
  }

  /** Timings of the typing indicator shown while subscribers are consulted. */
  public record Presence(Duration minRoundTrip, Duration pauseDelay) {

    public Presence {
      minRoundTrip = minRoundTrip == null ? Duration.ofSeconds(1) : minRoundTrip;
      pauseDelay = pauseDelay == null ? Duration.ofMillis(250) : pauseDelay;
    }

    static Presence defaults() {
      return new Presence(null, null);
    }
  }

  public record Webhook(
      String storageFile, String urls, String urlsFile, String bearerToken, Duration timeout) {

    public Webhook {
      storageFile = storageFile == null || storageFile.isBlank() ? "webhooks.txt" : storageFile;
      urls = urls == null ? "" : urls;
      urlsFile = urlsFile == null ? "" : urlsFile.trim();
      bearerToken = bearerToken == null ? "" : bearerToken.trim();
      timeout = timeout == null ? Duration.ofSeconds(8) : timeout;
    }

    static Webhook defaults() {
      return new Webhook(null, null, null, null, null);
    }
  }

  public record Storage(String snapshotFile) {

    public Storage {
      snapshotFile =
          snapshotFile == null || snapshotFile.isBlank() ? "whatsapp_data.json" : snapshotFile;
    }

    static Storage defaults() {
      return new Storage(null);
    }
  }

  private static Duration atLeast(Duration value, Duration fallback, Duration min) {
    Duration v = value == null ? fallback : value;
    return v.compareTo(min) < 0 ? min : v;
  }
}

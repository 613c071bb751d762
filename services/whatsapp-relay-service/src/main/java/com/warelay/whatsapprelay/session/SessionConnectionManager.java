package com.warelay.whatsapprelay.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.warelay.whatsapprelay.common.Pause;
import com.warelay.whatsapprelay.config.RelayProperties;
import com.warelay.whatsapprelay.store.CredentialStore;
import com.warelay.whatsapprelay.transport.ConnectionClosedException;
import com.warelay.whatsapprelay.transport.ConnectionStatus;
import com.warelay.whatsapprelay.transport.ConnectionUpdate;
import com.warelay.whatsapprelay.transport.DisconnectInfo;
import com.warelay.whatsapprelay.transport.SocketState;
import com.warelay.whatsapprelay.transport.TransportConnector;
import com.warelay.whatsapprelay.transport.TransportEventListener;
import com.warelay.whatsapprelay.transport.TransportException;
import com.warelay.whatsapprelay.transport.TransportSession;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Owns the single transport session of the process.
 *
 * <p>Every handle is created with a new generation number and its events are only honoured while
 * that generation is current, so a superseded handle can never drive state changes or deliver
 * messages. Transient closes are retried on a fixed backoff schedule; permanent ones (logout,
 * abandoned pairing) leave the session disconnected until the next explicit {@link #start()}.
 *
 * <p>Two optional timers keep the session healthy: auto-recover periodically calls {@link
 * #ensureConnected()}, and the forced refresh cycles the socket even while it looks connected to
 * get rid of half-open connections. While a refresh runs, close events do not schedule
 * reconnects.
 */
@Service
@Slf4j
public class SessionConnectionManager {

  private final TransportConnector connector;
  private final CredentialStore credentials;
  private final TaskScheduler scheduler;
  private final ApplicationEventPublisher events;
  private final RelayProperties.Session props;
  private final ReconnectBackoff backoff;
  private final Pause pause;

  private final Object lock = new Object();
  private final AtomicLong generations = new AtomicLong();
  private final AtomicBoolean refreshing = new AtomicBoolean(false);

  // guarded by lock
  private TransportSession client;
  private long generation;
  private SessionState state = SessionState.DISCONNECTED;
  private boolean connected;
  private int reconnectAttempt;
  private ScheduledFuture<?> reconnectTimer;
  private ScheduledFuture<?> refreshTimer;
  private ScheduledFuture<?> autoRecoverTimer;
  private CompletableFuture<Void> startInFlight;

  private volatile InboundEventHandler inboundHandler;

  public SessionConnectionManager(
      TransportConnector connector,
      CredentialStore credentials,
      TaskScheduler scheduler,
      ApplicationEventPublisher events,
      RelayProperties properties,
      Pause pause) {
    this.connector = connector;
    this.credentials = credentials;
    this.scheduler = scheduler;
    this.events = events;
    this.props = properties.session();
    this.backoff = new ReconnectBackoff(props.reconnectBackoff(), props.maxReconnectAttempts());
    this.pause = pause;
  }

  public void registerInboundHandler(InboundEventHandler handler) {
    this.inboundHandler = handler;
  }

  /**
   * Creates a new transport handle unless one is already connected.
   *
   * <p>Concurrent callers share one attempt: only the first caller talks to the transport, the
   * others wait for it and observe the same outcome.
   */
  public void start() {
    CompletableFuture<Void> attempt;
    boolean owner = false;
    synchronized (lock) {
      if (startInFlight == null) {
        startInFlight = new CompletableFuture<>();
        owner = true;
      }
      attempt = startInFlight;
    }

    if (!owner) {
      awaitStart(attempt);
      return;
    }

    RuntimeException failure = null;
    try {
      doStart();
    } catch (RuntimeException e) {
      failure = e;
    }
    synchronized (lock) {
      startInFlight = null;
    }
    if (failure != null) {
      attempt.completeExceptionally(failure);
      throw failure;
    }
    attempt.complete(null);
  }

  /** Runs {@link #start()} on the scheduler; failures are logged. */
  public void startAsync() {
    scheduler.schedule(
        () -> {
          try {
            start();
          } catch (RuntimeException e) {
            log.error("Failed to start session", e);
          }
        },
        Instant.now());
  }

  private void doStart() {
    boolean alreadyConnected;
    TransportSession detached = null;
    synchronized (lock) {
      alreadyConnected = connected && client != null;
      if (!alreadyConnected && client != null) {
        detached = client;
        client = null;
        generation = 0;
        state = SessionState.CLOSING;
      }
    }

    if (alreadyConnected) {
      String text = "WhatsApp is already connected!";
      log.debug(text);
      publish(SessionStatusEvent.text(text));
      return;
    }

    if (detached != null) {
      closeQuietly(detached);
      synchronized (lock) {
        if (client == null) {
          state = SessionState.DISCONNECTED;
        }
      }
    }

    JsonNode creds = credentials.load();
    long gen = generations.incrementAndGet();
    synchronized (lock) {
      generation = gen;
      state = SessionState.CONNECTING;
      connected = false;
    }
    log.info("Starting session generation={}", gen);

    TransportSession session;
    try {
      session = connector.connect(creds, new GenerationListener(gen));
    } catch (RuntimeException e) {
      synchronized (lock) {
        if (generation == gen) {
          generation = 0;
          state = SessionState.DISCONNECTED;
        }
      }
      throw e;
    }

    boolean superseded;
    synchronized (lock) {
      superseded = generation != gen;
      if (!superseded) {
        client = session;
      }
    }
    if (superseded) {
      log.warn("Session generation {} was superseded while connecting; closing it", gen);
      closeQuietly(session);
    }
  }

  private void awaitStart(CompletableFuture<Void> attempt) {
    try {
      attempt.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException re) {
        throw re;
      }
      throw new TransportException("Session start failed", e.getCause());
    }
  }

  private void onConnectionUpdate(long gen, ConnectionUpdate update) {
    String qr = null;
    String text = null;
    synchronized (lock) {
      if (gen != generation) {
        log.debug(
            "Discarding connection update of stale generation {} (current {})", gen, generation);
        return;
      }
      if (update.hasQr()) {
        state = SessionState.AWAITING_SCAN;
        qr = update.qr();
      }
      if (update.connection() == ConnectionStatus.CLOSE) {
        text = handleClose(update.lastDisconnect());
      } else if (update.connection() == ConnectionStatus.OPEN) {
        text = handleOpen();
      } else if (update.connection() == ConnectionStatus.CONNECTING
          && state != SessionState.AWAITING_SCAN) {
        state = SessionState.CONNECTING;
      }
    }

    if (qr != null) {
      publish(SessionStatusEvent.qr(qr));
    }
    if (text != null && !text.isEmpty()) {
      log.info(text);
      publish(SessionStatusEvent.text(text));
    }
  }

  // lock held
  private String handleOpen() {
    reconnectAttempt = 0;
    connected = true;
    state = SessionState.CONNECTED;
    cancelReconnect();
    return "Connected to WhatsApp!";
  }

  // lock held
  private String handleClose(DisconnectInfo info) {
    connected = false;
    String reason = describe(info);

    if (refreshing.get()) {
      state = SessionState.DISCONNECTED;
      return "Connection closed for refresh";
    }

    DisconnectKind kind = DisconnectClassifier.classify(info);
    if (kind == DisconnectKind.PERMANENT || backoff.isExhausted(reconnectAttempt)) {
      giveUp(kind, reason);
      return reason;
    }
    return scheduleReconnect();
  }

  // lock held
  private void giveUp(DisconnectKind kind, String reason) {
    log.warn(
        "Session closed without retry kind={} attempts={} reason={}",
        kind,
        reconnectAttempt,
        reason);
    state = SessionState.DISCONNECTED;
    reconnectAttempt = 0;
    cancelReconnect();
  }

  // lock held
  private String scheduleReconnect() {
    reconnectAttempt++;
    Duration delay = backoff.delayFor(reconnectAttempt);
    cancelReconnect();
    state = SessionState.DISCONNECTED;
    reconnectTimer = scheduler.schedule(this::runScheduledReconnect, Instant.now().plus(delay));
    return "Reconnecting in " + delay.toMillis() + "ms (attempt " + reconnectAttempt + ")";
  }

  private void runScheduledReconnect() {
    synchronized (lock) {
      reconnectTimer = null;
    }
    try {
      start();
    } catch (RuntimeException e) {
      log.warn("Scheduled reconnect failed: {}", e.getMessage());
      String text;
      synchronized (lock) {
        if (backoff.isExhausted(reconnectAttempt)) {
          giveUp(DisconnectKind.TRANSIENT, e.getMessage());
          text = "Reconnect failed: " + e.getMessage();
        } else {
          text = scheduleReconnect();
        }
      }
      publish(SessionStatusEvent.text(text));
    }
  }

  // lock held
  private void cancelReconnect() {
    if (reconnectTimer != null) {
      reconnectTimer.cancel(false);
      reconnectTimer = null;
    }
  }

  /**
   * Closes and restarts the session even if it looks healthy.
   *
   * <p>Reconnect scheduling is suppressed for the whole cycle and a second refresh that arrives
   * while one is running is ignored. The restart is always attempted once the close was issued.
   */
  public void forceRefresh() {
    if (!refreshing.compareAndSet(false, true)) {
      log.debug("Forced refresh already in progress");
      return;
    }
    try {
      TransportSession current;
      synchronized (lock) {
        current = client;
        if (current == null) {
          return;
        }
        cancelReconnect();
        client = null;
        connected = false;
        reconnectAttempt = 0;
        state = SessionState.CLOSING;
      }

      log.info("Forcing session refresh");
      closeQuietly(current);
      pause.sleep(props.refreshRestartDelay());
      try {
        start();
      } catch (RuntimeException e) {
        log.error("Forced refresh failed to restart the session", e);
      }
    } finally {
      refreshing.set(false);
    }
  }

  public ConnectionHealth health() {
    synchronized (lock) {
      boolean hasClient = client != null;
      SocketState socket = hasClient ? socketStateOf(client) : null;
      boolean socketOpen = socket == null ? connected : socket == SocketState.OPEN;
      boolean alive = connected && hasClient && socketOpen;
      return new ConnectionHealth(alive, connected, hasClient, reconnectTimer != null, socket);
    }
  }

  /**
   * Starts the session unless it is alive, a reconnect is already pending or a forced refresh is
   * restarting it.
   */
  public EnsureConnectedResult ensureConnected() {
    ConnectionHealth health = health();
    if (health.alive()) {
      return EnsureConnectedResult.of(health, RecoveryAction.ALREADY_ALIVE);
    }
    if (refreshing.get()) {
      return EnsureConnectedResult.of(health, RecoveryAction.REFRESH_IN_PROGRESS);
    }
    if (health.reconnectScheduled()) {
      return EnsureConnectedResult.of(health, RecoveryAction.RECONNECT_SCHEDULED);
    }
    try {
      start();
      return EnsureConnectedResult.of(health(), RecoveryAction.START_CALLED);
    } catch (RuntimeException e) {
      log.error("Failed to ensure session connection", e);
      return EnsureConnectedResult.of(health(), RecoveryAction.START_FAILED);
    }
  }

  /** Invalidates the credentials on the network side. Failures are logged only. */
  public void logout() {
    TransportSession current;
    synchronized (lock) {
      current = client;
    }
    if (current == null) {
      log.debug("Logout requested without a session");
      return;
    }
    try {
      current.logout();
    } catch (RuntimeException e) {
      log.warn("Logout failed: {}", e.getMessage());
    }
  }

  /**
   * Borrows the current handle for a single operation.
   *
   * @throws ConnectionClosedException if no handle exists
   */
  public TransportSession requireSession() {
    synchronized (lock) {
      if (client == null) {
        throw new ConnectionClosedException("Session is not connected");
      }
      return client;
    }
  }

  /**
   * Borrows the handle of one generation; empty once that generation was superseded or its
   * handle detached.
   */
  public Optional<TransportSession> sessionFor(long gen) {
    synchronized (lock) {
      if (gen != generation || client == null) {
        return Optional.empty();
      }
      return Optional.of(client);
    }
  }

  public SessionState state() {
    synchronized (lock) {
      return state;
    }
  }

  public int reconnectAttempt() {
    synchronized (lock) {
      return reconnectAttempt;
    }
  }

  public long generation() {
    synchronized (lock) {
      return generation;
    }
  }

  public boolean isRefreshing() {
    return refreshing.get();
  }

  /** Arms the auto-recover (when enabled) and forced-refresh timers. Idempotent. */
  public void startMaintenance() {
    synchronized (lock) {
      if (props.autoRecover() && autoRecoverTimer == null) {
        Duration interval = props.autoRecoverInterval();
        log.info("Auto-recover enabled interval={}ms", interval.toMillis());
        autoRecoverTimer =
            scheduler.scheduleWithFixedDelay(
                this::autoRecover, Instant.now().plus(interval), interval);
      }
      if (refreshTimer == null) {
        Duration interval = props.refreshInterval();
        log.info("Forced refresh enabled interval={}ms", interval.toMillis());
        refreshTimer =
            scheduler.scheduleWithFixedDelay(
                this::forceRefresh, Instant.now().plus(interval), interval);
      }
    }
  }

  private void autoRecover() {
    try {
      EnsureConnectedResult result = ensureConnected();
      if (result.action() != RecoveryAction.ALREADY_ALIVE) {
        log.info("Auto-recover action={} alive={}", result.action().code(), result.alive());
      }
    } catch (RuntimeException e) {
      log.warn("Auto-recover failed: {}", e.getMessage());
    }
  }

  @PreDestroy
  public void shutdown() {
    synchronized (lock) {
      cancelReconnect();
      if (refreshTimer != null) {
        refreshTimer.cancel(false);
        refreshTimer = null;
      }
      if (autoRecoverTimer != null) {
        autoRecoverTimer.cancel(false);
        autoRecoverTimer = null;
      }
    }
  }

  private boolean isCurrent(long gen) {
    synchronized (lock) {
      return gen == generation;
    }
  }

  private void publish(SessionStatusEvent event) {
    try {
      events.publishEvent(event);
    } catch (RuntimeException e) {
      log.warn("Failed to publish session event: {}", e.getMessage());
    }
  }

  private static SocketState socketStateOf(TransportSession session) {
    try {
      return session.socketState();
    } catch (RuntimeException e) {
      return null;
    }
  }

  private static void closeQuietly(TransportSession session) {
    try {
      session.close();
    } catch (RuntimeException e) {
      log.debug("Closing transport handle failed: {}", e.getMessage());
    }
  }

  private static String describe(DisconnectInfo info) {
    if (info == null) {
      return "Connection closed";
    }
    if (info.message() != null && !info.message().isBlank()) {
      return info.message();
    }
    return info.statusCode() == null
        ? "Connection closed"
        : "Connection closed status=" + info.statusCode();
  }

  /** Listener bound to one generation; events of any other generation are dropped. */
  private final class GenerationListener implements TransportEventListener {

    private final long gen;

    GenerationListener(long gen) {
      this.gen = gen;
    }

    @Override
    public void credentialsUpdated(JsonNode creds) {
      if (!isCurrent(gen)) {
        return;
      }
      try {
        credentials.save(creds);
      } catch (RuntimeException e) {
        log.warn("Failed to persist credentials: {}", e.getMessage());
      }
    }

    @Override
    public void connectionUpdated(ConnectionUpdate update) {
      if (update != null) {
        onConnectionUpdate(gen, update);
      }
    }

    @Override
    public void messagesReceived(List<JsonNode> messages) {
      InboundEventHandler handler = inboundHandler;
      if (handler == null || messages == null || messages.isEmpty()) {
        return;
      }
      if (!isCurrent(gen)) {
        log.debug("Discarding {} messages of stale generation {}", messages.size(), gen);
        return;
      }
      handler.onMessages(gen, messages);
    }

    @Override
    public void callReceived(JsonNode call) {
      InboundEventHandler handler = inboundHandler;
      if (handler != null && call != null && isCurrent(gen)) {
        handler.onCall(gen, call);
      }
    }

    @Override
    public void historySynced(JsonNode history) {
      InboundEventHandler handler = inboundHandler;
      if (handler != null && history != null && isCurrent(gen)) {
        handler.onHistorySync(history);
      }
    }
  }
}

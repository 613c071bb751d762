package com.warelay.whatsapprelay.inbound;

import com.fasterxml.jackson.databind.JsonNode;
import com.warelay.whatsapprelay.common.Pause;
import com.warelay.whatsapprelay.config.RelayProperties;
import com.warelay.whatsapprelay.outbound.OutboundMessageService;
import com.warelay.whatsapprelay.session.InboundEventHandler;
import com.warelay.whatsapprelay.session.SessionConnectionManager;
import com.warelay.whatsapprelay.store.ChatSnapshotStore;
import com.warelay.whatsapprelay.transport.MessageKey;
import com.warelay.whatsapprelay.transport.Presence;
import com.warelay.whatsapprelay.transport.TransportSession;
import com.warelay.whatsapprelay.webhook.DispatchResult;
import com.warelay.whatsapprelay.webhook.WebhookDispatcher;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Relays inbound messages to the webhook subscribers and sends their replies back.
 *
 * <p>All work runs on one worker thread fed by a bounded FIFO queue, so a batch (including its
 * webhook calls, presence updates and auto-replies) is finished before the next one starts. When
 * the queue is full the transport thread blocks until there is room again.
 */
@Service
@Slf4j
public class InboundMessagePipeline implements InboundEventHandler {

  /** Field of a subscriber response that carries the reply text. */
  static final String REPLY_FIELD = "msg";

  private final SessionConnectionManager session;
  private final WebhookDispatcher dispatcher;
  private final OutboundMessageService outbound;
  private final InboundMessageClassifier classifier;
  private final ChatSnapshotStore snapshots;
  private final PresencePolicy presence;
  private final Pause pause;
  private final ThreadPoolExecutor worker;

  public InboundMessagePipeline(
      SessionConnectionManager session,
      WebhookDispatcher dispatcher,
      OutboundMessageService outbound,
      InboundMessageClassifier classifier,
      ChatSnapshotStore snapshots,
      RelayProperties properties,
      Pause pause) {
    this.session = session;
    this.dispatcher = dispatcher;
    this.outbound = outbound;
    this.classifier = classifier;
    this.snapshots = snapshots;
    this.presence = PresencePolicy.from(properties.inbound().presence());
    this.pause = pause;
    this.worker =
        new ThreadPoolExecutor(
            1,
            1,
            0L,
            TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(properties.inbound().queueCapacity()),
            r -> {
              Thread t = new Thread(r, "inbound-pipeline");
              t.setDaemon(true);
              return t;
            },
            InboundMessagePipeline::blockUntilQueued);
  }

  @PostConstruct
  void register() {
    session.registerInboundHandler(this);
  }

  @PreDestroy
  public void shutdown() {
    worker.shutdown();
    try {
      if (!worker.awaitTermination(10, TimeUnit.SECONDS)) {
        log.warn(
            "Inbound queue did not drain in time; {} batches dropped", worker.getQueue().size());
        worker.shutdownNow();
      }
    } catch (InterruptedException e) {
      worker.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  @Override
  public void onMessages(long generation, List<JsonNode> messages) {
    List<JsonNode> batch = List.copyOf(messages);
    enqueue(() -> processBatch(generation, batch));
  }

  /** Rejects the call right away, then notifies subscribers from the queue. */
  @Override
  public void onCall(long generation, JsonNode call) {
    String callId = call.path("id").asText("");
    try {
      session
          .sessionFor(generation)
          .ifPresent(client -> client.rejectCall(callId, call.path("from").asText("")));
    } catch (RuntimeException e) {
      log.debug("Rejecting call {} failed: {}", callId, e.getMessage());
    }
    enqueue(() -> dispatcher.broadcast(Map.of("call", call)));
  }

  @Override
  public void onHistorySync(JsonNode history) {
    try {
      snapshots.append(history);
    } catch (RuntimeException e) {
      log.warn("Failed to store history sync: {}", e.getMessage());
    }
  }

  private void enqueue(Runnable task) {
    try {
      worker.execute(
          () -> {
            try {
              task.run();
            } catch (RuntimeException e) {
              log.warn("Inbound task failed: {}", e.getMessage());
            }
          });
    } catch (RejectedExecutionException e) {
      log.warn("Inbound pipeline is shut down; dropping work: {}", e.getMessage());
    }
  }

  /** Runs on the worker; stops as soon as {@code generation} is no longer the live session. */
  void processBatch(long generation, List<JsonNode> batch) {
    if (!dispatcher.hasSubscribers()) {
      log.debug("No webhook subscribers; ignoring {} inbound messages", batch.size());
      return;
    }
    for (int i = 0; i < batch.size(); i++) {
      JsonNode raw = batch.get(i);
      Optional<TransportSession> current = session.sessionFor(generation);
      if (current.isEmpty()) {
        log.debug(
            "Session generation {} superseded; dropping {} queued messages",
            generation,
            batch.size() - i);
        return;
      }
      TransportSession client = current.get();
      try {
        classifier
            .classify(raw, client::downloadMedia)
            .ifPresent(m -> relay(generation, client, m));
      } catch (RuntimeException e) {
        log.warn(
            "Failed to relay inbound message id={}: {}",
            raw.path("key").path("id").asText(""),
            e.getMessage());
      }
    }
  }

  private void relay(long generation, TransportSession client, InboundMessage message) {
    String jid = Jids.normalize(message.remoteId());
    long started = System.nanoTime();

    client.sendPresenceUpdate(Presence.COMPOSING, jid);
    List<DispatchResult> results =
        dispatcher.dispatchAndCollect(InboundWebhookPayload.of(message));
    markRead(client, message);
    String reply = firstReply(results);

    Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
    pause.sleep(presence.remainingAfter(elapsed));
    client.sendPresenceUpdate(Presence.PAUSED, jid);
    pause.sleep(presence.pauseDelay());

    if (reply == null) {
      return;
    }
    if (session.sessionFor(generation).isEmpty()) {
      log.debug("Session generation {} superseded; reply to {} dropped", generation, jid);
      return;
    }
    outbound.sendText(message.remoteId(), reply);
  }

  private void markRead(TransportSession client, InboundMessage message) {
    try {
      client.readMessages(
          List.of(
              new MessageKey(
                  message.remoteId(), message.messageId(), false, message.participantId())));
    } catch (RuntimeException e) {
      log.debug("Marking message {} read failed: {}", message.messageId(), e.getMessage());
    }
  }

  /** First non-empty reply in subscriber registration order. */
  static String firstReply(List<DispatchResult> results) {
    for (DispatchResult result : results) {
      String candidate = result.textAt(REPLY_FIELD);
      if (candidate != null) {
        return candidate;
      }
    }
    return null;
  }

  private static void blockUntilQueued(Runnable task, ThreadPoolExecutor executor) {
    if (executor.isShutdown()) {
      throw new RejectedExecutionException("Inbound pipeline is shut down");
    }
    try {
      executor.getQueue().put(task);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RejectedExecutionException("Interrupted while waiting for inbound queue", e);
    }
  }
}

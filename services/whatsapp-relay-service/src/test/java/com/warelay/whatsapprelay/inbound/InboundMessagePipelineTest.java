package com.warelay.whatsapprelay.inbound;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.warelay.whatsapprelay.common.Pause;
import com.warelay.whatsapprelay.config.RelayProperties;
import com.warelay.whatsapprelay.outbound.OutboundMessageService;
import com.warelay.whatsapprelay.session.SessionConnectionManager;
import com.warelay.whatsapprelay.store.ChatSnapshotStore;
import com.warelay.whatsapprelay.transport.Presence;
import com.warelay.whatsapprelay.transport.TransportSession;
import com.warelay.whatsapprelay.webhook.DispatchResult;
import com.warelay.whatsapprelay.webhook.WebhookDispatcher;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class InboundMessagePipelineTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
  private static final String LEGACY_CHAT = "15551234567@c.us";
  private static final String CHAT = "15551234567@s.whatsapp.net";
  private static final long GEN = 1L;

  private final ObjectMapper mapper = new ObjectMapper();

  private SessionConnectionManager session;
  private TransportSession client;
  private WebhookDispatcher dispatcher;
  private OutboundMessageService outbound;
  private ChatSnapshotStore snapshots;
  private Pause pause;
  private InboundMessagePipeline pipeline;

  @BeforeEach
  void setUp() {
    session = mock(SessionConnectionManager.class);
    client = mock(TransportSession.class);
    dispatcher = mock(WebhookDispatcher.class);
    outbound = mock(OutboundMessageService.class);
    snapshots = mock(ChatSnapshotStore.class);
    pause = mock(Pause.class);
    when(session.sessionFor(GEN)).thenReturn(Optional.of(client));
    when(dispatcher.hasSubscribers()).thenReturn(true);

    InboundMessageClassifier classifier =
        new InboundMessageClassifier(
            Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofSeconds(60), Set.of());
    pipeline =
        new InboundMessagePipeline(
            session,
            dispatcher,
            outbound,
            classifier,
            snapshots,
            RelayProperties.defaults(),
            pause);
  }

  @AfterEach
  void tearDown() {
    pipeline.shutdown();
  }

  private ObjectNode message(String id, String from, String text) {
    ObjectNode raw = mapper.createObjectNode();
    raw.putObject("key").put("remoteJid", from).put("id", id).put("fromMe", false);
    raw.putObject("message").put("conversation", text);
    raw.put("messageTimestamp", NOW.getEpochSecond());
    return raw;
  }

  private List<DispatchResult> reply(String text) {
    JsonNode body = mapper.createObjectNode().put(InboundMessagePipeline.REPLY_FIELD, text);
    return List.of(DispatchResult.success("http://hook", 200, body));
  }

  @Nested
  @DisplayName("Relaying a message")
  class Relay {

    @Test
    @DisplayName("typing indicator wraps the webhook call and the reply goes out last")
    void fullSequence() {
      when(dispatcher.dispatchAndCollect(any())).thenReturn(reply("pong"));

      pipeline.processBatch(GEN, List.of(message("M1", LEGACY_CHAT, "ping")));

      InOrder order = inOrder(client, dispatcher, pause, outbound);
      order.verify(client).sendPresenceUpdate(Presence.COMPOSING, CHAT);
      order.verify(dispatcher).dispatchAndCollect(any(InboundWebhookPayload.class));
      order.verify(client).readMessages(anyList());
      order.verify(pause).sleep(any(Duration.class));
      order.verify(client).sendPresenceUpdate(Presence.PAUSED, CHAT);
      order.verify(pause).sleep(Duration.ofMillis(250));
      order.verify(outbound).sendText(LEGACY_CHAT, "pong");
    }

    @Test
    @DisplayName("payload carries sender, text and message id")
    void payloadShape() {
      when(dispatcher.dispatchAndCollect(any())).thenReturn(List.of());

      pipeline.processBatch(GEN, List.of(message("M1", CHAT, "hello")));

      verify(dispatcher)
          .dispatchAndCollect(
              new InboundWebhookPayload(CHAT, "", "text", "hello", null, "M1", null));
    }

    @Test
    @DisplayName("no reply means no outbound message but presence still settles")
    void noReply() {
      when(dispatcher.dispatchAndCollect(any()))
          .thenReturn(List.of(DispatchResult.failed("http://hook", 500)));

      pipeline.processBatch(GEN, List.of(message("M1", CHAT, "ping")));

      verify(client).sendPresenceUpdate(Presence.PAUSED, CHAT);
      verify(outbound, never()).sendText(anyString(), anyString());
    }

    @Test
    @DisplayName("nothing is relayed without subscribers")
    void noSubscribers() {
      when(dispatcher.hasSubscribers()).thenReturn(false);

      pipeline.processBatch(GEN, List.of(message("M1", CHAT, "ping")));

      verify(dispatcher, never()).dispatchAndCollect(any());
      verify(client, never()).sendPresenceUpdate(any(), anyString());
    }

    @Test
    @DisplayName("a failing message does not stop the rest of the batch")
    void failureIsolated() {
      when(dispatcher.dispatchAndCollect(any()))
          .thenThrow(new IllegalStateException("boom"))
          .thenReturn(reply("second"));

      pipeline.processBatch(
          GEN, List.of(message("M1", CHAT, "first"), message("M2", CHAT, "second")));

      verify(outbound).sendText(CHAT, "second");
    }

    @Test
    @DisplayName("a batch queued before a session restart never touches the new handle")
    void supersededBatchDropped() {
      TransportSession next = mock(TransportSession.class);
      when(session.sessionFor(GEN)).thenReturn(Optional.empty());
      when(session.sessionFor(GEN + 1)).thenReturn(Optional.of(next));
      when(session.requireSession()).thenReturn(next);

      pipeline.processBatch(GEN, List.of(message("M1", CHAT, "ping"), message("M2", CHAT, "x")));

      verifyNoInteractions(client, next, outbound);
      verify(dispatcher, never()).dispatchAndCollect(any());
    }

    @Test
    @DisplayName("a reply is not sent once the session restarted mid-relay")
    void replyDroppedAfterRestart() {
      when(dispatcher.dispatchAndCollect(any())).thenReturn(reply("pong"));
      when(session.sessionFor(GEN)).thenReturn(Optional.of(client), Optional.empty());

      pipeline.processBatch(GEN, List.of(message("M1", CHAT, "ping")));

      verify(client).sendPresenceUpdate(Presence.PAUSED, CHAT);
      verify(outbound, never()).sendText(anyString(), anyString());
    }

    @Test
    @DisplayName("a reply of only whitespace is still sent")
    void whitespaceReplySent() {
      when(dispatcher.dispatchAndCollect(any())).thenReturn(reply(" "));

      pipeline.processBatch(GEN, List.of(message("M1", CHAT, "ping")));

      verify(outbound).sendText(CHAT, " ");
    }

    @Test
    @DisplayName("a failed read receipt does not block the reply")
    void readFailureIgnored() {
      when(dispatcher.dispatchAndCollect(any())).thenReturn(reply("pong"));
      doThrow(new IllegalStateException("read failed")).when(client).readMessages(anyList());

      pipeline.processBatch(GEN, List.of(message("M1", CHAT, "ping")));

      verify(outbound).sendText(CHAT, "pong");
    }
  }

  @Nested
  @DisplayName("Queue")
  class Queue {

    @Test
    @DisplayName("batches are processed one at a time in arrival order")
    void fifo() throws Exception {
      List<String> seen = new CopyOnWriteArrayList<>();
      CountDownLatch done = new CountDownLatch(3);
      when(dispatcher.dispatchAndCollect(any()))
          .thenAnswer(
              inv -> {
                seen.add(((InboundWebhookPayload) inv.getArgument(0)).messageId());
                done.countDown();
                return List.of();
              });

      pipeline.onMessages(GEN, List.of(message("A", CHAT, "1"), message("B", CHAT, "2")));
      pipeline.onMessages(GEN, List.of(message("C", CHAT, "3")));

      assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
      assertThat(seen).containsExactly("A", "B", "C");
    }

    @Test
    @DisplayName("calls are rejected and announced to subscribers")
    void callRejected() {
      JsonNode call = mapper.createObjectNode().put("id", "CALL1").put("from", CHAT);

      pipeline.onCall(GEN, call);

      verify(client).rejectCall("CALL1", CHAT);
      verify(dispatcher, timeout(5000)).broadcast(Map.of("call", call));
    }

    @Test
    @DisplayName("a call from a superseded session is not rejected on the new handle")
    void staleCallNotRejected() {
      TransportSession next = mock(TransportSession.class);
      when(session.sessionFor(GEN)).thenReturn(Optional.empty());
      when(session.requireSession()).thenReturn(next);
      JsonNode call = mapper.createObjectNode().put("id", "CALL1").put("from", CHAT);

      pipeline.onCall(GEN, call);

      verifyNoInteractions(client, next);
      verify(dispatcher, timeout(5000)).broadcast(Map.of("call", call));
    }

    @Test
    @DisplayName("history sync goes to the snapshot store")
    void historyStored() {
      JsonNode history = mapper.createObjectNode();

      pipeline.onHistorySync(history);

      verify(snapshots).append(history);
    }
  }

  @Test
  void firstReplySkipsFailuresAndEmptyReplies() {
    List<DispatchResult> results =
        List.of(
            DispatchResult.failed("http://a", null),
            DispatchResult.success("http://b", 200, mapper.createObjectNode().put("msg", "")),
            DispatchResult.success("http://c", 200, null),
            DispatchResult.success("http://d", 200, mapper.createObjectNode().put("msg", "ok")),
            DispatchResult.success("http://e", 200, mapper.createObjectNode().put("msg", "late")));

    assertThat(InboundMessagePipeline.firstReply(results)).isEqualTo("ok");
  }
}

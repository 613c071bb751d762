package com.warelay.whatsapprelay.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warelay.whatsapprelay.model.ReadMessagesRequest;
import com.warelay.whatsapprelay.model.ReadMessagesResponse;
import com.warelay.whatsapprelay.session.SessionConnectionManager;
import com.warelay.whatsapprelay.store.ChatSnapshotStore;
import com.warelay.whatsapprelay.transport.ConnectionClosedException;
import com.warelay.whatsapprelay.transport.MessageKey;
import com.warelay.whatsapprelay.transport.Presence;
import com.warelay.whatsapprelay.transport.TransportException;
import com.warelay.whatsapprelay.transport.TransportSession;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class ChatOperationsServiceTest {

  private static final String CHAT = "15551234567@s.whatsapp.net";

  private final ObjectMapper mapper = new ObjectMapper();
  private SessionConnectionManager session;
  private TransportSession client;
  private ChatSnapshotStore snapshots;
  private ChatOperationsService service;

  @BeforeEach
  void setUp() {
    session = mock(SessionConnectionManager.class);
    client = mock(TransportSession.class);
    snapshots = mock(ChatSnapshotStore.class);
    when(session.requireSession()).thenReturn(client);
    service = new ChatOperationsService(session, snapshots);
  }

  @Nested
  @DisplayName("simulatePresence")
  class SimulatePresence {

    @Test
    @DisplayName("announces availability, subscribes, then sends the action")
    void sequence() {
      assertThat(service.simulatePresence("15551234567@c.us", "recording")).isTrue();

      InOrder order = inOrder(client);
      order.verify(client).sendPresenceUpdate(Presence.AVAILABLE, CHAT);
      order.verify(client).presenceSubscribe(CHAT);
      order.verify(client).sendPresenceUpdate(Presence.RECORDING, CHAT);
    }

    @Test
    @DisplayName("unknown actions are ignored")
    void unknownAction() {
      assertThat(service.simulatePresence(CHAT, "dancing")).isFalse();

      verify(client, never()).sendPresenceUpdate(any(), any());
    }

    @Test
    @DisplayName("transport failures are absorbed")
    void failureAbsorbed() {
      doThrow(new TransportException("down")).when(client).presenceSubscribe(CHAT);

      assertThat(service.simulatePresence(CHAT, "composing")).isFalse();
    }
  }

  @Nested
  @DisplayName("readMessages")
  class ReadMessages {

    @Test
    @DisplayName("incomplete keys are discarded and presence goes to the first chat")
    void filtersKeys() {
      MessageKey good = new MessageKey(CHAT, "M1", false, null);
      MessageKey noId = new MessageKey(CHAT, null, false, null);
      MessageKey noChat = new MessageKey(" ", "M2", false, null);

      ReadMessagesResponse response =
          service.readMessages(
              new ReadMessagesRequest(Arrays.asList(good, noId, noChat, null), "paused", null));

      assertThat(response.read()).isEqualTo(1);
      assertThat(response.keys()).containsExactly(good);
      InOrder order = inOrder(client);
      order.verify(client).readMessages(List.of(good));
      order.verify(client).sendPresenceUpdate(Presence.AVAILABLE, CHAT);
      order.verify(client).presenceSubscribe(CHAT);
      order.verify(client).sendPresenceUpdate(Presence.PAUSED, CHAT);
    }

    @Test
    @DisplayName("nothing to read means no transport call")
    void nothingToRead() {
      assertThat(service.readMessages(new ReadMessagesRequest(List.of(), null, null)).read())
          .isZero();

      verify(client, never()).readMessages(anyList());
    }

    @Test
    @DisplayName("without a session nothing is read")
    void noSession() {
      when(session.requireSession()).thenThrow(new ConnectionClosedException("closed"));

      MessageKey key = new MessageKey(CHAT, "M1", false, null);

      ReadMessagesResponse response =
          service.readMessages(new ReadMessagesRequest(List.of(key), null, null));

      assertThat(response.read()).isZero();
    }
  }

  @Test
  void profileLookups() {
    JsonNode status = mapper.createObjectNode().put("status", "busy");
    when(client.fetchStatus(CHAT)).thenReturn(status);
    when(client.profilePictureUrl(CHAT)).thenReturn("https://pps.example/pic.jpg");

    assertThat(service.profileStatus(CHAT)).containsEntry("status", status);
    assertThat(service.profilePicture(CHAT)).containsEntry("url", "https://pps.example/pic.jpg");
  }

  @Test
  void profileLookupFailuresGiveEmptyResults() {
    when(client.fetchStatus(CHAT)).thenThrow(new TransportException("not authorized"));
    when(client.profilePictureUrl(CHAT)).thenThrow(new TransportException("item-not-found"));

    assertThat(service.profileStatus(CHAT)).isEmpty();
    assertThat(service.profilePicture(CHAT)).isEmpty();
  }

  @Test
  void resolveNumberStripsFormatting() {
    JsonNode found = mapper.createObjectNode().put("jid", CHAT).put("exists", true);
    when(client.resolveId("15551234567")).thenReturn(found);

    assertThat(service.resolveNumber("+1 (555) 123-4567")).isEqualTo(found);
    assertThat(service.resolveNumber("abc").isEmpty()).isTrue();
  }

  @Test
  void listsComeFromTheSnapshot() {
    List<JsonNode> chats = List.of(mapper.createObjectNode().put("id", CHAT));
    when(snapshots.chats()).thenReturn(chats);

    assertThat(service.listChats()).isEqualTo(chats);
  }
}

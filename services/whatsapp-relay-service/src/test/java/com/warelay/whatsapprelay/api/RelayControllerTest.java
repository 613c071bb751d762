package com.warelay.whatsapprelay.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.warelay.whatsapprelay.chat.ChatOperationsService;
import com.warelay.whatsapprelay.model.MessageRequest;
import com.warelay.whatsapprelay.outbound.OutboundMessageService;
import com.warelay.whatsapprelay.session.ConnectionHealth;
import com.warelay.whatsapprelay.session.EnsureConnectedResult;
import com.warelay.whatsapprelay.session.RecoveryAction;
import com.warelay.whatsapprelay.session.SessionConnectionManager;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(RelayController.class)
class RelayControllerTest {

  @Autowired MockMvc mvc;

  @MockBean SessionConnectionManager session;
  @MockBean SessionEventStream events;
  @MockBean OutboundMessageService outbound;
  @MockBean ChatOperationsService chats;

  @Test
  void healthReportsWithoutRecovering() throws Exception {
    when(session.health()).thenReturn(new ConnectionHealth(false, false, false, false, null));

    mvc.perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.alive").value(false))
        .andExpect(jsonPath("$.hasClient").value(false));
  }

  @Test
  void healthWithRecoverCallsEnsureConnected() throws Exception {
    ConnectionHealth health = new ConnectionHealth(false, false, true, false, null);
    when(session.ensureConnected())
        .thenReturn(EnsureConnectedResult.of(health, RecoveryAction.START_CALLED));

    mvc.perform(get("/health").param("recover", "true"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.action").value("start_called"));
  }

  @Test
  void messageIsHandedToOutbound() throws Exception {
    when(outbound.send(any(MessageRequest.class)))
        .thenReturn(JsonNodeFactory.instance.objectNode().put("id", "OUT1"));

    mvc.perform(
            post("/message")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"chatId\":\"1555@s.whatsapp.net\",\"text\":\"hi\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value("OUT1"));
    ArgumentCaptor<MessageRequest> sent = ArgumentCaptor.forClass(MessageRequest.class);
    verify(outbound).send(sent.capture());
    assertThat(sent.getValue().chatId()).isEqualTo("1555@s.whatsapp.net");
    assertThat(sent.getValue().text()).isEqualTo("hi");
  }

  @Test
  void indexServesQrPageAndStartsSession() throws Exception {
    mvc.perform(get("/"))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_HTML));
    verify(session).startAsync();
  }
}

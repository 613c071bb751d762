package com.warelay.whatsapprelay.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.warelay.whatsapprelay.chat.ChatOperationsService;
import com.warelay.whatsapprelay.model.MessageRequest;
import com.warelay.whatsapprelay.model.ReadMessagesRequest;
import com.warelay.whatsapprelay.model.ReadMessagesResponse;
import com.warelay.whatsapprelay.model.SimulateRequest;
import com.warelay.whatsapprelay.outbound.OutboundMessageService;
import com.warelay.whatsapprelay.session.SessionConnectionManager;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/** Pairing page, session control and chat operations. */
@RestController
public class RelayController {

  private static final Resource QR_PAGE = new ClassPathResource("static/qr.html");

  private final SessionConnectionManager session;
  private final SessionEventStream events;
  private final OutboundMessageService outbound;
  private final ChatOperationsService chats;

  public RelayController(
      SessionConnectionManager session,
      SessionEventStream events,
      OutboundMessageService outbound,
      ChatOperationsService chats) {
    this.session = session;
    this.events = events;
    this.outbound = outbound;
    this.chats = chats;
  }

  /** Serves the QR page and kicks off a session start; progress arrives over {@code /sse}. */
  @GetMapping(value = "/", produces = MediaType.TEXT_HTML_VALUE)
  public Resource index() {
    session.startAsync();
    return QR_PAGE;
  }

  @GetMapping(value = "/sse", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public SseEmitter sse() {
    return events.subscribe();
  }

  @PostMapping("/message")
  public JsonNode send(@RequestBody MessageRequest request) {
    return outbound.send(request);
  }

  @PostMapping("/simulate")
  public Map<String, Object> simulate(@Valid @RequestBody SimulateRequest request) {
    return Map.of("ok", chats.simulatePresence(request.chatId(), request.action()));
  }

  @PostMapping("/messages/read")
  public ReadMessagesResponse read(@RequestBody ReadMessagesRequest request) {
    return chats.readMessages(request);
  }

  @GetMapping("/profile/status/{chatId}")
  public Map<String, Object> profileStatus(@PathVariable String chatId) {
    return chats.profileStatus(chatId);
  }

  @GetMapping("/profile/picture/{chatId}")
  public Map<String, Object> profilePicture(@PathVariable String chatId) {
    return chats.profilePicture(chatId);
  }

  @GetMapping("/chats")
  public List<JsonNode> listChats() {
    return chats.listChats();
  }

  @GetMapping("/contacts")
  public List<JsonNode> listContacts() {
    return chats.listContacts();
  }

  @GetMapping("/number/{numberId}")
  public JsonNode resolveNumber(@PathVariable String numberId) {
    return chats.resolveNumber(numberId);
  }

  @GetMapping("/logout")
  public Map<String, Object> logout() {
    session.logout();
    return Map.of("ok", true);
  }

  /** Connection health; with {@code recover=true} a dead session is restarted first. */
  @GetMapping("/health")
  public Object health(@RequestParam(defaultValue = "false") boolean recover) {
    return recover ? session.ensureConnected() : session.health();
  }
}

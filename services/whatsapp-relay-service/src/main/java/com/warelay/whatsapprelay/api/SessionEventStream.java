package com.warelay.whatsapprelay.api;

import com.warelay.whatsapprelay.session.SessionStatusEvent;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/** Fans session status events out to the open status pages. New pages get the latest event. */
@Component
@Slf4j
public class SessionEventStream {

  /** Status pages stay subscribed until the browser goes away. */
  static final long NO_TIMEOUT = 0L;

  private final List<SseEmitter> emitters = new CopyOnWriteArrayList<>();
  private volatile SessionStatusEvent latest;

  public SseEmitter subscribe() {
    SseEmitter emitter = new SseEmitter(NO_TIMEOUT);
    emitter.onCompletion(() -> emitters.remove(emitter));
    emitter.onTimeout(() -> emitters.remove(emitter));
    emitter.onError(e -> emitters.remove(emitter));
    emitters.add(emitter);

    SessionStatusEvent last = latest;
    if (last != null) {
      send(emitter, last);
    }
    return emitter;
  }

  @EventListener
  public void onStatus(SessionStatusEvent event) {
    latest = event;
    for (SseEmitter emitter : emitters) {
      send(emitter, event);
    }
  }

  int subscribers() {
    return emitters.size();
  }

  private void send(SseEmitter emitter, SessionStatusEvent event) {
    try {
      emitter.send(SseEmitter.event().name("status").data(event));
    } catch (IOException | IllegalStateException e) {
      log.debug("Dropping status subscriber: {}", e.getMessage());
      emitters.remove(emitter);
      emitter.completeWithError(e);
    }
  }
}

package com.warelay.whatsapprelay.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.warelay.whatsapprelay.session.SessionStatusEvent;
import org.junit.jupiter.api.Test;

class SessionEventStreamTest {

  @Test
  void everySubscriberIsTracked() {
    SessionEventStream stream = new SessionEventStream();

    stream.subscribe();
    stream.subscribe();

    assertThat(stream.subscribers()).isEqualTo(2);
  }

  @Test
  void latestEventIsReplayedToNewSubscribers() {
    SessionEventStream stream = new SessionEventStream();
    stream.onStatus(SessionStatusEvent.qr("2@abc"));

    // Emitters created outside a request buffer early sends until the handler attaches.
    assertThat(stream.subscribe()).isNotNull();
    assertThat(stream.subscribers()).isEqualTo(1);
  }
}

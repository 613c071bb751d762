package com.warelay.whatsapprelay.session;

import static org.assertj.core.api.Assertions.assertThat;

import com.warelay.whatsapprelay.transport.DisconnectInfo;
import org.junit.jupiter.api.Test;

class DisconnectClassifierTest {

  @Test
  void loggedOutIsPermanent() {
    assertThat(DisconnectClassifier.classify(new DisconnectInfo(401, "Connection Failure")))
        .isEqualTo(DisconnectKind.PERMANENT);
  }

  @Test
  void expiredPairingIsPermanent() {
    assertThat(DisconnectClassifier.classify(new DisconnectInfo(null, "QR refs attempts ended")))
        .isEqualTo(DisconnectKind.PERMANENT);
  }

  @Test
  void everythingElseIsTransient() {
    assertThat(DisconnectClassifier.classify(new DisconnectInfo(515, "Stream Errored")))
        .isEqualTo(DisconnectKind.TRANSIENT);
    assertThat(DisconnectClassifier.classify(new DisconnectInfo(null, null)))
        .isEqualTo(DisconnectKind.TRANSIENT);
    assertThat(DisconnectClassifier.classify(null)).isEqualTo(DisconnectKind.TRANSIENT);
  }
}

package com.warelay.whatsapprelay.session;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.warelay.whatsapprelay.config.RelayProperties;
import com.warelay.whatsapprelay.store.CredentialStore;
import com.warelay.whatsapprelay.transport.TransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

class SessionBootstrapTest {

  private SessionConnectionManager session;
  private CredentialStore credentials;
  private SessionBootstrap bootstrap;

  @BeforeEach
  void setUp() {
    session = mock(SessionConnectionManager.class);
    credentials = mock(CredentialStore.class);
    bootstrap = new SessionBootstrap(session, credentials, RelayProperties.defaults());
  }

  @Test
  void savedSessionIsRestored() {
    when(credentials.hasSavedSession()).thenReturn(true);

    bootstrap.run(new DefaultApplicationArguments());

    verify(session).start();
    verify(session).startMaintenance();
  }

  @Test
  void withoutSavedSessionOnlyTimersAreArmed() {
    bootstrap.run(new DefaultApplicationArguments());

    verify(session, never()).start();
    verify(session).startMaintenance();
  }

  @Test
  void failedRestoreStillArmsTimers() {
    when(credentials.hasSavedSession()).thenReturn(true);
    doThrow(new TransportException("offline")).when(session).start();

    bootstrap.run(new DefaultApplicationArguments());

    verify(session).startMaintenance();
  }
}

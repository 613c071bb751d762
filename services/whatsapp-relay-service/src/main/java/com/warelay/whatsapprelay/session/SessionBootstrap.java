package com.warelay.whatsapprelay.session;

import com.warelay.whatsapprelay.config.RelayProperties;
import com.warelay.whatsapprelay.store.CredentialStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Reconnects a previously paired session on boot and arms the maintenance timers. Without saved
 * credentials the session waits for someone to open the QR page.
 */
@Component
@Order(1)
@Slf4j
public class SessionBootstrap implements ApplicationRunner {

  private final SessionConnectionManager session;
  private final CredentialStore credentials;
  private final RelayProperties.Session props;

  public SessionBootstrap(
      SessionConnectionManager session, CredentialStore credentials, RelayProperties properties) {
    this.session = session;
    this.credentials = credentials;
    this.props = properties.session();
  }

  @Override
  public void run(ApplicationArguments args) {
    if (props.autoStart() && credentials.hasSavedSession()) {
      log.info("Saved session found; connecting");
      try {
        session.start();
      } catch (RuntimeException e) {
        log.error("Failed to restore saved session", e);
      }
    } else {
      log.info("No saved session; open the QR page to pair a device");
    }
    session.startMaintenance();
  }
}

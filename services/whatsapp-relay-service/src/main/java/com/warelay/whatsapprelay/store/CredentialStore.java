package com.warelay.whatsapprelay.store;

import com.fasterxml.jackson.databind.JsonNode;

/** Persists the pairing credentials of the single session. */
public interface CredentialStore {

  boolean hasSavedSession();

  /** Returns the saved credentials, or an empty object node when none exist. */
  JsonNode load();

  void save(JsonNode credentials);
}

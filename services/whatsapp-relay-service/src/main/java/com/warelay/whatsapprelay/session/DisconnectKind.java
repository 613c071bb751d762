package com.warelay.whatsapprelay.session;

public enum DisconnectKind {
  /** Network drop; retried on the backoff schedule. */
  TRANSIENT,
  /** Logged out or pairing abandoned; a new QR scan is required. */
  PERMANENT
}

package com.warelay.whatsapprelay.session;

import com.warelay.whatsapprelay.transport.DisconnectInfo;

public final class DisconnectClassifier {

  /** Status the network uses when the linked device was removed. */
  static final int LOGGED_OUT_STATUS = 401;

  /** Raised when nobody scanned any of the offered QR codes. */
  static final String QR_ATTEMPTS_ENDED = "QR refs attempts ended";

  private DisconnectClassifier() {}

  public static DisconnectKind classify(DisconnectInfo info) {
    if (info == null) {
      return DisconnectKind.TRANSIENT;
    }
    if (info.statusCode() != null && info.statusCode() == LOGGED_OUT_STATUS) {
      return DisconnectKind.PERMANENT;
    }
    if (QR_ATTEMPTS_ENDED.equals(info.message())) {
      return DisconnectKind.PERMANENT;
    }
    return DisconnectKind.TRANSIENT;
  }
}

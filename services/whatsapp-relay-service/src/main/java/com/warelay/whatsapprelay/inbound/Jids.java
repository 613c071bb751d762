package com.warelay.whatsapprelay.inbound;

/** Helpers for network addresses ("jids") such as {@code 15551234567@s.whatsapp.net}. */
public final class Jids {

  static final String LEGACY_USER_SUFFIX = "@c.us";
  static final String USER_SUFFIX = "@s.whatsapp.net";

  private Jids() {}

  /** Rewrites the legacy {@code @c.us} suffix; presence calls only accept the native form. */
  public static String normalize(String jid) {
    if (jid == null) {
      return "";
    }
    if (jid.endsWith(LEGACY_USER_SUFFIX)) {
      return jid.substring(0, jid.length() - LEGACY_USER_SUFFIX.length()) + USER_SUFFIX;
    }
    return jid;
  }

  /** Status updates, broadcast lists and newsletters. */
  public static boolean isBroadcastOrigin(String jid) {
    if (jid == null) {
      return false;
    }
    return jid.endsWith("@broadcast") || jid.endsWith("@newsletter");
  }
}

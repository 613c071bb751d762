package com.warelay.whatsapprelay.transport.content;

public enum ContentType {
  TEXT,
  MEDIA,
  LOCATION,
  POLL,
  CONTACT
}

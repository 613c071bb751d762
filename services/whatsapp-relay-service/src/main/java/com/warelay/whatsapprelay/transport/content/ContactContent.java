package com.warelay.whatsapprelay.transport.content;

import java.util.List;

public record ContactContent(String displayName, List<String> vcards) implements MessageContent {
  @Override
  public ContentType type() {
    return ContentType.CONTACT;
  }
}

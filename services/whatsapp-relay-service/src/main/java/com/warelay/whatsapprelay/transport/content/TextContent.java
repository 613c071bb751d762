package com.warelay.whatsapprelay.transport.content;

public record TextContent(String text) implements MessageContent {
  @Override
  public ContentType type() {
    return ContentType.TEXT;
  }
}

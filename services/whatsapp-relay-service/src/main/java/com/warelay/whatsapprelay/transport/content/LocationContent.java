package com.warelay.whatsapprelay.transport.content;

public record LocationContent(
    String name, String address, String url, Double degreesLatitude, Double degreesLongitude)
    implements MessageContent {
  @Override
  public ContentType type() {
    return ContentType.LOCATION;
  }
}

package com.warelay.whatsapprelay.transport.content;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** Protocol-level content handed to {@code TransportSession#send}. */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.EXISTING_PROPERTY,
    property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = TextContent.class, name = "TEXT"),
  @JsonSubTypes.Type(value = MediaContent.class, name = "MEDIA"),
  @JsonSubTypes.Type(value = LocationContent.class, name = "LOCATION"),
  @JsonSubTypes.Type(value = PollContent.class, name = "POLL"),
  @JsonSubTypes.Type(value = ContactContent.class, name = "CONTACT")
})
public interface MessageContent {
  ContentType type();
}

package com.warelay.whatsapprelay.model;

import com.warelay.whatsapprelay.transport.MessageKey;
import java.util.List;

public record ReadMessagesResponse(int read, List<MessageKey> keys) {

  public static ReadMessagesResponse none() {
    return new ReadMessagesResponse(0, List.of());
  }
}

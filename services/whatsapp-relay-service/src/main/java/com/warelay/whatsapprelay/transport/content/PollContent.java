package com.warelay.whatsapprelay.transport.content;

import java.util.List;

/** {@code selectableCount} 0 means any number of options may be picked. */
public record PollContent(String name, List<String> values, int selectableCount)
    implements MessageContent {
  @Override
  public ContentType type() {
    return ContentType.POLL;
  }
}

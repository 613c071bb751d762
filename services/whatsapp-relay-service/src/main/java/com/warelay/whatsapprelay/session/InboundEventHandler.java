package com.warelay.whatsapprelay.session;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Receives the inbound events of the current session generation only. Implementations must not
 * block the calling transport thread for long.
 *
 * <p>Work deferred past the callback must borrow the handle through {@link
 * SessionConnectionManager#sessionFor(long)} with the generation it was given, so it never runs
 * on a later handle.
 */
public interface InboundEventHandler {

  void onMessages(long generation, List<JsonNode> messages);

  void onCall(long generation, JsonNode call);

  void onHistorySync(JsonNode history);
}

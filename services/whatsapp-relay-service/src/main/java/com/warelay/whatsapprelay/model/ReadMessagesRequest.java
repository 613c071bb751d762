package com.warelay.whatsapprelay.model;

import com.warelay.whatsapprelay.transport.MessageKey;
import java.util.List;

/**
 * @param presence optional presence code sent after marking the messages read
 * @param jid chat for the presence update; defaults to the chat of the first key
 */
public record ReadMessagesRequest(List<MessageKey> keys, String presence, String jid) {}

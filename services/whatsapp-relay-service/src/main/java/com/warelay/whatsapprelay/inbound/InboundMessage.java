package com.warelay.whatsapprelay.inbound;

import java.time.Instant;

/**
 * Inbound message that passed every filter.
 *
 * @param remoteId chat the message arrived in, as reported by the network
 * @param participantId author inside a group chat, null for direct chats
 * @param timestamp null when the network did not send one
 * @param replyToMessageId id of the quoted message, null when none
 */
public record InboundMessage(
    String remoteId,
    boolean selfOriginated,
    String participantId,
    String messageId,
    Instant timestamp,
    String pushName,
    MessageBody body,
    String replyToMessageId) {}

package com.warelay.whatsapprelay.inbound;

/** Classified content of an inbound message: {@link TextBody} or {@link MediaBody}. */
public interface MessageBody {}

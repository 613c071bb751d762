package com.warelay.whatsapprelay.inbound;

public record TextBody(String content) implements MessageBody {}

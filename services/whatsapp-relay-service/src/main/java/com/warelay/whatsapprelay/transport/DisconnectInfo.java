package com.warelay.whatsapprelay.transport;

/** Last disconnect reported by the transport; both fields may be null. */
public record DisconnectInfo(Integer statusCode, String message) {}

package com.warelay.whatsapprelay.transport;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessageKey(String remoteJid, String id, boolean fromMe, String participant) {}

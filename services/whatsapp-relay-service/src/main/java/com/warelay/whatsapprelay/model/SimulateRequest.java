package com.warelay.whatsapprelay.model;

import jakarta.validation.constraints.NotBlank;

/** @param action presence code: unavailable, available, composing, recording or paused */
public record SimulateRequest(@NotBlank String chatId, @NotBlank String action) {}

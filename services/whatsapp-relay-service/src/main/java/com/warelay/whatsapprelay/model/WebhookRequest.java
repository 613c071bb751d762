package com.warelay.whatsapprelay.model;

import jakarta.validation.constraints.NotBlank;

public record WebhookRequest(@NotBlank String url) {}

package com.warelay.whatsapprelay.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warelay.whatsapprelay.config.RelayProperties;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * Posts JSON payloads to every registered subscriber, one after another in registration order.
 * A failing subscriber never prevents delivery to the others.
 */
@Service
@Slf4j
public class WebhookDispatcher {

  private final RestClient rest;
  private final WebhookRegistry registry;
  private final ObjectMapper mapper;
  private final String bearerToken;

  public WebhookDispatcher(
      @Qualifier("webhookRestClient") RestClient rest,
      WebhookRegistry registry,
      ObjectMapper mapper,
      RelayProperties properties) {
    this.rest = rest;
    this.registry = registry;
    this.mapper = mapper;
    this.bearerToken = properties.webhook().bearerToken();
  }

  public boolean hasSubscribers() {
    return !registry.list().isEmpty();
  }

  /** Fire-and-forget delivery; responses are not examined. */
  public void broadcast(Object payload) {
    for (String url : registry.list()) {
      try {
        rest.post()
            .uri(URI.create(url))
            .contentType(MediaType.APPLICATION_JSON)
            .headers(this::applyAuth)
            .body(payload)
            .retrieve()
            .toBodilessEntity();
      } catch (Exception e) {
        log.warn("Webhook broadcast to {} failed: {}", url, e.getMessage());
      }
    }
  }

  /** Delivers to every subscriber and returns one result per subscriber, in registry order. */
  public List<DispatchResult> dispatchAndCollect(Object payload) {
    List<String> urls = registry.list();
    List<DispatchResult> results = new ArrayList<>(urls.size());
    for (String url : urls) {
      results.add(post(url, payload));
    }
    return results;
  }

  private DispatchResult post(String url, Object payload) {
    try {
      ResponseEntity<String> response =
          rest.post()
              .uri(URI.create(url))
              .contentType(MediaType.APPLICATION_JSON)
              .accept(MediaType.APPLICATION_JSON)
              .headers(this::applyAuth)
              .body(payload)
              .retrieve()
              .toEntity(String.class);
      return DispatchResult.success(
          url, response.getStatusCode().value(), parse(url, response.getBody()));
    } catch (RestClientResponseException e) {
      log.warn("Webhook {} answered {}: {}", url, e.getStatusCode().value(), e.getMessage());
      return DispatchResult.failed(url, e.getStatusCode().value());
    } catch (Exception e) {
      log.warn("Webhook {} unreachable: {}", url, e.getMessage());
      return DispatchResult.failed(url, null);
    }
  }

  private JsonNode parse(String url, String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      return mapper.readTree(body);
    } catch (Exception e) {
      log.debug("Webhook {} returned a non-JSON body", url);
      return null;
    }
  }

  private void applyAuth(HttpHeaders headers) {
    if (!bearerToken.isEmpty()) {
      headers.setBearerAuth(bearerToken);
    }
  }
}

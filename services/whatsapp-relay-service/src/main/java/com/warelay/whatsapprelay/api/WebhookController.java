package com.warelay.whatsapprelay.api;

import com.warelay.whatsapprelay.model.WebhookRequest;
import com.warelay.whatsapprelay.webhook.WebhookRegistry;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Subscriber management. Indexes in paths are 1-based, as shown to users. */
@RestController
@RequestMapping("/webhooks")
public class WebhookController {

  private final WebhookRegistry registry;

  public WebhookController(WebhookRegistry registry) {
    this.registry = registry;
  }

  @GetMapping
  public List<String> list() {
    return registry.list();
  }

  @PostMapping
  public Map<String, Object> add(@Valid @RequestBody WebhookRequest request) {
    boolean added = registry.insert(request.url());
    return Map.of("added", added, "webhooks", registry.list());
  }

  @DeleteMapping("/{index}")
  public Map<String, Object> delete(@PathVariable int index) {
    String removed = registry.delete(index - 1);
    return Map.of("removed", removed, "webhooks", registry.list());
  }
}

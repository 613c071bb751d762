package com.warelay.whatsapprelay.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class WebhookClientConfig {

  @Bean
  public RestClient webhookRestClient(RestClient.Builder builder, RelayProperties properties) {
    SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(properties.webhook().timeout());
    factory.setReadTimeout(properties.webhook().timeout());
    return builder.requestFactory(factory).build();
  }
}

package com.warelay.whatsapprelay.config;

import com.warelay.whatsapprelay.transport.TransportConnector;
import com.warelay.whatsapprelay.transport.UnavailableTransportConnector;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TransportConfig {

  @Bean
  @ConditionalOnMissingBean(TransportConnector.class)
  public TransportConnector transportConnector() {
    return new UnavailableTransportConnector();
  }
}

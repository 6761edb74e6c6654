package com.github.spud.intake.application.config;

import com.github.spud.intake.infrastructure.ams360.TicketCache;
import java.time.Clock;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Outbound clients for the agency management system and the CRM
 */
@Configuration
public class IntakeClientConfig {

  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }

  @Bean
  public RestClient ams360RestClient(Ams360Properties properties) {
    return RestClient.builder()
      .requestFactory(requestFactory(properties.getTimeout()))
      .build();
  }

  @Bean
  public TicketCache ams360TicketCache(Clock clock, Ams360Properties properties) {
    return new TicketCache(clock, properties.getTicketTtl());
  }

  @Bean
  public RestClient agencyZoomRestClient(AgencyZoomProperties properties) {
    return RestClient.builder()
      .requestFactory(requestFactory(properties.getTimeout()))
      .build();
  }

  private static SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
    SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(timeout);
    factory.setReadTimeout(timeout);
    return factory;
  }
}

package com.ospicorp.priceapi.config;

import java.time.Clock;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.web.client.RestTemplate;

@Configuration
@EnableScheduling
public class ApplicationConfig {

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  RestTemplate restTemplate(RestTemplateBuilder builder,
      @Value("${pricing.weather.timeout:10s}") Duration timeout) {
    return builder
        .setConnectTimeout(timeout)
        .setReadTimeout(timeout)
        .build();
  }
}

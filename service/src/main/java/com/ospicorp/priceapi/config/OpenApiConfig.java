package com.ospicorp.priceapi.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI apiInfo(PricingProperties properties) {
    return new OpenAPI()
        .info(new Info()
            .title("Commodity Price Estimation API")
            .version("v1")
            .description("Distance-weighted, smoothed per-kg price estimates ("
                + properties.units() + ") with calibrated confidence ranges")
            .contact(new Contact().name("Market Data Team").email("api-support@example.com")))
        .servers(List.of(new Server().url("/")));
  }
}

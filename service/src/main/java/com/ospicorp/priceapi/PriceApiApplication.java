package com.ospicorp.priceapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PriceApiApplication {

  public static void main(String[] args) {
    SpringApplication.run(PriceApiApplication.class, args);
  }
}

package com.market.intel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MarketIntelApplication {

  public static void main(String[] args) {
    SpringApplication.run(MarketIntelApplication.class, args);
  }
}

package com.launchbot.hft;

import com.launchbot.hft.config.HftProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(HftProperties.class)
public class StrategyServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(StrategyServiceApplication.class, args);
  }
}

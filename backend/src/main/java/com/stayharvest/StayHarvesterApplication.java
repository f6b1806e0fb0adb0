package com.stayharvest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class StayHarvesterApplication {

  public static void main(String[] args) {
    SpringApplication.run(StayHarvesterApplication.class, args);
  }
}

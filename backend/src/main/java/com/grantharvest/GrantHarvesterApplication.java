package com.grantharvest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GrantHarvesterApplication {

  public static void main(String[] args) {
    SpringApplication.run(GrantHarvesterApplication.class, args);
  }
}

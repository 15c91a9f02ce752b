package com.ivyintel.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class IvyIntelTrackerApplication {

  public static void main(String[] args) {
    SpringApplication.run(IvyIntelTrackerApplication.class, args);
  }
}

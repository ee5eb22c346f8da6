package com.apisite.checker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ApiSiteCheckerApplication {

  public static void main(String[] args) {
    SpringApplication.run(ApiSiteCheckerApplication.class, args);
  }
}

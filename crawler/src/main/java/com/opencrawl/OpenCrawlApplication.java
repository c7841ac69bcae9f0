package com.opencrawl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class OpenCrawlApplication {

  public static void main(String[] args) {
    SpringApplication.run(OpenCrawlApplication.class, args);
  }
}

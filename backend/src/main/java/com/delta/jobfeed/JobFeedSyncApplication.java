package com.delta.jobfeed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JobFeedSyncApplication {

  public static void main(String[] args) {
    SpringApplication.run(JobFeedSyncApplication.class, args);
  }
}

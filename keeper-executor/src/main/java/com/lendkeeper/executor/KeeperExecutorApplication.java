package com.lendkeeper.executor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.lendkeeper")
@ConfigurationPropertiesScan(basePackages = "com.lendkeeper")
@EnableScheduling
public class KeeperExecutorApplication {

  public static void main(String[] args) {
    SpringApplication.run(KeeperExecutorApplication.class, args);
  }
}

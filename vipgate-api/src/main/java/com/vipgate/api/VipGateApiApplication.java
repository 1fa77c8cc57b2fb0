package com.vipgate.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.vipgate")
@EnableJpaRepositories(basePackages = "com.vipgate.persistence")
@EntityScan(basePackages = "com.vipgate.persistence")
@ConfigurationPropertiesScan(basePackages = "com.vipgate.api")
@EnableScheduling
public class VipGateApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(VipGateApiApplication.class, args);
  }
}

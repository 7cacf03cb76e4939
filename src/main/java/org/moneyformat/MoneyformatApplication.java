package org.moneyformat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MoneyformatApplication {

  public static void main(String[] args) {
    SpringApplication.run(MoneyformatApplication.class, args);
  }
}

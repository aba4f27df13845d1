package com.dev.brokerage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * This class contains the startup of the application.
 */
@SpringBootApplication
public class BrokerageApplication {

  public static void main(String[] args) {
    SpringApplication.run(BrokerageApplication.class, args);
  }

}

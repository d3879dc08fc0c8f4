package com.flamingo.ai.stylecheck;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the CSR style checker. */
@SpringBootApplication
public class StyleCheckApplication {

  public static void main(String[] args) {
    SpringApplication.run(StyleCheckApplication.class, args);
  }
}

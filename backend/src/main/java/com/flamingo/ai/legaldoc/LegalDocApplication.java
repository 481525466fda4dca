package com.flamingo.ai.legaldoc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Entry point for the legal document analysis service. */
@SpringBootApplication
@EnableScheduling
public class LegalDocApplication {

  public static void main(String[] args) {
    SpringApplication.run(LegalDocApplication.class, args);
  }
}

package com.flamingo.ai.pitchscoop;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PitchScoopApplication {

  public static void main(String[] args) {
    SpringApplication.run(PitchScoopApplication.class, args);
  }
}

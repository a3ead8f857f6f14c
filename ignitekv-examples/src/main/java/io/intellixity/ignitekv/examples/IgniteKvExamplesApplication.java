package io.intellixity.ignitekv.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IgniteKvExamplesApplication {
  public static void main(String[] args) {
    SpringApplication.run(IgniteKvExamplesApplication.class, args);
  }
}

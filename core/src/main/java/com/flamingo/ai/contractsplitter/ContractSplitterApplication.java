package com.flamingo.ai.contractsplitter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Spring Boot entry point for the contract splitter. */
@SpringBootApplication
public class ContractSplitterApplication {

  public static void main(String[] args) {
    SpringApplication.run(ContractSplitterApplication.class, args);
  }
}

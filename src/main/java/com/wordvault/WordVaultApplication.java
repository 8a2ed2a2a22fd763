package com.wordvault;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WordVaultApplication {
  public static void main(String[] args) {
    SpringApplication.run(WordVaultApplication.class, args);
  }
}

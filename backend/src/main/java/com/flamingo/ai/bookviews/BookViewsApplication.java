package com.flamingo.ai.bookviews;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BookViewsApplication {

  public static void main(String[] args) {
    SpringApplication.run(BookViewsApplication.class, args);
  }
}

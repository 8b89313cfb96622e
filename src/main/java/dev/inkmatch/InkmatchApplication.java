package dev.inkmatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Inkmatch artist matching service.
 *
 * <p>Exposes the ranking engine over REST on port 8080.
 */
@SpringBootApplication
public class InkmatchApplication {
  public static void main(String[] args) {
    SpringApplication.run(InkmatchApplication.class, args);
  }
}

package dev.stdiobridge.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the stdio bridge.
 */
@SpringBootApplication
public class BridgeServerApplication {

	/**
	 * Bootstrap the Spring Boot application.
	 * @param args application arguments passed from the command line
	 */
	public static void main(String[] args) {
		SpringApplication.run(BridgeServerApplication.class, args);
	}

}

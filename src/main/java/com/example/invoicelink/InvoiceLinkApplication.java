package com.example.invoicelink;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Application entry point. Wires the application context and hands control to Spring;
 * the HTTP endpoints live under the interfaces layer.
 */
@SpringBootApplication
public class InvoiceLinkApplication {

	/**
	 * Boots the Spring container.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(InvoiceLinkApplication.class, args);
	}

}

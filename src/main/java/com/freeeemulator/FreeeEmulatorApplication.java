package com.freeeemulator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the freee API Emulator.
 *
 * The emulator is a stateful test double of the freee accounting API. It issues
 * OAuth2 tokens, stores accounting entities in an embedded single-file database
 * and settles unbooked wallet transactions when matching deals are created, so
 * client tooling can be developed without live credentials.
 */
@SpringBootApplication
public class FreeeEmulatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(FreeeEmulatorApplication.class, args);
    }
}

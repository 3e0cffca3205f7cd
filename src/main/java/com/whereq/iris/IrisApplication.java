package com.whereq.iris;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for WhereQ Iris.
 * This service runs user supplied ImageJ macros against batches of uploaded images
 * and streams LLM generated macros back to the browser.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class IrisApplication {

    public static void main(String[] args) {
        SpringApplication.run(IrisApplication.class, args);
    }
}

package com.ora.normalization;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the inventory normalization migrator.
 * The exit code of the process reflects the outcome of the run.
 */
@SpringBootApplication
public class OraNormalizationApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(OraNormalizationApplication.class, args)));
    }
}

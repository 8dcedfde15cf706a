package com.hexwar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main entry point for the HexWar movement service.
 *
 * Features:
 * - Movement ranges over terrain, rivers and roads
 * - Enemy zones of control
 * - Built-in and custom scenarios loaded from JSON
 */
@SpringBootApplication
public class HexWarApplication {

    public static void main(String[] args) {
        SpringApplication.run(HexWarApplication.class, args);
    }
}

package com.whereq.helios;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for WhereQ Helios.
 * This service governs a rolling-window model budget, routes tasks between the
 * high-capability and economical backend tiers, caches results across three tiers
 * and schedules dependency graphs of agent tasks against that budget.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class HeliosApplication {

    public static void main(String[] args) {
        SpringApplication.run(HeliosApplication.class, args);
    }
}

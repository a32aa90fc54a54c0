package com.facility.snapshot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Facility Snapshot Service
 *
 * Generates periodic metric snapshots for every active facility, keeps the most
 * recent ones and serves them through the v1/v2 read API.
 */
@SpringBootApplication
public class SnapshotServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SnapshotServiceApplication.class, args);
    }
}

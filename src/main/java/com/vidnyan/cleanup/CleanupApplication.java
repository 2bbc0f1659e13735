package com.vidnyan.cleanup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * Cleanup Agents - multi-agent code analysis.
 *
 * Security, quality, performance and best-practice analyzers run over one file,
 * optionally in parallel against isolated stores, and their findings are merged into one report.
 * Stores are built from cleanup.store.* rather than spring.datasource.*.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class CleanupApplication {

    public static void main(String[] args) {
        SpringApplication.run(CleanupApplication.class, args);
    }
}

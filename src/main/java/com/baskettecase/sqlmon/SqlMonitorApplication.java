package com.baskettecase.sqlmon;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

/**
 * SQL Server Monitor Application
 *
 * Hosts the connection management layer of the SQL Server monitoring client:
 * connection string parsing and validation, the connection cache, and
 * connect failure diagnostics.
 */
@Slf4j
@SpringBootApplication
public class SqlMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(SqlMonitorApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        log.info("🚀 SQL Server monitor is ready!");
    }
}

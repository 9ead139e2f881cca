package com.baskettecase.sqlmon.check;

import com.baskettecase.sqlmon.config.SqlMonitorProperties;
import com.baskettecase.sqlmon.db.ConnectionCacheManager;
import com.baskettecase.sqlmon.db.DatabaseCheckResult;
import com.baskettecase.sqlmon.db.DatabaseExistenceChecker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.sql.SQLException;

/**
 * Startup Connection Check
 *
 * Runs one check cycle when the application starts: database existence, the
 * default connection and each extra database.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "sqlmon", name = "check-on-startup", havingValue = "true")
public class StartupConnectionCheck {

    private final SqlMonitorProperties properties;
    private final ConnectionCacheManager connectionManager;
    private final DatabaseExistenceChecker existenceChecker;

    @Bean
    public CommandLineRunner runStartupConnectionCheck() {
        return args -> runCheck();
    }

    void runCheck() {
        log.info("🔧 Checking SQL Server connectivity...");
        try {
            DatabaseCheckResult result = existenceChecker.checkDatabase();
            if (!result.exists()) {
                log.warn("Database does not exist: {}", result.context());
                return;
            }

            try (ConnectionCacheManager.ManagedConnection ignored = connectionManager.openManagedDefaultConnection(null)) {
                log.info("✅ Connected to {}", result.context());
            }

            for (String database : properties.getInstance().getExtraDatabases()) {
                connectionManager.checkDatabaseConnections(database);
            }
        } catch (SQLException e) {
            log.error("❌ Connection check failed: {}", e.getMessage());
        }
    }
}

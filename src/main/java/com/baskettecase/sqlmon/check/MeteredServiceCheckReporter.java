package com.baskettecase.sqlmon.check;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Logs each connection check and counts it in {@value #METRIC_NAME}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MeteredServiceCheckReporter implements ServiceCheckReporter {

    static final String METRIC_NAME = "sqlserver.can_connect";

    private final MeterRegistry meterRegistry;

    @Override
    public void report(ServiceCheckStatus status, String host, String database, String message, boolean isDefault) {
        Counter.builder(METRIC_NAME)
            .description("Connection checks against the SQL Server instance")
            .tag("status", status.name().toLowerCase())
            .tag("default", String.valueOf(isDefault))
            .register(meterRegistry)
            .increment();

        if (status == ServiceCheckStatus.OK) {
            log.debug("✅ Connected to {} (database: {})", host, database);
        } else {
            log.warn("❌ {}", message);
        }
    }
}

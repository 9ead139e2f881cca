package com.baskettecase.sqlmon.check;

/**
 * Receives the outcome of every connection attempt.
 */
@FunctionalInterface
public interface ServiceCheckReporter {

    /**
     * @param message   masked diagnostic, null on success
     * @param isDefault whether the database is the instance's default database
     */
    void report(ServiceCheckStatus status, String host, String database, String message, boolean isDefault);
}

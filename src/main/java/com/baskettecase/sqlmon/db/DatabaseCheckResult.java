package com.baskettecase.sqlmon.db;

/**
 * @param exists  whether the configured database exists on the instance
 * @param context {@code "<host> - <database>"}
 */
public record DatabaseCheckResult(boolean exists, String context) {
}

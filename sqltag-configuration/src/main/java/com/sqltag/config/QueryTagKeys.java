package com.sqltag.config;

/**
 * Well-known tag and context keys.
 * <ul>
 *   <li>{@link #APPLICATION}, {@link #PID}: resolved by {@link DefaultTaggings}</li>
 *   <li>{@link #CONTROLLER}, {@link #ACTION}, {@link #JOB}: bound in the context by request and job producers</li>
 *   <li>{@link #DB_HOST}, {@link #DATABASE}, {@link #SOCKET}: registered from the JDBC URL</li>
 * </ul>
 */
public final class QueryTagKeys {

    public static final String APPLICATION = "application";
    public static final String PID = "pid";
    public static final String CONTROLLER = "controller";
    public static final String ACTION = "action";
    public static final String JOB = "job";
    public static final String DB_HOST = "db_host";
    public static final String DATABASE = "database";
    public static final String SOCKET = "socket";

    private QueryTagKeys() {
    }
}

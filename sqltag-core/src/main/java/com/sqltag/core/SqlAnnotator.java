package com.sqltag.core;

/**
 * Adds the query log comment to a SQL string. Called by the query execution path once per query.
 */
@FunctionalInterface
public interface SqlAnnotator {

    /**
     * @param sql query text, not null
     * @return the query with the comment prepended or appended, trimmed; the trimmed query when there is no comment
     */
    String annotate(String sql);
}

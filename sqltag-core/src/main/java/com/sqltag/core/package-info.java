/**
 * Query log tags: renders the configured tags into an SQL comment and attaches it to queries.
 * <ul>
 *   <li>{@link com.sqltag.core.QueryLogs} – process-wide entry point; configuration plus the current thread's context</li>
 *   <li>{@link com.sqltag.core.QueryAnnotator} – annotates SQL for an explicit context, caching the comment per context when enabled</li>
 *   <li>{@link com.sqltag.core.TagRenderer} – builds {@code /*key:value,...*&#47;} from the tag list</li>
 *   <li>{@link com.sqltag.core.SqlCommentEscaper} – strips comment delimiters from the rendered content</li>
 *   <li>{@link com.sqltag.core.SqlAnnotator} – what the query execution path calls</li>
 * </ul>
 */
package com.sqltag.core;

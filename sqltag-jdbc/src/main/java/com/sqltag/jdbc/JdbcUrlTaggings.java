package com.sqltag.jdbc;

import com.sqltag.config.QueryTagKeys;
import com.sqltag.config.QueryTagsConfig;
import com.sqltag.config.TagHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Registers {@code db_host}, {@code database} and {@code socket} taggings from a JDBC URL.
 * Understands {@code jdbc:<subprotocol>://[user@]host[:port][/database][?k=v&...|;k=v;...]};
 * URLs without an authority (e.g. {@code jdbc:h2:mem:test}) contribute nothing.
 */
public final class JdbcUrlTaggings {

    private static final Logger log = LoggerFactory.getLogger(JdbcUrlTaggings.class);
    private static final String JDBC_PREFIX = "jdbc:";

    private JdbcUrlTaggings() {
    }

    /**
     * Parsed connection details; any field may be null.
     */
    public record JdbcUrlInfo(String host, Integer port, String database, String socket) {

        static final JdbcUrlInfo EMPTY = new JdbcUrlInfo(null, null, null, null);
    }

    /**
     * Adds a static tagging for each detail found in the URL.
     *
     * @return the same builder
     */
    public static QueryTagsConfig.Builder register(QueryTagsConfig.Builder builder, String jdbcUrl) {
        Objects.requireNonNull(builder, "builder");
        JdbcUrlInfo info = parse(jdbcUrl);
        if (info.host() != null) {
            builder.tagging(QueryTagKeys.DB_HOST, TagHandler.value(info.host()));
        }
        if (info.database() != null) {
            builder.tagging(QueryTagKeys.DATABASE, TagHandler.value(info.database()));
        }
        if (info.socket() != null) {
            builder.tagging(QueryTagKeys.SOCKET, TagHandler.value(info.socket()));
        }
        log.debug("Registered connection taggings from JDBC URL: host={} database={} socket={}",
                info.host(), info.database(), info.socket());
        return builder;
    }

    public static JdbcUrlInfo parse(String jdbcUrl) {
        if (jdbcUrl == null || !jdbcUrl.startsWith(JDBC_PREFIX)) {
            throw new IllegalArgumentException("Not a JDBC URL: " + jdbcUrl);
        }
        String rest = jdbcUrl.substring(JDBC_PREFIX.length());
        int slashes = rest.indexOf("//");
        if (slashes < 0) {
            return JdbcUrlInfo.EMPTY;
        }
        String remainder = rest.substring(slashes + 2);
        int propsStart = indexOfAny(remainder, '?', ';');
        String location = propsStart >= 0 ? remainder.substring(0, propsStart) : remainder;
        Map<String, String> props = propsStart >= 0 ? parseProperties(remainder.substring(propsStart + 1)) : Map.of();

        int pathStart = location.indexOf('/');
        String authority = pathStart >= 0 ? location.substring(0, pathStart) : location;
        String path = pathStart >= 0 ? location.substring(pathStart + 1) : "";
        int at = authority.lastIndexOf('@');
        if (at >= 0) {
            authority = authority.substring(at + 1);
        }
        int comma = authority.indexOf(',');
        if (comma >= 0) {
            authority = authority.substring(0, comma);
        }

        String host = authority;
        Integer port = null;
        int portSeparator = authority.startsWith("[") ? authority.indexOf("]:") + 1 : authority.lastIndexOf(':');
        if (portSeparator > 0) {
            host = authority.substring(0, portSeparator);
            port = parsePort(authority.substring(portSeparator + 1));
        }

        String database = !path.isEmpty() ? path : firstNonBlank(props.get("databaseName"), props.get("database"));
        String socket = firstNonBlank(props.get("socket"), props.get("unixSocket"));
        return new JdbcUrlInfo(host.isEmpty() ? null : host, port, database, socket);
    }

    private static Map<String, String> parseProperties(String raw) {
        Map<String, String> props = new HashMap<>();
        for (String pair : raw.split("[&;]")) {
            int eq = pair.indexOf('=');
            if (eq > 0) {
                props.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
            }
        }
        return props;
    }

    private static Integer parsePort(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric port '{}' in JDBC URL", value);
            return null;
        }
    }

    private static int indexOfAny(String s, char a, char b) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == a || c == b) return i;
        }
        return -1;
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) return a;
        if (b != null && !b.isBlank()) return b;
        return null;
    }
}

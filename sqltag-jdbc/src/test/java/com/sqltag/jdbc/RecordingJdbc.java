package com.sqltag.jdbc;

import javax.sql.DataSource;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/** Driver stand-in: records every SQL string that reaches it. */
final class RecordingJdbc {

    final List<String> received = new ArrayList<>();
    private SQLException failure;

    /** Makes every SQL-carrying call fail with the given exception. */
    RecordingJdbc failWith(SQLException failure) {
        this.failure = failure;
        return this;
    }

    DataSource dataSource() {
        return proxy(DataSource.class, (p, m, a) ->
                "getConnection".equals(m.getName()) ? connection() : defaultValue(m));
    }

    Connection connection() {
        return proxy(Connection.class, (p, m, a) -> {
            switch (m.getName()) {
                case "prepareStatement":
                case "prepareCall":
                    record(a[0]);
                    return statement(m.getReturnType());
                case "nativeSQL":
                    record(a[0]);
                    return a[0];
                case "createStatement":
                    return statement(Statement.class);
                default:
                    return defaultValue(m);
            }
        });
    }

    private Object statement(Class<?> type) {
        return proxy(type, (p, m, a) -> {
            if (a != null && a.length > 0 && a[0] instanceof String) {
                record(a[0]);
            }
            return defaultValue(m);
        });
    }

    private void record(Object sql) throws SQLException {
        if (failure != null) {
            throw failure;
        }
        received.add((String) sql);
    }

    private static Object defaultValue(Method m) {
        Class<?> type = m.getReturnType();
        if (type == boolean.class) return false;
        if (type == int.class) return 0;
        if (type == long.class) return 0L;
        if (type == int[].class) return new int[0];
        return null;
    }

    private static <T> T proxy(Class<T> type, InvocationHandler handler) {
        return type.cast(Proxy.newProxyInstance(RecordingJdbc.class.getClassLoader(), new Class<?>[]{type}, handler));
    }
}

package com.sqltag.jdbc;

import com.sqltag.core.QueryLogs;
import com.sqltag.core.SqlAnnotator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.PrintWriter;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Statement;
import java.util.Objects;
import java.util.Set;

/**
 * {@link DataSource} decorator whose connections attach the query log comment to every SQL string
 * they are given: {@code prepareStatement}, {@code prepareCall}, {@code nativeSQL}, and the
 * {@code execute*}/{@code addBatch} methods of statements. Everything else is delegated unchanged.
 */
public final class TaggingDataSource implements DataSource {

    private static final Logger log = LoggerFactory.getLogger(TaggingDataSource.class);

    /** Connection methods whose first String argument is SQL. */
    private static final Set<String> CONNECTION_SQL_METHODS = Set.of("prepareStatement", "prepareCall", "nativeSQL");
    /** Statement methods whose first String argument is SQL. */
    private static final Set<String> STATEMENT_SQL_METHODS = Set.of(
            "execute", "executeQuery", "executeUpdate", "executeLargeUpdate", "addBatch");

    private final DataSource target;
    private final SqlAnnotator annotator;

    private TaggingDataSource(DataSource target, SqlAnnotator annotator) {
        this.target = Objects.requireNonNull(target, "target");
        this.annotator = Objects.requireNonNull(annotator, "annotator");
    }

    /** Wraps the data source, annotating with {@link QueryLogs} (the current thread's context). */
    public static DataSource wrap(DataSource target) {
        return wrap(target, QueryLogs.getInstance());
    }

    public static DataSource wrap(DataSource target, SqlAnnotator annotator) {
        log.debug("Wrapping data source {} with query log tags", target);
        return new TaggingDataSource(target, annotator);
    }

    /** Wraps a single connection. */
    public static Connection wrap(Connection connection, SqlAnnotator annotator) {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(annotator, "annotator");
        return (Connection) Proxy.newProxyInstance(
                TaggingDataSource.class.getClassLoader(),
                new Class<?>[]{Connection.class},
                new ConnectionHandler(connection, annotator));
    }

    @Override
    public Connection getConnection() throws SQLException {
        return wrap(target.getConnection(), annotator);
    }

    @Override
    public Connection getConnection(String username, String password) throws SQLException {
        return wrap(target.getConnection(username, password), annotator);
    }

    @Override
    public PrintWriter getLogWriter() throws SQLException {
        return target.getLogWriter();
    }

    @Override
    public void setLogWriter(PrintWriter out) throws SQLException {
        target.setLogWriter(out);
    }

    @Override
    public void setLoginTimeout(int seconds) throws SQLException {
        target.setLoginTimeout(seconds);
    }

    @Override
    public int getLoginTimeout() throws SQLException {
        return target.getLoginTimeout();
    }

    @Override
    public java.util.logging.Logger getParentLogger() throws SQLFeatureNotSupportedException {
        return target.getParentLogger();
    }

    @Override
    public <T> T unwrap(Class<T> iface) throws SQLException {
        if (iface.isInstance(this)) {
            return iface.cast(this);
        }
        return target.unwrap(iface);
    }

    @Override
    public boolean isWrapperFor(Class<?> iface) throws SQLException {
        return iface.isInstance(this) || target.isWrapperFor(iface);
    }

    private static Object[] annotateFirstArgument(Object[] args, SqlAnnotator annotator) {
        if (args == null || args.length == 0 || !(args[0] instanceof String)) {
            return args;
        }
        Object[] copy = args.clone();
        copy[0] = annotator.annotate((String) args[0]);
        return copy;
    }

    private static boolean isIdentityMethod(Method method) {
        return method.getDeclaringClass() == Object.class && !"toString".equals(method.getName());
    }

    /** equals and hashCode of a proxy are those of the proxy itself, not of the wrapped object. */
    private static Object identity(Object proxy, Method method, Object[] args) {
        if ("equals".equals(method.getName())) {
            return proxy == args[0];
        }
        return System.identityHashCode(proxy);
    }

    private static Object invoke(Object target, Method method, Object[] args) throws Throwable {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw e.getCause();
        }
    }

    private static final class ConnectionHandler implements InvocationHandler {
        private final Connection target;
        private final SqlAnnotator annotator;

        ConnectionHandler(Connection target, SqlAnnotator annotator) {
            this.target = target;
            this.annotator = annotator;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            String name = method.getName();
            if (isIdentityMethod(method)) {
                return identity(proxy, method, args);
            }
            if (CONNECTION_SQL_METHODS.contains(name)) {
                args = annotateFirstArgument(args, annotator);
            }
            Object result = TaggingDataSource.invoke(target, method, args);
            if (result instanceof Statement && isStatementType(method.getReturnType())) {
                return wrapStatement((Statement) result, method.getReturnType(), (Connection) proxy);
            }
            return result;
        }

        private Statement wrapStatement(Statement statement, Class<?> type, Connection connection) {
            return (Statement) Proxy.newProxyInstance(
                    TaggingDataSource.class.getClassLoader(),
                    new Class<?>[]{type},
                    new StatementHandler(statement, annotator, connection));
        }

        private static boolean isStatementType(Class<?> type) {
            return type == Statement.class || type == PreparedStatement.class || type == CallableStatement.class;
        }
    }

    private static final class StatementHandler implements InvocationHandler {
        private final Statement target;
        private final SqlAnnotator annotator;
        private final Connection connection;

        StatementHandler(Statement target, SqlAnnotator annotator, Connection connection) {
            this.target = target;
            this.annotator = annotator;
            this.connection = connection;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            String name = method.getName();
            if (isIdentityMethod(method)) {
                return identity(proxy, method, args);
            }
            if ("getConnection".equals(name) && method.getParameterCount() == 0) {
                return connection;
            }
            if (STATEMENT_SQL_METHODS.contains(name)) {
                args = annotateFirstArgument(args, annotator);
            }
            return TaggingDataSource.invoke(target, method, args);
        }
    }
}

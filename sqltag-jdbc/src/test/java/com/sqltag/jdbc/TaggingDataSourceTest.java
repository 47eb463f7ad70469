package com.sqltag.jdbc;

import com.sqltag.config.QueryTagKeys;
import com.sqltag.config.QueryTagsConfig;
import com.sqltag.context.QueryTagContext;
import com.sqltag.core.QueryAnnotator;
import com.sqltag.core.QueryLogs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaggingDataSourceTest {

    private final RecordingJdbc driver = new RecordingJdbc();

    @BeforeEach
    void setUp() {
        QueryLogs.getInstance().reset();
        QueryLogs.getInstance().configure(QueryTagsConfig.builder()
                .applicationName("shop")
                .tags(QueryTagKeys.APPLICATION, QueryTagKeys.CONTROLLER)
                .build());
    }

    @AfterEach
    void tearDown() {
        QueryLogs.getInstance().reset();
    }

    @Test
    void preparedAndCallableStatementsAreAnnotated() throws Exception {
        DataSource dataSource = TaggingDataSource.wrap(driver.dataSource());

        QueryLogs.getInstance().runWithContext(Map.of("controller", "orders"), () -> {
            try (Connection c = dataSource.getConnection()) {
                PreparedStatement ps = c.prepareStatement("SELECT * FROM orders WHERE id = ?");
                CallableStatement cs = c.prepareCall("{call refresh_totals()}");
                ps.close();
                cs.close();
            }
        });

        assertEquals(List.of(
                "SELECT * FROM orders WHERE id = ? /*application:shop,controller:orders*/",
                "{call refresh_totals()} /*application:shop,controller:orders*/"), driver.received);
    }

    @Test
    void plainStatementsAreAnnotatedAndKeepWrappedConnection() throws Exception {
        DataSource dataSource = TaggingDataSource.wrap(driver.dataSource());

        try (Connection c = dataSource.getConnection("app", "secret")) {
            Statement st = c.createStatement();
            st.executeQuery("SELECT 1");
            st.executeUpdate("DELETE FROM carts");
            st.addBatch("INSERT INTO audit VALUES (1)");
            st.executeBatch();

            assertSame(c, st.getConnection());
        }

        assertEquals(List.of(
                "SELECT 1 /*application:shop*/",
                "DELETE FROM carts /*application:shop*/",
                "INSERT INTO audit VALUES (1) /*application:shop*/"), driver.received);
    }

    @Test
    void explicitAnnotatorUsesGivenContext() throws Exception {
        QueryTagContext context = new QueryTagContext();
        context.setContext(QueryTagKeys.JOB, "NightlyReport");
        QueryAnnotator annotator = new QueryAnnotator(QueryTagsConfig.builder()
                .tags(QueryTagKeys.JOB)
                .prependComment(true)
                .build());
        DataSource dataSource = TaggingDataSource.wrap(driver.dataSource(), annotator.bind(context));

        try (Connection c = dataSource.getConnection()) {
            assertEquals("/*job:NightlyReport*/ SELECT 2", c.nativeSQL("SELECT 2"));
        }
    }

    @Test
    void driverExceptionsPropagateUnwrapped() throws Exception {
        SQLException failure = new SQLException("syntax error", "42601");
        DataSource dataSource = TaggingDataSource.wrap(driver.failWith(failure).dataSource());

        try (Connection c = dataSource.getConnection()) {
            SQLException thrown = assertThrows(SQLException.class, () -> c.prepareStatement("SELEC 1"));
            assertSame(failure, thrown);
        }
    }

    @Test
    void annotatorFailuresPropagate() throws Exception {
        DataSource dataSource = TaggingDataSource.wrap(driver.dataSource(), sql -> {
            throw new IllegalStateException("tag handler failed");
        });

        try (Connection c = dataSource.getConnection()) {
            assertThrows(IllegalStateException.class, () -> c.prepareStatement("SELECT 1"));
        }
        assertTrue(driver.received.isEmpty());
    }

    @Test
    void unwrapAndIdentity() throws Exception {
        DataSource dataSource = TaggingDataSource.wrap(driver.dataSource());

        assertTrue(dataSource.isWrapperFor(TaggingDataSource.class));
        assertSame(dataSource, dataSource.unwrap(TaggingDataSource.class));

        Connection first = dataSource.getConnection();
        Connection second = dataSource.getConnection();
        assertEquals(first, first);
        assertNotEquals(first, second);
        assertEquals(System.identityHashCode(first), first.hashCode());
    }
}

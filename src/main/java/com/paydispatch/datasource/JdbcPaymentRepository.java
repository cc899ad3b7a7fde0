package com.paydispatch.datasource;

import com.paydispatch.entity.AuditEntry;
import com.paydispatch.entity.Payment;
import com.paydispatch.entity.PaymentSummary;
import com.paydispatch.entity.PersistedPayment;
import com.paydispatch.entity.Processor;
import com.paydispatch.repository.PaymentRepository;
import com.paydispatch.repository.PaymentRepositoryException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class JdbcPaymentRepository implements PaymentRepository {
    private static final Logger log = LoggerFactory.getLogger(JdbcPaymentRepository.class);

    static final String PAYMENTS_TABLE = "payments";
    static final String AUDIT_LOG_TABLE = "payment_audit_log";

    private static final String UNIQUE_VIOLATION = "23505";
    private static final int CONNECTIVITY_TIMEOUT_SECONDS = 2;

    private static final List<String> SCHEMA = List.of(
            "CREATE TABLE IF NOT EXISTS " + PAYMENTS_TABLE + " (" +
                    "correlation_id VARCHAR(255) PRIMARY KEY," +
                    "amount NUMERIC(19,2) NOT NULL," +
                    "processor VARCHAR(16) NOT NULL," +
                    "created_at TIMESTAMP NOT NULL" +
                    ")",
            "CREATE INDEX IF NOT EXISTS idx_payments_created_at ON " + PAYMENTS_TABLE + " (created_at)",
            "CREATE TABLE IF NOT EXISTS " + AUDIT_LOG_TABLE + " (" +
                    "correlation_id VARCHAR(255) PRIMARY KEY," +
                    "amount NUMERIC(19,2) NOT NULL," +
                    "received_at TIMESTAMP NOT NULL" +
                    ")"
    );

    private final DataSource dataSource;
    private final SqlDialect dialect;
    private final String insertPaymentSql;
    private final String insertAuditSql;

    public JdbcPaymentRepository(DataSource dataSource, SqlDialect dialect) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.insertPaymentSql = dialect.insertIgnoreSql(PAYMENTS_TABLE, "correlation_id",
                List.of("correlation_id", "amount", "processor", "created_at"));
        this.insertAuditSql = dialect.insertIgnoreSql(AUDIT_LOG_TABLE, "correlation_id",
                List.of("correlation_id", "amount", "received_at"));
    }

    public static JdbcPaymentRepository connect(String jdbcUrl, String user, String password) {
        SqlDialect dialect = SqlDialect.forJdbcUrl(jdbcUrl);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setUsername(user);
        config.setPassword(password);
        config.setPoolName("payment-store");
        config.setInitializationFailTimeout(-1);

        JdbcPaymentRepository repository =
                new JdbcPaymentRepository(new HikariDataSource(config), dialect);
        try {
            repository.createSchemaIfAbsent();
        } catch (PaymentRepositoryException e) {
            repository.close();
            throw e;
        }
        return repository;
    }

    public void createSchemaIfAbsent() {
        try (Connection conn = dataSource.getConnection();
             Statement statement = conn.createStatement()) {
            for (String ddl : SCHEMA) {
                statement.execute(ddl);
            }
        } catch (SQLException e) {
            throw new PaymentRepositoryException("Failed to create payment schema", e);
        }
        log.info("Payment schema ready ({})", dialect.name());
    }

    @Override
    public boolean saveIfAbsent(Payment payment, Processor processor) {
        Timestamp createdAt = Timestamp.from(Instant.now().truncatedTo(ChronoUnit.MILLIS));
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(insertPaymentSql)) {
            ps.setString(1, payment.correlationId());
            ps.setBigDecimal(2, scaled(payment.amount()));
            ps.setString(3, processor.jsonName());
            ps.setTimestamp(4, createdAt);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                return false;
            }
            throw new PaymentRepositoryException("Failed to save payment " + payment.correlationId(), e);
        }
    }

    @Override
    public Optional<PersistedPayment> findByCorrelationId(String correlationId) {
        String sql = "SELECT correlation_id, amount, processor, created_at FROM " + PAYMENTS_TABLE +
                " WHERE correlation_id = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, correlationId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new PersistedPayment(
                        rs.getString("correlation_id"),
                        rs.getBigDecimal("amount"),
                        Processor.fromJsonName(rs.getString("processor")),
                        rs.getTimestamp("created_at").toInstant()));
            }
        } catch (SQLException e) {
            throw new PaymentRepositoryException("Failed to look up payment " + correlationId, e);
        }
    }

    @Override
    public PaymentSummary getPaymentsSummary(Instant from, Instant to) {
        StringBuilder sql = new StringBuilder(
                "SELECT processor, COUNT(*) AS total_requests, COALESCE(SUM(amount), 0) AS total_amount FROM ")
                .append(PAYMENTS_TABLE);
        List<Timestamp> params = new ArrayList<>(2);
        if (from != null) {
            sql.append(" WHERE created_at >= ?");
            params.add(Timestamp.from(from));
        }
        if (to != null) {
            sql.append(params.isEmpty() ? " WHERE" : " AND").append(" created_at <= ?");
            params.add(Timestamp.from(to));
        }
        sql.append(" GROUP BY processor");

        PaymentSummary.ProcessorSummary defaultSummary = PaymentSummary.ProcessorSummary.EMPTY;
        PaymentSummary.ProcessorSummary fallbackSummary = PaymentSummary.ProcessorSummary.EMPTY;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            for (int i = 0; i < params.size(); i++) {
                ps.setTimestamp(i + 1, params.get(i));
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    PaymentSummary.ProcessorSummary summary = new PaymentSummary.ProcessorSummary(
                            rs.getLong("total_requests"), rs.getBigDecimal("total_amount"));
                    switch (Processor.fromJsonName(rs.getString("processor"))) {
                        case DEFAULT -> defaultSummary = summary;
                        case FALLBACK -> fallbackSummary = summary;
                    }
                }
            }
        } catch (SQLException e) {
            throw new PaymentRepositoryException("Failed to aggregate payment summary", e);
        }
        return new PaymentSummary(defaultSummary, fallbackSummary);
    }

    @Override
    public void purgeAllData() {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (Statement statement = conn.createStatement()) {
                for (String sql : dialect.purgeSql(List.of(PAYMENTS_TABLE, AUDIT_LOG_TABLE))) {
                    statement.executeUpdate(sql);
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new PaymentRepositoryException("Failed to purge payments", e);
        }
    }

    @Override
    public int appendAuditLog(List<AuditEntry> entries) {
        if (entries.isEmpty()) {
            return 0;
        }
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(insertAuditSql)) {
            for (AuditEntry entry : entries) {
                ps.setString(1, entry.correlationId());
                ps.setBigDecimal(2, scaled(entry.amount()));
                ps.setTimestamp(3, Timestamp.from(entry.receivedAt()));
                ps.addBatch();
            }
            int written = 0;
            for (int count : ps.executeBatch()) {
                if (count > 0) {
                    written += count;
                }
            }
            return written;
        } catch (SQLException e) {
            throw new PaymentRepositoryException("Failed to append " + entries.size() + " audit entries", e);
        }
    }

    @Override
    public void verifyConnectivity() {
        try (Connection conn = dataSource.getConnection()) {
            if (!conn.isValid(CONNECTIVITY_TIMEOUT_SECONDS)) {
                throw new PaymentRepositoryException("Database connection is not valid");
            }
        } catch (SQLException e) {
            throw new PaymentRepositoryException("Could not connect to the database", e);
        }
    }

    @Override
    public void close() {
        if (dataSource instanceof HikariDataSource hikari && !hikari.isClosed()) {
            hikari.close();
        }
    }

    private static BigDecimal scaled(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }
}

package com.acme.analytics.collector.export.relational;

import com.acme.analytics.collector.event.Event;
import com.acme.analytics.collector.event.EventBatch;
import com.acme.analytics.collector.export.EventSink;
import com.acme.analytics.collector.export.ExportException;
import com.acme.analytics.collector.util.CollectorDefaults;
import com.acme.analytics.collector.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Statement;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Writes each batch into the {@code events} table in a single transaction.
 *
 * <p>Row layout: {@code id}, {@code recorded_at} (ISO-8601 text), {@code event} (JSON document with
 * entity, action, path, ts and appId) and {@code recorded_by} (the tenant). Any failure rolls the
 * whole batch back; no row of a failed batch is ever visible.</p>
 */
public final class RelationalEventSink implements EventSink {
    private static final Logger LOG = Logger.getLogger(RelationalEventSink.class.getName());
    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    public static final String DEFAULT_NAME = "relational";

    private final String name;
    private final String table;
    private final DataSource dataSource;
    private final boolean ownsDataSource;
    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactions;
    private final String insertSql;

    public RelationalEventSink(DataSource dataSource) {
        this(DEFAULT_NAME, dataSource, CollectorDefaults.EVENTS_TABLE, false);
    }

    public RelationalEventSink(String name, DataSource dataSource, String table, boolean ownsDataSource) {
        this(name, dataSource, table, ownsDataSource, Duration.ZERO);
    }

    /**
     * @param statementTimeout bound on each batch statement and its transaction, rounded up to whole
     *                         seconds; zero or negative leaves the driver default
     */
    public RelationalEventSink(String name, DataSource dataSource, String table, boolean ownsDataSource,
                               Duration statementTimeout) {
        this.name = Objects.requireNonNull(name, "name");
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.table = Objects.requireNonNull(table, "table");
        if (!TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("invalid table name: " + table);
        }
        this.ownsDataSource = ownsDataSource;
        this.jdbc = new NamedParameterJdbcTemplate(dataSource);
        this.transactions = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        int timeoutSeconds = timeoutSeconds(Objects.requireNonNull(statementTimeout, "statementTimeout"));
        if (timeoutSeconds > 0) {
            this.jdbc.getJdbcTemplate().setQueryTimeout(timeoutSeconds);
            this.transactions.setTimeout(timeoutSeconds);
        }
        this.insertSql = "INSERT INTO " + table + " (id, recorded_at, event, recorded_by) "
            + "VALUES (:id, :recorded_at, :event, :recorded_by)";
    }

    @Override
    public String name() {
        return name;
    }

    int queryTimeoutSeconds() {
        return jdbc.getJdbcTemplate().getQueryTimeout();
    }

    int transactionTimeoutSeconds() {
        return transactions.getTimeout();
    }

    static int timeoutSeconds(Duration timeout) {
        if (timeout.isNegative() || timeout.isZero()) {
            return 0;
        }
        long millis = Math.max(1L, timeout.toMillis());
        return (int) Math.min(Integer.MAX_VALUE, (millis + 999L) / 1000L);
    }

    /** Creates the events table when it does not exist yet. */
    public void createSchemaIfMissing() {
        jdbc.getJdbcTemplate().execute("CREATE TABLE IF NOT EXISTS " + table + " ("
            + "id VARCHAR PRIMARY KEY, "
            + "recorded_at VARCHAR NOT NULL, "
            + "event VARCHAR NOT NULL, "
            + "recorded_by VARCHAR NOT NULL)");
        LOG.info(() -> "Relational sink schema ready table=" + table);
    }

    @Override
    public int writeBatch(EventBatch batch) throws ExportException {
        Objects.requireNonNull(batch, "batch");
        if (batch.isEmpty()) {
            return 0;
        }
        MapSqlParameterSource[] rows = toRows(batch.events());

        Integer written;
        try {
            written = transactions.execute(status -> {
                int[] results = jdbc.batchUpdate(insertSql, rows);
                int inserted = 0;
                for (int result : results) {
                    inserted += result == Statement.SUCCESS_NO_INFO ? 1 : Math.max(result, 0);
                }
                if (inserted != rows.length) {
                    status.setRollbackOnly();
                }
                return inserted;
            });
        } catch (QueryTimeoutException e) {
            throw new ExportException(ExportException.Kind.CONNECTION,
                "batch " + batch.sequence() + " timed out: " + rootMessage(e), e);
        } catch (CannotGetJdbcConnectionException | CannotCreateTransactionException e) {
            throw new ExportException(ExportException.Kind.CONNECTION,
                "database unavailable: " + rootMessage(e), e);
        } catch (DataAccessException e) {
            throw new ExportException(ExportException.Kind.PARTIAL,
                "batch " + batch.sequence() + " rolled back: " + rootMessage(e), e);
        } catch (TransactionException e) {
            throw new ExportException(ExportException.Kind.CONNECTION,
                "transaction failed: " + rootMessage(e), e);
        }

        int count = written == null ? 0 : written;
        if (count != rows.length) {
            throw new ExportException(ExportException.Kind.PARTIAL,
                "batch " + batch.sequence() + " rolled back: inserted " + count + " of " + rows.length + " rows");
        }
        return count;
    }

    private static MapSqlParameterSource[] toRows(List<Event> events) throws ExportException {
        MapSqlParameterSource[] rows = new MapSqlParameterSource[events.size()];
        for (int i = 0; i < rows.length; i++) {
            Event event = events.get(i);
            rows[i] = new MapSqlParameterSource()
                .addValue("id", event.id())
                .addValue("recorded_at", event.recordedAt().toString())
                .addValue("event", encodeEvent(event))
                .addValue("recorded_by", event.appId());
        }
        return rows;
    }

    static String encodeEvent(Event event) throws ExportException {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("ts", event.occurredAt().toString());
        doc.put("entity", event.entity().wireName());
        doc.put("action", event.action().wireName());
        doc.put("path", event.path());
        doc.put("appId", event.appId());
        try {
            return JsonCodec.writeString(doc);
        } catch (JsonProcessingException e) {
            throw new ExportException(ExportException.Kind.SERIALIZATION,
                "failed to encode event " + event.id(), e);
        }
    }

    private static String rootMessage(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return message == null ? root.getClass().getSimpleName() : message;
    }

    @Override
    public void close() throws Exception {
        if (ownsDataSource && dataSource instanceof AutoCloseable closeable) {
            closeable.close();
        }
    }
}

package com.warden.guard.jdbc;

import com.warden.guard.CancellationSignal;
import com.warden.guard.FieldMatch;
import com.warden.guard.OwnershipProbe;
import com.warden.guard.ProbeOutcome;
import com.warden.guard.ResourceSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCallback;
import org.springframework.jdbc.core.PreparedStatementCreator;

/**
 * {@link ResourceSource} that answers a probe with a single SQL round trip.
 * <p>
 * Each probe becomes
 *
 * <pre>
 * SELECT CASE WHEN owner_id = ? AND tenant_id = ? THEN 1 ELSE 0 END
 *   FROM documents
 *  WHERE id = ?
 *  FETCH FIRST 1 ROWS ONLY
 * </pre>
 *
 * where column names are the {@link com.warden.guard.ResourceField#name() field names}. No row
 * means {@link ProbeOutcome#ABSENT}, {@code 1} means {@link ProbeOutcome#MATCHED} and {@code 0}
 * means {@link ProbeOutcome#MISMATCHED}.
 * <p>
 * Queries run on the supplied {@link Executor}, never on the caller's thread. A cancellation
 * requested while the query is running calls {@link java.sql.Statement#cancel()}; the returned
 * future then fails with {@link CancellationException}. Other data access failures propagate
 * unchanged as Spring {@link DataAccessException}s.
 *
 * @param <T> resource type mapped to {@code table}
 */
public final class JdbcResourceSource<T> implements ResourceSource<T> {

    private static final Logger log = LoggerFactory.getLogger(JdbcResourceSource.class);

    private static final Pattern TABLE_NAME =
            Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private final JdbcTemplate jdbc;
    private final String table;
    private final Executor executor;

    /**
     * @param jdbc     template bound to the resource's data source
     * @param table    table holding the resource, optionally schema-qualified
     * @param executor executor the blocking query runs on
     */
    public JdbcResourceSource(JdbcTemplate jdbc, String table, Executor executor) {
        if (jdbc == null) {
            throw new IllegalArgumentException("jdbc must not be null");
        }
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("table must be a plain SQL identifier but was: " + table);
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor must not be null");
        }
        this.jdbc = jdbc;
        this.table = table;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<ProbeOutcome> probe(OwnershipProbe<T> probe, CancellationSignal signal) {
        String sql = sql(table, probe);
        Object[] args = arguments(probe);
        return CompletableFuture.supplyAsync(() -> query(sql, args, signal), executor);
    }

    /** Table this source queries. */
    public String table() {
        return table;
    }

    private ProbeOutcome query(String sql, Object[] args, CancellationSignal signal) {
        signal.throwIfCancellationRequested();
        log.debug("Ownership probe: {}", sql);
        PreparedStatementCreator creator = con -> con.prepareStatement(sql);
        PreparedStatementCallback<ProbeOutcome> callback = ps -> {
            new ArgumentPreparedStatementSetter(args).setValues(ps);
            try (CancellationSignal.Registration ignored = signal.onCancel(() -> cancel(ps))) {
                // Statement.cancel() before executeQuery() is a no-op, so re-check once registered.
                signal.throwIfCancellationRequested();
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return ProbeOutcome.ABSENT;
                    }
                    return ProbeOutcome.of(rs.getInt(1) == 1);
                }
            }
        };
        try {
            return jdbc.execute(creator, callback);
        } catch (DataAccessException e) {
            if (signal.isCancellationRequested()) {
                CancellationException cancelled =
                        new CancellationException("Ownership probe on %s cancelled".formatted(table));
                cancelled.initCause(e);
                throw cancelled;
            }
            throw e;
        }
    }

    private void cancel(PreparedStatement ps) {
        try {
            ps.cancel();
        } catch (SQLException e) {
            log.warn("Failed to cancel ownership probe on {}: {}", table, e.getMessage());
        }
    }

    static <T> String sql(String table, OwnershipProbe<T> probe) {
        List<String> conditions = new ArrayList<>();
        for (FieldMatch<T> condition : probe.conditions()) {
            conditions.add(condition.field().name() + " = ?");
        }
        return "SELECT CASE WHEN %s THEN 1 ELSE 0 END FROM %s WHERE %s = ? FETCH FIRST 1 ROWS ONLY"
                .formatted(String.join(" AND ", conditions), table, probe.filter().field().name());
    }

    static <T> Object[] arguments(OwnershipProbe<T> probe) {
        List<Object> args = new ArrayList<>();
        for (FieldMatch<T> condition : probe.conditions()) {
            args.add(condition.expected());
        }
        args.add(probe.filter().expected());
        return args.toArray();
    }
}

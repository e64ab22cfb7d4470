package com.warden.guard.jdbc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.warden.guard.CancellationSignal;
import com.warden.guard.CancellationSource;
import com.warden.guard.DefaultAccessGuard;
import com.warden.guard.DefaultOwnershipDescriptorRegistry;
import com.warden.guard.Disposition;
import com.warden.guard.FieldMatch;
import com.warden.guard.KeyParsers;
import com.warden.guard.OwnershipGuardOptions;
import com.warden.guard.OwnershipProbe;
import com.warden.guard.ProbeOutcome;
import com.warden.guard.ResourceField;
import com.warden.guard.testing.MapRequestContext;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import javax.sql.DataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.support.SQLStateSQLExceptionTranslator;

@DisplayName("JdbcResourceSource")
class JdbcResourceSourceTest {

    record Document(UUID id, String ownerId, String tenantId) {}

    static final ResourceField<Document, UUID> ID = ResourceField.of("id", Document::id);
    static final ResourceField<Document, String> OWNER = ResourceField.of("owner_id", Document::ownerId);
    static final ResourceField<Document, String> TENANT = ResourceField.of("tenant_id", Document::tenantId);

    static final UUID DOC_1 = UUID.fromString("11111111-1111-1111-1111-111111111111");
    static final UUID DOC_2 = UUID.fromString("22222222-2222-2222-2222-222222222222");

    private static final Executor DIRECT = Runnable::run;

    private JdbcTemplate jdbc;
    private JdbcResourceSource<Document> source;

    @BeforeEach
    void setUp() {
        jdbc = new JdbcTemplate(new DriverManagerDataSource("jdbc:h2:mem:guard_jdbc;DB_CLOSE_DELAY=-1", "sa", ""));
        jdbc.execute("CREATE TABLE documents (id UUID PRIMARY KEY, owner_id VARCHAR(64), tenant_id VARCHAR(64))");
        jdbc.update("INSERT INTO documents VALUES (?, ?, ?)", DOC_1, "user1", "tenant1");
        jdbc.update("INSERT INTO documents VALUES (?, ?, ?)", DOC_2, "user2", "tenant2");
        source = new JdbcResourceSource<>(jdbc, "documents", DIRECT);
    }

    @AfterEach
    void tearDown() {
        jdbc.execute("DROP TABLE documents");
    }

    private static OwnershipProbe<Document> ownerProbe(UUID id, String owner) {
        return new OwnershipProbe<>(FieldMatch.of(ID, id), List.of(FieldMatch.of(OWNER, owner)));
    }

    private static OwnershipProbe<Document> tenantProbe(UUID id, String owner, String tenant) {
        return new OwnershipProbe<>(
                FieldMatch.of(ID, id),
                List.of(FieldMatch.of(OWNER, owner), FieldMatch.of(TENANT, tenant)));
    }

    @Nested
    @DisplayName("query shape")
    class QueryShape {

        @Test
        @DisplayName("conditions become one CASE expression filtered by the id column")
        void sqlText() {
            assertThat(JdbcResourceSource.sql("documents", tenantProbe(DOC_1, "user1", "tenant1")))
                    .isEqualTo("SELECT CASE WHEN owner_id = ? AND tenant_id = ? THEN 1 ELSE 0 END "
                            + "FROM documents WHERE id = ? FETCH FIRST 1 ROWS ONLY");
        }

        @Test
        @DisplayName("arguments follow the placeholders, id last")
        void argumentOrder() {
            assertThat(JdbcResourceSource.arguments(tenantProbe(DOC_1, "user1", "tenant1")))
                    .containsExactly("user1", "tenant1", DOC_1);
        }

        @Test
        @DisplayName("table names must be identifiers")
        void tableName() {
            assertThatThrownBy(() -> new JdbcResourceSource<Document>(jdbc, "documents; drop table x", DIRECT))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(new JdbcResourceSource<Document>(jdbc, "public.documents", DIRECT).table())
                    .isEqualTo("public.documents");
        }
    }

    @Nested
    @DisplayName("outcomes")
    class Outcomes {

        @Test
        @DisplayName("owner match is MATCHED")
        void matched() {
            assertThat(source.probe(ownerProbe(DOC_1, "user1"), CancellationSignal.none()).join())
                    .isEqualTo(ProbeOutcome.MATCHED);
        }

        @Test
        @DisplayName("another owner is MISMATCHED")
        void mismatched() {
            assertThat(source.probe(ownerProbe(DOC_2, "user1"), CancellationSignal.none()).join())
                    .isEqualTo(ProbeOutcome.MISMATCHED);
        }

        @Test
        @DisplayName("a tenant mismatch alone is MISMATCHED")
        void tenantMismatch() {
            assertThat(source.probe(tenantProbe(DOC_1, "user1", "tenant2"), CancellationSignal.none()).join())
                    .isEqualTo(ProbeOutcome.MISMATCHED);
        }

        @Test
        @DisplayName("an unknown id is ABSENT")
        void absent() {
            assertThat(source.probe(ownerProbe(UUID.randomUUID(), "user1"), CancellationSignal.none()).join())
                    .isEqualTo(ProbeOutcome.ABSENT);
        }

        @Test
        @DisplayName("SQL errors propagate as DataAccessException")
        void sqlError() {
            var missing = new JdbcResourceSource<Document>(jdbc, "no_such_table", DIRECT);

            assertThatThrownBy(() -> missing.probe(ownerProbe(DOC_1, "user1"), CancellationSignal.none()).join())
                    .isInstanceOf(CompletionException.class)
                    .hasCauseInstanceOf(DataAccessException.class);
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        @DisplayName("an already cancelled signal issues no query")
        void cancelledBeforeQuery() {
            var template = mock(JdbcTemplate.class);
            var cancelled = new CancellationSource();
            cancelled.cancel();

            CompletableFuture<ProbeOutcome> result = new JdbcResourceSource<Document>(template, "documents", DIRECT)
                    .probe(ownerProbe(DOC_1, "user1"), cancelled);

            assertThatThrownBy(result::join).hasCauseInstanceOf(CancellationException.class);
            verifyNoInteractions(template);
        }

        @Test
        @DisplayName("cancelling mid-query cancels the statement")
        void cancelledMidQuery() throws SQLException {
            var cancellation = new CancellationSource();
            var dataSource = mock(DataSource.class);
            var connection = mock(Connection.class);
            var statement = mock(PreparedStatement.class);
            when(dataSource.getConnection()).thenReturn(connection);
            when(connection.prepareStatement(anyString())).thenReturn(statement);
            when(statement.executeQuery()).thenAnswer(invocation -> {
                cancellation.cancel();
                throw new SQLException("Query cancelled", "57014");
            });
            var template = new JdbcTemplate(dataSource);
            template.setExceptionTranslator(new SQLStateSQLExceptionTranslator());

            CompletableFuture<ProbeOutcome> result = new JdbcResourceSource<Document>(template, "documents", DIRECT)
                    .probe(ownerProbe(DOC_1, "user1"), cancellation);

            assertThatThrownBy(result::join).hasCauseInstanceOf(CancellationException.class);
            verify(statement).cancel();
        }

        @Test
        @DisplayName("a cancel landing while the callback is registered stops the query")
        void cancelledDuringRegistration() {
            CompletableFuture<ProbeOutcome> result = source.probe(ownerProbe(DOC_1, "user1"), new CancelOnRegister());

            assertThatThrownBy(result::join).hasCauseInstanceOf(CancellationException.class);
        }
    }

    /** Reports not-cancelled on the first poll and becomes cancelled as soon as a callback registers. */
    private static final class CancelOnRegister implements CancellationSignal {

        private final CancellationSource delegate = new CancellationSource();

        @Override
        public boolean isCancellationRequested() {
            return delegate.isCancellationRequested();
        }

        @Override
        public Registration onCancel(Runnable callback) {
            Registration registration = delegate.onCancel(callback);
            delegate.cancel();
            return registration;
        }
    }

    @Nested
    @DisplayName("with the access guard")
    class WithGuard {

        @Test
        @DisplayName("registered UUID descriptors decide against the table")
        void dispatch() {
            var registry = new DefaultOwnershipDescriptorRegistry();
            registry.registerKeyed(
                    Document.class,
                    KeyParsers.uuids(),
                    ctx -> new JdbcResourceSource<>(ctx.resolve(JdbcTemplate.class), "documents", DIRECT),
                    ID, OWNER, TENANT);
            var guard = new DefaultAccessGuard(OwnershipGuardOptions.defaults(), registry);
            var ctx = MapRequestContext.empty().with(JdbcTemplate.class, jdbc);

            assertThat(guard.requireOwnerAndTenant(Document.class, DOC_1.toString(), "user1", "tenant1", ctx,
                    CancellationSignal.none()).join()).isEqualTo(Disposition.SUCCESS);
            assertThat(guard.requireOwnerAndTenant(Document.class, DOC_2.toString(), "user1", "tenant1", ctx,
                    CancellationSignal.none()).join()).isEqualTo(Disposition.FORBIDDEN);
            assertThat(guard.requireOwner(Document.class, "not-a-guid", "user1", ctx,
                    CancellationSignal.none()).join()).isEqualTo(Disposition.INVALID_ID);
        }
    }
}

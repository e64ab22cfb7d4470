package com.warden.guard;

import static com.warden.guard.TestResources.DOC_ID;
import static com.warden.guard.TestResources.DOC_OWNER;
import static com.warden.guard.TestResources.DOC_TENANT;
import static com.warden.guard.TestResources.failureOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.warden.guard.TestResources.Document;
import com.warden.guard.TestResources.Note;
import com.warden.guard.testing.InMemoryResourceSource;
import com.warden.guard.testing.MapRequestContext;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("AccessGuard dispatch by resource type")
class AccessGuardDispatchTest {

    private static final CancellationSignal NONE = CancellationSignal.none();

    /** Registry with Document registered for owner and tenant checks, its source resolved from the context. */
    private static DefaultOwnershipDescriptorRegistry documentRegistry() {
        var registry = new DefaultOwnershipDescriptorRegistry();
        registry.register(
                Document.class,
                ctx -> ctx.resolve(DocumentStore.class).source(),
                DOC_ID, DOC_OWNER, DOC_TENANT);
        return registry;
    }

    private static RequestContext seededContext() {
        var store = new DocumentStore(InMemoryResourceSource.of(new Document("D1", "user1", "tenant1")));
        return MapRequestContext.empty().with(DocumentStore.class, store);
    }

    private static AccessGuard guard(boolean hideExistence) {
        return new DefaultAccessGuard(
                OwnershipGuardOptions.defaults().withHideExistenceWhenForbidden(hideExistence),
                documentRegistry());
    }

    record DocumentStore(InMemoryResourceSource<Document> source) {}

    @Nested
    @DisplayName("document scenario")
    class DocumentScenario {

        @Test
        @DisplayName("owner in the same tenant succeeds")
        void ownerInTenant() {
            var result = guard(false).requireOwnerAndTenant(Document.class, "D1", "user1", "tenant1", seededContext(), NONE);
            assertThat(result.join()).isEqualTo(Disposition.SUCCESS);
        }

        @Test
        @DisplayName("owner in another tenant is FORBIDDEN when not hiding")
        void otherTenantForbidden() {
            var result = guard(false).requireOwnerAndTenant(Document.class, "D1", "user1", "tenant2", seededContext(), NONE);
            assertThat(result.join()).isEqualTo(Disposition.FORBIDDEN);
        }

        @Test
        @DisplayName("owner in another tenant is NOT_FOUND when hiding")
        void otherTenantHidden() {
            var result = guard(true).requireOwnerAndTenant(Document.class, "D1", "user1", "tenant2", seededContext(), NONE);
            assertThat(result.join()).isEqualTo(Disposition.NOT_FOUND);
        }

        @ParameterizedTest(name = "hideExistence={0}")
        @ValueSource(booleans = {false, true})
        @DisplayName("a nonexistent id is NOT_FOUND in both hiding modes")
        void nonexistent(boolean hideExistence) {
            var result = guard(hideExistence).requireOwner(Document.class, "nonexistent-id", "user1", seededContext(), NONE);
            assertThat(result.join()).isEqualTo(Disposition.NOT_FOUND);
        }

        @Test
        @DisplayName("owner-only dispatch ignores the tenant field")
        void ownerOnlyDispatch() {
            var result = guard(false).requireOwner(Document.class, "D1", "user1", seededContext(), NONE);
            assertThat(result.join()).isEqualTo(Disposition.SUCCESS);
        }
    }

    @Nested
    @DisplayName("configuration errors")
    class ConfigurationErrors {

        @Test
        @DisplayName("dispatching an unregistered type throws, naming the type")
        void unregisteredType() {
            assertThatThrownBy(() -> guard(false).requireOwner(Note.class, "n1", "user1", seededContext(), NONE))
                    .isInstanceOf(OwnershipDescriptorNotRegisteredException.class)
                    .hasMessageContaining(Note.class.getName());
        }

        @Test
        @DisplayName("tenant dispatch for an owner-only type throws a tenant-aware error")
        void ownerOnlyTypeWithTenant() {
            var registry = new DefaultOwnershipDescriptorRegistry();
            registry.register(Document.class, ctx -> new InMemoryResourceSource<>(), DOC_ID, DOC_OWNER);
            var guard = new DefaultAccessGuard(OwnershipGuardOptions.defaults(), registry);

            assertThatThrownBy(() -> guard.requireOwnerAndTenant(
                    Document.class, "D1", "user1", "tenant1", seededContext(), NONE))
                    .isInstanceOf(OwnershipDescriptorNotRegisteredException.class)
                    .satisfies(e -> assertThat(((OwnershipDescriptorNotRegisteredException) e).tenantAware()).isTrue());
        }

        @Test
        @DisplayName("empty identifiers are rejected before the registry is consulted")
        void emptyArguments() {
            assertThatThrownBy(() -> guard(false).requireOwner(Note.class, "", "user1", seededContext(), NONE))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> guard(false).requireOwnerAndTenant(Document.class, "D1", "user1", null, seededContext(), NONE))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        @DisplayName("the caller's signal reaches the data source")
        void signalPassedThrough() {
            var seen = new AtomicReference<CancellationSignal>();
            var registry = new DefaultOwnershipDescriptorRegistry();
            registry.register(Document.class, ctx -> (probe, signal) -> {
                seen.set(signal);
                return CompletableFuture.completedFuture(ProbeOutcome.MATCHED);
            }, DOC_ID, DOC_OWNER);
            var guard = new DefaultAccessGuard(OwnershipGuardOptions.defaults(), registry);
            var cancellation = new CancellationSource();

            guard.requireOwner(Document.class, "D1", "user1", MapRequestContext.empty(), cancellation).join();

            assertThat(seen.get()).isSameAs(cancellation);
        }

        @Test
        @DisplayName("a cancelled signal fails a dispatched decision")
        void cancelledDispatch() {
            var cancellation = new CancellationSource();
            cancellation.cancel();

            var result = guard(false).requireOwner(Document.class, "D1", "user1", seededContext(), cancellation);

            assertThat(failureOf(result)).isInstanceOf(CancellationException.class);
        }
    }
}

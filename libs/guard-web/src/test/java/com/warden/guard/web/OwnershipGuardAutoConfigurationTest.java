package com.warden.guard.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.warden.guard.AccessGuard;
import com.warden.guard.CancellationSignal;
import com.warden.guard.DefaultAccessGuard;
import com.warden.guard.Disposition;
import com.warden.guard.OwnershipDescriptorRegistry;
import com.warden.guard.ResourceField;
import com.warden.guard.testing.InMemoryResourceSource;
import com.warden.guard.testing.MapRequestContext;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.WebApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@DisplayName("OwnershipGuardAutoConfiguration")
class OwnershipGuardAutoConfigurationTest {

    record Memo(String id, String ownerId) {}

    static final ResourceField<Memo, String> MEMO_ID = ResourceField.of("id", Memo::id);
    static final ResourceField<Memo, String> MEMO_OWNER = ResourceField.of("owner_id", Memo::ownerId);

    @Configuration(proxyBeanMethods = false)
    static class MemoDescriptors {

        @Bean
        OwnershipDescriptorRegistrar memoRegistrar() {
            return registry -> registry.register(
                    Memo.class,
                    ctx -> InMemoryResourceSource.of(new Memo("m1", "user1")),
                    MEMO_ID,
                    MEMO_OWNER);
        }
    }

    private final WebApplicationContextRunner runner = new WebApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(OwnershipGuardAutoConfiguration.class));

    @Test
    @DisplayName("creates the guard beans and runs registrars")
    void createsBeans() {
        runner.withUserConfiguration(MemoDescriptors.class).run(context -> {
            assertThat(context).hasSingleBean(AccessGuard.class);
            assertThat(context).hasSingleBean(OwnershipHandlerInterceptor.class);
            assertThat(context).hasSingleBean(OwnershipWebMvcConfigurer.class);
            assertThat(context.getBean(OwnershipDescriptorRegistry.class).isRegistered(Memo.class)).isTrue();

            var guard = context.getBean(AccessGuard.class);
            assertThat(guard.requireOwner(Memo.class, "m1", "user1", MapRequestContext.empty(), CancellationSignal.none())
                    .join()).isEqualTo(Disposition.SUCCESS);
        });
    }

    @Test
    @DisplayName("binds warden.ownership properties")
    void bindsProperties() {
        runner.withPropertyValues(
                        "warden.ownership.hide-existence-when-forbidden=true",
                        "warden.ownership.user-id-claim=uid",
                        "warden.ownership.decision-timeout=250ms")
                .run(context -> {
                    var props = context.getBean(OwnershipGuardProperties.class);
                    assertThat(props.userIdClaim()).isEqualTo("uid");
                    assertThat(props.decisionTimeout()).isEqualTo(Duration.ofMillis(250));
                    assertThat(((DefaultAccessGuard) context.getBean(AccessGuard.class)).options()
                            .hideExistenceWhenForbidden()).isTrue();
                });
    }

    @Test
    @DisplayName("backs off when disabled")
    void disabled() {
        runner.withPropertyValues("warden.ownership.enabled=false").run(context -> {
            assertThat(context).doesNotHaveBean(AccessGuard.class);
            assertThat(context).doesNotHaveBean(OwnershipHandlerInterceptor.class);
        });
    }
}

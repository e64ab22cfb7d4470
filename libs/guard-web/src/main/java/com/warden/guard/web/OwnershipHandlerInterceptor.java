package com.warden.guard.web;

import com.warden.guard.AccessGuard;
import com.warden.guard.CancellationSource;
import com.warden.guard.Disposition;
import com.warden.guard.OwnershipDescriptorNotRegisteredException;
import com.warden.guard.OwnershipDescriptorRegistry;
import com.warden.guard.OwnershipGuardOptions;
import com.warden.guard.RequestContext;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.http.HttpStatus;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Spring MVC interceptor enforcing {@link RequireOwnership} before the handler runs.
 * <p>
 * For an annotated handler the interceptor:
 *
 * <ol>
 *   <li>reads the resource id from the URI template variable named by
 *       {@link RequireOwnership#routeParam()} (400 when missing or blank)
 *   <li>resolves the user id claim (401 when absent)
 *   <li>resolves the tenant id claim, only when the resource type registered a tenant check (401
 *       when absent)
 *   <li>asks the {@link AccessGuard}, waiting at most the configured decision timeout (503 and a
 *       cancelled probe on timeout)
 *   <li>lets the handler run on {@link Disposition#SUCCESS}; answers 400, 403 or 404 otherwise
 * </ol>
 *
 * A resource type without a registered descriptor is a configuration error: it is logged and
 * answered with 500.
 */
public class OwnershipHandlerInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(OwnershipHandlerInterceptor.class);

    /** MDC key holding the resource type while a check runs. */
    public static final String MDC_RESOURCE = "ownership.resource";

    private final AccessGuard guard;
    private final OwnershipDescriptorRegistry registry;
    private final ClaimsResolver claimsResolver;
    private final RequestContext requestContext;
    private final OwnershipGuardOptions options;
    private final Duration decisionTimeout;
    private final OwnershipResponseWriter responseWriter;
    private final OwnershipDecisionMetrics metrics;

    public OwnershipHandlerInterceptor(
            AccessGuard guard,
            OwnershipDescriptorRegistry registry,
            ClaimsResolver claimsResolver,
            RequestContext requestContext,
            OwnershipGuardOptions options,
            Duration decisionTimeout,
            OwnershipResponseWriter responseWriter,
            OwnershipDecisionMetrics metrics) {
        if (guard == null || registry == null || claimsResolver == null || requestContext == null) {
            throw new IllegalArgumentException("guard, registry, claimsResolver and requestContext must not be null");
        }
        if (options == null || decisionTimeout == null || responseWriter == null || metrics == null) {
            throw new IllegalArgumentException("options, decisionTimeout, responseWriter and metrics must not be null");
        }
        this.guard = guard;
        this.registry = registry;
        this.claimsResolver = claimsResolver;
        this.requestContext = requestContext;
        this.options = options;
        this.decisionTimeout = decisionTimeout;
        this.responseWriter = responseWriter;
        this.metrics = metrics;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws Exception {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }
        RequireOwnership requirement = findRequirement(handlerMethod);
        if (requirement == null) {
            return true;
        }

        Map<?, ?> variables = uriVariables(request);
        Object routeValue = variables.get(requirement.routeParam());
        if (routeValue == null) {
            return deny(request, response, HttpStatus.BAD_REQUEST, "Missing resource id in route.");
        }
        String resourceId = String.valueOf(routeValue);
        if (resourceId.isBlank()) {
            return deny(request, response, HttpStatus.BAD_REQUEST, "Invalid resource id in route.");
        }

        Optional<String> userId = claimsResolver.resolve(request, options.userIdClaim());
        if (userId.isEmpty()) {
            return deny(request, response, HttpStatus.UNAUTHORIZED, "User not authenticated.");
        }

        Class<?> resourceType = requirement.resource();
        boolean requiresTenant = registry.findTenantExecutor(resourceType).isPresent();
        String tenantId = null;
        if (requiresTenant) {
            Optional<String> tenantClaim = claimsResolver.resolve(request, options.tenantIdClaim());
            if (tenantClaim.isEmpty()) {
                return deny(request, response, HttpStatus.UNAUTHORIZED, "Tenant not specified.");
            }
            tenantId = tenantClaim.get();
        }

        MDC.put(MDC_RESOURCE, resourceType.getSimpleName());
        try {
            return decide(request, response, resourceType, resourceId, userId.get(), tenantId);
        } finally {
            MDC.remove(MDC_RESOURCE);
        }
    }

    private boolean decide(
            HttpServletRequest request,
            HttpServletResponse response,
            Class<?> resourceType,
            String resourceId,
            String userId,
            String tenantId) throws IOException, InterruptedException {
        CancellationSource cancellation = new CancellationSource();
        long started = System.nanoTime();
        Disposition disposition;
        try {
            CompletableFuture<Disposition> decision = tenantId != null
                    ? guard.requireOwnerAndTenant(resourceType, resourceId, userId, tenantId, requestContext, cancellation)
                    : guard.requireOwner(resourceType, resourceId, userId, requestContext, cancellation);
            disposition = decision.get(decisionTimeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (OwnershipDescriptorNotRegisteredException e) {
            return descriptorMissing(request, response, e, started);
        } catch (TimeoutException e) {
            cancellation.cancel();
            metrics.record(resourceType, OwnershipDecisionMetrics.OUTCOME_TIMEOUT, System.nanoTime() - started);
            log.warn("Ownership check for {} {} timed out after {}", resourceType.getSimpleName(), resourceId, decisionTimeout);
            return deny(request, response, HttpStatus.SERVICE_UNAVAILABLE, "Ownership check timed out.");
        } catch (InterruptedException e) {
            cancellation.cancel();
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e.getCause());
            if (cause instanceof OwnershipDescriptorNotRegisteredException notRegistered) {
                return descriptorMissing(request, response, notRegistered, started);
            }
            metrics.record(resourceType, OwnershipDecisionMetrics.OUTCOME_ERROR, System.nanoTime() - started);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Ownership check for %s failed".formatted(resourceType.getName()), cause);
        }

        metrics.record(resourceType, disposition, System.nanoTime() - started);
        log.debug("Ownership decision for {} {}: {}", resourceType.getSimpleName(), resourceId, disposition);
        if (disposition.isAllowed()) {
            return true;
        }
        return deny(request, response, DispositionStatus.of(disposition), DispositionStatus.title(disposition));
    }

    private boolean descriptorMissing(
            HttpServletRequest request,
            HttpServletResponse response,
            OwnershipDescriptorNotRegisteredException e,
            long started) throws IOException {
        log.error("Ownership descriptor not registered for resource type {}", e.resourceType().getName(), e);
        metrics.record(e.resourceType(), OwnershipDecisionMetrics.OUTCOME_UNREGISTERED, System.nanoTime() - started);
        return deny(request, response, HttpStatus.INTERNAL_SERVER_ERROR,
                "Ownership descriptor not registered for this resource type.");
    }

    private boolean deny(HttpServletRequest request, HttpServletResponse response, HttpStatus status, String title)
            throws IOException {
        responseWriter.write(response, status, title, request.getRequestURI());
        return false;
    }

    private static RequireOwnership findRequirement(HandlerMethod handlerMethod) {
        RequireOwnership onMethod =
                AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getMethod(), RequireOwnership.class);
        if (onMethod != null) {
            return onMethod;
        }
        return AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getBeanType(), RequireOwnership.class);
    }

    private static Map<?, ?> uriVariables(HttpServletRequest request) {
        Object attribute = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        return attribute instanceof Map<?, ?> map ? map : Map.of();
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}

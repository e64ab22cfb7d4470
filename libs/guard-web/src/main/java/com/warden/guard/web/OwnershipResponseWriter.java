package com.warden.guard.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.net.URI;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.json.ProblemDetailJacksonMixin;

/**
 * Writes denial responses: an RFC 7807 {@code application/problem+json} body when problem details
 * are enabled, otherwise only the status code.
 *
 * <pre>
 * {
 *   "type": "about:blank",
 *   "title": "Forbidden.",
 *   "status": 403,
 *   "instance": "/documents/2222..."
 * }
 * </pre>
 */
public class OwnershipResponseWriter {

    private final ObjectMapper objectMapper;
    private final boolean useProblemDetails;

    public OwnershipResponseWriter(ObjectMapper objectMapper, boolean useProblemDetails) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper must not be null");
        }
        this.objectMapper = objectMapper.copy().addMixIn(ProblemDetail.class, ProblemDetailJacksonMixin.class);
        this.useProblemDetails = useProblemDetails;
    }

    /**
     * Commits a denial response.
     *
     * @param response the response to write to
     * @param status   status code to answer
     * @param title    short human-readable summary
     * @param instance request URI the problem occurred on, may be null
     */
    public void write(HttpServletResponse response, HttpStatus status, String title, String instance)
            throws IOException {
        response.setStatus(status.value());
        if (!useProblemDetails) {
            return;
        }
        ProblemDetail problem = ProblemDetail.forStatus(status);
        problem.setTitle(title);
        if (instance != null) {
            problem.setInstance(URI.create(instance));
        }
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        objectMapper.writeValue(response.getOutputStream(), problem);
    }

    public boolean useProblemDetails() {
        return useProblemDetails;
    }
}

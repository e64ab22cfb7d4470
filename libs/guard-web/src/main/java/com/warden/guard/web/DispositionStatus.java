package com.warden.guard.web;

import com.warden.guard.Disposition;
import org.springframework.http.HttpStatus;

/**
 * HTTP mapping of {@link Disposition} values.
 */
public final class DispositionStatus {

    private DispositionStatus() {
        // utility class
    }

    /** Status code answered for a disposition; {@link HttpStatus#OK} means the handler proceeds. */
    public static HttpStatus of(Disposition disposition) {
        return switch (disposition) {
            case SUCCESS -> HttpStatus.OK;
            case INVALID_ID -> HttpStatus.BAD_REQUEST;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
        };
    }

    /** Problem title written for a denied disposition. */
    public static String title(Disposition disposition) {
        return switch (disposition) {
            case SUCCESS -> "OK.";
            case INVALID_ID -> "Invalid resource id.";
            case FORBIDDEN -> "Forbidden.";
            case NOT_FOUND -> "Not found.";
        };
    }
}

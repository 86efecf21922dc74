package com.devhub.chat.exception;

import org.springframework.http.HttpStatus;

/**
 * Failure kinds a chat operation can report to its caller.
 * Each kind carries the HTTP status used by the REST surface.
 */
public enum ErrorKind {

    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED),
    NOT_A_MEMBER(HttpStatus.FORBIDDEN),
    ROOM_NOT_FOUND(HttpStatus.NOT_FOUND),
    PRIVATE_ROOM_DENIED(HttpStatus.FORBIDDEN),
    ROOM_FULL(HttpStatus.CONFLICT),
    INVALID_NAME(HttpStatus.BAD_REQUEST),
    INVALID_ROOM_KIND(HttpStatus.BAD_REQUEST),
    INVALID_CAPACITY(HttpStatus.BAD_REQUEST),
    INVALID_CONTENT(HttpStatus.BAD_REQUEST),
    INVALID_REPLY(HttpStatus.BAD_REQUEST),
    INVALID_RECIPIENT(HttpStatus.BAD_REQUEST),
    MESSAGE_NOT_FOUND(HttpStatus.NOT_FOUND),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS),
    // Raised inside the direct-room resolver only, never returned to a caller
    DUPLICATE_ROOM(HttpStatus.CONFLICT),
    TRANSIENT_FAILURE(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}

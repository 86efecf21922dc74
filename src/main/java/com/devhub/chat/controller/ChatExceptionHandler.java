package com.devhub.chat.controller;

import com.devhub.chat.exception.ChatException;
import com.devhub.chat.exception.ErrorKind;
import com.devhub.chat.model.ChatDTOs;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps failures of the REST surface to {@link ChatDTOs.ErrorPayload}. Internal
 * details are logged, never returned.
 */
@Slf4j
@RestControllerAdvice
public class ChatExceptionHandler {

    @ExceptionHandler(ChatException.class)
    public ResponseEntity<ChatDTOs.ErrorPayload> handleChat(ChatException e) {
        ErrorKind kind = e.getKind() == ErrorKind.DUPLICATE_ROOM ? ErrorKind.TRANSIENT_FAILURE : e.getKind();
        log.debug("Request rejected: {} {}", kind, e.getMessage());
        return ResponseEntity.status(kind.getStatus())
                .body(ChatDTOs.ErrorPayload.builder().code(kind.name()).message(e.getMessage()).build());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ChatDTOs.ErrorPayload> handleBadRequest(Exception e) {
        log.debug("Malformed request: {}", e.getMessage());
        return ResponseEntity.badRequest()
                .body(ChatDTOs.ErrorPayload.builder().code("BAD_REQUEST").message("Malformed request").build());
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ChatDTOs.ErrorPayload> handleUnexpected(RuntimeException e) {
        log.error("Unhandled error", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ChatDTOs.ErrorPayload.builder()
                        .code(ErrorKind.TRANSIENT_FAILURE.name())
                        .message("Something went wrong, please retry")
                        .build());
    }
}

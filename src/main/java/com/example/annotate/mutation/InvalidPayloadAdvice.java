package com.example.annotate.mutation;

import com.example.annotate.error.ErrorKind;
import com.example.annotate.error.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

/**
 * Requests rejected before reaching an operation (unreadable JSON, failed bean validation)
 * still answer with an {@link Outcome}.
 */
@RestControllerAdvice
public class InvalidPayloadAdvice {
    private static final Logger log = LoggerFactory.getLogger(InvalidPayloadAdvice.class);

    // WebExchangeBindException extends ServerWebInputException
    @ExceptionHandler(ServerWebInputException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Outcome<Void> invalidPayload(ServerWebInputException e, ServerWebExchange exchange) {
        ServerHttpRequest request = exchange.getRequest();
        log.warn("{} {}: rejected kind={} caller={} detail={}", request.getMethod(), request.getPath().value(),
                ErrorKind.INVALID_PAYLOAD, request.getHeaders().getFirst(CallerHeaders.USER_ID), e.getReason());
        return Outcome.fail(ErrorKind.INVALID_PAYLOAD);
    }
}

package com.example.annotate.error;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.function.Supplier;

/**
 * Runs one operation and turns whatever it produced into an {@link Outcome}.
 * Every failure is logged here with the operation name and the input payload.
 */
@Component
public class OperationBoundary {
    private static final Logger log = LoggerFactory.getLogger(OperationBoundary.class);

    private final ObjectMapper mapper;

    public OperationBoundary(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public <T> Mono<Outcome<T>> run(String operation, Object payload, Supplier<Mono<T>> work) {
        return Mono.defer(work)
                .map(value -> Outcome.<T>success(value))
                .defaultIfEmpty(Outcome.success(null))
                .onErrorResume(e -> Mono.just(toFailure(operation, payload, e)));
    }

    public <T> Outcome<T> toFailure(String operation, Object payload, Throwable e) {
        ErrorKind kind = e instanceof AnnotateException ae ? ae.kind() : ErrorKind.UNKNOWN;

        if (kind.isRejection()) {
            log.warn("{}: rejected kind={} detail={} payload={}", operation, kind, e.getMessage(), render(payload));
        } else {
            log.error("{}: failed kind={} payload={}", operation, kind, render(payload), e);
        }
        return Outcome.fail(kind);
    }

    private String render(Object payload) {
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            return String.valueOf(payload);
        }
    }
}

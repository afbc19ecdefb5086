package com.example.annotate.store;

import com.example.annotate.error.AnnotateException;
import com.example.annotate.error.ErrorKind;
import com.example.annotate.config.AnnotateProps;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Timeout, retry and error translation shared by the store adapters.
 * <p>
 * Only reads are retried. A write that timed out may already have been applied, and
 * retrying an increment would count it twice.
 */
public final class StoreCalls {
    private final String store;
    private final Duration timeout;
    private final int readRetries;

    public StoreCalls(String store, AnnotateProps.Store props) {
        this.store = store;
        this.timeout = Duration.ofMillis(props.timeoutMs());
        this.readRetries = props.readRetries();
    }

    public <T> Mono<T> read(Mono<T> call) {
        return call.timeout(timeout)
                .retryWhen(readRetry())
                .onErrorMap(this::translate);
    }

    public <T> Flux<T> read(Flux<T> call) {
        return call.timeout(timeout)
                .retryWhen(readRetry())
                .onErrorMap(this::translate);
    }

    public <T> Mono<T> write(Mono<T> call) {
        return call.timeout(timeout)
                .onErrorMap(this::translate);
    }

    private Retry readRetry() {
        return Retry.backoff(readRetries, Duration.ofMillis(100))
                .maxBackoff(Duration.ofSeconds(1))
                .filter(StoreCalls::isTransient)
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    static boolean isTransient(Throwable e) {
        return e instanceof TimeoutException
               || e instanceof TransientDataAccessException
               || e instanceof DataAccessResourceFailureException;
    }

    Throwable translate(Throwable e) {
        if (e instanceof AnnotateException) {
            return e;
        }
        if (e instanceof DuplicateKeyException) {
            return new AnnotateException(ErrorKind.ALREADY_EXISTS, store + ": document already exists", e);
        }
        if (e instanceof TimeoutException || e instanceof DataAccessException) {
            return new AnnotateException(ErrorKind.STORE_UNAVAILABLE, store + ": " + e.getMessage(), e);
        }
        return e;
    }
}

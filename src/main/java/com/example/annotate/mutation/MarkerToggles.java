package com.example.annotate.mutation;

import com.example.annotate.error.AnnotateException;
import com.example.annotate.error.ErrorKind;
import com.example.annotate.persistence.dao.DocumentStore;
import com.example.annotate.persistence.entity.MarkerDoc;
import com.example.annotate.persistence.entity.MarkerKey;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Per-(user, target) marker transitions.
 * <p>
 * Every change is conditional on the value that was read, so two concurrent requests from the
 * same user cannot both apply: the loser fails with {@code CONFLICT} instead of firing twice.
 */
@Component
public class MarkerToggles {
    static final String PRESENT = "1";

    private final DocumentStore documents;
    private final Clock clock;

    public MarkerToggles(DocumentStore documents, Clock clock) {
        this.documents = documents;
        this.clock = clock;
    }

    public Mono<Optional<MarkerDoc>> current(MarkerKey key) {
        return documents.getMarker(key)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
    }

    /**
     * Same direction twice rolls the vote back; the opposite direction flips it in place.
     */
    public Mono<Toggle> toggleVote(MarkerKey key, VoteDirection direction) {
        String next = direction.name();
        return current(key).flatMap(existing -> {
            if (existing.isEmpty()) {
                return create(key, next).thenReturn(Toggle.ADDED);
            }
            String previous = existing.get().value();
            if (next.equals(previous)) {
                return requireApplied(documents.deleteMarker(key, previous), key).thenReturn(Toggle.REMOVED);
            }
            return requireApplied(documents.swapMarkerValue(key, previous, next), key).thenReturn(Toggle.FLIPPED);
        });
    }

    public Mono<Toggle> togglePresence(MarkerKey key) {
        return current(key).flatMap(existing -> existing.isEmpty()
                ? create(key, PRESENT).thenReturn(Toggle.ADDED)
                : requireApplied(documents.deleteMarker(key, existing.get().value()), key).thenReturn(Toggle.REMOVED));
    }

    /**
     * Write-once signal. Completes with {@code false} when the marker was already recorded.
     */
    public Mono<Boolean> recordOnce(MarkerKey key) {
        return documents.createMarker(MarkerDoc.of(key, PRESENT, Instant.now(clock)))
                .thenReturn(true)
                .onErrorResume(e -> AnnotateException.is(e, ErrorKind.ALREADY_EXISTS), e -> Mono.just(false));
    }

    public Mono<Void> create(MarkerKey key, String value) {
        return documents.createMarker(MarkerDoc.of(key, value, Instant.now(clock)))
                .onErrorMap(e -> AnnotateException.is(e, ErrorKind.ALREADY_EXISTS),
                        e -> new AnnotateException(ErrorKind.CONFLICT, "marker " + key.id() + " created concurrently", e))
                .then();
    }

    public Mono<Void> swap(MarkerKey key, String expected, String next) {
        return requireApplied(documents.swapMarkerValue(key, expected, next), key);
    }

    private Mono<Void> requireApplied(Mono<Boolean> conditionalWrite, MarkerKey key) {
        return conditionalWrite.flatMap(applied -> applied
                ? Mono.<Void>empty()
                : Mono.<Void>error(new AnnotateException(ErrorKind.CONFLICT, "marker " + key.id() + " changed concurrently")));
    }
}

package com.example.annotate.mutation;

import com.example.annotate.error.AnnotateException;
import com.example.annotate.error.ErrorKind;
import com.example.annotate.identity.VerifiedIdentity;
import com.example.annotate.persistence.dao.DocumentStore;
import com.example.annotate.persistence.entity.CommentDoc;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
public class OwnershipGuard {

    private final DocumentStore documents;

    public OwnershipGuard(DocumentStore documents) {
        this.documents = documents;
    }

    public Mono<CommentDoc> requireComment(String urlHash, String commentId) {
        return documents.getComment(urlHash, commentId)
                .switchIfEmpty(Mono.error(() -> new AnnotateException(ErrorKind.NOT_FOUND,
                        "comment " + commentId + " does not exist on " + urlHash)));
    }

    public Mono<CommentDoc> requireAuthor(VerifiedIdentity identity, String urlHash, String commentId) {
        return requireComment(urlHash, commentId)
                .doOnNext(comment -> assertOwner(comment.author(), identity, "comment " + commentId));
    }

    public void assertOwner(String ownerId, VerifiedIdentity identity, String resource) {
        if (ownerId == null || !ownerId.equals(identity.uid())) {
            throw new AnnotateException(ErrorKind.NOT_AUTHORIZED,
                    identity.uid() + " does not own " + resource + " (owner " + ownerId + ")");
        }
    }
}

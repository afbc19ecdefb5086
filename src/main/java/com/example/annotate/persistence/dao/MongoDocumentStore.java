package com.example.annotate.persistence.dao;

import com.example.annotate.config.AnnotateProps;
import com.example.annotate.error.AnnotateException;
import com.example.annotate.error.ErrorKind;
import com.example.annotate.persistence.entity.CommentDoc;
import com.example.annotate.persistence.entity.FlatCommentDoc;
import com.example.annotate.persistence.entity.MarkerDoc;
import com.example.annotate.persistence.entity.MarkerKey;
import com.example.annotate.persistence.entity.WebsiteDoc;
import com.example.annotate.persistence.entity.WebsiteMetadata;
import com.example.annotate.store.StoreCalls;
import org.springframework.data.mongodb.core.ReactiveMongoOperations;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

@Component
public class MongoDocumentStore implements DocumentStore {

    private final ReactiveMongoOperations mongo;
    private final StoreCalls calls;
    private final Clock clock;

    public MongoDocumentStore(ReactiveMongoOperations mongo, AnnotateProps props, Clock clock) {
        this.mongo = mongo;
        this.calls = new StoreCalls("mongo", props.store());
        this.clock = clock;
    }

    @Override
    public Mono<WebsiteDoc> getWebsite(String urlHash) {
        return calls.read(mongo.findById(urlHash, WebsiteDoc.class));
    }

    @Override
    public Mono<WebsiteDoc> createWebsite(WebsiteDoc website) {
        return calls.write(mongo.insert(website));
    }

    @Override
    public Mono<Void> refreshWebsiteMetadata(String urlHash, WebsiteMetadata metadata) {
        Update update = metadataUpdate(metadata);
        if (update.getUpdateObject().isEmpty()) {
            return Mono.empty();
        }
        return calls.write(mongo.updateFirst(byId(urlHash), update, WebsiteDoc.class)).then();
    }

    @Override
    public Mono<CommentDoc> createComment(CommentDoc comment) {
        return calls.write(mongo.insert(comment));
    }

    @Override
    public Mono<CommentDoc> getComment(String urlHash, String commentId) {
        return calls.read(mongo.findById(CommentDoc.key(urlHash, commentId), CommentDoc.class));
    }

    @Override
    public Mono<Void> updateCommentBody(String urlHash, String commentId, String body) {
        Update update = new Update()
                .set("body", body)
                .set("editedAt", Instant.now(clock));

        return calls.write(mongo.updateFirst(byId(CommentDoc.key(urlHash, commentId)), update, CommentDoc.class))
                .flatMap(r -> r.getMatchedCount() == 0
                        ? Mono.<Void>error(new AnnotateException(ErrorKind.NOT_FOUND,
                                "comment " + commentId + " does not exist on " + urlHash))
                        : Mono.<Void>empty());
    }

    @Override
    public Mono<Boolean> deleteComment(String urlHash, String commentId) {
        return calls.write(mongo.remove(byId(CommentDoc.key(urlHash, commentId)), CommentDoc.class))
                .map(r -> r.getDeletedCount() > 0);
    }

    @Override
    public Mono<FlatCommentDoc> createFlatComment(FlatCommentDoc flatComment) {
        return calls.write(mongo.insert(flatComment));
    }

    @Override
    public Mono<FlatCommentDoc> getFlatComment(String owner, String commentId) {
        return calls.read(mongo.findById(FlatCommentDoc.key(owner, commentId), FlatCommentDoc.class));
    }

    @Override
    public Mono<Void> deleteFlatComment(String owner, String commentId, String urlHash) {
        Query query = Query.query(Criteria.where("_id").is(FlatCommentDoc.key(owner, commentId)).and("urlHash").is(urlHash));
        return calls.write(mongo.remove(query, FlatCommentDoc.class)).then();
    }

    @Override
    public Mono<MarkerDoc> getMarker(MarkerKey key) {
        return calls.read(mongo.findById(key.id(), MarkerDoc.class));
    }

    @Override
    public Mono<MarkerDoc> createMarker(MarkerDoc marker) {
        return calls.write(mongo.insert(marker));
    }

    @Override
    public Mono<Boolean> swapMarkerValue(MarkerKey key, String expected, String next) {
        Query query = Query.query(Criteria.where("_id").is(key.id()).and("value").is(expected));
        return calls.write(mongo.updateFirst(query, new Update().set("value", next), MarkerDoc.class))
                .map(r -> r.getModifiedCount() > 0);
    }

    @Override
    public Mono<Boolean> deleteMarker(MarkerKey key, String expected) {
        Query query = Query.query(Criteria.where("_id").is(key.id()).and("value").is(expected));
        return calls.write(mongo.remove(query, MarkerDoc.class))
                .map(r -> r.getDeletedCount() > 0);
    }

    static Update metadataUpdate(WebsiteMetadata metadata) {
        Update update = new Update();
        if (metadata == null) return update;

        WebsiteMetadata m = metadata.compact();
        if (m.title() != null) update.set("title", m.title());
        if (m.description() != null) update.set("description", m.description());
        if (m.keywords() != null) update.set("keywords", m.keywords());
        if (m.image() != null) update.set("image", m.image());
        if (m.favicon() != null) update.set("favicon", m.favicon());
        return update;
    }

    private static Query byId(String id) {
        return Query.query(Criteria.where("_id").is(id));
    }
}

package com.example.annotate.mutation;

import com.example.annotate.error.ErrorKind;
import com.example.annotate.error.Outcome;
import com.example.annotate.identity.Caller;
import com.example.annotate.mutation.dto.AddCommentRequest;
import com.example.annotate.mutation.dto.CommentRef;
import com.example.annotate.mutation.dto.EditCommentRequest;
import com.example.annotate.persistence.entity.CommentDoc;
import com.example.annotate.persistence.entity.FlatCommentDoc;
import com.example.annotate.persistence.entity.MarkerKey;
import com.example.annotate.persistence.entity.MarkerKind;
import com.example.annotate.persistence.entity.WebsiteMetadata;
import com.example.annotate.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CommentOperationsTest {

    private static final String URL = "https://blog.example.com/posts/reactive-streams";
    private static final String OTHER_URL = "https://blog.example.com/posts/backpressure";

    private Fixtures f;
    private Caller alice;
    private Caller bob;
    private String hash;

    @BeforeEach
    void setUp() {
        f = new Fixtures();
        alice = f.register("uid-alice", "Alice", "alice");
        bob = f.register("uid-bob", "Bob", "bob");
        hash = f.hasher.hash(URL);
    }

    @Test
    void add_onUnindexedPageIndexesOnceAndCountsComment() {
        Outcome<Void> outcome = f.comments.addComment(alice, addRequest("c-1", "First!")).block();

        assertTrue(outcome.status());
        assertEquals(1, f.documents.websiteCreates());
        assertEquals(1L, f.aggregates.getCommentCount(hash).block());
        assertEquals("Reactive Streams", f.documents.getWebsite(hash).block().title());
        assertEquals("uid-alice", f.documents.getWebsite(hash).block().indexor());

        CommentDoc comment = f.documents.getComment(hash, "c-1").block();
        assertEquals("uid-alice", comment.author());
        assertEquals(0, comment.replyCount());
        assertEquals(Instant.now(f.clock), comment.createdAt());

        FlatCommentDoc flat = f.documents.getFlatComment("uid-alice", "c-1").block();
        assertEquals(hash, flat.urlHash());
        assertEquals("blog.example.com", flat.domain());
    }

    @Test
    void add_onIndexedPageDoesNotIndexAgain() {
        f.aggregates.setImpressions(hash, 12);

        assertTrue(f.comments.addComment(alice, addRequest("c-1", "Hello")).block().status());

        assertEquals(0, f.documents.websiteCreates());
        assertEquals(1L, f.aggregates.getCommentCount(hash).block());
    }

    @Test
    void add_withCollidingIdFailsAndLeavesCountUntouched() {
        assertTrue(f.comments.addComment(alice, addRequest("c-1", "Hello")).block().status());

        Outcome<Void> outcome = f.comments.addComment(bob, addRequest("c-1", "Hijack")).block();

        assertFalse(outcome.status());
        assertEquals(ErrorKind.ALREADY_EXISTS, outcome.error());
        assertEquals(1L, f.aggregates.getCommentCount(hash).block());
        assertEquals("Hello", f.documents.getComment(hash, "c-1").block().body());
    }

    @Test
    void addThenDelete_restoresCountAndRemovesFlatComment() {
        f.aggregates.setImpressions(hash, 1);
        assertTrue(f.comments.addComment(alice, addRequest("c-0", "Earlier")).block().status());
        long before = f.aggregates.getCommentCount(hash).block();

        assertTrue(f.comments.addComment(alice, addRequest("c-1", "Hello")).block().status());
        assertTrue(f.comments.deleteComment(alice, new CommentRef(URL, hash, "c-1")).block().status());

        assertEquals(before, f.aggregates.getCommentCount(hash).block());
        StepVerifier.create(f.documents.getComment(hash, "c-1")).verifyComplete();
        StepVerifier.create(f.documents.getFlatComment("uid-alice", "c-1")).verifyComplete();
        assertNotNull(f.documents.getFlatComment("uid-alice", "c-0").block());
    }

    @Test
    void add_reusingIdOnAnotherPageFailsBeforeAnyWrite() {
        assertTrue(f.comments.addComment(alice, addRequest("c-1", "Hello")).block().status());
        String otherHash = f.hasher.hash(OTHER_URL);
        int documentWrites = f.documents.writes();
        int aggregateWrites = f.aggregates.writes();

        Outcome<Void> outcome = f.comments.addComment(alice,
                new AddCommentRequest("c-1", OTHER_URL, otherHash, "blog.example.com", "Again", null)).block();

        assertEquals(ErrorKind.ALREADY_EXISTS, outcome.error());
        StepVerifier.create(f.documents.getComment(otherHash, "c-1")).verifyComplete();
        assertEquals(0L, f.aggregates.getCommentCount(otherHash).block());
        assertEquals(hash, f.documents.getFlatComment("uid-alice", "c-1").block().urlHash());
        assertEquals(documentWrites, f.documents.writes());
        assertEquals(aggregateWrites, f.aggregates.writes());
    }

    @Test
    void delete_keepsFlatCommentShadowingSameIdOnAnotherPage() {
        assertTrue(f.comments.addComment(alice, addRequest("c-1", "Hello")).block().status());
        String otherHash = f.hasher.hash(OTHER_URL);
        f.documents.createComment(CommentDoc.create("c-1", otherHash, "blog.example.com", OTHER_URL,
                "uid-alice", "Stray", Instant.now(f.clock))).block();

        assertTrue(f.comments.deleteComment(alice, new CommentRef(OTHER_URL, otherHash, "c-1")).block().status());

        StepVerifier.create(f.documents.getComment(otherHash, "c-1")).verifyComplete();
        assertNotNull(f.documents.getComment(hash, "c-1").block());
        assertEquals(hash, f.documents.getFlatComment("uid-alice", "c-1").block().urlHash());
    }

    @Test
    void delete_byNonAuthorIsRejectedWithoutMutation() {
        assertTrue(f.comments.addComment(alice, addRequest("c-1", "Hello")).block().status());
        int documentWrites = f.documents.writes();
        int aggregateWrites = f.aggregates.writes();

        Outcome<Void> outcome = f.comments.deleteComment(bob, new CommentRef(URL, hash, "c-1")).block();

        assertFalse(outcome.status());
        assertEquals(ErrorKind.NOT_AUTHORIZED, outcome.error());
        assertEquals("You are not allowed to modify this comment.", outcome.reason());
        assertEquals(1L, f.aggregates.getCommentCount(hash).block());
        assertNotNull(f.documents.getComment(hash, "c-1").block());
        assertEquals(documentWrites, f.documents.writes());
        assertEquals(aggregateWrites, f.aggregates.writes());
    }

    @Test
    void delete_missingCommentIsNotFound() {
        Outcome<Void> outcome = f.comments.deleteComment(alice, new CommentRef(URL, hash, "nope")).block();

        assertEquals(ErrorKind.NOT_FOUND, outcome.error());
        assertEquals(0L, f.aggregates.getCommentCount(hash).block());
    }

    @Test
    void edit_replacesBodyForAuthorOnly() {
        assertTrue(f.comments.addComment(alice, addRequest("c-1", "Helo")).block().status());

        Outcome<Void> denied = f.comments.editComment(bob, new EditCommentRequest(URL, hash, "c-1", "Vandalised")).block();
        Outcome<Void> edited = f.comments.editComment(alice, new EditCommentRequest(URL, hash, "c-1", "Hello")).block();

        assertEquals(ErrorKind.NOT_AUTHORIZED, denied.error());
        assertTrue(edited.status());
        assertEquals("Hello", f.documents.getComment(hash, "c-1").block().body());
        assertEquals(Instant.now(f.clock), f.documents.getComment(hash, "c-1").block().editedAt());
        assertEquals(1L, f.aggregates.getCommentCount(hash).block());
    }

    @Test
    void edit_withBlankBodyIsInvalid() {
        assertTrue(f.comments.addComment(alice, addRequest("c-1", "Hello")).block().status());

        Outcome<Void> outcome = f.comments.editComment(alice, new EditCommentRequest(URL, hash, "c-1", " ")).block();

        assertEquals(ErrorKind.INVALID_PAYLOAD, outcome.error());
        assertEquals("Hello", f.documents.getComment(hash, "c-1").block().body());
    }

    @Test
    void report_isWriteOnce() {
        assertTrue(f.comments.addComment(alice, addRequest("c-1", "Hello")).block().status());
        CommentRef ref = new CommentRef(URL, hash, "c-1");

        assertTrue(f.comments.reportComment(bob, ref).block().status());
        assertTrue(f.comments.reportComment(bob, ref).block().status());
        assertTrue(f.comments.notInterestedInComment(bob, ref).block().status());

        assertNotNull(f.documents.getMarker(MarkerKey.comment(MarkerKind.COMMENT_REPORT, "uid-bob", hash, "c-1")).block());
        assertNotNull(f.documents.getMarker(MarkerKey.comment(MarkerKind.COMMENT_NOT_INTERESTED, "uid-bob", hash, "c-1")).block());
    }

    @Test
    void report_onMissingCommentIsNotFound() {
        Outcome<Void> outcome = f.comments.reportComment(bob, new CommentRef(URL, hash, "ghost")).block();

        assertEquals(ErrorKind.NOT_FOUND, outcome.error());
    }

    @Test
    void commentVotes_followToggleContract() {
        assertTrue(f.comments.addComment(alice, addRequest("c-1", "Hello")).block().status());
        CommentRef ref = new CommentRef(URL, hash, "c-1");
        MarkerKey key = MarkerKey.comment(MarkerKind.COMMENT_VOTE, "uid-bob", hash, "c-1");

        assertTrue(f.comments.downvoteComment(bob, ref).block().status());
        assertEquals("DOWN", f.documents.getMarker(key).block().value());

        assertTrue(f.comments.upvoteComment(bob, ref).block().status());
        assertEquals("UP", f.documents.getMarker(key).block().value());

        assertTrue(f.comments.upvoteComment(bob, ref).block().status());
        StepVerifier.create(f.documents.getMarker(key)).verifyComplete();
    }

    @Test
    void bookmarkComment_togglesPresence() {
        assertTrue(f.comments.addComment(alice, addRequest("c-1", "Hello")).block().status());
        CommentRef ref = new CommentRef(URL, hash, "c-1");
        MarkerKey key = MarkerKey.comment(MarkerKind.COMMENT_BOOKMARK, "uid-bob", hash, "c-1");

        assertTrue(f.comments.bookmarkComment(bob, ref).block().status());
        assertNotNull(f.documents.getMarker(key).block());

        assertTrue(f.comments.bookmarkComment(bob, ref).block().status());
        StepVerifier.create(f.documents.getMarker(key)).verifyComplete();
    }

    @Test
    void add_withForgedHashWritesNothing() {
        String forged = f.hasher.hash("https://blog.example.com/other");
        AddCommentRequest req = new AddCommentRequest("c-1", URL, forged, "blog.example.com", "Hi", null);

        Outcome<Void> outcome = f.comments.addComment(alice, req).block();

        assertEquals(ErrorKind.INTEGRITY_MISMATCH, outcome.error());
        assertEquals(0, f.documents.writes());
        assertEquals(0, f.aggregates.writes());
    }

    private AddCommentRequest addRequest(String commentId, String body) {
        return new AddCommentRequest(commentId, URL, hash, "blog.example.com", body,
                new WebsiteMetadata("Reactive Streams", "A post", null, null, null));
    }
}

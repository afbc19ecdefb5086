package com.example.annotate.mutation;

import com.example.annotate.error.Outcome;
import com.example.annotate.mutation.dto.AddCommentRequest;
import com.example.annotate.mutation.dto.CommentRef;
import com.example.annotate.mutation.dto.EditCommentRequest;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/comments")
public class CommentController {

    private final CommentOperations operations;

    public CommentController(CommentOperations operations) {
        this.operations = operations;
    }

    @PostMapping("/add")
    public Mono<Outcome<Void>> add(@RequestBody @Valid AddCommentRequest req, ServerWebExchange exchange) {
        return operations.addComment(CallerHeaders.from(exchange), req);
    }

    @PostMapping("/delete")
    public Mono<Outcome<Void>> delete(@RequestBody @Valid CommentRef req, ServerWebExchange exchange) {
        return operations.deleteComment(CallerHeaders.from(exchange), req);
    }

    @PostMapping("/edit")
    public Mono<Outcome<Void>> edit(@RequestBody @Valid EditCommentRequest req, ServerWebExchange exchange) {
        return operations.editComment(CallerHeaders.from(exchange), req);
    }

    @PostMapping("/report")
    public Mono<Outcome<Void>> report(@RequestBody @Valid CommentRef req, ServerWebExchange exchange) {
        return operations.reportComment(CallerHeaders.from(exchange), req);
    }

    @PostMapping("/not-interested")
    public Mono<Outcome<Void>> notInterested(@RequestBody @Valid CommentRef req, ServerWebExchange exchange) {
        return operations.notInterestedInComment(CallerHeaders.from(exchange), req);
    }

    @PostMapping("/upvote")
    public Mono<Outcome<Void>> upvote(@RequestBody @Valid CommentRef req, ServerWebExchange exchange) {
        return operations.upvoteComment(CallerHeaders.from(exchange), req);
    }

    @PostMapping("/downvote")
    public Mono<Outcome<Void>> downvote(@RequestBody @Valid CommentRef req, ServerWebExchange exchange) {
        return operations.downvoteComment(CallerHeaders.from(exchange), req);
    }

    @PostMapping("/bookmark")
    public Mono<Outcome<Void>> bookmark(@RequestBody @Valid CommentRef req, ServerWebExchange exchange) {
        return operations.bookmarkComment(CallerHeaders.from(exchange), req);
    }
}

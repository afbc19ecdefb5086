package com.example.annotate.mutation;

import com.example.annotate.aggregate.FlagReason;
import com.example.annotate.error.Outcome;
import com.example.annotate.mutation.dto.FlagWebsiteRequest;
import com.example.annotate.mutation.dto.IndexWebsiteRequest;
import com.example.annotate.mutation.dto.VoteWebsiteRequest;
import com.example.annotate.mutation.dto.WebsiteRef;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/websites")
public class WebsiteController {

    private final WebsiteOperations operations;
    private final WebsiteStats stats;

    public WebsiteController(WebsiteOperations operations, WebsiteStats stats) {
        this.operations = operations;
        this.stats = stats;
    }

    @PostMapping("/index")
    public Mono<Outcome<Void>> index(@RequestBody @Valid IndexWebsiteRequest req, ServerWebExchange exchange) {
        return operations.indexWebsite(CallerHeaders.from(exchange), req);
    }

    @PostMapping("/flag")
    public Mono<Outcome<Void>> flag(@RequestBody @Valid FlagWebsiteRequest req, ServerWebExchange exchange) {
        return operations.flagWebsite(CallerHeaders.from(exchange), req);
    }

    @PostMapping("/upvote")
    public Mono<Outcome<Void>> upvote(@RequestBody @Valid VoteWebsiteRequest req, ServerWebExchange exchange) {
        return operations.upvoteWebsite(CallerHeaders.from(exchange), req);
    }

    @PostMapping("/downvote")
    public Mono<Outcome<Void>> downvote(@RequestBody @Valid VoteWebsiteRequest req, ServerWebExchange exchange) {
        return operations.downvoteWebsite(CallerHeaders.from(exchange), req);
    }

    @PostMapping("/bookmark")
    public Mono<Outcome<Void>> bookmark(@RequestBody @Valid WebsiteRef req, ServerWebExchange exchange) {
        return operations.bookmarkWebsite(CallerHeaders.from(exchange), req);
    }

    @GetMapping("/{urlHash}/impressions")
    public Mono<Outcome<Long>> impressions(@PathVariable String urlHash) {
        return stats.impressions(urlHash);
    }

    @GetMapping("/{urlHash}/comment-count")
    public Mono<Outcome<Long>> commentCount(@PathVariable String urlHash) {
        return stats.commentCount(urlHash);
    }

    @GetMapping("/{urlHash}/flag-count")
    public Mono<Outcome<Long>> flagCount(@PathVariable String urlHash) {
        return stats.flagCount(urlHash);
    }

    @GetMapping("/{urlHash}/flag-distribution")
    public Mono<Outcome<Map<FlagReason, Long>>> flagDistribution(@PathVariable String urlHash) {
        return stats.flagDistribution(urlHash);
    }

    @GetMapping("/{urlHash}/flag-distribution/{reason}")
    public Mono<Outcome<Long>> flagDistributionForReason(@PathVariable String urlHash, @PathVariable FlagReason reason) {
        return stats.flagDistributionForReason(urlHash, reason);
    }

    @GetMapping("/{urlHash}/flags-cumulative-weight")
    public Mono<Outcome<Double>> cumulativeWeight(@PathVariable String urlHash) {
        return stats.cumulativeWeight(urlHash);
    }
}

package com.example.annotate.mutation;

import com.example.annotate.identity.Caller;
import org.springframework.http.HttpHeaders;
import org.springframework.web.server.ServerWebExchange;

/**
 * The authenticating gateway forwards the session principal in these headers.
 */
public final class CallerHeaders {
    private CallerHeaders() {}

    public static final String USER_ID = "X-User-Id";
    public static final String USER_NAME = "X-User-Name";

    public static Caller from(ServerWebExchange exchange) {
        HttpHeaders headers = exchange.getRequest().getHeaders();
        return new Caller(headers.getFirst(USER_ID), headers.getFirst(USER_NAME));
    }
}

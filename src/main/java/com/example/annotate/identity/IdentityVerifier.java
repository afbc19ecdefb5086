package com.example.annotate.identity;

import com.example.annotate.error.AnnotateException;
import com.example.annotate.error.ErrorKind;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Gate that runs first in every mutation: the caller must be signed in, carry a display name
 * and own a reserved username.
 */
@Component
public class IdentityVerifier {

    private final UsernameDirectory usernames;

    public IdentityVerifier(UsernameDirectory usernames) {
        this.usernames = usernames;
    }

    public Mono<VerifiedIdentity> verify(Caller caller) {
        if (caller == null || isBlank(caller.uid())) {
            return Mono.error(new AnnotateException(ErrorKind.NOT_AUTHENTICATED, "no session principal"));
        }
        String uid = caller.uid();
        if (isBlank(caller.displayName())) {
            return Mono.error(new AnnotateException(ErrorKind.INCOMPLETE_PROFILE, "no display name for " + uid));
        }

        return usernames.findUsername(uid)
                .filter(username -> !isBlank(username))
                .switchIfEmpty(Mono.error(() ->
                        new AnnotateException(ErrorKind.INCOMPLETE_PROFILE, "no username reserved for " + uid)))
                .map(username -> new VerifiedIdentity(uid, caller.displayName(), username));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}

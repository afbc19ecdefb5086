package com.example.annotate.error;

/**
 * Failure taxonomy of the mutation core together with the message a caller is allowed to see.
 * <p>
 * Rejections carry a specific, non-sensitive message. Infrastructure failures all collapse
 * into the same generic message; their detail only ever reaches the failure log.
 */
public enum ErrorKind {
    NOT_AUTHENTICATED("Please login to continue!", true),
    INCOMPLETE_PROFILE("Please complete your profile with a name and a username to continue!", true),
    INTEGRITY_MISMATCH("The page could not be verified, please reload it and try again.", true),
    NOT_AUTHORIZED("You are not allowed to modify this comment.", true),
    NOT_FOUND("The requested item does not exist.", true),
    ALREADY_EXISTS("This item already exists.", true),
    CONFLICT("Your previous action is still being processed, please try again.", true),
    INVALID_PAYLOAD("The request is missing required details.", true),
    STORE_UNAVAILABLE("We're currently facing some problems, please try again later!", false),
    UNKNOWN("We're currently facing some problems, please try again later!", false);

    private final String publicMessage;
    private final boolean rejection;

    ErrorKind(String publicMessage, boolean rejection) {
        this.publicMessage = publicMessage;
        this.rejection = rejection;
    }

    public String publicMessage() {
        return publicMessage;
    }

    /**
     * True when the failure is a decision about the request (auth, integrity, ownership, validation)
     * rather than a malfunction of a store or of the service itself.
     */
    public boolean isRejection() {
        return rejection;
    }
}

package com.example.annotate.error;

public class AnnotateException extends RuntimeException {
    private final ErrorKind kind;

    public AnnotateException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AnnotateException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static boolean is(Throwable e, ErrorKind kind) {
        return e instanceof AnnotateException ae && ae.kind() == kind;
    }
}

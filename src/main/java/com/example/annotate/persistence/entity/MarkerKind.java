package com.example.annotate.persistence.entity;

public enum MarkerKind {
    WEBSITE_VOTE,
    WEBSITE_FLAG,
    WEBSITE_BOOKMARK,
    COMMENT_VOTE,
    COMMENT_BOOKMARK,
    COMMENT_REPORT,
    COMMENT_NOT_INTERESTED
}

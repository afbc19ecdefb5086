package com.example.annotate.util;

import com.example.annotate.error.AnnotateException;
import com.example.annotate.error.ErrorKind;
import org.springframework.stereotype.Component;

/**
 * Content key of a page: SHA-512 (128 lowercase hex chars) of its URL without the fragment.
 */
@Component
public class ContentHasher {

    public String hash(String url) {
        if (url == null || url.isBlank()) {
            throw new AnnotateException(ErrorKind.INVALID_PAYLOAD, "url is required");
        }
        return Sha.sha512Hex(stripFragment(url));
    }

    /**
     * Recomputes the key for {@code url} and rejects a caller-supplied key that does not match it.
     */
    public String requireMatch(String url, String suppliedHash) {
        String expected = hash(url);
        if (!expected.equals(suppliedHash)) {
            throw new AnnotateException(ErrorKind.INTEGRITY_MISMATCH,
                    "generated hash for " + url + " did not equal supplied hash " + suppliedHash);
        }
        return expected;
    }

    static String stripFragment(String url) {
        int hash = url.indexOf('#');
        return hash < 0 ? url : url.substring(0, hash);
    }
}

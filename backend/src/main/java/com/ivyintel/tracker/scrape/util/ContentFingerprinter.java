package com.ivyintel.tracker.scrape.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Change fingerprint for fetched documents. Script and style blocks and whitespace layout do not
 * contribute, so pages that differ only in that noise hash identically.
 */
public final class ContentFingerprinter {
    private static final Pattern SCRIPT_BLOCK =
        Pattern.compile("<script.*?>.*?</script>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern STYLE_BLOCK =
        Pattern.compile("<style.*?>.*?</style>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern WHITESPACE = Pattern.compile("(?U)\\s+");

    private ContentFingerprinter() {
    }

    public static String normalize(String document) {
        if (document == null || document.isEmpty()) {
            return "";
        }
        String stripped = SCRIPT_BLOCK.matcher(document).replaceAll("");
        stripped = STYLE_BLOCK.matcher(stripped).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    public static String fingerprint(String document) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(normalize(document).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}

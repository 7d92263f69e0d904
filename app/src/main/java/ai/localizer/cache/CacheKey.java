package ai.localizer.cache;

import ai.localizer.translate.TranslationContext;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

/**
 * Identity of one cached translation. Holds a fixed-width hash of the source text instead of
 * the text itself, so keys stay small and never leak user content into storage.
 */
public record CacheKey(String sourceLang, String targetLang, String contentHash, TranslationContext context) {

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    public CacheKey {
        sourceLang = normalizeTag(sourceLang, "sourceLang");
        targetLang = normalizeTag(targetLang, "targetLang");
        contentHash = Objects.requireNonNull(contentHash, "contentHash");
        context = Objects.requireNonNull(context, "context");
    }

    public static CacheKey create(String text, String sourceLang, String targetLang, TranslationContext context) {
        Objects.requireNonNull(text, "text");
        return new CacheKey(sourceLang, targetLang, hash(text), context);
    }

    /**
     * Canonical {@code {src}_{dst}_{CONTEXT}_{hash}} form used by key-value stores. Not reversible.
     */
    public String toStorageKey() {
        return sourceLang + "_" + targetLang + "_" + context.name() + "_" + contentHash;
    }

    /**
     * 64-bit FNV-1a over the UTF-8 bytes, rendered as 16 lowercase hex digits.
     */
    static String hash(String text) {
        long hash = FNV_OFFSET_BASIS;
        for (byte b : text.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return String.format("%016x", hash);
    }

    private static String normalizeTag(String tag, String field) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return tag.trim().toLowerCase(Locale.ROOT);
    }
}

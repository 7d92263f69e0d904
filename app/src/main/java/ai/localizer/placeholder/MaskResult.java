package ai.localizer.placeholder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Text with its placeholders swapped for opaque tokens, plus the token to placeholder mapping.
 */
public record MaskResult(String maskedText, Map<String, String> placeholders) {

    public MaskResult {
        Objects.requireNonNull(maskedText, "maskedText");
        placeholders = placeholders == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(placeholders));
    }

    public int placeholderCount() {
        return placeholders.size();
    }

    public boolean hasPlaceholders() {
        return !placeholders.isEmpty();
    }
}

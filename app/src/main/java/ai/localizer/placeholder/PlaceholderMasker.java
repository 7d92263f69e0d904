package ai.localizer.placeholder;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shields machine-meaningful substrings (format specifiers, named placeholders, template
 * expressions and markup tags) from a natural-language translator.
 *
 * <p>Placeholders are replaced by tokens of the form {@code ⟦PH<n>⟧}. Text that already looks
 * like a token is masked first, so it comes back verbatim. Restoration is a single pass over the
 * translated text and never rescans a restored value.
 */
public class PlaceholderMasker {

    private static final Logger LOGGER = LoggerFactory.getLogger(PlaceholderMasker.class);

    static final String TOKEN_PREFIX = "⟦PH";
    static final String TOKEN_SUFFIX = "⟧";

    private static final Pattern TOKEN = Pattern.compile("⟦PH\\d+⟧");

    // Scan order matters only to avoid masking inside an earlier match.
    private static final List<Pattern> PATTERNS = List.of(
            TOKEN,
            Pattern.compile("%(\\d+\\$)?[,+\\-# 0(]*\\d*(?:\\.\\d+)?[diouxXeEfFgGaAcsStTbBhHnp%]"),
            Pattern.compile("\\{[a-zA-Z_][a-zA-Z0-9_]*\\}"),
            Pattern.compile("\\{\\d+\\}"),
            Pattern.compile("\\$\\{[^}]+\\}"),
            Pattern.compile("</?[a-zA-Z][a-zA-Z0-9]*(?:\\s+[^<>]*?)?\\s*/?>"));

    /**
     * Masks placeholders in {@code text}, hands the masked text to {@code translateFn} and
     * restores the placeholders in whatever the function returns.
     *
     * @param text source text, never {@code null}
     * @param translateFn translation applied to the masked text
     * @return translated text with original placeholders restored
     */
    public String translateWithProtection(String text, UnaryOperator<String> translateFn) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(translateFn, "translateFn");
        MaskResult masked = mask(text);
        String translated = translateFn.apply(masked.maskedText());
        return unmask(translated == null ? "" : translated, masked.placeholders());
    }

    MaskResult mask(String text) {
        if (text.isEmpty()) {
            return new MaskResult(text, Map.of());
        }
        StringBuilder current = new StringBuilder(text);
        Map<String, String> placeholders = new LinkedHashMap<>();
        int tokenIndex = 0;
        for (Pattern pattern : PATTERNS) {
            List<MatchSpan> matches = findAll(pattern, current);
            for (int i = matches.size() - 1; i >= 0; i--) {
                MatchSpan match = matches.get(i);
                if (!match.value().contentEquals(current.subSequence(match.start(), match.end()))) {
                    continue;
                }
                String token = token(tokenIndex++);
                placeholders.put(token, match.value());
                current.replace(match.start(), match.end(), token);
            }
        }
        return new MaskResult(current.toString(), placeholders);
    }

    String unmask(String maskedText, Map<String, String> placeholders) {
        if (placeholders.isEmpty()) {
            return maskedText;
        }
        Set<String> restored = new HashSet<>();
        StringBuilder result = new StringBuilder(maskedText.length());
        Matcher matcher = TOKEN.matcher(maskedText);
        while (matcher.find()) {
            String original = placeholders.get(matcher.group());
            if (original == null) {
                matcher.appendReplacement(result, Matcher.quoteReplacement(matcher.group()));
            } else {
                restored.add(matcher.group());
                matcher.appendReplacement(result, Matcher.quoteReplacement(original));
            }
        }
        matcher.appendTail(result);
        int missing = placeholders.size() - restored.size();
        if (missing > 0) {
            LOGGER.warn("Translator dropped {} of {} placeholder tokens; they were not restored",
                    missing, placeholders.size());
        }
        return result.toString();
    }

    static String token(int index) {
        return TOKEN_PREFIX + index + TOKEN_SUFFIX;
    }

    private static List<MatchSpan> findAll(Pattern pattern, CharSequence text) {
        List<MatchSpan> matches = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            matches.add(new MatchSpan(matcher.start(), matcher.end(), matcher.group()));
        }
        return matches;
    }

    private record MatchSpan(int start, int end, String value) {
    }
}

package ai.localizer.localize;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the current target language and notifies listeners when it changes. Persisting the
 * choice is left to the application.
 */
public class LanguageSelection {

    private static final Logger LOGGER = LoggerFactory.getLogger(LanguageSelection.class);

    private final List<String> supportedTags;
    private final List<Consumer<String>> listeners = new CopyOnWriteArrayList<>();
    private volatile String currentTag;

    public LanguageSelection(List<String> supportedTags, String initialTag) {
        if (supportedTags == null || supportedTags.isEmpty()) {
            throw new IllegalArgumentException("supportedTags must not be empty");
        }
        this.supportedTags = List.copyOf(supportedTags);
        this.currentTag = resolveInitial(this.supportedTags, initialTag);
    }

    /**
     * Picks the supported tag matching {@code systemTag} exactly, then by primary subtag, and
     * falls back to the first supported tag.
     */
    static String resolveInitial(List<String> supportedTags, String systemTag) {
        if (systemTag != null && !systemTag.isBlank()) {
            for (String tag : supportedTags) {
                if (LanguageMatchPolicy.EXACT.isSameLanguage(tag, systemTag)) {
                    return tag;
                }
            }
            for (String tag : supportedTags) {
                if (LanguageMatchPolicy.PRIMARY_SUBTAG.isSameLanguage(tag, systemTag)) {
                    return tag;
                }
            }
        }
        return supportedTags.get(0);
    }

    public String current() {
        return currentTag;
    }

    public List<String> supportedTags() {
        return supportedTags;
    }

    /**
     * Switches the target language and notifies listeners if it changed.
     *
     * @throws IllegalArgumentException if {@code tag} is not one of the supported tags
     */
    public void select(String tag) {
        String resolved = supportedTags.stream()
                .filter(candidate -> LanguageMatchPolicy.EXACT.isSameLanguage(candidate, tag))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported language: " + tag));
        String previous;
        synchronized (this) {
            previous = currentTag;
            currentTag = resolved;
        }
        if (previous.equals(resolved)) {
            return;
        }
        LOGGER.info("Target language changed from {} to {}", previous, resolved);
        for (Consumer<String> listener : listeners) {
            try {
                listener.accept(resolved);
            } catch (RuntimeException ex) {
                LOGGER.warn("Language change listener failed", ex);
            }
        }
    }

    public void addListener(Consumer<String> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(Consumer<String> listener) {
        listeners.remove(listener);
    }
}

package ai.localizer.translate;

/**
 * Contract a backing translation engine implements, whether on-device, remote or custom.
 */
public interface Translator extends AutoCloseable {

    /**
     * Translates {@code text} from {@code sourceLanguageTag} to {@code targetLanguageTag}.
     *
     * @throws UnsupportedLanguageException when a tag cannot be mapped
     * @throws ModelNotAvailableException when the pair has not been prepared
     * @throws TranslationException on any other engine failure
     */
    String translate(String text, String sourceLanguageTag, String targetLanguageTag, TranslationContext context);

    /**
     * Whether the engine can serve the pair right now. May consult local state but should not
     * start any warm-up.
     */
    default boolean isReady(String sourceLanguageTag, String targetLanguageTag) {
        return true;
    }

    /**
     * Performs whatever warm-up the pair needs and reports the result. Engines without warm-up
     * return {@link PrepareResult#ready()} immediately.
     */
    default PrepareResult prepare(String sourceLanguageTag, String targetLanguageTag) {
        return PrepareResult.ready();
    }

    /**
     * Releases held resources. Calling it more than once has no further effect.
     */
    @Override
    default void close() {
    }
}

package ai.localizer.translate;

import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import java.util.Locale;
import java.util.Objects;

/**
 * Remote translator backed by a LangChain4j {@link ChatModel}. Remote models need no warm-up,
 * so it is always ready and {@link #prepare(String, String)} keeps the default.
 */
public class ChatModelTranslator implements Translator {

    private final ChatModel model;
    private final String providerName;
    private final String modelName;

    public ChatModelTranslator(ChatModel model, String providerName, String modelName) {
        this.model = Objects.requireNonNull(model, "model");
        this.providerName = requireNonBlank(providerName, "providerName");
        this.modelName = requireNonBlank(modelName, "modelName");
    }

    @Override
    public String translate(String text, String sourceLanguageTag, String targetLanguageTag, TranslationContext context) {
        if (text == null || text.isBlank()) {
            return text == null ? "" : text;
        }
        String response;
        try {
            response = model.chat(buildPrompt(text, sourceLanguageTag, targetLanguageTag, context));
        } catch (RuntimeException ex) {
            if (isModelMissing(ex)) {
                throw new ModelNotAvailableException(targetLanguageTag,
                        "%s model '%s' is not available.".formatted(providerName, modelName), ex);
            }
            throw new TranslationException("%s translation failed".formatted(providerName), ex);
        }
        if (response == null || response.isBlank()) {
            throw new TranslationException("%s model '%s' returned an empty translation".formatted(providerName, modelName));
        }
        return stripWrapping(response.strip());
    }

    String buildPrompt(String text, String sourceLanguageTag, String targetLanguageTag, TranslationContext context) {
        return """
Translate the text below from %s into %s.
Rules:
- The text is %s.
- Tokens of the form ⟦PH0⟧, ⟦PH1⟧, ... are placeholders. Copy every token exactly as written; never translate, renumber, or drop them. You may move them where the target grammar requires.
- Keep line breaks where the source has them.
- Output only the translated text. Do not add quotes, commentary, or code fences.

<text>
""".formatted(displayName(sourceLanguageTag), displayName(targetLanguageTag), describe(context == null ? TranslationContext.UI : context)) + text + "\n</text>";
    }

    private static String stripWrapping(String response) {
        String cleaned = response;
        if (cleaned.startsWith("<text>") && cleaned.endsWith("</text>")) {
            cleaned = cleaned.substring("<text>".length(), cleaned.length() - "</text>".length()).strip();
        }
        return cleaned;
    }

    private static String displayName(String languageTag) {
        Locale locale = Locale.forLanguageTag(languageTag.replace('_', '-'));
        String name = locale.getDisplayName(Locale.ENGLISH);
        if (name.isBlank()) {
            return languageTag;
        }
        return name + " (" + languageTag + ")";
    }

    private static String describe(TranslationContext context) {
        return switch (context) {
            case UI -> "a user interface label; keep it short";
            case BACKEND -> "a message returned by a backend service";
            case USER_CONTENT -> "content written by an end user; keep its tone";
            case SYSTEM -> "a system notification or error message";
        };
    }

    private boolean isModelMissing(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof ModelNotFoundException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}

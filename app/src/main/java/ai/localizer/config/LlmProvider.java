package ai.localizer.config;

import java.util.Locale;

/**
 * Remote chat-model providers usable as the production translator.
 */
public enum LlmProvider {
    GEMINI("gemini-2.5-flash"),
    OLLAMA("llama3.1:8b");

    private final String defaultModel;

    LlmProvider(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    public String defaultModel() {
        return defaultModel;
    }

    public static LlmProvider from(String value) {
        if (value == null) {
            return OLLAMA;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "gemini" -> GEMINI;
            case "ollama", "" -> OLLAMA;
            default -> throw new IllegalArgumentException("Unsupported LLM provider: " + value);
        };
    }
}

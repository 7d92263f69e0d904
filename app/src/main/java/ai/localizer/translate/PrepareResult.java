package ai.localizer.translate;

import java.util.Objects;

/**
 * Outcome of {@link Translator#prepare(String, String)}. {@link Ready} and {@link Failed} are
 * terminal; {@link Downloading} is transient and callers poll again until it resolves.
 */
public interface PrepareResult {

    boolean isTerminal();

    static PrepareResult ready() {
        return new Ready();
    }

    static PrepareResult downloading(double progress) {
        return new Downloading(progress);
    }

    static PrepareResult failed(TranslationException error) {
        return new Failed(error);
    }

    record Ready() implements PrepareResult {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    record Downloading(double progress) implements PrepareResult {
        public Downloading {
            if (Double.isNaN(progress) || progress < 0.0 || progress > 1.0) {
                throw new IllegalArgumentException("progress must be between 0.0 and 1.0");
            }
        }

        @Override
        public boolean isTerminal() {
            return false;
        }
    }

    record Failed(TranslationException error) implements PrepareResult {
        public Failed {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }
}

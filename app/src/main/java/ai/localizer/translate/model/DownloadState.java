package ai.localizer.translate.model;

import java.util.Objects;

/**
 * States a model download passes through: idle, downloading, then complete or failed.
 */
public interface DownloadState {

    static DownloadState idle() {
        return new Idle();
    }

    record Idle() implements DownloadState {
    }

    record Downloading(double progress, String languageCode) implements DownloadState {
        public Downloading {
            progress = Math.max(0.0, Math.min(1.0, progress));
            Objects.requireNonNull(languageCode, "languageCode");
        }
    }

    record Complete() implements DownloadState {
    }

    record Failed(Throwable error) implements DownloadState {
        public Failed {
            Objects.requireNonNull(error, "error");
        }
    }
}

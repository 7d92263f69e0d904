package ai.localizer.translate.model;

import java.io.IOException;
import java.util.Set;
import java.util.function.DoubleConsumer;

/**
 * Local registry of downloadable language models.
 */
public interface ModelRegistry {

    boolean isDownloaded(String languageCode);

    /**
     * Downloads the model for {@code languageCode}, reporting progress between 0.0 and 1.0.
     */
    void download(String languageCode, DoubleConsumer progressListener) throws IOException;

    Set<String> downloadedModels();
}

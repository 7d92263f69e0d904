package ai.localizer.translate.model;

@FunctionalInterface
public interface DownloadStateListener {

    void onStateChanged(DownloadState state);
}

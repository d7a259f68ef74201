package de.bsommerfeld.spellbook.sync.download;

/**
 * Callback for tracking download progress.
 */
@FunctionalInterface
public interface DownloadProgressListener {

    DownloadProgressListener NONE = (bytesRead, totalBytes) -> {
    };

    /**
     * Called once per chunk written to disk.
     *
     * @param bytesRead  bytes transferred so far
     * @param totalBytes total expected size, or -1 if the server sent no
     *                   {@code Content-Length}
     */
    void onProgress(long bytesRead, long totalBytes);
}

package de.bsommerfeld.spellbook.sync.download;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.spellbook.core.config.NetworkConfig;
import de.bsommerfeld.spellbook.core.error.NetworkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * HTTP download utility built on {@link HttpClient}.
 *
 * <p>
 * Large payloads stream to disk in 64 KiB chunks; nothing beyond one chunk
 * is held in memory. Small JSON payloads (bulk listings, release listings)
 * go through {@link #toString(String)}.
 *
 * <h3>Timeouts</h3>
 * Every phase of a transfer is bounded:
 * <ul>
 * <li>connect: configured on the shared client</li>
 * <li>request: time until response headers arrive, set per request</li>
 * <li>read: longest pause between two body chunks, enforced by a watchdog
 * that closes the body stream when no chunk arrives in time</li>
 * </ul>
 * Any of them expiring surfaces as {@link NetworkException}. There is no
 * retry; the caller decides whether a failure is fatal.
 *
 * <h3>Redirect handling</h3>
 * The client follows redirects. Release asset URLs redirect from the API
 * domain to a CDN.
 */
@Singleton
public class StreamingDownloader {

    private static final Logger LOG = LoggerFactory.getLogger(StreamingDownloader.class);

    static final int CHUNK_SIZE = 64 * 1024;

    private static final String ACCEPT = "application/json;q=0.9,*/*;q=0.8";

    private static final ScheduledExecutorService WATCHDOG = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "download-watchdog");
        t.setDaemon(true);
        return t;
    });

    private final HttpClient http;
    private final Duration requestTimeout;
    private final Duration readTimeout;
    private final String userAgent;

    @Inject
    public StreamingDownloader(NetworkConfig network) {
        this.http = HttpClient.newBuilder()
                .connectTimeout(network.connectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.requestTimeout = network.requestTimeout();
        this.readTimeout = network.readTimeout();
        this.userAgent = network.getUserAgent();
    }

    /**
     * Downloads {@code url} to {@code target}.
     *
     * <p>
     * The body streams into a {@code .tmp} sibling first and is renamed onto
     * the target only after the last byte arrived, so a failed transfer
     * never leaves a truncated file at the target path.
     *
     * @return number of bytes written
     * @throws NetworkException on connect/request/read timeouts, non-2xx
     *                          status, broken connections or interrupts
     * @throws IOException      if the local file cannot be written
     */
    public long toFile(String url, Path target, DownloadProgressListener listener)
            throws NetworkException, IOException {
        HttpResponse<InputStream> response = send(url, HttpResponse.BodyHandlers.ofInputStream());
        long totalBytes = response.headers()
                .firstValueAsLong("Content-Length")
                .orElse(-1);

        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");

        long transferred;
        boolean complete = false;
        try (InputStream in = response.body(); OutputStream out = Files.newOutputStream(temp)) {
            transferred = transferWithWatchdog(in, out, totalBytes, url, listener);
            complete = true;
        } finally {
            if (!complete) {
                Files.deleteIfExists(temp);
            }
        }

        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        LOG.info("Downloaded {} ({})", url, TransferStatus.size(transferred));
        return transferred;
    }

    /**
     * Downloads a URL as a UTF-8 string. Meant for small JSON documents;
     * progress is not reported. The body is read under the same per-chunk
     * read timeout as {@link #toFile}.
     */
    public String toString(String url) throws NetworkException {
        HttpResponse<InputStream> response = send(url, HttpResponse.BodyHandlers.ofInputStream());
        long totalBytes = response.headers()
                .firstValueAsLong("Content-Length")
                .orElse(-1);

        ByteArrayOutputStream body = new ByteArrayOutputStream();
        try (InputStream in = response.body()) {
            transferWithWatchdog(in, body, totalBytes, url, DownloadProgressListener.NONE);
        } catch (IOException e) {
            throw new NetworkException("Read failed for " + url + ": " + e.getMessage(), e);
        }
        return body.toString(StandardCharsets.UTF_8);
    }

    private <T> HttpResponse<T> send(String url, HttpResponse.BodyHandler<T> handler) throws NetworkException {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                    .timeout(requestTimeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", ACCEPT)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new NetworkException("Invalid URL: " + url, e);
        }

        try {
            HttpResponse<T> response = http.send(request, handler);
            validateStatus(response.statusCode(), url);
            return response;
        } catch (IOException e) {
            throw new NetworkException("Request failed for " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkException("Download interrupted: " + url, e);
        }
    }

    /**
     * Copies the body chunk by chunk. Before each read a watchdog task is
     * armed that closes the stream once {@code readTimeout} passes without
     * the read returning; a closed stream makes the blocked read return.
     */
    private long transferWithWatchdog(InputStream in, OutputStream out, long totalBytes, String url,
            DownloadProgressListener listener) throws NetworkException, IOException {
        AtomicBoolean stalled = new AtomicBoolean();
        byte[] buffer = new byte[CHUNK_SIZE];
        long transferred = 0;

        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw new NetworkException("Download interrupted: " + url);
            }

            int read = readChunk(in, buffer, stalled, url);
            if (read == -1) {
                break;
            }
            out.write(buffer, 0, read);
            transferred += read;
            listener.onProgress(transferred, totalBytes);
        }

        if (totalBytes > 0 && transferred != totalBytes) {
            throw new NetworkException("Connection closed after " + transferred
                    + " of " + totalBytes + " bytes: " + url);
        }
        return transferred;
    }

    private int readChunk(InputStream in, byte[] buffer, AtomicBoolean stalled, String url)
            throws NetworkException {
        ScheduledFuture<?> alarm = WATCHDOG.schedule(() -> {
            stalled.set(true);
            try {
                in.close();
            } catch (IOException e) {
                LOG.debug("Closing stalled stream for {} failed", url, e);
            }
        }, readTimeout.toMillis(), TimeUnit.MILLISECONDS);

        try {
            int read = in.read(buffer);
            if (stalled.get()) {
                throw stallException(url);
            }
            return read;
        } catch (IOException e) {
            if (stalled.get()) {
                throw stallException(url);
            }
            throw new NetworkException("Read failed for " + url + ": " + e.getMessage(), e);
        } finally {
            alarm.cancel(false);
        }
    }

    private NetworkException stallException(String url) {
        return new NetworkException("No data received for " + readTimeout.toSeconds() + "s: " + url);
    }

    /** Validates that the HTTP status code is in the 2xx success range. */
    static void validateStatus(int status, String url) throws NetworkException {
        if (status < 200 || status >= 300) {
            throw new NetworkException("HTTP " + status + " for " + url);
        }
    }
}

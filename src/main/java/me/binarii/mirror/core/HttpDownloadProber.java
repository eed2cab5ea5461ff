package me.binarii.mirror.core;

import me.binarii.mirror.model.Mirror;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.http.HttpEntity;
import org.apache.http.HttpStatus;
import org.apache.http.client.config.CookieSpecs;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.conn.ConnectTimeoutException;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.concurrent.TimeUnit.*;

/**
 * Downloads a well-known repository database from a mirror and derives the
 * transfer rate from the bytes received and the wall-clock time spent.
 */
public class HttpDownloadProber implements Prober, Closeable {

    private static Log logger = LogFactory.getLog(HttpDownloadProber.class);

    public static final String DEFAULT_RESOURCE_PATH = "extra/os/x86_64/extra.db";

    private static final int BUFFER_SIZE = 16 * 1024;

    private CloseableHttpClient httpClient;

    private final String resourcePath;

    private final ScheduledThreadPoolExecutor watchdog;

    public HttpDownloadProber() {
        this(DEFAULT_RESOURCE_PATH);
    }

    public HttpDownloadProber(String resourcePath) {
        this.resourcePath = resourcePath;
        ScheduledThreadPoolExecutor watchdog = new ScheduledThreadPoolExecutor(1, r -> {
            Thread thread = new Thread(r, "probe-watchdog");
            thread.setDaemon(true);
            return thread;
        });
        watchdog.setRemoveOnCancelPolicy(true);
        this.watchdog = watchdog;
        this.initHttpClient();
    }

    @Override
    public Mirror probe(Mirror mirror, Duration deadline) throws ProbeException {
        String uri = resourceUri(mirror.getUrl());
        HttpGet request = new HttpGet(uri);
        if (deadline != null) {
            int millis = (int) Math.max(1, Math.min(Integer.MAX_VALUE, deadline.toMillis()));
            request.setConfig(RequestConfig
                    .custom()
                    .setConnectionRequestTimeout(millis)
                    .setConnectTimeout(millis)
                    .setSocketTimeout(millis)
                    .setCookieSpec(CookieSpecs.IGNORE_COOKIES)
                    .build());
        }

        // socket timeouts bound single reads only, the watchdog bounds the whole transfer
        AtomicBoolean expired = new AtomicBoolean();
        ScheduledFuture<?> alarm = deadline == null ? null : watchdog.schedule(() -> {
            expired.set(true);
            request.abort();
        }, deadline.toNanos(), NANOSECONDS);

        try {
            long tik = System.nanoTime();
            long bytes;
            try (CloseableHttpResponse response = httpClient.execute(request)) {
                int statusCode = response.getStatusLine().getStatusCode();
                if (statusCode != HttpStatus.SC_OK) {
                    throw new ProbeException("GET " + uri + " answered " + statusCode);
                }
                bytes = drain(response.getEntity(), request);
            }
            long tok = System.nanoTime();
            if (expired.get()) {
                throw new ProbeTimeoutException(mirror.getUrl(), deadline);
            }

            double rate = Bandwidth.rate(bytes, NANOSECONDS.toMillis(tok - tik));
            logger.debug("download rate updated for " + mirror.getUrl() + ": " + rate);
            return mirror.withDownloadRate(rate);
        } catch (IOException e) {
            boolean timedOut = e instanceof SocketTimeoutException || e instanceof ConnectTimeoutException;
            if (expired.get() || (deadline != null && timedOut)) {
                throw new ProbeTimeoutException(mirror.getUrl(), deadline, e);
            }
            throw new ProbeException("GET " + uri + " failed: " + e.getMessage(), e);
        } finally {
            if (alarm != null) {
                alarm.cancel(false);
            }
            request.releaseConnection();
        }
    }

    @Override
    public void close() {
        watchdog.shutdownNow();
        try {
            httpClient.close();
        } catch (IOException e) {
            logger.trace(e.getMessage(), e);
        }
    }

    int pendingAlarms() {
        return watchdog.getQueue().size();
    }

    String resourceUri(String mirrorUrl) {
        return mirrorUrl.endsWith("/") ? mirrorUrl + resourcePath : mirrorUrl + "/" + resourcePath;
    }

    private long drain(HttpEntity entity, HttpGet request) throws IOException, ProbeException {
        if (entity == null) {
            return 0;
        }
        long total = 0;
        byte[] buffer = new byte[BUFFER_SIZE];
        try (InputStream in = entity.getContent()) {
            int n;
            while ((n = in.read(buffer)) != -1) {
                total += n;
                if (Thread.currentThread().isInterrupted()) {
                    request.abort();
                    throw new ProbeException("probe of " + request.getURI() + " abandoned");
                }
            }
        }
        return total;
    }

    private void initHttpClient() {
        RequestConfig requestConfig = RequestConfig
                .custom()
                .setCookieSpec(CookieSpecs.IGNORE_COOKIES)
                .build();

        PoolingHttpClientConnectionManager connManager = new PoolingHttpClientConnectionManager();
        connManager.setMaxTotal(Integer.MAX_VALUE);
        connManager.setDefaultMaxPerRoute(Integer.MAX_VALUE);

        httpClient = HttpClients
                .custom()
                .setConnectionManager(connManager)
                .setDefaultRequestConfig(requestConfig)
                .disableAutomaticRetries()
                .disableContentCompression()
                .setUserAgent("mirror-ranker/1.0")
                .useSystemProperties()
                .build();
    }

}

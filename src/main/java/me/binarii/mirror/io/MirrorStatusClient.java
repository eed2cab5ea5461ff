package me.binarii.mirror.io;

import com.google.gson.JsonParseException;
import me.binarii.mirror.model.Mirror;
import me.binarii.mirror.model.MirrorList;
import me.binarii.mirror.model.Protocol;
import me.binarii.mirror.util.JSON;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.http.HttpEntity;
import org.apache.http.client.config.CookieSpecs;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;

import java.io.Closeable;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Fetches the mirror status document and decodes it into a {@link MirrorList}.
 * <pre>
 * {"urls": [{"url": "...", "protocol": "https", "last_sync": "2024-05-01T14:25:08Z",
 *            "score": 2.85, "delay": 6354, "country": "Greece", "country_code": "GR",
 *            "isos": true, "ipv4": true, "ipv6": true, "details": "..."}, ...]}
 * </pre>
 */
public class MirrorStatusClient implements Closeable {

    private static Log logger = LogFactory.getLog(MirrorStatusClient.class);

    private final CloseableHttpClient httpClient;

    public MirrorStatusClient() {
        RequestConfig requestConfig = RequestConfig
                .custom()
                .setConnectionRequestTimeout(10000)
                .setConnectTimeout(10000)
                .setSocketTimeout(30000)
                .setCookieSpec(CookieSpecs.IGNORE_COOKIES)
                .build();

        this.httpClient = HttpClients
                .custom()
                .setDefaultRequestConfig(requestConfig)
                .setUserAgent("mirror-ranker/1.0")
                .useSystemProperties()
                .build();
    }

    public MirrorList fetch(String url) throws MirrorStatusException {
        HttpGet request = new HttpGet(url);
        String body;
        try (CloseableHttpResponse response = httpClient.execute(request)) {
            int statusCode = response.getStatusLine().getStatusCode();
            if (statusCode / 100 != 2) {
                throw new MirrorStatusException("GET " + url + " answered " + statusCode);
            }
            HttpEntity entity = response.getEntity();
            body = entity != null ? EntityUtils.toString(entity, UTF_8) : "";
        } catch (IOException e) {
            throw new MirrorStatusException("cannot fetch " + url + ": " + e.getMessage(), e);
        } finally {
            request.releaseConnection();
        }
        MirrorList mirrorList = decode(body, url);
        logger.info("fetched " + mirrorList.size() + " mirrors from " + url);
        return mirrorList;
    }

    public static MirrorList decode(String json, String source) throws MirrorStatusException {
        StatusDocument document;
        try {
            document = JSON.parse(json, StatusDocument.class);
        } catch (JsonParseException | IllegalStateException e) {
            logger.debug("malformed mirror status document: " + json);
            throw new MirrorStatusException("malformed mirror status document: " + e.getMessage(), e);
        }
        if (document == null || document.urls == null) {
            throw new MirrorStatusException("mirror status document has no \"urls\" array");
        }

        List<Mirror> mirrors = new ArrayList<>(document.urls.size());
        for (MirrorRecord record : document.urls) {
            if (record == null || record.url == null) {
                throw new MirrorStatusException("mirror entry without url");
            }
            mirrors.add(Mirror.builder(record.url)
                    .protocol(record.protocol)
                    .score(record.score)
                    .delay(record.delay)
                    .country(record.country)
                    .countryCode(record.countryCode)
                    .lastSync(record.lastSync)
                    .isos(record.isos)
                    .ipv4(record.ipv4)
                    .ipv6(record.ipv6)
                    .details(record.details)
                    .build());
        }
        return new MirrorList(mirrors, source);
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }

    private static class StatusDocument {
        List<MirrorRecord> urls;
    }

    private static class MirrorRecord {
        String url;
        Protocol protocol = Protocol.DEFAULT;
        Double score;
        Double delay;
        String country;
        String countryCode;
        Instant lastSync;
        Boolean isos;
        Boolean ipv4;
        Boolean ipv6;
        String details;
    }

}

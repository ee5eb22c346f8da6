package com.apisite.checker.probe.http;

import com.apisite.checker.config.CheckerProperties;
import com.apisite.checker.config.TrustPolicy;
import com.apisite.checker.probe.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;

/**
 * Single-shot GET used by the endpoint probe. Never throws: transport problems come back as an
 * {@link HttpFetchResult} with an {@code errorCode}.
 */
@Service
public class ProbeHttpClient {
    private static final Logger log = LoggerFactory.getLogger(ProbeHttpClient.class);

    private final CheckerProperties properties;
    private final HttpClient client;

    public ProbeHttpClient(CheckerProperties properties) {
        this.properties = properties;
        HttpClient.Builder builder = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1);
        if (properties.getTrustPolicy() == TrustPolicy.TRUST_ALL) {
            builder.sslContext(TrustAllTrustManager.sslContext());
        }
        this.client = builder.build();
    }

    public HttpFetchResult get(String url) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }
        try {
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", "application/json, text/plain, */*")
                .GET()
                .build();
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            HttpFetchResult result = new HttpFetchResult(
                url,
                response.statusCode(),
                response.body(),
                response.headers().firstValue("Content-Type").orElse(null),
                null,
                null
            );
            log.debug("GET {} -> {} in {} ms", url, response.statusCode(),
                Duration.between(startedAt, Instant.now()).toMillis());
            return result;
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", describe(e));
        } catch (SSLException e) {
            return errorResult(url, startedAt, "tls_error", describe(e));
        } catch (IOException e) {
            if (e.getCause() instanceof SSLException) {
                return errorResult(url, startedAt, "tls_error", describe(e));
            }
            return errorResult(url, startedAt, "io_error", describe(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", describe(e));
        } catch (Exception e) {
            log.debug("Unexpected failure fetching {}", url, e);
            return errorResult(url, startedAt, "http_error", describe(e));
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        log.debug("GET {} failed with {} after {} ms", url, code,
            Duration.between(startedAt, Instant.now()).toMillis());
        return new HttpFetchResult(url, 0, null, null, code, message);
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            return e.getClass().getSimpleName();
        }
        return e.getClass().getSimpleName() + ": " + message;
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "http://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}

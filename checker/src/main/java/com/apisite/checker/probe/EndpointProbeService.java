package com.apisite.checker.probe;

import com.apisite.checker.config.CheckerProperties;
import com.apisite.checker.probe.http.ProbeHttpClient;
import com.apisite.checker.probe.model.EndpointConfig;
import com.apisite.checker.probe.model.HttpFetchResult;
import com.apisite.checker.probe.model.ProbeResult;
import com.apisite.checker.probe.util.CandidateUrlBuilder;
import com.apisite.checker.probe.util.ReasonCodeClassifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Probes one endpoint: every candidate URL, for up to {@code maxAttempts} rounds, stopping at the
 * first 200 response whose JSON body passes {@link ResponseValidator}.
 */
@Service
public class EndpointProbeService {
    private static final Logger log = LoggerFactory.getLogger(EndpointProbeService.class);

    private final CheckerProperties properties;
    private final ProbeHttpClient httpClient;
    private final ResponseValidator validator;
    private final ObjectReader bodyReader;

    public EndpointProbeService(
        CheckerProperties properties,
        ProbeHttpClient httpClient,
        ResponseValidator validator,
        ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.validator = validator;
        // a JSON value followed by anything else (e.g. an appended PHP warning) is not a JSON body
        this.bodyReader = objectMapper.readerFor(JsonNode.class)
            .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public ProbeResult probe(EndpointConfig endpoint) {
        return probe(endpoint.identifier(), endpoint.baseUrl(), properties.getMaxAttempts());
    }

    public ProbeResult probe(String identifier, String baseUrl, int maxAttempts) {
        Instant startedAt = Instant.now();
        int rounds = Math.max(1, maxAttempts);
        List<String> candidates = CandidateUrlBuilder.candidates(baseUrl);
        FailureTrace trace = new FailureTrace();

        int attempt = 1;
        for (; attempt <= rounds; attempt++) {
            for (String candidate : candidates) {
                HttpFetchResult fetch = httpClient.get(candidate);
                if (checkCandidate(identifier, fetch, trace)) {
                    log.debug("{} valid via {} on attempt {}", identifier, candidate, attempt);
                    return ProbeResult.valid(
                        identifier,
                        candidate,
                        fetch.statusCode(),
                        attempt,
                        Duration.between(startedAt, Instant.now())
                    );
                }
            }
            if (attempt < rounds && !pauseBeforeRetry()) {
                break;
            }
        }

        int attemptsUsed = Math.min(attempt, rounds);
        log.debug("{} invalid after {} attempt(s): {}", identifier, attemptsUsed, trace.message);
        return ProbeResult.invalid(
            identifier,
            baseUrl,
            trace.statusCode,
            trace.message,
            trace.reasonCode,
            attemptsUsed,
            Duration.between(startedAt, Instant.now())
        );
    }

    private boolean checkCandidate(String identifier, HttpFetchResult fetch, FailureTrace trace) {
        if (fetch.isTransportFailure()) {
            trace.transportFailure(fetch);
            log.debug("{} {} failed: {}", identifier, fetch.requestedUrl(), fetch.errorMessage());
            return false;
        }
        if (!fetch.isOk()) {
            trace.httpStatus(fetch.statusCode());
            log.debug("{} {} returned HTTP {}", identifier, fetch.requestedUrl(), fetch.statusCode());
            return false;
        }
        if (!fetch.hasBody()) {
            trace.rejected(fetch.statusCode(), "response body is empty", ReasonCodeClassifier.NOT_JSON);
            return false;
        }
        JsonNode payload;
        try {
            // raw bytes so Jackson skips a BOM and detects UTF-16/32 itself
            payload = bodyReader.readValue(fetch.bodyBytes());
        } catch (IOException e) {
            trace.rejected(fetch.statusCode(), notJsonMessage(fetch, e), ReasonCodeClassifier.NOT_JSON);
            log.debug("{} {} returned a non-JSON body", identifier, fetch.requestedUrl());
            return false;
        }
        if (payload == null || payload.isMissingNode()) {
            trace.rejected(fetch.statusCode(), "response body is empty", ReasonCodeClassifier.NOT_JSON);
            return false;
        }
        String rejection = validator.rejectionReason(payload);
        if (rejection != null) {
            trace.rejected(fetch.statusCode(), rejection, ReasonCodeClassifier.SCHEMA_REJECTED);
            log.debug("{} {} rejected: {}", identifier, fetch.requestedUrl(), rejection);
            return false;
        }
        return true;
    }

    private static String notJsonMessage(HttpFetchResult fetch, IOException e) {
        String detail = e instanceof JsonProcessingException
            ? ((JsonProcessingException) e).getOriginalMessage()
            : e.getMessage();
        if (fetch.contentType() == null || fetch.contentType().isBlank()) {
            return "response is not valid JSON: " + detail;
        }
        return "response is not valid JSON (content-type " + fetch.contentType() + "): " + detail;
    }

        private boolean pauseBeforeRetry() {
        long delayMs = properties.getRetryDelayMs();
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Last status, diagnostic and reason seen across all candidates of one probe. The status only
     * moves when an HTTP response actually arrived.
     */
    private static final class FailureTrace {
        private int statusCode = ProbeResult.NO_RESPONSE;
        private String message = "no candidate URL was attempted";
        private String reasonCode = ReasonCodeClassifier.UNKNOWN;

        void transportFailure(HttpFetchResult fetch) {
            String detail = fetch.errorMessage() == null ? fetch.errorCode() : fetch.errorMessage();
            message = fetch.errorCode() + ": " + detail;
            reasonCode = ReasonCodeClassifier.fromErrorCode(fetch.errorCode(), fetch.errorMessage());
        }

        void httpStatus(int status) {
            statusCode = status;
            message = "HTTP " + status;
            reasonCode = ReasonCodeClassifier.fromHttpStatus(status);
        }

        void rejected(int status, String diagnostic, String reason) {
            statusCode = status;
            message = diagnostic;
            reasonCode = reason;
        }
    }
}

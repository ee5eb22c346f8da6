package com.apisite.checker.probe.http;

import com.apisite.checker.config.CheckerProperties;
import com.apisite.checker.config.TrustPolicy;
import com.apisite.checker.probe.model.HttpFetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.tls.HandshakeCertificates;
import okhttp3.tls.HeldCertificate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ProbeHttpClientTest {
    private MockWebServer server;

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
    }

    @Test
    void sendsBrowserLikeUserAgentAndReturnsBody() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(200)
            .setHeader("Content-Type", "application/json")
            .setBody("{\"a\":1}"));
        server.start();

        ProbeHttpClient client = new ProbeHttpClient(properties(TrustPolicy.TRUST_ALL));
        HttpFetchResult result = client.get(server.url("/api").toString());

        assertThat(result.isOk()).isTrue();
        assertThat(result.bodyBytes()).isEqualTo("{\"a\":1}".getBytes(StandardCharsets.UTF_8));
        assertThat(result.contentType()).isEqualTo("application/json");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getHeader("User-Agent")).startsWith("Mozilla/5.0");
    }

    @Test
    void reportsNonOkStatusWithoutError() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(503).setBody("down"));
        server.start();

        ProbeHttpClient client = new ProbeHttpClient(properties(TrustPolicy.TRUST_ALL));
        HttpFetchResult result = client.get(server.url("/api").toString());

        assertThat(result.statusCode()).isEqualTo(503);
        assertThat(result.isOk()).isFalse();
        assertThat(result.isTransportFailure()).isFalse();
    }

    @Test
    void capturesConnectionFailureAsErrorResult() throws Exception {
        server = new MockWebServer();
        server.start();
        String url = server.url("/api").toString();
        server.shutdown();
        server = null;

        ProbeHttpClient client = new ProbeHttpClient(properties(TrustPolicy.TRUST_ALL));
        HttpFetchResult result = client.get(url);

        assertThat(result.isTransportFailure()).isTrue();
        assertThat(result.statusCode()).isZero();
        assertThat(result.errorCode()).isEqualTo("io_error");
        assertThat(result.errorMessage()).isNotBlank();
    }

    @Test
    void rejectsMalformedUrlWithoutSending() {
        ProbeHttpClient client = new ProbeHttpClient(properties(TrustPolicy.TRUST_ALL));

        assertThat(client.get("http://").errorCode()).isEqualTo("invalid_url");
        assertThat(client.get("   ").errorCode()).isEqualTo("invalid_url");
    }

    @Test
    void trustAllPolicyAcceptsSelfSignedCertificate() throws Exception {
        server = selfSignedServer();
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"list\":[]}"));

        ProbeHttpClient client = new ProbeHttpClient(properties(TrustPolicy.TRUST_ALL));
        HttpFetchResult result = client.get(server.url("/api").toString());

        assertThat(result.errorMessage()).isNull();
        assertThat(result.statusCode()).isEqualTo(200);
    }

    @Test
    void verifyPolicyRejectsSelfSignedCertificate() throws Exception {
        server = selfSignedServer();
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"list\":[]}"));

        ProbeHttpClient client = new ProbeHttpClient(properties(TrustPolicy.VERIFY));
        HttpFetchResult result = client.get(server.url("/api").toString());

        assertThat(result.isTransportFailure()).isTrue();
        assertThat(result.statusCode()).isZero();
        assertThat(result.errorCode()).isIn("tls_error", "io_error");
    }

    private MockWebServer selfSignedServer() throws Exception {
        HeldCertificate certificate = new HeldCertificate.Builder()
            .addSubjectAlternativeName("localhost")
            .build();
        HandshakeCertificates serverCertificates = new HandshakeCertificates.Builder()
            .heldCertificate(certificate)
            .build();
        MockWebServer httpsServer = new MockWebServer();
        httpsServer.useHttps(serverCertificates.sslSocketFactory(), false);
        httpsServer.start();
        return httpsServer;
    }

    private CheckerProperties properties(TrustPolicy trustPolicy) {
        CheckerProperties properties = new CheckerProperties();
        properties.setRequestTimeoutSeconds(5);
        properties.setTrustPolicy(trustPolicy);
        return properties;
    }
}

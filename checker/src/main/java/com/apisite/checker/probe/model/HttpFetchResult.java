package com.apisite.checker.probe.model;

public record HttpFetchResult(
    String requestedUrl,
    int statusCode,
    byte[] bodyBytes,
    String contentType,
    String errorCode,
    String errorMessage
) {
    public boolean isTransportFailure() {
        return errorCode != null;
    }

    public boolean isOk() {
        return statusCode == 200 && errorCode == null;
    }

    public boolean hasBody() {
        return bodyBytes != null && bodyBytes.length > 0;
    }
}

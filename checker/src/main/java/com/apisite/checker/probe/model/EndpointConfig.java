package com.apisite.checker.probe.model;

/**
 * One {@code api_site} entry eligible for probing.
 */
public record EndpointConfig(String identifier, String baseUrl) {
}

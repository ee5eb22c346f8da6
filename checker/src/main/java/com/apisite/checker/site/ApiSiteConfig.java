package com.apisite.checker.site;

import com.apisite.checker.probe.model.EndpointConfig;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.file.Path;
import java.util.List;

/**
 * A loaded configuration document. {@code root} keeps document order and every field verbatim;
 * {@code endpoints} lists the {@code api_site} entries that carry an {@code api} URL.
 */
public record ApiSiteConfig(Path path, ObjectNode root, List<EndpointConfig> endpoints) {
    public ApiSiteConfig {
        endpoints = List.copyOf(endpoints);
    }
}

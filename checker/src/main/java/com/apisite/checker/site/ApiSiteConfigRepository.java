package com.apisite.checker.site;

import com.apisite.checker.probe.model.EndpointConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads and rewrites the JSON configuration file holding the {@code api_site} section.
 */
@Repository
public class ApiSiteConfigRepository {
    private static final Logger log = LoggerFactory.getLogger(ApiSiteConfigRepository.class);

    public static final String API_SITE_FIELD = "api_site";
    public static final String API_FIELD = "api";
    public static final String BACKUP_SUFFIX = ".backup";

    private final ObjectMapper objectMapper;

    public ApiSiteConfigRepository(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ApiSiteConfig load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ApiSiteConfigException("Configuration file not found: " + path);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(Files.readString(path, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new ApiSiteConfigException("Configuration file is not valid JSON: " + path, e);
        } catch (IOException e) {
            throw new ApiSiteConfigException("Unable to read configuration file: " + path, e);
        }
        if (root == null || !root.isObject()) {
            throw new ApiSiteConfigException("Configuration root must be a JSON object: " + path);
        }
        ObjectNode document = (ObjectNode) root;
        List<EndpointConfig> endpoints = extractEndpoints(document);
        log.info("Loaded {} probe-able endpoints from {}", endpoints.size(), path);
        return new ApiSiteConfig(path, document, endpoints);
    }

    /**
     * Returns a deep copy of {@code root} with the given identifiers removed from {@code api_site}.
     * Everything else is left as it was.
     */
    public ObjectNode prune(ObjectNode root, Collection<String> identifiers) {
        ObjectNode copy = root.deepCopy();
        JsonNode sites = copy.get(API_SITE_FIELD);
        if (sites == null || !sites.isObject()) {
            return copy;
        }
        ObjectNode siteNode = (ObjectNode) sites;
        for (String identifier : identifiers) {
            if (siteNode.remove(identifier) != null) {
                log.info("Removed invalid API entry {}", identifier);
            }
        }
        return copy;
    }

    /**
     * Copies the original file to {@code <path>.backup}, then overwrites it with the pruned
     * document.
     *
     * @return the backup path
     */
    public Path writePruned(ApiSiteConfig config, Collection<String> identifiers) {
        Path path = config.path();
        Path backup = backupPath(path);
        ObjectNode pruned = prune(config.root(), identifiers);
        try {
            if (Files.isRegularFile(path)) {
                Files.copy(path, backup, StandardCopyOption.REPLACE_EXISTING);
            } else {
                Files.writeString(backup, render(config.root()), StandardCharsets.UTF_8);
            }
            Files.writeString(path, render(pruned), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ApiSiteConfigException("Unable to write configuration file: " + path, e);
        }
        log.info("Backed up {} to {} and removed {} entries", path, backup, identifiers.size());
        return backup;
    }

    public String render(JsonNode document) {
        try {
            return objectMapper.writer(new ApiSitePrettyPrinter()).writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new ApiSiteConfigException("Unable to serialise configuration", e);
        }
    }

    public static Path backupPath(Path path) {
        return path.resolveSibling(path.getFileName().toString() + BACKUP_SUFFIX);
    }

    private List<EndpointConfig> extractEndpoints(ObjectNode root) {
        JsonNode sites = root.get(API_SITE_FIELD);
        if (sites == null || !sites.isObject()) {
            return List.of();
        }
        List<EndpointConfig> endpoints = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = sites.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode api = entry.getValue().get(API_FIELD);
            if (api == null || !api.isTextual()) {
                log.debug("Skipping {}: no api field", entry.getKey());
                continue;
            }
            endpoints.add(new EndpointConfig(entry.getKey(), api.textValue()));
        }
        return endpoints;
    }
}

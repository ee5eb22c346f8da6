package com.apisite.checker.probe;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides whether a decoded 200 body plausibly carries catalog data from a provider API.
 *
 * <p>This is a heuristic. It prefers accepting odd payloads over dropping a live endpoint, so a
 * non-empty object with none of {@code code}, {@code list} or {@code data} is accepted.
 */
@Component
public class ResponseValidator {
    static final Set<String> SUCCESS_CODES = Set.of("1", "200");
    static final Map<String, List<String>> FIELD_ALIASES = fieldAliases();

    public boolean isValid(JsonNode payload) {
        return rejectionReason(payload) == null;
    }

    /**
     * Returns why the payload was rejected, or {@code null} when it is accepted.
     */
    public String rejectionReason(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return "response is not a JSON object";
        }
        if (payload.has("code") && !isSuccessCode(payload.get("code"))) {
            return "response code " + payload.get("code").toString() + " is not a success code";
        }
        if (payload.has("list")) {
            return listRejection(payload.get("list"));
        }
        if (payload.has("data")) {
            JsonNode data = payload.get("data");
            if (data.isArray() || data.isObject()) {
                return null;
            }
            return "data field is neither an array nor an object";
        }
        return payload.isEmpty() ? "response object is empty" : null;
    }

    private String listRejection(JsonNode list) {
        if (!list.isArray()) {
            return "list field is not an array";
        }
        if (list.isEmpty()) {
            return null;
        }
        JsonNode first = list.get(0);
        for (Map.Entry<String, List<String>> field : FIELD_ALIASES.entrySet()) {
            if (!hasFieldOrAlias(first, field.getKey(), field.getValue())) {
                return "first list item has no " + field.getKey() + " field";
            }
        }
        return null;
    }

    private boolean hasFieldOrAlias(JsonNode item, String canonical, List<String> aliases) {
        if (item == null || !item.isObject()) {
            return false;
        }
        if (item.has(canonical)) {
            return true;
        }
        for (String alias : aliases) {
            if (item.has(alias)) {
                return true;
            }
        }
        return false;
    }

    private boolean isSuccessCode(JsonNode code) {
        if (code.isIntegralNumber()) {
            return SUCCESS_CODES.contains(code.asText());
        }
        if (code.isNumber()) {
            double value = code.doubleValue();
            return value == 1d || value == 200d;
        }
        if (code.isTextual()) {
            return SUCCESS_CODES.contains(code.textValue().trim());
        }
        return false;
    }

    private static Map<String, List<String>> fieldAliases() {
        Map<String, List<String>> aliases = new LinkedHashMap<>();
        aliases.put("vod_id", List.of("id", "video_id"));
        aliases.put("vod_name", List.of("name", "title"));
        return Collections.unmodifiableMap(aliases);
    }
}

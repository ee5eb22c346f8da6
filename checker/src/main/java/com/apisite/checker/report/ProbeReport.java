package com.apisite.checker.report;

import com.apisite.checker.probe.model.ProbeResult;
import com.apisite.checker.probe.util.ReasonCodeClassifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Probe results split into valid and invalid, each in the order they were produced.
 */
public record ProbeReport(List<ProbeResult> valid, List<ProbeResult> invalid, Map<String, Integer> invalidByReason) {

    public static ProbeReport of(List<ProbeResult> results) {
        List<ProbeResult> valid = new ArrayList<>();
        List<ProbeResult> invalid = new ArrayList<>();
        Map<String, Integer> reasons = new LinkedHashMap<>();
        for (ProbeResult result : results) {
            if (result.valid()) {
                valid.add(result);
            } else {
                invalid.add(result);
                String reason = result.reasonCode() == null ? ReasonCodeClassifier.UNKNOWN : result.reasonCode();
                reasons.merge(reason, 1, Integer::sum);
            }
        }
        return new ProbeReport(List.copyOf(valid), List.copyOf(invalid), Collections.unmodifiableMap(reasons));
    }

    public int total() {
        return valid.size() + invalid.size();
    }

    public boolean hasInvalid() {
        return !invalid.isEmpty();
    }

    public List<String> invalidIdentifiers() {
        return invalid.stream().map(ProbeResult::identifier).toList();
    }
}

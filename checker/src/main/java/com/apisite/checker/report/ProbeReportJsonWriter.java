package com.apisite.checker.report;

import com.apisite.checker.probe.model.ProbeResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Writes the results of a run to a JSON file for scripts that want more than the console report.
 */
@Component
public class ProbeReportJsonWriter {
    private static final Logger log = LoggerFactory.getLogger(ProbeReportJsonWriter.class);

    private final ObjectMapper objectMapper;

    public ProbeReportJsonWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(Path target, Path configPath, ProbeReport report) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        RunReport document = new RunReport(
            configPath.toString(),
            Instant.now(),
            report.total(),
            report.valid().size(),
            report.invalid().size(),
            report.valid(),
            report.invalid()
        );
        objectMapper.writer().with(SerializationFeature.INDENT_OUTPUT).writeValue(target.toFile(), document);
        log.info("Wrote JSON report for {} endpoints to {}", report.total(), target);
    }

    public record RunReport(
        String config,
        Instant finishedAt,
        int total,
        int validCount,
        int invalidCount,
        List<ProbeResult> valid,
        List<ProbeResult> invalid
    ) {
    }
}

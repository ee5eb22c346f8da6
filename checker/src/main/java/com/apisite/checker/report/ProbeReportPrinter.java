package com.apisite.checker.report;

import com.apisite.checker.probe.model.ProbeResult;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Map;
import java.util.stream.Collectors;

@Component
public class ProbeReportPrinter {
    static final String HEAVY_RULE = "=".repeat(80);
    static final String LIGHT_RULE = "-".repeat(40);

    private final PrintStream out;

    public ProbeReportPrinter(@Qualifier("reportStream") PrintStream out) {
        this.out = out;
    }

    public void printLoaded(int endpointCount) {
        out.println("Loaded " + endpointCount + " APIs for testing");
        out.println(HEAVY_RULE);
    }

    public void print(ProbeReport report) {
        out.println();
        out.println("Results:");
        out.println(HEAVY_RULE);

        out.println();
        out.println("Valid APIs (" + report.valid().size() + "):");
        out.println(LIGHT_RULE);
        for (ProbeResult result : report.valid()) {
            out.println(formatLine(result));
        }

        out.println();
        out.println("Invalid APIs (" + report.invalid().size() + "):");
        out.println(LIGHT_RULE);
        for (ProbeResult result : report.invalid()) {
            out.println(formatLine(result));
        }

        if (!report.invalidByReason().isEmpty()) {
            out.println();
            out.println("Failure reasons: " + formatReasons(report.invalidByReason()));
        }

        out.println();
        out.println(summaryLine(report));
    }

    public void message(String line) {
        out.println(line);
    }

    static String formatLine(ProbeResult result) {
        if (result.valid()) {
            return "✓ " + result.identifier() + ": " + result.url() + " (status: " + result.statusCode() + ")";
        }
        if (!result.hasResponse()) {
            return "✗ " + result.identifier() + ": " + result.url() + " (request failed: " + result.message() + ")";
        }
        String status = "status: " + result.statusCode();
        String detail = result.message() == null || result.message().equals("HTTP " + result.statusCode())
            ? status
            : status + ", " + result.message();
        return "✗ " + result.identifier() + ": " + result.url() + " (" + detail + ")";
    }

    static String summaryLine(ProbeReport report) {
        return "Summary: " + report.valid().size() + "/" + report.total() + " APIs valid";
    }

    private static String formatReasons(Map<String, Integer> reasons) {
        return reasons.entrySet().stream()
            .map(entry -> entry.getKey() + "=" + entry.getValue())
            .collect(Collectors.joining(", "));
    }
}

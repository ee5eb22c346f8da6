package com.apisite.checker.site;

import com.apisite.checker.probe.model.EndpointConfig;
import com.apisite.checker.probe.model.ProbeResult;
import com.apisite.checker.probe.util.ReasonCodeClassifier;
import com.apisite.checker.report.ProbeReport;
import com.apisite.checker.report.ProbeReportPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ApiSitePruneServiceTest {
    private static final String CONFIG =
        "{\"api_site\":{\"good\":{\"api\":\"http://good/api\"},\"bad\":{\"api\":\"http://bad/api\"}},\"cache_time\":60}";

    @TempDir
    Path tempDir;

    private final ApiSiteConfigRepository repository = new ApiSiteConfigRepository(new ObjectMapper());
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private final AtomicInteger promptsShown = new AtomicInteger();
    private Path configPath;

    @BeforeEach
    void setUp() throws Exception {
        configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, CONFIG, StandardCharsets.UTF_8);
    }

    @Test
    void skipsPromptWhenEverythingIsValid() {
        ApiSitePruneService service = service(true);
        ProbeReport report = ProbeReport.of(List.of(valid("good"), valid("bad")));

        boolean pruned = service.pruneIfConfirmed(repository.load(configPath), report);

        assertThat(pruned).isFalse();
        assertThat(promptsShown.get()).isZero();
        assertThat(Files.exists(ApiSiteConfigRepository.backupPath(configPath))).isFalse();
        assertThat(printed()).contains("nothing to prune");
    }

    @Test
    void declinedPromptLeavesFilesAlone() throws Exception {
        ApiSitePruneService service = service(false);
        ProbeReport report = ProbeReport.of(List.of(valid("good"), invalid("bad")));

        boolean pruned = service.pruneIfConfirmed(repository.load(configPath), report);

        assertThat(pruned).isFalse();
        assertThat(promptsShown.get()).isEqualTo(1);
        assertThat(Files.readString(configPath, StandardCharsets.UTF_8)).isEqualTo(CONFIG);
        assertThat(Files.exists(ApiSiteConfigRepository.backupPath(configPath))).isFalse();
        assertThat(printed()).contains("No changes made");
    }

    @Test
    void confirmedPromptRemovesInvalidEntriesAfterBackup() throws Exception {
        ApiSitePruneService service = service(true);
        ProbeReport report = ProbeReport.of(List.of(valid("good"), invalid("bad")));

        boolean pruned = service.pruneIfConfirmed(repository.load(configPath), report);

        assertThat(pruned).isTrue();
        Path backup = ApiSiteConfigRepository.backupPath(configPath);
        assertThat(Files.readString(backup, StandardCharsets.UTF_8)).isEqualTo(CONFIG);
        ApiSiteConfig rewritten = repository.load(configPath);
        assertThat(rewritten.endpoints()).extracting(EndpointConfig::identifier).containsExactly("good");
        assertThat(rewritten.root().get("cache_time").asInt()).isEqualTo(60);
        assertThat(printed()).contains("backed up to").contains("Removed 1 invalid APIs");
    }

    private ApiSitePruneService service(boolean answer) {
        ProbeReportPrinter printer = new ProbeReportPrinter(new PrintStream(output, true, StandardCharsets.UTF_8));
        return new ApiSitePruneService(repository, question -> {
            promptsShown.incrementAndGet();
            return answer;
        }, printer);
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    private static ProbeResult valid(String id) {
        return ProbeResult.valid(id, "http://" + id + "/api?ac=detail&pg=1", 200, 1, Duration.ZERO);
    }

    private static ProbeResult invalid(String id) {
        return ProbeResult.invalid(id, "http://" + id + "/api", 500, "HTTP 500", ReasonCodeClassifier.HTTP_5XX, 3, Duration.ZERO);
    }
}

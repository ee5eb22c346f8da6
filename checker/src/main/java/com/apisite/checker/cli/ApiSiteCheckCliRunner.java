package com.apisite.checker.cli;

import com.apisite.checker.config.CheckerProperties;
import com.apisite.checker.probe.ProbeSchedulerService;
import com.apisite.checker.probe.model.ProbeResult;
import com.apisite.checker.report.ProbeReport;
import com.apisite.checker.report.ProbeReportJsonWriter;
import com.apisite.checker.report.ProbeReportPrinter;
import com.apisite.checker.site.ApiSiteConfig;
import com.apisite.checker.site.ApiSiteConfigException;
import com.apisite.checker.site.ApiSiteConfigRepository;
import com.apisite.checker.site.ApiSitePruneService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

@Component
public class ApiSiteCheckCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ApiSiteCheckCliRunner.class);

    private final CheckerProperties properties;
    private final ApiSiteConfigRepository configRepository;
    private final ProbeSchedulerService probeSchedulerService;
    private final ProbeReportPrinter reportPrinter;
    private final ApiSitePruneService pruneService;
    private final ProbeReportJsonWriter jsonWriter;
    private final ConfigurableApplicationContext applicationContext;

    public ApiSiteCheckCliRunner(
        CheckerProperties properties,
        ApiSiteConfigRepository configRepository,
        ProbeSchedulerService probeSchedulerService,
        ProbeReportPrinter reportPrinter,
        ApiSitePruneService pruneService,
        ProbeReportJsonWriter jsonWriter,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.configRepository = configRepository;
        this.probeSchedulerService = probeSchedulerService;
        this.reportPrinter = reportPrinter;
        this.pruneService = pruneService;
        this.jsonWriter = jsonWriter;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }
        checkAndPrune(resolveConfigPath(args));

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    /**
     * One full pass: load, probe every endpoint, report, prune on confirmation.
     *
     * @return the probe results, empty when the configuration could not be loaded
     */
    public List<ProbeResult> checkAndPrune(Path configPath) {
        ApiSiteConfig config;
        try {
            config = configRepository.load(configPath);
        } catch (ApiSiteConfigException e) {
            log.error("Cannot start API check: {}", e.getMessage());
            reportPrinter.message("Error: " + e.getMessage());
            return List.of();
        }

        reportPrinter.printLoaded(config.endpoints().size());
        List<ProbeResult> results = probeSchedulerService.probeAll(config.endpoints());
        ProbeReport report = ProbeReport.of(results);
        reportPrinter.print(report);
        writeJsonReport(configPath, report);

        try {
            pruneService.pruneIfConfirmed(config, report);
        } catch (ApiSiteConfigException e) {
            log.error("Pruning {} failed", configPath, e);
            reportPrinter.message("Error: " + e.getMessage());
        }
        return results;
    }

    private void writeJsonReport(Path configPath, ProbeReport report) {
        String reportPath = properties.getReportPath();
        if (reportPath.isEmpty()) {
            return;
        }
        try {
            jsonWriter.write(Path.of(reportPath), configPath, report);
        } catch (IOException e) {
            log.warn("Could not write JSON report to {}", reportPath, e);
            reportPrinter.message("Could not write JSON report: " + e.getMessage());
        }
    }

    Path resolveConfigPath(ApplicationArguments args) {
        if (args != null && !args.getNonOptionArgs().isEmpty()) {
            return Path.of(args.getNonOptionArgs().get(0));
        }
        return Path.of(properties.getConfigPath());
    }
}

package com.apisite.checker.site;

import com.apisite.checker.cli.ConfirmationPrompt;
import com.apisite.checker.report.ProbeReport;
import com.apisite.checker.report.ProbeReportPrinter;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Removes invalid endpoints from the configuration once the operator agrees to it.
 */
@Service
public class ApiSitePruneService {
    private final ApiSiteConfigRepository repository;
    private final ConfirmationPrompt confirmationPrompt;
    private final ProbeReportPrinter printer;

    public ApiSitePruneService(
        ApiSiteConfigRepository repository,
        ConfirmationPrompt confirmationPrompt,
        ProbeReportPrinter printer
    ) {
        this.repository = repository;
        this.confirmationPrompt = confirmationPrompt;
        this.printer = printer;
    }

    /**
     * @return {@code true} if the configuration file was rewritten
     */
    public boolean pruneIfConfirmed(ApiSiteConfig config, ProbeReport report) {
        if (!report.hasInvalid()) {
            printer.message("");
            printer.message("All APIs are valid, nothing to prune");
            return false;
        }
        List<String> invalidIds = report.invalidIdentifiers();
        String question = "\nRemove these " + invalidIds.size() + " invalid APIs from " + config.path() + "?";
        if (!confirmationPrompt.confirm(question)) {
            printer.message("No changes made");
            return false;
        }
        Path backup = repository.writePruned(config, invalidIds);
        printer.message("Original configuration backed up to: " + backup);
        printer.message("Removed " + invalidIds.size() + " invalid APIs from " + config.path());
        return true;
    }
}

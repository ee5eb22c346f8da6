package com.apisite.checker.probe;

import com.apisite.checker.probe.model.EndpointConfig;
import com.apisite.checker.probe.model.ProbeResult;
import com.apisite.checker.probe.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Runs one probe per endpoint on the bounded {@code probeExecutor} and waits for all of them.
 * Results come back in the order the endpoints were given.
 */
@Service
public class ProbeSchedulerService {
    private static final Logger log = LoggerFactory.getLogger(ProbeSchedulerService.class);

    private final EndpointProbeService endpointProbeService;
    private final ExecutorService probeExecutor;

    public ProbeSchedulerService(
        EndpointProbeService endpointProbeService,
        @Qualifier("probeExecutor") ExecutorService probeExecutor
    ) {
        this.endpointProbeService = endpointProbeService;
        this.probeExecutor = probeExecutor;
    }

    public List<ProbeResult> probeAll(List<EndpointConfig> endpoints) {
        if (endpoints == null || endpoints.isEmpty()) {
            return List.of();
        }
        Instant startedAt = Instant.now();
        List<CompletableFuture<ProbeResult>> futures = new ArrayList<>(endpoints.size());
        for (EndpointConfig endpoint : endpoints) {
            futures.add(CompletableFuture.supplyAsync(() -> endpointProbeService.probe(endpoint), probeExecutor));
        }

        List<ProbeResult> results = new ArrayList<>(endpoints.size());
        for (int i = 0; i < futures.size(); i++) {
            EndpointConfig endpoint = endpoints.get(i);
            try {
                ProbeResult result = futures.get(i).join();
                results.add(result == null ? taskFailure(endpoint, "probe returned no result") : result);
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.warn("Probe for {} failed unexpectedly", endpoint.identifier(), cause);
                results.add(taskFailure(endpoint, describe(cause)));
            }
        }

        long valid = results.stream().filter(ProbeResult::valid).count();
        log.info(
            "Probed {} endpoints in {} ms: valid={}, invalid={}",
            results.size(),
            Duration.between(startedAt, Instant.now()).toMillis(),
            valid,
            results.size() - valid
        );
        return List.copyOf(results);
    }

    private ProbeResult taskFailure(EndpointConfig endpoint, String message) {
        return ProbeResult.invalid(
            endpoint.identifier(),
            endpoint.baseUrl(),
            ProbeResult.NO_RESPONSE,
            message,
            ReasonCodeClassifier.TASK_FAILED,
            0,
            Duration.ZERO
        );
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return error.getClass().getSimpleName() + ": " + message;
    }
}

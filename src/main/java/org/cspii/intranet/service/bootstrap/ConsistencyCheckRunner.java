package org.cspii.intranet.service.bootstrap;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.cspii.intranet.service.reconciliation.ConsistencyReconciler;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Checks the directory once the application is up. Problems are logged; the
 * application keeps running in a degraded state rather than failing to start.
 */
@Slf4j
@Service
@Profile("!test") // This service will not run during unit/integration tests
@RequiredArgsConstructor
public class ConsistencyCheckRunner implements ApplicationRunner {

    private final ConsistencyReconciler consistencyReconciler;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Running directory consistency check...");
        try {
            List<String> missing = consistencyReconciler.checkRequiredSingletons();
            if (!missing.isEmpty()) {
                log.warn("Running without required teams: {}", missing);
            }
            consistencyReconciler.reportDrift();
            log.info("Directory consistency check finished.");
        } catch (Exception e) {
            log.error("Directory consistency check failed, continuing without it", e);
        }
    }
}

package uk.gegc.examforge.features.paper.application;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Outcome counters for the lifecycle operations that call out to collaborators.
 */
@Component
@RequiredArgsConstructor
public class PaperMetrics {

    static final String OPERATIONS = "exam.papers.operations";

    private final MeterRegistry meterRegistry;

    public void success(String operation) {
        meterRegistry.counter(OPERATIONS, "operation", operation, "outcome", "success").increment();
    }

    public void failure(String operation) {
        meterRegistry.counter(OPERATIONS, "operation", operation, "outcome", "failure").increment();
    }
}

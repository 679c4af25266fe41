package uk.gegc.questionbank.features.monitoring.api.dto;

import java.util.List;

public record AggregateOverviewDto(
        HealthStatus status,
        long totalQuestions,
        long mismatchCount,
        List<CountCheckDto> checks
) {
}

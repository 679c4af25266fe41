package uk.gegc.questionbank.features.monitoring.api.dto;

import java.util.List;

public record UserHealthDto(
        String userId,
        HealthStatus status,
        long mismatchCount,
        List<CountCheckDto> checks
) {
}

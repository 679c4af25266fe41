package uk.gegc.questionbank.features.monitoring.api.dto;

import java.util.List;

public enum HealthStatus {
    HEALTHY,
    MISMATCH;

    public static HealthStatus of(List<CountCheckDto> checks) {
        return checks.stream().allMatch(CountCheckDto::match) ? HEALTHY : MISMATCH;
    }
}

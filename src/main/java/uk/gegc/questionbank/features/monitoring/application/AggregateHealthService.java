package uk.gegc.questionbank.features.monitoring.application;

import uk.gegc.questionbank.features.monitoring.api.dto.AggregateOverviewDto;
import uk.gegc.questionbank.features.monitoring.api.dto.UserAggregatesDto;
import uk.gegc.questionbank.features.monitoring.api.dto.UserHealthDto;

/**
 * Compares aggregate counts with recounts from the primary store. Read-only; a mismatch is
 * reported, never repaired.
 */
public interface AggregateHealthService {

    /**
     * Question aggregates: the global total and every theme, subtheme and group.
     */
    AggregateOverviewDto getOverview();

    /**
     * Every user-scoped aggregate of one user, each level summed over the user's namespaces and
     * compared with the user's stored facts.
     */
    UserHealthDto checkUser(String userId);

    UserAggregatesDto getUserAggregates(String userId);
}

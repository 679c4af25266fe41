package uk.gegc.questionbank.features.repair.domain.model;

import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Primary-store tables scanned during a rebuild, with the aggregate sources their rows feed.
 */
public enum RepairTable {
    QUESTIONS(List.of(AggregateSource.QUESTION)),
    USER_FACTS(List.of(AggregateSource.ANSWERED, AggregateSource.INCORRECT, AggregateSource.BOOKMARKED));

    private final List<AggregateSource> sources;

    RepairTable(List<AggregateSource> sources) {
        this.sources = sources;
    }

    public List<AggregateName> aggregates() {
        List<AggregateName> aggregates = new ArrayList<>();
        for (AggregateSource source : sources) {
            aggregates.addAll(AggregateName.forSource(source));
        }
        return aggregates;
    }
}

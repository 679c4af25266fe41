package uk.gegc.questionbank.features.repair.domain.model;

import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;

import java.util.ArrayList;
import java.util.List;

public enum RepairTarget {
    ALL(List.of(RepairTable.QUESTIONS, RepairTable.USER_FACTS)),
    QUESTIONS(List.of(RepairTable.QUESTIONS)),
    USER_FACTS(List.of(RepairTable.USER_FACTS)),
    /**
     * The user-scoped aggregates of a single user, rebuilt from that user's facts.
     */
    USER(List.of(RepairTable.USER_FACTS));

    private final List<RepairTable> tables;

    RepairTarget(List<RepairTable> tables) {
        this.tables = tables;
    }

    public List<RepairTable> getTables() {
        return tables;
    }

    public boolean isUserScoped() {
        return this == USER;
    }

    /**
     * Aggregates cleared and rebuilt by a run, in the order they are cleared.
     */
    public List<AggregateName> aggregates() {
        List<AggregateName> aggregates = new ArrayList<>();
        for (RepairTable table : tables) {
            aggregates.addAll(table.aggregates());
        }
        return aggregates;
    }
}

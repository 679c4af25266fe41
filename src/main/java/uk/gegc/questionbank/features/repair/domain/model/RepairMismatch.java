package uk.gegc.questionbank.features.repair.domain.model;

import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;

public record RepairMismatch(AggregateName aggregate, String namespace, long expected, long actual) {
}

package uk.gegc.questionbank.features.repair.application.source;

import uk.gegc.questionbank.features.aggregate.domain.model.IndexedRecord;

import java.util.List;

/**
 * One keyset page of a primary-store table. {@code nextCursor} is the id of the last row read,
 * or the incoming cursor when the page is empty.
 */
public record ScanPage(List<IndexedRecord> rows, String nextCursor, boolean done) {
}

package uk.gegc.questionbank.features.aggregate.application;

import uk.gegc.questionbank.features.aggregate.domain.model.IndexedRecord;

/**
 * Keeps aggregate entries in lockstep with the rows they are derived from.
 */
public interface AggregateSyncService {

    void onCreated(IndexedRecord record);

    void onDeleted(IndexedRecord record);

    /**
     * Re-keys a record whose taxonomy changed: old entries are deleted, new ones inserted.
     */
    void onChanged(IndexedRecord before, IndexedRecord after);
}

package uk.gegc.questionbank.features.aggregate.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.questionbank.features.aggregate.application.AggregateMetrics;
import uk.gegc.questionbank.features.aggregate.application.AggregateSyncService;
import uk.gegc.questionbank.features.aggregate.application.NamespaceRegistry;
import uk.gegc.questionbank.features.aggregate.application.OrderedAggregateIndex;
import uk.gegc.questionbank.features.aggregate.domain.exception.DuplicateAggregateEntryException;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateEntry;
import uk.gegc.questionbank.features.aggregate.domain.model.IndexedRecord;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class AggregateSyncServiceImpl implements AggregateSyncService {

    private final OrderedAggregateIndex index;
    private final NamespaceRegistry namespaceRegistry;
    private final AggregateMetrics metrics;

    @Override
    public void onCreated(IndexedRecord record) {
        List<AggregateEntry> entries = namespaceRegistry.entriesFor(record);
        for (AggregateEntry entry : entries) {
            insert(entry);
        }
        log.debug("Indexed {} {} into {} aggregates", record.source(), record.entityKey(), entries.size());
    }

    @Override
    public void onDeleted(IndexedRecord record) {
        int removed = 0;
        for (AggregateEntry entry : namespaceRegistry.entriesFor(record)) {
            if (index.delete(entry.key())) {
                removed++;
            }
        }
        log.debug("Removed {} {} from {} aggregates", record.source(), record.entityKey(), removed);
    }

    @Override
    public void onChanged(IndexedRecord before, IndexedRecord after) {
        Set<AggregateEntry> previous = new HashSet<>(namespaceRegistry.entriesFor(before));
        Set<AggregateEntry> next = new HashSet<>(namespaceRegistry.entriesFor(after));
        for (AggregateEntry entry : previous) {
            if (!next.contains(entry)) {
                index.delete(entry.key());
            }
        }
        for (AggregateEntry entry : next) {
            if (!previous.contains(entry)) {
                insert(entry);
            }
        }
    }

    private void insert(AggregateEntry entry) {
        try {
            index.insert(entry);
        } catch (DuplicateAggregateEntryException e) {
            // a concurrent repair page can index a fresh row first
            metrics.syncDuplicate();
            log.warn("Aggregate entry already present, keeping existing: {}", e.getMessage());
        }
    }
}

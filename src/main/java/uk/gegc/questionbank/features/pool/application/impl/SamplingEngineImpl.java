package uk.gegc.questionbank.features.pool.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import uk.gegc.questionbank.features.aggregate.application.AggregateMetrics;
import uk.gegc.questionbank.features.aggregate.application.OrderedAggregateIndex;
import uk.gegc.questionbank.features.aggregate.config.AggregateProperties;
import uk.gegc.questionbank.features.aggregate.domain.exception.RankOutOfRangeException;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateEntry;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateKey;
import uk.gegc.questionbank.features.pool.application.SamplingEngine;
import uk.gegc.questionbank.features.scope.domain.model.AggregateTarget;
import uk.gegc.questionbank.features.scope.domain.model.ScopeDescriptor;
import uk.gegc.questionbank.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

@Slf4j
@Service
public class SamplingEngineImpl implements SamplingEngine {

    private final OrderedAggregateIndex index;
    private final AggregateProperties properties;
    private final AggregateMetrics metrics;
    private final Executor samplingTaskExecutor;

    public SamplingEngineImpl(OrderedAggregateIndex index,
                              AggregateProperties properties,
                              AggregateMetrics metrics,
                              @Qualifier("samplingTaskExecutor") Executor samplingTaskExecutor) {
        this.index = index;
        this.properties = properties;
        this.metrics = metrics;
        this.samplingTaskExecutor = samplingTaskExecutor;
    }

    @Override
    public Optional<String> sampleOne(AggregateTarget target) {
        int maxAttempts = properties.getSampling().getMaxAttemptsPerSlot();
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            long size = index.count(target.aggregate(), target.namespace());
            if (size == 0) {
                return Optional.empty();
            }
            try {
                return Optional.of(index.at(target.aggregate(), target.namespace(), randomRank(size)).entityKey());
            } catch (RankOutOfRangeException e) {
                metrics.samplingRetry();
            }
        }
        log.debug("Gave up sampling one entity from {} after {} attempts", target, maxAttempts);
        return Optional.empty();
    }

    @Override
    public long available(ScopeDescriptor descriptor) {
        AggregateTarget target = descriptor.target();
        long total = index.count(target.aggregate(), target.namespace());
        if (!descriptor.hasExclusion() || total == 0) {
            return total;
        }
        AggregateTarget exclusion = descriptor.exclusion();
        return Math.max(0, total - index.count(exclusion.aggregate(), exclusion.namespace()));
    }

    @Override
    public List<String> sampleK(ScopeDescriptor descriptor, int k) {
        if (k <= 0) {
            return List.of();
        }
        AggregateTarget target = descriptor.target();
        long size = index.count(target.aggregate(), target.namespace());
        if (size == 0) {
            return List.of();
        }
        long eligible = descriptor.hasExclusion() ? available(descriptor) : size;
        long wanted = Math.min(k, eligible);
        if (wanted == 0) {
            return List.of();
        }

        LinkedHashSet<String> picked = new LinkedHashSet<>();
        Set<Long> usedRanks = new HashSet<>();
        // rejection sampling only pays off while most ranks are eligible and few are wanted
        boolean dense = eligible * 2 >= size && wanted * 2 < eligible;
        if (!dense && size <= Integer.MAX_VALUE) {
            walkPermutation(descriptor, (int) size, (int) wanted, usedRanks, picked);
        } else {
            drawRandomRanks(descriptor, size, (int) wanted, usedRanks, picked);
            if (picked.size() < wanted) {
                sweep(descriptor, size, (int) wanted, usedRanks, picked);
            }
            if (picked.size() < wanted && size <= Integer.MAX_VALUE
                    && index.count(target.aggregate(), target.namespace()) >= size) {
                // nothing vanished, so the eligible entities sit on ranks not tried yet
                walkPermutation(descriptor, (int) size, (int) wanted, usedRanks, picked);
            }
        }
        if (picked.size() < wanted) {
            metrics.samplingShortfall();
            log.debug("Sampled {} of {} wanted from {}", picked.size(), wanted, target);
        }
        return new ArrayList<>(picked);
    }

    @Override
    public List<String> sampleAcrossScopes(List<ScopeDescriptor> descriptors, int totalK, List<Double> weights) {
        if (totalK <= 0 || descriptors == null || descriptors.isEmpty()) {
            return List.of();
        }
        if (weights != null && weights.size() != descriptors.size()) {
            throw new ValidationException("Expected " + descriptors.size() + " weights but got " + weights.size());
        }
        return metrics.timeSampling(() -> {
            List<Long> availability = fanOut(descriptors, this::available, 0L);
            int[] quotas = allocateQuotas(availability, weights, totalK);

            List<QuotaTask> tasks = new ArrayList<>();
            for (int i = 0; i < descriptors.size(); i++) {
                if (quotas[i] > 0) {
                    tasks.add(new QuotaTask(descriptors.get(i), quotas[i]));
                }
            }
            List<List<String>> samples = fanOut(tasks, QuotaTask::descriptor,
                    task -> sampleK(task.descriptor(), task.quota()), List.of());

            LinkedHashSet<String> merged = new LinkedHashSet<>();
            samples.forEach(merged::addAll);
            List<String> result = new ArrayList<>(merged);
            Collections.shuffle(result, ThreadLocalRandom.current());
            if (result.size() > totalK) {
                result = new ArrayList<>(result.subList(0, totalK));
            }
            if (result.size() < totalK) {
                metrics.samplingShortfall();
            }
            log.debug("Sampled {} of {} requested across {} descriptors", result.size(), totalK, descriptors.size());
            return result;
        });
    }

    /**
     * Splits {@code totalK} in proportion to the weights, never beyond a descriptor's availability.
     * Quota a descriptor cannot use is handed to those with spare capacity.
     */
    static int[] allocateQuotas(List<Long> availability, List<Double> weights, int totalK) {
        int n = availability.size();
        int[] quotas = new int[n];
        long[] caps = new long[n];
        double[] w = new double[n];
        long capacity = 0;
        boolean anyWeight = false;
        for (int i = 0; i < n; i++) {
            caps[i] = Math.max(0, availability.get(i));
            capacity += caps[i];
            double weight = weights == null ? 1.0 : weights.get(i);
            if (weight < 0 || Double.isNaN(weight)) {
                throw new ValidationException("Weights must be non-negative");
            }
            w[i] = weight;
            anyWeight |= weight > 0 && caps[i] > 0;
        }
        if (!anyWeight) {
            // every weight is zero where there is something to draw: fall back to equal shares
            for (int i = 0; i < n; i++) {
                w[i] = 1.0;
            }
        }

        long remaining = Math.min(totalK, capacity);
        while (remaining > 0) {
            double weightSum = 0;
            for (int i = 0; i < n; i++) {
                if (quotas[i] < caps[i] && w[i] > 0) {
                    weightSum += w[i];
                }
            }
            if (weightSum == 0) {
                break;
            }
            long round = remaining;
            long handed = 0;
            for (int i = 0; i < n && handed < round; i++) {
                if (quotas[i] >= caps[i] || w[i] <= 0) {
                    continue;
                }
                long share = Math.max(1, (long) Math.floor(round * w[i] / weightSum));
                long give = Math.min(Math.min(share, caps[i] - quotas[i]), round - handed);
                quotas[i] += (int) give;
                handed += give;
            }
            if (handed == 0) {
                break;
            }
            remaining -= handed;
        }
        return quotas;
    }

    // Visits every rank not in usedRanks in random order until enough entities are picked.
    private void walkPermutation(ScopeDescriptor descriptor, int size, int wanted,
                                 Set<Long> usedRanks, Set<String> picked) {
        List<Long> ranks = new ArrayList<>(size - usedRanks.size());
        for (long r = 0; r < size; r++) {
            if (!usedRanks.contains(r)) {
                ranks.add(r);
            }
        }
        Collections.shuffle(ranks, ThreadLocalRandom.current());
        for (Long rank : ranks) {
            if (picked.size() >= wanted) {
                return;
            }
            usedRanks.add(rank);
            String candidate = entityAt(descriptor, rank);
            if (candidate != null && !isExcluded(descriptor, candidate)) {
                picked.add(candidate);
            }
        }
    }

    private void drawRandomRanks(ScopeDescriptor descriptor, long size, int wanted,
                                 Set<Long> usedRanks, Set<String> picked) {
        int maxAttempts = properties.getSampling().getMaxAttemptsPerSlot();
        for (int slot = 0; slot < wanted; slot++) {
            for (int attempt = 0; attempt < maxAttempts; attempt++) {
                long rank = randomRank(size);
                if (!usedRanks.add(rank)) {
                    metrics.samplingRetry();
                    continue;
                }
                String candidate = entityAt(descriptor, rank);
                if (candidate == null || picked.contains(candidate) || isExcluded(descriptor, candidate)) {
                    metrics.samplingRetry();
                    continue;
                }
                picked.add(candidate);
                break;
            }
        }
    }

    // Visits consecutive ranks from a random start, skipping ranks already tried.
    private void sweep(ScopeDescriptor descriptor, long size, int wanted, Set<Long> usedRanks, Set<String> picked) {
        int limit = properties.getSampling().getSweepLimit();
        long start = randomRank(size);
        for (long step = 0; step < size && step < limit && picked.size() < wanted; step++) {
            long rank = (start + step) % size;
            if (!usedRanks.add(rank)) {
                continue;
            }
            String candidate = entityAt(descriptor, rank);
            if (candidate != null && !isExcluded(descriptor, candidate)) {
                picked.add(candidate);
            }
        }
    }

    private String entityAt(ScopeDescriptor descriptor, long rank) {
        AggregateTarget target = descriptor.target();
        try {
            AggregateEntry entry = index.at(target.aggregate(), target.namespace(), rank);
            return entry.entityKey();
        } catch (RankOutOfRangeException e) {
            // the namespace shrank since it was counted
            metrics.samplingRetry();
            return null;
        }
    }

    private boolean isExcluded(ScopeDescriptor descriptor, String entityKey) {
        if (!descriptor.hasExclusion()) {
            return false;
        }
        AggregateTarget exclusion = descriptor.exclusion();
        // fact entries are sorted by question id, which is also their entity key
        return index.contains(new AggregateKey(exclusion.aggregate(), exclusion.namespace(), entityKey, entityKey));
    }

    private <T> List<T> fanOut(List<ScopeDescriptor> descriptors, Function<ScopeDescriptor, T> task, T fallback) {
        return fanOut(descriptors, Function.identity(), task, fallback);
    }

    private <S, T> List<T> fanOut(List<S> items, Function<S, ScopeDescriptor> descriptorOf,
                                  Function<S, T> task, T fallback) {
        long timeoutSeconds = properties.getSampling().getTimeoutSeconds();
        List<CompletableFuture<T>> futures = items.stream()
                .map(item -> CompletableFuture.supplyAsync(() -> task.apply(item), samplingTaskExecutor)
                        .orTimeout(timeoutSeconds, TimeUnit.SECONDS))
                .toList();
        List<T> results = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof TimeoutException) {
                    log.warn("Descriptor {} did not answer within {}s, treating it as empty",
                            descriptorOf.apply(items.get(i)).target(), timeoutSeconds);
                    results.add(fallback);
                } else if (e.getCause() instanceof RuntimeException runtime) {
                    throw runtime;
                } else {
                    throw e;
                }
            }
        }
        return results;
    }

    private record QuotaTask(ScopeDescriptor descriptor, int quota) {
    }

    private static long randomRank(long size) {
        return ThreadLocalRandom.current().nextLong(size);
    }
}

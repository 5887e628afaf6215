package org.pl0vm.runtime.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-operation counters accumulated over one execution run: how often an
 * operation was delegated to a provider, how often the safety fallback fired,
 * and the summed absolute error between prediction and exact value.
 *
 * @param <E> The operation enum.
 */
public class OperationStatistics<E extends Enum<E>> {

    private final Map<E, Entry> entries;

    public OperationStatistics(Class<E> type) {
        this.entries = new EnumMap<>(type);
    }

    /**
     * Records one provider call.
     * @param op The operation.
     * @param usedFallback Whether the safety fallback replaced the blended value.
     * @param absError The absolute prediction error.
     */
    public void record(E op, boolean usedFallback, double absError) {
        Entry entry = entries.computeIfAbsent(op, k -> new Entry());
        entry.count++;
        if (usedFallback) {
            entry.fallbacks++;
        }
        entry.absErrorSum += absError;
    }

    public long count(E op) {
        Entry entry = entries.get(op);
        return entry == null ? 0 : entry.count;
    }

    public long fallbacks(E op) {
        Entry entry = entries.get(op);
        return entry == null ? 0 : entry.fallbacks;
    }

    public double absErrorSum(E op) {
        Entry entry = entries.get(op);
        return entry == null ? 0.0 : entry.absErrorSum;
    }

    /**
     * @param op The operation.
     * @return The mean absolute error, or 0 if the operation was never recorded.
     */
    public double meanAbsError(E op) {
        Entry entry = entries.get(op);
        return entry == null || entry.count == 0 ? 0.0 : entry.absErrorSum / entry.count;
    }

    public long totalCount() {
        return entries.values().stream().mapToLong(e -> e.count).sum();
    }

    public long totalFallbacks() {
        return entries.values().stream().mapToLong(e -> e.fallbacks).sum();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * @return The recorded operations in enum order.
     */
    public Iterable<E> operations() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public void clear() {
        entries.clear();
    }

    private static final class Entry {
        private long count;
        private long fallbacks;
        private double absErrorSum;
    }
}

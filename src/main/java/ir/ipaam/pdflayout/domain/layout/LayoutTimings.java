package ir.ipaam.pdflayout.domain.layout;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregates layout durations per widget identity.
 */
public class LayoutTimings implements LayoutInstrumentation {

    private final Map<String, Stats> stats = new LinkedHashMap<>();

    @Override
    public void recordLayout(String widgetId, long nanos) {
        stats.computeIfAbsent(widgetId, key -> new Stats()).add(nanos);
    }

    public Optional<LayoutStats> getStats(String widgetId) {
        return Optional.ofNullable(stats.get(widgetId)).map(Stats::snapshot);
    }

    public Map<String, LayoutStats> getAllStats() {
        Map<String, LayoutStats> snapshot = new LinkedHashMap<>();
        stats.forEach((id, value) -> snapshot.put(id, value.snapshot()));
        return Collections.unmodifiableMap(snapshot);
    }

    public long totalLayouts() {
        return stats.values().stream().mapToLong(value -> value.count).sum();
    }

    public void clear() {
        stats.clear();
    }

    public String report() {
        StringBuilder report = new StringBuilder("Layout timings:");
        getAllStats().forEach((id, value) -> report.append(String.format(Locale.ROOT,
                "%n  %s: count=%d avg=%.3fms min=%.3fms max=%.3fms total=%.3fms",
                id, value.count(), value.averageNanos() / 1e6, value.minNanos() / 1e6,
                value.maxNanos() / 1e6, value.totalNanos() / 1e6)));
        return report.toString();
    }

    public record LayoutStats(long count, long totalNanos, double averageNanos, long minNanos, long maxNanos) {
    }

    private static final class Stats {
        private long count;
        private long total;
        private long min = Long.MAX_VALUE;
        private long max;

        void add(long nanos) {
            count++;
            total += nanos;
            min = Math.min(min, nanos);
            max = Math.max(max, nanos);
        }

        LayoutStats snapshot() {
            return new LayoutStats(count, total, count == 0 ? 0 : (double) total / count, min, max);
        }
    }
}

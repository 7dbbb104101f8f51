package com.wellpath.series.store;

import com.wellpath.series.model.AggregateKey;
import com.wellpath.series.model.AggregateRecord;
import com.wellpath.series.model.Granularity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory, thread-safe store of pre-aggregated records.
 *
 * <p>Backed by a {@link ConcurrentHashMap} keyed on {@link AggregateKey}, so there is
 * at most one record per (subject, granularity, calculation type, metric, period start).
 */
@Repository
public class AggregateStore implements AggregateSource {

    private static final Logger log = LoggerFactory.getLogger(AggregateStore.class);

    private final ConcurrentMap<AggregateKey, AggregateRecord> store = new ConcurrentHashMap<>();

    /**
     * Save (or overwrite) an aggregate. Overwrites let the upstream job re-publish a period.
     */
    public void save(String subjectId, Granularity granularity, String calculationType, AggregateRecord record) {
        AggregateKey key = new AggregateKey(subjectId, granularity, calculationType,
                record.metricId(), record.periodStart());
        store.put(key, record);
        log.debug("Stored aggregate: subject={} granularity={} calc={} metric={} periodStart={}",
                subjectId, granularity.getLabel(), calculationType, record.metricId(), record.periodStart());
    }

    public int saveAll(String subjectId, Granularity granularity, String calculationType,
                       Collection<AggregateRecord> records) {
        records.forEach(record -> save(subjectId, granularity, calculationType, record));
        return records.size();
    }

    @Override
    public List<AggregateRecord> find(String subjectId, Granularity granularity, String calculationType,
                                      Collection<String> metricIds, Instant from, Instant to) {
        List<AggregateRecord> result = store.entrySet().stream()
                .filter(e -> e.getKey().subjectId().equals(subjectId))
                .filter(e -> e.getKey().granularity() == granularity)
                .filter(e -> e.getKey().calculationType().equals(calculationType))
                .filter(e -> metricIds.contains(e.getKey().metricId()))
                .filter(e -> !e.getKey().periodStart().isBefore(from) && !e.getKey().periodStart().isAfter(to))
                .map(Map.Entry::getValue)
                .sorted(Comparator.comparing(AggregateRecord::periodStart))
                .toList();
        log.debug("Found {} aggregates: subject={} granularity={} calc={} metrics={} from={} to={}",
                result.size(), subjectId, granularity.getLabel(), calculationType, metricIds, from, to);
        return result;
    }

    /**
     * Returns the total number of aggregates stored across all subjects.
     */
    public int totalRecords() {
        return store.size();
    }

    /**
     * Returns distinct subjects known to the store, sorted.
     */
    public List<String> knownSubjects() {
        return store.keySet().stream()
                .map(AggregateKey::subjectId)
                .distinct()
                .sorted()
                .toList();
    }

    /**
     * Clears all data, primarily for testing.
     */
    public void clear() {
        store.clear();
    }
}

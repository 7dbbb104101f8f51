package com.wellpath.series.generator;

import com.wellpath.series.config.SeriesProperties;
import com.wellpath.series.model.AggregateRecord;
import com.wellpath.series.model.Granularity;
import com.wellpath.series.store.AggregateStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SampleDataGenerator")
class SampleDataGeneratorTest {

    private static final Instant NOW = Instant.parse("2024-03-15T09:00:00Z");
    private static final Set<String> ALL = Set.of(
            SampleDataGenerator.BEDTIME, SampleDataGenerator.WAKETIME, SampleDataGenerator.DURATION);

    @Test
    @DisplayName("format renders minutes after noon on the 24h clock")
    void formatWrapsMidnight() {
        assertThat(SampleDataGenerator.format(660)).isEqualTo("23:00:00");
        assertThat(SampleDataGenerator.format(735)).isEqualTo("00:15:00");
        assertThat(SampleDataGenerator.format(1125)).isEqualTo("06:45:00");
    }

    @Test
    @DisplayName("seed writes daily records and rollups with explicit period ends")
    void seedPopulatesStore() {
        AggregateStore store = new AggregateStore();
        SeriesProperties properties = new SeriesProperties("UTC", DayOfWeek.MONDAY, "AVG", Map.of());
        SampleDataGenerator generator = new SampleDataGenerator(store, properties,
                Clock.fixed(NOW, ZoneOffset.UTC), "demo", 60, 7L);

        generator.seed();

        Instant from = Instant.parse("2023-01-01T00:00:00Z");
        List<AggregateRecord> daily = store.find("demo", Granularity.DAILY, "AVG", ALL, from, NOW);
        List<AggregateRecord> weekly = store.find("demo", Granularity.WEEKLY, "AVG", ALL, from, NOW);
        List<AggregateRecord> monthly = store.find("demo", Granularity.MONTHLY, "AVG",
                Set.of(SampleDataGenerator.BEDTIME), from, NOW);

        assertThat(daily).filteredOn(r -> r.metricId().equals(SampleDataGenerator.BEDTIME)).hasSize(61);
        assertThat(weekly).isNotEmpty().allSatisfy(r -> assertThat(r.periodEnd()).isNotNull());
        assertThat(monthly).extracting(AggregateRecord::periodStart).containsExactly(
                Instant.parse("2024-01-01T00:00:00Z"),
                Instant.parse("2024-02-01T00:00:00Z"),
                Instant.parse("2024-03-01T00:00:00Z"));
        assertThat(monthly.get(1).periodEnd()).isEqualTo(Instant.parse("2024-02-29T00:00:00Z"));
        assertThat(store.knownSubjects()).containsExactly("demo");
    }
}

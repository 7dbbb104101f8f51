package com.wellpath.series.generator;

import com.wellpath.series.config.SeriesProperties;
import com.wellpath.series.model.AggregateRecord;
import com.wellpath.series.model.Granularity;
import com.wellpath.series.store.AggregateStore;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

/**
 * Seeds a demo subject with realistic sleep aggregates at startup.
 *
 * <p>Daily bedtime, waketime and duration are drawn around typical values; roughly one night
 * in twenty has no waketime so the gap handling is visible on the charts. Weekly and monthly
 * averages are rolled up from the daily values and carry explicit period ends, the way the
 * upstream aggregation job writes them. Enabled only when {@code series.sample-data.enabled=true}.
 */
@Component
@ConditionalOnProperty(name = "series.sample-data.enabled", havingValue = "true")
public class SampleDataGenerator {

    private static final Logger log = LoggerFactory.getLogger(SampleDataGenerator.class);

    static final String BEDTIME = "AGG_SLEEP_BEDTIME";
    static final String WAKETIME = "AGG_SLEEP_WAKETIME";
    static final String DURATION = "AGG_SLEEP_DURATION";

    // Bedtimes are tracked as minutes after noon so averages across midnight stay correct
    private static final int NOON = 12 * 60;
    private static final int DAY = 24 * 60;

    private final AggregateStore aggregateStore;
    private final SeriesProperties properties;
    private final Clock clock;
    private final String subject;
    private final int days;
    private final Random random;

    public SampleDataGenerator(
            AggregateStore aggregateStore,
            SeriesProperties properties,
            Clock clock,
            @Value("${series.sample-data.subject:demo}") String subject,
            @Value("${series.sample-data.days:400}") int days,
            @Value("${series.sample-data.seed:42}") long seed) {
        this.aggregateStore = aggregateStore;
        this.properties = properties;
        this.clock = clock;
        this.subject = subject;
        this.days = days;
        this.random = new Random(seed);
    }

    @PostConstruct
    public void seed() {
        ZoneId zone = properties.zoneId();
        DayOfWeek weekStart = properties.weekStart();
        String calc = properties.calculationType();
        LocalDate today = LocalDate.now(clock.withZone(zone));

        List<Night> nights = new ArrayList<>(days);
        for (int i = days; i >= 0; i--) {
            nights.add(randomNight(today.minusDays(i)));
        }

        for (Night night : nights) {
            aggregateStore.save(subject, Granularity.DAILY, calc,
                    AggregateRecord.ofTime(BEDTIME, night.date.atStartOfDay(zone).toInstant(), format(night.bedtime)));
            if (night.waketime != null) {
                aggregateStore.save(subject, Granularity.DAILY, calc,
                        AggregateRecord.ofTime(WAKETIME, night.date.atStartOfDay(zone).toInstant(), format(night.waketime)));
            }
            aggregateStore.save(subject, Granularity.DAILY, calc,
                    AggregateRecord.ofValue(DURATION, night.date.atStartOfDay(zone).toInstant(), night.durationMinutes));
        }

        int weekly = rollUp(nights, Granularity.WEEKLY, weekStart, zone, calc);
        int monthly = rollUp(nights, Granularity.MONTHLY, weekStart, zone, calc);
        log.info("Seeded sample data for subject={}: {} days, {} weeks, {} months",
                subject, nights.size(), weekly, monthly);
    }

    private int rollUp(List<Night> nights, Granularity granularity, DayOfWeek weekStart, ZoneId zone, String calc) {
        Map<LocalDate, List<Night>> byPeriod = new TreeMap<>();
        for (Night night : nights) {
            byPeriod.computeIfAbsent(granularity.periodStart(night.date, weekStart), k -> new ArrayList<>()).add(night);
        }

        byPeriod.forEach((start, members) -> {
            Instant periodStart = start.atStartOfDay(zone).toInstant();
            Instant periodEnd = granularity.lastDay(start).atStartOfDay(zone).toInstant();

            double avgBed = members.stream().mapToInt(n -> n.bedtime).average().orElse(0);
            double avgDuration = members.stream().mapToDouble(n -> n.durationMinutes).average().orElse(0);
            aggregateStore.save(subject, granularity, calc,
                    new AggregateRecord(BEDTIME, periodStart, periodEnd, null, format((int) Math.round(avgBed))));
            aggregateStore.save(subject, granularity, calc,
                    new AggregateRecord(DURATION, periodStart, periodEnd, avgDuration, null));

            members.stream().filter(n -> n.waketime != null).mapToInt(n -> n.waketime).average()
                    .ifPresent(avgWake -> aggregateStore.save(subject, granularity, calc,
                            new AggregateRecord(WAKETIME, periodStart, periodEnd, null, format((int) Math.round(avgWake)))));
        });
        return byPeriod.size();
    }

    private Night randomNight(LocalDate date) {
        // Bedtime around 23:00 (660 minutes after noon), waketime around 06:45
        int bedtime = 660 + (int) Math.round(random.nextGaussian() * 35);
        int sleepMinutes = 450 + (int) Math.round(random.nextGaussian() * 40);
        Integer waketime = random.nextInt(20) == 0 ? null : bedtime + sleepMinutes;
        return new Night(date, bedtime, waketime, sleepMinutes);
    }

    /** Formats minutes after noon as "HH:MM:SS" on the 24h clock. */
    static String format(int minutesAfterNoon) {
        int clockMinutes = Math.floorMod(NOON + minutesAfterNoon, DAY);
        return String.format("%02d:%02d:00", clockMinutes / 60, clockMinutes % 60);
    }

    private record Night(LocalDate date, int bedtime, Integer waketime, double durationMinutes) {}
}

package com.wellpath.series.config;

import com.wellpath.series.engine.CalendarWindow;
import com.wellpath.series.engine.RecordGrouper;
import com.wellpath.series.engine.SeriesBuilder;
import com.wellpath.series.engine.SeriesEngine;
import com.wellpath.series.engine.TimeOfDayParser;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Application-wide Spring configuration.
 *
 * <p>The engine classes carry no Spring annotations; they are wired here so they stay
 * usable as a plain library.
 */
@Configuration
@EnableConfigurationProperties(SeriesProperties.class)
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TimeOfDayParser timeOfDayParser() {
        return new TimeOfDayParser();
    }

    @Bean
    public CalendarWindow calendarWindow() {
        return new CalendarWindow();
    }

    @Bean
    public SeriesEngine seriesEngine(CalendarWindow calendarWindow, TimeOfDayParser timeOfDayParser) {
        return new SeriesEngine(calendarWindow, new RecordGrouper(calendarWindow), new SeriesBuilder(timeOfDayParser));
    }
}

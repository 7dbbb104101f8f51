package com.wellpath.series.controller;

import com.wellpath.series.model.AggregateRecord;
import com.wellpath.series.model.Granularity;
import com.wellpath.series.store.AggregateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = {
        "series.sample-data.enabled=false"  // Disable demo seeding during tests
})
@DisplayName("SeriesController integration tests")
class SeriesControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private AggregateStore aggregateStore;

    @BeforeEach
    void setUp() {
        aggregateStore.clear();
    }

    private void sleep(Granularity granularity, String day, Instant periodEnd, String bed, String wake) {
        Instant start = Instant.parse(day + "T00:00:00Z");
        aggregateStore.save("s1", granularity, "AVG",
                new AggregateRecord("AGG_SLEEP_BEDTIME", start, periodEnd, null, bed));
        if (wake != null) {
            aggregateStore.save("s1", granularity, "AVG",
                    new AggregateRecord("AGG_SLEEP_WAKETIME", start, periodEnd, null, wake));
        }
    }

    @Test
    @DisplayName("GET /series returns ok with points in columnar format")
    void seriesReturnsPoints() throws Exception {
        sleep(Granularity.DAILY, "2024-01-01", null, "23:15", "06:45");
        sleep(Granularity.DAILY, "2024-01-02", null, "23:40", null);
        sleep(Granularity.DAILY, "2024-01-03", null, "22:50:30", "07:05");

        mockMvc.perform(get("/series")
                        .param("subject", "s1")
                        .param("series", "sleep-consistency")
                        .param("granularity", "daily")
                        .param("back", "7")
                        .param("at", "2024-01-03T12:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.s").value("ok"))
                .andExpect(jsonPath("$.g").value("daily"))
                .andExpect(jsonPath("$.from").value("2023-12-27T00:00:00Z"))
                .andExpect(jsonPath("$.to").value("2024-01-03T00:00:00Z"))
                .andExpect(jsonPath("$.t", hasSize(2)))
                .andExpect(jsonPath("$.t[0]").value("2024-01-01T00:00:00Z"))
                .andExpect(jsonPath("$.t[1]").value("2024-01-03T00:00:00Z"))
                .andExpect(jsonPath("$.e[0]").value("2024-01-01T00:00:00Z"))
                .andExpect(jsonPath("$.v.bedtime[0]").value("2000-01-01T23:15:00Z"))
                .andExpect(jsonPath("$.v.waketime[0]").value("2000-01-01T06:45:00Z"))
                .andExpect(jsonPath("$.v.bedtime[1]").value("2000-01-01T22:50:30Z"))
                .andExpect(jsonPath("$.w", hasSize(0)));
    }

    @Test
    @DisplayName("GET /series with a chart range loads weekly rollups with explicit ends")
    void seriesByRange() throws Exception {
        sleep(Granularity.WEEKLY, "2024-01-01", Instant.parse("2024-01-07T23:59:59Z"), "23:05", "06:55");

        mockMvc.perform(get("/series")
                        .param("subject", "s1")
                        .param("series", "sleep-consistency")
                        .param("range", "6M")
                        .param("at", "2024-01-10T00:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.g").value("weekly"))
                .andExpect(jsonPath("$.t[0]").value("2024-01-01T00:00:00Z"))
                .andExpect(jsonPath("$.e[0]").value("2024-01-07T23:59:59Z"));
    }

    @Test
    @DisplayName("GET /series for a numeric series returns bare numbers")
    void numericSeries() throws Exception {
        aggregateStore.save("s1", Granularity.MONTHLY, "AVG",
                AggregateRecord.ofValue("AGG_SLEEP_DURATION", Instant.parse("2024-02-01T00:00:00Z"), 441.5));

        mockMvc.perform(get("/series")
                        .param("subject", "s1")
                        .param("series", "sleep-duration")
                        .param("range", "Y")
                        .param("at", "2024-02-15T00:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.v.duration[0]").value(441.5))
                .andExpect(jsonPath("$.e[0]").value("2024-02-29T00:00:00Z"));
    }

    @Test
    @DisplayName("GET /series with malformed clock times reports warnings")
    void seriesWarnings() throws Exception {
        sleep(Granularity.DAILY, "2024-01-01", null, "23:15", "soon");

        mockMvc.perform(get("/series")
                        .param("subject", "s1")
                        .param("series", "sleep-consistency")
                        .param("granularity", "daily")
                        .param("back", "3")
                        .param("at", "2024-01-02T00:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.v.waketime[0]").value("2000-01-01T00:00:00Z"))
                .andExpect(jsonPath("$.w", hasSize(1)))
                .andExpect(jsonPath("$.w[0]", containsString("AGG_SLEEP_WAKETIME")));
    }

    @Test
    @DisplayName("GET /series with no complete periods returns no_data")
    void seriesNoData() throws Exception {
        sleep(Granularity.DAILY, "2024-01-01", null, "23:15", null);

        mockMvc.perform(get("/series")
                        .param("subject", "s1")
                        .param("series", "sleep-consistency")
                        .param("range", "W")
                        .param("at", "2024-01-02T00:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.s").value("no_data"))
                .andExpect(jsonPath("$.t", hasSize(0)));
    }

    @Test
    @DisplayName("GET /series with an unrepresentable window returns 422")
    void seriesInvalidRange() throws Exception {
        mockMvc.perform(get("/series")
                        .param("subject", "s1")
                        .param("series", "sleep-consistency")
                        .param("granularity", "monthly")
                        .param("ahead", "1")
                        .param("at", "+999999999-12-15T00:00:00Z"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.s").value("error: Failed to calculate date range"));
    }

    @Test
    @DisplayName("GET /series with invalid parameters returns 400")
    void seriesBadRequests() throws Exception {
        mockMvc.perform(get("/series").param("subject", "s1").param("series", "heart-rate").param("range", "W"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.s", startsWith("error")));

        mockMvc.perform(get("/series").param("subject", "s1").param("series", "sleep-consistency").param("range", "2Y"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.s", startsWith("error")));

        mockMvc.perform(get("/series").param("subject", "s1").param("series", "sleep-consistency")
                        .param("granularity", "hourly"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.s", startsWith("error")));

        mockMvc.perform(get("/series").param("subject", "s1").param("series", "sleep-consistency")
                        .param("granularity", "daily").param("back", "-1"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/series").param("subject", "s1").param("series", "sleep-consistency")
                        .param("range", "W").param("ahead", "-2"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.s", containsString("non-negative")));

        mockMvc.perform(get("/series").param("subject", "s1").param("series", "sleep-consistency"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/series").param("subject", "s1").param("series", "sleep-consistency")
                        .param("range", "W").param("at", "yesterday"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /aggregates stores records that GET /series then returns")
    void ingestThenQuery() throws Exception {
        String body = """
                [
                  {"agg_metric_id": "AGG_SLEEP_BEDTIME", "period_start": "2024-02-01T00:00:00Z", "value_time": "23:00"},
                  {"metricId": "AGG_SLEEP_WAKETIME", "periodStart": "2024-02-01T00:00:00Z", "valueTime": "07:00"}
                ]
                """;

        mockMvc.perform(post("/aggregates")
                        .param("subject", "s1")
                        .param("granularity", "monthly")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stored").value(2));

        mockMvc.perform(get("/series")
                        .param("subject", "s1")
                        .param("series", "sleep-consistency")
                        .param("range", "Y")
                        .param("at", "2024-02-10T00:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.t[0]").value("2024-02-01T00:00:00Z"))
                .andExpect(jsonPath("$.e[0]").value("2024-02-29T00:00:00Z"));
    }

    @Test
    @DisplayName("POST /aggregates with an unknown granularity returns 400")
    void ingestBadGranularity() throws Exception {
        mockMvc.perform(post("/aggregates")
                        .param("subject", "s1")
                        .param("granularity", "hourly")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[]"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /aggregates with a null element returns 400 and stores nothing")
    void ingestNullElement() throws Exception {
        mockMvc.perform(post("/aggregates")
                        .param("subject", "s1")
                        .param("granularity", "daily")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"metricId\": \"AGG_SLEEP_BEDTIME\", \"periodStart\": \"2024-01-01T00:00:00Z\", \"valueTime\": \"23:00\"}, null]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status", startsWith("error")));

        assertThat(aggregateStore.totalRecords()).isZero();
    }

    @Test
    @DisplayName("GET /ping returns ok")
    void pingOk() throws Exception {
        mockMvc.perform(get("/ping"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    @DisplayName("GET /granularities and /ranges list supported values")
    void listingEndpoints() throws Exception {
        mockMvc.perform(get("/granularities"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", contains("daily", "weekly", "monthly")));

        mockMvc.perform(get("/ranges"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].range", contains("W", "M", "6M", "Y")))
                .andExpect(jsonPath("$[2].granularity").value("weekly"));
    }

    @Test
    @DisplayName("GET /status reports stored aggregates and configured series")
    void statusEndpoint() throws Exception {
        sleep(Granularity.DAILY, "2024-01-01", null, "23:15", "06:45");

        mockMvc.perform(get("/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalAggregatesStored").value(2))
                .andExpect(jsonPath("$.knownSubjects", contains("s1")))
                .andExpect(jsonPath("$.series", hasItems("sleep-consistency", "sleep-duration")));
    }
}

package com.wellpath.series;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SeriesApplication {

    private static final Logger log = LoggerFactory.getLogger(SeriesApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(SeriesApplication.class, args);
        log.info("Period Series Service started.");
        log.info("Series API:  GET http://localhost:8080/series?subject=demo&series=sleep-consistency&range=W");
        log.info("Status:      GET http://localhost:8080/status");
        log.info("Health:      GET http://localhost:8080/actuator/health");
    }
}

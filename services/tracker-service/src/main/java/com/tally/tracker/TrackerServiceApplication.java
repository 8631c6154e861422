package com.tally.tracker;

import com.tally.tracker.config.TrackerServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Tally tracker service: logs page visits and product purchases into a shared in-memory ledger and
 * reports the running total plus a trailing-window count.
 *
 * <p>Runs as a single JVM. All request threads share the one ledger bean built in {@link
 * com.tally.tracker.config.LedgerConfiguration}; there is no cross-process state.
 */
@SpringBootApplication
@EnableConfigurationProperties(TrackerServiceProperties.class)
public class TrackerServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(TrackerServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(TrackerServiceApplication.class, args);
        log.info("Tally tracker service started");
    }
}

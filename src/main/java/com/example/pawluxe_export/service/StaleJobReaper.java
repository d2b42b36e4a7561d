package com.example.pawluxe_export.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Periodic sweep that puts jobs of crashed workers back into the queue.
 */
@Service
public class StaleJobReaper {
    private static final Logger LOGGER = LoggerFactory.getLogger(StaleJobReaper.class);

    private final ExportJobService jobService;

    public StaleJobReaper(ExportJobService jobService) {
        this.jobService = jobService;
    }

    public int reap() {
        int recovered = jobService.recoverStale();
        if (recovered > 0) {
            LOGGER.warn("Recovered {} stale export job(s)", recovered);
        } else {
            LOGGER.debug("Stale sweep - nothing to recover");
        }
        return recovered;
    }
}

package com.bazaar.marketplace.service;

import com.bazaar.marketplace.config.MarketplaceRuntimeProperties;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ListingExpirySweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(ListingExpirySweepScheduler.class);

    private final MarketplaceRuntimeProperties marketplaceRuntimeProperties;
    private final ListingService listingService;

    @Scheduled(
            fixedRateString = "${bazaar.sweep.interval-ms:60000}",
            initialDelayString = "${bazaar.sweep.initial-delay-ms:5000}"
    )
    public void sweepTick() {
        if (!marketplaceRuntimeProperties.getSweep().isEnabled()) {
            return;
        }

        try {
            ListingService.SweepSummary summary = listingService.sweepExpired();
            if (summary.hasWork()) {
                log.info("Listing expiry sweep: scanned={}, expired={}", summary.scanned(), summary.expired());
            } else {
                log.debug("Listing expiry sweep completed with no state changes (scanned={})", summary.scanned());
            }
        } catch (RuntimeException ex) {
            // the next tick retries; a failed sweep leaves listings ACTIVE, never half-closed
            log.error("Listing expiry sweep failed", ex);
        }
    }
}

package com.memberguard.backend.services;

import com.memberguard.backend.lifecycle.JobReport;
import com.memberguard.backend.lifecycle.LifecycleJob;
import com.memberguard.backend.models.Offer;
import com.memberguard.backend.repositories.OfferRepository;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class OfferService {

    private final OfferRepository offerRepository;
    private final LifecycleMetrics lifecycleMetrics;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<Offer> activeOffers() {
        return offerRepository.findByActiveTrueAndValidTillAfterOrderByValidTillAsc(OffsetDateTime.now(clock));
    }

    @Transactional
    public JobReport deactivateExpired() {
        Timer.Sample sample = lifecycleMetrics.start();

        int deactivated = offerRepository.deactivateExpired(OffsetDateTime.now(clock));
        if (deactivated > 0) {
            log.info("{} expired offers deactivated", deactivated);
        }

        JobReport report = new JobReport(LifecycleJob.OFFER_EXPIRY, deactivated, deactivated, 0, 0);
        lifecycleMetrics.record(sample, report);
        return report;
    }
}

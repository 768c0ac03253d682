package com.jobrelay.engine;

import com.jobrelay.Job;
import com.jobrelay.JobRepository;
import com.jobrelay.JobState;
import com.jobrelay.config.JobRelayProperties;
import com.jobrelay.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Picks the next job to run: highest priority first, oldest first among equals, skipping jobs whose rate key has
 * no token left. Selection does not touch the job; the {@link LeaseManager} re-verifies the candidate when it
 * claims it.
 */
@Component
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final JobRepository jobRepository;
    private final LeaseManager leaseManager;
    private final RateLimiter rateLimiter;
    private final JobRelayProperties properties;

    public Dispatcher(JobRepository jobRepository, LeaseManager leaseManager, RateLimiter rateLimiter,
            JobRelayProperties properties) {
        this.jobRepository = jobRepository;
        this.leaseManager = leaseManager;
        this.rateLimiter = rateLimiter;
        this.properties = properties;
    }

    /**
     * @param types job types to consider; empty means all
     * @return the best eligible job admitted by the rate limiter, if any. Admission spends a token of the job's
     *         rate key.
     */
    public Optional<Job> nextReady(Collection<String> types, OffsetDateTime now) {
        return select(types, now, Set.of());
    }

    /**
     * Selects and claims in a loop until a claim succeeds, nothing is eligible, or the claim attempt budget is
     * spent on lost races.
     */
    public Optional<Lease> dispatch(String workerId, Collection<String> types, OffsetDateTime now) {
        int maxAttempts = Math.max(1, properties.getDispatcher().getMaxClaimAttempts());
        Set<UUID> lostRaces = new HashSet<>();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Optional<Job> candidate = select(types, now, lostRaces);
            if (candidate.isEmpty()) {
                return Optional.empty();
            }
            Job job = candidate.get();
            Optional<Lease> lease = leaseManager.claim(job.getId(), workerId, now);
            if (lease.isPresent()) {
                return lease;
            }
            lostRaces.add(job.getId());
        }
        log.debug("Worker {} lost {} claim races in a row; giving up this round", workerId, maxAttempts);
        return Optional.empty();
    }

    private Optional<Job> select(Collection<String> types, OffsetDateTime now, Set<UUID> excluded) {
        int batchSize = Math.max(1, properties.getDispatcher().getScanBatchSize());
        int maxPages = Math.max(1, properties.getDispatcher().getMaxScanPages());
        boolean allTypes = types == null || types.isEmpty();
        Set<String> deniedKeys = new HashSet<>();

        try {
            for (int page = 0; page < maxPages; page++) {
                PageRequest pageRequest = PageRequest.of(page, batchSize);
                List<Job> batch = allTypes
                        ? jobRepository.findEligible(JobState.DISPATCHABLE, now, pageRequest)
                        : jobRepository.findEligibleOfTypes(types, JobState.DISPATCHABLE, now, pageRequest);

                for (Job job : batch) {
                    if (excluded.contains(job.getId())) {
                        continue;
                    }
                    String rateKey = job.getRateKey();
                    if (rateKey == null) {
                        return Optional.of(job);
                    }
                    if (deniedKeys.contains(rateKey)) {
                        continue;
                    }
                    if (rateLimiter.allow(rateKey, now)) {
                        return Optional.of(job);
                    }
                    log.debug("Rate key {} has no tokens; skipping job {}", rateKey, job.getId());
                    deniedKeys.add(rateKey);
                }

                if (batch.size() < batchSize) {
                    break;
                }
            }
        } catch (RuntimeException e) {
            throw StoreFailures.translate("dispatch selection", e);
        }
        return Optional.empty();
    }
}

package com.jobrelay.internal;

import com.jobrelay.WorkerRecord;
import com.jobrelay.WorkerRecordRepository;
import com.jobrelay.engine.StoreFailures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Informational record of worker runtimes and when they were last seen. Nothing here is used for lease
 * correctness.
 */
@Component
public class WorkerRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkerRegistry.class);

    private final WorkerRecordRepository workerRecordRepository;
    private final TransactionTemplate transactionTemplate;

    public WorkerRegistry(WorkerRecordRepository workerRecordRepository, TransactionTemplate transactionTemplate) {
        this.workerRecordRepository = workerRecordRepository;
        this.transactionTemplate = transactionTemplate;
    }

    /**
     * Records that {@code workerId} is alive, registering it on first sight.
     */
    public void heartbeat(String workerId, String host, OffsetDateTime now) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                if (workerRecordRepository.touch(workerId, now) == 0 && !workerRecordRepository.existsById(workerId)) {
                    workerRecordRepository.saveAndFlush(new WorkerRecord(workerId, host, now));
                    log.info("Registered worker {} on {}", workerId, host);
                }
            });
        } catch (DataIntegrityViolationException concurrentRegistration) {
            log.debug("Worker {} was registered concurrently", workerId);
        } catch (RuntimeException e) {
            throw StoreFailures.translate("worker heartbeat", e);
        }
    }

    public List<WorkerRecord> activeWorkers(OffsetDateTime since) {
        try {
            return workerRecordRepository.findByLastSeenAtAfterOrderByWorkerIdAsc(since);
        } catch (RuntimeException e) {
            throw StoreFailures.translate("worker lookup", e);
        }
    }
}

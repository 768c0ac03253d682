package com.jobrelay;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;

@Repository
public interface WorkerRecordRepository extends JpaRepository<WorkerRecord, String> {

    List<WorkerRecord> findByLastSeenAtAfterOrderByWorkerIdAsc(OffsetDateTime since);

    @Modifying
    @Query("UPDATE WorkerRecord w SET w.lastSeenAt = :now WHERE w.workerId = :workerId AND w.lastSeenAt < :now")
    int touch(@Param("workerId") String workerId, @Param("now") OffsetDateTime now);
}

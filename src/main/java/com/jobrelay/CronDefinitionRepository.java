package com.jobrelay;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;

@Repository
public interface CronDefinitionRepository extends JpaRepository<CronDefinition, String> {

    @Query("""
            SELECT c FROM CronDefinition c
            WHERE c.enabled = true
              AND c.nextFireAt <= :now
            ORDER BY c.nextFireAt ASC
            """)
    List<CronDefinition> findDue(@Param("now") OffsetDateTime now);

    List<CronDefinition> findAllByOrderByIdAsc();

    /**
     * Advances a definition past the firing it observed. Succeeds for exactly one evaluator per firing.
     */
    @Modifying(flushAutomatically = true)
    @Query("""
            UPDATE CronDefinition c
            SET c.nextFireAt = :nextFireAt,
                c.lastFiredAt = :firedAt,
                c.updatedAt = :now
            WHERE c.id = :id
              AND c.enabled = true
              AND c.nextFireAt = :firedAt
            """)
    int advance(
            @Param("id") String id,
            @Param("firedAt") OffsetDateTime firedAt,
            @Param("nextFireAt") OffsetDateTime nextFireAt,
            @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE CronDefinition c
            SET c.schedule = :schedule,
                c.nextFireAt = :nextFireAt,
                c.updatedAt = :now
            WHERE c.id = :id
            """)
    int reschedule(
            @Param("id") String id,
            @Param("schedule") String schedule,
            @Param("nextFireAt") OffsetDateTime nextFireAt,
            @Param("now") OffsetDateTime now);

    /**
     * Turns a disabled definition back on. Firings missed while it was off are skipped by the caller's
     * choice of {@code nextFireAt}.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE CronDefinition c
            SET c.enabled = true,
                c.nextFireAt = :nextFireAt,
                c.updatedAt = :now
            WHERE c.id = :id
              AND c.enabled = false
            """)
    int enable(
            @Param("id") String id,
            @Param("nextFireAt") OffsetDateTime nextFireAt,
            @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE CronDefinition c
            SET c.enabled = false,
                c.updatedAt = :now
            WHERE c.id = :id
              AND c.enabled = true
            """)
    int disable(@Param("id") String id, @Param("now") OffsetDateTime now);
}

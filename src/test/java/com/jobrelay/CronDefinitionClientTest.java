package com.jobrelay;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.jobrelay.engine.CronScheduler;
import com.jobrelay.exception.InvalidCronScheduleException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CronDefinitionClientTest extends StoreBackedTest {

    @Autowired
    CronDefinitionClient cronDefinitionClient;

    @Autowired
    CronDefinitionRepository cronDefinitionRepository;

    @Autowired
    CronScheduler cronScheduler;

    @Test
    void shouldDefineWithFirstFiringInTheFuture() {
        OffsetDateTime before = OffsetDateTime.now(ZoneOffset.UTC);

        CronDefinition definition = cronDefinitionClient.define("nightly-report", "0 0 2 * * *", "REPORT",
                Map.of("scope", "all"));

        assertTrue(definition.isEnabled());
        assertEquals(MisfirePolicy.COLLAPSE, definition.getMisfirePolicy());
        assertEquals(3, definition.getMaxAttempts());
        assertTrue(definition.getNextFireAt().isAfter(before));
        assertEquals(2, definition.getNextFireAt().withOffsetSameInstant(ZoneOffset.UTC).getHour());

        CronDefinition stored = cronDefinitionClient.find("nightly-report").orElseThrow();
        assertEquals("REPORT", stored.getJobType());
        assertEquals("all", stored.getPayload().get("scope").asText());
    }

    @Test
    void shouldRejectDuplicateIds() {
        cronDefinitionClient.define("nightly-report", "0 0 2 * * *", "REPORT", null);

        assertThrows(IllegalArgumentException.class,
                () -> cronDefinitionClient.define("nightly-report", "0 0 3 * * *", "REPORT", null));
        assertEquals("0 0 2 * * *", cronDefinitionClient.find("nightly-report").orElseThrow().getSchedule());
    }

    @Test
    void shouldRejectInvalidSchedulesWithoutStoringAnything() {
        assertThrows(InvalidCronScheduleException.class,
                () -> cronDefinitionClient.define("broken", "every day at noon", "REPORT", null));
        assertThrows(InvalidCronScheduleException.class,
                () -> cronDefinitionClient.define("broken", "0 0 25 * * *", "REPORT", null));
        assertTrue(cronDefinitionClient.find("broken").isEmpty());
    }

    @Test
    void shouldRejectBlankIdentifiers() {
        assertThrows(IllegalArgumentException.class,
                () -> cronDefinitionClient.define(" ", "0 0 2 * * *", "REPORT", null));
        assertThrows(IllegalArgumentException.class,
                () -> cronDefinitionClient.define("nightly-report", "0 0 2 * * *", "", null));
    }

    @Test
    void shouldMergeUpdatesIntoExistingDefinition() {
        cronDefinitionClient.define("sync", "0 */5 * * * *", "SYNC", Map.of("full", false), MisfirePolicy.COLLAPSE,
                JobOptions.defaults().withPriority(4).withRateKey("partner-api"));

        CronDefinition updated = cronDefinitionClient.update("sync", "0 */10 * * * *", null, MisfirePolicy.BACKFILL,
                JobOptions.defaults().withMaxAttempts(6).withBackoff(Duration.ofSeconds(2), Duration.ofMinutes(1)));

        assertEquals("0 */10 * * * *", updated.getSchedule());
        assertEquals(0, updated.getNextFireAt().getMinute() % 10);
        assertEquals(MisfirePolicy.BACKFILL, updated.getMisfirePolicy());
        assertEquals(4, updated.getPriority());
        assertEquals(6, updated.getMaxAttempts());
        assertEquals(2_000, updated.getBaseDelayMs());
        assertEquals(60_000, updated.getMaxDelayMs());
        assertEquals("partner-api", updated.getRateKey());
        assertFalse(updated.getPayload().get("full").asBoolean());
    }

    @Test
    void shouldClearRateKeyWithBlankOption() {
        cronDefinitionClient.define("sync", "0 */5 * * * *", "SYNC", null, null,
                JobOptions.defaults().withRateKey("partner-api"));

        CronDefinition updated = cronDefinitionClient.update("sync", null, null, null,
                JobOptions.defaults().withRateKey(" "));

        assertNull(updated.getRateKey());
    }

    @Test
    void shouldFailToUpdateUnknownDefinition() {
        assertThrows(IllegalArgumentException.class,
                () -> cronDefinitionClient.update("missing", null, Map.of(), null, null));
        assertThrows(IllegalArgumentException.class, () -> cronDefinitionClient.enable("missing"));
        assertThrows(IllegalArgumentException.class, () -> cronDefinitionClient.disable("missing"));
    }

    @Test
    void shouldNotFireWhileDisabledAndSkipMissedFiringsOnEnable() {
        cronDefinitionClient.define("ticker", "* * * * * *", "TICK", null);
        OffsetDateTime farFuture = OffsetDateTime.now(ZoneOffset.UTC).plusHours(1);

        assertFalse(cronDefinitionClient.disable("ticker").isEnabled());
        assertEquals(0, cronScheduler.evaluate(farFuture));

        CronDefinition enabled = cronDefinitionClient.enable("ticker");
        assertTrue(enabled.isEnabled());
        assertTrue(enabled.getNextFireAt().isBefore(farFuture));
        assertTrue(jobRepository.findAll().isEmpty());
    }

    @Test
    void shouldKeepFiringWhenAnEditRacesTheScheduler() {
        CronDefinition defined = cronDefinitionClient.define("ticker", "0 * * * * *", "TICK", null);
        OffsetDateTime first = defined.getNextFireAt();
        CronDefinition loadedBeforeFiring = cronDefinitionRepository.findById("ticker").orElseThrow();

        assertEquals(1, cronScheduler.evaluate(first));
        loadedBeforeFiring.setPayload(JsonNodeFactory.instance.objectNode().put("edited", true));
        cronDefinitionRepository.saveAndFlush(loadedBeforeFiring);

        CronDefinition stored = cronDefinitionRepository.findById("ticker").orElseThrow();
        assertEquals(first.plusMinutes(1).toInstant(), stored.getNextFireAt().toInstant());
        assertTrue(stored.getPayload().get("edited").asBoolean());

        cronDefinitionClient.update("ticker", null, Map.of("edited", "again"), null, null);
        assertEquals(first.plusMinutes(1).toInstant(),
                cronDefinitionClient.find("ticker").orElseThrow().getNextFireAt().toInstant());

        assertEquals(1, cronScheduler.evaluate(first.plusMinutes(1)));
        assertEquals(1, cronScheduler.evaluate(first.plusMinutes(2)));
        assertEquals(3, jobRepository.findAll().size());
    }

    @Test
    void shouldKeepMaterializedJobsWhenDefinitionIsDeleted() {
        CronDefinition definition = cronDefinitionClient.define("ticker", "* * * * * *", "TICK", null);
        assertEquals(1, cronScheduler.evaluate(definition.getNextFireAt()));

        assertTrue(cronDefinitionClient.delete("ticker"));
        assertFalse(cronDefinitionClient.delete("ticker"));

        assertTrue(cronDefinitionClient.find("ticker").isEmpty());
        assertEquals(1, jobRepository.findAll().size());
        assertEquals("ticker", jobRepository.findAll().get(0).getCronDefinitionId());
    }

    @Test
    void shouldListDefinitionsById() {
        cronDefinitionClient.define("b-sync", "0 */5 * * * *", "SYNC", null);
        cronDefinitionClient.define("a-report", "0 0 2 * * *", "REPORT", null);

        assertEquals(2, cronDefinitionRepository.count());
        assertEquals("a-report", cronDefinitionClient.list().get(0).getId());
        assertEquals("b-sync", cronDefinitionClient.list().get(1).getId());
    }
}

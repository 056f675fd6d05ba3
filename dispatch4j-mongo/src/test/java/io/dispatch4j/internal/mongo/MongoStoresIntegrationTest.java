package io.dispatch4j.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClients;
import io.dispatch4j.ScheduleLedger;
import io.dispatch4j.SchedulingEngine;
import io.dispatch4j.core.IntervalCode;
import io.dispatch4j.core.Job;
import io.dispatch4j.core.RunTemplate;
import io.dispatch4j.core.Tenant;
import io.dispatch4j.core.TickReport;
import io.dispatch4j.core.TriggerSource;
import io.dispatch4j.utils.IntervalResolver;
import io.dispatch4j.utils.Slf4jStatusSink;
import io.dispatch4j.utils.WindowCalculator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoStoresIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final Instant NOW = Instant.parse("2024-01-31T23:00:00Z");

    private MongoTemplate mongoTemplate;
    private MongoTenantStore tenantStore;
    private MongoRunTemplateStore runTemplateStore;
    private MongoJobStore jobStore;
    private MongoJobPreparer jobPreparer;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "dispatch4j_test");
        dropAll();
        tenantStore = new MongoTenantStore(mongoTemplate);
        runTemplateStore = new MongoRunTemplateStore(mongoTemplate);
        jobStore = new MongoJobStore(mongoTemplate);
        jobPreparer = new MongoJobPreparer(mongoTemplate, new ObjectMapper(), "test-instance", Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        dropAll();
    }

    @Test
    void listActiveTenantsShouldSkipDisabledTenants() {
        mongoTemplate.insert(tenant("t1", "ACME", null));
        mongoTemplate.insert(tenant("t2", "Globex", false));
        mongoTemplate.insert(tenant("t3", "", true));

        List<Tenant> tenants = tenantStore.listActiveTenants();

        assertEquals(List.of(new Tenant("t1", "ACME"), new Tenant("t3", "t3")), tenants);
    }

    @Test
    void listActiveRunTemplatesShouldMapDocuments() {
        RunTemplateDocument daily = template("rt-1", "t1", "d");
        daily.setDelay(null);
        mongoTemplate.insert(daily);
        RunTemplateDocument inactive = template("rt-2", "t1", "h");
        inactive.setActive(false);
        mongoTemplate.insert(inactive);
        mongoTemplate.insert(template("rt-3", "t2", "h"));

        List<RunTemplate> templates = runTemplateStore.listActiveRunTemplates("t1");

        assertEquals(1, templates.size());
        RunTemplate t = templates.get(0);
        assertEquals("rt-1", t.id());
        assertEquals(IntervalCode.DAY, t.intervalCode());
        assertEquals(0, t.delaySeconds());
        assertEquals("app-1", t.appId());
        assertEquals(2, runTemplateStore.listActiveRunTemplates().size());
    }

    @Test
    void unknownIntervalCodeShouldMapToNone() {
        mongoTemplate.insert(template("rt-1", "t1", "q"));

        assertEquals(IntervalCode.NONE, runTemplateStore.listActiveRunTemplates("t1").get(0).intervalCode());
    }

    @Test
    void claimWindowShouldSucceedOnlyForExpectedMarker() {
        RunTemplateDocument doc = template("rt-1", "t1", "h");
        doc.setNextSchedule(Instant.parse("2024-03-10T10:00:00Z"));
        mongoTemplate.insert(doc);
        Instant window = Instant.parse("2024-03-10T10:00:00Z");

        assertTrue(runTemplateStore.claimWindow("rt-1", null, window));
        assertFalse(runTemplateStore.claimWindow("rt-1", null, window));

        RunTemplateDocument stored = mongoTemplate.findById("rt-1", RunTemplateDocument.class);
        assertEquals(window, stored.getLastSchedule());
        assertNull(stored.getNextSchedule());

        assertTrue(runTemplateStore.claimWindow("rt-1", window, Instant.parse("2024-03-10T11:00:00Z")));
    }

    @Test
    void disableScheduleShouldStoreNoneCode() {
        mongoTemplate.insert(template("rt-1", "t1", "c"));

        runTemplateStore.disableSchedule("rt-1");

        assertEquals("n", mongoTemplate.findById("rt-1", RunTemplateDocument.class).getIntervalCode());
    }

    @Test
    void findPendingJobShouldIgnoreFinishedJobs() {
        mongoTemplate.insert(job("rt-1", Instant.parse("2024-03-10T09:00:00Z"), 0));
        JobDocument pending = mongoTemplate.insert(job("rt-1", Instant.parse("2024-03-10T10:00:00Z"), null));

        Optional<Job> found = jobStore.findPendingJob("rt-1");

        assertTrue(found.isPresent());
        assertEquals(pending.getId(), found.get().id());
        assertTrue(jobStore.findPendingJob("rt-2").isEmpty());
    }

    @Test
    void prepareAndEnqueueShouldSnapshotConfiguration() {
        RunTemplateDocument doc = template("rt-1", "t1", "h");
        doc.setConfiguration(Map.of("ACCOUNT", "acme", "LIMIT", 10));
        mongoTemplate.insert(doc);
        RunTemplate template = runTemplateStore.listActiveRunTemplates("t1").get(0);

        Job job = jobPreparer.prepareAndEnqueue(template, Instant.parse("2024-03-10T10:00:00Z"), "native", TriggerSource.INTERVAL);

        mongoTemplate.updateFirst(new Query(Criteria.where("_id").is("rt-1")),
                new Update().set("configuration.ACCOUNT", "changed"),
                RunTemplateDocument.class);

        JobDocument stored = mongoTemplate.findById(job.id(), JobDocument.class);
        assertNotNull(stored);
        assertEquals("acme", stored.getConfiguration().get("ACCOUNT"));
        assertEquals("test-instance", stored.getScheduledBy());
        assertEquals("interval", stored.getTriggerSource());
        assertEquals(NOW, stored.getCreatedAt());
        assertEquals(job.id(), jobStore.findPendingJob("rt-1").orElseThrow().id());
    }

    @Test
    void recoveryDeletesShouldTargetOnlyBrokenAndOrphanedJobs() {
        mongoTemplate.insert(job(null, Instant.parse("2024-03-10T08:00:00Z"), null));
        mongoTemplate.insert(job("rt-1", null, null));
        mongoTemplate.insert(job("rt-gone", Instant.parse("2024-03-10T08:00:00Z"), null));
        mongoTemplate.insert(job("rt-gone", Instant.parse("2024-03-10T10:20:00Z"), null));
        mongoTemplate.insert(job("rt-gone", Instant.parse("2024-03-10T08:00:00Z"), 1));
        mongoTemplate.insert(job("rt-1", Instant.parse("2024-03-10T08:00:00Z"), null));

        assertEquals(2, jobStore.deleteMalformedJobs());
        assertEquals(1, jobStore.deleteOrphanedPendingJobs(Set.of("rt-1"), Instant.parse("2024-03-10T09:30:00Z")));
        assertEquals(3, mongoTemplate.count(new Query(), JobDocument.class));
    }

    @Test
    void pingShouldSucceedAgainstLiveServer() {
        jobStore.ping();
    }

    @Test
    void repeatedPassesShouldEnqueueOnceAgainstMongo() {
        mongoTemplate.insert(tenant("t1", "ACME", true));
        mongoTemplate.insert(template("rt-1", "t1", "d"));

        IntervalResolver resolver = new IntervalResolver();
        WindowCalculator calculator = new WindowCalculator(ZoneOffset.UTC);
        Slf4jStatusSink status = new Slf4jStatusSink();
        ScheduleLedger ledger = new ScheduleLedger(runTemplateStore, jobStore, resolver, calculator, status);
        SchedulingEngine engine = new SchedulingEngine(tenantStore, runTemplateStore, ledger, jobPreparer, status, ZoneOffset.UTC);

        TickReport first = engine.runOnce(NOW);
        TickReport second = engine.runOnce(NOW.plusSeconds(1));

        assertEquals(1, first.enqueued());
        assertEquals(0, second.enqueued());
        assertEquals(1, mongoTemplate.count(new Query(), JobDocument.class));
        assertEquals(Instant.parse("2024-02-01T00:00:00Z"),
                mongoTemplate.findById("rt-1", RunTemplateDocument.class).getLastSchedule());
    }

    private void dropAll() {
        mongoTemplate.dropCollection(TenantDocument.class);
        mongoTemplate.dropCollection(RunTemplateDocument.class);
        mongoTemplate.dropCollection(JobDocument.class);
    }

    private static TenantDocument tenant(String id, String name, Boolean enabled) {
        TenantDocument doc = new TenantDocument();
        doc.setId(id);
        doc.setName(name);
        doc.setEnabled(enabled);
        return doc;
    }

    private static RunTemplateDocument template(String id, String companyId, String interv) {
        RunTemplateDocument doc = new RunTemplateDocument();
        doc.setId(id);
        doc.setCompanyId(companyId);
        doc.setAppId("app-1");
        doc.setName("export");
        doc.setExecutor("native");
        doc.setActive(true);
        doc.setIntervalCode(interv);
        doc.setDelay(0);
        return doc;
    }

    private static JobDocument job(String runTemplateId, Instant scheduledTime, Integer exitCode) {
        JobDocument doc = new JobDocument();
        doc.setRunTemplateId(runTemplateId);
        doc.setCompanyId("t1");
        doc.setScheduledTime(scheduledTime);
        doc.setExitCode(exitCode);
        doc.setTriggerSource("interval");
        return doc;
    }
}

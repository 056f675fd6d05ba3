package io.dispatch4j.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.dispatch4j.core.IntervalCode;
import io.dispatch4j.core.RunTemplate;
import io.dispatch4j.store.RunTemplateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * MongoDB persistence for run templates.
 *
 * <p>{@link #claimWindow} is a single-document conditional update, so two schedulers racing on the same
 * template cannot both move {@code lastSchedule}.
 */
public class MongoRunTemplateStore implements RunTemplateRepository {
    private static final Logger log = LoggerFactory.getLogger(MongoRunTemplateStore.class);

    private final MongoTemplate mongoTemplate;

    public MongoRunTemplateStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public List<RunTemplate> listActiveRunTemplates(String tenantId) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        return findActive(Criteria.where("active").is(true).and("companyId").is(tenantId));
    }

    @Override
    public List<RunTemplate> listActiveRunTemplates() {
        return findActive(Criteria.where("active").is(true));
    }

    @Override
    public void disableSchedule(String runTemplateId) {
        Objects.requireNonNull(runTemplateId, "runTemplateId must not be null");
        Query q = new Query(Criteria.where("_id").is(runTemplateId));
        Update u = new Update()
                .set("interv", IntervalCode.NONE.code())
                .unset("nextSchedule");
        MongoErrors.run("disableSchedule", () -> mongoTemplate.updateFirst(q, u, RunTemplateDocument.class));
    }

    @Override
    public boolean claimWindow(String runTemplateId, Instant expectedLastSchedule, Instant windowStart) {
        Objects.requireNonNull(runTemplateId, "runTemplateId must not be null");
        Objects.requireNonNull(windowStart, "windowStart must not be null");

        // is(null) also matches a missing field
        Query q = new Query(Criteria.where("_id").is(runTemplateId).and("lastSchedule").is(expectedLastSchedule));
        Update u = new Update()
                .set("lastSchedule", windowStart)
                .unset("nextSchedule");

        UpdateResult r = MongoErrors.call("claimWindow", () -> mongoTemplate.updateFirst(q, u, RunTemplateDocument.class));
        return r.getModifiedCount() == 1;
    }

    @Override
    public void updateNextSchedule(String runTemplateId, Instant nextSchedule) {
        Objects.requireNonNull(runTemplateId, "runTemplateId must not be null");
        Query q = new Query(Criteria.where("_id").is(runTemplateId));
        Update u = new Update();
        if (nextSchedule != null) {
            u.set("nextSchedule", nextSchedule);
        } else {
            u.unset("nextSchedule");
        }
        MongoErrors.run("updateNextSchedule", () -> mongoTemplate.updateFirst(q, u, RunTemplateDocument.class));
    }

    private List<RunTemplate> findActive(Criteria c) {
        Query q = new Query(c);
        q.with(Sort.by(Sort.Order.asc("_id")));
        List<RunTemplateDocument> docs = MongoErrors.call("listActiveRunTemplates",
                () -> mongoTemplate.find(q, RunTemplateDocument.class));
        return docs.stream().map(MongoRunTemplateStore::toRunTemplate).toList();
    }

    static RunTemplate toRunTemplate(RunTemplateDocument doc) {
        int delay = doc.getDelay() == null ? 0 : doc.getDelay();
        if (delay < 0) {
            log.warn("dispatch negative delay treated as 0 runTemplateId={} delay={}", doc.getId(), delay);
            delay = 0;
        }

        return RunTemplate.builder(doc.getId())
                .tenantId(doc.getCompanyId())
                .appId(doc.getAppId())
                .name(doc.getName())
                .executor(doc.getExecutor())
                .active(doc.isActive())
                .intervalCode(intervalCodeOf(doc))
                .customExpression(doc.getCron())
                .delaySeconds(delay)
                .lastSchedule(doc.getLastSchedule())
                .nextSchedule(doc.getNextSchedule())
                .build();
    }

    private static IntervalCode intervalCodeOf(RunTemplateDocument doc) {
        String raw = doc.getIntervalCode();
        if (raw == null || raw.isBlank()) {
            return IntervalCode.NONE;
        }
        try {
            return IntervalCode.fromCode(raw);
        } catch (IllegalArgumentException e) {
            log.warn("dispatch unknown interval code treated as none runTemplateId={} interv={}", doc.getId(), raw);
            return IntervalCode.NONE;
        }
    }
}

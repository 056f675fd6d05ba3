package io.dispatch4j.internal.mongo;

import io.dispatch4j.core.Job;
import io.dispatch4j.core.TriggerSource;
import io.dispatch4j.store.JobRepository;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for jobs, as far as the scheduler needs it.
 *
 * <p>A job is pending while {@code exitCode} is null (or missing) and {@code scheduledTime} is set.
 */
public class MongoJobStore implements JobRepository {

    private final MongoTemplate mongoTemplate;

    public MongoJobStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public Optional<Job> findPendingJob(String runTemplateId) {
        Objects.requireNonNull(runTemplateId, "runTemplateId must not be null");

        Query q = new Query(
                Criteria.where("runTemplateId").is(runTemplateId)
                        .and("exitCode").is(null)
                        .and("scheduledTime").ne(null)
        );
        q.with(Sort.by(Sort.Order.asc("scheduledTime")));

        JobDocument doc = MongoErrors.call("findPendingJob", () -> mongoTemplate.findOne(q, JobDocument.class));
        return Optional.ofNullable(doc).map(MongoJobStore::toJob);
    }

    @Override
    public long deleteMalformedJobs() {
        Query q = new Query(
                Criteria.where("exitCode").is(null)
                        .orOperator(
                                Criteria.where("scheduledTime").is(null),
                                Criteria.where("runTemplateId").is(null)
                        )
        );
        return MongoErrors.call("deleteMalformedJobs",
                () -> mongoTemplate.remove(q, JobDocument.class).getDeletedCount());
    }

    @Override
    public long deleteOrphanedPendingJobs(Collection<String> activeRunTemplateIds, Instant cutoff) {
        Objects.requireNonNull(activeRunTemplateIds, "activeRunTemplateIds must not be null");
        Objects.requireNonNull(cutoff, "cutoff must not be null");

        Query q = new Query(
                Criteria.where("exitCode").is(null)
                        .and("scheduledTime").ne(null).lt(cutoff)
                        .and("runTemplateId").nin(activeRunTemplateIds)
        );
        return MongoErrors.call("deleteOrphanedPendingJobs",
                () -> mongoTemplate.remove(q, JobDocument.class).getDeletedCount());
    }

    @Override
    public void ping() {
        MongoErrors.run("ping", () -> mongoTemplate.executeCommand("{ ping: 1 }"));
    }

    static Job toJob(JobDocument doc) {
        TriggerSource source = doc.getTriggerSource() == null ? null : TriggerSource.fromWireName(doc.getTriggerSource());
        return new Job(
                doc.getId(),
                doc.getRunTemplateId(),
                doc.getCompanyId(),
                doc.getAppId(),
                doc.getScheduledTime(),
                doc.getExecutor(),
                source,
                doc.getExitCode(),
                doc.getConfiguration()
        );
    }
}

package io.dispatch4j.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dispatch4j.JobPreparer;
import io.dispatch4j.core.Job;
import io.dispatch4j.core.RunTemplate;
import io.dispatch4j.core.TriggerSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Writes the job record for an occurrence. Inserting it is what makes the job visible to the executors.
 *
 * <p>The template's {@code configuration} is copied into the job as it is at enqueue time, so later
 * edits to the template do not change jobs already waiting.
 */
public class MongoJobPreparer implements JobPreparer {
    private static final Logger log = LoggerFactory.getLogger(MongoJobPreparer.class);

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;
    private final String instanceId;
    private final Clock clock;

    public MongoJobPreparer(MongoTemplate mongoTemplate, ObjectMapper objectMapper, String instanceId, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.instanceId = Objects.requireNonNull(instanceId, "instanceId must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Job prepareAndEnqueue(RunTemplate runTemplate, Instant fireInstant, String executor, TriggerSource triggerSource) {
        Objects.requireNonNull(runTemplate, "runTemplate must not be null");
        Objects.requireNonNull(fireInstant, "fireInstant must not be null");
        Objects.requireNonNull(triggerSource, "triggerSource must not be null");

        JobDocument doc = new JobDocument();
        doc.setRunTemplateId(runTemplate.id());
        doc.setCompanyId(runTemplate.tenantId());
        doc.setAppId(runTemplate.appId());
        doc.setScheduledTime(fireInstant);
        doc.setExecutor(executor);
        doc.setTriggerSource(triggerSource.wireName());
        doc.setConfiguration(snapshotConfiguration(runTemplate.id()));
        doc.setScheduledBy(instanceId);
        doc.setCreatedAt(clock.instant());

        JobDocument saved = MongoErrors.call("prepareAndEnqueue", () -> mongoTemplate.insert(doc));
        log.debug("dispatch job inserted jobId={} runTemplateId={} scheduledTime={}",
                saved.getId(), runTemplate.id(), fireInstant);
        return MongoJobStore.toJob(saved);
    }

    private Map<String, Object> snapshotConfiguration(String runTemplateId) {
        RunTemplateDocument template = MongoErrors.call("loadConfiguration",
                () -> mongoTemplate.findById(runTemplateId, RunTemplateDocument.class));
        if (template == null || template.getConfiguration() == null) {
            return null;
        }
        // deep copy, nested maps included
        return objectMapper.convertValue(template.getConfiguration(), new TypeReference<>() {
        });
    }
}

package io.dispatch4j.config;

import io.dispatch4j.internal.mongo.JobDocument;
import io.dispatch4j.internal.mongo.RunTemplateDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the dispatch scheduler.
 *
 * <p>Indexes are not created at startup unless {@code dispatch.ensure-indexes-on-startup=true}; usually
 * they are managed by migration scripts.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li><b>idx_pending_by_template</b> on {@code jobs}: { runTemplateId: 1, exitCode: 1, scheduledTime: 1 }
 *       <br/>Used by the pending-job check run for every template on every tick.</li>
 *   <li><b>idx_active_by_company</b> on {@code run_templates}: { companyId: 1, active: 1 }
 *       <br/>Used to list the active templates of a tenant.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.jobs.createIndex({ runTemplateId: 1, exitCode: 1, scheduledTime: 1 }, { name: "idx_pending_by_template" });
 * db.run_templates.createIndex({ companyId: 1, active: 1 }, { name: "idx_active_by_company" });
 * </pre>
 */
public class DispatchMongoIndexConfig {

    public static final String IDX_PENDING_BY_TEMPLATE = "idx_pending_by_template";
    public static final String IDX_ACTIVE_BY_COMPANY = "idx_active_by_company";

    private final MongoTemplate mongoTemplate;

    public DispatchMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(pendingByTemplateIndex());
        mongoTemplate.indexOps(RunTemplateDocument.class).ensureIndex(activeByCompanyIndex());
    }

    public static Index pendingByTemplateIndex() {
        return new Index()
                .on("runTemplateId", Sort.Direction.ASC)
                .on("exitCode", Sort.Direction.ASC)
                .on("scheduledTime", Sort.Direction.ASC)
                .named(IDX_PENDING_BY_TEMPLATE);
    }

    public static Index activeByCompanyIndex() {
        return new Index()
                .on("companyId", Sort.Direction.ASC)
                .on("active", Sort.Direction.ASC)
                .named(IDX_ACTIVE_BY_COMPANY);
    }
}

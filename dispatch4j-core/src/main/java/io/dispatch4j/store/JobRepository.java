package io.dispatch4j.store;

import io.dispatch4j.core.Job;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

public interface JobRepository {

    /**
     * Oldest job of the template with no exit code and a scheduled time, if any.
     */
    Optional<Job> findPendingJob(String runTemplateId);

    /**
     * Removes partially written jobs: no exit code and no scheduled time or no template id.
     *
     * @return deleted count
     */
    long deleteMalformedJobs();

    /**
     * Removes pending jobs scheduled before {@code cutoff} whose template is not in {@code activeRunTemplateIds}.
     *
     * @return deleted count
     */
    long deleteOrphanedPendingJobs(Collection<String> activeRunTemplateIds, Instant cutoff);

    /**
     * Cheap round trip used as a health check. Throws when storage is unreachable.
     */
    void ping();
}

package io.dispatch4j.store;

import io.dispatch4j.core.RunTemplate;

import java.time.Instant;
import java.util.List;

/**
 * Read and bookkeeping access to run templates.
 *
 * <p>Connectivity failures surface as {@link io.dispatch4j.core.StorageUnavailableException}.
 */
public interface RunTemplateRepository {

    /**
     * Active templates of one tenant, in any order.
     */
    List<RunTemplate> listActiveRunTemplates(String tenantId);

    /**
     * Active templates across all tenants.
     */
    List<RunTemplate> listActiveRunTemplates();

    /**
     * Moves the template to the terminal {@code none} interval.
     */
    void disableSchedule(String runTemplateId);

    /**
     * Atomically sets {@code lastSchedule = windowStart} and clears {@code nextSchedule}, but only
     * while the stored {@code lastSchedule} still equals {@code expectedLastSchedule} (both may be null).
     *
     * @return true if this call moved the marker
     */
    boolean claimWindow(String runTemplateId, Instant expectedLastSchedule, Instant windowStart);

    void updateNextSchedule(String runTemplateId, Instant nextSchedule);
}

package io.dispatch4j.support;

import io.dispatch4j.JobPreparer;
import io.dispatch4j.core.IntervalCode;
import io.dispatch4j.core.Job;
import io.dispatch4j.core.RunTemplate;
import io.dispatch4j.core.Tenant;
import io.dispatch4j.core.TriggerSource;
import io.dispatch4j.store.JobRepository;
import io.dispatch4j.store.RunTemplateRepository;
import io.dispatch4j.store.TenantRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Map-backed stand-in for every storage collaborator, with hooks to inject failures.
 */
public class InMemoryDispatchStore implements TenantRepository, RunTemplateRepository, JobRepository, JobPreparer {

    private final Map<String, Tenant> tenants = new LinkedHashMap<>();
    private final Map<String, RunTemplate> templates = new LinkedHashMap<>();
    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private final AtomicInteger jobSeq = new AtomicInteger();

    private final List<String> disableCalls = new ArrayList<>();

    public Supplier<RuntimeException> claimFailure;
    public Supplier<RuntimeException> prepareFailure;
    public Supplier<RuntimeException> pingFailure;
    public String failTemplatesOfTenant;

    public InMemoryDispatchStore tenant(String id, String name) {
        tenants.put(id, new Tenant(id, name));
        return this;
    }

    public InMemoryDispatchStore template(RunTemplate template) {
        templates.put(template.id(), template);
        return this;
    }

    public InMemoryDispatchStore job(Job job) {
        jobs.put(job.id(), job);
        return this;
    }

    public RunTemplate template(String id) {
        return templates.get(id);
    }

    public List<Job> jobs() {
        return List.copyOf(jobs.values());
    }

    public List<Job> jobsOf(String runTemplateId) {
        return jobs.values().stream().filter(j -> runTemplateId.equals(j.runTemplateId())).toList();
    }

    public List<String> disableCalls() {
        return List.copyOf(disableCalls);
    }

    public void complete(String jobId, int exitCode) {
        jobs.computeIfPresent(jobId, (k, j) -> j.withExitCode(exitCode));
    }

    @Override
    public List<Tenant> listActiveTenants() {
        return List.copyOf(tenants.values());
    }

    @Override
    public List<RunTemplate> listActiveRunTemplates(String tenantId) {
        if (tenantId.equals(failTemplatesOfTenant)) {
            throw new IllegalStateException("listing failed for tenant " + tenantId);
        }
        return templates.values().stream()
                .filter(t -> tenantId.equals(t.tenantId()) && t.active())
                .toList();
    }

    @Override
    public List<RunTemplate> listActiveRunTemplates() {
        return templates.values().stream().filter(RunTemplate::active).toList();
    }

    @Override
    public void disableSchedule(String runTemplateId) {
        disableCalls.add(runTemplateId);
        templates.computeIfPresent(runTemplateId, (k, t) -> t.withIntervalCode(IntervalCode.NONE));
    }

    @Override
    public boolean claimWindow(String runTemplateId, Instant expectedLastSchedule, Instant windowStart) {
        if (claimFailure != null) {
            throw claimFailure.get();
        }
        RunTemplate t = templates.get(runTemplateId);
        if (t == null || !Objects.equals(t.lastSchedule(), expectedLastSchedule)) {
            return false;
        }
        templates.put(runTemplateId, t.withLastSchedule(windowStart));
        return true;
    }

    @Override
    public void updateNextSchedule(String runTemplateId, Instant nextSchedule) {
        templates.computeIfPresent(runTemplateId, (k, t) -> t.withNextSchedule(nextSchedule));
    }

    @Override
    public Optional<Job> findPendingJob(String runTemplateId) {
        return jobs.values().stream()
                .filter(j -> runTemplateId.equals(j.runTemplateId()) && j.isPending())
                .min(Comparator.comparing(Job::scheduledTime));
    }

    @Override
    public long deleteMalformedJobs() {
        return removeIf(j -> j.exitCode() == null && (j.scheduledTime() == null || j.runTemplateId() == null));
    }

    @Override
    public long deleteOrphanedPendingJobs(Collection<String> activeRunTemplateIds, Instant cutoff) {
        return removeIf(j -> j.isPending()
                && j.scheduledTime().isBefore(cutoff)
                && !activeRunTemplateIds.contains(j.runTemplateId()));
    }

    @Override
    public void ping() {
        if (pingFailure != null) {
            throw pingFailure.get();
        }
    }

    @Override
    public Job prepareAndEnqueue(RunTemplate runTemplate, Instant fireInstant, String executor, TriggerSource triggerSource) {
        if (prepareFailure != null) {
            throw prepareFailure.get();
        }
        Job job = new Job("job-" + jobSeq.incrementAndGet(), runTemplate.id(), runTemplate.tenantId(),
                runTemplate.appId(), fireInstant, executor, triggerSource, null, Map.of());
        jobs.put(job.id(), job);
        return job;
    }

    private long removeIf(Predicate<Job> p) {
        List<String> ids = jobs.values().stream().filter(p).map(Job::id).toList();
        ids.forEach(jobs::remove);
        return ids.size();
    }
}

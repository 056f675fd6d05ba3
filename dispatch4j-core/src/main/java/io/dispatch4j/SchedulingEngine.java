package io.dispatch4j;

import io.dispatch4j.core.IntervalCode;
import io.dispatch4j.core.Job;
import io.dispatch4j.core.Occurrence;
import io.dispatch4j.core.RunTemplate;
import io.dispatch4j.core.ScheduleDecision;
import io.dispatch4j.core.StatusLevel;
import io.dispatch4j.core.StorageUnavailableException;
import io.dispatch4j.core.Tenant;
import io.dispatch4j.core.TickReport;
import io.dispatch4j.core.TriggerSource;
import io.dispatch4j.store.RunTemplateRepository;
import io.dispatch4j.store.TenantRepository;
import io.dispatch4j.utils.StatusMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

/**
 * One scheduling pass over every active tenant and its active run templates.
 *
 * <p>Errors are contained per template and per tenant: they are logged and counted, and the pass
 * continues. The only exception that escapes {@link #runOnce} is {@link StorageUnavailableException},
 * which ends the pass so the caller can reconnect.
 */
public class SchedulingEngine {
    private static final Logger log = LoggerFactory.getLogger(SchedulingEngine.class);

    static final String MDC_TENANT = "tenant";

    private final TenantRepository tenants;
    private final RunTemplateRepository runTemplates;
    private final ScheduleLedger ledger;
    private final JobPreparer jobPreparer;
    private final StatusSink status;
    private final ZoneId zone;

    public SchedulingEngine(TenantRepository tenants,
                            RunTemplateRepository runTemplates,
                            ScheduleLedger ledger,
                            JobPreparer jobPreparer,
                            StatusSink status,
                            ZoneId zone) {
        this.tenants = Objects.requireNonNull(tenants, "tenants must not be null");
        this.runTemplates = Objects.requireNonNull(runTemplates, "runTemplates must not be null");
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.jobPreparer = Objects.requireNonNull(jobPreparer, "jobPreparer must not be null");
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    /**
     * Schedules every due template of every active tenant.
     *
     * @throws StorageUnavailableException if storage became unreachable during the pass
     */
    public TickReport runOnce(Instant now) {
        return run(now, null);
    }

    /**
     * Same as {@link #runOnce(Instant)} restricted to templates of one fixed interval.
     */
    public TickReport runOnce(Instant now, IntervalCode interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        if (!interval.isFixed()) {
            throw new IllegalArgumentException("interval must be a fixed interval: " + interval.label());
        }
        return run(now, interval);
    }

    private TickReport run(Instant now, IntervalCode only) {
        Objects.requireNonNull(now, "now must not be null");
        Tally tally = new Tally();

        for (Tenant tenant : tenants.listActiveTenants()) {
            tally.tenants++;
            MDC.put(MDC_TENANT, tenant.name());
            try {
                scheduleTenant(tenant, now, only, tally);
            } catch (StorageUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                tally.failed++;
                log.error("dispatch tenant pass failed tenant={} msg={}", tenant.name(), e.getMessage(), e);
            } finally {
                MDC.remove(MDC_TENANT);
            }
        }

        TickReport report = tally.toReport();
        if (report.enqueued() > 0 || report.failed() > 0) {
            log.info("dispatch pass done now={} report={}", now, report);
        } else {
            log.debug("dispatch pass done now={} report={}", now, report);
        }
        return report;
    }

    private void scheduleTenant(Tenant tenant, Instant now, IntervalCode only, Tally tally) {
        if (only != null) {
            status.emit(StatusLevel.DEBUG, StatusMessages.intervalBegin(tenant, only));
        }
        List<RunTemplate> templates = runTemplates.listActiveRunTemplates(tenant.id());
        int enqueuedBefore = tally.enqueued;

        for (RunTemplate template : templates) {
            if (only != null && template.intervalCode() != only) {
                continue;
            }
            tally.templates++;
            try {
                scheduleTemplate(tenant, template, now, tally);
            } catch (StorageUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                tally.failed++;
                log.error("dispatch runTemplate failed runTemplateId={} tenant={} msg={}",
                        template.id(), tenant.name(), e.getMessage(), e);
            }
        }

        if (only != null && only != IntervalCode.MINUTE && tally.enqueued == enqueuedBefore) {
            status.emit(StatusLevel.DEBUG, StatusMessages.noApplications(tenant, only));
        }
        if (only != null) {
            status.emit(StatusLevel.DEBUG, StatusMessages.intervalEnd(tenant, only));
        }
    }

    private void scheduleTemplate(Tenant tenant, RunTemplate template, Instant now, Tally tally) {
        ScheduleDecision decision = ledger.decide(template, now);
        switch (decision.outcome()) {
            case SKIP -> tally.skipped++;
            case DISABLE -> tally.disabled++;
            case ENQUEUE -> {
                enqueue(tenant, template, decision.occurrence());
                tally.enqueued++;
            }
        }
    }

    private void enqueue(Tenant tenant, RunTemplate template, Occurrence occurrence) {
        TriggerSource source = TriggerSource.forInterval(template.intervalCode());
        Job job = jobPreparer.prepareAndEnqueue(template, occurrence.fireInstant(), template.executor(), source);

        if (template.delaySeconds() > 0) {
            status.emit(StatusLevel.DEBUG, StatusMessages.startupDelay(template, occurrence.windowStart(), zone));
        }
        log.info("dispatch enqueue runTemplateId={} tenant={} jobId={} windowStart={} fireAt={} source={}",
                template.id(), tenant.name(), job.id(), occurrence.windowStart(), occurrence.fireInstant(),
                source.wireName());
        status.emit(StatusLevel.INFO, StatusMessages.launch(template, tenant, occurrence.fireInstant(), zone));

        ledger.recordWindow(template, occurrence);
    }

    private static final class Tally {
        int tenants;
        int templates;
        int enqueued;
        int skipped;
        int disabled;
        int failed;

        TickReport toReport() {
            return new TickReport(tenants, templates, enqueued, skipped, disabled, failed);
        }
    }
}

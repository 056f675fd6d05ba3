package io.dispatch4j;

import io.dispatch4j.core.Occurrence;
import io.dispatch4j.core.RunTemplate;
import io.dispatch4j.core.ScheduleExpression;
import io.dispatch4j.core.StorageUnavailableException;
import io.dispatch4j.store.JobRepository;
import io.dispatch4j.store.RunTemplateRepository;
import io.dispatch4j.utils.IntervalResolver;
import io.dispatch4j.utils.WindowCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One-time cleanup performed before the first scheduling pass.
 */
public class StartupRecovery {
    private static final Logger log = LoggerFactory.getLogger(StartupRecovery.class);

    public record Report(long malformedRemoved, long orphansRemoved, int nextSchedulesSeeded) {
    }

    private final RunTemplateRepository runTemplates;
    private final JobRepository jobs;
    private final IntervalResolver resolver;
    private final WindowCalculator calculator;

    public StartupRecovery(RunTemplateRepository runTemplates,
                           JobRepository jobs,
                           IntervalResolver resolver,
                           WindowCalculator calculator) {
        this.runTemplates = Objects.requireNonNull(runTemplates, "runTemplates must not be null");
        this.jobs = Objects.requireNonNull(jobs, "jobs must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.calculator = Objects.requireNonNull(calculator, "calculator must not be null");
    }

    /**
     * Removes partially written jobs and orphaned pending jobs older than {@code orphanGrace},
     * then optionally writes {@code nextSchedule} for every active template.
     */
    public Report recover(Instant now, Duration orphanGrace, boolean preseedNextSchedule) {
        long malformed = jobs.deleteMalformedJobs();

        List<RunTemplate> active = runTemplates.listActiveRunTemplates();
        Set<String> activeIds = active.stream().map(RunTemplate::id).collect(Collectors.toSet());
        long orphans = jobs.deleteOrphanedPendingJobs(activeIds, now.minus(orphanGrace));

        int seeded = 0;
        if (preseedNextSchedule) {
            for (RunTemplate template : active) {
                if (seedNextSchedule(template, now)) {
                    seeded++;
                }
            }
        }

        Report report = new Report(malformed, orphans, seeded);
        log.info("dispatch startup recovery malformedRemoved={} orphansRemoved={} nextSchedulesSeeded={}",
                report.malformedRemoved(), report.orphansRemoved(), report.nextSchedulesSeeded());
        return report;
    }

    private boolean seedNextSchedule(RunTemplate template, Instant now) {
        try {
            ScheduleExpression expr = resolver.resolve(template.intervalCode(), template.customExpression());
            if (expr.isNever()) {
                return false;
            }
            Occurrence next = calculator.nextOccurrence(expr, now, false, template.delaySeconds());
            runTemplates.updateNextSchedule(template.id(), next.windowStart());
            return true;
        } catch (StorageUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("dispatch nextSchedule not seeded runTemplateId={} msg={}", template.id(), e.getMessage());
            return false;
        }
    }
}

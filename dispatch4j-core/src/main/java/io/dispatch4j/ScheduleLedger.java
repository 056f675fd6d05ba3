package io.dispatch4j;

import io.dispatch4j.core.ClaimResult;
import io.dispatch4j.core.EmptyCustomScheduleException;
import io.dispatch4j.core.IntervalCode;
import io.dispatch4j.core.InvalidScheduleExpressionException;
import io.dispatch4j.core.Job;
import io.dispatch4j.core.Occurrence;
import io.dispatch4j.core.RunTemplate;
import io.dispatch4j.core.ScheduleDecision;
import io.dispatch4j.core.ScheduleExpression;
import io.dispatch4j.core.StatusLevel;
import io.dispatch4j.core.StorageUnavailableException;
import io.dispatch4j.store.JobRepository;
import io.dispatch4j.store.RunTemplateRepository;
import io.dispatch4j.utils.IntervalResolver;
import io.dispatch4j.utils.StatusMessages;
import io.dispatch4j.utils.WindowCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Persisted dedup bookkeeping of run templates.
 *
 * <p>At most one pending job exists per template and due window. Two guards back this up:
 * <ul>
 *   <li>a pending job of the template blocks any new enqueue until the executor records its exit code,
 *       which also covers a crash or outage between enqueue and bookkeeping</li>
 *   <li>{@code lastSchedule} holds the window start of the last enqueue, which keeps a finished job's
 *       window from being scheduled again</li>
 * </ul>
 *
 * <p>{@code lastSchedule} is written only after the job was enqueued ({@link #recordWindow}), so the marker
 * never points at a window without a job.
 */
public class ScheduleLedger {
    private static final Logger log = LoggerFactory.getLogger(ScheduleLedger.class);

    private final RunTemplateRepository runTemplates;
    private final JobRepository jobs;
    private final IntervalResolver resolver;
    private final WindowCalculator calculator;
    private final StatusSink status;

    public ScheduleLedger(RunTemplateRepository runTemplates,
                          JobRepository jobs,
                          IntervalResolver resolver,
                          WindowCalculator calculator,
                          StatusSink status) {
        this.runTemplates = Objects.requireNonNull(runTemplates, "runTemplates must not be null");
        this.jobs = Objects.requireNonNull(jobs, "jobs must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.calculator = Objects.requireNonNull(calculator, "calculator must not be null");
        this.status = Objects.requireNonNull(status, "status must not be null");
    }

    /**
     * Decides whether the template has an occurrence to enqueue at {@code now}.
     *
     * <p>Disabling is the only write performed here: a custom template without a usable expression is
     * moved to {@link IntervalCode#NONE} and reported with a warning.
     */
    public ScheduleDecision decide(RunTemplate template, Instant now) {
        Objects.requireNonNull(template, "template must not be null");
        Objects.requireNonNull(now, "now must not be null");

        if (!template.active()) {
            return ScheduleDecision.skip("inactive");
        }
        if (template.intervalCode() == IntervalCode.NONE) {
            return ScheduleDecision.skip("schedule disabled");
        }

        ScheduleExpression expr;
        try {
            expr = resolver.resolve(template.intervalCode(), template.customExpression());
        } catch (EmptyCustomScheduleException | InvalidScheduleExpressionException e) {
            return disable(template, e.getMessage());
        }

        Optional<Job> pending = jobs.findPendingJob(template.id());
        if (pending.isPresent()) {
            log.debug("dispatch skip runTemplateId={} pendingJobId={} scheduledTime={}",
                    template.id(), pending.get().id(), pending.get().scheduledTime());
            return ScheduleDecision.skip("pending job " + pending.get().id());
        }

        Occurrence occurrence = calculator.currentWindow(expr, now, template.delaySeconds());
        Instant last = template.lastSchedule();
        if (last != null && !occurrence.windowStart().isAfter(last)) {
            return ScheduleDecision.skip("window " + occurrence.windowStart() + " already scheduled");
        }

        return ScheduleDecision.enqueue(occurrence);
    }

    /**
     * Moves {@code lastSchedule} from the value read with the template onto the enqueued occurrence's window.
     * A failed write other than a storage outage is logged and reported as {@link ClaimResult#UNKNOWN}; the
     * pending job keeps the window from being enqueued twice.
     */
    public ClaimResult recordWindow(RunTemplate template, Occurrence occurrence) {
        try {
            boolean recorded = runTemplates.claimWindow(template.id(), template.lastSchedule(), occurrence.windowStart());
            if (!recorded) {
                log.warn("dispatch lastSchedule moved by another scheduler runTemplateId={} windowStart={}",
                        template.id(), occurrence.windowStart());
                return ClaimResult.LOST;
            }
            return ClaimResult.CLAIMED;
        } catch (StorageUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("dispatch lastSchedule update failed runTemplateId={} windowStart={} msg={}",
                    template.id(), occurrence.windowStart(), e.getMessage(), e);
            return ClaimResult.UNKNOWN;
        }
    }

    private ScheduleDecision disable(RunTemplate template, String reason) {
        runTemplates.disableSchedule(template.id());
        log.warn("dispatch disabled schedule runTemplateId={} reason={}", template.id(), reason);
        status.emit(StatusLevel.WARN, StatusMessages.disabled(template, reason));
        return ScheduleDecision.disable(reason);
    }
}

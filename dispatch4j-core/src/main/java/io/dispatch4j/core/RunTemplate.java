package io.dispatch4j.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot of a persisted recurring job definition, as read at the start of a pass.
 *
 * <p>{@code lastSchedule} is the window start of the most recently enqueued occurrence,
 * {@code nextSchedule} is optional forward-looking bookkeeping cleared once a window is claimed.
 */
public record RunTemplate(

        // identity
        String id,
        String tenantId,
        String appId,
        String name,
        String executor,

        // scheduling
        boolean active,
        IntervalCode intervalCode,
        String customExpression,
        int delaySeconds,

        // bookkeeping
        Instant lastSchedule,
        Instant nextSchedule
) {

    public RunTemplate {
        Objects.requireNonNull(id, "runTemplate id must not be null");
        Objects.requireNonNull(intervalCode, "intervalCode must not be null");
        if (delaySeconds < 0) {
            throw new IllegalArgumentException("delaySeconds must not be negative: " + delaySeconds);
        }
    }

    public RunTemplate withIntervalCode(IntervalCode code) {
        return new RunTemplate(id, tenantId, appId, name, executor, active, code, customExpression,
                delaySeconds, lastSchedule, nextSchedule);
    }

    public RunTemplate withLastSchedule(Instant last) {
        return new RunTemplate(id, tenantId, appId, name, executor, active, intervalCode, customExpression,
                delaySeconds, last, null);
    }

    public RunTemplate withNextSchedule(Instant next) {
        return new RunTemplate(id, tenantId, appId, name, executor, active, intervalCode, customExpression,
                delaySeconds, lastSchedule, next);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static final class Builder {
        private final String id;
        private String tenantId;
        private String appId;
        private String name;
        private String executor;
        private boolean active = true;
        private IntervalCode intervalCode = IntervalCode.NONE;
        private String customExpression;
        private int delaySeconds;
        private Instant lastSchedule;
        private Instant nextSchedule;

        private Builder(String id) {
            this.id = id;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder appId(String appId) {
            this.appId = appId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder executor(String executor) {
            this.executor = executor;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder intervalCode(IntervalCode intervalCode) {
            this.intervalCode = intervalCode;
            return this;
        }

        public Builder customExpression(String customExpression) {
            this.customExpression = customExpression;
            return this;
        }

        public Builder delaySeconds(int delaySeconds) {
            this.delaySeconds = delaySeconds;
            return this;
        }

        public Builder lastSchedule(Instant lastSchedule) {
            this.lastSchedule = lastSchedule;
            return this;
        }

        public Builder nextSchedule(Instant nextSchedule) {
            this.nextSchedule = nextSchedule;
            return this;
        }

        public RunTemplate build() {
            return new RunTemplate(id, tenantId, appId, name, executor, active, intervalCode, customExpression,
                    delaySeconds, lastSchedule, nextSchedule);
        }
    }
}

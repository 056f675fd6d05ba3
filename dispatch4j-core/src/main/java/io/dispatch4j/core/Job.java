package io.dispatch4j.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One enqueue request derived from a run template occurrence.
 *
 * <p>A job is pending while {@code exitCode} is null and {@code scheduledTime} is set; only the
 * execution subsystem ever records an exit code.
 */
public record Job(
        String id,
        String runTemplateId,
        String tenantId,
        String appId,
        Instant scheduledTime,
        String executor,
        TriggerSource triggerSource,
        Integer exitCode,
        Map<String, Object> configSnapshot
) {

    public Job {
        configSnapshot = configSnapshot == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(configSnapshot));
    }

    public boolean isPending() {
        return exitCode == null && scheduledTime != null;
    }

    public Job withExitCode(Integer code) {
        return new Job(id, runTemplateId, tenantId, appId, scheduledTime, executor, triggerSource, code,
                configSnapshot);
    }
}

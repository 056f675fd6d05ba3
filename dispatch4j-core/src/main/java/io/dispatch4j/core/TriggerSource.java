package io.dispatch4j.core;

import java.util.Locale;

/**
 * What caused a job to be enqueued.
 */
public enum TriggerSource {
    CRON,
    INTERVAL,
    ADHOC;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TriggerSource forInterval(IntervalCode code) {
        return code == IntervalCode.CUSTOM ? CRON : INTERVAL;
    }

    public static TriggerSource fromWireName(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

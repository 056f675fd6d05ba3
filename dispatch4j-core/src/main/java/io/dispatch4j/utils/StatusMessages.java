package io.dispatch4j.utils;

import io.dispatch4j.core.IntervalCode;
import io.dispatch4j.core.RunTemplate;
import io.dispatch4j.core.Tenant;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Formats operator-facing status lines.
 */
public final class StatusMessages {

    private static final DateTimeFormatter LOCAL_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private StatusMessages() {
    }

    /**
     * e.g. {@code "🕰️ 🧩 #app-1	nightly-export (runtemplate #rt-7) - Launch Thu, 1 Feb 2024 00:00:00 GMT for 🏣 ACME"}
     */
    public static String launch(RunTemplate template, Tenant tenant, Instant fireInstant, ZoneId zone) {
        return template.intervalCode().emoji() + " 🧩 #" + template.appId() + "\t" + template.name()
                + " (runtemplate #" + template.id() + ") - Launch " + rfc1123(fireInstant, zone)
                + " for 🏣 " + tenant.name();
    }

    public static String disabled(RunTemplate template, String reason) {
        return IntervalCode.NONE.emoji() + " Schedule of runtemplate #" + template.id() + " (" + template.name()
                + ") disabled: " + reason;
    }

    public static String noApplications(Tenant tenant, IntervalCode interval) {
        return interval.emoji() + " No applications to run for " + tenant.name() + " in interval " + interval.label();
    }

    public static String intervalBegin(Tenant tenant, IntervalCode interval) {
        return interval.emoji() + " " + tenant.name() + " Scheduler interval " + interval.label() + " begin";
    }

    public static String intervalEnd(Tenant tenant, IntervalCode interval) {
        return interval.emoji() + " " + tenant.name() + " Scheduler interval " + interval.label() + " end";
    }

    /**
     * e.g. {@code "☀️ Adding Startup delay +300 seconds to 2024-02-01 00:00:00"}
     */
    public static String startupDelay(RunTemplate template, Instant windowStart, ZoneId zone) {
        return template.intervalCode().emoji() + " Adding Startup delay +" + template.delaySeconds()
                + " seconds to " + LOCAL_DATE_TIME.format(windowStart.atZone(zone));
    }

    public static String rfc1123(Instant instant, ZoneId zone) {
        return DateTimeFormatter.RFC_1123_DATE_TIME.format(instant.atZone(zone));
    }
}

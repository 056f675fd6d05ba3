package io.dispatch4j.config;

import io.dispatch4j.core.DaemonSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.UUID;

/**
 * Runtime configuration for the dispatch scheduler.
 */
@ConfigurationProperties(prefix = "dispatch")
public class DispatchProperties {
    private static final Logger log = LoggerFactory.getLogger(DispatchProperties.class);

    private boolean enabled = true;
    private boolean daemonize = true;
    private Duration tickEvery = Duration.ofSeconds(1);
    private String timezone; // system default when blank
    private int startupMaxAttempts = 6;
    private Duration reconnectBaseDelay = Duration.ofSeconds(10);
    private Duration reconnectMaxDelay = Duration.ofSeconds(60);
    private Duration orphanGracePeriod = Duration.ofHours(1);
    private boolean preseedNextSchedule = false;
    private String instanceId;
    private boolean ensureIndexesOnStartup = false;
    private boolean oneShot = false;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isDaemonize() {
        return daemonize;
    }

    public void setDaemonize(boolean daemonize) {
        this.daemonize = daemonize;
    }

    public Duration getTickEvery() {
        return tickEvery;
    }

    public void setTickEvery(Duration tickEvery) {
        this.tickEvery = tickEvery;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public int getStartupMaxAttempts() {
        return startupMaxAttempts;
    }

    public void setStartupMaxAttempts(int startupMaxAttempts) {
        this.startupMaxAttempts = startupMaxAttempts;
    }

    public Duration getReconnectBaseDelay() {
        return reconnectBaseDelay;
    }

    public void setReconnectBaseDelay(Duration reconnectBaseDelay) {
        this.reconnectBaseDelay = reconnectBaseDelay;
    }

    public Duration getReconnectMaxDelay() {
        return reconnectMaxDelay;
    }

    public void setReconnectMaxDelay(Duration reconnectMaxDelay) {
        this.reconnectMaxDelay = reconnectMaxDelay;
    }

    public Duration getOrphanGracePeriod() {
        return orphanGracePeriod;
    }

    public void setOrphanGracePeriod(Duration orphanGracePeriod) {
        this.orphanGracePeriod = orphanGracePeriod;
    }

    public boolean isPreseedNextSchedule() {
        return preseedNextSchedule;
    }

    public void setPreseedNextSchedule(boolean preseedNextSchedule) {
        this.preseedNextSchedule = preseedNextSchedule;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public void setInstanceId(String instanceId) {
        this.instanceId = instanceId;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public boolean isOneShot() {
        return oneShot;
    }

    public void setOneShot(boolean oneShot) {
        this.oneShot = oneShot;
    }

    /**
     * @throws IllegalArgumentException for non-positive durations or fewer than one startup attempt
     */
    public DaemonSettings toDaemonSettings() {
        return new DaemonSettings(
                tickEvery,
                startupMaxAttempts,
                reconnectBaseDelay,
                reconnectMaxDelay,
                orphanGracePeriod,
                preseedNextSchedule,
                daemonize
        );
    }

    /**
     * @throws IllegalArgumentException for an unknown zone id
     */
    public ZoneId zoneId() {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Unknown dispatch.timezone: " + timezone, e);
        }
    }

    /**
     * Configured instance id, or {@code host-pid-uuid} when none is set.
     */
    public String resolveInstanceId() {
        if (instanceId != null && !instanceId.isBlank()) {
            return instanceId;
        }

        String host = "dispatch4j";
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("dispatch hostname lookup failed, using fallback msg={}", e.getMessage());
        }

        String generated = host + "-" + ManagementFactory.getRuntimeMXBean().getPid() + "-" + UUID.randomUUID();
        return generated.length() > 128 ? generated.substring(0, 128) : generated;
    }
}

package io.dispatch4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.Map;

/**
 * Mongo document model for run templates.
 *
 * <p>The scheduler writes only {@code interv} (when disabling), {@code lastSchedule} and {@code nextSchedule}.
 */
@Document(collection = "run_templates")
public class RunTemplateDocument {

    @Id
    private String id;

    private String companyId;
    private String appId;
    private String name;
    private String executor;
    private boolean active;

    @Field("interv")
    private String intervalCode;

    private String cron;
    private Integer delay;

    private Instant lastSchedule;
    private Instant nextSchedule;

    private Map<String, Object> configuration;

    public RunTemplateDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getCompanyId() {
        return companyId;
    }

    public void setCompanyId(String companyId) {
        this.companyId = companyId;
    }

    public String getAppId() {
        return appId;
    }

    public void setAppId(String appId) {
        this.appId = appId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getExecutor() {
        return executor;
    }

    public void setExecutor(String executor) {
        this.executor = executor;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public String getIntervalCode() {
        return intervalCode;
    }

    public void setIntervalCode(String intervalCode) {
        this.intervalCode = intervalCode;
    }

    public String getCron() {
        return cron;
    }

    public void setCron(String cron) {
        this.cron = cron;
    }

    public Integer getDelay() {
        return delay;
    }

    public void setDelay(Integer delay) {
        this.delay = delay;
    }

    public Instant getLastSchedule() {
        return lastSchedule;
    }

    public void setLastSchedule(Instant lastSchedule) {
        this.lastSchedule = lastSchedule;
    }

    public Instant getNextSchedule() {
        return nextSchedule;
    }

    public void setNextSchedule(Instant nextSchedule) {
        this.nextSchedule = nextSchedule;
    }

    public Map<String, Object> getConfiguration() {
        return configuration;
    }

    public void setConfiguration(Map<String, Object> configuration) {
        this.configuration = configuration;
    }
}

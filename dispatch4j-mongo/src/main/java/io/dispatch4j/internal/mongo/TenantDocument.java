package io.dispatch4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Mongo document model for tenants. Owned by the administration side; only read here.
 */
@Document(collection = "companies")
public class TenantDocument {

    @Id
    private String id;

    private String name;

    // missing counts as enabled
    private Boolean enabled;

    public TenantDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Boolean getEnabled() {
        return enabled;
    }

    public void setEnabled(Boolean enabled) {
        this.enabled = enabled;
    }
}

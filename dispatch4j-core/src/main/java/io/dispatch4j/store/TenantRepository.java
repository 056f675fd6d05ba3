package io.dispatch4j.store;

import io.dispatch4j.core.Tenant;

import java.util.List;

public interface TenantRepository {

    List<Tenant> listActiveTenants();
}

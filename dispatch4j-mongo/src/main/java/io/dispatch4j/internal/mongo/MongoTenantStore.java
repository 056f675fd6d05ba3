package io.dispatch4j.internal.mongo;

import io.dispatch4j.core.Tenant;
import io.dispatch4j.store.TenantRepository;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;
import java.util.Objects;

public class MongoTenantStore implements TenantRepository {

    private final MongoTemplate mongoTemplate;

    public MongoTenantStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public List<Tenant> listActiveTenants() {
        Query q = new Query(Criteria.where("enabled").ne(false));
        q.with(Sort.by(Sort.Order.asc("_id")));

        List<TenantDocument> docs = MongoErrors.call("listActiveTenants",
                () -> mongoTemplate.find(q, TenantDocument.class));
        return docs.stream()
                .map(d -> new Tenant(d.getId(), d.getName()))
                .toList();
    }
}

package io.github.hotbrkm.mailrouter.engine.email.tenant;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryTenantConfigStore implements TenantConfigStore {

    private final Map<String, TenantEmailConfig> configs = new ConcurrentHashMap<>();

    @Override
    public Optional<TenantEmailConfig> find(String tenantId) {
        if (tenantId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(configs.get(tenantId));
    }

    @Override
    public TenantEmailConfig save(TenantEmailConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        configs.put(config.tenantId(), config);
        return config;
    }
}

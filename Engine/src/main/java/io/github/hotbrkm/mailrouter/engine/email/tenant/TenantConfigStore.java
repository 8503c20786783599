package io.github.hotbrkm.mailrouter.engine.email.tenant;

import java.util.Optional;

/**
 * Persisted tenant email configuration, owned by the host application.
 */
public interface TenantConfigStore {

    Optional<TenantEmailConfig> find(String tenantId);

    /**
     * Upserts the configuration; the last write for a tenant wins.
     */
    TenantEmailConfig save(TenantEmailConfig config);
}

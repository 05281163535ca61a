package me.golemcore.pulse.adapter.outbound.tenant;

import me.golemcore.pulse.domain.service.JsonTable;
import me.golemcore.pulse.domain.service.JsonTableStore;
import me.golemcore.pulse.domain.service.PulseTables;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.TenantDirectoryPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Tenants listed in {@code pulse.tenants} plus every tenant that has autonomy
 * settings or metric snapshots stored.
 */
@Component
public class ConfiguredTenantDirectoryAdapter implements TenantDirectoryPort {

    private final PulseProperties properties;
    private final JsonTable<Object> autonomySettings;
    private final JsonTable<Object> metricSnapshots;

    public ConfiguredTenantDirectoryAdapter(PulseProperties properties, JsonTableStore tableStore) {
        this.properties = properties;
        this.autonomySettings = tableStore.table(PulseTables.AUTONOMY_SETTINGS, Object.class);
        this.metricSnapshots = tableStore.table(PulseTables.METRIC_SNAPSHOTS, Object.class);
    }

    @Override
    public List<String> listTenants() {
        Set<String> tenants = new LinkedHashSet<>(properties.getTenants());
        tenants.addAll(autonomySettings.tenants());
        tenants.addAll(metricSnapshots.tenants());
        return new ArrayList<>(tenants);
    }
}

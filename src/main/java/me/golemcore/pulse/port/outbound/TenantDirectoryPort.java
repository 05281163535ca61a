package me.golemcore.pulse.port.outbound;

import java.util.List;

/**
 * Port listing the tenants known to this core.
 */
public interface TenantDirectoryPort {

    List<String> listTenants();
}

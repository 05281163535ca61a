package me.golemcore.pulse.testsupport;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.pulse.domain.service.JsonTableStore;
import me.golemcore.pulse.infrastructure.config.AutoConfiguration;

/**
 * Wiring shortcuts shared by service tests.
 */
public final class PulseTestSupport {

    private PulseTestSupport() {
    }

    public static ObjectMapper objectMapper() {
        return AutoConfiguration.objectMapper();
    }

    public static JsonTableStore tableStore() {
        return new JsonTableStore(new InMemoryStoragePort(), objectMapper());
    }

    public static JsonTableStore tableStore(InMemoryStoragePort storagePort) {
        return new JsonTableStore(storagePort, objectMapper());
    }
}

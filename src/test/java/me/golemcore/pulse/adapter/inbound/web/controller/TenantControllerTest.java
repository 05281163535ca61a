package me.golemcore.pulse.adapter.inbound.web.controller;

import me.golemcore.pulse.domain.service.TenantDataService;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class TenantControllerTest {

    @Test
    void shouldPurgeTenantData() {
        TenantDataService tenantDataService = mock(TenantDataService.class);
        TenantController controller = new TenantController(tenantDataService);

        StepVerifier.create(controller.purge("acme"))
                .assertNext(response -> assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode()))
                .verifyComplete();

        verify(tenantDataService).purge("acme");
    }
}

package me.golemcore.pulse.domain.service;

import me.golemcore.pulse.domain.model.AutonomySettings;
import me.golemcore.pulse.domain.model.AutonomySettingsPatch;
import me.golemcore.pulse.domain.model.EvaluationResult;
import me.golemcore.pulse.domain.model.HeartbeatRuleSet;
import me.golemcore.pulse.testsupport.InMemoryStoragePort;
import me.golemcore.pulse.testsupport.MutableClock;
import me.golemcore.pulse.testsupport.PulseTestSupport;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TenantDataServiceTest {

    @Test
    void shouldDeleteTenantRowsAndKeepOtherTenantsAndGlobalRows() {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-02T12:00:00Z"));
        JsonTableStore tableStore = PulseTestSupport.tableStore(new InMemoryStoragePort());
        HeartbeatLedgerService ledger = new HeartbeatLedgerService(tableStore, clock);
        AutonomyService autonomy = new AutonomyService(tableStore, clock);
        JsonTable<HeartbeatRuleSet> ruleSets = tableStore.table(PulseTables.HEARTBEAT_RULESETS,
                HeartbeatRuleSet.class);

        ledger.append(EvaluationResult.builder().tenantId("acme").timestamp(clock.instant()).build());
        ledger.append(EvaluationResult.builder().tenantId("globex").timestamp(clock.instant()).build());
        autonomy.update("acme", AutonomySettingsPatch.builder().dailyActionLimit(3).build());
        ruleSets.append(JsonTable.GLOBAL, HeartbeatRuleSet.builder().id("revenue-watch").agentId("a").build());

        new TenantDataService(tableStore).purge("acme");

        assertTrue(ledger.list("acme").isEmpty());
        assertEquals(1, ledger.list("globex").size());
        assertEquals(AutonomySettings.DEFAULT_DAILY_ACTION_LIMIT, autonomy.get("acme").getDailyActionLimit());
        assertEquals(1, ruleSets.read(JsonTable.GLOBAL).size());
    }

    @Test
    void shouldRefuseGlobalOrBlankTenant() {
        TenantDataService service = new TenantDataService(PulseTestSupport.tableStore());

        assertThrows(IllegalArgumentException.class, () -> service.purge(JsonTable.GLOBAL));
        assertThrows(IllegalArgumentException.class, () -> service.purge(" "));
    }
}

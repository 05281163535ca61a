package me.golemcore.pulse.domain.service;

import java.util.List;

/**
 * Names of the persisted tables. Each is a storage directory holding one
 * JSON document per tenant.
 */
public final class PulseTables {

    public static final String AGENT_MESSAGES = "agent_messages";
    public static final String HEARTBEAT_LEDGER = "heartbeat_ledger";
    public static final String HEARTBEAT_RULESETS = "heartbeat_rulesets";
    public static final String TRIGGER_RULES = "trigger_rules";
    public static final String TRIGGER_LOGS = "trigger_logs";
    public static final String AGENT_ACTIONS = "agent_actions";
    public static final String WORKFLOWS = "workflows";
    public static final String WORKFLOW_RUNS = "workflow_runs";
    public static final String WORKFLOW_LOGS = "workflow_logs";
    public static final String WORKFLOW_APPROVALS = "workflow_approvals";
    public static final String AUTONOMY_SETTINGS = "startup_autonomy_settings";
    public static final String PROACTIVE_ACTION_LOG = "proactive_action_log";
    public static final String METRIC_SNAPSHOTS = "metric_snapshots";

    public static final List<String> ALL = List.of(
            AGENT_MESSAGES, HEARTBEAT_LEDGER, HEARTBEAT_RULESETS, TRIGGER_RULES, TRIGGER_LOGS,
            AGENT_ACTIONS, WORKFLOWS, WORKFLOW_RUNS, WORKFLOW_LOGS, WORKFLOW_APPROVALS,
            AUTONOMY_SETTINGS, PROACTIVE_ACTION_LOG, METRIC_SNAPSHOTS);

    /**
     * Tables whose documents belong to a tenant and are removed on purge.
     */
    public static final List<String> TENANT_SCOPED = ALL.stream()
            .filter(table -> !HEARTBEAT_RULESETS.equals(table))
            .toList();

    private PulseTables() {
    }
}

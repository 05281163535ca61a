package me.golemcore.pulse.domain.workflow.node;

import me.golemcore.pulse.domain.exception.NodeExecutionException;
import me.golemcore.pulse.domain.model.WorkflowNode;
import me.golemcore.pulse.domain.model.WorkflowNode.NodeType;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CodeNodeExecutorTest {

    private final CodeNodeExecutor executor = new CodeNodeExecutor();

    @Test
    void shouldEvaluateExpressionOverContextAndInputs() {
        NodeInput input = new NodeInput("acme", "wf-1", "run-1", Map.of("limit", 100),
                Map.of("http_1", Map.of("status", 200, "count", 140)));

        Object output = executor.execute(node("#context['http_1']['status'] == 200 "
                + "and #context['http_1']['count'] > #inputs['limit']"), input);

        assertEquals(Map.of("result", true), output);
    }

    @Test
    void shouldNotExposeTypeReferences() {
        NodeInput input = new NodeInput("acme", "wf-1", "run-1", Map.of(), Map.of());

        assertThrows(NodeExecutionException.class,
                () -> executor.execute(node("T(java.lang.System).exit(1)"), input));
    }

    @Test
    void shouldRejectUnparsableExpressionOnSave() {
        assertThrows(IllegalArgumentException.class, () -> executor.validate(node("#context[")));
        assertThrows(IllegalArgumentException.class, () -> executor.validate(node(" ")));
    }

    private static WorkflowNode node(String expression) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("expression", expression);
        return WorkflowNode.builder().id("code_1").type(NodeType.CODE).config(config).build();
    }
}

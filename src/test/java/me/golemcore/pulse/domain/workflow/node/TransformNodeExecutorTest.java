package me.golemcore.pulse.domain.workflow.node;

import me.golemcore.pulse.domain.model.WorkflowNode;
import me.golemcore.pulse.domain.model.WorkflowNode.NodeType;
import me.golemcore.pulse.testsupport.PulseTestSupport;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TransformNodeExecutorTest {

    private final TransformNodeExecutor executor = new TransformNodeExecutor(PulseTestSupport.objectMapper());

    @Test
    void shouldPickFieldsFromNestedValue() {
        WorkflowNode node = node(Map.of("transform", "pick", "input_key", "http_1.json",
                "fields", List.of("plan", "missing")));

        Object output = executor.execute(node, input(Map.of("http_1",
                Map.of("json", Map.of("plan", "pro", "seats", 12)))));

        assertEquals(Map.of("plan", "pro"), output);
    }

    @Test
    void shouldParseJsonStrings() {
        Object output = executor.execute(node(Map.of("transform", "json_parse")),
                input(Map.of("input", "[1,2]")));

        assertEquals(List.of(1, 2), output);
    }

    @Test
    void shouldPassThroughByDefault() {
        assertEquals("x", executor.execute(node(Map.of()), input(Map.of("input", "x"))));
    }

    @Test
    void shouldValidateTransformConfig() {
        assertThrows(IllegalArgumentException.class, () -> executor.validate(node(Map.of("transform", "template"))));
        assertThrows(IllegalArgumentException.class, () -> executor.validate(node(Map.of("transform", "pick"))));
        assertDoesNotThrow(() -> executor.validate(node(Map.of("transform", "LOWERCASE"))));
    }

    private static WorkflowNode node(Map<String, Object> config) {
        return WorkflowNode.builder().id("t").type(NodeType.TRANSFORM).config(new LinkedHashMap<>(config)).build();
    }

    private static NodeInput input(Map<String, Object> context) {
        return new NodeInput("acme", "wf-1", "run-1", Map.of(), context);
    }
}

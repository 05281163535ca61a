package me.golemcore.pulse.domain.workflow.node;

import me.golemcore.pulse.domain.exception.NodeExecutionException;
import me.golemcore.pulse.domain.model.Advice;
import me.golemcore.pulse.domain.model.AdvisorRequest;
import me.golemcore.pulse.domain.model.WorkflowNode;
import me.golemcore.pulse.domain.model.WorkflowNode.NodeType;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.AdvisorPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AiNodeExecutorTest {

    private AdvisorPort advisorPort;
    private PulseProperties properties;
    private AiNodeExecutor executor;

    @BeforeEach
    void setUp() {
        advisorPort = mock(AdvisorPort.class);
        properties = new PulseProperties();
        executor = new AiNodeExecutor(advisorPort, properties);
    }

    @Test
    void shouldRenderPromptFromContext() {
        when(advisorPort.respond(any())).thenReturn(Advice.builder().content("Follow up today").model("gpt").build());
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("prompt_template", "Summarize lead {lead.name} with score {http_1.score}");
        config.put("agent", "sales");

        Object output = executor.execute(node(config), new NodeInput("acme", "wf-1", "run-1", Map.of(),
                Map.of("lead", Map.of("name", "Globex"), "http_1", Map.of("score", 87))));

        ArgumentCaptor<AdvisorRequest> captor = ArgumentCaptor.forClass(AdvisorRequest.class);
        verify(advisorPort).respond(captor.capture());
        assertEquals("Summarize lead Globex with score 87", captor.getValue().getPrompt());
        assertEquals("sales", captor.getValue().getAgentId());
        assertEquals("acme", captor.getValue().getTenantId());
        assertEquals(Map.of("result", "Follow up today", "model", "gpt"), output);
    }

    @Test
    void shouldTruncateLongAnswers() {
        properties.getWorkflow().setMaxResponseChars(5);
        when(advisorPort.respond(any())).thenReturn(Advice.builder().content("abcdefghij").build());

        Object output = executor.execute(node(new LinkedHashMap<>()),
                new NodeInput("acme", "wf-1", "run-1", Map.of(), Map.of("input", "x")));

        assertEquals("abcde", ((Map<?, ?>) output).get("result"));
    }

    @Test
    void shouldFailNodeWhenAdvisorThrows() {
        when(advisorPort.respond(any())).thenThrow(new IllegalStateException("quota exceeded"));

        NodeExecutionException ex = assertThrows(NodeExecutionException.class,
                () -> executor.execute(node(new LinkedHashMap<>()),
                        new NodeInput("acme", "wf-1", "run-1", Map.of(), Map.of())));

        assertEquals("ai_1", ex.getNodeId());
        assertEquals("AI call failed: quota exceeded", ex.getMessage());
    }

    private static WorkflowNode node(Map<String, Object> config) {
        return WorkflowNode.builder().id("ai_1").type(NodeType.AI).config(config).build();
    }
}

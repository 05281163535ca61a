package me.golemcore.pulse.domain.workflow.node;

import me.golemcore.pulse.domain.exception.NodeExecutionException;
import me.golemcore.pulse.domain.model.WorkflowNode;
import me.golemcore.pulse.domain.model.WorkflowNode.NodeType;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BrowserNodeExecutorTest {

    private static final String PAGE = """
            <html><head><title>Pricing</title><script>track()</script></head>
            <body>
              <nav>Home | Blog</nav>
              <main><h1>Plans</h1><p>Pro costs   $49&nbsp;per seat.</p></main>
              <footer>(c) Acme</footer>
            </body></html>
            """;

    private MockWebServer mockServer;
    private BrowserNodeExecutor executor;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();
        executor = new BrowserNodeExecutor(new OkHttpClient(), new PulseProperties());
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    @Test
    void shouldFetchPageAndExtractMainText() {
        mockServer.enqueue(new MockResponse().setBody(PAGE).setHeader("Content-Type", "text/html"));

        @SuppressWarnings("unchecked")
        Map<String, Object> output = (Map<String, Object>) executor.execute(
                node(Map.of("url", mockServer.url("/pricing").toString())),
                new NodeInput("acme", "wf-1", "run-1", Map.of(), Map.of()));

        assertEquals("Pricing", output.get("title"));
        assertEquals("Plans Pro costs $49 per seat.", output.get("text"));
        assertEquals(200, output.get("status"));
    }

    @Test
    void shouldFailOnErrorStatus() {
        mockServer.enqueue(new MockResponse().setResponseCode(404));

        assertThrows(NodeExecutionException.class, () -> executor.execute(
                node(Map.of("url", mockServer.url("/missing").toString())),
                new NodeInput("acme", "wf-1", "run-1", Map.of(), Map.of())));
    }

    @Test
    void shouldHonourSelectorAndFallBackToBody() {
        assertEquals("Pro costs $49 per seat.",
                BrowserNodeExecutor.extractText(Jsoup.parse(PAGE), "main p"));
        assertEquals("Just text",
                BrowserNodeExecutor.extractText(Jsoup.parse("<body><div>Just text</div></body>"), null));
    }

    private static WorkflowNode node(Map<String, Object> config) {
        return WorkflowNode.builder().id("browse").type(NodeType.BROWSER).config(new LinkedHashMap<>(config))
                .build();
    }
}

package me.golemcore.gateway.adapter.outbound.runtime;

import me.golemcore.gateway.domain.model.QueryRequest;
import me.golemcore.gateway.domain.model.RuntimeMessage;
import me.golemcore.gateway.domain.model.RuntimeMessageType;
import me.golemcore.gateway.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EchoAgentRuntimeAdapterTest {

    private EchoAgentRuntimeAdapter runtime;

    @BeforeEach
    void setUp() {
        runtime = new EchoAgentRuntimeAdapter(AutoConfiguration.objectMapper());
    }

    @Test
    void shouldEmitInitAssistantAndResult() {
        QueryRequest request = QueryRequest.builder().prompt("hello there").model("sonnet").build();

        StepVerifier.create(runtime.execute(request, "s1"))
                .assertNext(message -> assertTrue(message.isInit()))
                .assertNext(message -> {
                    assertEquals(RuntimeMessageType.ASSISTANT, message.type());
                    assertEquals("hello there", message.data().path("content").get(0).path("text").asText());
                    assertEquals("sonnet", message.data().path("model").asText());
                    assertEquals(2, message.data().path("usage").path("input_tokens").asInt());
                })
                .assertNext(message -> {
                    assertEquals(RuntimeMessageType.RESULT, message.type());
                    assertEquals(1, message.data().path("num_turns").asInt());
                    assertEquals("hello there", message.data().path("result").asText());
                })
                .verifyComplete();
    }

    @Test
    void shouldCompleteEarlyWhenStopped() {
        QueryRequest request = QueryRequest.builder().prompt("hello").build();
        Flux<RuntimeMessage> messages = runtime.execute(request, "s1");

        assertTrue(runtime.stop("s1"));

        StepVerifier.create(messages).verifyComplete();
    }

    @Test
    void shouldReturnFalseWhenStoppingUnknownSession() {
        assertFalse(runtime.stop("unknown"));
    }

    @Test
    void shouldDescribeEchoCommand() {
        assertEquals("/echo", runtime.describeCommands().get(0).get("name"));
    }
}

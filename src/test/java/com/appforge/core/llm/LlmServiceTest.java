package com.appforge.core.llm;

import com.appforge.core.model.FrameworkChoice;
import com.appforge.core.model.RunPlan;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link LlmService}. The {@link ChatClient} chain is mocked.
 */
class LlmServiceTest {

    private ChatClientRequestSpec requestSpec;
    private CallResponseSpec callResponse;
    private LlmService llmService;

    @BeforeEach
    void setUp() {
        var chatClient = mock(ChatClient.class);
        requestSpec = mock(ChatClientRequestSpec.class);
        callResponse = mock(CallResponseSpec.class);

        when(chatClient.prompt()).thenReturn(requestSpec);
        when(requestSpec.system(anyString())).thenReturn(requestSpec);
        when(requestSpec.user(anyString())).thenReturn(requestSpec);
        when(requestSpec.call()).thenReturn(callResponse);

        ChatClient.Builder builder = mock(ChatClient.Builder.class);
        when(builder.build()).thenReturn(chatClient);

        llmService = new LlmService(builder, "http://test:1234");
    }

    @Test
    @DisplayName("structuredCall sends the system prompt and the user prompt with format instructions")
    void sendsPrompts() {
        when(callResponse.content()).thenReturn("{\"framework\":\"react\",\"reason\":\"spa\"}");

        FrameworkChoice choice = llmService.structuredCall("System prompt", "User prompt", FrameworkChoice.class);

        assertEquals("react", choice.framework());
        verify(requestSpec).system("System prompt");
        var user = ArgumentCaptor.forClass(String.class);
        verify(requestSpec).user(user.capture());
        assertTrue(user.getValue().startsWith("User prompt"));
        assertTrue(user.getValue().length() > "User prompt".length());
    }

    @Test
    @DisplayName("an empty response raises LlmEmptyResponseException")
    void emptyResponse() {
        when(callResponse.content()).thenReturn("  ");

        assertThrows(LlmEmptyResponseException.class,
                () -> llmService.structuredCall("s", "u", FrameworkChoice.class));
    }

    @Test
    @DisplayName("unparseable output raises LlmParseException")
    void unparseable() {
        when(callResponse.content()).thenReturn("I think you should use React.");

        assertThrows(LlmParseException.class, () -> llmService.structuredCall("s", "u", FrameworkChoice.class));
    }

    @Test
    @DisplayName("the lenient fallback strips markdown fences")
    void stripsFences() {
        RunPlan plan = llmService.parseWithJackson("""
                ```json
                {"steps":["Create app/page.tsx"],"assumptions":[],"risks":["No tests"]}
                ```
                """, RunPlan.class);

        assertEquals(List.of("Create app/page.tsx"), plan.steps());
        assertEquals(List.of("No tests"), plan.risks());
    }

    @Test
    @DisplayName("the lenient fallback ignores unknown fields and accepts single values as lists")
    void lenientParsing() {
        RunPlan plan = llmService.parseWithJackson(
                "{\"steps\":\"Only step\",\"confidence\":0.9}", RunPlan.class);

        assertEquals(List.of("Only step"), plan.steps());
        assertNull(plan.assumptions());
    }
}

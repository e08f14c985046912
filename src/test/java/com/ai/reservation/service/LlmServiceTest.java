package com.ai.reservation.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class LlmServiceTest {

    private LlmService llmService;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        llmService = new LlmService(new RestTemplateBuilder(), new ObjectMapper());
        ReflectionTestUtils.setField(llmService, "baseUrl", "https://llm.test/api/v1/");
        ReflectionTestUtils.setField(llmService, "apiKey", "test-key");
        ReflectionTestUtils.setField(llmService, "model", "openai/gpt-4o-mini");
        ReflectionTestUtils.setField(llmService, "temperature", 0.2);
        ReflectionTestUtils.setField(llmService, "maxOutputTokens", 1200);
        RestTemplate restTemplate = (RestTemplate) ReflectionTestUtils.getField(llmService, "restTemplate");
        server = MockRestServiceServer.bindTo(restTemplate).build();
    }

    @Test
    void completeJsonShouldSendSystemPromptInJsonMode() {
        server.expect(requestTo("https://llm.test/api/v1/chat/completions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer test-key"))
                .andExpect(jsonPath("$.model").value("openai/gpt-4o-mini"))
                .andExpect(jsonPath("$.max_tokens").value(1200))
                .andExpect(jsonPath("$.response_format.type").value("json_object"))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andExpect(jsonPath("$.messages[0].content").value("prompt text"))
                .andRespond(withSuccess(completion("{\\\"reply\\\": \\\"Hi\\\"}"), MediaType.APPLICATION_JSON));

        String content = llmService.completeJson("prompt text");

        assertThat(content).isEqualTo("{\"reply\": \"Hi\"}");
        server.verify();
    }

    @Test
    void completeJsonShouldStripMarkdownFence() {
        server.expect(requestTo("https://llm.test/api/v1/chat/completions"))
                .andRespond(withSuccess(completion("```json\\n{\\\"reply\\\": \\\"Hi\\\"}\\n```"), MediaType.APPLICATION_JSON));

        assertThat(llmService.completeJson("prompt")).isEqualTo("{\"reply\": \"Hi\"}");
    }

    @Test
    void completeJsonShouldRejectEmptyContent() {
        server.expect(requestTo("https://llm.test/api/v1/chat/completions"))
                .andRespond(withSuccess("{\"choices\": []}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> llmService.completeJson("prompt"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void completeJsonShouldFailWithoutApiKey() {
        ReflectionTestUtils.setField(llmService, "apiKey", "");

        assertThatThrownBy(() -> llmService.completeJson("prompt"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("OPENROUTER_API_KEY");
    }

    private static String completion(String escapedContent) {
        return "{\"choices\": [{\"message\": {\"role\": \"assistant\", \"content\": \"" + escapedContent + "\"}}]}";
    }
}

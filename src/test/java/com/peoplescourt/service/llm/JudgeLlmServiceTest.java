package com.peoplescourt.service.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.peoplescourt.config.CourtProperties;
import com.peoplescourt.exception.UpstreamServiceException;
import com.peoplescourt.util.JudgePromptBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.api.OllamaOptions;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JudgeLlmServiceTest {

    @Mock
    private OllamaChatModel judgeChatModel;

    private CourtProperties properties;
    private JudgeLlmService judgeLlmService;

    @BeforeEach
    void setUp() {
        properties = new CourtProperties();
        CourtProperties.Judge judge = new CourtProperties.Judge();
        judge.setApiKey("secret-key");
        properties.setJudge(judge);

        OllamaOptions options = OllamaOptions.builder().model("gemma3:12b").temperature(0.2).build();
        JudgePromptBuilder promptBuilder = new JudgePromptBuilder(new JudgeResponseSchema(new ObjectMapper()));
        judgeLlmService = new JudgeLlmService(judgeChatModel, options, promptBuilder, properties);
    }

    private static ChatResponse chunk(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }

    @Test
    void streamsFragmentsInOrderSkippingEmptyOnes() {
        when(judgeChatModel.stream(any(Prompt.class)))
                .thenReturn(Flux.just(chunk("{\"verdict\""), chunk(""), chunk(": \"NTA\""), chunk("}")));

        StepVerifier.create(judgeLlmService.deliberate("context"))
                .expectNext("{\"verdict\"", ": \"NTA\"", "}")
                .verifyComplete();
    }

    @Test
    void sendsSystemInstructionsAndContextWithSchema() {
        when(judgeChatModel.stream(any(Prompt.class))).thenReturn(Flux.just(chunk("{}")));
        ArgumentCaptor<Prompt> prompt = ArgumentCaptor.forClass(Prompt.class);

        judgeLlmService.deliberate("### CURRENT EVIDENCE PROVIDED BY THE PLAINTIFF:").blockLast();

        verify(judgeChatModel).stream(prompt.capture());
        assertThat(prompt.getValue().getInstructions()).hasSize(2);
        assertThat(prompt.getValue().getInstructions().get(0).getMessageType()).isEqualTo(MessageType.SYSTEM);
        assertThat(prompt.getValue().getInstructions().get(1).getText())
                .startsWith("### CURRENT EVIDENCE PROVIDED BY THE PLAINTIFF:")
                .contains("### RESPONSE FORMAT", "\"opening_statement\"");
    }

    @Test
    void transportFailureBecomesUpstreamError() {
        when(judgeChatModel.stream(any(Prompt.class))).thenReturn(Flux.error(new IOException("connection reset")));

        StepVerifier.create(judgeLlmService.deliberate("context"))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(UpstreamServiceException.class)
                        .hasMessageContaining("connection reset"))
                .verify();
    }

    @Test
    void silentStreamTimesOut() {
        when(judgeChatModel.stream(any(Prompt.class))).thenReturn(Flux.never());

        StepVerifier.withVirtualTime(() -> judgeLlmService.deliberate("context"))
                .expectSubscription()
                .thenAwait(Duration.ofSeconds(61))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(UpstreamServiceException.class)
                        .hasMessage("Judge produced no output for 60s"))
                .verify();
    }

    @Test
    void credentialRequiresNonBlankKey() {
        assertThat(judgeLlmService.hasCredential()).isTrue();

        properties.getJudge().setApiKey("  ");
        assertThat(judgeLlmService.hasCredential()).isFalse();

        properties.setJudge(null);
        assertThat(judgeLlmService.hasCredential()).isFalse();
    }
}

package com.peoplescourt.service.llm;

import com.peoplescourt.config.CourtProperties;
import com.peoplescourt.exception.CourtException;
import com.peoplescourt.exception.UpstreamServiceException;
import com.peoplescourt.util.JudgePromptBuilder;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

@Slf4j
@Service
@RequiredArgsConstructor
public class JudgeLlmService {

    private final OllamaChatModel judgeChatModel;
    private final OllamaOptions judgeOllamaOptions;
    private final JudgePromptBuilder promptBuilder;
    private final CourtProperties properties;

    public boolean hasCredential() {
        return StringUtils.hasText(properties.getJudgeApiKey());
    }

    /**
     * Stream the Judge's structured ruling for the given case context. Fragments
     * arrive in generation order; cancelling the subscription aborts the call.
     */
    @CircuitBreaker(name = "judge")
    public Flux<String> deliberate(String caseContext) {
        int timeout = properties.getJudgeTimeoutSeconds();

        List<Message> messages = List.of(
                new SystemMessage(promptBuilder.buildSystemPrompt()),
                new UserMessage(promptBuilder.buildDeliberationPrompt(caseContext)));
        Prompt prompt = new Prompt(messages, judgeOllamaOptions);

        return Flux.defer(() -> judgeChatModel.stream(prompt))
                .doOnSubscribe(s -> log.debug("Streaming ruling from Judge"))
                .map(this::textOf)
                .filter(StringUtils::hasLength)
                .timeout(Duration.ofSeconds(timeout))
                .onErrorMap(e -> !(e instanceof CourtException), e -> e instanceof TimeoutException
                        ? new UpstreamServiceException("Judge produced no output for " + timeout + "s", e)
                        : new UpstreamServiceException("Judge deliberation failed: " + e.getMessage(), e));
    }

    private String textOf(ChatResponse response) {
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            return "";
        }
        String text = response.getResult().getOutput().getText();
        return text != null ? text : "";
    }
}

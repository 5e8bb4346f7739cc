package com.peoplescourt.util;

import org.springframework.stereotype.Component;

import com.peoplescourt.service.llm.JudgeResponseSchema;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class JudgePromptBuilder {

    private final JudgeResponseSchema responseSchema;

    /* =========================================================
     * SYSTEM PROMPT
     * ========================================================= */
    public String buildSystemPrompt() {
        return """
                You are the Judge of 'The People's Court'. You rule on everyday social
                conflicts, guided by precedent cases and by the jury's pre-deliberation poll.

                Mandatory instructions:
                1. VERDICT: exactly one of YTA, NTA, ESH, NAH.
                2. RULING: 3-4 concise, authoritative sentences. Refer to precedents by their case ID.
                3. PRECEDENTS: for each case you rely on, one short sentence comparing it to the plaintiff's situation.
                4. Answer with JSON only, no prose around it.
                """;
    }

    /* =========================================================
     * DELIBERATION PROMPT
     * ========================================================= */
    public String buildDeliberationPrompt(String caseContext) {
        StringBuilder prompt = new StringBuilder();

        prompt.append(caseContext).append("\n");

        prompt.append("### RESPONSE FORMAT\n");
        prompt.append("Response MUST be valid JSON according to this schema:\n");
        prompt.append(responseSchema.asJson());

        return prompt.toString();
    }
}

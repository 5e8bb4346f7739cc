package com.peoplescourt.service.llm;

import java.util.Map;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON schema the Judge's output must satisfy. Sent both as the model's
 * structured-output format and verbatim inside the prompt.
 */
@Component
public class JudgeResponseSchema {

    public static final String JSON = """
            {
              "type": "object",
              "properties": {
                "verdict": {"type": "string", "enum": ["YTA", "NTA", "ESH", "NAH"]},
                "opening_statement": {"type": "string"},
                "facts": {"type": "string"},
                "precedents": {
                  "type": "array",
                  "items": {
                    "type": "object",
                    "properties": {
                      "case_id": {"type": "string"},
                      "comparison": {"type": "string"}
                    },
                    "required": ["case_id", "comparison"]
                  }
                },
                "deliberation": {"type": "string"}
              },
              "required": ["verdict", "opening_statement", "facts", "precedents", "deliberation"]
            }
            """;

    private final Map<String, Object> schema;

    public JudgeResponseSchema(ObjectMapper objectMapper) {
        try {
            this.schema = objectMapper.readValue(JSON, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Judge response schema is not valid JSON", e);
        }
    }

    public Map<String, Object> asMap() {
        return schema;
    }

    public String asJson() {
        return JSON;
    }
}

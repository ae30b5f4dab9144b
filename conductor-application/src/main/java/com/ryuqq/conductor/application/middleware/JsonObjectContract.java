package com.ryuqq.conductor.application.middleware;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.conductor.core.error.ValidationFailureException;
import com.ryuqq.conductor.core.model.Payload;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * JSON 객체 출력 계약.
 *
 * <p>출력이 JSON 객체이고 필수 필드를 모두 가지는지 검증한 뒤, 공백 없는 형태로 다시 직렬화합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class JsonObjectContract implements OutputContract {

    private final ObjectMapper objectMapper;
    private final Set<String> requiredFields;

    public JsonObjectContract(ObjectMapper objectMapper, Set<String> requiredFields) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
        this.requiredFields = requiredFields == null ? Set.of() : Set.copyOf(requiredFields);
    }

    @Override
    public Payload normalize(Payload raw) {
        JsonNode node;
        try {
            node = objectMapper.readTree(raw.asText());
        } catch (JsonProcessingException e) {
            throw new ValidationFailureException("Output is not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new ValidationFailureException("Output is not a JSON object");
        }
        List<String> missing = new ArrayList<>();
        for (String field : requiredFields) {
            if (!node.hasNonNull(field)) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            missing.sort(null);
            throw new ValidationFailureException("Output is missing required fields: " + missing);
        }
        try {
            return Payload.of(objectMapper.writeValueAsString(node));
        } catch (JsonProcessingException e) {
            throw new ValidationFailureException("Output could not be re-serialized", e);
        }
    }
}

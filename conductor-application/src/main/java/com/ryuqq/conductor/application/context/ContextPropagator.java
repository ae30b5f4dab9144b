package com.ryuqq.conductor.application.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.conductor.core.context.ContextKeys;
import org.slf4j.MDC;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * 요청 범위 상관관계 정보의 캡처/복원.
 *
 * <p>상관관계 정보는 SLF4J {@link MDC}에 바인딩됩니다.</p>
 *
 * <p><strong>경계별 전파:</strong></p>
 * <ul>
 *   <li>같은 메모리를 공유하는 워커 풀: {@link ContextPropagatingExecutorService}가 자동으로 전파</li>
 *   <li>큐/프로세스 경계: {@link #toMap(PropagationToken)} 또는 {@link #toJson(PropagationToken)}으로 직렬화해
 *       명시적으로 넘기고, 수신 측이 로깅이나 위임 전에 {@link #restore(PropagationToken)}를 호출해야 함</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * PropagationToken token = propagator.fromMap(message.context());
 * try (ContextPropagator.Scope ignored = propagator.restore(token)) {
 *     coordinator.handle(unit);
 * }
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ContextPropagator {

    /** WorkUnit 범위 키는 캡처하지 않습니다. 실행하는 쪽에서 다시 바인딩합니다. */
    private static final TypeReference<Map<String, String>> TOKEN_MAP = new TypeReference<>() {
    };
    private static final Set<String> UNIT_SCOPED_KEYS = Set.of(ContextKeys.WORK_UNIT_ID, ContextKeys.CONVERSATION_ID);

    private final ObjectMapper objectMapper;

    public ContextPropagator() {
        this(new ObjectMapper());
    }

    public ContextPropagator(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * 현재 스레드의 상관관계 정보 캡처.
     *
     * @return 전파 토큰
     */
    public PropagationToken capture() {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        if (mdc == null || mdc.isEmpty()) {
            return PropagationToken.empty();
        }
        Map<String, String> baggage = new HashMap<>();
        for (Map.Entry<String, String> entry : mdc.entrySet()) {
            String key = entry.getKey();
            if (!key.equals(ContextKeys.CORRELATION_ID) && !key.equals(ContextKeys.TRACE_ID)
                && !UNIT_SCOPED_KEYS.contains(key) && entry.getValue() != null) {
                baggage.put(key, entry.getValue());
            }
        }
        return new PropagationToken(mdc.get(ContextKeys.CORRELATION_ID), mdc.get(ContextKeys.TRACE_ID), baggage);
    }

    /**
     * 토큰을 현재 스레드에 바인딩. 반환된 Scope를 닫으면 이전 상태로 복원됩니다.
     *
     * @param token 전파 토큰
     * @return 복원 범위
     */
    public Scope restore(PropagationToken token) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        PropagationToken value = token == null ? PropagationToken.empty() : token;
        putOrRemove(ContextKeys.CORRELATION_ID, value.correlationId());
        putOrRemove(ContextKeys.TRACE_ID, value.traceId());
        value.baggage().forEach(MDC::put);
        return () -> {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        };
    }

    private static void putOrRemove(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }

    public Runnable wrap(Runnable task) {
        PropagationToken token = capture();
        return () -> {
            try (Scope ignored = restoreClean(token)) {
                task.run();
            }
        };
    }

    public <T> Callable<T> wrap(Callable<T> task) {
        PropagationToken token = capture();
        return () -> {
            try (Scope ignored = restoreClean(token)) {
                return task.call();
            }
        };
    }

    /**
     * 풀 스레드에 남아 있을 수 있는 이전 작업의 MDC를 지우고 복원.
     */
    private Scope restoreClean(PropagationToken token) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        MDC.clear();
        Scope restored = restore(token);
        return () -> {
            restored.close();
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        };
    }

    // ===== 명시적 직렬화 (큐/프로세스 경계) =====

    public Map<String, String> toMap(PropagationToken token) {
        Map<String, String> map = new HashMap<>();
        if (token.correlationId() != null) {
            map.put(ContextKeys.CORRELATION_ID, token.correlationId());
        }
        if (token.traceId() != null) {
            map.put(ContextKeys.TRACE_ID, token.traceId());
        }
        token.baggage().forEach((k, v) -> map.put(ContextKeys.BAGGAGE_PREFIX + k, v));
        return map;
    }

    public PropagationToken fromMap(Map<String, String> map) {
        if (map == null || map.isEmpty()) {
            return PropagationToken.empty();
        }
        Map<String, String> baggage = new HashMap<>();
        map.forEach((k, v) -> {
            if (k.startsWith(ContextKeys.BAGGAGE_PREFIX)) {
                baggage.put(k.substring(ContextKeys.BAGGAGE_PREFIX.length()), v);
            }
        });
        return new PropagationToken(map.get(ContextKeys.CORRELATION_ID), map.get(ContextKeys.TRACE_ID), baggage);
    }

    public String toJson(PropagationToken token) {
        try {
            return objectMapper.writeValueAsString(toMap(token));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize propagation token", e);
        }
    }

    /**
     * JSON에서 토큰 복원.
     *
     * @param json toJson 결과
     * @return 전파 토큰
     * @throws IllegalArgumentException JSON 형식이 아닌 경우
     */
    public PropagationToken fromJson(String json) {
        if (json == null || json.isBlank()) {
            return PropagationToken.empty();
        }
        try {
            return fromMap(objectMapper.readValue(json, TOKEN_MAP));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid propagation token: " + json, e);
        }
    }

    /**
     * 복원 범위. 예외를 던지지 않는 AutoCloseable.
     */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {

        @Override
        void close();
    }
}

package com.ryuqq.conductor.application.routing;

import com.ryuqq.conductor.application.middleware.OutputContract;
import com.ryuqq.conductor.core.handler.Handler;

import java.util.List;

/**
 * 등록된 핸들러 한 개의 메타데이터.
 *
 * @param name 핸들러 이름 (라우팅 결과와 visited_handlers에 쓰임)
 * @param handler 실행 함수
 * @param description 카탈로그용 설명
 * @param keywords 키워드 라우팅 규칙이 사용하는 키워드
 * @param contract 출력 계약 (null이면 통과)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record HandlerRegistration(
    String name,
    Handler handler,
    String description,
    List<String> keywords,
    OutputContract contract
) {

    public HandlerRegistration {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        description = description == null ? "" : description;
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        contract = contract == null ? OutputContract.passThrough() : contract;
    }

    public static HandlerRegistration of(String name, Handler handler, String... keywords) {
        return new HandlerRegistration(name, handler, "", List.of(keywords), null);
    }

    public HandlerRegistration withDescription(String value) {
        return new HandlerRegistration(name, handler, value, keywords, contract);
    }

    public HandlerRegistration withContract(OutputContract value) {
        return new HandlerRegistration(name, handler, description, keywords, value);
    }
}

package com.ryuqq.conductor.core.handler;

import com.ryuqq.conductor.core.model.Payload;

/**
 * 핸들러가 요청하는 하위 작업 위임.
 *
 * @param targetHint 대상 핸들러 이름 힌트 (null이면 라우팅 규칙으로 결정)
 * @param input 하위 작업 입력
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DelegationRequest(String targetHint, Payload input) {

    public DelegationRequest {
        input = input == null ? Payload.empty() : input;
    }

    public static DelegationRequest to(String targetHint, String input) {
        return new DelegationRequest(targetHint, Payload.of(input));
    }
}

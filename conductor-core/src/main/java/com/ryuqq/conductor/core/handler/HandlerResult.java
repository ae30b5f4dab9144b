package com.ryuqq.conductor.core.handler;

import com.ryuqq.conductor.core.model.Payload;

import java.util.Optional;

/**
 * 핸들러 실행 결과.
 *
 * <p><strong>구성:</strong></p>
 * <ul>
 *   <li>output: 출력 Payload</li>
 *   <li>usage: 비용/사용량 (없으면 {@link Usage#none()})</li>
 *   <li>delegation: 선택적 위임 요청</li>
 *   <li>approvalRequired: 사람의 승인 후 다시 실행되어야 하는지</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record HandlerResult(
    Payload output,
    Usage usage,
    DelegationRequest delegation,
    boolean approvalRequired
) {

    public HandlerResult {
        output = output == null ? Payload.empty() : output;
        usage = usage == null ? Usage.none() : usage;
    }

    public static HandlerResult of(String output) {
        return new HandlerResult(Payload.of(output), Usage.none(), null, false);
    }

    public static HandlerResult of(String output, Usage usage) {
        return new HandlerResult(Payload.of(output), usage, null, false);
    }

    public static HandlerResult delegating(String output, Usage usage, DelegationRequest delegation) {
        if (delegation == null) {
            throw new IllegalArgumentException("delegation cannot be null");
        }
        return new HandlerResult(Payload.of(output), usage, delegation, false);
    }

    public static HandlerResult awaitingApproval(String output) {
        return new HandlerResult(Payload.of(output), Usage.none(), null, true);
    }

    public Optional<DelegationRequest> getDelegation() {
        return Optional.ofNullable(delegation);
    }

    /**
     * 출력만 교체한 결과 (output-normalization 단계용).
     *
     * @param normalized 정규화된 출력
     * @return 새 HandlerResult
     */
    public HandlerResult withOutput(Payload normalized) {
        return new HandlerResult(normalized, usage, delegation, approvalRequired);
    }
}

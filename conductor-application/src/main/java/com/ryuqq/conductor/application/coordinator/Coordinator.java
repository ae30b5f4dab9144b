package com.ryuqq.conductor.application.coordinator;

import com.ryuqq.conductor.core.delegation.DelegationContext;
import com.ryuqq.conductor.core.handler.DelegationRequest;
import com.ryuqq.conductor.core.model.WorkUnit;
import com.ryuqq.conductor.core.model.WorkUnitId;

/**
 * WorkUnit 실행 조정자.
 *
 * <p>WorkUnit을 핸들러로 라우팅하고, 재귀 위임의 깊이/순환/예산/마감 한도를 강제하며,
 * 모든 핸들러 실행을 미들웨어 체인으로 감쌉니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * WorkUnit unit = WorkUnit.root(WorkKind.USER_REQUEST, ConversationId.generate(), Payload.of("hi"), clock);
 * WorkUnit done = coordinator.handle(unit);
 *
 * switch (done.getStatus()) {
 *     case COMPLETED -&gt; render(done.getOutput());
 *     case FAILED -&gt; report(done.getError());
 *     default -&gt; ...
 * }
 * </pre>
 *
 * <p><strong>경계 보장:</strong> handle 계열 메서드는 예외를 던지지 않고 항상 종료 상태의 WorkUnit을 반환합니다.
 * 모든 실패는 {@code status}/{@code error}에 기록됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Coordinator {

    /**
     * 루트 WorkUnit 처리. 기본 예산/마감으로 depth 0 컨텍스트를 만듭니다.
     *
     * @param workUnit PENDING 상태의 루트 WorkUnit (이미 종료된 id면 저장된 기록 반환)
     * @return 종료 상태의 WorkUnit
     */
    WorkUnit handle(WorkUnit workUnit);

    /**
     * 주어진 위임 컨텍스트로 WorkUnit 처리.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>취소/마감/깊이 확인 (핸들러 실행 전 거부)</li>
     *   <li>라우팅 (규칙 → 분류기 → 기본 핸들러)</li>
     *   <li>순환 확인 (visited_handlers)</li>
     *   <li>depth+1 컨텍스트로 미들웨어 체인 실행</li>
     *   <li>위임 요청 시 자식 WorkUnit으로 재귀, 아니면 완료</li>
     * </ol>
     *
     * @param workUnit 처리할 WorkUnit
     * @param context 현재 위임 컨텍스트
     * @return 종료 상태의 WorkUnit
     */
    WorkUnit handle(WorkUnit workUnit, DelegationContext context);

    /**
     * 라우팅 없이 지정 핸들러로 직접 실행. 깊이/순환/예산 검사와 미들웨어 체인은 동일하게 적용됩니다.
     *
     * @param handlerName 등록된 핸들러 이름
     * @param workUnit 처리할 WorkUnit
     * @param context 현재 위임 컨텍스트
     * @return 종료 상태의 WorkUnit
     */
    WorkUnit handleDirect(String handlerName, WorkUnit workUnit, DelegationContext context);

    /**
     * 핸들러 내부(워커 스레드 포함)에서 하위 작업 위임.
     *
     * @param parent 위임하는 WorkUnit
     * @param context 핸들러가 받은 위임 컨텍스트
     * @param request 위임 요청
     * @return 종료 상태의 자식 WorkUnit (부모에 연결됨)
     */
    WorkUnit delegate(WorkUnit parent, DelegationContext context, DelegationRequest request);

    /**
     * 실행 중인 루트 WorkUnit과 하위 트리 취소.
     *
     * @param rootId 루트 WorkUnit ID
     * @param reason 취소 사유
     * @return 실행 중인 루트를 찾아 신호를 보냈으면 true
     */
    boolean cancel(WorkUnitId rootId, String reason);

    /**
     * 승인 대기 중인 WorkUnit 승인. 핸들러가 approved=true로 다시 실행됩니다.
     *
     * @param workUnitId 승인 대기 WorkUnit ID
     * @return 대기 중인 WorkUnit이 있었으면 true
     */
    boolean approve(WorkUnitId workUnitId);

    /**
     * 승인 대기 중인 WorkUnit 거절. WorkUnit은 CANCELLED가 됩니다.
     *
     * @param workUnitId 승인 대기 WorkUnit ID
     * @param reason 거절 사유
     * @return 대기 중인 WorkUnit이 있었으면 true
     */
    boolean reject(WorkUnitId workUnitId, String reason);
}

package com.ryuqq.conductor.application.middleware;

/**
 * 대화 컨텍스트에 저장되는 실행 기록 한 건.
 *
 * @param workUnitId WorkUnit ID
 * @param handler 실행한 핸들러
 * @param input 입력 원문
 * @param output 출력 원문
 * @param at 기록 시각 (ISO-8601)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ConversationTurn(String workUnitId, String handler, String input, String output, String at) {
}

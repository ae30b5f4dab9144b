package com.ryuqq.conductor.core.spi;

import com.ryuqq.conductor.core.model.WorkUnit;

import java.util.Set;

/**
 * 결정적 라우팅 규칙이 모두 실패했을 때 사용하는 분류기 SPI (예: LLM 분류 호출).
 *
 * <p>Router는 이 호출을 "classifier" 의존성 이름으로 ResilientCaller를 통해 실행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Classifier {

    /**
     * 핸들러 이름 선택.
     *
     * @param workUnit 라우팅 대상
     * @param candidates 등록된 핸들러 이름
     * @return 선택한 핸들러 이름 (알 수 없는 이름이면 기본 핸들러로 대체됨)
     * @throws Exception 분류 실패
     */
    String classify(WorkUnit workUnit, Set<String> candidates) throws Exception;
}

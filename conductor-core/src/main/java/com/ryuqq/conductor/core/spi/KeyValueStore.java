package com.ryuqq.conductor.core.spi;

import java.util.Optional;

/**
 * 단순 get/put 저장소 SPI.
 *
 * <p>state-load/state-save는 conversationId로, cost-accounting은 WorkUnit ID로 키를 구성합니다.
 * 저장 형식은 구현이 결정합니다. 호출은 항상 ResilientCaller를 통해 이루어집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void put(String key, String value);
}

/**
 * Runner Adapter Layer - Coordinator 구현체와 엔진 조립.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.adapter.runner.DelegatingCoordinator} - 라우팅, 재귀 위임, 승인 대기</li>
 *   <li>{@link com.ryuqq.conductor.adapter.runner.QueueWorkerRunner} - 큐 intake (Runtime)</li>
 *   <li>{@link com.ryuqq.conductor.adapter.runner.ConductorEngine} - 설정 기반 조립</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (DelegatingCoordinator, QueueWorkerRunner, LifecycleManager)
 *   ↓ implements
 * application (Coordinator, Runtime, MiddlewareChain, Router, EngineGate)
 *   ↓ depends on
 * core (WorkUnit, DelegationContext, ErrorCode, SPI)
 *   ↑ implemented by
 * adapter-resilience (ResiliencePipeline)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.conductor.adapter.runner;

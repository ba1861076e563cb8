/**
 * Runner Adapter Layer - 리뷰 프로토콜 실행과 조립.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.reviewflow.adapter.runner.ConsensusReviewRunner} - ReviewCoordinator 구현, 제한된 worker pool</li>
 *   <li>{@link com.ryuqq.reviewflow.adapter.runner.EscalationDispatcher} - HumanDecisionPort 호출 전용 스레드</li>
 *   <li>{@link com.ryuqq.reviewflow.adapter.runner.ReviewFlowEngine} - 조립 루트</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (ConsensusReviewRunner, EscalationDispatcher, ReviewFlowEngine)
 *   ↓ implements
 * application (ReviewCoordinator, PhaseController, TaskRouter)
 *   ↓ depends on
 * core (model, statemachine, resolver, SPI)
 * </pre>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
package com.ryuqq.reviewflow.adapter.runner;

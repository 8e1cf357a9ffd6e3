package com.ryuqq.scorelog.application.assignment;

/**
 * 아이템을 호환 가능한 BatchJob에 배정.
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>아이템당 ScoringJob 최대 1개 (같은 itemId로 반복 호출 시 기존 작업 반환)</li>
 *   <li>ScoringJob은 같은 호환성 범위의 BatchJob에만 연결</li>
 *   <li>BatchJob 크기 상한은 soft cap (동시 배정 시 초과 가능)</li>
 * </ul>
 *
 * <p>동기 호출이며, 모든 오류를 호출자에게 전파합니다.</p>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public interface BatchJobAssigner {

    /**
     * 아이템 배정.
     *
     * @param request 배정 요청
     * @return 배정 결과
     * @throws com.ryuqq.scorelog.core.exception.GatewayException 원격 호출 실패 시
     */
    Assignment assign(AssignmentRequest request);
}

package com.ryuqq.scorelog.adapter.runner;

/**
 * BatchJobCoordinator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>linkPageSize: 링크 재계산 시 페이지 크기 (기본 1000)</li>
 *   <li>batchJobType: 새로 만드는 BatchJob의 유형 (기본 MultiStepScore)</li>
 * </ul>
 *
 * <p>BatchJob 최대 크기는 요청마다 다를 수 있으므로
 * {@link com.ryuqq.scorelog.application.assignment.AssignmentRequest#maxBatchSize()}에 둡니다.</p>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 * @param linkPageSize 링크 페이지 크기 (1 이상)
 * @param batchJobType BatchJob 유형 (빈 문자열 불가)
 */
public record CoordinatorConfig(int linkPageSize, String batchJobType) {

    public static final String DEFAULT_BATCH_JOB_TYPE = "MultiStepScore";

    /**
     * 기본 설정 생성자 (linkPageSize=1000, batchJobType=MultiStepScore).
     */
    public CoordinatorConfig() {
        this(1000, DEFAULT_BATCH_JOB_TYPE);
    }

    public CoordinatorConfig {
        if (linkPageSize <= 0) {
            throw new IllegalArgumentException(
                "linkPageSize must be positive (current: " + linkPageSize + ")"
            );
        }
        if (batchJobType == null || batchJobType.isBlank()) {
            throw new IllegalArgumentException("batchJobType cannot be null or blank");
        }
    }

    /**
     * linkPageSize만 변경한 새 인스턴스 생성.
     */
    public CoordinatorConfig withLinkPageSize(int linkPageSize) {
        return new CoordinatorConfig(linkPageSize, batchJobType);
    }

    /**
     * batchJobType만 변경한 새 인스턴스 생성.
     */
    public CoordinatorConfig withBatchJobType(String batchJobType) {
        return new CoordinatorConfig(linkPageSize, batchJobType);
    }
}

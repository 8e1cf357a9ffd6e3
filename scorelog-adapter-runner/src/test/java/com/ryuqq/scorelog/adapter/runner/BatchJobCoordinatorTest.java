package com.ryuqq.scorelog.adapter.runner;

import com.ryuqq.scorelog.application.api.DashboardApi;
import com.ryuqq.scorelog.application.assignment.Assignment;
import com.ryuqq.scorelog.application.assignment.AssignmentRequest;
import com.ryuqq.scorelog.core.contract.GatewayError;
import com.ryuqq.scorelog.core.contract.Operation;
import com.ryuqq.scorelog.core.exception.ApplicationException;
import com.ryuqq.scorelog.core.model.BatchJob;
import com.ryuqq.scorelog.core.model.BatchJobLink;
import com.ryuqq.scorelog.core.model.BatchJobStatus;
import com.ryuqq.scorelog.core.model.BatchJobUpdate;
import com.ryuqq.scorelog.core.model.BatchScope;
import com.ryuqq.scorelog.core.model.NewBatchJob;
import com.ryuqq.scorelog.core.model.NewScoringJob;
import com.ryuqq.scorelog.core.model.ScoringJob;
import com.ryuqq.scorelog.core.model.ScoringJobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * BatchJobCoordinator 유닛 테스트.
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class BatchJobCoordinatorTest {

    private static final BatchScope SCOPE = BatchScope.of("acc", "sc", "openai", "gpt-4o");

    @Mock
    private DashboardApi api;

    private BatchJobCoordinator coordinator;

    @BeforeEach
    void setUp() {
        coordinator = new BatchJobCoordinator(api, new CoordinatorConfig());
    }

    // ============================================================
    // 1. 기존 ScoringJob 재사용
    // ============================================================

    @Test
    void 기존_작업이_있으면_연결된_배치와_함께_반환() {
        // given
        ScoringJob existing = scoringJob("sj-1", "bj-1");
        BatchJob batch = batchJob("bj-1", BatchJobStatus.OPEN, null, 1);
        when(api.findScoringJobByItemId("item-1")).thenReturn(Optional.of(existing));
        when(api.findLinkForScoringJob("sj-1")).thenReturn(Optional.of(new BatchJobLink("bj-1", "sj-1")));
        when(api.getBatchJob("bj-1")).thenReturn(batch);

        // when
        Assignment assignment = coordinator.assign(request("item-1"));

        // then
        assertThat(assignment.reused()).isTrue();
        assertThat(assignment.scoringJob()).isEqualTo(existing);
        assertThat(assignment.batchJob()).isEqualTo(batch);
        verify(api, never()).createScoringJob(any());
        verify(api, never()).createLink(anyString(), anyString());
    }

    @Test
    void 기존_작업의_링크가_없으면_batchJob은_null() {
        // given
        when(api.findScoringJobByItemId("item-1")).thenReturn(Optional.of(scoringJob("sj-1", null)));
        when(api.findLinkForScoringJob("sj-1")).thenReturn(Optional.empty());

        // when
        Assignment assignment = coordinator.assign(request("item-1"));

        // then
        assertThat(assignment.reused()).isTrue();
        assertThat(assignment.batchJob()).isNull();
    }

    // ============================================================
    // 2. BatchJob 선택 / 생성
    // ============================================================

    @Test
    void 여유있는_열린_배치를_first_fit으로_선택() {
        // given
        BatchJob full = batchJob("bj-full", BatchJobStatus.OPEN, 20, 20);
        BatchJob roomy = batchJob("bj-roomy", BatchJobStatus.OPEN, 5, 5);
        when(api.findScoringJobByItemId("item-1")).thenReturn(Optional.empty());
        when(api.listOpenBatchJobs(SCOPE)).thenReturn(List.of(full, roomy));
        when(api.getBatchJob("bj-roomy")).thenReturn(roomy);
        when(api.createScoringJob(any())).thenReturn(scoringJob("sj-1", "bj-roomy"));
        when(api.countLinksForBatch("bj-roomy", 1000)).thenReturn(6);
        when(api.updateBatchJob(eq("bj-roomy"), any())).thenReturn(batchJob("bj-roomy", BatchJobStatus.OPEN, 5, 6));

        // when
        Assignment assignment = coordinator.assign(request("item-1"));

        // then
        assertThat(assignment.reused()).isFalse();
        assertThat(assignment.batchJob().id()).isEqualTo("bj-roomy");
        verify(api).createLink("bj-roomy", "sj-1");
        verify(api).updateBatchJob("bj-roomy", BatchJobUpdate.countCache(6));
        verify(api, never()).createBatchJob(any());
    }

    @Test
    void 열린_배치가_없으면_MultiStepScore_유형으로_생성() {
        // given
        BatchJob created = batchJob("bj-new", BatchJobStatus.OPEN, null, 0);
        when(api.findScoringJobByItemId("item-1")).thenReturn(Optional.empty());
        when(api.listOpenBatchJobs(SCOPE)).thenReturn(List.of());
        when(api.createBatchJob(any())).thenReturn(created);
        when(api.createScoringJob(any())).thenReturn(scoringJob("sj-1", "bj-new"));
        when(api.countLinksForBatch("bj-new", 1000)).thenReturn(1);
        when(api.updateBatchJob(eq("bj-new"), any())).thenReturn(batchJob("bj-new", BatchJobStatus.OPEN, null, 1));

        // when
        coordinator.assign(request("item-1"));

        // then
        ArgumentCaptor<NewBatchJob> batchCaptor = ArgumentCaptor.forClass(NewBatchJob.class);
        verify(api).createBatchJob(batchCaptor.capture());
        assertThat(batchCaptor.getValue().type()).isEqualTo("MultiStepScore");
        assertThat(batchCaptor.getValue().status()).isEqualTo(BatchJobStatus.OPEN);
        assertThat(batchCaptor.getValue().scoringJobCountCache()).isZero();
        assertThat(batchCaptor.getValue().scope()).isEqualTo(SCOPE);

        ArgumentCaptor<NewScoringJob> jobCaptor = ArgumentCaptor.forClass(NewScoringJob.class);
        verify(api).createScoringJob(jobCaptor.capture());
        assertThat(jobCaptor.getValue().status()).isEqualTo(ScoringJobStatus.PENDING);
        assertThat(jobCaptor.getValue().batchId()).isEqualTo("bj-new");
    }

    @Test
    void 범위가_다른_배치는_건너뜀() {
        // given
        BatchJob foreign = new BatchJob("bj-foreign", "acc", "sc", null, "MultiStepScore",
            "openai", "gpt-4o-mini", BatchJobStatus.OPEN, null, 0, null);
        when(api.findScoringJobByItemId("item-1")).thenReturn(Optional.empty());
        when(api.listOpenBatchJobs(SCOPE)).thenReturn(List.of(foreign));
        when(api.createBatchJob(any())).thenReturn(batchJob("bj-new", BatchJobStatus.OPEN, null, 0));
        when(api.createScoringJob(any())).thenReturn(scoringJob("sj-1", "bj-new"));
        when(api.countLinksForBatch("bj-new", 1000)).thenReturn(1);
        when(api.updateBatchJob(eq("bj-new"), any())).thenReturn(batchJob("bj-new", BatchJobStatus.OPEN, null, 1));

        // when
        Assignment assignment = coordinator.assign(request("item-1"));

        // then
        assertThat(assignment.batchJob().id()).isEqualTo("bj-new");
        verify(api, never()).getBatchJob("bj-foreign");
    }

    // ============================================================
    // 3. 재계산 및 닫기
    // ============================================================

    @Test
    void 링크_수가_상한에_도달하면_닫음() {
        // given
        BatchJob open = batchJob("bj-1", BatchJobStatus.OPEN, null, 19);
        BatchJob closed = batchJob("bj-1", BatchJobStatus.CLOSED, null, 20);
        when(api.findScoringJobByItemId("item-20")).thenReturn(Optional.empty());
        when(api.listOpenBatchJobs(SCOPE)).thenReturn(List.of(open));
        when(api.getBatchJob("bj-1")).thenReturn(open);
        when(api.createScoringJob(any())).thenReturn(scoringJob("sj-20", "bj-1"));
        when(api.countLinksForBatch("bj-1", 1000)).thenReturn(20);
        when(api.updateBatchJob("bj-1", BatchJobUpdate.close(20))).thenReturn(closed);

        // when
        Assignment assignment = coordinator.assign(request("item-20"));

        // then
        assertThat(assignment.batchJob().status()).isEqualTo(BatchJobStatus.CLOSED);
        assertThat(assignment.batchJob().scoringJobCountCache()).isEqualTo(20);
    }

    @Test
    void 링크_재계산은_설정된_페이지_크기를_사용() {
        // given
        coordinator = new BatchJobCoordinator(api, new CoordinatorConfig().withLinkPageSize(50));
        BatchJob open = batchJob("bj-1", BatchJobStatus.OPEN, null, 0);
        when(api.findScoringJobByItemId("item-1")).thenReturn(Optional.empty());
        when(api.listOpenBatchJobs(SCOPE)).thenReturn(List.of(open));
        when(api.getBatchJob("bj-1")).thenReturn(open);
        when(api.createScoringJob(any())).thenReturn(scoringJob("sj-1", "bj-1"));
        when(api.countLinksForBatch("bj-1", 50)).thenReturn(1);
        when(api.updateBatchJob(eq("bj-1"), any())).thenReturn(batchJob("bj-1", BatchJobStatus.OPEN, null, 1));

        // when
        coordinator.assign(request("item-1"));

        // then
        verify(api).countLinksForBatch("bj-1", 50);
    }

    @Test
    void 원격_오류는_호출자에게_전파() {
        // given
        when(api.findScoringJobByItemId("item-1")).thenReturn(Optional.empty());
        when(api.listOpenBatchJobs(SCOPE))
            .thenThrow(new ApplicationException(Operation.LIST_OPEN_BATCH_JOBS, List.of(GatewayError.of("denied"))));

        // when & then
        assertThatThrownBy(() -> coordinator.assign(request("item-1")))
            .isInstanceOf(ApplicationException.class)
            .hasMessageContaining("denied");
        verify(api, never()).createScoringJob(any());
    }

    private static AssignmentRequest request(String itemId) {
        return AssignmentRequest.builder(itemId).scope(SCOPE).build();
    }

    private static ScoringJob scoringJob(String id, String batchId) {
        return new ScoringJob(id, "item", "acc", "sc", null, batchId, ScoringJobStatus.PENDING, null, null, null);
    }

    private static BatchJob batchJob(String id, BatchJobStatus status, Integer totalRequests, int count) {
        return new BatchJob(id, "acc", "sc", null, "MultiStepScore", "openai", "gpt-4o",
            status, totalRequests, count, null);
    }
}

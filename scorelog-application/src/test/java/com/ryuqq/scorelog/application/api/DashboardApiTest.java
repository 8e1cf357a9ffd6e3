package com.ryuqq.scorelog.application.api;

import com.ryuqq.scorelog.core.contract.BatchJobLinkRequests;
import com.ryuqq.scorelog.core.contract.GatewayError;
import com.ryuqq.scorelog.core.contract.GatewayRequest;
import com.ryuqq.scorelog.core.contract.GatewayResponse;
import com.ryuqq.scorelog.core.contract.Operation;
import com.ryuqq.scorelog.core.contract.ScoreResultRequests;
import com.ryuqq.scorelog.core.contract.ScoringJobRequests;
import com.ryuqq.scorelog.core.exception.ApplicationException;
import com.ryuqq.scorelog.core.exception.TransportException;
import com.ryuqq.scorelog.core.model.BatchJobLink;
import com.ryuqq.scorelog.core.model.LogItem;
import com.ryuqq.scorelog.core.model.Page;
import com.ryuqq.scorelog.core.model.PersistedRecord;
import com.ryuqq.scorelog.core.model.ScoringJob;
import com.ryuqq.scorelog.core.spi.Gateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * DashboardApi 유닛 테스트.
 *
 * <p>두 실패 계층(전송 예외, 응답 errors) 처리와 링크 페이지 순회를 검증합니다.</p>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DashboardApiTest {

    @Mock
    private Gateway gateway;

    @Captor
    private ArgumentCaptor<GatewayRequest<?>> requestCaptor;

    private DashboardApi api;

    @BeforeEach
    void setUp() {
        api = new DashboardApi(gateway);
    }

    @Test
    void 성공_응답은_data를_반환() {
        // given
        LogItem item = LogItem.of(0.8, "item-1");
        PersistedRecord record = new PersistedRecord("sr-1", item);
        doReturn(GatewayResponse.ok(record)).when(gateway).execute(any(ScoreResultRequests.Create.class));

        // when
        PersistedRecord result = api.createScoreResult(item);

        // then
        assertThat(result).isEqualTo(record);
    }

    @Test
    void errors가_있으면_ApplicationException() {
        // given
        doReturn(GatewayResponse.failed(List.of(GatewayError.of("not authorized"))))
            .when(gateway).execute(any(ScoringJobRequests.Get.class));

        // when & then
        assertThatThrownBy(() -> api.getScoringJob("sj-1"))
            .isInstanceOf(ApplicationException.class)
            .hasMessageContaining("not authorized")
            .satisfies(e -> assertThat(((ApplicationException) e).getOperation())
                .isEqualTo(Operation.GET_SCORING_JOB));
    }

    @Test
    void 필수_결과에_data가_없으면_ApplicationException() {
        // given
        doReturn(GatewayResponse.ok(null)).when(gateway).execute(any(ScoringJobRequests.Get.class));

        // when & then
        assertThatThrownBy(() -> api.getScoringJob("sj-1"))
            .isInstanceOf(ApplicationException.class)
            .hasMessageContaining("no data");
    }

    @Test
    void 전송_예외는_그대로_전파() {
        // given
        when(gateway.execute(any(ScoringJobRequests.Get.class)))
            .thenThrow(new TransportException(Operation.GET_SCORING_JOB, "connection refused"));

        // when & then
        assertThatThrownBy(() -> api.getScoringJob("sj-1"))
            .isInstanceOf(TransportException.class)
            .hasMessage("connection refused");
    }

    @Test
    void 조회_결과_data가_없으면_빈_Optional() {
        // given
        doReturn(GatewayResponse.ok(null)).when(gateway).execute(any(ScoringJobRequests.FindByItemId.class));

        // when
        Optional<ScoringJob> result = api.findScoringJobByItemId("item-1");

        // then
        assertThat(result).isEmpty();
    }

    @Test
    void 링크_수는_모든_페이지를_합산() {
        // given
        Page<BatchJobLink> first = new Page<>(
            List.of(new BatchJobLink("bj-1", "sj-1"), new BatchJobLink("bj-1", "sj-2")), "2");
        Page<BatchJobLink> second = Page.last(List.of(new BatchJobLink("bj-1", "sj-3")));
        doReturn(GatewayResponse.ok(first), GatewayResponse.ok(second))
            .when(gateway).execute(any(BatchJobLinkRequests.ListByBatchJob.class));

        // when
        int count = api.countLinksForBatch("bj-1", 2);

        // then
        assertThat(count).isEqualTo(3);
        verify(gateway, times(2)).execute(requestCaptor.capture());
        assertThat(requestCaptor.getAllValues())
            .extracting(r -> ((BatchJobLinkRequests.ListByBatchJob) r).nextToken())
            .containsExactly(null, "2");
    }

    @Test
    void 페이지_토큰이_진행되지_않으면_예외() {
        // given
        Page<BatchJobLink> stuck = new Page<>(List.of(new BatchJobLink("bj-1", "sj-1")), "same");
        doReturn(GatewayResponse.ok(stuck)).when(gateway).execute(any(BatchJobLinkRequests.ListByBatchJob.class));

        // when & then
        assertThatThrownBy(() -> api.countLinksForBatch("bj-1", 1))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("did not advance");
    }

    @Test
    void gateway가_null이면_예외() {
        assertThatThrownBy(() -> new DashboardApi(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("gateway cannot be null");
    }
}

package com.ryuqq.scorelog.core.contract;

import com.ryuqq.scorelog.core.model.BatchJob;
import com.ryuqq.scorelog.core.model.BatchJobLink;
import com.ryuqq.scorelog.core.model.Page;
import com.ryuqq.scorelog.core.model.PersistedRecord;
import com.ryuqq.scorelog.core.model.ScoringJob;

import java.util.List;
import java.util.Optional;

/**
 * 요청 타입별 처리기.
 *
 * <p>Gateway 구현체는 이 인터페이스를 구현하고 {@link GatewayRequest#accept(GatewayRequestHandler)}로
 * 요청을 위임받습니다. 각 메서드의 반환 타입이 요청의 응답 data 타입과 일치하므로
 * 구현체는 형변환 없이 요청을 처리할 수 있습니다.</p>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public interface GatewayRequestHandler {

    PersistedRecord handle(ScoreResultRequests.Create request);

    List<PersistedRecord> handle(ScoreResultRequests.BatchCreate request);

    ScoringJob handle(ScoringJobRequests.Create request);

    ScoringJob handle(ScoringJobRequests.Get request);

    Optional<ScoringJob> handle(ScoringJobRequests.FindByItemId request);

    ScoringJob handle(ScoringJobRequests.Update request);

    BatchJob handle(BatchJobRequests.Create request);

    BatchJob handle(BatchJobRequests.Get request);

    BatchJob handle(BatchJobRequests.Update request);

    List<BatchJob> handle(BatchJobRequests.ListOpen request);

    BatchJobLink handle(BatchJobLinkRequests.Create request);

    Page<BatchJobLink> handle(BatchJobLinkRequests.ListByBatchJob request);

    Optional<BatchJobLink> handle(BatchJobLinkRequests.FindByScoringJob request);

    Optional<String> handle(IdentifierRequests.Lookup request);
}

package com.ryuqq.scorelog.application.client;

import com.ryuqq.scorelog.application.assignment.AssignmentRequest;
import com.ryuqq.scorelog.application.assignment.BatchJobAssigner;
import com.ryuqq.scorelog.application.logger.ScoreLogger;
import com.ryuqq.scorelog.application.logger.SubmitOptions;
import com.ryuqq.scorelog.application.resolution.IdentifierResolver;
import com.ryuqq.scorelog.core.model.BatchScope;
import com.ryuqq.scorelog.core.model.IdentifierKind;
import com.ryuqq.scorelog.core.model.LogItem;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * DashboardClient 유닛 테스트.
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DashboardClientTest {

    @Mock
    private ScoreLogger scoreLogger;

    @Mock
    private BatchJobAssigner assigner;

    @Mock
    private IdentifierResolver resolver;

    @Test
    void 컨텍스트의_key로_비어있는_범위_ID를_채움() {
        // given
        ClientContext context = ClientContext.forAccount("acme")
            .withScorecardKey("quality")
            .withScoreName("Tone");
        when(resolver.resolve(IdentifierKind.ACCOUNT, "acme")).thenReturn("acc-1");
        when(resolver.resolve(IdentifierKind.SCORECARD, "quality")).thenReturn("sc-1");
        when(resolver.resolve(IdentifierKind.SCORE, "Tone", "sc-1")).thenReturn("score-1");
        DashboardClient client = new DashboardClient(context, scoreLogger, assigner, resolver);

        // when
        client.logScore(LogItem.of(0.9, "item-1"));

        // then
        ArgumentCaptor<LogItem> captor = ArgumentCaptor.forClass(LogItem.class);
        verify(scoreLogger).submit(captor.capture(), eq(SubmitOptions.defaults()));
        assertThat(captor.getValue().accountId()).isEqualTo("acc-1");
        assertThat(captor.getValue().scorecardId()).isEqualTo("sc-1");
        assertThat(captor.getValue().scoreId()).isEqualTo("score-1");
    }

    @Test
    void LogItem에_지정된_ID는_덮어쓰지_않음() {
        // given
        ClientContext context = ClientContext.forAccount("acme").withScorecardKey("quality");
        DashboardClient client = new DashboardClient(context, scoreLogger, assigner, resolver);
        LogItem item = LogItem.builder(0.9, "item-1").accountId("acc-x").scorecardId("sc-x").build();

        // when
        client.logScore(item, SubmitOptions.immediately());

        // then
        verify(scoreLogger).submit(item, SubmitOptions.immediately());
        verify(resolver, never()).resolve(eq(IdentifierKind.ACCOUNT), any(), any());
        verify(resolver, never()).resolve(eq(IdentifierKind.ACCOUNT), any());
    }

    @Test
    void 호출별_scorecardKey는_컨텍스트_대신_해석하고_컨텍스트는_유지() {
        // given
        ClientContext context = new ClientContext()
            .withAccountId("acc-1")
            .withScorecardKey("quality")
            .withScoreName("Tone");
        when(resolver.resolve(IdentifierKind.SCORECARD, "Safety Review")).thenReturn("sc-2");
        when(resolver.resolve(IdentifierKind.SCORE, "Tone", "sc-2")).thenReturn("score-2");
        DashboardClient client = new DashboardClient(context, scoreLogger, assigner, resolver);

        // when
        client.logScore(LogItem.of(0.4, "item-4"), SubmitOptions.defaults(), "Safety Review");

        // then
        ArgumentCaptor<LogItem> captor = ArgumentCaptor.forClass(LogItem.class);
        verify(scoreLogger).submit(captor.capture(), eq(SubmitOptions.defaults()));
        assertThat(captor.getValue().scorecardId()).isEqualTo("sc-2");
        assertThat(captor.getValue().scoreId()).isEqualTo("score-2");
        verify(resolver, never()).resolve(IdentifierKind.SCORECARD, "quality");
        assertThat(client.getContext().scorecardKey()).isEqualTo("quality");
        assertThat(client.getContext().scorecardId()).isNull();
    }

    @Test
    void 호출별_scorecardKey는_지정된_scorecardId를_덮어쓰지_않음() {
        // given
        ClientContext context = new ClientContext().withAccountId("acc-1");
        DashboardClient client = new DashboardClient(context, scoreLogger, assigner, resolver);
        LogItem item = LogItem.of(0.4, "item-5").withScorecardId("sc-x");

        // when
        client.logScore(item, SubmitOptions.defaults(), "Safety Review");

        // then
        verify(resolver, never()).resolve(eq(IdentifierKind.SCORECARD), any());
        verify(scoreLogger).submit(item, SubmitOptions.defaults());
    }

    @Test
    void 컨텍스트의_정규_ID는_해석없이_사용() {
        // given
        ClientContext context = new ClientContext().withAccountId("acc-1").withScorecardId("sc-1");
        DashboardClient client = new DashboardClient(context, scoreLogger, assigner, resolver);

        // when
        client.logScore(LogItem.of(0.1, "item-2"));

        // then
        verifyNoInteractions(resolver);
        ArgumentCaptor<LogItem> captor = ArgumentCaptor.forClass(LogItem.class);
        verify(scoreLogger).submit(captor.capture(), any(SubmitOptions.class));
        assertThat(captor.getValue().accountId()).isEqualTo("acc-1");
        assertThat(captor.getValue().scoreId()).isNull();
    }

    @Test
    void 해석_실패시_ID를_비워두고_제출() {
        // given
        ClientContext context = ClientContext.forAccount("unknown");
        when(resolver.resolve(IdentifierKind.ACCOUNT, "unknown")).thenReturn(null);
        DashboardClient client = new DashboardClient(context, scoreLogger, assigner, resolver);

        // when
        client.logScore(LogItem.of(0.1, "item-3"));

        // then
        ArgumentCaptor<LogItem> captor = ArgumentCaptor.forClass(LogItem.class);
        verify(scoreLogger).submit(captor.capture(), any(SubmitOptions.class));
        assertThat(captor.getValue().accountId()).isNull();
    }

    @Test
    void assign은_배정기에_위임() {
        // given
        DashboardClient client = new DashboardClient(new ClientContext(), scoreLogger, assigner, resolver);
        AssignmentRequest request = AssignmentRequest.builder("item-1")
            .scope(BatchScope.of("acc", "sc", "openai", "gpt-4o"))
            .build();

        // when
        client.assign(request);

        // then
        verify(assigner).assign(request);
    }

    @Test
    void close는_flush에_위임() {
        // given
        DashboardClient client = new DashboardClient(new ClientContext(), scoreLogger, assigner, resolver);

        // when
        client.close();
        client.flush();

        // then
        verify(scoreLogger, times(2)).flush();
    }

    @Test
    void null_item은_예외() {
        DashboardClient client = new DashboardClient(new ClientContext(), scoreLogger, assigner, resolver);

        assertThatThrownBy(() -> client.logScore(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("item cannot be null");
    }
}

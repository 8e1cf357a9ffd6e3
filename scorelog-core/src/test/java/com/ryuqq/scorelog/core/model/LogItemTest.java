package com.ryuqq.scorelog.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * LogItem 유닛 테스트.
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
class LogItemTest {

    @Test
    void of_필수값만으로_생성() {
        // when
        LogItem item = LogItem.of(0.75, "item-1");

        // then
        assertThat(item.value()).isEqualTo(0.75);
        assertThat(item.itemId()).isEqualTo("item-1");
        assertThat(item.accountId()).isNull();
        assertThat(item.metadata()).isNull();
    }

    @Test
    void builder_선택값_설정() {
        // when
        LogItem item = LogItem.builder(1.0, "item-2")
            .accountId("acc-1")
            .scorecardId("sc-1")
            .scoreId("score-1")
            .confidence(0.9)
            .metadata(Map.of("source", "test"))
            .scoringJobId("job-1")
            .evaluationId("eval-1")
            .build();

        // then
        assertThat(item.accountId()).isEqualTo("acc-1");
        assertThat(item.scorecardId()).isEqualTo("sc-1");
        assertThat(item.scoreId()).isEqualTo("score-1");
        assertThat(item.confidence()).isEqualTo(0.9);
        assertThat(item.metadata()).containsEntry("source", "test");
        assertThat(item.scoringJobId()).isEqualTo("job-1");
        assertThat(item.evaluationId()).isEqualTo("eval-1");
    }

    @Test
    void itemId가_null이면_예외() {
        assertThatThrownBy(() -> LogItem.of(1.0, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("itemId cannot be null");
    }

    @Test
    void itemId가_공백이면_예외() {
        assertThatThrownBy(() -> LogItem.of(1.0, "  "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void metadata는_방어적_복사되고_불변() {
        // given
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("k", "v");

        // when
        LogItem item = LogItem.builder(1.0, "item-3").metadata(metadata).build();
        metadata.put("k2", "v2");

        // then
        assertThat(item.metadata()).containsOnlyKeys("k");
        assertThatThrownBy(() -> item.metadata().put("x", "y"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void 빈_metadata는_null로_정규화() {
        LogItem item = LogItem.builder(1.0, "item-4").metadata(Map.of()).build();

        assertThat(item.metadata()).isNull();
    }

    @Test
    void withX는_해당_필드만_변경() {
        // given
        LogItem item = LogItem.builder(0.5, "item-5").confidence(0.3).build();

        // when
        LogItem changed = item.withAccountId("acc").withScorecardId("sc").withScoreId("score");

        // then
        assertThat(changed.accountId()).isEqualTo("acc");
        assertThat(changed.scorecardId()).isEqualTo("sc");
        assertThat(changed.scoreId()).isEqualTo("score");
        assertThat(changed.confidence()).isEqualTo(0.3);
        assertThat(item.accountId()).isNull();
    }
}

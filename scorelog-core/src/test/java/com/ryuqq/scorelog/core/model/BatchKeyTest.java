package com.ryuqq.scorelog.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BatchKey 유닛 테스트.
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
class BatchKeyTest {

    @Test
    void 기본값은_10개_1초() {
        BatchKey key = BatchKey.defaults();

        assertThat(key.batchSize()).isEqualTo(10);
        assertThat(key.batchTimeout()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void 같은_설정이면_같은_키() {
        assertThat(new BatchKey(5, Duration.ofMillis(500)))
            .isEqualTo(new BatchKey(5, Duration.ofMillis(500)))
            .hasSameHashCodeAs(new BatchKey(5, Duration.ofMillis(500)));
    }

    @Test
    void batchSize가_0이하면_예외() {
        assertThatThrownBy(() -> new BatchKey(0, Duration.ofSeconds(1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("batchSize must be positive (current: 0)");
    }

    @Test
    void batchTimeout이_null이거나_0이면_예외() {
        assertThatThrownBy(() -> new BatchKey(10, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("batchTimeout cannot be null");
        assertThatThrownBy(() -> new BatchKey(10, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void 경과시간이_timeout을_초과해야_만료() {
        BatchKey key = new BatchKey(10, Duration.ofMillis(100));

        assertThat(key.isTimedOut(Duration.ofMillis(100).toNanos())).isFalse();
        assertThat(key.isTimedOut(Duration.ofMillis(101).toNanos())).isTrue();
    }
}

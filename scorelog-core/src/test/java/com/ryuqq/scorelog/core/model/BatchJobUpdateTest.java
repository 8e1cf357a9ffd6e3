package com.ryuqq.scorelog.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchJobUpdateTest {

    @Test
    void close는_CLOSED와_카운트를_함께_기록() {
        BatchJobUpdate update = BatchJobUpdate.close(20);

        assertThat(update.status()).isEqualTo(BatchJobStatus.CLOSED);
        assertThat(update.scoringJobCountCache()).isEqualTo(20);
    }

    @Test
    void countCache는_상태를_변경하지_않음() {
        BatchJobUpdate update = BatchJobUpdate.countCache(3);

        assertThat(update.status()).isNull();
        assertThat(update.scoringJobCountCache()).isEqualTo(3);
    }

    @Test
    void 변경할_필드가_없으면_예외() {
        assertThatThrownBy(() -> new BatchJobUpdate(null, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void 음수_카운트는_예외() {
        assertThatThrownBy(() -> BatchJobUpdate.countCache(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("current: -1");
    }
}

package com.ryuqq.scorelog.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runner 설정 record 유닛 테스트.
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
class RunnerConfigTest {

    @Test
    void LogDispatcherConfig_기본값() {
        LogDispatcherConfig config = new LogDispatcherConfig();

        assertThat(config.pollIntervalMs()).isEqualTo(1000);
        assertThat(config.shutdownTimeoutMs()).isEqualTo(5000);
        assertThat(config.errorBackoffMs()).isEqualTo(1000);
        assertThat(config.registerShutdownHook()).isTrue();
    }

    @Test
    void LogDispatcherConfig_withX는_해당_값만_변경() {
        LogDispatcherConfig config = new LogDispatcherConfig().withPollIntervalMs(50);

        assertThat(config.pollIntervalMs()).isEqualTo(50);
        assertThat(config.shutdownTimeoutMs()).isEqualTo(5000);
    }

    @Test
    void LogDispatcherConfig_pollIntervalMs가_0이면_예외() {
        assertThatThrownBy(() -> new LogDispatcherConfig(0, 5000, 1000, false))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("pollIntervalMs must be positive (current: 0)");
    }

    @Test
    void CoordinatorConfig_기본값() {
        CoordinatorConfig config = new CoordinatorConfig();

        assertThat(config.linkPageSize()).isEqualTo(1000);
        assertThat(config.batchJobType()).isEqualTo("MultiStepScore");
    }

    @Test
    void CoordinatorConfig_빈_유형은_예외() {
        assertThatThrownBy(() -> new CoordinatorConfig().withBatchJobType(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void IdentifierCacheConfig_기본값은_1시간_10000개() {
        IdentifierCacheConfig config = new IdentifierCacheConfig();

        assertThat(config.ttlMs()).isEqualTo(3_600_000L);
        assertThat(config.maximumSize()).isEqualTo(10_000L);
    }

    @Test
    void IdentifierCacheConfig_음수_TTL은_예외() {
        assertThatThrownBy(() -> new IdentifierCacheConfig(-1, 10))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("ttlMs must be positive");
    }
}

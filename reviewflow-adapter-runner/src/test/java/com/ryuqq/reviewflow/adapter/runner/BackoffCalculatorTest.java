package com.ryuqq.reviewflow.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffCalculatorTest {

    @Test
    void jitter가_없으면_지수적으로_증가하고_최대값에서_멈춤() {
        // given
        BackoffCalculator backoff = new BackoffCalculator(100, 1000, 0.0);

        // when & then
        assertThat(backoff.calculate(1)).isEqualTo(100);
        assertThat(backoff.calculate(2)).isEqualTo(200);
        assertThat(backoff.calculate(4)).isEqualTo(800);
        assertThat(backoff.calculate(5)).isEqualTo(1000);
        assertThat(backoff.calculate(Integer.MAX_VALUE)).isEqualTo(1000);
    }

    @Test
    void jitter는_지수값과_최대값_사이() {
        // given
        BackoffCalculator backoff = new BackoffCalculator(100, 10_000, 0.5);

        // when & then
        for (int i = 0; i < 50; i++) {
            assertThat(backoff.calculate(3)).isBetween(400L, 600L);
        }
    }

    @Test
    void 설정에서_생성() {
        // given
        ReviewRunnerConfig config = new ReviewRunnerConfig().withBackoff(50, 500, 0.2);

        // when
        BackoffCalculator backoff = BackoffCalculator.from(config);

        // then
        assertThat(backoff.getBaseDelayMs()).isEqualTo(50);
        assertThat(backoff.getMaxDelayMs()).isEqualTo(500);
        assertThat(backoff.getJitterFactor()).isEqualTo(0.2);
    }

    @Test
    void 잘못된_값은_IllegalArgumentException() {
        assertThatThrownBy(() -> new BackoffCalculator(0, 100, 0.1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(100, 50, 0.1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(100, 200, 1.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator().calculate(0)).isInstanceOf(IllegalArgumentException.class);
    }
}

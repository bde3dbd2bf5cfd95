package com.ryuqq.provisioning.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffCalculator 테스트.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
class BackoffCalculatorTest {

    @Test
    void 지연은_시도마다_두_배로_증가() {
        BackoffCalculator calculator = BackoffCalculator.withoutJitter(2000, 600000);

        assertThat(calculator.calculate(1)).isEqualTo(2000);
        assertThat(calculator.calculate(2)).isEqualTo(4000);
        assertThat(calculator.calculate(3)).isEqualTo(8000);
    }

    @Test
    void 지연은_maxDelay를_넘지_않음() {
        BackoffCalculator calculator = new BackoffCalculator(2000, 10000, 0.5, () -> 0.99);

        assertThat(calculator.calculate(3)).isEqualTo(10000);
        assertThat(calculator.calculate(100)).isEqualTo(10000);
    }

    @Test
    void jitter는_지수_지연의_jitterFactor_비율_이내() {
        BackoffCalculator calculator = new BackoffCalculator(1000, 600000, 0.2, () -> 0.5);

        // 2000 + 2000 * 0.2 * 0.5
        assertThat(calculator.calculate(2)).isEqualTo(2200);
    }

    @Test
    void 기본값은_2초_10분_20퍼센트() {
        BackoffCalculator calculator = new BackoffCalculator();

        assertThat(calculator.getBaseDelayMs()).isEqualTo(2000);
        assertThat(calculator.getMaxDelayMs()).isEqualTo(600000);
        assertThat(calculator.calculate(1)).isBetween(2000L, 2400L);
    }

    @Test
    void 잘못된_설정과_시도_횟수는_거부() {
        assertThatThrownBy(() -> new BackoffCalculator(0, 1000, 0.1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("baseDelayMs must be positive");
        assertThatThrownBy(() -> new BackoffCalculator(1000, 500, 0.1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(1000, 5000, 1.5))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BackoffCalculator.withoutJitter(1, 1).calculate(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("attempt must be positive");
    }
}

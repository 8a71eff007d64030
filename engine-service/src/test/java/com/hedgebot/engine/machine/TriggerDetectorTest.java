package com.hedgebot.engine.machine;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TriggerDetectorTest {

    @Test
    void triggerIsAnUpwardMoveOfAtLeastThreshold() {
        assertThat(TriggerDetector.movePct(2.0, 2.6)).isCloseTo(30.0, within(1e-9));
        assertThat(TriggerDetector.isTrigger(2.0, 2.6, 30.0)).isTrue();
        assertThat(TriggerDetector.isTrigger(2.0, 2.58, 30.0)).isFalse();
        assertThat(TriggerDetector.isTrigger(2.0, 1.4, 30.0)).isFalse();
    }

    @Test
    void revertMeansMoveBelowHalfTheThreshold() {
        assertThat(TriggerDetector.isReverted(2.0, 2.28, 30.0)).isTrue();
        assertThat(TriggerDetector.isReverted(2.0, 2.32, 30.0)).isFalse();
        assertThat(TriggerDetector.isReverted(2.0, 1.8, 30.0)).isTrue();
    }

    @Test
    void rejectsNonPositiveBaseline() {
        assertThatThrownBy(() -> TriggerDetector.movePct(0.0, 2.0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void windowKeepsMostRecentReadings() {
        List<Double> window = TriggerDetector.window(List.of(2.0, 2.02, 2.04, 2.06), 2.08, 4);

        assertThat(window).containsExactly(2.02, 2.04, 2.06, 2.08);
    }

    @Test
    void stableOnlyWhenWindowIsFullAndTight() {
        assertThat(TriggerDetector.isStable(List.of(2.0, 2.02, 2.04), 4, 5.0)).isFalse();
        assertThat(TriggerDetector.isStable(List.of(2.0, 2.02, 2.04, 2.02), 4, 5.0)).isTrue();
        assertThat(TriggerDetector.isStable(List.of(2.0, 2.02, 2.5, 2.02), 4, 5.0)).isFalse();
    }

    @Test
    void medianOfEvenWindowTakesUpperMiddle() {
        assertThat(TriggerDetector.median(List.of(2.4, 2.0, 2.2, 2.6))).isEqualTo(2.4);
    }
}

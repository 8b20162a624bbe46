package com.phillippitts.driftwatch.service.window;

import com.phillippitts.driftwatch.domain.Observation;
import com.phillippitts.driftwatch.domain.Window;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class WindowAggregatorTest {

    @Test
    void emitsOneWindowPerCapacityObservations() {
        WindowAggregator aggregator = new WindowAggregator(10);
        List<Window> windows = new ArrayList<>();

        for (int i = 0; i < 57; i++) {
            aggregator.observe(new Observation("t" + i, i)).ifPresent(windows::add);
        }

        assertThat(windows).hasSize(5);
        assertThat(windows).extracting(Window::id).containsExactly(0L, 1L, 2L, 3L, 4L);
        assertThat(windows).allSatisfy(w -> assertThat(w.size()).isEqualTo(10));
        assertThat(aggregator.pending()).isEqualTo(7);
        assertThat(aggregator.progress()).isEqualTo("7/10");
        assertThat(aggregator.currentWindowId()).isEqualTo(5);
    }

    @Test
    void computesMeanAndPopulationStddev() {
        WindowAggregator aggregator = new WindowAggregator(4);
        Optional<Window> window = Optional.empty();

        for (double v : new double[] {2.0, 4.0, 4.0, 6.0}) {
            window = aggregator.observe(new Observation("t", v));
        }

        assertThat(window).isPresent();
        assertThat(window.get().mean()).isCloseTo(4.0, within(1e-12));
        assertThat(window.get().stddev()).isCloseTo(Math.sqrt(2.0), within(1e-12));
    }

    @Test
    void constantWindowHasZeroStddev() {
        WindowAggregator aggregator = new WindowAggregator(3);
        Optional<Window> window = Optional.empty();

        for (int i = 0; i < 3; i++) {
            window = aggregator.observe(new Observation("t", 0.1));
        }

        assertThat(window.get().stddev()).isZero();
    }

    @Test
    void statisticsResetBetweenWindows() {
        WindowAggregator aggregator = new WindowAggregator(2);
        aggregator.observe(new Observation("a", 100.0));
        aggregator.observe(new Observation("b", 100.0));

        aggregator.observe(new Observation("c", 1.0));
        Window second = aggregator.observe(new Observation("d", 3.0)).orElseThrow();

        assertThat(second.id()).isEqualTo(1);
        assertThat(second.mean()).isEqualTo(2.0);
        assertThat(second.stddev()).isEqualTo(1.0);
        assertThat(second.lastTimestamp()).isEqualTo("d");
    }

    @Test
    void capacityOfOneCompletesEveryObservation() {
        WindowAggregator aggregator = new WindowAggregator(1);

        assertThat(aggregator.observe(new Observation("t", 5.0))).hasValueSatisfying(w -> {
            assertThat(w.mean()).isEqualTo(5.0);
            assertThat(w.stddev()).isZero();
        });
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new WindowAggregator(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("capacity");
    }
}

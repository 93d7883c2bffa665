package com.fincore.foresight.feature;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FeatureScalerTest {

    @Test
    void standardisesWithPopulationDeviation() {
        FeatureScaler scaler = FeatureScaler.fit(new double[][]{{1, 5}, {3, 5}});

        double[] scaled = scaler.transform(new double[]{3, 5});

        // mean 2, population std 1
        assertThat(scaled[0]).isCloseTo(1.0, within(1e-12));
        assertThat(scaler.width()).isEqualTo(2);
    }

    @Test
    void constantColumnMapsToZero() {
        FeatureScaler scaler = FeatureScaler.fit(new double[][]{{1, 5}, {3, 5}});

        assertThat(scaler.transform(new double[]{0, 5})[1]).isZero();
        assertThat(scaler.transform(new double[]{0, 7})[1]).isEqualTo(2.0);
    }

    @Test
    void rejectsWrongWidth() {
        FeatureScaler scaler = FeatureScaler.fit(new double[][]{{1, 5}, {3, 5}});

        assertThatThrownBy(() -> scaler.transform(new double[]{1}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FeatureScaler.fit(new double[0][]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

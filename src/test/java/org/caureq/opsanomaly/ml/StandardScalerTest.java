package org.caureq.opsanomaly.ml;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StandardScalerTest {

    @Test
    void usesPopulationStandardDeviation() {
        double[][] m = {{2.0, 1.0}, {4.0, 1.0}, {4.0, 1.0}, {4.0, 1.0}, {5.0, 1.0}, {5.0, 1.0}, {7.0, 1.0}, {9.0, 1.0}};
        var scaler = StandardScaler.fit(m, new double[]{5.0, 1.0});

        assertThat(scaler.mean()[0]).isEqualTo(5.0);
        assertThat(scaler.std()[0]).isEqualTo(2.0);
        assertThat(scaler.transform(new double[]{9.0, 1.0})[0]).isCloseTo(2.0, within(1e-12));
    }

    @Test
    void constantFeatureTransformsToZeroForAnyInput() {
        double[][] m = {{1.0, 50.0}, {2.0, 50.0}, {3.0, 50.0}};
        var scaler = StandardScaler.fit(m, new double[]{2.0, 50.0});

        assertThat(scaler.std()[1]).isZero();
        assertThat(scaler.transform(new double[]{2.0, 50.0})[1]).isZero();
        assertThat(scaler.transform(new double[]{2.0, 99.0})[1]).isZero();
        assertThat(scaler.transform(new double[]{2.0, -3.0})[1]).isZero();
    }

    @Test
    void rejectsRowOfWrongWidth() {
        var scaler = StandardScaler.fit(new double[][]{{1.0, 2.0}}, new double[]{1.0, 2.0});
        assertThatThrownBy(() -> scaler.transform(new double[]{1.0})).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constantColumnWithInexactValueIsStillZeroVariance() {
        double[][] small = {{1.0, 0.1}, {2.0, 0.1}, {3.0, 0.1}};
        var a = StandardScaler.fit(small, new double[]{2.0, 0.1});

        assertThat(a.std()[1]).isZero();
        assertThat(a.transform(new double[]{2.0, 0.1})[1]).isZero();
        assertThat(a.transform(new double[]{2.0, 57.4})[1]).isZero();

        double[][] many = new double[1000][];
        for (int i = 0; i < many.length; i++) many[i] = new double[]{i, 57.3};
        var b = StandardScaler.fit(many, new double[]{499.5, 57.3});

        assertThat(b.std()[1]).isZero();
        assertThat(b.transform(new double[]{0.0, 57.3})[1]).isZero();
        assertThat(b.transform(new double[]{0.0, 57.4})[1]).isZero();
        assertThat(b.std()[0]).isGreaterThan(0.0);
    }
}

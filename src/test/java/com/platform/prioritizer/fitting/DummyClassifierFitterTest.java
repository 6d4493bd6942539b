package com.platform.prioritizer.fitting;

import com.platform.prioritizer.domain.FeatureMatrix;
import com.platform.prioritizer.domain.MatrixRow;
import com.platform.prioritizer.domain.ModelConfiguration;
import com.platform.prioritizer.error.FitException;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DummyClassifierFitterTest {

    private final DummyClassifierFitter fitter = new DummyClassifierFitter();

    private static FeatureMatrix matrix(double... labels) {
        List<MatrixRow> rows = new ArrayList<>();
        LocalDateTime asOf = LocalDateTime.of(2015, 1, 1, 0, 0);
        for (int i = 0; i < labels.length; i++) {
            rows.add(new MatrixRow(String.valueOf(i), asOf, new double[]{i}, labels[i]));
        }
        return new FeatureMatrix("m", List.of("f"), rows);
    }

    private static ModelConfiguration dummy(Map<String, Object> params) {
        return new ModelConfiguration("dummy", params);
    }

    @Test
    void testPriorScoresPositiveRate() {
        FittedModel model = fitter.fit(dummy(Map.of("strategy", "prior")), matrix(1, 0, 0, 0), 1L);
        double[] scores = model.score(matrix(0, 1));
        assertArrayEquals(new double[]{0.25, 0.25}, scores);
    }

    @Test
    void testMostFrequent() {
        assertArrayEquals(new double[]{0.0}, fitter.fit(dummy(Map.of("strategy", "most_frequent")),
                matrix(1, 0, 0), 1L).score(matrix(1)));
        assertArrayEquals(new double[]{1.0}, fitter.fit(dummy(Map.of("strategy", "most_frequent")),
                matrix(1, 1, 0), 1L).score(matrix(1)));
        // tie goes to the negative class
        assertArrayEquals(new double[]{0.0}, fitter.fit(dummy(Map.of("strategy", "most_frequent")),
                matrix(1, 0), 1L).score(matrix(1)));
    }

    @Test
    void testConstantNeedsParameter() {
        assertArrayEquals(new double[]{1.0, 1.0}, fitter.fit(
                dummy(Map.of("strategy", "constant", "constant", 1)), matrix(1, 0), 1L).score(matrix(0, 0)));
        assertThrows(FitException.class, () -> fitter.fit(dummy(Map.of("strategy", "constant")), matrix(1, 0), 1L));
    }

    @Test
    void testRandomStrategiesAreSeeded() {
        FeatureMatrix train = matrix(1, 0, 1, 0);
        FeatureMatrix test = matrix(new double[50]);
        double[] first = fitter.fit(dummy(Map.of("strategy", "uniform")), train, 7L).score(test);
        double[] second = fitter.fit(dummy(Map.of("strategy", "uniform")), train, 7L).score(test);
        assertArrayEquals(first, second);
        assertTrue(Arrays.stream(first).allMatch(s -> s == 0.0 || s == 1.0));
        assertTrue(Arrays.stream(first).anyMatch(s -> s == 1.0));
    }

    @Test
    void testRejectsSingleClassAndEmptyMatrices() {
        assertThrows(FitException.class, () -> fitter.fit(dummy(Map.of()), matrix(1, 1, 1), 1L));
        assertThrows(FitException.class, () -> fitter.fit(dummy(Map.of()), matrix(), 1L));
    }

    @Test
    void testUnknownStrategy() {
        assertThrows(FitException.class, () -> fitter.fit(dummy(Map.of("strategy", "oracle")), matrix(1, 0), 1L));
    }
}

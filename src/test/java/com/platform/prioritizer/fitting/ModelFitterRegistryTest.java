package com.platform.prioritizer.fitting;

import com.platform.prioritizer.error.GridException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelFitterRegistryTest {

    private final DummyClassifierFitter dummy = new DummyClassifierFitter();
    private final XGBoostModelFitter xgboost = new XGBoostModelFitter();
    private final ModelFitterRegistry registry = new ModelFitterRegistry(List.of(dummy, xgboost));

    @Test
    void testResolvesEveryIdentifier() {
        assertSame(dummy, registry.resolve("dummy"));
        assertSame(dummy, registry.resolve("sklearn.dummy.DummyClassifier"));
        assertSame(xgboost, registry.resolve("xgboost"));
        assertSame(xgboost, registry.resolve("ml.dmlc.xgboost4j.java.XGBoost"));
        assertTrue(registry.supports("xgboost"));
    }

    @Test
    void testUnknownClassIsGridError() {
        GridException e = assertThrows(GridException.class,
                () -> registry.resolve("sklearn.ensemble.ExtraTreesClassifier"));
        assertFalse(e.isRunFatal());
        assertFalse(registry.supports("sklearn.ensemble.ExtraTreesClassifier"));
    }

    @Test
    void testDuplicateIdentifiersAreRejected() {
        assertThrows(IllegalStateException.class,
                () -> new ModelFitterRegistry(List.of(dummy, new DummyClassifierFitter())));
    }
}

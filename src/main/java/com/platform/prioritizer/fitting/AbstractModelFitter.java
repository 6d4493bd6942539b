package com.platform.prioritizer.fitting;

import com.platform.prioritizer.domain.FeatureMatrix;
import com.platform.prioritizer.domain.ModelConfiguration;
import com.platform.prioritizer.error.FitException;

import java.util.Map;

/**
 * Rejects matrices no binary classifier can learn from before delegating to {@link #doFit}.
 */
public abstract class AbstractModelFitter implements ModelFitter {

    @Override
    public final FittedModel fit(ModelConfiguration configuration, FeatureMatrix train, long seed) {
        if (train.isEmpty()) {
            throw new FitException("Training matrix " + train.matrixId() + " has no rows");
        }
        if (train.featureCount() == 0) {
            throw new FitException("Training matrix " + train.matrixId() + " has no feature columns");
        }
        double[] labels = train.labels();
        boolean anyPositive = false;
        boolean anyNegative = false;
        for (double label : labels) {
            if (label != 0) anyPositive = true;
            else anyNegative = true;
        }
        if (!anyPositive || !anyNegative) {
            throw new FitException("Training matrix " + train.matrixId() + " has a single label class ("
                    + (anyPositive ? "all positive" : "all negative") + ")");
        }
        return doFit(configuration, train, seed);
    }

    protected abstract FittedModel doFit(ModelConfiguration configuration, FeatureMatrix train, long seed);

    protected static double doubleParam(Map<String, Object> params, String name, double defaultValue) {
        Object value = params.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            throw new FitException("Parameter '" + name + "' must be numeric, got '" + value + "'", e);
        }
    }

    protected static int intParam(Map<String, Object> params, String name, int defaultValue) {
        double value = doubleParam(params, name, defaultValue);
        if (value != Math.rint(value)) {
            throw new FitException("Parameter '" + name + "' must be a whole number, got " + value);
        }
        return (int) value;
    }
}

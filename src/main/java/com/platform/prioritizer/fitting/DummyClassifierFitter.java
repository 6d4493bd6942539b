package com.platform.prioritizer.fitting;

import com.platform.prioritizer.domain.FeatureMatrix;
import com.platform.prioritizer.domain.ModelConfiguration;
import com.platform.prioritizer.error.FitException;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Random;
import java.util.Set;

/**
 * Baselines that ignore the features.
 * <ul>
 *   <li>{@code prior} (default): every row scores the training positive rate</li>
 *   <li>{@code most_frequent}: 1 when positives are the majority, else 0 (ties go to 0)</li>
 *   <li>{@code constant}: the {@code constant} parameter</li>
 *   <li>{@code stratified}: seeded draws of 0/1 with the training positive rate</li>
 *   <li>{@code uniform}: seeded draws of 0/1 with equal odds</li>
 * </ul>
 */
@Component
public class DummyClassifierFitter extends AbstractModelFitter {

    @Override
    public Set<String> classIdentifiers() {
        return Set.of("dummy", "sklearn.dummy.DummyClassifier");
    }

    @Override
    protected FittedModel doFit(ModelConfiguration configuration, FeatureMatrix train, long seed) {
        String strategy = String.valueOf(configuration.parameters().getOrDefault("strategy", "prior"));
        double[] labels = train.labels();
        double positives = Arrays.stream(labels).filter(l -> l != 0).count();
        double prior = positives / labels.length;

        return switch (strategy) {
            case "prior" -> constantModel(prior);
            case "most_frequent" -> constantModel(prior > 0.5 ? 1.0 : 0.0);
            case "constant" -> {
                if (!configuration.parameters().containsKey("constant")) {
                    throw new FitException("Dummy strategy 'constant' requires a 'constant' parameter");
                }
                yield constantModel(doubleParam(configuration.parameters(), "constant", 0.0));
            }
            case "stratified" -> randomModel(prior, seed);
            case "uniform" -> randomModel(0.5, seed);
            default -> throw new FitException("Unknown dummy strategy '" + strategy + "'");
        };
    }

    private static FittedModel constantModel(double value) {
        return matrix -> {
            double[] scores = new double[matrix.size()];
            Arrays.fill(scores, value);
            return scores;
        };
    }

    // A fresh generator per call keeps scoring repeatable.
    private static FittedModel randomModel(double positiveRate, long seed) {
        return matrix -> {
            Random random = new Random(seed);
            double[] scores = new double[matrix.size()];
            for (int i = 0; i < scores.length; i++) {
                scores[i] = random.nextDouble() < positiveRate ? 1.0 : 0.0;
            }
            return scores;
        };
    }
}

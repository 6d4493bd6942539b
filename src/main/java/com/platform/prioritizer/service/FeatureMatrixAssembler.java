package com.platform.prioritizer.service;

import com.platform.prioritizer.domain.AggregationSpec;
import com.platform.prioritizer.domain.Digests;
import com.platform.prioritizer.domain.FeatureBlock;
import com.platform.prioritizer.domain.FeatureMatrix;
import com.platform.prioritizer.domain.MatrixRow;
import com.platform.prioritizer.domain.Timespan;
import com.platform.prioritizer.experiment.CohortConfig;
import com.platform.prioritizer.experiment.LabelConfig;
import com.platform.prioritizer.service.CohortLabelResolver.LabelSet;
import com.platform.prioritizer.service.FeatureAggregationService.RawAggregates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Joins cohort, labels and per-spec feature blocks into a {@link FeatureMatrix}.
 * <p>
 * Columns follow spec order, so every matrix built from the same specs and
 * feature-group selection has the same schema. Rows are ordered by as-of date,
 * then entity id.
 */
@Service
public class FeatureMatrixAssembler {

    private static final Logger log = LoggerFactory.getLogger(FeatureMatrixAssembler.class);

    private final CohortLabelResolver labelResolver;
    private final FeatureAggregationService aggregationService;

    public FeatureMatrixAssembler(CohortLabelResolver labelResolver, FeatureAggregationService aggregationService) {
        this.labelResolver = labelResolver;
        this.aggregationService = aggregationService;
    }

    /**
     * @param specs            every aggregation spec, choices resolved, in declared order
     * @param selectedPrefixes the feature group selection; specs outside it are left out
     * @param training         training matrices may impute missing labels, test matrices never do
     */
    public record MatrixRequest(
            List<AggregationSpec> specs,
            Set<String> selectedPrefixes,
            CohortConfig cohortConfig,
            LabelConfig labelConfig,
            List<LocalDateTime> asOfDates,
            Timespan labelTimespan,
            boolean training
    ) {
        public MatrixRequest {
            specs = List.copyOf(specs);
            selectedPrefixes = Set.copyOf(selectedPrefixes);
            asOfDates = List.copyOf(new TreeSet<>(asOfDates));
        }

        List<AggregationSpec> selectedSpecs() {
            return specs.stream().filter(s -> selectedPrefixes.contains(s.prefix())).toList();
        }
    }

    public FeatureMatrix assemble(MatrixRequest request, FeatureCache cache) {
        List<AggregationSpec> selected = request.selectedSpecs();
        List<String> featureNames = featureNames(selected);
        String matrixId = matrixId(request, featureNames);

        List<MatrixRow> rows = new ArrayList<>();
        int dropped = 0;
        int imputedLabels = 0;
        for (LocalDateTime asOfDate : request.asOfDates()) {
            LabelSet labelSet = cache.labels(asOfDate, request.labelTimespan(),
                    () -> labelResolver.resolve(request.cohortConfig(), request.labelConfig(),
                            asOfDate, request.labelTimespan()));

            List<FeatureBlock> blocks = new ArrayList<>();
            for (AggregationSpec spec : selected) {
                RawAggregates raw = cache.aggregates(spec.prefix(), asOfDate,
                        () -> aggregationService.aggregate(spec, asOfDate));
                blocks.add(aggregationService.impute(raw, labelSet.cohort()));
            }

            for (String entity : labelSet.cohort()) {
                double label;
                if (labelSet.hasLabel(entity)) {
                    label = labelSet.labels().get(entity);
                } else if (request.training() && request.labelConfig().imputesMissingTrainLabels()) {
                    label = request.labelConfig().missingTrainLabelValue();
                    imputedLabels++;
                } else {
                    dropped++;
                    continue;
                }
                rows.add(new MatrixRow(entity, asOfDate, concat(blocks, entity, featureNames.size()), label));
            }
        }

        log.debug("Matrix {} ({}): {} rows over {} as-of dates, {} columns, {} unlabelled rows dropped, {} labels imputed",
                matrixId, request.training() ? "train" : "test", rows.size(), request.asOfDates().size(),
                featureNames.size(), dropped, imputedLabels);
        return new FeatureMatrix(matrixId, featureNames, rows);
    }

    public List<String> featureNames(List<AggregationSpec> specs) {
        List<String> names = new ArrayList<>();
        for (AggregationSpec spec : specs) {
            names.addAll(aggregationService.columnNames(spec));
        }
        return names;
    }

    private static double[] concat(List<FeatureBlock> blocks, String entity, int width) {
        double[] features = new double[width];
        int offset = 0;
        for (FeatureBlock block : blocks) {
            double[] part = block.row(entity);
            System.arraycopy(part, 0, features, offset, part.length);
            offset += part.length;
        }
        return features;
    }

    static String matrixId(MatrixRequest request, List<String> featureNames) {
        String metadata = String.join("|",
                request.training() ? "train" : "test",
                request.cohortConfig().name(),
                request.labelConfig().name(),
                request.labelTimespan().text(),
                String.valueOf(request.labelConfig().missingTrainLabelValue()),
                request.asOfDates().toString(),
                String.join(",", featureNames));
        return Digests.md5Hex(metadata);
    }
}

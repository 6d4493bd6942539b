package com.platform.prioritizer.service;

import com.platform.prioritizer.domain.EntityIds;
import com.platform.prioritizer.domain.Timespan;
import com.platform.prioritizer.error.ResolutionException;
import com.platform.prioritizer.experiment.CohortConfig;
import com.platform.prioritizer.experiment.LabelConfig;
import com.platform.prioritizer.store.QueryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Resolves the cohort and its outcomes for one as-of date and label timespan.
 * <p>
 * Queries receive {@code :as_of_date} and, for labels, {@code :label_timespan} as
 * interval text ({@code 1 month}). Result rows must carry {@code entity_id}; label rows
 * also carry {@code outcome}.
 */
@Service
public class CohortLabelResolver {

    private static final Logger log = LoggerFactory.getLogger(CohortLabelResolver.class);

    public static final String ENTITY_ID = "entity_id";
    public static final String OUTCOME = "outcome";

    private final QueryExecutor queryExecutor;

    public CohortLabelResolver(QueryExecutor queryExecutor) {
        this.queryExecutor = queryExecutor;
    }

    /**
     * Cohort entities with the labels that were found for them.
     * Entities in {@code cohort} but not in {@code labels} have a missing label.
     */
    public record LabelSet(LocalDateTime asOfDate, Timespan labelTimespan,
                           Set<String> cohort, Map<String, Double> labels) {

        public LabelSet {
            TreeSet<String> sorted = new TreeSet<>(EntityIds.ORDER);
            sorted.addAll(cohort);
            cohort = Collections.unmodifiableSet(sorted);
            labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
        }

        public boolean hasLabel(String entityId) {
            return labels.containsKey(entityId);
        }

        public int missingCount() {
            return cohort.size() - labels.size();
        }
    }

    public LabelSet resolve(CohortConfig cohortConfig, LabelConfig labelConfig,
                            LocalDateTime asOfDate, Timespan labelTimespan) {
        Map<String, Double> labelled = labels(labelConfig, asOfDate, labelTimespan);

        Set<String> cohort;
        Map<String, Double> labels;
        if (cohortConfig.hasQuery()) {
            cohort = cohort(cohortConfig, asOfDate);
            labels = new TreeMap<>(EntityIds.ORDER);
            for (String entity : cohort) {
                Double outcome = labelled.get(entity);
                if (outcome != null) {
                    labels.put(entity, outcome);
                }
            }
        } else {
            cohort = labelled.keySet();
            labels = labelled;
        }

        LabelSet set = new LabelSet(asOfDate, labelTimespan, cohort, labels);
        log.debug("Cohort '{}' at {} ({}): {} entities, {} labelled, {} missing",
                cohortConfig.name(), asOfDate, labelTimespan, set.cohort().size(),
                set.labels().size(), set.missingCount());
        return set;
    }

    Set<String> cohort(CohortConfig cohortConfig, LocalDateTime asOfDate) {
        List<Map<String, Object>> rows = queryExecutor.query(cohortConfig.query(), Map.of("as_of_date", asOfDate));
        Set<String> cohort = new TreeSet<>(EntityIds.ORDER);
        for (Map<String, Object> row : rows) {
            cohort.add(entityId(row, "cohort", asOfDate));
        }
        return cohort;
    }

    Map<String, Double> labels(LabelConfig labelConfig, LocalDateTime asOfDate, Timespan labelTimespan) {
        List<Map<String, Object>> rows = queryExecutor.query(labelConfig.query(), Map.of(
                "as_of_date", asOfDate,
                "label_timespan", labelTimespan.toSqlInterval()));
        Map<String, Double> labels = new TreeMap<>(EntityIds.ORDER);
        Set<String> seen = new HashSet<>();
        for (Map<String, Object> row : rows) {
            String entity = entityId(row, "label", asOfDate);
            if (!seen.add(entity)) {
                throw new ResolutionException("Label query '" + labelConfig.name() + "' returned entity "
                        + entity + " more than once at " + asOfDate + " (" + labelTimespan + ")");
            }
            Double outcome = outcome(row.get(OUTCOME), entity, asOfDate);
            if (outcome != null) {
                labels.put(entity, outcome);
            }
        }
        return labels;
    }

    private static String entityId(Map<String, Object> row, String source, LocalDateTime asOfDate) {
        if (!row.containsKey(ENTITY_ID)) {
            throw new ResolutionException("The " + source + " query at " + asOfDate
                    + " did not return an entity_id column, got " + row.keySet());
        }
        String entity = EntityIds.of(row.get(ENTITY_ID));
        if (entity == null) {
            throw new ResolutionException("The " + source + " query at " + asOfDate + " returned a null entity_id");
        }
        return entity;
    }

    private static Double outcome(Object value, String entity, LocalDateTime asOfDate) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            throw new ResolutionException("Non-numeric outcome '" + value + "' for entity " + entity
                    + " at " + asOfDate, e);
        }
    }
}

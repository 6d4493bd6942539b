package com.platform.prioritizer.service;

import com.platform.prioritizer.domain.AggregateDefinition;
import com.platform.prioritizer.domain.AggregateMetric;
import com.platform.prioritizer.domain.AggregationInterval;
import com.platform.prioritizer.domain.AggregationSpec;
import com.platform.prioritizer.domain.CategoricalDefinition;
import com.platform.prioritizer.domain.EntityIds;
import com.platform.prioritizer.domain.FeatureBlock;
import com.platform.prioritizer.domain.ImputationRule;
import com.platform.prioritizer.domain.ImputationType;
import com.platform.prioritizer.domain.TemporalValues;
import com.platform.prioritizer.error.ImputationException;
import com.platform.prioritizer.error.PrioritizerException;
import com.platform.prioritizer.error.SpecException;
import com.platform.prioritizer.store.QueryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Point-in-time aggregation of event rows into per-entity features.
 * <p>
 * For an as-of date {@code d}, only rows whose knowledge date is strictly before {@code d}
 * contribute. The source query already asks for that, and every row is checked again
 * here, so a source that ignores the bound cannot leak future rows into a feature.
 * <p>
 * Aggregation and imputation are separate steps: {@link #aggregate} yields raw values
 * ({@code null} where undefined) that can be cached per (spec, as-of date), and
 * {@link #impute} fills them for a given cohort.
 */
@Service
public class FeatureAggregationService {

    private static final Logger log = LoggerFactory.getLogger(FeatureAggregationService.class);

    public static final String FLAG_SUFFIX = "_imp";

    private final QueryExecutor queryExecutor;

    public FeatureAggregationService(QueryExecutor queryExecutor) {
        this.queryExecutor = queryExecutor;
    }

    /**
     * One value column of a spec. {@code quantityColumn} is {@code null} for the
     * per-row quantity; categorical columns carry the column and choice instead.
     */
    public record FeatureColumn(
            String name,
            String group,
            AggregationInterval interval,
            String quantityColumn,
            String categoricalColumn,
            String choice,
            AggregateMetric metric,
            ImputationRule imputation
    ) {
        public boolean categorical() {
            return categoricalColumn != null;
        }

        public boolean flagged() {
            return imputation.type().isFlagged();
        }

        public String flagName() {
            return name + FLAG_SUFFIX;
        }
    }

    /**
     * Raw aggregates of one spec at one as-of date for every entity seen in the source.
     * A {@code null} entry is a missing value.
     */
    public record RawAggregates(String prefix, LocalDateTime asOfDate, List<FeatureColumn> columns,
                                Map<String, Double[]> values) {

        public Double value(String entityId, int column) {
            Double[] row = values.get(entityId);
            return row == null ? null : row[column];
        }
    }

    // --- Choice discovery ---

    /**
     * Replace every {@code choice_query} with the distinct non-null values it returns, sorted.
     *
     * @throws SpecException when a choice query returns nothing
     */
    public List<AggregationSpec> resolveChoices(List<AggregationSpec> specs) {
        List<AggregationSpec> resolved = new ArrayList<>();
        for (AggregationSpec spec : specs) {
            if (!spec.hasUnresolvedChoices()) {
                resolved.add(spec);
                continue;
            }
            List<CategoricalDefinition> categoricals = new ArrayList<>();
            for (CategoricalDefinition categorical : spec.categoricals()) {
                if (categorical.hasResolvedChoices()) {
                    categoricals.add(categorical);
                    continue;
                }
                List<String> choices = discoverChoices(spec, categorical);
                log.info("Resolved {} choices for '{}.{}': {}", choices.size(), spec.prefix(),
                        categorical.column(), choices);
                categoricals.add(categorical.withChoices(choices));
            }
            resolved.add(spec.withCategoricals(categoricals));
        }
        return resolved;
    }

    private List<String> discoverChoices(AggregationSpec spec, CategoricalDefinition categorical) {
        TreeSet<String> choices = new TreeSet<>();
        for (Map<String, Object> row : queryExecutor.query(categorical.choiceQuery(), Map.of())) {
            Object value = row.containsKey(categorical.column())
                    ? row.get(categorical.column())
                    : row.values().stream().findFirst().orElse(null);
            if (value != null) {
                choices.add(value.toString());
            }
        }
        if (choices.isEmpty()) {
            throw new SpecException("choice_query for '" + spec.prefix() + "." + categorical.column()
                    + "' returned no values");
        }
        return List.copyOf(choices);
    }

    // --- Schema ---

    public List<FeatureColumn> columns(AggregationSpec spec) {
        if (spec.hasUnresolvedChoices()) {
            throw new IllegalStateException("Choices of '" + spec.prefix() + "' have not been resolved");
        }
        List<FeatureColumn> columns = new ArrayList<>();
        for (String group : spec.groups()) {
            for (AggregationInterval interval : spec.intervals()) {
                String stem = spec.prefix() + "_" + group + "_" + interval.name() + "_";
                for (AggregateDefinition aggregate : spec.aggregates()) {
                    for (Map.Entry<String, String> quantity : aggregate.quantities().entrySet()) {
                        String column = AggregateDefinition.ROW_QUANTITY.equals(quantity.getValue())
                                ? null : quantity.getValue();
                        for (AggregateMetric metric : aggregate.metrics()) {
                            columns.add(new FeatureColumn(
                                    stem + quantity.getKey() + "_" + metric.configName(),
                                    group, interval, column, null, null, metric,
                                    spec.aggregatesImputation().resolve(spec.prefix(), metric)));
                        }
                    }
                }
                for (CategoricalDefinition categorical : spec.categoricals()) {
                    for (String choice : categorical.choices()) {
                        for (AggregateMetric metric : categorical.metrics()) {
                            columns.add(new FeatureColumn(
                                    stem + categorical.column() + "_" + choice + "_" + metric.configName(),
                                    group, interval, null, categorical.column(), choice, metric,
                                    spec.categoricalsImputation().resolve(spec.prefix(), metric)));
                        }
                    }
                }
            }
        }
        return columns;
    }

    /** Matrix column names, each flagged value column followed by its indicator. */
    public List<String> columnNames(AggregationSpec spec) {
        return columnNames(columns(spec));
    }

    static List<String> columnNames(List<FeatureColumn> columns) {
        List<String> names = new ArrayList<>();
        for (FeatureColumn column : columns) {
            names.add(column.name());
            if (column.flagged()) {
                names.add(column.flagName());
            }
        }
        return names;
    }

    // --- Aggregation ---

    public RawAggregates aggregate(AggregationSpec spec, LocalDateTime asOfDate) {
        List<FeatureColumn> columns = columns(spec);
        List<KnowableRow> rows = knowableRows(spec, asOfDate);

        Map<String, Double[]> values = new TreeMap<>(EntityIds.ORDER);
        for (KnowableRow row : rows) {
            values.computeIfAbsent(row.entityId(), e -> new Double[columns.size()]);
        }

        for (String group : spec.groups()) {
            Map<String, String> membership = AggregationSpec.ENTITY_GROUP.equals(group)
                    ? null : groupMembership(rows, group);
            for (AggregationInterval interval : spec.intervals()) {
                LocalDateTime lowerBound = interval.lowerBound(asOfDate);
                Map<String, List<KnowableRow>> buckets = new HashMap<>();
                for (KnowableRow row : rows) {
                    if (lowerBound != null && row.knowledgeDate().isBefore(lowerBound)) {
                        continue;
                    }
                    String key = membership == null ? row.entityId() : row.groupValue(group);
                    if (key != null) {
                        buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
                    }
                }
                for (int c = 0; c < columns.size(); c++) {
                    FeatureColumn column = columns.get(c);
                    if (!column.group().equals(group) || !column.interval().equals(interval)) {
                        continue;
                    }
                    Map<String, Double> byKey = new HashMap<>();
                    for (Map.Entry<String, List<KnowableRow>> bucket : buckets.entrySet()) {
                        byKey.put(bucket.getKey(), compute(spec, column, bucket.getValue()));
                    }
                    for (Map.Entry<String, Double[]> entity : values.entrySet()) {
                        String key = membership == null ? entity.getKey() : membership.get(entity.getKey());
                        entity.getValue()[c] = key == null ? null : byKey.get(key);
                    }
                }
            }
        }

        log.debug("Aggregated '{}' at {}: {} knowable rows, {} entities, {} columns",
                spec.prefix(), asOfDate, rows.size(), values.size(), columns.size());
        return new RawAggregates(spec.prefix(), asOfDate, columns, values);
    }

    String sourceQuery(AggregationSpec spec, LocalDateTime lowerBound) {
        String kdc = spec.knowledgeDateColumn();
        StringBuilder sql = new StringBuilder("select * from ").append(spec.fromObj())
                .append(" where ").append(kdc).append(" < :as_of_date");
        if (lowerBound != null) {
            sql.append(" and ").append(kdc).append(" >= :lower_bound");
        }
        return sql.toString();
    }

    /** Widest finite look-back, or {@code null} when any interval is unbounded. */
    static LocalDateTime widestLowerBound(AggregationSpec spec, LocalDateTime asOfDate) {
        LocalDateTime widest = null;
        for (AggregationInterval interval : spec.intervals()) {
            if (interval.isUnbounded()) {
                return null;
            }
            LocalDateTime bound = interval.lowerBound(asOfDate);
            if (widest == null || bound.isBefore(widest)) {
                widest = bound;
            }
        }
        return widest;
    }

    private List<KnowableRow> knowableRows(AggregationSpec spec, LocalDateTime asOfDate) {
        LocalDateTime lowerBound = widestLowerBound(spec, asOfDate);
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("as_of_date", asOfDate);
        if (lowerBound != null) {
            params.put("lower_bound", lowerBound);
        }
        List<Map<String, Object>> source = queryExecutor.query(sourceQuery(spec, lowerBound), params);

        List<KnowableRow> rows = new ArrayList<>(source.size());
        int discarded = 0;
        for (Map<String, Object> row : source) {
            LocalDateTime knowledgeDate = knowledgeDate(spec, row);
            if (knowledgeDate == null || !knowledgeDate.isBefore(asOfDate)
                    || (lowerBound != null && knowledgeDate.isBefore(lowerBound))) {
                discarded++;
                continue;
            }
            if (!row.containsKey(AggregationSpec.ENTITY_GROUP)) {
                throw new SpecException("Source '" + spec.fromObj() + "' of aggregation '" + spec.prefix()
                        + "' has no entity_id column");
            }
            for (String group : spec.groups()) {
                if (!row.containsKey(group)) {
                    throw new SpecException("Source '" + spec.fromObj() + "' of aggregation '" + spec.prefix()
                            + "' has no group column '" + group + "'");
                }
            }
            String entityId = EntityIds.of(row.get(AggregationSpec.ENTITY_GROUP));
            if (entityId != null) {
                rows.add(new KnowableRow(entityId, knowledgeDate, row));
            }
        }
        if (discarded > 0) {
            log.debug("Discarded {} rows of '{}' not knowable at {}", discarded, spec.prefix(), asOfDate);
        }
        return rows;
    }

    private static LocalDateTime knowledgeDate(AggregationSpec spec, Map<String, Object> row) {
        if (!row.containsKey(spec.knowledgeDateColumn())) {
            throw new SpecException("Source '" + spec.fromObj() + "' has no knowledge date column '"
                    + spec.knowledgeDateColumn() + "'");
        }
        try {
            return TemporalValues.toLocalDateTime(row.get(spec.knowledgeDateColumn()));
        } catch (IllegalArgumentException | PrioritizerException e) {
            throw new SpecException("Unreadable knowledge date in '" + spec.prefix() + "': "
                    + row.get(spec.knowledgeDateColumn()), e);
        }
    }

    /**
     * Entity to group value, taken from the entity's latest knowable row that has one.
     * Ties on the knowledge date go to the smallest group value.
     */
    private static Map<String, String> groupMembership(List<KnowableRow> rows, String group) {
        Map<String, KnowableRow> latest = new HashMap<>();
        for (KnowableRow row : rows) {
            String value = row.groupValue(group);
            if (value == null) {
                continue;
            }
            KnowableRow current = latest.get(row.entityId());
            if (current == null
                    || row.knowledgeDate().isAfter(current.knowledgeDate())
                    || (row.knowledgeDate().equals(current.knowledgeDate())
                        && value.compareTo(current.groupValue(group)) < 0)) {
                latest.put(row.entityId(), row);
            }
        }
        Map<String, String> membership = new HashMap<>();
        latest.forEach((entity, row) -> membership.put(entity, row.groupValue(group)));
        return membership;
    }

    private static Double compute(AggregationSpec spec, FeatureColumn column, List<KnowableRow> rows) {
        List<Double> values = new ArrayList<>(rows.size());
        if (column.categorical()) {
            int matches = 0;
            for (KnowableRow row : rows) {
                Object raw = row.source().get(column.categoricalColumn());
                if (raw == null) {
                    continue;
                }
                boolean match = raw.toString().equals(column.choice());
                if (match) matches++;
                values.add(match ? 1.0 : 0.0);
            }
            if (column.metric() == AggregateMetric.COUNT) {
                return (double) matches;
            }
        } else {
            for (KnowableRow row : rows) {
                if (column.quantityColumn() == null) {
                    values.add(1.0);
                } else {
                    Double value = numeric(spec, column.quantityColumn(), row.source().get(column.quantityColumn()));
                    if (value != null) {
                        values.add(value);
                    }
                }
            }
        }
        return column.metric().apply(values);
    }

    private static Double numeric(AggregationSpec spec, String column, Object raw) {
        if (raw == null) return null;
        if (raw instanceof Number n) return n.doubleValue();
        if (raw instanceof Boolean b) return b ? 1.0 : 0.0;
        try {
            return Double.parseDouble(raw.toString());
        } catch (NumberFormatException e) {
            throw new SpecException("Column '" + column + "' of aggregation '" + spec.prefix()
                    + "' is not numeric: '" + raw + "'", e);
        }
    }

    // --- Imputation ---

    /**
     * Fill the raw aggregates for every cohort entity. Entities absent from the source get
     * the imputed value for every column; flag columns mark what was imputed.
     *
     * @throws ImputationException when an {@code error} rule meets a missing value
     */
    public FeatureBlock impute(RawAggregates raw, Collection<String> cohort) {
        List<FeatureColumn> columns = raw.columns();
        double[] fills = new double[columns.size()];
        for (int c = 0; c < columns.size(); c++) {
            fills[c] = fillValue(columns.get(c), observed(raw, cohort, c));
        }

        List<String> names = columnNames(columns);
        Map<String, double[]> values = new LinkedHashMap<>();
        for (String entity : cohort) {
            double[] row = new double[names.size()];
            int out = 0;
            for (int c = 0; c < columns.size(); c++) {
                FeatureColumn column = columns.get(c);
                Double value = raw.value(entity, c);
                boolean imputed = value == null;
                if (imputed && column.imputation().type() == ImputationType.ERROR) {
                    throw new ImputationException("Missing value for " + column.name() + " of entity "
                            + entity + " at " + raw.asOfDate() + " and the imputation rule is 'error'");
                }
                row[out++] = imputed ? fills[c] : value;
                if (column.flagged()) {
                    row[out++] = imputed ? 1.0 : 0.0;
                }
            }
            values.put(entity, row);
        }
        return new FeatureBlock(raw.prefix(), names, values);
    }

    private static List<Double> observed(RawAggregates raw, Collection<String> cohort, int column) {
        List<Double> observed = new ArrayList<>();
        for (String entity : cohort) {
            Double value = raw.value(entity, column);
            if (value != null) {
                observed.add(value);
            }
        }
        return observed;
    }

    static double fillValue(FeatureColumn column, List<Double> observed) {
        ImputationRule rule = column.imputation();
        return switch (rule.type()) {
            case ZERO, ZERO_NOFLAG, ERROR -> 0.0;
            case CONSTANT -> rule.value();
            case MEAN -> observed.isEmpty()
                    ? 0.0
                    : observed.stream().mapToDouble(Double::doubleValue).sum() / observed.size();
            case BINARY_MODE -> {
                long ones = observed.stream().filter(v -> v == 1.0).count();
                long zeros = observed.stream().filter(v -> v == 0.0).count();
                yield ones > zeros ? 1.0 : 0.0;
            }
        };
    }

    private record KnowableRow(String entityId, LocalDateTime knowledgeDate, Map<String, Object> source) {

        String groupValue(String group) {
            Object value = source.get(group);
            return value == null ? null : EntityIds.of(value);
        }
    }
}

package com.queryroute.etl;

import com.queryroute.analyzer.KeywordVocabulary;
import com.queryroute.model.AggregateFunction;
import com.queryroute.model.AggregationConfig;
import com.queryroute.model.EtlInstructions;
import com.queryroute.model.EtlQueryType;
import com.queryroute.model.EtlTaskContext;
import com.queryroute.model.OutputFormat;
import com.queryroute.model.PlaceholderCategory;
import com.queryroute.model.PlaceholderRequirement;
import com.queryroute.model.RegionFilterConfig;
import com.queryroute.model.RegionMatchMode;
import com.queryroute.model.TimeFilterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Plans one ETL instruction set per placeholder category.
 */
@Slf4j
@Component
public class EtlInstructionPlanner {
    private static final List<String> NUMERIC_HINTS = List.of("value", "amount", "count", "sum", "total", "price", "quantity");
    private static final List<String> DATE_HINTS = List.of("date", "time", "day", "month", "created", "日期", "时间");
    private static final List<String> REGION_HINTS = List.of("region", "province", "city", "area", "district", "地区", "区域", "省", "市");

    private static final Map<AggregateFunction, List<String>> FUNCTION_KEYWORDS = new LinkedHashMap<>();

    static {
        FUNCTION_KEYWORDS.put(AggregateFunction.SUM, List.of("total", "sum", "总计", "合计", "总"));
        FUNCTION_KEYWORDS.put(AggregateFunction.AVG, List.of("average", "avg", "mean", "平均", "均值"));
        FUNCTION_KEYWORDS.put(AggregateFunction.MAX, List.of("max", "maximum", "highest", "最大", "最高"));
        FUNCTION_KEYWORDS.put(AggregateFunction.MIN, List.of("min", "minimum", "lowest", "最小", "最低"));
        FUNCTION_KEYWORDS.put(AggregateFunction.COUNT, List.of("count", "number of", "数量", "件数", "次数"));
    }

    public List<EtlInstructions> plan(List<PlaceholderRequirement> requirements, List<String> availableFields, EtlTaskContext context) {
        EtlTaskContext ctx = context != null ? context : new EtlTaskContext();
        List<String> fields = availableFields != null ? availableFields : List.of();

        Map<PlaceholderCategory, List<PlaceholderRequirement>> grouped = new LinkedHashMap<>();
        for (PlaceholderRequirement requirement : requirements) {
            if (requirement.getCategory() == null) {
                throw new IllegalArgumentException("Placeholder category is required");
            }
            grouped.computeIfAbsent(requirement.getCategory(), k -> new ArrayList<>()).add(requirement);
        }

        Optional<String> dateField = detect(fields, DATE_HINTS);
        Optional<String> regionField = detect(fields, REGION_HINTS);

        List<EtlInstructions> planned = new ArrayList<>();
        for (Map.Entry<PlaceholderCategory, List<PlaceholderRequirement>> group : grouped.entrySet()) {
            List<PlaceholderRequirement> items = group.getValue();
            EtlInstructions instructions;
            switch (group.getKey()) {
                case STATISTIC:
                    instructions = aggregateInstructions("statistic", items, fields, List.of(), OutputFormat.SCALAR);
                    break;
                case CHART: {
                    List<String> groupBy = new ArrayList<>();
                    dateField.ifPresent(groupBy::add);
                    regionField.ifPresent(groupBy::add);
                    instructions = aggregateInstructions("chart", items, fields, groupBy, OutputFormat.JSON);
                    break;
                }
                case PERIOD:
                    instructions = dateField.map(d -> periodInstructions(items, fields, d, ctx)).orElse(null);
                    break;
                case REGION:
                    instructions = regionField
                            .map(r -> aggregateInstructions("region", items, fields, List.of(r), OutputFormat.JSON))
                            .orElse(null);
                    if (instructions != null) {
                        instructions.setRegionConfig(RegionFilterConfig.builder()
                                .field(regionField.get())
                                .regionValue(ctx.hasRegion() ? ctx.getRegion() : "")
                                .regionType(RegionMatchMode.EXACT)
                                .build());
                    }
                    break;
                default:
                    instructions = null;
            }
            if (instructions == null) {
                log.info("No instructions planned: category={}, requirements={}", group.getKey(), items.size());
                continue;
            }
            if (instructions.getTimeConfig() == null && ctx.hasTimeRange() && dateField.isPresent()) {
                instructions.setTimeConfig(timeConfig(dateField.get(), ctx));
            }
            if (instructions.getRegionConfig() == null && ctx.hasRegion() && regionField.isPresent()) {
                instructions.setRegionConfig(RegionFilterConfig.builder().field(regionField.get()).regionValue(ctx.getRegion()).build());
            }
            planned.add(instructions);
        }
        log.info("Planned ETL instructions: requirements={}, instruction_sets={}", requirements.size(), planned.size());
        return planned;
    }

    private EtlInstructions aggregateInstructions(String prefix, List<PlaceholderRequirement> items, List<String> fields,
                                                  List<String> groupBy, OutputFormat format) {
        List<AggregationConfig> aggregations = new ArrayList<>();
        LinkedHashSet<String> sourceFields = new LinkedHashSet<>();
        for (PlaceholderRequirement item : items) {
            Optional<AggregationConfig> agg = aggregationFor(item.getDescription(), fields);
            if (agg.isEmpty()) {
                continue;
            }
            AggregationConfig config = agg.get();
            if (!groupBy.isEmpty()) {
                config.setGroupBy(new ArrayList<>(groupBy));
            }
            if (aggregations.stream().noneMatch(a -> a.alias().equals(config.alias()))) {
                aggregations.add(config);
                sourceFields.add(config.getField());
            }
        }
        if (aggregations.isEmpty()) {
            return null;
        }
        return EtlInstructions.builder()
                .instructionId(prefix + "_" + items.size())
                .queryType(EtlQueryType.AGGREGATE)
                .sourceFields(new ArrayList<>(sourceFields))
                .aggregations(aggregations)
                .outputFormat(format)
                .build();
    }

    private EtlInstructions periodInstructions(List<PlaceholderRequirement> items, List<String> fields, String dateField,
                                               EtlTaskContext ctx) {
        LinkedHashSet<String> sourceFields = new LinkedHashSet<>();
        for (PlaceholderRequirement item : items) {
            String lower = lower(item.getDescription());
            for (String field : fields) {
                if (KeywordVocabulary.mentions(lower, field)) {
                    sourceFields.add(field);
                }
            }
        }
        if (sourceFields.isEmpty()) {
            sourceFields.add(dateField);
        }
        return EtlInstructions.builder()
                .instructionId("period_" + items.size())
                .queryType(EtlQueryType.SELECT)
                .sourceFields(new ArrayList<>(sourceFields))
                .timeConfig(timeConfig(dateField, ctx))
                .outputFormat(OutputFormat.ARRAY)
                .build();
    }

    private static TimeFilterConfig timeConfig(String dateField, EtlTaskContext ctx) {
        return TimeFilterConfig.builder()
                .field(dateField)
                .startDate(ctx.getStartDate())
                .endDate(ctx.getEndDate())
                .build();
    }

    /**
     * Function from the description's keywords (sum when none), field = the longest available field the
     * description mentions, else the first numeric-looking field.
     */
    static Optional<AggregationConfig> aggregationFor(String description, List<String> fields) {
        String lower = lower(description);
        AggregateFunction function = AggregateFunction.SUM;
        for (Map.Entry<AggregateFunction, List<String>> entry : FUNCTION_KEYWORDS.entrySet()) {
            if (entry.getValue().stream().anyMatch(kw -> KeywordVocabulary.mentions(lower, kw))) {
                function = entry.getKey();
                break;
            }
        }

        String field = null;
        for (String candidate : fields) {
            if (KeywordVocabulary.mentions(lower, candidate) && (field == null || candidate.length() > field.length())) {
                field = candidate;
            }
        }
        if (field == null) {
            field = fields.stream()
                    .filter(f -> NUMERIC_HINTS.stream().anyMatch(h -> f.toLowerCase(Locale.ROOT).contains(h)))
                    .findFirst()
                    .orElse(null);
        }
        if (field == null) {
            return Optional.empty();
        }
        return Optional.of(AggregationConfig.builder().function(function).field(field).build());
    }

    private static Optional<String> detect(List<String> fields, List<String> hints) {
        return fields.stream()
                .filter(f -> hints.stream().anyMatch(h -> f.toLowerCase(Locale.ROOT).contains(h)))
                .findFirst();
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}

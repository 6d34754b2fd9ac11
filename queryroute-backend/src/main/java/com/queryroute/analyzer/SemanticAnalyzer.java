package com.queryroute.analyzer;

import com.queryroute.model.QueryContext;
import com.queryroute.model.QueryIntent;
import com.queryroute.model.TimeRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Turns a free-text request into a {@link QueryContext}. Pure and deterministic: no I/O, no clock.
 */
@Slf4j
@Component
public class SemanticAnalyzer {
    private static final double DEFAULT_CONFIDENCE = 0.5;

    private final KeywordVocabulary vocabulary;

    public SemanticAnalyzer(KeywordVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    public QueryContext analyze(String request) {
        if (request == null) {
            throw new IllegalArgumentException("request text is required");
        }
        String lower = request.toLowerCase(Locale.ROOT);

        QueryIntent intent = QueryIntent.DETAIL;
        double confidence = DEFAULT_CONFIDENCE;
        for (KeywordVocabulary.IntentRule rule : vocabulary.getIntentRules()) {
            if (mentionsAny(lower, rule.getKeywords())) {
                intent = rule.getIntent();
                confidence = rule.getConfidence();
                break;
            }
        }

        QueryContext context = QueryContext.builder()
                .originalQuery(request)
                .entities(extractEntities(lower))
                .intent(intent)
                .confidence(confidence)
                .timeRange(extractTimeRange(request))
                .filters(extractFilters(lower))
                .aggregationFunction(extractAggregation(lower))
                .build();
        log.debug("Analyzed request: intent={}, confidence={}, entities={}, filters={}, aggregation={}",
                context.getIntent(), context.getConfidence(), context.getEntities(), context.getFilters(),
                context.getAggregationFunction());
        return context;
    }

    private Set<String> extractEntities(String lower) {
        Set<String> entities = new LinkedHashSet<>();
        for (Map.Entry<String, List<String>> entry : vocabulary.getEntities().entrySet()) {
            for (String keyword : entry.getValue()) {
                if (lower.contains(keyword.toLowerCase(Locale.ROOT))) {
                    entities.add(entry.getKey());
                    break;
                }
            }
        }
        return Collections.unmodifiableSet(entities);
    }

    private TimeRange extractTimeRange(String request) {
        for (KeywordVocabulary.TimePattern tp : vocabulary.getTimePatterns()) {
            Matcher m = tp.getPattern().matcher(request);
            if (m.find()) {
                String number = firstGroup(m);
                return new TimeRange(tp.getLabel(), substitute(tp.getStartTemplate(), number),
                        substitute(tp.getEndTemplate(), number), amount(number));
            }
        }
        return null;
    }

    private static String firstGroup(Matcher m) {
        for (int i = 1; i <= m.groupCount(); i++) {
            if (m.group(i) != null) {
                return m.group(i);
            }
        }
        return null;
    }

    private static Integer amount(String number) {
        if (number == null) {
            return null;
        }
        try {
            return Integer.valueOf(number);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String substitute(String template, String number) {
        return number != null ? template.replace("$1", number) : template;
    }

    private Map<String, String> extractFilters(String lower) {
        Map<String, String> filters = new LinkedHashMap<>();
        for (KeywordVocabulary.FilterRule rule : vocabulary.getFilterRules()) {
            if (!filters.containsKey(rule.getKey()) && mentionsAny(lower, rule.getKeywords())) {
                filters.put(rule.getKey(), rule.getValue());
            }
        }
        return Collections.unmodifiableMap(filters);
    }

    private String extractAggregation(String lower) {
        for (KeywordVocabulary.AggregationRule rule : vocabulary.getAggregationRules()) {
            if (mentionsAny(lower, rule.getKeywords())) {
                return rule.getFunction();
            }
        }
        return null;
    }

    private static boolean mentionsAny(String lower, List<String> keywords) {
        for (String keyword : keywords) {
            if (KeywordVocabulary.mentions(lower, keyword)) {
                return true;
            }
        }
        return false;
    }
}

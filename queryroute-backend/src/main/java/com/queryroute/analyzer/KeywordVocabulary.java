package com.queryroute.analyzer;

import com.queryroute.model.QueryIntent;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Keyword tables that drive request analysis and table matching.
 *
 * <p>Rule lists are ordered; the first matching rule wins wherever a single answer is needed.
 */
@Getter
@Builder(toBuilder = true)
public class KeywordVocabulary {

    /** Entity label to the keywords that signal it, in priority order. */
    private final Map<String, List<String>> entities;
    private final List<IntentRule> intentRules;
    private final List<TimePattern> timePatterns;
    private final List<FilterRule> filterRules;
    private final List<AggregationRule> aggregationRules;
    /** Column-name fragments that mark a time column. */
    private final List<String> timeColumnKeywords;
    /** Column-name fragments that make a column an aggregation candidate during matching. */
    private final List<String> measureColumnKeywords;
    /** Column-name fragments the planner aggregates over. */
    private final List<String> plannerMeasureKeywords;
    /** Generic business words used to score tables found by live listing. */
    private final List<String> businessKeywords;

    @Value
    public static class IntentRule {
        QueryIntent intent;
        double confidence;
        List<String> keywords;
    }

    /**
     * {@code $1} in the templates is replaced by the first captured group.
     */
    @Value
    public static class TimePattern {
        Pattern pattern;
        String label;
        String startTemplate;
        String endTemplate;
    }

    @Value
    public static class FilterRule {
        List<String> keywords;
        String key;
        String value;
    }

    @Value
    public static class AggregationRule {
        List<String> keywords;
        String function;
    }

    /**
     * Keywords of an entity label; unknown labels match themselves.
     */
    public List<String> keywordsFor(String entity) {
        return entities.getOrDefault(entity, List.of(entity));
    }

    /**
     * Keyword test used by intent, filter and aggregation rules. ASCII keywords must stand as a word
     * (a plural suffix is allowed), other keywords match as substrings.
     *
     * @param lowerText lowercased text
     * @param keyword keyword, any case
     */
    public static boolean mentions(String lowerText, String keyword) {
        String kw = keyword.toLowerCase(Locale.ROOT);
        if (!kw.chars().allMatch(c -> c < 128)) {
            return lowerText.contains(kw);
        }
        return Pattern.compile("(?<![a-z])" + Pattern.quote(kw) + "(?:s|es)?(?![a-z])").matcher(lowerText).find();
    }

    public static KeywordVocabulary defaults() {
        Map<String, List<String>> entities = new LinkedHashMap<>();
        entities.put("User", List.of("user", "customer", "member", "用户", "客户", "会员"));
        entities.put("Order", List.of("order", "transaction", "purchase", "订单", "交易", "购买"));
        entities.put("Product", List.of("product", "item", "goods", "产品", "商品", "物品"));
        entities.put("Sale", List.of("sale", "revenue", "income", "销售", "营收", "收入"));
        entities.put("Employee", List.of("employee", "staff", "worker", "员工", "职员", "工作人员"));
        entities.put("Department", List.of("department", "division", "team", "部门", "科室", "团队"));
        entities.put("Finance", List.of("finance", "accounting", "budget", "财务", "会计", "预算"));
        entities.put("Inventory", List.of("inventory", "stock", "warehouse", "库存", "仓库", "存货"));

        String firstOfMonth = "DATE_FORMAT(NOW(), '%Y-%m-01')";
        String firstOfYear = "DATE_FORMAT(NOW(), '%Y-01-01')";

        return KeywordVocabulary.builder()
                .entities(entities)
                .intentRules(List.of(
                        new IntentRule(QueryIntent.STATISTICAL, 0.9,
                                List.of("统计", "汇总", "分析", "报表", "总计", "statistic", "summary", "report", "analysis")),
                        new IntentRule(QueryIntent.COMPARISON, 0.85,
                                List.of("对比", "比较", "相比", "同比", "环比", "compare", "comparison", "versus", "vs")),
                        new IntentRule(QueryIntent.TREND, 0.85,
                                List.of("趋势", "变化", "增长", "下降", "走势", "trend", "growth", "decline", "over time")),
                        new IntentRule(QueryIntent.DETAIL, 0.8,
                                List.of("查询", "查看", "列表", "明细", "详情", "list", "show", "detail")),
                        new IntentRule(QueryIntent.AGGREGATION, 0.85,
                                List.of("总数", "平均", "最大", "最小", "数量", "总和", "how many", "average", "maximum", "minimum", "total", "count")),
                        new IntentRule(QueryIntent.JOIN, 0.9,
                                List.of("关联", "连接", "连表", "join"))))
                .timePatterns(List.of(
                        timePattern("最近(\\d+)天|(?:last|past) (\\d+) days?", "last_n_days",
                                "DATE_SUB(NOW(), INTERVAL $1 DAY)", "NOW()"),
                        timePattern("最近(\\d+)个?月|(?:last|past) (\\d+) months?", "last_n_months",
                                "DATE_SUB(NOW(), INTERVAL $1 MONTH)", "NOW()"),
                        timePattern("最近(\\d+)年|(?:last|past) (\\d+) years?", "last_n_years",
                                "DATE_SUB(NOW(), INTERVAL $1 YEAR)", "NOW()"),
                        timePattern("今天|today", "today",
                                "CURDATE()", "DATE_ADD(CURDATE(), INTERVAL 1 DAY)"),
                        timePattern("昨天|yesterday", "yesterday",
                                "DATE_SUB(CURDATE(), INTERVAL 1 DAY)", "CURDATE()"),
                        timePattern("本月|这个月|this month", "this_month",
                                firstOfMonth, "DATE_ADD(" + firstOfMonth + ", INTERVAL 1 MONTH)"),
                        timePattern("上月|上个月|last month", "last_month",
                                "DATE_SUB(" + firstOfMonth + ", INTERVAL 1 MONTH)", firstOfMonth),
                        timePattern("今年|this year", "this_year",
                                firstOfYear, "DATE_ADD(" + firstOfYear + ", INTERVAL 1 YEAR)"),
                        timePattern("去年|last year", "last_year",
                                "DATE_SUB(" + firstOfYear + ", INTERVAL 1 YEAR)", firstOfYear)))
                .filterRules(List.of(
                        new FilterRule(List.of("VIP"), "level", "VIP"),
                        new FilterRule(List.of("已完成", "completed"), "status", "completed"),
                        new FilterRule(List.of("进行中", "in progress", "processing"), "status", "processing")))
                .aggregationRules(List.of(
                        new AggregationRule(List.of("总数", "数量", "个数", "计数", "count", "number of", "how many"), "COUNT"),
                        new AggregationRule(List.of("总计", "总和", "合计", "sum", "total"), "SUM"),
                        new AggregationRule(List.of("平均", "均值", "average", "avg", "mean"), "AVG"),
                        new AggregationRule(List.of("最大", "最高", "max", "maximum", "highest"), "MAX"),
                        new AggregationRule(List.of("最小", "最低", "min", "minimum", "lowest"), "MIN")))
                .timeColumnKeywords(List.of("time", "date", "created", "updated"))
                .measureColumnKeywords(List.of("amount", "count", "total", "sum", "price"))
                .plannerMeasureKeywords(List.of("amount", "price", "total"))
                .businessKeywords(List.of("user", "order", "product", "customer", "sale", "transaction",
                        "complaint", "ticket", "issue", "用户", "订单", "产品", "客户", "销售", "交易", "投诉", "工单", "问题"))
                .build();
    }

    private static TimePattern timePattern(String regex, String label, String start, String end) {
        return new TimePattern(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), label, start, end);
    }
}

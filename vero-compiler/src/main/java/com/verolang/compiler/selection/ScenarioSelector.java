package com.verolang.compiler.selection;

import com.verolang.compiler.ast.decl.FeatureDecl;
import com.verolang.compiler.ast.decl.Program;
import com.verolang.compiler.ast.decl.ScenarioDecl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 场景筛选器
 * <p>
 * 按场景名、名称正则和标签表达式裁剪程序；只保留至少有一个场景被选中的 feature。
 * 输入程序不被修改。
 */
public final class ScenarioSelector {

    private static final Logger LOG = Logger.getLogger(ScenarioSelector.class.getName());

    private static final Pattern LOWER_THEN_UPPER = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern ACRONYM_THEN_WORD = Pattern.compile("([A-Z]+)([A-Z][a-z])");
    private static final Pattern NON_ALNUM = Pattern.compile("[^A-Za-z0-9]+");

    private final Set<String> exactNames = new LinkedHashSet<String>();
    private final Set<String> comparableNames = new HashSet<String>();
    private final List<Pattern> namePatterns = new ArrayList<Pattern>();
    private final TagExpression tagExpression;
    private final String tagExpressionSource;
    private final String filterSummary;

    /**
     * 预先解析全部条件；非法条件在任何场景求值之前抛出
     *
     * @throws ScenarioSelectionException 正则或标签表达式非法
     */
    public ScenarioSelector(ScenarioSelectionOptions options) {
        ScenarioSelectionOptions opts = options != null ? options : ScenarioSelectionOptions.none();
        List<String> names = cleanList(opts.getScenarioNames());
        List<String> patterns = cleanList(opts.getNamePatterns());
        String tags = opts.getTagExpression() != null ? opts.getTagExpression().trim() : "";

        for (String name : names) {
            exactNames.add(normalizeScenarioName(name));
            comparableNames.add(comparableName(name));
        }
        for (String pattern : patterns) {
            try {
                namePatterns.add(Pattern.compile(pattern, Pattern.CASE_INSENSITIVE));
            } catch (PatternSyntaxException e) {
                throw new ScenarioSelectionException(
                        "Invalid name pattern '" + pattern + "': " + e.getDescription());
            }
        }
        if (!tags.isEmpty()) {
            tagExpression = TagExpression.parse(tags);
            tagExpressionSource = tags;
        } else {
            tagExpression = null;
            tagExpressionSource = null;
        }
        filterSummary = summarize(names, patterns, tagExpressionSource);
    }

    /**
     * 便捷方法
     */
    public static SelectionResult apply(Program program, ScenarioSelectionOptions options) {
        return new ScenarioSelector(options).select(program);
    }

    public boolean hasFilters() {
        return !exactNames.isEmpty() || !namePatterns.isEmpty() || tagExpression != null;
    }

    /**
     * 执行筛选
     *
     * @throws ScenarioSelectionException 有筛选条件但没有任何场景被选中
     */
    public SelectionResult select(Program program) {
        int total = program.getScenarioCount();
        if (!hasFilters()) {
            return new SelectionResult(program, new SelectionDiagnostics(total, total,
                    program.getFeatures().size(), false,
                    new ArrayList<String>(), new ArrayList<String>(), null));
        }

        List<FeatureDecl> features = new ArrayList<FeatureDecl>();
        int selected = 0;
        for (FeatureDecl feature : program.getFeatures()) {
            List<ScenarioDecl> matching = new ArrayList<ScenarioDecl>();
            for (ScenarioDecl scenario : feature.getScenarios()) {
                if (matches(scenario)) {
                    matching.add(scenario);
                }
            }
            if (matching.isEmpty()) continue;
            features.add(feature.withScenarios(matching));
            selected += matching.size();
        }

        if (selected == 0) {
            throw new ScenarioSelectionException("No scenarios matched the provided selection"
                    + (filterSummary.isEmpty() ? "" : " (" + filterSummary + ")") + ".");
        }

        List<String> patternSources = new ArrayList<String>();
        for (Pattern pattern : namePatterns) {
            patternSources.add(pattern.pattern());
        }
        SelectionDiagnostics diagnostics = new SelectionDiagnostics(total, selected, features.size(), true,
                new ArrayList<String>(exactNames), patternSources, tagExpressionSource);
        LOG.fine(diagnostics.toString());
        return new SelectionResult(program.withFeatures(features), diagnostics);
    }

    /**
     * 单个场景是否满足全部条件
     */
    public boolean matches(ScenarioDecl scenario) {
        if (!exactNames.isEmpty()) {
            if (!exactNames.contains(normalizeScenarioName(scenario.getName()))
                    && !comparableNames.contains(comparableName(scenario.getName()))) {
                return false;
            }
        }
        if (!namePatterns.isEmpty()) {
            String readable = readableName(scenario.getName());
            boolean matched = false;
            for (Pattern pattern : namePatterns) {
                if (pattern.matcher(scenario.getName()).find() || pattern.matcher(readable).find()) {
                    matched = true;
                    break;
                }
            }
            if (!matched) return false;
        }
        if (tagExpression != null) {
            Set<String> tags = new HashSet<String>();
            for (String tag : scenario.getTags()) {
                tags.add(TagExpression.normalizeTag(tag));
            }
            return tagExpression.evaluate(tags);
        }
        return true;
    }

    // ============ 名称规范化 ============

    static String normalizeScenarioName(String name) {
        return name.trim().toLowerCase();
    }

    /**
     * 可比较形式：拆分驼峰/帕斯卡命名为小写单词，以空格连接
     */
    static String comparableName(String name) {
        return join(splitWords(name));
    }

    static String readableName(String name) {
        List<String> words = splitWords(name);
        return words.isEmpty() ? name : join(words);
    }

    static List<String> splitWords(String name) {
        String split = LOWER_THEN_UPPER.matcher(name).replaceAll("$1 $2");
        split = ACRONYM_THEN_WORD.matcher(split).replaceAll("$1 $2");
        split = NON_ALNUM.matcher(split).replaceAll(" ").trim().toLowerCase();
        List<String> words = new ArrayList<String>();
        for (String word : Arrays.asList(split.split("\\s+"))) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }

    private static String join(List<String> words) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < words.size(); i++) {
            if (i > 0) sb.append(' ');
            sb.append(words.get(i));
        }
        return sb.toString();
    }

    private static List<String> cleanList(List<String> values) {
        List<String> result = new ArrayList<String>();
        if (values == null) return result;
        for (String value : values) {
            if (value == null) continue;
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }

    private static String summarize(List<String> names, List<String> patterns, String tags) {
        List<String> parts = new ArrayList<String>();
        if (!names.isEmpty()) {
            parts.add("scenarioNames=" + String.join(",", names));
        }
        if (!patterns.isEmpty()) {
            parts.add("namePatterns=" + String.join(",", patterns));
        }
        if (tags != null) {
            parts.add("tagExpression=" + tags);
        }
        return String.join("; ", parts);
    }
}

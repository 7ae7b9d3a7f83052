package com.verolang.compiler.selection;

import java.util.Set;

/**
 * 标签表达式的布尔语法树
 * <p>
 * 叶子是规范化后的标签名（去掉前导 @，小写）。
 */
public abstract class TagExpression {

    /**
     * 解析标签表达式
     *
     * @throws ScenarioSelectionException 表达式非法时，携带出错的字符下标
     */
    public static TagExpression parse(String expression) {
        return new TagExpressionParser(expression).parse();
    }

    /**
     * 对规范化后的标签集合求值
     */
    public abstract boolean evaluate(Set<String> tags);

    /**
     * 标签规范化：去空白、去前导 @、小写
     */
    public static String normalizeTag(String tag) {
        String trimmed = tag.trim();
        int start = 0;
        while (start < trimmed.length() && trimmed.charAt(start) == '@') {
            start++;
        }
        return trimmed.substring(start).toLowerCase();
    }

    // ============ 节点 ============

    public static final class Tag extends TagExpression {
        private final String name;

        public Tag(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        @Override
        public boolean evaluate(Set<String> tags) {
            return tags.contains(name);
        }

        @Override
        public String toString() {
            return "@" + name;
        }
    }

    public static final class Not extends TagExpression {
        private final TagExpression operand;

        public Not(TagExpression operand) {
            this.operand = operand;
        }

        public TagExpression getOperand() {
            return operand;
        }

        @Override
        public boolean evaluate(Set<String> tags) {
            return !operand.evaluate(tags);
        }

        @Override
        public String toString() {
            return "not " + operand;
        }
    }

    public static final class And extends TagExpression {
        private final TagExpression left;
        private final TagExpression right;

        public And(TagExpression left, TagExpression right) {
            this.left = left;
            this.right = right;
        }

        public TagExpression getLeft() { return left; }
        public TagExpression getRight() { return right; }

        @Override
        public boolean evaluate(Set<String> tags) {
            return left.evaluate(tags) && right.evaluate(tags);
        }

        @Override
        public String toString() {
            return "(" + left + " and " + right + ")";
        }
    }

    public static final class Or extends TagExpression {
        private final TagExpression left;
        private final TagExpression right;

        public Or(TagExpression left, TagExpression right) {
            this.left = left;
            this.right = right;
        }

        public TagExpression getLeft() { return left; }
        public TagExpression getRight() { return right; }

        @Override
        public boolean evaluate(Set<String> tags) {
            return left.evaluate(tags) || right.evaluate(tags);
        }

        @Override
        public String toString() {
            return "(" + left + " or " + right + ")";
        }
    }
}

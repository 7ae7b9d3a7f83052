package com.verolang.compiler.selection;

import java.util.ArrayList;
import java.util.List;

/**
 * 标签表达式递归下降解析器
 * <p>
 * 优先级：NOT > AND > OR，支持括号；关键字大小写不敏感。
 */
final class TagExpressionParser {

    enum TagTokenType {
        LPAREN, RPAREN, AND, OR, NOT, TAG, EOF
    }

    static final class TagToken {
        final TagTokenType type;
        final String value;
        final int index;

        TagToken(TagTokenType type, String value, int index) {
            this.type = type;
            this.value = value;
            this.index = index;
        }

        @Override
        public String toString() {
            return type + "(" + value + ")@" + index;
        }
    }

    private final List<TagToken> tokens;
    private int current = 0;

    TagExpressionParser(String expression) {
        this.tokens = tokenize(expression);
    }

    TagExpression parse() {
        TagExpression result = parseOr();
        expect(TagTokenType.EOF, "Unexpected trailing content in tag expression");
        return result;
    }

    // ============ 语法 ============

    private TagExpression parseOr() {
        TagExpression left = parseAnd();
        while (match(TagTokenType.OR)) {
            left = new TagExpression.Or(left, parseAnd());
        }
        return left;
    }

    private TagExpression parseAnd() {
        TagExpression left = parseUnary();
        while (match(TagTokenType.AND)) {
            left = new TagExpression.And(left, parseUnary());
        }
        return left;
    }

    private TagExpression parseUnary() {
        if (match(TagTokenType.NOT)) {
            return new TagExpression.Not(parseUnary());
        }
        return parsePrimary();
    }

    private TagExpression parsePrimary() {
        if (match(TagTokenType.LPAREN)) {
            TagExpression expr = parseOr();
            expect(TagTokenType.RPAREN, "Expected ')' to close tag expression group");
            return expr;
        }
        TagToken token = peek();
        if (token.type == TagTokenType.TAG) {
            advance();
            return new TagExpression.Tag(TagExpression.normalizeTag(token.value));
        }
        throw new ScenarioSelectionException(
                "Invalid tag expression near index " + token.index + ": expected a tag or '('", token.index);
    }

    // ============ 辅助方法 ============

    private TagToken peek() {
        return current < tokens.size() ? tokens.get(current) : tokens.get(tokens.size() - 1);
    }

    private TagToken advance() {
        TagToken token = peek();
        current++;
        return token;
    }

    private boolean match(TagTokenType type) {
        if (peek().type != type) {
            return false;
        }
        advance();
        return true;
    }

    private TagToken expect(TagTokenType type, String message) {
        TagToken token = peek();
        if (token.type != type) {
            throw new ScenarioSelectionException(message + " at index " + token.index, token.index);
        }
        return advance();
    }

    // ============ 词法 ============

    static List<TagToken> tokenize(String expression) {
        List<TagToken> result = new ArrayList<TagToken>();
        int index = 0;
        while (index < expression.length()) {
            char c = expression.charAt(index);

            if (Character.isWhitespace(c)) {
                index++;
                continue;
            }
            if (c == '(') {
                result.add(new TagToken(TagTokenType.LPAREN, "(", index));
                index++;
                continue;
            }
            if (c == ')') {
                result.add(new TagToken(TagTokenType.RPAREN, ")", index));
                index++;
                continue;
            }
            if (c == '@') {
                int end = readWord(expression, index + 1);
                if (end == index + 1) {
                    throw new ScenarioSelectionException(
                            "Invalid tag expression near index " + index + ": expected tag after '@'", index);
                }
                result.add(new TagToken(TagTokenType.TAG, expression.substring(index, end), index));
                index = end;
                continue;
            }
            if (isWordChar(c)) {
                int end = readWord(expression, index);
                String word = expression.substring(index, end);
                String lower = word.toLowerCase();
                TagTokenType type;
                if (lower.equals("and")) {
                    type = TagTokenType.AND;
                } else if (lower.equals("or")) {
                    type = TagTokenType.OR;
                } else if (lower.equals("not")) {
                    type = TagTokenType.NOT;
                } else {
                    type = TagTokenType.TAG;
                }
                result.add(new TagToken(type, word, index));
                index = end;
                continue;
            }
            throw new ScenarioSelectionException(
                    "Invalid tag expression near index " + index + ": unexpected character '" + c + "'", index);
        }
        result.add(new TagToken(TagTokenType.EOF, "", expression.length()));
        return result;
    }

    private static int readWord(String input, int start) {
        int index = start;
        while (index < input.length() && isWordChar(input.charAt(index))) {
            index++;
        }
        return index;
    }

    private static boolean isWordChar(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_' || c == '-';
    }
}

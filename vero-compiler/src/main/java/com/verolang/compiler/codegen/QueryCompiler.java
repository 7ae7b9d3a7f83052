package com.verolang.compiler.codegen;

import com.verolang.compiler.ast.expr.Expression;
import com.verolang.compiler.ast.query.OrderBy;
import com.verolang.compiler.ast.query.QueryComparison;
import com.verolang.compiler.ast.query.QueryCondition;
import com.verolang.compiler.ast.query.QueryContains;
import com.verolang.compiler.ast.query.QueryEmpty;
import com.verolang.compiler.ast.query.QueryIn;
import com.verolang.compiler.ast.query.QueryLogical;
import com.verolang.compiler.ast.query.QueryNot;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 数据查询（WHERE / ORDER BY）→ 数组谓词与比较器
 */
final class QueryCompiler {

    static final String ROW = "row";
    private static final Pattern SIMPLE_NAME = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    private final GenContext ctx;

    QueryCompiler(GenContext ctx) {
        this.ctx = ctx;
    }

    /**
     * 数据表访问：Data.Users 或 Data['Project.Users']
     */
    static String table(String qualifiedName) {
        if (SIMPLE_NAME.matcher(qualifiedName).matches()) {
            return "Data." + qualifiedName;
        }
        return "Data[" + TsSyntax.quote(qualifiedName) + "]";
    }

    /**
     * 过滤谓词体（参数名为 row）
     */
    String predicate(QueryCondition condition) {
        if (condition instanceof QueryComparison) {
            QueryComparison c = (QueryComparison) condition;
            String column = column(c.getColumnName());
            String value = value(c.getValue());
            switch (c.getOperator()) {
                case EQ:
                case NE:
                    return "String(" + column + ") " + c.getOperator().getTsOperator() + " String(" + value + ")";
                default:
                    return "Number(" + column + ") " + c.getOperator().getTsOperator() + " Number(" + value + ")";
            }
        }
        if (condition instanceof QueryContains) {
            QueryContains c = (QueryContains) condition;
            return "String(" + column(c.getColumnName()) + " ?? '').includes(String(" + value(c.getValue()) + "))";
        }
        if (condition instanceof QueryEmpty) {
            QueryEmpty c = (QueryEmpty) condition;
            String column = column(c.getColumnName());
            String empty = "(" + column + " == null || " + column + " === '')";
            return c.isNegated() ? "!" + empty : empty;
        }
        if (condition instanceof QueryIn) {
            QueryIn c = (QueryIn) condition;
            StringBuilder sb = new StringBuilder("[");
            List<Expression> values = c.getValues();
            for (int i = 0; i < values.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(value(values.get(i)));
            }
            return sb.append("].map(String).includes(String(").append(column(c.getColumnName())).append("))").toString();
        }
        if (condition instanceof QueryNot) {
            return "!(" + predicate(((QueryNot) condition).getOperand()) + ")";
        }
        if (condition instanceof QueryLogical) {
            QueryLogical c = (QueryLogical) condition;
            String operator = c.getKind() == QueryLogical.Kind.AND ? " && " : " || ";
            return "(" + predicate(c.getLeft()) + operator + predicate(c.getRight()) + ")";
        }
        throw new IllegalStateException("Unknown query condition: " + condition.getClass().getSimpleName());
    }

    String filterCall(QueryCondition condition) {
        return ".filter((" + ROW + ") => " + predicate(condition) + ")";
    }

    String findCall(QueryCondition condition) {
        return ".find((" + ROW + ") => " + predicate(condition) + ")";
    }

    /**
     * 多列排序比较器
     */
    String sortCall(List<OrderBy> orderBy) {
        StringBuilder sb = new StringBuilder(".sort((a, b) => ");
        for (int i = 0; i < orderBy.size(); i++) {
            OrderBy order = orderBy.get(i);
            String key = "[" + TsSyntax.quote(order.getColumnName()) + "]";
            String first = order.isDescending() ? "b" : "a";
            String second = order.isDescending() ? "a" : "b";
            if (i > 0) sb.append(" || ");
            sb.append("String(").append(first).append(key).append(" ?? '').localeCompare(String(")
                    .append(second).append(key).append(" ?? ''), undefined, { numeric: true })");
        }
        return sb.append(')').toString();
    }

    private String column(String name) {
        return ROW + "[" + TsSyntax.quote(name) + "]";
    }

    private String value(Expression expression) {
        return ExpressionCompiler.compile(ctx, expression);
    }
}

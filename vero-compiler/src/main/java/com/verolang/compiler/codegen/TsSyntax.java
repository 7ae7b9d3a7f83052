package com.verolang.compiler.codegen;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * TypeScript 字面量与命名工具
 */
public final class TsSyntax {

    static final String ENV_MAP = "__env__";
    static final String ENV_DECLARATION =
            "const __env__: Record<string, string> = JSON.parse(process.env.VERO_ENV_VARS || '{}');";

    private static final Pattern ENV_PLACEHOLDER = Pattern.compile("\\{\\{\\s*([^{}]*?)\\s*}}");

    private TsSyntax() {
    }

    /**
     * 单引号字符串字面量
     */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder("'");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '\'': sb.append("\\'"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default: sb.append(c);
            }
        }
        return sb.append('\'').toString();
    }

    /**
     * 含 {{name}} 占位符的字符串生成模板字面量，否则生成普通字符串
     */
    public static String stringWithPlaceholders(String value) {
        Matcher m = ENV_PLACEHOLDER.matcher(value);
        if (!m.find()) {
            return quote(value);
        }
        StringBuilder sb = new StringBuilder("`");
        int last = 0;
        do {
            sb.append(escapeTemplate(value.substring(last, m.start())));
            sb.append("${").append(envLookup(m.group(1))).append('}');
            last = m.end();
        } while (m.find());
        sb.append(escapeTemplate(value.substring(last)));
        return sb.append('`').toString();
    }

    public static boolean hasPlaceholders(String value) {
        return ENV_PLACEHOLDER.matcher(value).find();
    }

    public static String envLookup(String name) {
        return ENV_MAP + "[" + quote(name) + "]";
    }

    /**
     * 首字母小写：LoginPage → loginPage
     */
    public static String camelCase(String name) {
        if (name == null || name.isEmpty()) return name;
        return Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }

    /**
     * 数字字面量，整数不带小数点
     */
    public static String number(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }

    private static String escapeTemplate(String text) {
        return text.replace("\\", "\\\\").replace("`", "\\`").replace("${", "\\${");
    }
}

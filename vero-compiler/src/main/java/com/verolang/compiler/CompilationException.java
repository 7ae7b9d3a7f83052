package com.verolang.compiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 严格模式下源码存在错误
 */
public class CompilationException extends RuntimeException {

    private final List<String> errors;

    public CompilationException(List<String> errors) {
        super(buildMessage(errors));
        this.errors = Collections.unmodifiableList(new ArrayList<String>(errors));
    }

    public List<String> getErrors() {
        return errors;
    }

    private static String buildMessage(List<String> errors) {
        StringBuilder sb = new StringBuilder("Compilation failed with ")
                .append(errors.size()).append(" error(s)");
        for (String error : errors) {
            sb.append("\n  - ").append(error);
        }
        return sb.toString();
    }
}

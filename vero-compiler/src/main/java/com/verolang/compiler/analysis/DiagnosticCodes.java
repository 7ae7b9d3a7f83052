package com.verolang.compiler.analysis;

/**
 * 诊断代码：VERO-1xx 为结构问题，VERO-2xx 为引用问题
 */
public final class DiagnosticCodes {

    private DiagnosticCodes() {}

    public static final String DUPLICATE_PAGE = "VERO-100";
    public static final String DUPLICATE_PAGE_ACTIONS = "VERO-101";
    public static final String DUPLICATE_MEMBER = "VERO-102";
    public static final String DUPLICATE_OVERLOAD = "VERO-103";
    public static final String INVALID_SELECTOR = "VERO-104";
    public static final String INVALID_MODIFIER = "VERO-105";
    public static final String NAME_ON_NON_ROLE = "VERO-106";
    public static final String DUPLICATE_SCENARIO = "VERO-107";
    public static final String NAMING_CONVENTION = "VERO-108";

    public static final String UNDEFINED_PAGE = "VERO-200";
    public static final String PAGE_NOT_IN_USE = "VERO-201";
    public static final String UNDEFINED_ACTION = "VERO-202";
    public static final String UNDEFINED_COLLECTION = "VERO-203";
    public static final String POSSIBLY_UNDEFINED = "VERO-204";
    public static final String UNDEFINED_FIELD = "VERO-205";
    public static final String UNDEFINED_FOR_PAGE = "VERO-206";
    public static final String ARITY_MISMATCH = "VERO-207";
}

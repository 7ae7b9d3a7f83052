package com.verolang.compiler.parser;

import com.verolang.compiler.ast.ComparisonOperator;
import com.verolang.compiler.ast.ElementState;
import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.TextMatch;
import com.verolang.compiler.ast.VariableType;
import com.verolang.compiler.ast.VisualPreset;
import com.verolang.compiler.ast.cond.ComparisonCondition;
import com.verolang.compiler.ast.cond.Condition;
import com.verolang.compiler.ast.cond.ContainsCondition;
import com.verolang.compiler.ast.cond.ElementStateCondition;
import com.verolang.compiler.ast.cond.NotCondition;
import com.verolang.compiler.ast.cond.TruthCondition;
import com.verolang.compiler.ast.decl.ActionDecl;
import com.verolang.compiler.ast.decl.FeatureDecl;
import com.verolang.compiler.ast.decl.FieldDecl;
import com.verolang.compiler.ast.decl.HookDecl;
import com.verolang.compiler.ast.decl.PageActionsDecl;
import com.verolang.compiler.ast.decl.PageDecl;
import com.verolang.compiler.ast.decl.PageVariableDecl;
import com.verolang.compiler.ast.decl.Program;
import com.verolang.compiler.ast.decl.ScenarioDecl;
import com.verolang.compiler.ast.expr.BooleanLiteral;
import com.verolang.compiler.ast.expr.EnvVarRef;
import com.verolang.compiler.ast.expr.Expression;
import com.verolang.compiler.ast.expr.ListLiteral;
import com.verolang.compiler.ast.expr.NumberLiteral;
import com.verolang.compiler.ast.expr.StringLiteral;
import com.verolang.compiler.ast.expr.VariableRef;
import com.verolang.compiler.ast.query.OrderBy;
import com.verolang.compiler.ast.query.QueryComparison;
import com.verolang.compiler.ast.query.QueryCondition;
import com.verolang.compiler.ast.query.QueryContains;
import com.verolang.compiler.ast.query.QueryEmpty;
import com.verolang.compiler.ast.query.QueryIn;
import com.verolang.compiler.ast.query.QueryLogical;
import com.verolang.compiler.ast.query.QueryNot;
import com.verolang.compiler.ast.query.RowPosition;
import com.verolang.compiler.ast.query.TableRef;
import com.verolang.compiler.ast.selector.FirstModifier;
import com.verolang.compiler.ast.selector.HasModifier;
import com.verolang.compiler.ast.selector.HasNotModifier;
import com.verolang.compiler.ast.selector.LastModifier;
import com.verolang.compiler.ast.selector.NthModifier;
import com.verolang.compiler.ast.selector.Selector;
import com.verolang.compiler.ast.selector.SelectorModifier;
import com.verolang.compiler.ast.selector.SelectorType;
import com.verolang.compiler.ast.selector.WithTextModifier;
import com.verolang.compiler.ast.selector.WithoutTextModifier;
import com.verolang.compiler.ast.stmt.*;
import com.verolang.compiler.lexer.Token;
import com.verolang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import static com.verolang.compiler.lexer.TokenType.*;

/**
 * Vero 递归下降解析器
 * <p>
 * 解析是容错的：遇到语法错误时记录诊断，并在下一个块边界（匹配的右花括号、
 * 下一行的成员/语句起始关键词或下一个顶层声明）重新同步。
 * 一个损坏的块不会阻止文件其余部分的解析，总会返回尽力构造的 AST。
 */
public class Parser {

    private static final TokenType[] PAGE_MEMBER_START = {KW_FIELD, KW_TEXT, KW_NUMBER, KW_FLAG, KW_LIST};
    private static final TokenType[] FEATURE_MEMBER_START = {KW_USE, KW_BEFORE, KW_AFTER, KW_SCENARIO};
    private static final TokenType[] ACTION_START = {IDENTIFIER};
    private static final TokenType[] STATEMENT_START = {
            KW_CLICK, KW_RIGHT, KW_DOUBLE, KW_FORCE, KW_DRAG, KW_FILL, KW_CLEAR, KW_SELECT,
            KW_CHECK, KW_UNCHECK, KW_HOVER, KW_PRESS, KW_SCROLL, KW_UPLOAD, KW_DOWNLOAD,
            KW_OPEN, KW_REFRESH, KW_WAIT, KW_SWITCH, KW_CLOSE, KW_ACCEPT, KW_DISMISS, KW_SET,
            KW_LOG, KW_TAKE, KW_VERIFY, KW_IF, KW_REPEAT, KW_FOR, KW_TRY, KW_PERFORM,
            KW_TEXT, KW_NUMBER, KW_FLAG, KW_LIST, KW_RETURN, KW_LOAD, KW_ROW, KW_ROWS, KW_COUNT
    };

    private static final Pattern CSS_PSEUDO = Pattern.compile(":[a-z-]+(\\(|$)", Pattern.CASE_INSENSITIVE);
    private static final Pattern CSS_TAG_PREFIX = Pattern.compile("^[a-z]+[.#\\[]", Pattern.CASE_INSENSITIVE);

    private final List<Token> tokens;
    private final List<ParseError> errors = new ArrayList<ParseError>();
    private int pos = 0;
    private Token current;
    private Token previous;

    public Parser(List<Token> tokens) {
        this.tokens = new ArrayList<Token>(tokens.size());
        for (Token token : tokens) {
            if (!token.is(COMMENT)) {
                this.tokens.add(token);
            }
        }
        if (this.tokens.isEmpty() || !this.tokens.get(this.tokens.size() - 1).is(EOF)) {
            Token last = this.tokens.isEmpty() ? null : this.tokens.get(this.tokens.size() - 1);
            int line = last != null ? last.getLine() : 1;
            int column = last != null ? last.getColumn() + last.getLexeme().length() : 1;
            this.tokens.add(new Token(EOF, "", null, line, column, 0));
        }
        this.current = this.tokens.get(0);
    }

    /**
     * 便捷方法：解析 token 列表
     */
    public static ParseResult parse(List<Token> tokens) {
        return new Parser(tokens).parse();
    }

    // ============ 基础方法 ============

    Token advance() {
        previous = current;
        if (!isAtEnd()) {
            pos++;
            current = tokens.get(pos);
        }
        return previous;
    }

    /**
     * 向前查看第 n 个 token（0 为当前 token）
     */
    Token peek(int n) {
        int index = Math.min(pos + n, tokens.size() - 1);
        return tokens.get(index);
    }

    boolean check(TokenType type) {
        return current.getType() == type;
    }

    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current, type.name());
    }

    /**
     * 名称位置接受标识符或关键词（关键词大小写不敏感，名称可能恰好与之同名）
     */
    String expectName(String message) {
        if (check(IDENTIFIER) || current.getType().isKeyword()) {
            return advance().getLexeme();
        }
        throw new ParseException(message, current, "IDENTIFIER");
    }

    /**
     * 名称或字符串（FEATURE / SCENARIO 名称两种写法都接受）
     */
    String expectNameOrString(String message) {
        if (check(STRING_LITERAL)) {
            return advance().getValue();
        }
        return expectName(message);
    }

    String expectString(String message) {
        return expect(STRING_LITERAL, message).getValue();
    }

    int expectInteger(String message) {
        Token token = expect(NUMBER_LITERAL, message);
        double value = ((Double) token.getLiteral()).doubleValue();
        if (value != Math.rint(value)) {
            throw new ParseException("Expected an integer", token, "integer");
        }
        return (int) value;
    }

    double expectNumber(String message) {
        return ((Double) expect(NUMBER_LITERAL, message).getLiteral()).doubleValue();
    }

    SourceLocation location() {
        return new SourceLocation(current.getLine(), current.getColumn());
    }

    boolean isAtEnd() {
        return check(EOF);
    }

    /**
     * 是否位于顶层声明起始处（关键词后紧跟名称）
     */
    boolean isTopLevelStart() {
        if (!checkAny(KW_PAGE, KW_PAGEACTIONS, KW_FEATURE)) return false;
        Token next = peek(1);
        return next.is(IDENTIFIER) || next.is(STRING_LITERAL) || next.getType().isKeyword();
    }

    private void recordError(ParseException e) {
        errors.add(new ParseError(e.getMessage(), e.getToken()));
    }

    /**
     * 块结束：缺少右花括号时只记录错误，保留已解析的内容
     */
    private void expectBlockEnd(String owner) {
        if (match(RBRACE)) return;
        recordError(new ParseException("Expected '}' to close " + owner, current, "RBRACE"));
    }

    // ============ 错误恢复 ============

    /**
     * 顶层恢复：跳到下一个顶层声明
     */
    private void synchronizeTopLevel(Token failedAt) {
        if (current == failedAt) advance();
        while (!isAtEnd() && !isTopLevelStart()) {
            advance();
        }
    }

    /**
     * 块内恢复：跳过出错的成员，停在同层的右花括号、顶层声明，
     * 或出错行之后的下一个成员起始关键词
     */
    private void synchronizeMember(Token failedAt, TokenType[] memberStart) {
        int line = failedAt.getLine();
        if (current == failedAt && !check(LBRACE)) advance();
        int depth = 0;
        while (!isAtEnd()) {
            if (isTopLevelStart()) return;
            if (depth == 0 && check(RBRACE)) return;
            if (depth == 0 && current.getLine() > line && checkAny(memberStart)) return;
            if (check(LBRACE)) {
                depth++;
            } else if (check(RBRACE)) {
                depth--;
            }
            advance();
        }
    }

    // ============ 程序解析 ============

    /**
     * 解析整个程序
     */
    public ParseResult parse() {
        SourceLocation loc = location();
        List<PageDecl> pages = new ArrayList<PageDecl>();
        List<PageActionsDecl> pageActions = new ArrayList<PageActionsDecl>();
        List<FeatureDecl> features = new ArrayList<FeatureDecl>();

        while (!isAtEnd()) {
            Token start = current;
            try {
                if (check(KW_PAGE)) {
                    pages.add(parsePage());
                } else if (check(KW_PAGEACTIONS)) {
                    pageActions.add(parsePageActions());
                } else if (check(KW_FEATURE)) {
                    features.add(parseFeature());
                } else {
                    throw new ParseException("Expected a top-level declaration", current,
                            "PAGE, PAGEACTIONS, FEATURE");
                }
            } catch (ParseException e) {
                recordError(e);
                synchronizeTopLevel(start);
            }
        }

        return new ParseResult(new Program(loc, pages, pageActions, features), errors);
    }

    // ============ PAGE ============

    private PageDecl parsePage() {
        SourceLocation loc = location();
        expect(KW_PAGE, "Expected 'PAGE'");
        String name = expectName("Expected page name");
        expect(LBRACE, "Expected '{' after page name");

        List<FieldDecl> fields = new ArrayList<FieldDecl>();
        List<PageVariableDecl> variables = new ArrayList<PageVariableDecl>();
        while (!check(RBRACE) && !isAtEnd() && !isTopLevelStart()) {
            Token start = current;
            try {
                if (check(KW_FIELD)) {
                    fields.add(parseField());
                } else if (isVariableType()) {
                    variables.add(parsePageVariable());
                } else {
                    throw new ParseException("Unexpected token in PAGE '" + name + "'", current,
                            "FIELD, TEXT, NUMBER, FLAG, LIST");
                }
            } catch (ParseException e) {
                recordError(e);
                synchronizeMember(start, PAGE_MEMBER_START);
            }
        }
        expectBlockEnd("PAGE '" + name + "'");
        return new PageDecl(loc, name, fields, variables);
    }

    private FieldDecl parseField() {
        SourceLocation loc = location();
        expect(KW_FIELD, "Expected 'FIELD'");
        String name = expectName("Expected field name");
        expect(EQ, "Expected '=' after field name");
        Selector selector = parseSelector(false);
        return new FieldDecl(loc, name, selector);
    }

    private PageVariableDecl parsePageVariable() {
        SourceLocation loc = location();
        VariableType type = parseVariableType();
        String name = expectName("Expected variable name");
        expect(EQ, "Expected '=' after variable name");
        Expression value = parseExpression();
        return new PageVariableDecl(loc, type, name, value);
    }

    private boolean isVariableType() {
        return checkAny(KW_TEXT, KW_NUMBER, KW_FLAG, KW_LIST);
    }

    private VariableType parseVariableType() {
        Token token = advance();
        switch (token.getType()) {
            case KW_TEXT: return VariableType.TEXT;
            case KW_NUMBER: return VariableType.NUMBER;
            case KW_FLAG: return VariableType.FLAG;
            case KW_LIST: return VariableType.LIST;
            default:
                throw new ParseException("Expected variable type", token, "TEXT, NUMBER, FLAG, LIST");
        }
    }

    // ============ PAGEACTIONS ============

    private PageActionsDecl parsePageActions() {
        SourceLocation loc = location();
        expect(KW_PAGEACTIONS, "Expected 'PAGEACTIONS'");
        String name = expectName("Expected PageActions name");
        expect(KW_FOR, "Expected 'FOR' after PageActions name");
        String forPage = expectName("Expected page name after 'FOR'");
        expect(LBRACE, "Expected '{' after PageActions header");

        List<ActionDecl> actions = new ArrayList<ActionDecl>();
        while (!check(RBRACE) && !isAtEnd() && !isTopLevelStart()) {
            Token start = current;
            try {
                actions.add(parseAction());
            } catch (ParseException e) {
                recordError(e);
                synchronizeMember(start, ACTION_START);
            }
        }
        expectBlockEnd("PAGEACTIONS '" + name + "'");
        return new PageActionsDecl(loc, name, forPage, actions);
    }

    private ActionDecl parseAction() {
        SourceLocation loc = location();
        String name = expectName("Expected action name");
        List<String> parameters = new ArrayList<String>();
        if (match(KW_WITH)) {
            do {
                parameters.add(expectName("Expected parameter name"));
            } while (match(COMMA));
        }
        VariableType returnType = null;
        if (match(KW_RETURNS)) {
            if (!isVariableType()) {
                throw new ParseException("Expected return type", current, "TEXT, NUMBER, FLAG, LIST");
            }
            returnType = parseVariableType();
        }
        List<Statement> body = parseBlock("action '" + name + "'");
        return new ActionDecl(loc, name, parameters, returnType, body);
    }

    // ============ FEATURE ============

    private FeatureDecl parseFeature() {
        SourceLocation loc = location();
        expect(KW_FEATURE, "Expected 'FEATURE'");
        String name = expectNameOrString("Expected feature name");
        expect(LBRACE, "Expected '{' after feature name");

        List<String> uses = new ArrayList<String>();
        List<HookDecl> hooks = new ArrayList<HookDecl>();
        List<ScenarioDecl> scenarios = new ArrayList<ScenarioDecl>();
        while (!check(RBRACE) && !isAtEnd() && !isTopLevelStart()) {
            Token start = current;
            try {
                if (match(KW_USE)) {
                    do {
                        uses.add(expectName("Expected page or PageActions name after 'USE'"));
                    } while (match(COMMA));
                } else if (checkAny(KW_BEFORE, KW_AFTER)) {
                    hooks.add(parseHook());
                } else if (check(KW_SCENARIO)) {
                    scenarios.add(parseScenario());
                } else {
                    throw new ParseException("Unexpected token in FEATURE '" + name + "'", current,
                            "USE, BEFORE, AFTER, SCENARIO");
                }
            } catch (ParseException e) {
                recordError(e);
                synchronizeMember(start, FEATURE_MEMBER_START);
            }
        }
        expectBlockEnd("FEATURE '" + name + "'");
        return new FeatureDecl(loc, name, uses, hooks, scenarios);
    }

    private HookDecl parseHook() {
        SourceLocation loc = location();
        boolean before = advance().is(KW_BEFORE);
        HookDecl.HookType type;
        if (match(KW_ALL)) {
            type = before ? HookDecl.HookType.BEFORE_ALL : HookDecl.HookType.AFTER_ALL;
        } else if (match(KW_EACH)) {
            type = before ? HookDecl.HookType.BEFORE_EACH : HookDecl.HookType.AFTER_EACH;
        } else {
            throw new ParseException("Expected 'ALL' or 'EACH' after hook keyword", current, "ALL, EACH");
        }
        return new HookDecl(loc, type, parseBlock("hook"));
    }

    private ScenarioDecl parseScenario() {
        SourceLocation loc = location();
        expect(KW_SCENARIO, "Expected 'SCENARIO'");
        String name = expectNameOrString("Expected scenario name");
        List<String> tags = new ArrayList<String>();
        while (true) {
            if (check(TAG)) {
                tags.add(advance().getValue());
            } else if (match(AT)) {
                tags.add(expectName("Expected tag name after '@'"));
            } else {
                break;
            }
        }
        List<Statement> body = parseBlock("SCENARIO '" + name + "'");
        return new ScenarioDecl(loc, name, tags, body);
    }

    // ============ 语句 ============

    /**
     * 解析花括号语句块，块内单条语句出错时恢复到下一条语句
     */
    private List<Statement> parseBlock(String owner) {
        expect(LBRACE, "Expected '{' to open " + owner);
        List<Statement> statements = new ArrayList<Statement>();
        while (!check(RBRACE) && !isAtEnd() && !isTopLevelStart()) {
            Token start = current;
            try {
                statements.add(parseStatement());
            } catch (ParseException e) {
                recordError(e);
                synchronizeMember(start, STATEMENT_START);
            }
        }
        expectBlockEnd(owner);
        return statements;
    }

    Statement parseStatement() {
        SourceLocation loc = location();
        switch (current.getType()) {
            case KW_CLICK:
                advance();
                return new ClickStmt(loc, parseTarget(false), ClickStmt.ClickType.NORMAL);
            case KW_RIGHT:
                advance();
                expect(KW_CLICK, "Expected 'CLICK' after 'RIGHT'");
                return new ClickStmt(loc, parseTarget(false), ClickStmt.ClickType.RIGHT);
            case KW_DOUBLE:
                advance();
                expect(KW_CLICK, "Expected 'CLICK' after 'DOUBLE'");
                return new ClickStmt(loc, parseTarget(false), ClickStmt.ClickType.DOUBLE);
            case KW_FORCE:
                advance();
                expect(KW_CLICK, "Expected 'CLICK' after 'FORCE'");
                return new ClickStmt(loc, parseTarget(false), ClickStmt.ClickType.FORCE);
            case KW_DRAG: {
                advance();
                Target source = parseTarget(false);
                expect(KW_TO, "Expected 'TO' in DRAG");
                return new DragStmt(loc, source, parseTarget(false));
            }
            case KW_FILL: {
                advance();
                Target target = parseTarget(false);
                expect(KW_WITH, "Expected 'WITH' in FILL");
                return new FillStmt(loc, target, parseExpression());
            }
            case KW_CLEAR:
                advance();
                if (match(KW_COOKIES)) return new ClearCookiesStmt(loc);
                if (match(KW_STORAGE)) return new ClearStorageStmt(loc);
                return new ClearStmt(loc, parseTarget(false));
            case KW_SELECT: {
                advance();
                Expression option = parseExpression();
                expect(KW_FROM, "Expected 'FROM' in SELECT");
                return new SelectStmt(loc, option, parseTarget(false));
            }
            case KW_CHECK:
                advance();
                return new CheckStmt(loc, parseTarget(false), true);
            case KW_UNCHECK:
                advance();
                return new CheckStmt(loc, parseTarget(false), false);
            case KW_HOVER:
                advance();
                return new HoverStmt(loc, parseTarget(false));
            case KW_PRESS:
                advance();
                return new PressStmt(loc, parseExpression());
            case KW_SCROLL:
                return parseScroll();
            case KW_UPLOAD: {
                advance();
                List<Expression> files = new ArrayList<Expression>();
                do {
                    files.add(parseExpression());
                } while (match(COMMA));
                expect(KW_TO, "Expected 'TO' in UPLOAD");
                return new UploadStmt(loc, files, parseTarget(false));
            }
            case KW_DOWNLOAD: {
                advance();
                expect(KW_FROM, "Expected 'FROM' after 'DOWNLOAD'");
                Target target = parseTarget(false);
                Expression saveAs = match(KW_AS) ? parseExpression() : null;
                return new DownloadStmt(loc, target, saveAs);
            }
            case KW_OPEN:
                advance();
                return new OpenStmt(loc, parseExpression());
            case KW_REFRESH:
                advance();
                return new RefreshStmt(loc);
            case KW_WAIT:
                return parseWait();
            case KW_SWITCH:
                return parseSwitch();
            case KW_CLOSE:
                advance();
                expect(KW_TAB, "Expected 'TAB' after 'CLOSE'");
                return new CloseTabStmt(loc);
            case KW_ACCEPT: {
                advance();
                expect(KW_DIALOG, "Expected 'DIALOG' after 'ACCEPT'");
                Expression prompt = match(KW_WITH) ? parseExpression() : null;
                return new AcceptDialogStmt(loc, prompt);
            }
            case KW_DISMISS:
                advance();
                expect(KW_DIALOG, "Expected 'DIALOG' after 'DISMISS'");
                return new DismissDialogStmt(loc);
            case KW_SET:
                return parseSet();
            case KW_LOG:
                advance();
                return new LogStmt(loc, parseExpression());
            case KW_TAKE:
                return parseTakeScreenshot();
            case KW_VERIFY:
                return parseVerify();
            case KW_IF:
                return parseIf();
            case KW_REPEAT: {
                advance();
                Expression times = parseExpression();
                expect(KW_TIMES, "Expected 'TIMES' after repeat count");
                return new RepeatStmt(loc, times, parseBlock("REPEAT"));
            }
            case KW_FOR: {
                advance();
                expect(KW_EACH, "Expected 'EACH' after 'FOR'");
                String item = expectName("Expected loop variable name");
                expect(KW_IN, "Expected 'IN' in FOR EACH");
                VariableRef collection = parseVariableRef();
                return new ForEachStmt(loc, item, collection, parseBlock("FOR EACH"));
            }
            case KW_TRY: {
                advance();
                List<Statement> tryBody = parseBlock("TRY");
                expect(KW_CATCH, "Expected 'CATCH' after TRY block");
                return new TryCatchStmt(loc, tryBody, parseBlock("CATCH"));
            }
            case KW_PERFORM:
                return parsePerform();
            case KW_TEXT:
            case KW_NUMBER:
            case KW_FLAG:
            case KW_LIST:
                return parseVariableDecl();
            case KW_RETURN:
                return parseReturn();
            case KW_LOAD:
                return parseLoad();
            case KW_ROW:
                return parseRow();
            case KW_ROWS:
                return parseRows();
            case KW_COUNT: {
                advance();
                String variable = expectName("Expected variable name after 'COUNT'");
                expectAssignOrFrom();
                return parseCountQuery(loc, variable);
            }
            default:
                throw new ParseException("Unexpected token in statement position", current, "statement");
        }
    }

    private Statement parseScroll() {
        SourceLocation loc = location();
        advance();
        if (match(KW_UP)) return new ScrollStmt(loc, ScrollStmt.Direction.UP, null);
        if (match(KW_DOWN)) return new ScrollStmt(loc, ScrollStmt.Direction.DOWN, null);
        if (match(KW_TO)) return new ScrollStmt(loc, ScrollStmt.Direction.TO, parseTarget(false));
        throw new ParseException("Expected scroll direction", current, "UP, DOWN, TO");
    }

    private Statement parseWait() {
        SourceLocation loc = location();
        advance();
        if (match(KW_FOR)) {
            if (match(KW_NAVIGATION)) return new WaitForNavigationStmt(loc);
            if (match(KW_NETWORK)) {
                expect(KW_IDLE, "Expected 'IDLE' after 'NETWORK'");
                return new WaitForNetworkIdleStmt(loc);
            }
            if (match(KW_URL)) {
                TextMatch textMatch = parseTextMatch(false);
                return new WaitForUrlStmt(loc, textMatch, parseExpression());
            }
            return new WaitForElementStmt(loc, parseTarget(false));
        }
        if (!isExpressionStart()) {
            return new WaitForNetworkIdleStmt(loc);
        }
        Expression duration = parseExpression();
        boolean milliseconds = false;
        if (match(KW_MILLISECONDS)) {
            milliseconds = true;
        } else {
            match(KW_SECONDS);
        }
        return new WaitStmt(loc, duration, milliseconds);
    }

    private Statement parseSwitch() {
        SourceLocation loc = location();
        advance();
        expect(KW_TO, "Expected 'TO' after 'SWITCH'");
        if (match(KW_NEW)) {
            expect(KW_TAB, "Expected 'TAB' after 'NEW'");
            Expression url = isExpressionStart() ? parseExpression() : null;
            return new SwitchToNewTabStmt(loc, url);
        }
        if (match(KW_TAB)) {
            return new SwitchToTabStmt(loc, parseExpression());
        }
        if (match(KW_FRAME)) {
            return new SwitchToFrameStmt(loc, parseSelector(false));
        }
        if (match(KW_MAIN)) {
            expect(KW_FRAME, "Expected 'FRAME' after 'MAIN'");
            return new SwitchToMainFrameStmt(loc);
        }
        throw new ParseException("Expected switch destination", current, "NEW TAB, TAB, FRAME, MAIN FRAME");
    }

    private Statement parseSet() {
        SourceLocation loc = location();
        advance();
        if (match(KW_COOKIE)) {
            Expression name = parseExpression();
            expect(KW_TO, "Expected 'TO' in SET COOKIE");
            return new SetCookieStmt(loc, name, parseExpression());
        }
        if (match(KW_STORAGE)) {
            Expression key = parseExpression();
            expect(KW_TO, "Expected 'TO' in SET STORAGE");
            return new SetStorageStmt(loc, key, parseExpression());
        }
        throw new ParseException("Expected 'COOKIE' or 'STORAGE' after 'SET'", current, "COOKIE, STORAGE");
    }

    private Statement parseTakeScreenshot() {
        SourceLocation loc = location();
        advance();
        expect(KW_SCREENSHOT, "Expected 'SCREENSHOT' after 'TAKE'");
        Target target = null;
        if (isSelectorKeyword() || check(IDENTIFIER)) {
            target = parseTarget(false);
        }
        String fileName = null;
        if (match(KW_AS)) {
            fileName = expectString("Expected screenshot file name after 'AS'");
        } else if (check(STRING_LITERAL)) {
            fileName = advance().getValue();
        }
        return new TakeScreenshotStmt(loc, target, fileName);
    }

    // ============ VERIFY ============

    private Statement parseVerify() {
        SourceLocation loc = location();
        advance();

        if (match(KW_URL)) {
            TextMatch textMatch = parseTextMatch(true);
            return new VerifyUrlStmt(loc, textMatch, parseExpression());
        }
        if (match(KW_TITLE)) {
            TextMatch textMatch = parseTextMatch(false);
            return new VerifyTitleStmt(loc, textMatch, parseExpression());
        }
        if (match(KW_SCREENSHOT)) {
            String name = parseScreenshotName();
            return new VerifyScreenshotStmt(loc, null, name, parseScreenshotSettings());
        }

        Target target = parseTarget(true);
        if (match(KW_IS)) {
            boolean negated = match(KW_NOT);
            if (checkAny(KW_TRUE, KW_FALSE)) {
                boolean value = advance().is(KW_TRUE);
                return new VerifyFlagStmt(loc, toVariable(target), value != negated);
            }
            return new VerifyStateStmt(loc, target, parseElementState(), negated);
        }
        if (match(KW_NOT)) {
            expect(KW_CONTAINS, "Expected 'CONTAINS' after 'NOT'");
            return new VerifyContainsStmt(loc, target, parseExpression(), true);
        }
        if (match(KW_CONTAINS)) {
            return new VerifyContainsStmt(loc, target, parseExpression(), false);
        }
        if (match(KW_HAS)) {
            if (match(KW_ATTRIBUTE)) {
                Expression attribute = parseExpression();
                expect(EQ, "Expected '=' after attribute name");
                return new VerifyAttributeStmt(loc, target, attribute, parseExpression());
            }
            VerifyPropertyStmt.Property property;
            if (match(KW_COUNT)) {
                property = VerifyPropertyStmt.Property.COUNT;
            } else if (match(KW_VALUE)) {
                property = VerifyPropertyStmt.Property.VALUE;
            } else if (match(KW_TEXT)) {
                property = VerifyPropertyStmt.Property.TEXT;
            } else if (match(KW_CLASS)) {
                property = VerifyPropertyStmt.Property.CLASS;
            } else {
                throw new ParseException("Expected property after 'HAS'", current,
                        "COUNT, VALUE, TEXT, CLASS, ATTRIBUTE");
            }
            return new VerifyPropertyStmt(loc, target, property, parseExpression());
        }
        if (match(KW_MATCHES)) {
            expect(KW_SCREENSHOT, "Expected 'SCREENSHOT' after 'MATCHES'");
            String name = parseScreenshotName();
            return new VerifyScreenshotStmt(loc, target, name, parseScreenshotSettings());
        }
        if (match(KW_EQUALS)) {
            return new VerifyEqualsStmt(loc, toVariable(target), parseExpression());
        }
        throw new ParseException("Expected assertion after VERIFY target", current,
                "IS, CONTAINS, HAS, MATCHES, EQUALS");
    }

    private VariableRef toVariable(Target target) {
        if (target.isSelector()) {
            throw new ParseException("Expected a variable, not a selector", previous, "variable");
        }
        return new VariableRef(target.getLocation(), target.getPageName(), target.getFieldName());
    }

    private TextMatch parseTextMatch(boolean allowMatches) {
        if (match(KW_CONTAINS)) return TextMatch.CONTAINS;
        if (match(KW_IS)) return TextMatch.IS;
        if (allowMatches && match(KW_MATCHES)) return TextMatch.MATCHES;
        throw new ParseException("Expected comparison", current,
                allowMatches ? "CONTAINS, IS, MATCHES" : "CONTAINS, IS");
    }

    private ElementState parseElementState() {
        Token token = advance();
        switch (token.getType()) {
            case KW_VISIBLE: return ElementState.VISIBLE;
            case KW_HIDDEN: return ElementState.HIDDEN;
            case KW_ENABLED: return ElementState.ENABLED;
            case KW_DISABLED: return ElementState.DISABLED;
            case KW_CHECKED: return ElementState.CHECKED;
            case KW_FOCUSED: return ElementState.FOCUSED;
            case KW_EMPTY: return ElementState.EMPTY;
            default:
                throw new ParseException("Expected element state", token,
                        "VISIBLE, HIDDEN, ENABLED, DISABLED, CHECKED, FOCUSED, EMPTY");
        }
    }

    private String parseScreenshotName() {
        if (match(KW_AS)) {
            return expectString("Expected screenshot name after 'AS'");
        }
        return null;
    }

    private ScreenshotSettings parseScreenshotSettings() {
        VisualPreset preset = null;
        Double threshold = null;
        Integer maxDiffPixels = null;
        Double maxDiffRatio = null;
        while (true) {
            if (check(KW_WITH) && peek(1).isOneOf(KW_STRICT, KW_BALANCED, KW_RELAXED)) {
                advance();
                Token presetToken = advance();
                preset = VisualPreset.valueOf(presetToken.getType().name().substring(3));
            } else if (match(KW_THRESHOLD)) {
                threshold = Double.valueOf(expectNumber("Expected number after 'THRESHOLD'"));
            } else if (match(KW_MAX_DIFF_PIXELS)) {
                maxDiffPixels = Integer.valueOf(expectInteger("Expected integer after 'MAX_DIFF_PIXELS'"));
            } else if (match(KW_MAX_DIFF_RATIO)) {
                maxDiffRatio = Double.valueOf(expectNumber("Expected number after 'MAX_DIFF_RATIO'"));
            } else {
                break;
            }
        }
        if (preset == null && threshold == null && maxDiffPixels == null && maxDiffRatio == null) {
            return ScreenshotSettings.NONE;
        }
        return new ScreenshotSettings(preset, threshold, maxDiffPixels, maxDiffRatio);
    }

    // ============ 控制流 ============

    private Statement parseIf() {
        SourceLocation loc = location();
        expect(KW_IF, "Expected 'IF'");
        Condition condition = parseCondition();
        List<Statement> thenBranch = parseBlock("IF");
        List<Statement> elseBranch = Collections.emptyList();
        if (match(KW_ELSE)) {
            if (check(KW_IF)) {
                elseBranch = Collections.singletonList(parseIf());
            } else {
                elseBranch = parseBlock("ELSE");
            }
        }
        return new IfStmt(loc, condition, thenBranch, elseBranch);
    }

    private Condition parseCondition() {
        SourceLocation loc = location();
        if (match(KW_NOT)) {
            return new NotCondition(loc, parseCondition());
        }
        if (isSelectorKeyword()) {
            Target target = parseTarget(false);
            expect(KW_IS, "Expected 'IS' after condition target");
            boolean negated = match(KW_NOT);
            return new ElementStateCondition(loc, target, parseElementState(), negated);
        }

        Expression left = parseExpression();
        if (match(KW_IS)) {
            boolean negated = match(KW_NOT);
            if (checkAny(KW_TRUE, KW_FALSE)) {
                Expression right = parseExpression();
                return new ComparisonCondition(loc, left, negated ? ComparisonOperator.NE : ComparisonOperator.EQ, right);
            }
            Target target = expressionToTarget(left);
            return new ElementStateCondition(loc, target, parseElementState(), negated);
        }
        if (current.getType().isComparison()) {
            ComparisonOperator operator = parseComparisonOperator();
            return new ComparisonCondition(loc, left, operator, parseExpression());
        }
        if (match(KW_CONTAINS)) {
            return new ContainsCondition(loc, left, parseExpression());
        }
        if (left instanceof VariableRef) {
            return new TruthCondition(loc, (VariableRef) left);
        }
        throw new ParseException("Expected condition", current, "IS, CONTAINS, comparison operator");
    }

    private Target expressionToTarget(Expression expression) {
        if (expression instanceof StringLiteral) {
            String value = ((StringLiteral) expression).getValue();
            return Target.selector(new Selector(expression.getLocation(), detectSelectorType(value), value,
                    null, Collections.<SelectorModifier>emptyList()));
        }
        if (expression instanceof VariableRef) {
            VariableRef ref = (VariableRef) expression;
            return ref.isQualified()
                    ? Target.pageField(ref.getLocation(), ref.getPageName(), ref.getName())
                    : Target.field(ref.getLocation(), ref.getName());
        }
        throw new ParseException("Expected an element before 'IS'", previous, "selector or field");
    }

    private ComparisonOperator parseComparisonOperator() {
        Token token = advance();
        switch (token.getType()) {
            case EQ:
            case EQ_EQ:
                return ComparisonOperator.EQ;
            case NE: return ComparisonOperator.NE;
            case GT: return ComparisonOperator.GT;
            case LT: return ComparisonOperator.LT;
            case GE: return ComparisonOperator.GE;
            case LE: return ComparisonOperator.LE;
            default:
                throw new ParseException("Expected comparison operator", token, "=, ==, !=, >, <, >=, <=");
        }
    }

    // ============ PERFORM / 变量 / RETURN ============

    private PerformStmt parsePerform() {
        SourceLocation loc = location();
        expect(KW_PERFORM, "Expected 'PERFORM'");
        String first = expectName("Expected action name after 'PERFORM'");
        String blockName = null;
        String actionName = first;
        if (match(DOT)) {
            blockName = first;
            actionName = expectName("Expected action name after '.'");
        }
        List<Expression> arguments = new ArrayList<Expression>();
        if (match(KW_WITH)) {
            do {
                arguments.add(parseExpression());
            } while (match(COMMA));
        }
        return new PerformStmt(loc, blockName, actionName, arguments);
    }

    private Statement parseVariableDecl() {
        SourceLocation loc = location();
        VariableType type = parseVariableType();
        String name = expectName("Expected variable name");
        expect(EQ, "Expected '=' after variable name");
        if (check(KW_PERFORM)) {
            return new PerformAssignStmt(loc, type, name, parsePerform());
        }
        if (match(KW_COUNT)) {
            return parseCountQuery(loc, name);
        }
        return new VariableDeclStmt(loc, type, name, parseExpression());
    }

    private Statement parseReturn() {
        SourceLocation loc = location();
        expect(KW_RETURN, "Expected 'RETURN'");
        if (checkAny(KW_VISIBLE, KW_TEXT, KW_VALUE) && peek(1).is(KW_OF)) {
            Token kind = advance();
            advance();
            Target target = parseTarget(false);
            ReturnStmt.ReturnKind returnKind = kind.is(KW_VISIBLE) ? ReturnStmt.ReturnKind.VISIBLE
                    : kind.is(KW_TEXT) ? ReturnStmt.ReturnKind.TEXT : ReturnStmt.ReturnKind.VALUE;
            return new ReturnStmt(loc, returnKind, null, target);
        }
        if (isExpressionStart()) {
            return new ReturnStmt(loc, ReturnStmt.ReturnKind.EXPRESSION, parseExpression(), null);
        }
        return new ReturnStmt(loc, ReturnStmt.ReturnKind.NONE, null, null);
    }

    // ============ 数据查询 ============

    private Statement parseLoad() {
        SourceLocation loc = location();
        expect(KW_LOAD, "Expected 'LOAD'");
        String variable = expectName("Expected variable name after 'LOAD'");
        expect(KW_FROM, "Expected 'FROM' in LOAD");
        String table = expectNameOrString("Expected table name after 'FROM'");
        QueryCondition where = match(KW_WHERE) ? parseQueryCondition() : null;
        return new LoadStmt(loc, variable, table, where);
    }

    private Statement parseRow() {
        SourceLocation loc = location();
        expect(KW_ROW, "Expected 'ROW'");
        String variable = expectName("Expected variable name after 'ROW'");
        expectAssignOrFrom();
        RowPosition position = null;
        if (match(KW_FIRST)) {
            position = RowPosition.FIRST;
        } else if (match(KW_LAST)) {
            position = RowPosition.LAST;
        } else if (match(KW_RANDOM)) {
            position = RowPosition.RANDOM;
        }
        TableRef table = parseTableRef();
        QueryCondition where = match(KW_WHERE) ? parseQueryCondition() : null;
        List<OrderBy> orderBy = parseOrderBy();
        return new RowStmt(loc, variable, position, table, where, orderBy);
    }

    private Statement parseRows() {
        SourceLocation loc = location();
        expect(KW_ROWS, "Expected 'ROWS'");
        String variable = expectName("Expected variable name after 'ROWS'");
        expectAssignOrFrom();
        TableRef table = parseTableRef();
        QueryCondition where = match(KW_WHERE) ? parseQueryCondition() : null;
        List<OrderBy> orderBy = parseOrderBy();
        Integer limit = null;
        Integer offset = null;
        if (match(KW_LIMIT)) {
            limit = Integer.valueOf(expectInteger("Expected integer after 'LIMIT'"));
        }
        if (match(KW_OFFSET)) {
            offset = Integer.valueOf(expectInteger("Expected integer after 'OFFSET'"));
        }
        return new RowsStmt(loc, variable, table, where, orderBy, limit, offset);
    }

    private Statement parseCountQuery(SourceLocation loc, String variable) {
        TableRef table = parseTableRef();
        QueryCondition where = match(KW_WHERE) ? parseQueryCondition() : null;
        return new CountStmt(loc, variable, table, where);
    }

    private void expectAssignOrFrom() {
        if (!match(EQ) && !match(KW_FROM)) {
            throw new ParseException("Expected '=' or 'FROM'", current, "=, FROM");
        }
    }

    private TableRef parseTableRef() {
        String first = expectName("Expected table name");
        if (match(DOT)) {
            return new TableRef(first, expectName("Expected table name after '.'"));
        }
        return new TableRef(null, first);
    }

    private List<OrderBy> parseOrderBy() {
        List<OrderBy> result = new ArrayList<OrderBy>();
        if (!match(KW_ORDER)) return result;
        expect(KW_BY, "Expected 'BY' after 'ORDER'");
        do {
            String column = expectName("Expected column name in ORDER BY");
            boolean descending = false;
            if (match(KW_DESC)) {
                descending = true;
            } else {
                match(KW_ASC);
            }
            result.add(new OrderBy(column, descending));
        } while (match(COMMA));
        return result;
    }

    /** 优先级：NOT > AND > OR */
    private QueryCondition parseQueryCondition() {
        QueryCondition left = parseQueryAnd();
        while (check(KW_OR)) {
            SourceLocation loc = location();
            advance();
            left = new QueryLogical(loc, QueryLogical.Kind.OR, left, parseQueryAnd());
        }
        return left;
    }

    private QueryCondition parseQueryAnd() {
        QueryCondition left = parseQueryUnary();
        while (check(KW_AND)) {
            SourceLocation loc = location();
            advance();
            left = new QueryLogical(loc, QueryLogical.Kind.AND, left, parseQueryUnary());
        }
        return left;
    }

    private QueryCondition parseQueryUnary() {
        SourceLocation loc = location();
        if (match(KW_NOT)) {
            return new QueryNot(loc, parseQueryUnary());
        }
        return parseQueryPrimary();
    }

    private QueryCondition parseQueryPrimary() {
        SourceLocation loc = location();
        if (match(LPAREN)) {
            QueryCondition inner = parseQueryCondition();
            expect(RPAREN, "Expected ')' to close condition group");
            return inner;
        }
        String column = expectName("Expected column name in WHERE clause");
        if (match(KW_IS)) {
            boolean negated = match(KW_NOT);
            expect(KW_EMPTY, "Expected 'EMPTY' after 'IS'");
            return new QueryEmpty(loc, column, negated);
        }
        if (match(KW_CONTAINS)) {
            return new QueryContains(loc, column, parseExpression());
        }
        if (match(KW_IN)) {
            expect(LBRACKET, "Expected '[' after 'IN'");
            List<Expression> values = new ArrayList<Expression>();
            if (!check(RBRACKET)) {
                do {
                    values.add(parseExpression());
                } while (match(COMMA));
            }
            expect(RBRACKET, "Expected ']' to close value list");
            return new QueryIn(loc, column, values);
        }
        if (current.getType().isComparison()) {
            ComparisonOperator operator = parseComparisonOperator();
            return new QueryComparison(loc, column, operator, parseExpression());
        }
        throw new ParseException("Expected operator in WHERE clause", current,
                "=, !=, >, <, >=, <=, CONTAINS, IS EMPTY, IN");
    }

    // ============ 目标与选择器 ============

    private boolean isSelectorKeyword() {
        return checkAny(KW_CSS, KW_ROLE, KW_TEXT, KW_TESTID, KW_LABEL, KW_PLACEHOLDER);
    }

    /**
     * 解析动作目标
     *
     * @param verifyContext 为 true 时 HAS COUNT/VALUE/TEXT/CLASS/ATTRIBUTE 属于断言而非修饰符
     */
    Target parseTarget(boolean verifyContext) {
        if (isSelectorKeyword() || check(STRING_LITERAL)) {
            return Target.selector(parseSelector(verifyContext));
        }
        if (check(IDENTIFIER)) {
            SourceLocation loc = location();
            String first = advance().getLexeme();
            if (match(DOT)) {
                String field = expectName("Expected field name after '.'");
                return Target.pageField(loc, first, field);
            }
            return Target.field(loc, first);
        }
        throw new ParseException("Expected target", current, "Page.field, field name or selector");
    }

    Selector parseSelector(boolean verifyContext) {
        Selector base = parseBaseSelector();
        List<SelectorModifier> modifiers = parseModifiers(verifyContext);
        return new Selector(base.getLocation(), base.getSelectorType(), base.getValue(),
                base.getNameParam(), modifiers);
    }

    private Selector parseBaseSelector() {
        SourceLocation loc = location();
        SelectorType type;
        String value;
        if (check(STRING_LITERAL)) {
            value = advance().getValue();
            type = detectSelectorType(value);
        } else {
            Token typeToken = advance();
            switch (typeToken.getType()) {
                case KW_CSS: type = SelectorType.CSS; break;
                case KW_ROLE: type = SelectorType.ROLE; break;
                case KW_TEXT: type = SelectorType.TEXT; break;
                case KW_TESTID: type = SelectorType.TESTID; break;
                case KW_LABEL: type = SelectorType.LABEL; break;
                case KW_PLACEHOLDER: type = SelectorType.PLACEHOLDER; break;
                default:
                    throw new ParseException("Expected selector", typeToken,
                            "css, role, text, testid, label, placeholder or string");
            }
            value = expectString("Expected selector value");
        }
        String nameParam = null;
        if (match(KW_NAME)) {
            nameParam = expectString("Expected accessible name after 'NAME'");
        }
        return new Selector(loc, type, value, nameParam, null);
    }

    private List<SelectorModifier> parseModifiers(boolean verifyContext) {
        List<SelectorModifier> modifiers = new ArrayList<SelectorModifier>();
        while (true) {
            SourceLocation loc = location();
            if (match(KW_FIRST)) {
                modifiers.add(new FirstModifier(loc));
            } else if (match(KW_LAST)) {
                modifiers.add(new LastModifier(loc));
            } else if (match(KW_NTH)) {
                modifiers.add(new NthModifier(loc, expectInteger("Expected index after 'NTH'")));
            } else if (check(KW_WITH) && peek(1).is(KW_TEXT) && peek(2).is(STRING_LITERAL)) {
                advance();
                advance();
                modifiers.add(new WithTextModifier(loc, advance().getValue()));
            } else if (match(KW_WITHOUT)) {
                expect(KW_TEXT, "Expected 'TEXT' after 'WITHOUT'");
                modifiers.add(new WithoutTextModifier(loc, expectString("Expected text after 'WITHOUT TEXT'")));
            } else if (check(KW_HAS) && isHasModifierAhead(verifyContext)) {
                advance();
                if (match(KW_NOT)) {
                    modifiers.add(new HasNotModifier(loc, parseBaseSelector()));
                } else {
                    modifiers.add(new HasModifier(loc, parseBaseSelector()));
                }
            } else {
                break;
            }
        }
        return modifiers;
    }

    private boolean isHasModifierAhead(boolean verifyContext) {
        Token next = peek(1);
        if (next.is(KW_NOT)) return true;
        if (verifyContext && next.isOneOf(KW_COUNT, KW_VALUE, KW_TEXT, KW_CLASS, KW_ATTRIBUTE)) {
            return false;
        }
        return next.isOneOf(KW_CSS, KW_ROLE, KW_TEXT, KW_TESTID, KW_LABEL, KW_PLACEHOLDER, STRING_LITERAL);
    }

    /**
     * 裸字符串选择器的类型推断：像 CSS/XPath 的按 CSS 处理，否则按可见文本处理
     */
    static SelectorType detectSelectorType(String value) {
        if (value.startsWith("#") || value.startsWith(".")) return SelectorType.CSS;
        if (value.startsWith("[") && value.contains("]")) return SelectorType.CSS;
        if (value.startsWith("//") || value.startsWith("/html")) return SelectorType.CSS;
        if (value.contains(">") || value.contains("~") || value.contains("+")) return SelectorType.CSS;
        if (value.contains(":") && CSS_PSEUDO.matcher(value).find()) return SelectorType.CSS;
        if (CSS_TAG_PREFIX.matcher(value).find()) return SelectorType.CSS;
        return SelectorType.TEXT;
    }

    // ============ 表达式 ============

    private boolean isExpressionStart() {
        return checkAny(STRING_LITERAL, NUMBER_LITERAL, KW_TRUE, KW_FALSE, ENV_VAR, IDENTIFIER, LBRACKET);
    }

    Expression parseExpression() {
        SourceLocation loc = location();
        switch (current.getType()) {
            case STRING_LITERAL:
                return new StringLiteral(loc, advance().getValue());
            case NUMBER_LITERAL:
                return new NumberLiteral(loc, ((Double) advance().getLiteral()).doubleValue());
            case KW_TRUE:
                advance();
                return new BooleanLiteral(loc, true);
            case KW_FALSE:
                advance();
                return new BooleanLiteral(loc, false);
            case ENV_VAR:
                return new EnvVarRef(loc, advance().getValue());
            case LBRACKET: {
                advance();
                List<Expression> elements = new ArrayList<Expression>();
                if (!check(RBRACKET)) {
                    do {
                        elements.add(parseExpression());
                    } while (match(COMMA));
                }
                expect(RBRACKET, "Expected ']' to close list");
                return new ListLiteral(loc, elements);
            }
            case IDENTIFIER:
                return parseVariableRef();
            default:
                throw new ParseException("Expected expression", current,
                        "string, number, boolean, variable or {{env}}");
        }
    }

    private VariableRef parseVariableRef() {
        SourceLocation loc = location();
        String first = expect(IDENTIFIER, "Expected variable name").getLexeme();
        if (match(DOT)) {
            return new VariableRef(loc, first, expectName("Expected member name after '.'"));
        }
        return new VariableRef(loc, null, first);
    }
}

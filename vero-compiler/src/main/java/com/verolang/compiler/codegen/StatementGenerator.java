package com.verolang.compiler.codegen;

import com.verolang.compiler.ast.ElementState;
import com.verolang.compiler.ast.TextMatch;
import com.verolang.compiler.ast.VariableType;
import com.verolang.compiler.ast.cond.ComparisonCondition;
import com.verolang.compiler.ast.cond.Condition;
import com.verolang.compiler.ast.cond.ContainsCondition;
import com.verolang.compiler.ast.cond.ElementStateCondition;
import com.verolang.compiler.ast.cond.NotCondition;
import com.verolang.compiler.ast.cond.TruthCondition;
import com.verolang.compiler.ast.decl.ActionDecl;
import com.verolang.compiler.ast.decl.PageActionsDecl;
import com.verolang.compiler.ast.expr.BooleanLiteral;
import com.verolang.compiler.ast.expr.Expression;
import com.verolang.compiler.ast.expr.ListLiteral;
import com.verolang.compiler.ast.expr.NumberLiteral;
import com.verolang.compiler.ast.expr.StringLiteral;
import com.verolang.compiler.ast.query.RowPosition;
import com.verolang.compiler.ast.selector.Selector;
import com.verolang.compiler.ast.selector.SelectorType;
import com.verolang.compiler.ast.stmt.*;

import java.util.ArrayList;
import java.util.List;

/**
 * 语句 → TypeScript 语句
 * <p>
 * 每个 visit 方法向上下文的 writer 写出完整的语句行；
 * {@link #emitBody} 负责 test.step 包装与调试插桩。
 */
final class StatementGenerator implements StatementVisitor<Void, GenContext> {

    static final StatementGenerator INSTANCE = new StatementGenerator();

    private static final String ESCAPE_REGEX = ".replace(/[.*+?^${}()|[\\]\\\\/]/g, '\\\\$&')";

    // ============ 语句体 ============

    /**
     * 输出语句序列
     *
     * @param wrapSteps 顶层场景/钩子语句包装为 test.step
     */
    void emitBody(List<Statement> statements, GenContext ctx, boolean wrapSteps) {
        for (Statement statement : statements) {
            emitStatement(statement, ctx, wrapSteps);
        }
    }

    private void emitStatement(Statement statement, GenContext ctx, boolean wrapStep) {
        boolean scoped = isScoped(statement);
        if (!ctx.isInstrumented() && (!wrapStep || scoped)) {
            statement.accept(this, ctx);
            return;
        }

        StepDescriber.StepInfo info = StepDescriber.describe(statement);
        CodeWriter buffer = ctx.newBuffer();
        GenContext buffered = ctx.withWriter(buffer);
        if (ctx.isInstrumented()) {
            instrument(statement, info, buffered, scoped);
        } else {
            statement.accept(this, buffered);
        }
        ctx.frameRef = buffered.frameRef;

        String code = buffer.getOutput();
        if (!wrapStep || scoped) {
            ctx.writer.lines(code);
            return;
        }
        String title = TsSyntax.quote(info.title);
        String trimmed = code.endsWith("\n") ? code.substring(0, code.length() - 1) : code;
        if (!trimmed.contains("\n")) {
            ctx.writer.line("await test.step(" + title + ", async () => { " + trimmed + " });");
        } else {
            ctx.writer.line("await test.step(" + title + ", async () => {");
            ctx.writer.indent();
            ctx.writer.lines(code);
            ctx.writer.dedent();
            ctx.writer.line("});");
        }
    }

    private void instrument(Statement statement, StepDescriber.StepInfo info, GenContext ctx, boolean scoped) {
        int line = statement.getLine();
        String start = ctx.unit.temp("t");
        CodeWriter w = ctx.writer;
        w.line(DebugInstrumentation.beforeStep(line, info));
        w.line("const " + start + " = Date.now();");
        if (scoped) {
            statement.accept(this, ctx);
            w.line(DebugInstrumentation.afterStep(line, info, true, start));
            String declared = declaredName(statement);
            if (declared != null) {
                w.line(DebugInstrumentation.variable(declared));
            }
            return;
        }
        w.line("try {");
        w.indent();
        statement.accept(this, ctx);
        w.line(DebugInstrumentation.afterStep(line, info, true, start));
        w.dedent();
        w.line("} catch (e) {");
        w.indent();
        w.line(DebugInstrumentation.afterStep(line, info, false, start));
        w.line("throw e;");
        w.dedent();
        w.line("}");
    }

    /**
     * 声明变量或改变后续语句上下文的语句，不能放进回调或 try 块
     */
    private static boolean isScoped(Statement statement) {
        return declaredName(statement) != null
                || statement instanceof SwitchToFrameStmt
                || statement instanceof SwitchToMainFrameStmt;
    }

    private static String declaredName(Statement statement) {
        if (statement instanceof VariableDeclStmt) return ((VariableDeclStmt) statement).getName();
        if (statement instanceof PerformAssignStmt) return ((PerformAssignStmt) statement).getName();
        if (statement instanceof LoadStmt) return ((LoadStmt) statement).getVariable();
        if (statement instanceof RowStmt) return ((RowStmt) statement).getVariable();
        if (statement instanceof RowsStmt) return ((RowsStmt) statement).getVariable();
        if (statement instanceof CountStmt) return ((CountStmt) statement).getVariable();
        return null;
    }

    // ============ 辅助方法 ============

    private static String target(GenContext ctx, Target target) {
        return NameResolver.target(ctx, target);
    }

    private static String expr(GenContext ctx, Expression expression) {
        return ExpressionCompiler.compile(ctx, expression);
    }

    private static String text(GenContext ctx, Expression expression) {
        return ExpressionCompiler.compileText(ctx, expression);
    }

    private static String regexLiteral(String value) {
        StringBuilder sb = new StringBuilder("/");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (".*+?^${}()|[]\\/".indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.append('/').toString();
    }

    /**
     * 包含匹配：字面量在编译期转义为正则，其他表达式在运行期转义
     */
    private static String containsPattern(GenContext ctx, Expression value) {
        if (value instanceof StringLiteral && !TsSyntax.hasPlaceholders(((StringLiteral) value).getValue())) {
            return regexLiteral(((StringLiteral) value).getValue());
        }
        return "new RegExp(" + text(ctx, value) + ESCAPE_REGEX + ")";
    }

    private static String textMatchArgument(GenContext ctx, TextMatch match, Expression value) {
        switch (match) {
            case CONTAINS:
                return containsPattern(ctx, value);
            case MATCHES:
                return "new RegExp(" + text(ctx, value) + ")";
            default:
                return expr(ctx, value);
        }
    }

    private static String stateAssertion(ElementState state, boolean negated) {
        switch (state) {
            case VISIBLE: return negated ? "not.toBeVisible()" : "toBeVisible()";
            case HIDDEN: return negated ? "toBeVisible()" : "toBeHidden()";
            case ENABLED: return negated ? "toBeDisabled()" : "toBeEnabled()";
            case DISABLED: return negated ? "toBeEnabled()" : "toBeDisabled()";
            case CHECKED: return negated ? "not.toBeChecked()" : "toBeChecked()";
            case FOCUSED: return negated ? "not.toBeFocused()" : "toBeFocused()";
            case EMPTY: return negated ? "not.toBeEmpty()" : "toBeEmpty()";
            default: throw new IllegalStateException("Unknown element state: " + state);
        }
    }

    private static String stateQuery(String locator, ElementState state) {
        switch (state) {
            case VISIBLE: return "await " + locator + ".isVisible()";
            case HIDDEN: return "await " + locator + ".isHidden()";
            case ENABLED: return "await " + locator + ".isEnabled()";
            case DISABLED: return "await " + locator + ".isDisabled()";
            case CHECKED: return "await " + locator + ".isChecked()";
            case FOCUSED: return "await " + locator + ".evaluate((el) => el === document.activeElement)";
            case EMPTY:
                return "await " + locator
                        + ".evaluate((el) => String((el as HTMLInputElement).value ?? el.textContent ?? '').trim() === '')";
            default: throw new IllegalStateException("Unknown element state: " + state);
        }
    }

    private static String condition(GenContext ctx, Condition condition) {
        if (condition instanceof ElementStateCondition) {
            ElementStateCondition c = (ElementStateCondition) condition;
            String query = stateQuery(target(ctx, c.getTarget()), c.getState());
            return c.isNegated() ? "!(" + query + ")" : query;
        }
        if (condition instanceof ComparisonCondition) {
            ComparisonCondition c = (ComparisonCondition) condition;
            return expr(ctx, c.getLeft()) + " " + c.getOperator().getTsOperator() + " " + expr(ctx, c.getRight());
        }
        if (condition instanceof ContainsCondition) {
            ContainsCondition c = (ContainsCondition) condition;
            return expr(ctx, c.getSubject()) + ".includes(" + expr(ctx, c.getValue()) + ")";
        }
        if (condition instanceof TruthCondition) {
            return "Boolean(" + NameResolver.variable(ctx, ((TruthCondition) condition).getVariable()) + ")";
        }
        if (condition instanceof NotCondition) {
            return "!(" + condition(ctx, ((NotCondition) condition).getOperand()) + ")";
        }
        throw new IllegalStateException("Unknown condition: " + condition.getClass().getSimpleName());
    }

    /**
     * 按变量声明类型转换初始值
     */
    private static String typedValue(GenContext ctx, VariableType type, Expression value) {
        String code = expr(ctx, value);
        switch (type) {
            case NUMBER:
                return value instanceof NumberLiteral ? code : "Number(" + code + ")";
            case FLAG:
                return value instanceof BooleanLiteral ? code : "Boolean(" + code + ")";
            case TEXT:
                return value instanceof StringLiteral ? code : "String(" + code + ")";
            default:
                return code;
        }
    }

    private static void ensureTable(GenContext ctx, String table) {
        ctx.unit.usesData = true;
        ctx.unit.usesEnv = true;
        if (ctx.ensuredTables.add(table)) {
            ctx.writer.line("await veroData.ensureTable(" + TsSyntax.quote(table) + ");");
        }
    }

    private static String resolveRow(String row) {
        return "veroData.resolveReferences(" + row + ", " + TsSyntax.ENV_MAP + ")";
    }

    private static String resolveRows(String rows) {
        return rows + ".map((" + QueryCompiler.ROW + ") => " + resolveRow(QueryCompiler.ROW) + ")";
    }

    /**
     * PERFORM 调用表达式（含 await），并校验参数个数
     */
    private static String performCall(GenContext ctx, PerformStmt stmt) {
        UnitState unit = ctx.unit;
        PageActionsDecl block;
        String receiver;

        if (stmt.getBlockName() != null) {
            block = unit.program.findPageActions(stmt.getBlockName());
            if (block == null) {
                throw new GenerationException("PageActions '" + stmt.getBlockName() + "' is not defined",
                        stmt.getLocation());
            }
            if (unit.isActions()) {
                if (block == unit.block) {
                    receiver = "this";
                } else {
                    unit.referencedBlocks.add(block.getName());
                    receiver = "new " + block.getName() + "(this.page)";
                }
            } else {
                receiver = TsSyntax.camelCase(block.getName());
            }
        } else if (unit.isActions()) {
            block = unit.block;
            receiver = "this";
        } else {
            block = null;
            for (String used : unit.feature.getUses()) {
                PageActionsDecl candidate = unit.program.findPageActions(used);
                if (candidate != null && !candidate.findOverloads(stmt.getActionName()).isEmpty()) {
                    block = candidate;
                    break;
                }
            }
            if (block == null) {
                throw new GenerationException("Action '" + stmt.getActionName()
                        + "' is not defined in any PageActions used by feature '" + unit.feature.getName() + "'",
                        stmt.getLocation());
            }
            receiver = TsSyntax.camelCase(block.getName());
        }

        List<ActionDecl> overloads = block.findOverloads(stmt.getActionName());
        if (overloads.isEmpty()) {
            throw new GenerationException("Action '" + stmt.getActionName() + "' is not defined in '"
                    + block.getName() + "'", stmt.getLocation());
        }
        int arity = stmt.getArguments().size();
        boolean matched = false;
        List<Integer> arities = new ArrayList<Integer>();
        for (ActionDecl action : overloads) {
            arities.add(action.getArity());
            if (action.getArity() == arity) {
                matched = true;
            }
        }
        if (!matched) {
            throw new GenerationException("No overload of '" + block.getName() + "." + stmt.getActionName()
                    + "' takes " + arity + " argument(s); declared arities: " + arities, stmt.getLocation());
        }

        StringBuilder sb = new StringBuilder("await ").append(receiver).append('.')
                .append(stmt.getActionName()).append('(');
        for (int i = 0; i < stmt.getArguments().size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(expr(ctx, stmt.getArguments().get(i)));
        }
        return sb.append(')').toString();
    }

    // ============ 动作 ============

    @Override
    public Void visitClick(ClickStmt stmt, GenContext ctx) {
        String locator = target(ctx, stmt.getTarget());
        switch (stmt.getClickType()) {
            case RIGHT:
                ctx.writer.line("await " + locator + ".click({ button: 'right' });");
                break;
            case DOUBLE:
                ctx.writer.line("await " + locator + ".dblclick();");
                break;
            case FORCE:
                ctx.writer.line("await " + locator + ".click({ force: true });");
                break;
            default:
                ctx.writer.line("await " + locator + ".click();");
        }
        return null;
    }

    @Override
    public Void visitDrag(DragStmt stmt, GenContext ctx) {
        ctx.writer.line("await " + target(ctx, stmt.getSource()) + ".dragTo(" + target(ctx, stmt.getDestination()) + ");");
        return null;
    }

    @Override
    public Void visitFill(FillStmt stmt, GenContext ctx) {
        ctx.writer.line("await " + target(ctx, stmt.getTarget()) + ".fill(" + text(ctx, stmt.getValue()) + ");");
        return null;
    }

    @Override
    public Void visitClear(ClearStmt stmt, GenContext ctx) {
        ctx.writer.line("await " + target(ctx, stmt.getTarget()) + ".clear();");
        return null;
    }

    @Override
    public Void visitSelect(SelectStmt stmt, GenContext ctx) {
        ctx.writer.line("await " + target(ctx, stmt.getTarget()) + ".selectOption(" + text(ctx, stmt.getOption()) + ");");
        return null;
    }

    @Override
    public Void visitCheck(CheckStmt stmt, GenContext ctx) {
        ctx.writer.line("await " + target(ctx, stmt.getTarget()) + (stmt.isChecked() ? ".check();" : ".uncheck();"));
        return null;
    }

    @Override
    public Void visitHover(HoverStmt stmt, GenContext ctx) {
        ctx.writer.line("await " + target(ctx, stmt.getTarget()) + ".hover();");
        return null;
    }

    @Override
    public Void visitPress(PressStmt stmt, GenContext ctx) {
        ctx.writer.line("await " + ctx.pageRef() + ".keyboard.press(" + text(ctx, stmt.getKey()) + ");");
        return null;
    }

    @Override
    public Void visitScroll(ScrollStmt stmt, GenContext ctx) {
        switch (stmt.getDirection()) {
            case UP:
                ctx.writer.line("await " + ctx.pageRef() + ".mouse.wheel(0, -500);");
                break;
            case DOWN:
                ctx.writer.line("await " + ctx.pageRef() + ".mouse.wheel(0, 500);");
                break;
            default:
                ctx.writer.line("await " + target(ctx, stmt.getTarget()) + ".scrollIntoViewIfNeeded();");
        }
        return null;
    }

    @Override
    public Void visitUpload(UploadStmt stmt, GenContext ctx) {
        String files;
        if (stmt.getFiles().size() == 1) {
            files = text(ctx, stmt.getFiles().get(0));
        } else {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < stmt.getFiles().size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(text(ctx, stmt.getFiles().get(i)));
            }
            files = sb.append(']').toString();
        }
        ctx.writer.line("await " + target(ctx, stmt.getTarget()) + ".setInputFiles(" + files + ");");
        return null;
    }

    @Override
    public Void visitDownload(DownloadStmt stmt, GenContext ctx) {
        String download = ctx.unit.temp("download");
        CodeWriter w = ctx.writer;
        w.line("const [" + download + "] = await Promise.all([");
        w.indent();
        w.line(ctx.pageRef() + ".waitForEvent('download'),");
        w.line(target(ctx, stmt.getTarget()) + ".click(),");
        w.dedent();
        w.line("]);");
        if (stmt.getSaveAs() != null) {
            w.line("await " + download + ".saveAs(" + text(ctx, stmt.getSaveAs()) + ");");
        }
        return null;
    }

    // ============ 导航与浏览器 ============

    @Override
    public Void visitOpen(OpenStmt stmt, GenContext ctx) {
        String url = expr(ctx, stmt.getUrl());
        String baseUrl = ctx.unit.options.getBaseUrl();
        if (baseUrl != null && stmt.getUrl() instanceof StringLiteral) {
            String value = ((StringLiteral) stmt.getUrl()).getValue();
            if (value.startsWith("/") && !TsSyntax.hasPlaceholders(value)) {
                String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
                url = TsSyntax.quote(base + value);
            }
        }
        ctx.writer.line("await " + ctx.pageRef() + ".goto(" + url + ");");
        return null;
    }

    @Override
    public Void visitRefresh(RefreshStmt stmt, GenContext ctx) {
        ctx.writer.line("await " + ctx.pageRef() + ".reload();");
        return null;
    }

    @Override
    public Void visitWait(WaitStmt stmt, GenContext ctx) {
        String millis;
        if (stmt.getDuration() instanceof NumberLiteral) {
            double value = ((NumberLiteral) stmt.getDuration()).getValue();
            millis = TsSyntax.number(stmt.isMilliseconds() ? value : value * 1000);
        } else {
            String code = "Number(" + expr(ctx, stmt.getDuration()) + ")";
            millis = stmt.isMilliseconds() ? code : code + " * 1000";
        }
        ctx.writer.line("await " + ctx.pageRef() + ".waitForTimeout(" + millis + ");");
        return null;
    }

    @Override
    public Void visitWaitForElement(WaitForElementStmt stmt, GenContext ctx) {
        ctx.writer.line("await " + target(ctx, stmt.getTarget()) + ".waitFor();");
        return null;
    }

    @Override
    public Void visitWaitForNavigation(WaitForNavigationStmt stmt, GenContext ctx) {
        ctx.writer.line("await " + ctx.pageRef() + ".waitForLoadState();");
        return null;
    }

    @Override
    public Void visitWaitForNetworkIdle(WaitForNetworkIdleStmt stmt, GenContext ctx) {
        ctx.writer.line("await " + ctx.pageRef() + ".waitForLoadState('networkidle');");
        return null;
    }

    @Override
    public Void visitWaitForUrl(WaitForUrlStmt stmt, GenContext ctx) {
        ctx.writer.line("await " + ctx.pageRef() + ".waitForURL("
                + textMatchArgument(ctx, stmt.getMatch(), stmt.getValue()) + ");");
        return null;
    }

    @Override
    public Void visitSwitchToNewTab(SwitchToNewTabStmt stmt, GenContext ctx) {
        String page = ctx.pageRef();
        if (stmt.getUrl() != null) {
            ctx.writer.line(page + " = await " + page + ".context().newPage();");
            ctx.writer.line("await " + page + ".goto(" + expr(ctx, stmt.getUrl()) + ");");
        } else {
            ctx.writer.line(page + " = await " + page + ".context().waitForEvent('page');");
            ctx.writer.line("await " + page + ".waitForLoadState();");
        }
        return null;
    }

    @Override
    public Void visitSwitchToTab(SwitchToTabStmt stmt, GenContext ctx) {
        String page = ctx.pageRef();
        String index;
        if (stmt.getIndex() instanceof NumberLiteral) {
            index = TsSyntax.number(((NumberLiteral) stmt.getIndex()).getValue() - 1);
        } else {
            index = "Number(" + expr(ctx, stmt.getIndex()) + ") - 1";
        }
        ctx.writer.line(page + " = " + page + ".context().pages()[" + index + "];");
        ctx.writer.line("await " + page + ".bringToFront();");
        return null;
    }

    @Override
    public Void visitSwitchToFrame(SwitchToFrameStmt stmt, GenContext ctx) {
        Selector selector = stmt.getSelector();
        String frame = ctx.unit.temp("frame");
        String locator;
        if (selector.getSelectorType() == SelectorType.CSS && !selector.hasModifiers()) {
            locator = ctx.pageRef() + ".frameLocator(" + TsSyntax.quote(selector.getValue()) + ")";
        } else {
            locator = SelectorCompiler.compile(selector, ctx.pageRef()) + ".contentFrame()";
        }
        ctx.writer.line("const " + frame + " = " + locator + ";");
        ctx.frameRef = frame;
        return null;
    }

    @Override
    public Void visitSwitchToMainFrame(SwitchToMainFrameStmt stmt, GenContext ctx) {
        ctx.frameRef = null;
        ctx.writer.line("// main frame");
        return null;
    }

    @Override
    public Void visitCloseTab(CloseTabStmt stmt, GenContext ctx) {
        String page = ctx.pageRef();
        ctx.writer.line("await " + page + ".close();");
        ctx.writer.line(page + " = " + page + ".context().pages()[0];");
        return null;
    }

    @Override
    public Void visitAcceptDialog(AcceptDialogStmt stmt, GenContext ctx) {
        String argument = stmt.getPromptText() != null ? text(ctx, stmt.getPromptText()) : "";
        ctx.writer.line(ctx.pageRef() + ".once('dialog', (dialog) => dialog.accept(" + argument + "));");
        return null;
    }

    @Override
    public Void visitDismissDialog(DismissDialogStmt stmt, GenContext ctx) {
        ctx.writer.line(ctx.pageRef() + ".once('dialog', (dialog) => dialog.dismiss());");
        return null;
    }

    @Override
    public Void visitSetCookie(SetCookieStmt stmt, GenContext ctx) {
        String page = ctx.pageRef();
        ctx.writer.line("await " + page + ".context().addCookies([{ name: " + text(ctx, stmt.getName())
                + ", value: " + text(ctx, stmt.getValue()) + ", url: " + page + ".url() }]);");
        return null;
    }

    @Override
    public Void visitClearCookies(ClearCookiesStmt stmt, GenContext ctx) {
        ctx.writer.line("await " + ctx.pageRef() + ".context().clearCookies();");
        return null;
    }

    @Override
    public Void visitSetStorage(SetStorageStmt stmt, GenContext ctx) {
        ctx.writer.line("await " + ctx.pageRef() + ".evaluate(([key, value]) => localStorage.setItem(key, value), ["
                + text(ctx, stmt.getKey()) + ", " + text(ctx, stmt.getValue()) + "]);");
        return null;
    }

    @Override
    public Void visitClearStorage(ClearStorageStmt stmt, GenContext ctx) {
        ctx.writer.line("await " + ctx.pageRef() + ".evaluate(() => localStorage.clear());");
        return null;
    }

    @Override
    public Void visitLog(LogStmt stmt, GenContext ctx) {
        ctx.writer.line("console.log(" + expr(ctx, stmt.getMessage()) + ");");
        return null;
    }

    @Override
    public Void visitTakeScreenshot(TakeScreenshotStmt stmt, GenContext ctx) {
        String subject = stmt.getTarget() != null ? target(ctx, stmt.getTarget()) : ctx.pageRef();
        if (stmt.getFileName() != null) {
            String path = stmt.getFileName().contains(".") ? stmt.getFileName() : stmt.getFileName() + ".png";
            ctx.writer.line("await " + subject + ".screenshot({ path: " + TsSyntax.quote(path) + " });");
        } else if (ctx.hasTestInfo()) {
            ctx.writer.line("await testInfo.attach('screenshot', { body: await " + subject
                    + ".screenshot(), contentType: 'image/png' });");
        } else {
            ctx.writer.line("await " + subject + ".screenshot();");
        }
        return null;
    }

    // ============ 断言 ============

    @Override
    public Void visitVerifyState(VerifyStateStmt stmt, GenContext ctx) {
        ctx.writer.line("await expect(" + target(ctx, stmt.getTarget()) + ")."
                + stateAssertion(stmt.getState(), stmt.isNegated()) + ";");
        return null;
    }

    @Override
    public Void visitVerifyContains(VerifyContainsStmt stmt, GenContext ctx) {
        ctx.writer.line("await expect(" + target(ctx, stmt.getTarget()) + ")."
                + (stmt.isNegated() ? "not." : "") + "toContainText(" + text(ctx, stmt.getValue()) + ");");
        return null;
    }

    @Override
    public Void visitVerifyProperty(VerifyPropertyStmt stmt, GenContext ctx) {
        String locator = target(ctx, stmt.getTarget());
        String assertion;
        switch (stmt.getProperty()) {
            case COUNT:
                assertion = "toHaveCount(" + (stmt.getValue() instanceof NumberLiteral
                        ? expr(ctx, stmt.getValue()) : "Number(" + expr(ctx, stmt.getValue()) + ")") + ")";
                break;
            case VALUE:
                assertion = "toHaveValue(" + text(ctx, stmt.getValue()) + ")";
                break;
            case TEXT:
                assertion = "toHaveText(" + text(ctx, stmt.getValue()) + ")";
                break;
            default:
                assertion = "toHaveClass(" + containsPattern(ctx, stmt.getValue()) + ")";
        }
        ctx.writer.line("await expect(" + locator + ")." + assertion + ";");
        return null;
    }

    @Override
    public Void visitVerifyAttribute(VerifyAttributeStmt stmt, GenContext ctx) {
        ctx.writer.line("await expect(" + target(ctx, stmt.getTarget()) + ").toHaveAttribute("
                + text(ctx, stmt.getAttribute()) + ", " + text(ctx, stmt.getValue()) + ");");
        return null;
    }

    @Override
    public Void visitVerifyUrl(VerifyUrlStmt stmt, GenContext ctx) {
        ctx.writer.line("await expect(" + ctx.pageRef() + ").toHaveURL("
                + textMatchArgument(ctx, stmt.getMatch(), stmt.getValue()) + ");");
        return null;
    }

    @Override
    public Void visitVerifyTitle(VerifyTitleStmt stmt, GenContext ctx) {
        ctx.writer.line("await expect(" + ctx.pageRef() + ").toHaveTitle("
                + textMatchArgument(ctx, stmt.getMatch(), stmt.getValue()) + ");");
        return null;
    }

    @Override
    public Void visitVerifyFlag(VerifyFlagStmt stmt, GenContext ctx) {
        ctx.writer.line("expect(" + NameResolver.variable(ctx, stmt.getVariable()) + ").toBe("
                + stmt.isExpected() + ");");
        return null;
    }

    @Override
    public Void visitVerifyEquals(VerifyEqualsStmt stmt, GenContext ctx) {
        ctx.writer.line("expect(" + NameResolver.variable(ctx, stmt.getVariable()) + ").toEqual("
                + expr(ctx, stmt.getExpected()) + ");");
        return null;
    }

    @Override
    public Void visitVerifyScreenshot(VerifyScreenshotStmt stmt, GenContext ctx) {
        String subject = stmt.getTarget() != null ? target(ctx, stmt.getTarget()) : ctx.pageRef();
        ctx.writer.line("await expect(" + subject + ").toHaveScreenshot("
                + VisualAssertions.arguments(stmt.getName(), stmt.getSettings()) + ");");
        return null;
    }

    // ============ 控制流 ============

    @Override
    public Void visitIf(IfStmt stmt, GenContext ctx) {
        emitIf(stmt, ctx, "");
        return null;
    }

    private void emitIf(IfStmt stmt, GenContext ctx, String prefix) {
        CodeWriter w = ctx.writer;
        w.line(prefix + "if (" + condition(ctx, stmt.getCondition()) + ") {");
        w.indent();
        emitBody(stmt.getThenBranch(), ctx.child(), false);
        w.dedent();
        List<Statement> elseBranch = stmt.getElseBranch();
        if (elseBranch.size() == 1 && elseBranch.get(0) instanceof IfStmt) {
            emitIf((IfStmt) elseBranch.get(0), ctx, "} else ");
            return;
        }
        if (!elseBranch.isEmpty()) {
            w.line("} else {");
            w.indent();
            emitBody(elseBranch, ctx.child(), false);
            w.dedent();
        }
        w.line("}");
    }

    @Override
    public Void visitRepeat(RepeatStmt stmt, GenContext ctx) {
        String counter = ctx.unit.temp("i");
        String times = stmt.getTimes() instanceof NumberLiteral
                ? expr(ctx, stmt.getTimes()) : "Number(" + expr(ctx, stmt.getTimes()) + ")";
        ctx.writer.line("for (let " + counter + " = 0; " + counter + " < " + times + "; " + counter + "++) {");
        ctx.writer.indent();
        emitBody(stmt.getBody(), ctx.child(), false);
        ctx.writer.dedent();
        ctx.writer.line("}");
        return null;
    }

    @Override
    public Void visitForEach(ForEachStmt stmt, GenContext ctx) {
        ctx.writer.line("for (const " + stmt.getItemName() + " of "
                + NameResolver.variable(ctx, stmt.getCollection()) + ") {");
        ctx.writer.indent();
        GenContext body = ctx.child();
        body.locals.add(stmt.getItemName());
        emitBody(stmt.getBody(), body, false);
        ctx.writer.dedent();
        ctx.writer.line("}");
        return null;
    }

    @Override
    public Void visitTryCatch(TryCatchStmt stmt, GenContext ctx) {
        CodeWriter w = ctx.writer;
        w.line("try {");
        w.indent();
        emitBody(stmt.getTryBody(), ctx.child(), false);
        w.dedent();
        w.line("} catch {");
        w.indent();
        emitBody(stmt.getCatchBody(), ctx.child(), false);
        w.dedent();
        w.line("}");
        return null;
    }

    // ============ 值 ============

    @Override
    public Void visitPerform(PerformStmt stmt, GenContext ctx) {
        ctx.writer.line(performCall(ctx, stmt) + ";");
        return null;
    }

    @Override
    public Void visitVariableDecl(VariableDeclStmt stmt, GenContext ctx) {
        VariableType type = stmt.getVarType();
        String value = type == VariableType.LIST && !(stmt.getValue() instanceof ListLiteral)
                ? expr(ctx, stmt.getValue()) : typedValue(ctx, type, stmt.getValue());
        ctx.writer.line("const " + stmt.getName() + ": " + type.getTsType() + " = " + value + ";");
        ctx.locals.add(stmt.getName());
        return null;
    }

    @Override
    public Void visitPerformAssign(PerformAssignStmt stmt, GenContext ctx) {
        ctx.writer.line("const " + stmt.getName() + ": " + stmt.getVarType().getTsType() + " = "
                + performCall(ctx, stmt.getCall()) + ";");
        ctx.locals.add(stmt.getName());
        return null;
    }

    @Override
    public Void visitReturn(ReturnStmt stmt, GenContext ctx) {
        switch (stmt.getKind()) {
            case EXPRESSION:
                ctx.writer.line("return " + expr(ctx, stmt.getValue()) + ";");
                break;
            case VISIBLE:
                ctx.writer.line("return await " + target(ctx, stmt.getTarget()) + ".isVisible();");
                break;
            case TEXT:
                ctx.writer.line("return (await " + target(ctx, stmt.getTarget()) + ".textContent()) ?? '';");
                break;
            case VALUE:
                ctx.writer.line("return await " + target(ctx, stmt.getTarget()) + ".inputValue();");
                break;
            default:
                ctx.writer.line("return;");
        }
        return null;
    }

    // ============ 数据 ============

    @Override
    public Void visitLoad(LoadStmt stmt, GenContext ctx) {
        ensureTable(ctx, stmt.getTable());
        QueryCompiler query = new QueryCompiler(ctx);
        String rows = QueryCompiler.table(stmt.getTable());
        if (stmt.getWhere() != null) {
            rows += query.filterCall(stmt.getWhere());
        }
        ctx.writer.line("const " + stmt.getVariable() + " = " + resolveRows(rows) + ";");
        ctx.locals.add(stmt.getVariable());
        return null;
    }

    @Override
    public Void visitRow(RowStmt stmt, GenContext ctx) {
        String table = stmt.getTable().getQualifiedName();
        ensureTable(ctx, table);
        QueryCompiler query = new QueryCompiler(ctx);
        String source = QueryCompiler.table(table);
        String row;
        if (stmt.getOrderBy().isEmpty() && stmt.getPosition() != RowPosition.LAST
                && stmt.getPosition() != RowPosition.RANDOM
                && stmt.getWhere() != null) {
            row = source + query.findCall(stmt.getWhere());
        } else {
            String rows = stmt.getWhere() != null ? source + query.filterCall(stmt.getWhere()) : "[..." + source + "]";
            if (!stmt.getOrderBy().isEmpty()) {
                rows += query.sortCall(stmt.getOrderBy());
            }
            if (stmt.getPosition() == RowPosition.LAST) {
                row = rows + ".slice(-1)[0]";
            } else if (stmt.getPosition() == RowPosition.RANDOM) {
                row = "((rows) => rows[Math.floor(Math.random() * rows.length)])(" + rows + ")";
            } else {
                row = rows + "[0]";
            }
        }
        ctx.writer.line("const " + stmt.getVariable() + " = " + resolveRow(row) + ";");
        ctx.locals.add(stmt.getVariable());
        return null;
    }

    @Override
    public Void visitRows(RowsStmt stmt, GenContext ctx) {
        String table = stmt.getTable().getQualifiedName();
        ensureTable(ctx, table);
        QueryCompiler query = new QueryCompiler(ctx);
        String rows = QueryCompiler.table(table);
        boolean copied = false;
        if (stmt.getWhere() != null) {
            rows += query.filterCall(stmt.getWhere());
            copied = true;
        }
        if (!stmt.getOrderBy().isEmpty()) {
            if (!copied) {
                rows = "[..." + rows + "]";
            }
            rows += query.sortCall(stmt.getOrderBy());
        }
        Integer offset = stmt.getOffset();
        Integer limit = stmt.getLimit();
        if (limit != null) {
            int start = offset != null ? offset : 0;
            rows += ".slice(" + start + ", " + (start + limit) + ")";
        } else if (offset != null) {
            rows += ".slice(" + offset + ")";
        }
        ctx.writer.line("const " + stmt.getVariable() + " = " + resolveRows(rows) + ";");
        ctx.locals.add(stmt.getVariable());
        return null;
    }

    @Override
    public Void visitCount(CountStmt stmt, GenContext ctx) {
        String table = stmt.getTable().getQualifiedName();
        ensureTable(ctx, table);
        String rows = QueryCompiler.table(table);
        if (stmt.getWhere() != null) {
            rows += new QueryCompiler(ctx).filterCall(stmt.getWhere());
        }
        ctx.writer.line("const " + stmt.getVariable() + ": number = " + rows + ".length;");
        ctx.locals.add(stmt.getVariable());
        return null;
    }
}

package com.verolang.compiler.analysis;

import com.verolang.compiler.ast.SourceLocation;
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
import com.verolang.compiler.ast.expr.ExpressionVisitor;
import com.verolang.compiler.ast.expr.ListLiteral;
import com.verolang.compiler.ast.expr.NumberLiteral;
import com.verolang.compiler.ast.expr.StringLiteral;
import com.verolang.compiler.ast.expr.VariableRef;
import com.verolang.compiler.ast.query.QueryComparison;
import com.verolang.compiler.ast.query.QueryCondition;
import com.verolang.compiler.ast.query.QueryContains;
import com.verolang.compiler.ast.query.QueryEmpty;
import com.verolang.compiler.ast.query.QueryIn;
import com.verolang.compiler.ast.query.QueryLogical;
import com.verolang.compiler.ast.query.QueryNot;
import com.verolang.compiler.ast.selector.FirstModifier;
import com.verolang.compiler.ast.selector.HasModifier;
import com.verolang.compiler.ast.selector.HasNotModifier;
import com.verolang.compiler.ast.selector.LastModifier;
import com.verolang.compiler.ast.selector.ModifierVisitor;
import com.verolang.compiler.ast.selector.NthModifier;
import com.verolang.compiler.ast.selector.Selector;
import com.verolang.compiler.ast.selector.SelectorModifier;
import com.verolang.compiler.ast.selector.SelectorType;
import com.verolang.compiler.ast.selector.WithTextModifier;
import com.verolang.compiler.ast.selector.WithoutTextModifier;
import com.verolang.compiler.ast.stmt.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Vero 语义校验器
 * <p>
 * 只读遍历 AST，收集所有独立的问题；错误是否阻止代码生成由调用方决定。
 */
public final class VeroValidator implements StatementVisitor<Void, Scope> {

    private final List<SemanticDiagnostic> diagnostics = new ArrayList<SemanticDiagnostic>();
    private Program program;

    // 当前上下文：二者恰有一个非 null
    private FeatureDecl currentFeature;
    private PageActionsDecl currentBlock;

    /**
     * 便捷方法：校验程序
     */
    public static ValidationResult validate(Program program) {
        return new VeroValidator().run(program);
    }

    public ValidationResult run(Program program) {
        this.program = program;
        diagnostics.clear();

        checkPages();
        checkPageActions();
        checkFeatures();

        return new ValidationResult(diagnostics);
    }

    // ============ 诊断 ============

    private void error(String code, String message, SourceLocation location) {
        diagnostics.add(new SemanticDiagnostic(SemanticDiagnostic.Severity.ERROR, code, message, location));
    }

    private void warning(String code, String message, SourceLocation location) {
        diagnostics.add(new SemanticDiagnostic(SemanticDiagnostic.Severity.WARNING, code, message, location));
    }

    // ============ 声明 ============

    private void checkPages() {
        Set<String> seen = new HashSet<String>();
        for (PageDecl page : program.getPages()) {
            if (!seen.add(page.getName())) {
                error(DiagnosticCodes.DUPLICATE_PAGE, "Duplicate page '" + page.getName() + "'", page.getLocation());
            }
            checkPascalCase(page.getName(), "Page", page.getLocation());

            Set<String> members = new HashSet<String>();
            for (FieldDecl field : page.getFields()) {
                if (!members.add(field.getName())) {
                    error(DiagnosticCodes.DUPLICATE_MEMBER,
                            "Duplicate member '" + field.getName() + "' in page '" + page.getName() + "'",
                            field.getLocation());
                }
                checkCamelCase(field.getName(), "Field", field.getLocation());
                checkSelector(field.getSelector());
            }
            for (PageVariableDecl variable : page.getVariables()) {
                if (!members.add(variable.getName())) {
                    error(DiagnosticCodes.DUPLICATE_MEMBER,
                            "Duplicate member '" + variable.getName() + "' in page '" + page.getName() + "'",
                            variable.getLocation());
                }
            }
        }
    }

    private void checkPageActions() {
        Set<String> seen = new HashSet<String>();
        for (PageActionsDecl block : program.getPageActions()) {
            if (!seen.add(block.getName())) {
                error(DiagnosticCodes.DUPLICATE_PAGE_ACTIONS,
                        "Duplicate PageActions '" + block.getName() + "'", block.getLocation());
            }
            checkPascalCase(block.getName(), "PageActions", block.getLocation());
            if (program.findPage(block.getForPage()) == null) {
                error(DiagnosticCodes.UNDEFINED_FOR_PAGE,
                        "PageActions '" + block.getName() + "' is declared FOR undefined page '"
                                + block.getForPage() + "'", block.getLocation());
            }

            for (Map.Entry<String, List<ActionDecl>> entry : block.getOverloads().entrySet()) {
                Map<Integer, ActionDecl> byArity = new HashMap<Integer, ActionDecl>();
                for (ActionDecl action : entry.getValue()) {
                    ActionDecl existing = byArity.put(action.getArity(), action);
                    if (existing != null) {
                        error(DiagnosticCodes.DUPLICATE_OVERLOAD,
                                "Action '" + entry.getKey() + "' in '" + block.getName() + "' has more than one body with "
                                        + action.getArity() + " parameter(s)", action.getLocation());
                    }
                }
            }

            currentBlock = block;
            currentFeature = null;
            for (ActionDecl action : block.getActions()) {
                checkCamelCase(action.getName(), "Action", action.getLocation());
                Scope scope = new Scope(Scope.ScopeType.ACTION, null);
                for (String parameter : action.getParameters()) {
                    scope.define(new Symbol(parameter, SymbolKind.PARAMETER, action.getLocation()));
                }
                checkStatements(action.getStatements(), scope);
            }
            currentBlock = null;
        }
    }

    private void checkFeatures() {
        for (FeatureDecl feature : program.getFeatures()) {
            currentFeature = feature;
            currentBlock = null;

            for (String used : feature.getUses()) {
                if (program.findPage(used) == null && program.findPageActions(used) == null) {
                    error(DiagnosticCodes.UNDEFINED_PAGE,
                            "Page or PageActions '" + used + "' used by feature '" + feature.getName()
                                    + "' is not defined", feature.getLocation());
                }
            }

            Scope featureScope = new Scope(Scope.ScopeType.FEATURE, null);
            for (HookDecl hook : feature.getHooks()) {
                checkStatements(hook.getStatements(), featureScope.child(Scope.ScopeType.BLOCK));
            }

            Set<String> names = new HashSet<String>();
            for (ScenarioDecl scenario : feature.getScenarios()) {
                if (!names.add(scenario.getName())) {
                    warning(DiagnosticCodes.DUPLICATE_SCENARIO,
                            "Duplicate scenario '" + scenario.getName() + "' in feature '" + feature.getName() + "'",
                            scenario.getLocation());
                }
                checkStatements(scenario.getStatements(), featureScope.child(Scope.ScopeType.SCENARIO));
            }
            currentFeature = null;
        }
    }

    private void checkPascalCase(String name, String kind, SourceLocation location) {
        if (!name.isEmpty() && !Character.isUpperCase(name.charAt(0))) {
            warning(DiagnosticCodes.NAMING_CONVENTION,
                    kind + " name '" + name + "' should be PascalCase", location);
        }
    }

    private void checkCamelCase(String name, String kind, SourceLocation location) {
        if (!name.isEmpty() && !Character.isLowerCase(name.charAt(0))) {
            warning(DiagnosticCodes.NAMING_CONVENTION,
                    kind + " name '" + name + "' should be camelCase", location);
        }
    }

    // ============ 选择器 ============

    private void checkSelector(final Selector selector) {
        if (selector.getValue() == null || selector.getValue().trim().isEmpty()) {
            error(DiagnosticCodes.INVALID_SELECTOR, "Selector value must not be empty", selector.getLocation());
        }
        if (selector.getNameParam() != null && selector.getSelectorType() != SelectorType.ROLE) {
            warning(DiagnosticCodes.NAME_ON_NON_ROLE,
                    "NAME is only meaningful on role selectors", selector.getLocation());
        }
        for (SelectorModifier modifier : selector.getModifiers()) {
            modifier.accept(modifierChecker);
        }
    }

    private final ModifierVisitor<Void> modifierChecker = new ModifierVisitor<Void>() {
        @Override
        public Void visitFirst(FirstModifier modifier) {
            return null;
        }

        @Override
        public Void visitLast(LastModifier modifier) {
            return null;
        }

        @Override
        public Void visitNth(NthModifier modifier) {
            if (modifier.getIndex() < 0) {
                error(DiagnosticCodes.INVALID_MODIFIER,
                        "NTH index must be >= 0 (got " + modifier.getIndex() + ")", modifier.getLocation());
            }
            return null;
        }

        @Override
        public Void visitWithText(WithTextModifier modifier) {
            checkModifierText(modifier.getText(), "WITH TEXT", modifier.getLocation());
            return null;
        }

        @Override
        public Void visitWithoutText(WithoutTextModifier modifier) {
            checkModifierText(modifier.getText(), "WITHOUT TEXT", modifier.getLocation());
            return null;
        }

        @Override
        public Void visitHas(HasModifier modifier) {
            checkNestedSelector(modifier.getSelector(), "HAS", modifier.getLocation());
            return null;
        }

        @Override
        public Void visitHasNot(HasNotModifier modifier) {
            checkNestedSelector(modifier.getSelector(), "HAS NOT", modifier.getLocation());
            return null;
        }
    };

    private void checkModifierText(String text, String keyword, SourceLocation location) {
        if (text == null || text.isEmpty()) {
            error(DiagnosticCodes.INVALID_MODIFIER, keyword + " requires non-empty text", location);
        }
    }

    private void checkNestedSelector(Selector nested, String keyword, SourceLocation location) {
        if (nested == null || nested.getValue() == null || nested.getValue().trim().isEmpty()) {
            error(DiagnosticCodes.INVALID_MODIFIER, keyword + " requires a non-empty selector", location);
            return;
        }
        if (nested.hasModifiers()) {
            error(DiagnosticCodes.INVALID_MODIFIER,
                    "Selector inside " + keyword + " cannot have modifiers", nested.getLocation());
        }
    }

    // ============ 引用解析 ============

    /**
     * 页面引用：必须已声明；在 feature 中还必须出现在 USE 列表里
     */
    private PageDecl resolvePage(String pageName, SourceLocation location) {
        PageDecl page = program.findPage(pageName);
        if (page == null) {
            error(DiagnosticCodes.UNDEFINED_PAGE, "Page '" + pageName + "' is not defined", location);
            return null;
        }
        if (currentFeature != null && !currentFeature.getUses().contains(pageName)) {
            error(DiagnosticCodes.PAGE_NOT_IN_USE,
                    "Page '" + pageName + "' is not listed in USE of feature '" + currentFeature.getName() + "'",
                    location);
        }
        return page;
    }

    private void checkTarget(Target target, Scope scope) {
        if (target == null) return;
        if (target.isSelector()) {
            checkSelector(target.getSelector());
            return;
        }
        if (target.isPageField()) {
            PageDecl page = resolvePage(target.getPageName(), target.getLocation());
            if (page != null && page.findField(target.getFieldName()) == null) {
                error(DiagnosticCodes.UNDEFINED_FIELD,
                        "Field '" + target.getFieldName() + "' is not defined in page '" + page.getName() + "'",
                        target.getLocation());
            }
            return;
        }
        // 裸名称
        String name = target.getFieldName();
        if (scope.resolve(name) != null) return;
        if (currentBlock != null) {
            PageDecl forPage = program.findPage(currentBlock.getForPage());
            if (forPage != null && forPage.findField(name) == null) {
                error(DiagnosticCodes.UNDEFINED_FIELD,
                        "Field '" + name + "' is not defined in page '" + forPage.getName() + "'",
                        target.getLocation());
            }
            return;
        }
        error(DiagnosticCodes.UNDEFINED_FIELD,
                "'" + name + "' is neither a variable nor a Page.field reference", target.getLocation());
    }

    private void checkExpression(Expression expression, final Scope scope) {
        if (expression == null) return;
        expression.accept(new ExpressionVisitor<Void>() {
            @Override
            public Void visitString(StringLiteral expr) {
                return null;
            }

            @Override
            public Void visitNumber(NumberLiteral expr) {
                return null;
            }

            @Override
            public Void visitBoolean(BooleanLiteral expr) {
                return null;
            }

            @Override
            public Void visitList(ListLiteral expr) {
                for (Expression element : expr.getElements()) {
                    element.accept(this);
                }
                return null;
            }

            @Override
            public Void visitVariable(VariableRef expr) {
                checkVariable(expr, scope);
                return null;
            }

            @Override
            public Void visitEnvVar(EnvVarRef expr) {
                return null;
            }
        });
    }

    private void checkVariable(VariableRef ref, Scope scope) {
        if (ref.isQualified()) {
            // 数据行的列访问（user.email）
            if (scope.resolve(ref.getPageName()) != null) return;
            PageDecl page = resolvePage(ref.getPageName(), ref.getLocation());
            if (page != null && !page.hasMember(ref.getName())) {
                error(DiagnosticCodes.UNDEFINED_FIELD,
                        "'" + ref.getName() + "' is not defined in page '" + page.getName() + "'",
                        ref.getLocation());
            }
            return;
        }
        if (scope.resolve(ref.getName()) != null) return;
        if (currentBlock != null) {
            PageDecl forPage = program.findPage(currentBlock.getForPage());
            if (forPage != null && forPage.hasMember(ref.getName())) return;
        }
        warning(DiagnosticCodes.POSSIBLY_UNDEFINED,
                "Variable '" + ref.getName() + "' may be undefined", ref.getLocation());
    }

    private void checkPerform(PerformStmt stmt) {
        List<ActionDecl> overloads;
        String blockLabel;
        if (stmt.getBlockName() != null) {
            PageActionsDecl block = program.findPageActions(stmt.getBlockName());
            if (block == null) {
                error(DiagnosticCodes.UNDEFINED_ACTION,
                        "PageActions '" + stmt.getBlockName() + "' is not defined", stmt.getLocation());
                return;
            }
            if (currentFeature != null && !currentFeature.getUses().contains(block.getName())) {
                error(DiagnosticCodes.PAGE_NOT_IN_USE,
                        "PageActions '" + block.getName() + "' is not listed in USE of feature '"
                                + currentFeature.getName() + "'", stmt.getLocation());
            }
            overloads = block.findOverloads(stmt.getActionName());
            blockLabel = block.getName();
        } else if (currentBlock != null) {
            overloads = currentBlock.findOverloads(stmt.getActionName());
            blockLabel = currentBlock.getName();
        } else {
            overloads = new ArrayList<ActionDecl>();
            for (String used : currentFeature.getUses()) {
                PageActionsDecl block = program.findPageActions(used);
                if (block != null) {
                    overloads.addAll(block.findOverloads(stmt.getActionName()));
                }
            }
            blockLabel = "any used PageActions";
        }

        if (overloads.isEmpty()) {
            error(DiagnosticCodes.UNDEFINED_ACTION,
                    "Action '" + stmt.getActionName() + "' is not defined in " + blockLabel, stmt.getLocation());
            return;
        }
        int arity = stmt.getArguments().size();
        List<Integer> arities = new ArrayList<Integer>();
        for (ActionDecl action : overloads) {
            if (action.getArity() == arity) return;
            arities.add(action.getArity());
        }
        error(DiagnosticCodes.ARITY_MISMATCH,
                "Action '" + stmt.getActionName() + "' has no overload taking " + arity
                        + " argument(s); declared arities: " + arities, stmt.getLocation());
    }

    private void checkCondition(Condition condition, Scope scope) {
        if (condition instanceof ElementStateCondition) {
            checkTarget(((ElementStateCondition) condition).getTarget(), scope);
        } else if (condition instanceof ComparisonCondition) {
            ComparisonCondition comparison = (ComparisonCondition) condition;
            checkExpression(comparison.getLeft(), scope);
            checkExpression(comparison.getRight(), scope);
        } else if (condition instanceof ContainsCondition) {
            ContainsCondition contains = (ContainsCondition) condition;
            checkExpression(contains.getSubject(), scope);
            checkExpression(contains.getValue(), scope);
        } else if (condition instanceof TruthCondition) {
            checkVariable(((TruthCondition) condition).getVariable(), scope);
        } else if (condition instanceof NotCondition) {
            checkCondition(((NotCondition) condition).getOperand(), scope);
        } else {
            throw new IllegalStateException("Unknown condition: " + condition.getClass().getSimpleName());
        }
    }

    private void checkQuery(QueryCondition condition, Scope scope) {
        if (condition == null) return;
        if (condition instanceof QueryComparison) {
            checkExpression(((QueryComparison) condition).getValue(), scope);
        } else if (condition instanceof QueryContains) {
            checkExpression(((QueryContains) condition).getValue(), scope);
        } else if (condition instanceof QueryIn) {
            for (Expression value : ((QueryIn) condition).getValues()) {
                checkExpression(value, scope);
            }
        } else if (condition instanceof QueryNot) {
            checkQuery(((QueryNot) condition).getOperand(), scope);
        } else if (condition instanceof QueryLogical) {
            checkQuery(((QueryLogical) condition).getLeft(), scope);
            checkQuery(((QueryLogical) condition).getRight(), scope);
        } else if (!(condition instanceof QueryEmpty)) {
            throw new IllegalStateException("Unknown query condition: " + condition.getClass().getSimpleName());
        }
    }

    private void checkStatements(List<Statement> statements, Scope scope) {
        for (Statement statement : statements) {
            statement.accept(this, scope);
        }
    }

    private void define(String name, SymbolKind kind, SourceLocation location, Scope scope) {
        scope.define(new Symbol(name, kind, location));
    }

    // ============ 语句访问 ============

    @Override
    public Void visitClick(ClickStmt stmt, Scope scope) {
        checkTarget(stmt.getTarget(), scope);
        return null;
    }

    @Override
    public Void visitDrag(DragStmt stmt, Scope scope) {
        checkTarget(stmt.getSource(), scope);
        checkTarget(stmt.getDestination(), scope);
        return null;
    }

    @Override
    public Void visitFill(FillStmt stmt, Scope scope) {
        checkTarget(stmt.getTarget(), scope);
        checkExpression(stmt.getValue(), scope);
        return null;
    }

    @Override
    public Void visitClear(ClearStmt stmt, Scope scope) {
        checkTarget(stmt.getTarget(), scope);
        return null;
    }

    @Override
    public Void visitSelect(SelectStmt stmt, Scope scope) {
        checkExpression(stmt.getOption(), scope);
        checkTarget(stmt.getTarget(), scope);
        return null;
    }

    @Override
    public Void visitCheck(CheckStmt stmt, Scope scope) {
        checkTarget(stmt.getTarget(), scope);
        return null;
    }

    @Override
    public Void visitHover(HoverStmt stmt, Scope scope) {
        checkTarget(stmt.getTarget(), scope);
        return null;
    }

    @Override
    public Void visitPress(PressStmt stmt, Scope scope) {
        checkExpression(stmt.getKey(), scope);
        return null;
    }

    @Override
    public Void visitScroll(ScrollStmt stmt, Scope scope) {
        checkTarget(stmt.getTarget(), scope);
        return null;
    }

    @Override
    public Void visitUpload(UploadStmt stmt, Scope scope) {
        for (Expression file : stmt.getFiles()) {
            checkExpression(file, scope);
        }
        checkTarget(stmt.getTarget(), scope);
        return null;
    }

    @Override
    public Void visitDownload(DownloadStmt stmt, Scope scope) {
        checkTarget(stmt.getTarget(), scope);
        checkExpression(stmt.getSaveAs(), scope);
        return null;
    }

    @Override
    public Void visitOpen(OpenStmt stmt, Scope scope) {
        checkExpression(stmt.getUrl(), scope);
        return null;
    }

    @Override
    public Void visitRefresh(RefreshStmt stmt, Scope scope) {
        return null;
    }

    @Override
    public Void visitWait(WaitStmt stmt, Scope scope) {
        checkExpression(stmt.getDuration(), scope);
        return null;
    }

    @Override
    public Void visitWaitForElement(WaitForElementStmt stmt, Scope scope) {
        checkTarget(stmt.getTarget(), scope);
        return null;
    }

    @Override
    public Void visitWaitForNavigation(WaitForNavigationStmt stmt, Scope scope) {
        return null;
    }

    @Override
    public Void visitWaitForNetworkIdle(WaitForNetworkIdleStmt stmt, Scope scope) {
        return null;
    }

    @Override
    public Void visitWaitForUrl(WaitForUrlStmt stmt, Scope scope) {
        checkExpression(stmt.getValue(), scope);
        return null;
    }

    @Override
    public Void visitSwitchToNewTab(SwitchToNewTabStmt stmt, Scope scope) {
        checkExpression(stmt.getUrl(), scope);
        return null;
    }

    @Override
    public Void visitSwitchToTab(SwitchToTabStmt stmt, Scope scope) {
        checkExpression(stmt.getIndex(), scope);
        return null;
    }

    @Override
    public Void visitSwitchToFrame(SwitchToFrameStmt stmt, Scope scope) {
        checkSelector(stmt.getSelector());
        return null;
    }

    @Override
    public Void visitSwitchToMainFrame(SwitchToMainFrameStmt stmt, Scope scope) {
        return null;
    }

    @Override
    public Void visitCloseTab(CloseTabStmt stmt, Scope scope) {
        return null;
    }

    @Override
    public Void visitAcceptDialog(AcceptDialogStmt stmt, Scope scope) {
        checkExpression(stmt.getPromptText(), scope);
        return null;
    }

    @Override
    public Void visitDismissDialog(DismissDialogStmt stmt, Scope scope) {
        return null;
    }

    @Override
    public Void visitSetCookie(SetCookieStmt stmt, Scope scope) {
        checkExpression(stmt.getName(), scope);
        checkExpression(stmt.getValue(), scope);
        return null;
    }

    @Override
    public Void visitClearCookies(ClearCookiesStmt stmt, Scope scope) {
        return null;
    }

    @Override
    public Void visitSetStorage(SetStorageStmt stmt, Scope scope) {
        checkExpression(stmt.getKey(), scope);
        checkExpression(stmt.getValue(), scope);
        return null;
    }

    @Override
    public Void visitClearStorage(ClearStorageStmt stmt, Scope scope) {
        return null;
    }

    @Override
    public Void visitLog(LogStmt stmt, Scope scope) {
        checkExpression(stmt.getMessage(), scope);
        return null;
    }

    @Override
    public Void visitTakeScreenshot(TakeScreenshotStmt stmt, Scope scope) {
        checkTarget(stmt.getTarget(), scope);
        return null;
    }

    @Override
    public Void visitVerifyState(VerifyStateStmt stmt, Scope scope) {
        checkTarget(stmt.getTarget(), scope);
        return null;
    }

    @Override
    public Void visitVerifyContains(VerifyContainsStmt stmt, Scope scope) {
        checkTarget(stmt.getTarget(), scope);
        checkExpression(stmt.getValue(), scope);
        return null;
    }

    @Override
    public Void visitVerifyProperty(VerifyPropertyStmt stmt, Scope scope) {
        checkTarget(stmt.getTarget(), scope);
        checkExpression(stmt.getValue(), scope);
        return null;
    }

    @Override
    public Void visitVerifyAttribute(VerifyAttributeStmt stmt, Scope scope) {
        checkTarget(stmt.getTarget(), scope);
        checkExpression(stmt.getAttribute(), scope);
        checkExpression(stmt.getValue(), scope);
        return null;
    }

    @Override
    public Void visitVerifyUrl(VerifyUrlStmt stmt, Scope scope) {
        checkExpression(stmt.getValue(), scope);
        return null;
    }

    @Override
    public Void visitVerifyTitle(VerifyTitleStmt stmt, Scope scope) {
        checkExpression(stmt.getValue(), scope);
        return null;
    }

    @Override
    public Void visitVerifyFlag(VerifyFlagStmt stmt, Scope scope) {
        checkVariable(stmt.getVariable(), scope);
        return null;
    }

    @Override
    public Void visitVerifyEquals(VerifyEqualsStmt stmt, Scope scope) {
        checkVariable(stmt.getVariable(), scope);
        checkExpression(stmt.getExpected(), scope);
        return null;
    }

    @Override
    public Void visitVerifyScreenshot(VerifyScreenshotStmt stmt, Scope scope) {
        checkTarget(stmt.getTarget(), scope);
        return null;
    }

    @Override
    public Void visitIf(IfStmt stmt, Scope scope) {
        checkCondition(stmt.getCondition(), scope);
        checkStatements(stmt.getThenBranch(), scope.child(Scope.ScopeType.BLOCK));
        checkStatements(stmt.getElseBranch(), scope.child(Scope.ScopeType.BLOCK));
        return null;
    }

    @Override
    public Void visitRepeat(RepeatStmt stmt, Scope scope) {
        checkExpression(stmt.getTimes(), scope);
        checkStatements(stmt.getBody(), scope.child(Scope.ScopeType.BLOCK));
        return null;
    }

    @Override
    public Void visitForEach(ForEachStmt stmt, Scope scope) {
        VariableRef collection = stmt.getCollection();
        boolean resolved = collection.isQualified()
                ? program.findPage(collection.getPageName()) != null
                        && program.findPage(collection.getPageName()).hasMember(collection.getName())
                : scope.resolve(collection.getName()) != null || isForPageMember(collection.getName());
        if (!resolved) {
            warning(DiagnosticCodes.UNDEFINED_COLLECTION,
                    "Collection '" + collection + "' in FOR EACH is not defined", collection.getLocation());
        }
        Scope body = scope.child(Scope.ScopeType.BLOCK);
        define(stmt.getItemName(), SymbolKind.LOOP_VARIABLE, stmt.getLocation(), body);
        checkStatements(stmt.getBody(), body);
        return null;
    }

    private boolean isForPageMember(String name) {
        if (currentBlock == null) return false;
        PageDecl forPage = program.findPage(currentBlock.getForPage());
        return forPage != null && forPage.hasMember(name);
    }

    @Override
    public Void visitTryCatch(TryCatchStmt stmt, Scope scope) {
        checkStatements(stmt.getTryBody(), scope.child(Scope.ScopeType.BLOCK));
        checkStatements(stmt.getCatchBody(), scope.child(Scope.ScopeType.BLOCK));
        return null;
    }

    @Override
    public Void visitPerform(PerformStmt stmt, Scope scope) {
        for (Expression argument : stmt.getArguments()) {
            checkExpression(argument, scope);
        }
        checkPerform(stmt);
        return null;
    }

    @Override
    public Void visitVariableDecl(VariableDeclStmt stmt, Scope scope) {
        checkExpression(stmt.getValue(), scope);
        define(stmt.getName(), SymbolKind.VARIABLE, stmt.getLocation(), scope);
        return null;
    }

    @Override
    public Void visitPerformAssign(PerformAssignStmt stmt, Scope scope) {
        visitPerform(stmt.getCall(), scope);
        define(stmt.getName(), SymbolKind.VARIABLE, stmt.getLocation(), scope);
        return null;
    }

    @Override
    public Void visitReturn(ReturnStmt stmt, Scope scope) {
        checkExpression(stmt.getValue(), scope);
        checkTarget(stmt.getTarget(), scope);
        return null;
    }

    @Override
    public Void visitLoad(LoadStmt stmt, Scope scope) {
        checkQuery(stmt.getWhere(), scope);
        define(stmt.getVariable(), SymbolKind.DATA, stmt.getLocation(), scope);
        return null;
    }

    @Override
    public Void visitRow(RowStmt stmt, Scope scope) {
        checkQuery(stmt.getWhere(), scope);
        define(stmt.getVariable(), SymbolKind.DATA, stmt.getLocation(), scope);
        return null;
    }

    @Override
    public Void visitRows(RowsStmt stmt, Scope scope) {
        checkQuery(stmt.getWhere(), scope);
        define(stmt.getVariable(), SymbolKind.DATA, stmt.getLocation(), scope);
        return null;
    }

    @Override
    public Void visitCount(CountStmt stmt, Scope scope) {
        checkQuery(stmt.getWhere(), scope);
        define(stmt.getVariable(), SymbolKind.DATA, stmt.getLocation(), scope);
        return null;
    }
}

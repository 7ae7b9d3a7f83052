package com.verolang.compiler.codegen;

import com.verolang.compiler.ast.expr.BooleanLiteral;
import com.verolang.compiler.ast.expr.EnvVarRef;
import com.verolang.compiler.ast.expr.Expression;
import com.verolang.compiler.ast.expr.NumberLiteral;
import com.verolang.compiler.ast.expr.StringLiteral;
import com.verolang.compiler.ast.expr.VariableRef;
import com.verolang.compiler.ast.stmt.*;

/**
 * 为语句生成步骤标题和调试事件中的动作名
 */
final class StepDescriber implements StatementVisitor<StepDescriber.StepInfo, Void> {

    static final class StepInfo {
        final String action;
        final String target;
        final String title;

        StepInfo(String action, String target, String title) {
            this.action = action;
            this.target = target;
            this.title = title;
        }
    }

    static final StepDescriber INSTANCE = new StepDescriber();

    static StepInfo describe(Statement statement) {
        return statement.accept(INSTANCE, null);
    }

    private static StepInfo step(String action, Target target, String title) {
        String described = target != null ? target.describe() : null;
        return new StepInfo(action, described, described != null ? title + " " + described : title);
    }

    private static StepInfo step(String action, String title) {
        return new StepInfo(action, null, title);
    }

    private static String text(Expression expression) {
        if (expression == null) return "";
        if (expression instanceof StringLiteral) return ((StringLiteral) expression).getValue();
        if (expression instanceof NumberLiteral) return ((NumberLiteral) expression).format();
        if (expression instanceof BooleanLiteral) return String.valueOf(((BooleanLiteral) expression).getValue());
        if (expression instanceof EnvVarRef) return "{{" + ((EnvVarRef) expression).getName() + "}}";
        if (expression instanceof VariableRef) return expression.toString();
        return "[list]";
    }

    @Override
    public StepInfo visitClick(ClickStmt stmt, Void context) {
        switch (stmt.getClickType()) {
            case RIGHT: return step("click", stmt.getTarget(), "Right click");
            case DOUBLE: return step("click", stmt.getTarget(), "Double click");
            case FORCE: return step("click", stmt.getTarget(), "Force click");
            default: return step("click", stmt.getTarget(), "Click");
        }
    }

    @Override
    public StepInfo visitDrag(DragStmt stmt, Void context) {
        return new StepInfo("drag", stmt.getSource().describe(),
                "Drag " + stmt.getSource().describe() + " to " + stmt.getDestination().describe());
    }

    @Override
    public StepInfo visitFill(FillStmt stmt, Void context) {
        return step("fill", stmt.getTarget(), "Fill");
    }

    @Override
    public StepInfo visitClear(ClearStmt stmt, Void context) {
        return step("clear", stmt.getTarget(), "Clear");
    }

    @Override
    public StepInfo visitSelect(SelectStmt stmt, Void context) {
        return new StepInfo("select", stmt.getTarget().describe(),
                "Select " + text(stmt.getOption()) + " from " + stmt.getTarget().describe());
    }

    @Override
    public StepInfo visitCheck(CheckStmt stmt, Void context) {
        return stmt.isChecked() ? step("check", stmt.getTarget(), "Check")
                : step("uncheck", stmt.getTarget(), "Uncheck");
    }

    @Override
    public StepInfo visitHover(HoverStmt stmt, Void context) {
        return step("hover", stmt.getTarget(), "Hover");
    }

    @Override
    public StepInfo visitPress(PressStmt stmt, Void context) {
        return step("press", "Press " + text(stmt.getKey()));
    }

    @Override
    public StepInfo visitScroll(ScrollStmt stmt, Void context) {
        switch (stmt.getDirection()) {
            case UP: return step("scroll", "Scroll up");
            case DOWN: return step("scroll", "Scroll down");
            default: return step("scroll", stmt.getTarget(), "Scroll to");
        }
    }

    @Override
    public StepInfo visitUpload(UploadStmt stmt, Void context) {
        return step("upload", stmt.getTarget(), "Upload to");
    }

    @Override
    public StepInfo visitDownload(DownloadStmt stmt, Void context) {
        return step("download", stmt.getTarget(), "Download from");
    }

    @Override
    public StepInfo visitOpen(OpenStmt stmt, Void context) {
        return new StepInfo("navigate", text(stmt.getUrl()), "Navigate to " + text(stmt.getUrl()));
    }

    @Override
    public StepInfo visitRefresh(RefreshStmt stmt, Void context) {
        return step("refresh", "Refresh page");
    }

    @Override
    public StepInfo visitWait(WaitStmt stmt, Void context) {
        return step("wait", "Wait " + text(stmt.getDuration()) + (stmt.isMilliseconds() ? " milliseconds" : " seconds"));
    }

    @Override
    public StepInfo visitWaitForElement(WaitForElementStmt stmt, Void context) {
        return step("wait", stmt.getTarget(), "Wait for");
    }

    @Override
    public StepInfo visitWaitForNavigation(WaitForNavigationStmt stmt, Void context) {
        return step("wait", "Wait for navigation");
    }

    @Override
    public StepInfo visitWaitForNetworkIdle(WaitForNetworkIdleStmt stmt, Void context) {
        return step("wait", "Wait for network idle");
    }

    @Override
    public StepInfo visitWaitForUrl(WaitForUrlStmt stmt, Void context) {
        return step("wait", "Wait for URL " + text(stmt.getValue()));
    }

    @Override
    public StepInfo visitSwitchToNewTab(SwitchToNewTabStmt stmt, Void context) {
        return step("tab", "Switch to new tab");
    }

    @Override
    public StepInfo visitSwitchToTab(SwitchToTabStmt stmt, Void context) {
        return step("tab", "Switch to tab " + text(stmt.getIndex()));
    }

    @Override
    public StepInfo visitSwitchToFrame(SwitchToFrameStmt stmt, Void context) {
        return new StepInfo("frame", stmt.getSelector().getValue(), "Switch to frame " + stmt.getSelector().getValue());
    }

    @Override
    public StepInfo visitSwitchToMainFrame(SwitchToMainFrameStmt stmt, Void context) {
        return step("frame", "Switch to main frame");
    }

    @Override
    public StepInfo visitCloseTab(CloseTabStmt stmt, Void context) {
        return step("tab", "Close tab");
    }

    @Override
    public StepInfo visitAcceptDialog(AcceptDialogStmt stmt, Void context) {
        return step("dialog", "Accept dialog");
    }

    @Override
    public StepInfo visitDismissDialog(DismissDialogStmt stmt, Void context) {
        return step("dialog", "Dismiss dialog");
    }

    @Override
    public StepInfo visitSetCookie(SetCookieStmt stmt, Void context) {
        return step("cookie", "Set cookie " + text(stmt.getName()));
    }

    @Override
    public StepInfo visitClearCookies(ClearCookiesStmt stmt, Void context) {
        return step("cookie", "Clear cookies");
    }

    @Override
    public StepInfo visitSetStorage(SetStorageStmt stmt, Void context) {
        return step("storage", "Set storage " + text(stmt.getKey()));
    }

    @Override
    public StepInfo visitClearStorage(ClearStorageStmt stmt, Void context) {
        return step("storage", "Clear storage");
    }

    @Override
    public StepInfo visitLog(LogStmt stmt, Void context) {
        return step("log", "Log: " + text(stmt.getMessage()));
    }

    @Override
    public StepInfo visitTakeScreenshot(TakeScreenshotStmt stmt, Void context) {
        String name = stmt.getFileName() != null ? stmt.getFileName() : "screenshot";
        return step("screenshot", stmt.getTarget(), "Screenshot: " + name + (stmt.getTarget() != null ? " of" : ""));
    }

    @Override
    public StepInfo visitVerifyState(VerifyStateStmt stmt, Void context) {
        return new StepInfo("verify", stmt.getTarget().describe(), "Verify " + stmt.getTarget().describe()
                + " is " + (stmt.isNegated() ? "not " : "") + stmt.getState().name().toLowerCase());
    }

    @Override
    public StepInfo visitVerifyContains(VerifyContainsStmt stmt, Void context) {
        return new StepInfo("verify", stmt.getTarget().describe(), "Verify " + stmt.getTarget().describe()
                + (stmt.isNegated() ? " does not contain " : " contains ") + text(stmt.getValue()));
    }

    @Override
    public StepInfo visitVerifyProperty(VerifyPropertyStmt stmt, Void context) {
        return new StepInfo("verify", stmt.getTarget().describe(), "Verify " + stmt.getTarget().describe()
                + " has " + stmt.getProperty().name().toLowerCase() + " " + text(stmt.getValue()));
    }

    @Override
    public StepInfo visitVerifyAttribute(VerifyAttributeStmt stmt, Void context) {
        return new StepInfo("verify", stmt.getTarget().describe(), "Verify " + stmt.getTarget().describe()
                + " has attribute " + text(stmt.getAttribute()));
    }

    @Override
    public StepInfo visitVerifyUrl(VerifyUrlStmt stmt, Void context) {
        return step("verify", "Verify URL " + stmt.getMatch().name().toLowerCase() + " " + text(stmt.getValue()));
    }

    @Override
    public StepInfo visitVerifyTitle(VerifyTitleStmt stmt, Void context) {
        return step("verify", "Verify title " + stmt.getMatch().name().toLowerCase() + " " + text(stmt.getValue()));
    }

    @Override
    public StepInfo visitVerifyFlag(VerifyFlagStmt stmt, Void context) {
        return step("verify", "Verify " + stmt.getVariable() + " is " + stmt.isExpected());
    }

    @Override
    public StepInfo visitVerifyEquals(VerifyEqualsStmt stmt, Void context) {
        return step("verify", "Verify " + stmt.getVariable() + " equals " + text(stmt.getExpected()));
    }

    @Override
    public StepInfo visitVerifyScreenshot(VerifyScreenshotStmt stmt, Void context) {
        String name = stmt.getName() != null ? " " + stmt.getName() : "";
        if (stmt.getTarget() == null) {
            return step("verify", "Verify screenshot" + name);
        }
        return new StepInfo("verify", stmt.getTarget().describe(),
                "Verify " + stmt.getTarget().describe() + " matches screenshot" + name);
    }

    @Override
    public StepInfo visitIf(IfStmt stmt, Void context) {
        return step("if", "If");
    }

    @Override
    public StepInfo visitRepeat(RepeatStmt stmt, Void context) {
        return step("repeat", "Repeat " + text(stmt.getTimes()) + " times");
    }

    @Override
    public StepInfo visitForEach(ForEachStmt stmt, Void context) {
        return step("for-each", "For each " + stmt.getItemName() + " in " + stmt.getCollection());
    }

    @Override
    public StepInfo visitTryCatch(TryCatchStmt stmt, Void context) {
        return step("try", "Try");
    }

    @Override
    public StepInfo visitPerform(PerformStmt stmt, Void context) {
        String name = stmt.getBlockName() != null
                ? stmt.getBlockName() + "." + stmt.getActionName() : stmt.getActionName();
        return new StepInfo("perform", name, "Perform " + name);
    }

    @Override
    public StepInfo visitVariableDecl(VariableDeclStmt stmt, Void context) {
        return step("variable", "Set " + stmt.getName());
    }

    @Override
    public StepInfo visitPerformAssign(PerformAssignStmt stmt, Void context) {
        return step("perform", "Set " + stmt.getName());
    }

    @Override
    public StepInfo visitReturn(ReturnStmt stmt, Void context) {
        return step("return", "Return");
    }

    @Override
    public StepInfo visitLoad(LoadStmt stmt, Void context) {
        return new StepInfo("data", stmt.getTable(), "Load " + stmt.getVariable() + " from " + stmt.getTable());
    }

    @Override
    public StepInfo visitRow(RowStmt stmt, Void context) {
        return new StepInfo("data", stmt.getTable().getQualifiedName(),
                "Row " + stmt.getVariable() + " from " + stmt.getTable());
    }

    @Override
    public StepInfo visitRows(RowsStmt stmt, Void context) {
        return new StepInfo("data", stmt.getTable().getQualifiedName(),
                "Rows " + stmt.getVariable() + " from " + stmt.getTable());
    }

    @Override
    public StepInfo visitCount(CountStmt stmt, Void context) {
        return new StepInfo("data", stmt.getTable().getQualifiedName(),
                "Count " + stmt.getVariable() + " from " + stmt.getTable());
    }
}

package com.verolang.compiler.ast.stmt;

/**
 * 语句访问者
 * <p>
 * 没有默认实现：新增语句类型时，所有访问者都必须处理它。
 */
public interface StatementVisitor<R, C> {
    R visitClick(ClickStmt stmt, C context);
    R visitDrag(DragStmt stmt, C context);
    R visitFill(FillStmt stmt, C context);
    R visitClear(ClearStmt stmt, C context);
    R visitSelect(SelectStmt stmt, C context);
    R visitCheck(CheckStmt stmt, C context);
    R visitHover(HoverStmt stmt, C context);
    R visitPress(PressStmt stmt, C context);
    R visitScroll(ScrollStmt stmt, C context);
    R visitUpload(UploadStmt stmt, C context);
    R visitDownload(DownloadStmt stmt, C context);
    R visitOpen(OpenStmt stmt, C context);
    R visitRefresh(RefreshStmt stmt, C context);
    R visitWait(WaitStmt stmt, C context);
    R visitWaitForElement(WaitForElementStmt stmt, C context);
    R visitWaitForNavigation(WaitForNavigationStmt stmt, C context);
    R visitWaitForNetworkIdle(WaitForNetworkIdleStmt stmt, C context);
    R visitWaitForUrl(WaitForUrlStmt stmt, C context);
    R visitSwitchToNewTab(SwitchToNewTabStmt stmt, C context);
    R visitSwitchToTab(SwitchToTabStmt stmt, C context);
    R visitSwitchToFrame(SwitchToFrameStmt stmt, C context);
    R visitSwitchToMainFrame(SwitchToMainFrameStmt stmt, C context);
    R visitCloseTab(CloseTabStmt stmt, C context);
    R visitAcceptDialog(AcceptDialogStmt stmt, C context);
    R visitDismissDialog(DismissDialogStmt stmt, C context);
    R visitSetCookie(SetCookieStmt stmt, C context);
    R visitClearCookies(ClearCookiesStmt stmt, C context);
    R visitSetStorage(SetStorageStmt stmt, C context);
    R visitClearStorage(ClearStorageStmt stmt, C context);
    R visitLog(LogStmt stmt, C context);
    R visitTakeScreenshot(TakeScreenshotStmt stmt, C context);
    R visitVerifyState(VerifyStateStmt stmt, C context);
    R visitVerifyContains(VerifyContainsStmt stmt, C context);
    R visitVerifyProperty(VerifyPropertyStmt stmt, C context);
    R visitVerifyAttribute(VerifyAttributeStmt stmt, C context);
    R visitVerifyUrl(VerifyUrlStmt stmt, C context);
    R visitVerifyTitle(VerifyTitleStmt stmt, C context);
    R visitVerifyFlag(VerifyFlagStmt stmt, C context);
    R visitVerifyEquals(VerifyEqualsStmt stmt, C context);
    R visitVerifyScreenshot(VerifyScreenshotStmt stmt, C context);
    R visitIf(IfStmt stmt, C context);
    R visitRepeat(RepeatStmt stmt, C context);
    R visitForEach(ForEachStmt stmt, C context);
    R visitTryCatch(TryCatchStmt stmt, C context);
    R visitPerform(PerformStmt stmt, C context);
    R visitVariableDecl(VariableDeclStmt stmt, C context);
    R visitPerformAssign(PerformAssignStmt stmt, C context);
    R visitReturn(ReturnStmt stmt, C context);
    R visitLoad(LoadStmt stmt, C context);
    R visitRow(RowStmt stmt, C context);
    R visitRows(RowsStmt stmt, C context);
    R visitCount(CountStmt stmt, C context);
}

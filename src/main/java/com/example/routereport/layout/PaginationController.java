package com.example.routereport.layout;

import com.example.routereport.model.Cursor;
import com.example.routereport.model.PageGeometry;
import com.example.routereport.model.PaginationState;
import com.example.routereport.model.RenderSession;
import com.example.routereport.model.RenderState;
import com.example.routereport.model.TableStyle;
import com.example.routereport.surface.TableFont;

import java.io.IOException;

/**
 * Decides where a table's rows land.
 * <pre>
 * IDLE -> HEADER_PENDING -> BODY_RENDERING -> PAGE_BREAK -> HEADER_PENDING ... -> DONE
 * </pre>
 * Rows are checked before any of their drawing starts, so a row is never split
 * across pages. A row taller than a whole page is drawn anyway when it is the
 * first row below a header that started at the top of the page.
 */
public class PaginationController {

    private final RenderSession session;
    private final PageGeometry geometry;

    public PaginationController(RenderSession session, PageGeometry geometry) {
        this.session = session;
        this.geometry = geometry;
    }

    public PaginationState getState() {
        return session.getRenderState().getState();
    }

    public void begin() {
        require(PaginationState.IDLE);
        RenderState state = session.getRenderState();
        state.pageStarted(isAtTopOfPage());
        state.setState(PaginationState.HEADER_PENDING);
    }

    public boolean fits(float height) {
        return session.getCursor().getY() - height >= geometry.getBottomMargin();
    }

    /**
     * True when the title, header and first row would not fit below the
     * starting position but would on a fresh page.
     */
    public boolean needsFreshPageBeforeHeader(float requiredHeight) {
        require(PaginationState.HEADER_PENDING);
        return !fits(requiredHeight) && !session.getRenderState().isPageStartedAtTop();
    }

    /**
     * Starts the table on a new page. Nothing of the table was drawn yet, so
     * no continued note is written.
     */
    public void moveTableToNewPage() throws IOException {
        require(PaginationState.HEADER_PENDING);
        newPage();
    }

    public void headerEmitted() {
        require(PaginationState.HEADER_PENDING);
        RenderState state = session.getRenderState();
        if (state.isHeadersEmittedOnCurrentPage()) {
            throw new IllegalStateException("Header already drawn on page " + session.getCursor().getPageNumber());
        }
        state.headerEmitted();
        state.setState(PaginationState.BODY_RENDERING);
    }

    public boolean shouldBreakBefore(float rowHeight) {
        require(PaginationState.BODY_RENDERING);
        if (fits(rowHeight)) {
            return false;
        }
        RenderState state = session.getRenderState();
        // oversize row: another break would leave it just as short of space
        return !(state.getRowsOnCurrentPage() == 0 && state.isPageStartedAtTop());
    }

    public void breakPage(TableStyle style, boolean moreRowsRemain) throws IOException {
        require(PaginationState.BODY_RENDERING);
        RenderState state = session.getRenderState();
        state.setState(PaginationState.PAGE_BREAK);

        if (moreRowsRemain) {
            drawContinuedNote(style);
        }
        newPage();
        state.setState(PaginationState.HEADER_PENDING);
    }

    public void finish() {
        require(PaginationState.BODY_RENDERING);
        session.getRenderState().setState(PaginationState.DONE);
    }

    private void newPage() throws IOException {
        session.getSurface().startNewPage();
        session.getCursor().newPage(geometry.getTopY());
        session.getRenderState().pageStarted(true);
    }

    private void drawContinuedNote(TableStyle style) throws IOException {
        String note = style.getContinuedNote();
        if (note == null || note.isEmpty()) return;

        float size = style.getContinuedNoteFontSize();
        Cursor cursor = session.getCursor();
        // just under the last row, inside the reserved bottom margin
        float baseline = Math.max(size * 0.5f, Math.min(cursor.getY(), geometry.getBottomMargin()) - size - 2f);

        session.getSurface().setFillColor(style.getContinuedNoteColor());
        session.getSurface().drawText(session.getStartX() + style.getTextPaddingX(), baseline, note, TableFont.ITALIC, size);
    }

    private boolean isAtTopOfPage() {
        return session.getCursor().getY() >= geometry.getTopY() - 0.01f;
    }

    private void require(PaginationState expected) {
        PaginationState actual = getState();
        if (actual != expected) {
            throw new IllegalStateException("Pagination is " + actual + ", expected " + expected);
        }
    }
}

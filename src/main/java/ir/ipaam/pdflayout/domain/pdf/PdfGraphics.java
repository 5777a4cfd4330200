package ir.ipaam.pdflayout.domain.pdf;

import ir.ipaam.pdflayout.domain.exception.UnbalancedGraphicsStateException;
import ir.ipaam.pdflayout.domain.graphics.GraphicsContext;
import ir.ipaam.pdflayout.domain.graphics.Transform2D;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Writes content stream operators in native PDF space (origin bottom-left, Y up).
 */
public class PdfGraphics implements GraphicsContext {

    private final PdfPage page;
    private final PdfStream buffer;
    private final boolean verbose;
    private final Deque<GraphicsState> stack = new ArrayDeque<>();
    private GraphicsState state = new GraphicsState(Transform2D.IDENTITY, null, 0);

    PdfGraphics(PdfPage page, PdfStream buffer, boolean verbose) {
        this.page = page;
        this.buffer = buffer;
        this.verbose = verbose;
    }

    public PdfPage getPage() {
        return page;
    }

    @Override
    public void saveContext() {
        stack.push(state);
        buffer.putString("q\n");
    }

    @Override
    public void restoreContext() {
        if (stack.isEmpty()) {
            throw new UnbalancedGraphicsStateException("page " + page.getSerial(), 0, -1);
        }
        state = stack.pop();
        buffer.putString("Q\n");
    }

    @Override
    public int getStackDepth() {
        return stack.size();
    }

    @Override
    public void setTransform(Transform2D transform) {
        putNumbers(transform.a(), transform.b(), transform.c(), transform.d(), transform.tx(), transform.ty());
        buffer.putString("cm\n");
        state = state.withTransform(transform.multiply(state.transform()));
    }

    @Override
    public Transform2D getTransform() {
        return state.transform();
    }

    @Override
    public void moveTo(double x, double y) {
        putNumbers(x, y);
        buffer.putString("m\n");
    }

    @Override
    public void lineTo(double x, double y) {
        putNumbers(x, y);
        buffer.putString("l\n");
    }

    @Override
    public void curveTo(double x1, double y1, double x2, double y2, double x3, double y3) {
        putNumbers(x1, y1, x2, y2, x3, y3);
        buffer.putString("c\n");
    }

    @Override
    public void drawRect(double x, double y, double width, double height) {
        putNumbers(x, y, width, height);
        buffer.putString("re\n");
    }

    @Override
    public void closePath() {
        buffer.putString("h\n");
    }

    @Override
    public void fillPath(boolean evenOdd) {
        buffer.putString(evenOdd ? "f*\n" : "f\n");
    }

    @Override
    public void strokePath(boolean close) {
        buffer.putString(close ? "s\n" : "S\n");
    }

    @Override
    public void fillAndStrokePath(boolean evenOdd, boolean close) {
        String op = close ? "b" : "B";
        buffer.putString(op + (evenOdd ? "*" : "") + "\n");
    }

    @Override
    public void clipPath(boolean evenOdd, boolean end) {
        buffer.putString(evenOdd ? "W*" : "W");
        buffer.putString(end ? " n\n" : "\n");
    }

    @Override
    public void setLineWidth(double width) {
        putNumbers(width);
        buffer.putString("w\n");
    }

    @Override
    public void setLineCap(LineCap cap) {
        buffer.putString(cap.code() + " J\n");
    }

    @Override
    public void setLineJoin(LineJoin join) {
        buffer.putString(join.code() + " j\n");
    }

    @Override
    public void setFillColor(PdfColor color) {
        putNumbers(color.red(), color.green(), color.blue());
        buffer.putString("rg\n");
    }

    @Override
    public void setStrokeColor(PdfColor color) {
        putNumbers(color.red(), color.green(), color.blue());
        buffer.putString("RG\n");
    }

    @Override
    public void beginText() {
        buffer.putString("BT\n");
    }

    @Override
    public void endText() {
        buffer.putString("ET\n");
    }

    @Override
    public void moveTextPosition(double x, double y) {
        putNumbers(x, y);
        buffer.putString("Td\n");
    }

    @Override
    public void setFont(PdfFont font, double size) {
        setFont(font, size, 0, 0, 100, TextRenderingMode.FILL);
    }

    public void setFont(PdfFont font, double size, double charSpace, double wordSpace, double scale,
                        TextRenderingMode mode) {
        page.useFont(font);
        buffer.putString(font.getResourceName() + " ");
        putNumbers(size);
        buffer.putString("Tf ");
        putNumbers(charSpace);
        buffer.putString("Tc ");
        putNumbers(wordSpace);
        buffer.putString("Tw ");
        putNumbers(scale);
        buffer.putString("Tz " + mode.code() + " Tr\n");
        state = state.withFont(font, size);
    }

    @Override
    public void showText(String text) {
        if (state.font() == null) {
            throw new IllegalStateException("No font selected before showing text");
        }
        PdfString.ofBytes(state.font().encode(text)).output(buffer);
        buffer.putString(" Tj\n");
    }

    @Override
    public void comment(String text) {
        if (verbose) {
            buffer.putComment(text);
        }
    }

    private void putNumbers(double... values) {
        for (double value : values) {
            buffer.putString(PdfNum.format(value)).putString(" ");
        }
    }

    private record GraphicsState(Transform2D transform, PdfFont font, double fontSize) {

        GraphicsState withTransform(Transform2D transform) {
            return new GraphicsState(transform, font, fontSize);
        }

        GraphicsState withFont(PdfFont font, double fontSize) {
            return new GraphicsState(transform, font, fontSize);
        }
    }
}

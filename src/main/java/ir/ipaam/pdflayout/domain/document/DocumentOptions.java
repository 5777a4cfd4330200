package ir.ipaam.pdflayout.domain.document;

import ir.ipaam.pdflayout.domain.font.FontMetricsProvider;
import ir.ipaam.pdflayout.domain.font.StandardFontMetricsProvider;
import ir.ipaam.pdflayout.domain.layout.LayoutInstrumentation;
import ir.ipaam.pdflayout.domain.pdf.DocumentInfo;
import ir.ipaam.pdflayout.domain.pdf.PdfDocumentSettings;
import ir.ipaam.pdflayout.domain.theme.ThemeData;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class DocumentOptions {

    @Builder.Default
    private final DocumentInfo info = DocumentInfo.empty();
    @Builder.Default
    private final PdfDocumentSettings settings = PdfDocumentSettings.defaults();
    @Builder.Default
    private final ThemeData theme = ThemeData.defaults();
    @Builder.Default
    private final FontMetricsProvider fontMetrics = new StandardFontMetricsProvider();
    @Builder.Default
    private final LayoutInstrumentation instrumentation = LayoutInstrumentation.NONE;
    @Builder.Default
    private final boolean layoutCache = true;
}

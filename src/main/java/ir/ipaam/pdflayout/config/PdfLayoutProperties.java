package ir.ipaam.pdflayout.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "pdflayout")
public class PdfLayoutProperties {

    /**
     * Page format used when a page gives neither a format nor an explicit size.
     */
    private String defaultFormat = "LETTER";
    private double defaultMargin = 20;
    private String pdfVersion = "1.4";
    private boolean compress = false;
    private boolean verbose = false;
    private boolean layoutCache = true;
    private String defaultFontFamily = "Helvetica";
    private double defaultFontSize = 12;
    private String producer = "pdf-layout-service";
}

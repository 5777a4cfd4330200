package ir.ipaam.pdflayout.api.mapper;

import com.fasterxml.jackson.databind.ObjectMapper;
import ir.ipaam.pdflayout.api.dto.DocumentRequest;
import ir.ipaam.pdflayout.api.dto.EdgeInsetsRequest;
import ir.ipaam.pdflayout.api.dto.TextStyleRequest;
import ir.ipaam.pdflayout.api.dto.WidgetSpec;
import ir.ipaam.pdflayout.domain.geometry.EdgeInsets;
import ir.ipaam.pdflayout.domain.layout.Widget;
import ir.ipaam.pdflayout.domain.pdf.PdfColor;
import ir.ipaam.pdflayout.domain.theme.TextStyle;
import ir.ipaam.pdflayout.domain.widget.Center;
import ir.ipaam.pdflayout.domain.widget.Column;
import ir.ipaam.pdflayout.domain.widget.Row;
import ir.ipaam.pdflayout.domain.widget.Text;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class WidgetSpecMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void mapsJsonTreeToWidgets() throws IOException {
        DocumentRequest request = readFixture();

        Widget first = WidgetSpecMapper.toWidget(request.getPages().get(0).getContent());
        Widget second = WidgetSpecMapper.toWidget(request.getPages().get(1).getContent());

        Column column = assertInstanceOf(Column.class, first);
        assertThat(column.getChildren()).hasSize(4);
        assertInstanceOf(Row.class, column.getChildren().get(1));
        assertInstanceOf(Center.class, second);
    }

    @Test
    void textSpecKeepsKey() {
        WidgetSpec.TextSpec spec = new WidgetSpec.TextSpec();
        spec.setKey("headline");
        spec.setText("Hello");

        Widget widget = WidgetSpecMapper.toWidget(spec);

        assertInstanceOf(Text.class, widget);
        assertThat(widget.getKey()).isEqualTo("headline");
    }

    @Test
    void camelCaseEnumNamesAreAccepted() {
        WidgetSpec.RowSpec spec = new WidgetSpec.RowSpec();
        spec.setMainAxisAlignment("spaceEvenly");
        spec.setCrossAxisAlignment("END");
        spec.setMainAxisSize("min");

        assertInstanceOf(Row.class, WidgetSpecMapper.toWidget(spec));
    }

    @Test
    void unknownEnumValueIsRejected() {
        WidgetSpec.AlignSpec spec = new WidgetSpec.AlignSpec();
        spec.setAlignment("somewhere");

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> WidgetSpecMapper.toWidget(spec));

        assertThat(ex.getMessage()).contains("Unknown Alignment: somewhere");
    }

    @Test
    void textStyleLeavesUnsetFieldsNull() {
        TextStyleRequest request = new TextStyleRequest();
        request.setFontSize(18.0);
        request.setColor("#ff0000");

        TextStyle style = WidgetSpecMapper.toTextStyle(request);

        assertThat(style.fontSize()).isEqualTo(18.0);
        assertThat(style.color()).isEqualTo(PdfColor.RED);
        assertNull(style.fontFamily());
        assertNull(style.bold());
    }

    @Test
    void edgeInsetsDefaultToZero() {
        assertThat(WidgetSpecMapper.toEdgeInsets(null)).isEqualTo(EdgeInsets.ZERO);
        assertThat(WidgetSpecMapper.toEdgeInsets(new EdgeInsetsRequest(1, 2, 3, 4)))
                .isEqualTo(new EdgeInsets(1, 2, 3, 4));
    }

    @Test
    void blankColorMeansUnset() {
        assertNull(WidgetSpecMapper.toColor(" "));
        assertThrows(IllegalArgumentException.class, () -> WidgetSpecMapper.toColor("#12345"));
    }

    private DocumentRequest readFixture() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/requests/invoice.json")) {
            return objectMapper.readValue(in, DocumentRequest.class);
        }
    }
}

package ir.ipaam.pdflayout.api.mapper;

import ir.ipaam.pdflayout.api.dto.EdgeInsetsRequest;
import ir.ipaam.pdflayout.api.dto.TextStyleRequest;
import ir.ipaam.pdflayout.api.dto.WidgetSpec;
import ir.ipaam.pdflayout.domain.geometry.Alignment;
import ir.ipaam.pdflayout.domain.geometry.EdgeInsets;
import ir.ipaam.pdflayout.domain.layout.Widget;
import ir.ipaam.pdflayout.domain.pdf.PdfColor;
import ir.ipaam.pdflayout.domain.theme.TextStyle;
import ir.ipaam.pdflayout.domain.widget.Align;
import ir.ipaam.pdflayout.domain.widget.BorderSide;
import ir.ipaam.pdflayout.domain.widget.BoxDecoration;
import ir.ipaam.pdflayout.domain.widget.Center;
import ir.ipaam.pdflayout.domain.widget.Column;
import ir.ipaam.pdflayout.domain.widget.Container;
import ir.ipaam.pdflayout.domain.widget.CrossAxisAlignment;
import ir.ipaam.pdflayout.domain.widget.Expanded;
import ir.ipaam.pdflayout.domain.widget.FlexFit;
import ir.ipaam.pdflayout.domain.widget.Flexible;
import ir.ipaam.pdflayout.domain.widget.IntrinsicWidth;
import ir.ipaam.pdflayout.domain.widget.MainAxisAlignment;
import ir.ipaam.pdflayout.domain.widget.MainAxisSize;
import ir.ipaam.pdflayout.domain.widget.Padding;
import ir.ipaam.pdflayout.domain.widget.Positioned;
import ir.ipaam.pdflayout.domain.widget.Row;
import ir.ipaam.pdflayout.domain.widget.SizedBox;
import ir.ipaam.pdflayout.domain.widget.Stack;
import ir.ipaam.pdflayout.domain.widget.StackFit;
import ir.ipaam.pdflayout.domain.widget.Text;
import ir.ipaam.pdflayout.domain.widget.TextAlign;
import ir.ipaam.pdflayout.domain.widget.TextOverflow;

import java.util.List;
import java.util.Locale;

/**
 * Turns request DTOs into widget trees and value objects.
 */
public final class WidgetSpecMapper {

    private WidgetSpecMapper() {
    }

    public static Widget toWidget(WidgetSpec spec) {
        if (spec == null) {
            return null;
        }
        if (spec instanceof WidgetSpec.TextSpec text) {
            return Text.builder()
                    .key(text.getKey())
                    .content(text.getText())
                    .style(toTextStyle(text.getStyle()))
                    .textAlign(enumOrDefault(TextAlign.class, text.getTextAlign(), TextAlign.START))
                    .overflow(enumOrDefault(TextOverflow.class, text.getOverflow(), TextOverflow.CLIP))
                    .maxLines(text.getMaxLines())
                    .softWrap(text.getSoftWrap() == null || text.getSoftWrap())
                    .build();
        }
        if (spec instanceof WidgetSpec.ContainerSpec container) {
            return Container.builder()
                    .key(container.getKey())
                    .child(toWidget(container.getChild()))
                    .padding(toEdgeInsets(container.getPadding()))
                    .margin(toEdgeInsets(container.getMargin()))
                    .width(container.getWidth())
                    .height(container.getHeight())
                    .alignment(enumOrDefault(Alignment.class, container.getAlignment(), Alignment.CENTER))
                    .decoration(toDecoration(container))
                    .build();
        }
        if (spec instanceof WidgetSpec.PaddingSpec padding) {
            return Padding.builder()
                    .key(padding.getKey())
                    .padding(toEdgeInsets(padding.getPadding()))
                    .child(toWidget(padding.getChild()))
                    .build();
        }
        if (spec instanceof WidgetSpec.CenterSpec center) {
            return Center.builder()
                    .key(center.getKey())
                    .child(toWidget(center.getChild()))
                    .build();
        }
        if (spec instanceof WidgetSpec.AlignSpec align) {
            return Align.builder()
                    .key(align.getKey())
                    .alignment(enumOrDefault(Alignment.class, align.getAlignment(), Alignment.CENTER))
                    .widthFactor(align.getWidthFactor())
                    .heightFactor(align.getHeightFactor())
                    .child(toWidget(align.getChild()))
                    .build();
        }
        if (spec instanceof WidgetSpec.SizedBoxSpec box) {
            return SizedBox.builder()
                    .key(box.getKey())
                    .width(box.getWidth())
                    .height(box.getHeight())
                    .child(toWidget(box.getChild()))
                    .build();
        }
        if (spec instanceof WidgetSpec.RowSpec row) {
            return Row.builder()
                    .key(row.getKey())
                    .children(toWidgets(row.getChildren()))
                    .mainAxisAlignment(enumOrDefault(MainAxisAlignment.class, row.getMainAxisAlignment(), MainAxisAlignment.START))
                    .crossAxisAlignment(enumOrDefault(CrossAxisAlignment.class, row.getCrossAxisAlignment(), CrossAxisAlignment.CENTER))
                    .mainAxisSize(enumOrDefault(MainAxisSize.class, row.getMainAxisSize(), MainAxisSize.MAX))
                    .spacing(row.getSpacing())
                    .build();
        }
        if (spec instanceof WidgetSpec.ColumnSpec column) {
            return Column.builder()
                    .key(column.getKey())
                    .children(toWidgets(column.getChildren()))
                    .mainAxisAlignment(enumOrDefault(MainAxisAlignment.class, column.getMainAxisAlignment(), MainAxisAlignment.START))
                    .crossAxisAlignment(enumOrDefault(CrossAxisAlignment.class, column.getCrossAxisAlignment(), CrossAxisAlignment.CENTER))
                    .mainAxisSize(enumOrDefault(MainAxisSize.class, column.getMainAxisSize(), MainAxisSize.MAX))
                    .spacing(column.getSpacing())
                    .build();
        }
        if (spec instanceof WidgetSpec.ExpandedSpec expanded) {
            return Expanded.builder()
                    .key(expanded.getKey())
                    .flex(expanded.getFlex())
                    .child(toWidget(expanded.getChild()))
                    .build();
        }
        if (spec instanceof WidgetSpec.FlexibleSpec flexible) {
            return Flexible.builder()
                    .key(flexible.getKey())
                    .flex(flexible.getFlex())
                    .fit(enumOrDefault(FlexFit.class, flexible.getFit(), FlexFit.LOOSE))
                    .child(toWidget(flexible.getChild()))
                    .build();
        }
        if (spec instanceof WidgetSpec.StackSpec stack) {
            return Stack.builder()
                    .key(stack.getKey())
                    .children(toWidgets(stack.getChildren()))
                    .alignment(enumOrDefault(Alignment.class, stack.getAlignment(), Alignment.TOP_LEFT))
                    .fit(enumOrDefault(StackFit.class, stack.getFit(), StackFit.LOOSE))
                    .clip(stack.isClip())
                    .build();
        }
        if (spec instanceof WidgetSpec.PositionedSpec positioned) {
            return Positioned.builder()
                    .key(positioned.getKey())
                    .left(positioned.getLeft())
                    .top(positioned.getTop())
                    .right(positioned.getRight())
                    .bottom(positioned.getBottom())
                    .width(positioned.getWidth())
                    .height(positioned.getHeight())
                    .child(toWidget(positioned.getChild()))
                    .build();
        }
        if (spec instanceof WidgetSpec.IntrinsicWidthSpec intrinsic) {
            return IntrinsicWidth.builder()
                    .key(intrinsic.getKey())
                    .child(toWidget(intrinsic.getChild()))
                    .build();
        }
        throw new IllegalArgumentException("Unsupported widget type: " + spec.getClass().getSimpleName());
    }

    public static EdgeInsets toEdgeInsets(EdgeInsetsRequest request) {
        if (request == null) {
            return EdgeInsets.ZERO;
        }
        return new EdgeInsets(request.getTop(), request.getRight(), request.getBottom(), request.getLeft());
    }

    public static TextStyle toTextStyle(TextStyleRequest request) {
        if (request == null) {
            return null;
        }
        return TextStyle.builder()
                .fontFamily(request.getFontFamily())
                .fontSize(request.getFontSize())
                .bold(request.getBold())
                .italic(request.getItalic())
                .color(toColor(request.getColor()))
                .lineHeight(request.getLineHeight())
                .underline(request.getUnderline())
                .build();
    }

    public static PdfColor toColor(String hex) {
        return hex == null || hex.isBlank() ? null : PdfColor.fromHex(hex);
    }

    private static BoxDecoration toDecoration(WidgetSpec.ContainerSpec container) {
        PdfColor fill = toColor(container.getColor());
        PdfColor borderColor = toColor(container.getBorderColor());
        if (fill == null && borderColor == null) {
            return null;
        }
        BorderSide border = null;
        if (borderColor != null) {
            double width = container.getBorderWidth() != null ? container.getBorderWidth() : 1;
            border = new BorderSide(borderColor, width);
        }
        return BoxDecoration.builder()
                .color(fill)
                .border(border)
                .borderRadius(container.getBorderRadius())
                .build();
    }

    private static List<Widget> toWidgets(List<WidgetSpec> specs) {
        if (specs == null) {
            return List.of();
        }
        return specs.stream().map(WidgetSpecMapper::toWidget).toList();
    }

    private static <E extends Enum<E>> E enumOrDefault(Class<E> type, String value, E fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String normalized = value.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(type, normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown " + type.getSimpleName() + ": " + value, ex);
        }
    }
}

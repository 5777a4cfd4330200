package ir.ipaam.pdflayout.api.dto;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON description of a widget tree. The {@code type} property selects the widget.
 */
@Data
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = WidgetSpec.TextSpec.class, name = "text"),
        @JsonSubTypes.Type(value = WidgetSpec.ContainerSpec.class, name = "container"),
        @JsonSubTypes.Type(value = WidgetSpec.PaddingSpec.class, name = "padding"),
        @JsonSubTypes.Type(value = WidgetSpec.AlignSpec.class, name = "align"),
        @JsonSubTypes.Type(value = WidgetSpec.CenterSpec.class, name = "center"),
        @JsonSubTypes.Type(value = WidgetSpec.SizedBoxSpec.class, name = "sizedBox"),
        @JsonSubTypes.Type(value = WidgetSpec.RowSpec.class, name = "row"),
        @JsonSubTypes.Type(value = WidgetSpec.ColumnSpec.class, name = "column"),
        @JsonSubTypes.Type(value = WidgetSpec.ExpandedSpec.class, name = "expanded"),
        @JsonSubTypes.Type(value = WidgetSpec.FlexibleSpec.class, name = "flexible"),
        @JsonSubTypes.Type(value = WidgetSpec.StackSpec.class, name = "stack"),
        @JsonSubTypes.Type(value = WidgetSpec.PositionedSpec.class, name = "positioned"),
        @JsonSubTypes.Type(value = WidgetSpec.IntrinsicWidthSpec.class, name = "intrinsicWidth")
})
public abstract class WidgetSpec {

    private String key;

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class TextSpec extends WidgetSpec {
        @NotNull
        private String text;
        @Valid
        private TextStyleRequest style;
        private String textAlign;
        private String overflow;
        @Positive
        private Integer maxLines;
        private Boolean softWrap;
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class ContainerSpec extends WidgetSpec {
        @Valid
        private WidgetSpec child;
        @Valid
        private EdgeInsetsRequest padding;
        @Valid
        private EdgeInsetsRequest margin;
        @PositiveOrZero
        private Double width;
        @PositiveOrZero
        private Double height;
        private String alignment;
        private String color;
        private String borderColor;
        @PositiveOrZero
        private Double borderWidth;
        @PositiveOrZero
        private double borderRadius;
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class PaddingSpec extends WidgetSpec {
        @Valid
        private EdgeInsetsRequest padding;
        @Valid
        private WidgetSpec child;
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class AlignSpec extends WidgetSpec {
        private String alignment;
        @Positive
        private Double widthFactor;
        @Positive
        private Double heightFactor;
        @Valid
        private WidgetSpec child;
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class CenterSpec extends WidgetSpec {
        @Valid
        private WidgetSpec child;
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class SizedBoxSpec extends WidgetSpec {
        @PositiveOrZero
        private Double width;
        @PositiveOrZero
        private Double height;
        @Valid
        private WidgetSpec child;
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public abstract static class FlexSpec extends WidgetSpec {
        @Valid
        private List<WidgetSpec> children = new ArrayList<>();
        private String mainAxisAlignment;
        private String crossAxisAlignment;
        private String mainAxisSize;
        @PositiveOrZero
        private double spacing;
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class RowSpec extends FlexSpec {
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class ColumnSpec extends FlexSpec {
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class FlexibleSpec extends WidgetSpec {
        @Positive
        private int flex = 1;
        private String fit;
        @Valid
        private WidgetSpec child;
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class ExpandedSpec extends WidgetSpec {
        @Positive
        private int flex = 1;
        @Valid
        private WidgetSpec child;
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class StackSpec extends WidgetSpec {
        @Valid
        private List<WidgetSpec> children = new ArrayList<>();
        private String alignment;
        private String fit;
        private boolean clip;
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class PositionedSpec extends WidgetSpec {
        private Double left;
        private Double top;
        private Double right;
        private Double bottom;
        @PositiveOrZero
        private Double width;
        @PositiveOrZero
        private Double height;
        @Valid
        private WidgetSpec child;
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class IntrinsicWidthSpec extends WidgetSpec {
        @Valid
        private WidgetSpec child;
    }
}

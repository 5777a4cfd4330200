package ir.ipaam.pdflayout.domain.theme;

/**
 * Style snapshot handed to every layout and paint call.
 */
public record ThemeData(TextStyle defaultTextStyle, ColorScheme colorScheme) {

    public static ThemeData defaults() {
        return new ThemeData(TextStyle.defaults(), ColorScheme.light());
    }

    public ThemeData withDefaultTextStyle(TextStyle style) {
        return new ThemeData(defaultTextStyle.merge(style), colorScheme);
    }
}

package ir.ipaam.pdflayout.domain.layout;

public record LayoutOptions(boolean useCache, boolean validateConstraints) {

    public static final LayoutOptions DEFAULT = new LayoutOptions(true, true);
    public static final LayoutOptions UNCACHED = new LayoutOptions(false, true);
}

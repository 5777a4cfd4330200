package ir.ipaam.pdflayout.domain.widget;

import ir.ipaam.pdflayout.domain.layout.Widget;
import lombok.experimental.SuperBuilder;

/**
 * {@link Flexible} that must fill its share.
 */
@SuperBuilder
public class Expanded extends Flexible {

    public static Expanded of(Widget child) {
        return Expanded.builder().child(child).build();
    }

    public static Expanded of(int flex, Widget child) {
        return Expanded.builder().flex(flex).child(child).build();
    }

    @Override
    public FlexFit getFit() {
        return FlexFit.TIGHT;
    }
}

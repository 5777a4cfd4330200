package ir.ipaam.pdflayout.domain.widget;

import ir.ipaam.pdflayout.domain.layout.Widget;
import lombok.experimental.SuperBuilder;

@SuperBuilder
public class Center extends Align {

    public static Center of(Widget child) {
        return Center.builder().child(child).build();
    }
}

package ir.ipaam.pdflayout.domain.widget;

import ir.ipaam.pdflayout.domain.layout.Widget;
import lombok.Getter;
import lombok.experimental.SuperBuilder;

@Getter
@SuperBuilder
public abstract class BaseWidget implements Widget {

    private final String key;
    private final String debugLabel;
}

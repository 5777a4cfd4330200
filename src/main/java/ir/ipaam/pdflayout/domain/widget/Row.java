package ir.ipaam.pdflayout.domain.widget;

import ir.ipaam.pdflayout.domain.geometry.Axis;
import lombok.experimental.SuperBuilder;

@SuperBuilder
public class Row extends Flex {

    @Override
    public Axis getDirection() {
        return Axis.HORIZONTAL;
    }
}

package ir.ipaam.pdflayout.domain.widget;

import ir.ipaam.pdflayout.domain.geometry.Axis;
import lombok.experimental.SuperBuilder;

@SuperBuilder
public class Column extends Flex {

    @Override
    public Axis getDirection() {
        return Axis.VERTICAL;
    }
}

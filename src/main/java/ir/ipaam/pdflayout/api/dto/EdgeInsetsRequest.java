package ir.ipaam.pdflayout.api.dto;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EdgeInsetsRequest {

    @PositiveOrZero
    private double top;
    @PositiveOrZero
    private double right;
    @PositiveOrZero
    private double bottom;
    @PositiveOrZero
    private double left;
}

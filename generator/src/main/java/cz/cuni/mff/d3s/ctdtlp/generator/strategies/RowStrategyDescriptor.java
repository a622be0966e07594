package cz.cuni.mff.d3s.ctdtlp.generator.strategies;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Selectable row-proposal strategy as listed by {@link RowStrategyProvider}.
 */
@Getter
@ToString
@AllArgsConstructor
public class RowStrategyDescriptor {
    private final String id;
    private final String displayName;
    private final String description;
    private final boolean isDefault;
}

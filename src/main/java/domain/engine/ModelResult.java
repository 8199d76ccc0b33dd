package domain.engine;

import domain.model.ResultTable;

import java.util.Objects;

/**
 * Raw engine output: the wide statistics table and, when requested, the structural-zero table.
 */
public final class ModelResult {

    private final ResultTable statistics;
    private final ResultTable structuralZeros;

    public ModelResult(ResultTable statistics, ResultTable structuralZeros) {
        this.statistics = Objects.requireNonNull(statistics, "statistics");
        this.structuralZeros = structuralZeros;
    }

    public ResultTable getStatistics() {
        return statistics;
    }

    /**
     * @return the indicator table, or null when structural-zero detection was off
     */
    public ResultTable getStructuralZeros() {
        return structuralZeros;
    }
}

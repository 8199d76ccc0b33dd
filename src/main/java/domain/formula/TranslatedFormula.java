package domain.formula;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Result of {@link FormulaTranslator#translate}: the engine-ready formula plus what was renamed.
 */
public final class TranslatedFormula {

    private final String originalFormula;
    private final String engineFormula;
    /**
     * Original metadata column names, in order of first appearance.
     */
    private final List<String> variables;
    /**
     * Original names whose hyphens were replaced by periods in the formula text.
     */
    private final Set<String> renamedOriginals;

    TranslatedFormula(String originalFormula, String engineFormula, List<String> variables,
                      Set<String> renamedOriginals) {
        this.originalFormula = originalFormula;
        this.engineFormula = engineFormula;
        this.variables = List.copyOf(variables);
        this.renamedOriginals = Collections.unmodifiableSet(new LinkedHashSet<>(renamedOriginals));
    }

    public String getOriginalFormula() {
        return originalFormula;
    }

    public String getEngineFormula() {
        return engineFormula;
    }

    public List<String> getVariables() {
        return variables;
    }

    public Set<String> getRenamedOriginals() {
        return renamedOriginals;
    }

    @Override
    public String toString() {
        return "TranslatedFormula{'" + originalFormula + "' -> '" + engineFormula + "'}";
    }
}

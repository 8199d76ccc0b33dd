package domain.analysis;

import domain.formula.TranslatedFormula;
import domain.model.AnalysisWarning;
import domain.result.ResultSlice;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Disambiguated slices of one run plus what was decided along the way.
 */
public final class AnalysisResult {

    private final Map<String, ResultSlice> slices;
    private final Map<String, String> referenceLevels;
    private final TranslatedFormula fixedEffects;
    private final TranslatedFormula randomEffects;
    private final Map<String, String> renames;
    private final List<AnalysisWarning> warnings;

    public AnalysisResult(List<ResultSlice> slices,
                          Map<String, String> referenceLevels,
                          TranslatedFormula fixedEffects,
                          TranslatedFormula randomEffects,
                          Map<String, String> renames,
                          List<AnalysisWarning> warnings) {
        Map<String, ResultSlice> m = new LinkedHashMap<>();
        for (ResultSlice s : slices) {
            if (m.put(s.getName(), s) != null) {
                throw new IllegalArgumentException("duplicate slice: " + s.getName());
            }
        }
        this.slices = Collections.unmodifiableMap(m);
        this.referenceLevels = Collections.unmodifiableMap(new LinkedHashMap<>(referenceLevels));
        this.fixedEffects = fixedEffects;
        this.randomEffects = randomEffects;
        this.renames = Collections.unmodifiableMap(new LinkedHashMap<>(renames));
        this.warnings = List.copyOf(warnings);
    }

    /**
     * Slices in bundle order: the statistics, then the structural zeros when present.
     */
    public List<ResultSlice> getSlices() {
        return List.copyOf(slices.values());
    }

    /**
     * @return the slice, or null when absent
     */
    public ResultSlice getSlice(String name) {
        return slices.get(name);
    }

    /**
     * Reference level per categorical variable, as deduced from the engine output.
     */
    public Map<String, String> getReferenceLevels() {
        return referenceLevels;
    }

    public TranslatedFormula getFixedEffects() {
        return fixedEffects;
    }

    /**
     * @return the translated random-effects formula, or null
     */
    public TranslatedFormula getRandomEffects() {
        return randomEffects;
    }

    /**
     * Engine identifier to original column name, for every column handed to the engine.
     */
    public Map<String, String> getRenames() {
        return renames;
    }

    public List<AnalysisWarning> getWarnings() {
        return warnings;
    }
}

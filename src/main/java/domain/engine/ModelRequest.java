package domain.engine;

import domain.covariate.CovariateTable;
import domain.model.FeatureTable;

import java.util.Objects;

/**
 * Everything the engine needs for one fit, already in engine identifiers.
 */
public final class ModelRequest {

    private final FeatureTable featureTable;
    private final CovariateTable covariates;
    private final String fixedEffects;
    private final String randomEffects;
    private final String group;
    private final EngineParameters parameters;

    /**
     * @param randomEffects engine formula of random terms, or null
     * @param group         engine name of the group variable, or null
     */
    public ModelRequest(FeatureTable featureTable, CovariateTable covariates, String fixedEffects,
                        String randomEffects, String group, EngineParameters parameters) {
        this.featureTable = Objects.requireNonNull(featureTable, "featureTable");
        this.covariates = Objects.requireNonNull(covariates, "covariates");
        this.fixedEffects = Objects.requireNonNull(fixedEffects, "fixedEffects");
        this.randomEffects = randomEffects;
        this.group = group;
        this.parameters = Objects.requireNonNull(parameters, "parameters");
    }

    public FeatureTable getFeatureTable() {
        return featureTable;
    }

    public CovariateTable getCovariates() {
        return covariates;
    }

    public String getFixedEffects() {
        return fixedEffects;
    }

    public String getRandomEffects() {
        return randomEffects;
    }

    public String getGroup() {
        return group;
    }

    public EngineParameters getParameters() {
        return parameters;
    }
}

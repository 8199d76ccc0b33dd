package domain.analysis;

import domain.engine.EngineParameters;
import domain.model.FeatureTable;
import domain.model.SampleMetadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Inputs of one differential-abundance run, in the caller's (metadata) naming.
 */
public final class AnalysisRequest {

    private final FeatureTable featureTable;
    private final SampleMetadata metadata;
    private final String fixedEffects;
    private final String randomEffects;
    private final List<String> referenceLevels;
    private final String group;
    private final EngineParameters parameters;

    private AnalysisRequest(Builder b) {
        this.featureTable = Objects.requireNonNull(b.featureTable, "featureTable");
        this.metadata = Objects.requireNonNull(b.metadata, "metadata");
        this.fixedEffects = b.fixedEffects;
        this.randomEffects = blankToNull(b.randomEffects);
        this.referenceLevels = Collections.unmodifiableList(new ArrayList<>(b.referenceLevels));
        this.group = blankToNull(b.group);
        this.parameters = (b.parameters == null) ? EngineParameters.defaults() : b.parameters;
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }

    public static Builder builder(FeatureTable featureTable, SampleMetadata metadata) {
        return new Builder(featureTable, metadata);
    }

    public FeatureTable getFeatureTable() {
        return featureTable;
    }

    public SampleMetadata getMetadata() {
        return metadata;
    }

    public String getFixedEffects() {
        return fixedEffects;
    }

    /**
     * @return the random-effects formula, or null
     */
    public String getRandomEffects() {
        return randomEffects;
    }

    /**
     * @return {@code column::level} directives in caller order
     */
    public List<String> getReferenceLevels() {
        return referenceLevels;
    }

    /**
     * @return the group column, or null
     */
    public String getGroup() {
        return group;
    }

    public EngineParameters getParameters() {
        return parameters;
    }

    public static final class Builder {
        private final FeatureTable featureTable;
        private final SampleMetadata metadata;
        private String fixedEffects;
        private String randomEffects;
        private final List<String> referenceLevels = new ArrayList<>();
        private String group;
        private EngineParameters parameters;

        private Builder(FeatureTable featureTable, SampleMetadata metadata) {
            this.featureTable = featureTable;
            this.metadata = metadata;
        }

        public Builder fixedEffects(String formula) {
            this.fixedEffects = formula;
            return this;
        }

        public Builder randomEffects(String formula) {
            this.randomEffects = formula;
            return this;
        }

        public Builder referenceLevels(List<String> directives) {
            this.referenceLevels.clear();
            if (directives != null) this.referenceLevels.addAll(directives);
            return this;
        }

        public Builder referenceLevel(String directive) {
            this.referenceLevels.add(directive);
            return this;
        }

        public Builder group(String group) {
            this.group = group;
            return this;
        }

        public Builder parameters(EngineParameters parameters) {
            this.parameters = parameters;
            return this;
        }

        public AnalysisRequest build() {
            return new AnalysisRequest(this);
        }
    }
}

package domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Feature-by-sample count table (features as rows).
 */
public final class FeatureTable {

    private final List<String> featureIds;
    private final List<String> sampleIds;
    private final double[][] counts;

    /**
     * @param counts one row per feature, one value per sample (same order as sampleIds)
     */
    public FeatureTable(List<String> featureIds, List<String> sampleIds, double[][] counts) {
        if (featureIds == null || sampleIds == null || counts == null) {
            throw new IllegalArgumentException("feature table parts must not be null");
        }
        if (counts.length != featureIds.size()) {
            throw new IllegalArgumentException("row count " + counts.length
                    + " does not match feature count " + featureIds.size());
        }
        Set<String> seen = new HashSet<>();
        for (String s : sampleIds) {
            if (!seen.add(s)) throw new IllegalArgumentException("duplicate sample id in feature table: " + s);
        }
        double[][] copy = new double[counts.length][];
        for (int i = 0; i < counts.length; i++) {
            if (counts[i].length != sampleIds.size()) {
                throw new IllegalArgumentException("feature " + featureIds.get(i) + " has "
                        + counts[i].length + " values, expected " + sampleIds.size());
            }
            copy[i] = counts[i].clone();
        }
        this.featureIds = Collections.unmodifiableList(new ArrayList<>(featureIds));
        this.sampleIds = Collections.unmodifiableList(new ArrayList<>(sampleIds));
        this.counts = copy;
    }

    public List<String> getFeatureIds() {
        return featureIds;
    }

    public List<String> getSampleIds() {
        return sampleIds;
    }

    public double getCount(int featureIndex, int sampleIndex) {
        return counts[featureIndex][sampleIndex];
    }

    public int featureCount() {
        return featureIds.size();
    }

    public int sampleCount() {
        return sampleIds.size();
    }
}

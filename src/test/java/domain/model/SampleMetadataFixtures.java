package domain.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Small moving-pictures style metadata shared by the tests.
 *
 * <pre>
 * sample  body-site    body-site-count  days-since-experiment-start  subject
 * S1      gut          1                0                            subject-1
 * S2      gut          2                84                           subject-2
 * S3      left palm    3                0                            subject-1
 * S4      left palm    4                84                           subject-2
 * S5      right palm   5                0                            subject-1
 * S6      right palm   6                84                           subject-2
 * S7      tongue       7                0                            subject-1
 * S8      tongue       8                84                           subject-2
 * </pre>
 */
public final class SampleMetadataFixtures {

    public static final List<String> SAMPLES = List.of("S1", "S2", "S3", "S4", "S5", "S6", "S7", "S8");

    private SampleMetadataFixtures() {
    }

    public static SampleMetadata movingPictures() {
        return new SampleMetadata(SAMPLES, List.of(
                column("body-site", ColumnType.CATEGORICAL,
                        "gut", "gut", "left palm", "left palm", "right palm", "right palm", "tongue", "tongue"),
                column("body-site-count", ColumnType.NUMERIC, "1", "2", "3", "4", "5", "6", "7", "8"),
                column("days-since-experiment-start", ColumnType.NUMERIC, "0", "84", "0", "84", "0", "84", "0", "84"),
                column("subject", ColumnType.CATEGORICAL,
                        "subject-1", "subject-2", "subject-1", "subject-2",
                        "subject-1", "subject-2", "subject-1", "subject-2")
        ));
    }

    public static MetadataColumn column(String name, ColumnType type, String... values) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            m.put(SAMPLES.get(i), values[i]);
        }
        return new MetadataColumn(name, type, m);
    }

    public static FeatureTable featureTable(List<String> sampleIds, String... featureIds) {
        double[][] counts = new double[featureIds.length][sampleIds.size()];
        for (int f = 0; f < featureIds.length; f++) {
            for (int s = 0; s < sampleIds.size(); s++) {
                counts[f][s] = (f + 1) * 10 + s;
            }
        }
        return new FeatureTable(List.of(featureIds), sampleIds, counts);
    }
}

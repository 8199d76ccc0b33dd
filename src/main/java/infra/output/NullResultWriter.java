package infra.output;

import domain.analysis.AnalysisResult;
import domain.output.ResultWriter;

import java.nio.file.Path;

/**
 * No-op implementation (feature toggle).
 */
public final class NullResultWriter implements ResultWriter {
    @Override
    public void write(Path resultXlsx, AnalysisResult result) {
        // report disabled
    }
}

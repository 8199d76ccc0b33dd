package domain.output;

import domain.analysis.AnalysisResult;

import java.nio.file.Path;

/** Saves the human-readable run report. */
public interface ResultWriter {

    void write(Path resultXlsx, AnalysisResult result);
}

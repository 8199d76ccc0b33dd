package domain.output;

import domain.analysis.AnalysisResult;

import java.nio.file.Path;

/** Writes the slice bundle (one table per slice plus its descriptor) into a directory. */
public interface BundleWriter {

    void write(Path outDir, AnalysisResult result);
}

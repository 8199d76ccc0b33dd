package app;

import domain.analysis.Ancombc2Analysis;
import domain.engine.ModelRunner;
import domain.model.FeatureTable;
import domain.model.SampleMetadata;
import domain.output.BundleWriter;
import domain.output.ResultWriter;
import infra.engine.RscriptModelRunner;
import infra.output.AnalysisReportXlsxWriter;
import infra.output.CsvBundleWriter;
import infra.output.NullResultWriter;
import infra.output.XlsxResultWriter;
import infra.table.FeatureTableTsvLoader;
import infra.table.MetadataTsvLoader;

import java.nio.file.Path;

/**
 * Object-assembly factory for {@link Ancombc2CliApp}.
 * <p>
 * Keeps the CLI app focused on orchestration/logging and moves object
 * creation ("new") here.
 */
class Ancombc2ComponentsFactory {

    FeatureTable loadFeatureTable(Path tablePath) {
        return new FeatureTableTsvLoader().load(tablePath);
    }

    SampleMetadata loadMetadata(Path metadataPath) {
        return new MetadataTsvLoader().load(metadataPath);
    }

    /**
     * @param rscript {@code --rscript}, or null for the process-wide lookup
     */
    ModelRunner createModelRunner(String rscript) {
        if (rscript == null) return new RscriptModelRunner();
        return RscriptModelRunner.withRscript(rscript);
    }

    Ancombc2Analysis createAnalysis(ModelRunner runner) {
        return new Ancombc2Analysis(runner);
    }

    BundleWriter createBundleWriter() {
        return new CsvBundleWriter();
    }

    ResultWriter createResultWriter(boolean enable) {
        if (!enable) return new NullResultWriter();
        return new XlsxResultWriter(new AnalysisReportXlsxWriter());
    }
}

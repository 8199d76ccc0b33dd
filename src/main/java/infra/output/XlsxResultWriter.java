package infra.output;

import domain.analysis.AnalysisResult;
import domain.output.ResultWriter;

import java.nio.file.Path;

/** {@link AnalysisReportXlsxWriter} based XLSX report. */
public final class XlsxResultWriter implements ResultWriter {

    private final AnalysisReportXlsxWriter delegate;

    public XlsxResultWriter(AnalysisReportXlsxWriter delegate) {
        this.delegate = delegate;
    }

    @Override
    public void write(Path resultXlsx, AnalysisResult result) {
        delegate.write(resultXlsx, result.getSlices(), result.getReferenceLevels(), result.getRenames(),
                result.getWarnings());
    }
}

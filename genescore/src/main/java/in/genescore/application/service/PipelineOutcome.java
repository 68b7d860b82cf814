package in.genescore.application.service;

import in.genescore.domain.model.ScoredGeneSet;
import in.genescore.domain.qc.QcReport;
import in.genescore.domain.report.ValidationReport;
import in.genescore.domain.sensitivity.SensitivityResult;
import in.genescore.domain.sensitivity.SensitivitySummary;
import in.genescore.domain.validation.NegativeControlResult;
import in.genescore.domain.validation.PositiveControlResult;

/**
 * Everything produced by one pipeline run.
 */
public record PipelineOutcome(
        ScoredGeneSet scoredGenes,
        QcReport qcReport,
        PositiveControlResult positiveControls,
        NegativeControlResult negativeControls,
        SensitivityResult sensitivity,
        SensitivitySummary sensitivitySummary,
        ValidationReport report
) {
}

package in.genescore.application.service;

import in.genescore.application.port.output.ScoredGeneRepository;
import in.genescore.config.ScoringConfig;
import in.genescore.domain.model.ScoredGeneSet;
import in.genescore.domain.model.ScoringWeights;
import in.genescore.domain.qc.QcReport;
import in.genescore.domain.report.ValidationReport;
import in.genescore.domain.sensitivity.SensitivityResult;
import in.genescore.domain.sensitivity.SensitivitySummary;
import in.genescore.domain.validation.NegativeControlResult;
import in.genescore.domain.validation.PositiveControlResult;
import in.genescore.service.qc.QualityControlAnalyzer;
import in.genescore.service.report.ValidationReportSynthesizer;
import in.genescore.service.scoring.CompositeScoreAggregator;
import in.genescore.service.sensitivity.SensitivityAnalyzer;
import in.genescore.service.validation.ControlValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * One synchronous scoring and validation run:
 * aggregate → persist → QC → positive controls → negative controls → sensitivity → report.
 *
 * A failed validation is a normal outcome. Only invalid configuration and evidence store
 * failures propagate.
 */
public final class ScoringPipeline {
    private static final Logger log = LoggerFactory.getLogger(ScoringPipeline.class);

    private final CompositeScoreAggregator aggregator;
    private final QualityControlAnalyzer qualityControl;
    private final ControlValidator controlValidator;
    private final SensitivityAnalyzer sensitivityAnalyzer;
    private final ValidationReportSynthesizer reportSynthesizer;
    private final Optional<ScoredGeneRepository> scoredGeneRepository;

    public ScoringPipeline(CompositeScoreAggregator aggregator,
                           QualityControlAnalyzer qualityControl,
                           ControlValidator controlValidator,
                           SensitivityAnalyzer sensitivityAnalyzer,
                           ValidationReportSynthesizer reportSynthesizer,
                           ScoredGeneRepository scoredGeneRepository) {
        this.aggregator = aggregator;
        this.qualityControl = qualityControl;
        this.controlValidator = controlValidator;
        this.sensitivityAnalyzer = sensitivityAnalyzer;
        this.reportSynthesizer = reportSynthesizer;
        this.scoredGeneRepository = Optional.ofNullable(scoredGeneRepository);
    }

    public PipelineOutcome run(ScoringWeights weights) {
        return run(ScoringConfig.defaults().withWeights(weights));
    }

    public PipelineOutcome run(ScoringConfig config) {
        String error = config.validationError();
        if (error != null) {
            throw new IllegalArgumentException("Invalid scoring configuration: " + error);
        }
        ScoringWeights weights = config.toWeights();

        log.info("[PIPELINE] Step 1/6: aggregating evidence");
        ScoredGeneSet scored = aggregator.aggregate(weights);

        if (config.persistScoredGenes()) {
            scoredGeneRepository.ifPresent(repo -> {
                log.info("[PIPELINE] Persisting {} scored genes", scored.size());
                repo.replaceAll(scored);
            });
        }

        log.info("[PIPELINE] Step 2/6: quality control");
        QcReport qc = qualityControl.analyze(scored);

        log.info("[PIPELINE] Step 3/6: positive controls");
        PositiveControlResult positive = controlValidator.validatePositiveControls(scored, config.positiveThreshold());

        log.info("[PIPELINE] Step 4/6: negative controls");
        NegativeControlResult negative = controlValidator.validateNegativeControls(scored, config.negativeThreshold());

        log.info("[PIPELINE] Step 5/6: sensitivity analysis");
        SensitivityResult sensitivity = sensitivityAnalyzer.run(
            scored, config.sensitivityDeltas(), config.sensitivityTopN());
        SensitivitySummary summary = SensitivityAnalyzer.summarize(sensitivity);

        log.info("[PIPELINE] Step 6/6: validation report");
        ValidationReport report = reportSynthesizer.synthesize(positive, negative, sensitivity, summary);

        log.info("[PIPELINE] Complete: {} genes, QC {}, verdict {}",
            scored.size(), qc.passed() ? "passed" : "failed", report.verdict().label());
        return new PipelineOutcome(scored, qc, positive, negative, sensitivity, summary, report);
    }
}

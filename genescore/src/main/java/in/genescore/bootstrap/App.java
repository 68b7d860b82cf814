package in.genescore.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.genescore.application.service.PipelineOutcome;
import in.genescore.application.service.ScoringPipeline;
import in.genescore.config.ScoringConfig;
import in.genescore.domain.model.EvidenceLayer;
import in.genescore.domain.model.ReferenceSet;
import in.genescore.infrastructure.metrics.PrometheusMetricsFileExporter;
import in.genescore.infrastructure.metrics.PrometheusScoringMetrics;
import in.genescore.infrastructure.persistence.PostgresEvidenceRepository;
import in.genescore.infrastructure.persistence.PostgresReferenceGeneRepository;
import in.genescore.infrastructure.persistence.PostgresScoredGeneRepository;
import in.genescore.infrastructure.reference.CuratedReferenceGeneRepository;
import in.genescore.migration.ScoringSchemaMigration;
import in.genescore.service.admin.ScoringConfigService;
import in.genescore.service.qc.QualityControlAnalyzer;
import in.genescore.service.report.ValidationReportSynthesizer;
import in.genescore.service.scoring.CompositeScoreAggregator;
import in.genescore.service.sensitivity.SensitivityAnalyzer;
import in.genescore.service.validation.ControlValidator;
import in.genescore.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs one scoring and validation pass against the evidence database.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        String configDir = Env.get("CONFIG_DIR", "./config");
        int sensitivityThreads = Env.getInt("SENSITIVITY_THREADS", 1);

        // ═══════════════════════════════════════════════════════════════
        // Configuration (validated before touching the database)
        // ═══════════════════════════════════════════════════════════════
        ScoringConfigService configService = new ScoringConfigService(configDir);
        ScoringConfig stored = configService.getConfig();
        ScoringConfig config = new ScoringConfig(stored.weights(), stored.positiveThreshold(),
            stored.negativeThreshold(), stored.sensitivityDeltas(), stored.sensitivityTopN(),
            Env.getBool("PERSIST_SCORED_GENES", stored.persistScoredGenes()));
        List<EvidenceLayer> layers = EvidenceLayer.DEFAULT_LAYERS;
        StartupConfigValidator.validate(config, layers);

        ExecutorService executor = sensitivityThreads > 1 ? Executors.newFixedThreadPool(sensitivityThreads) : null;
        try (HikariDataSource dataSource = createDataSource()) {
            PrometheusScoringMetrics metrics = new PrometheusScoringMetrics();
            log.info("✓ Prometheus metrics initialized");

            new ScoringSchemaMigration(dataSource).migrate();

            PostgresReferenceGeneRepository referenceRepo = new PostgresReferenceGeneRepository(dataSource);
            seedReferenceGenes(referenceRepo);

            CompositeScoreAggregator aggregator = new CompositeScoreAggregator(
                new PostgresEvidenceRepository(dataSource), layers, metrics);
            ScoringPipeline pipeline = new ScoringPipeline(
                aggregator,
                new QualityControlAnalyzer(metrics),
                new ControlValidator(referenceRepo, metrics),
                new SensitivityAnalyzer(aggregator, executor, metrics),
                new ValidationReportSynthesizer(),
                new PostgresScoredGeneRepository(dataSource));

            PipelineOutcome outcome = pipeline.run(config);
            log.info("\n{}", outcome.report().markdown());
            log.info("Verdict: {}", outcome.report().verdict().label());

            exportMetrics(metrics, Path.of(Env.get("METRICS_FILE", "./metrics/genescore.prom")));
        } finally {
            if (executor != null) {
                executor.shutdownNow();
            }
        }
    }

    /**
     * Write the run's metrics for the textfile collector. A failed export does not
     * change the run outcome.
     */
    static void exportMetrics(PrometheusScoringMetrics metrics, Path target) {
        try {
            new PrometheusMetricsFileExporter(metrics.getRegistry()).export(target);
        } catch (IOException e) {
            log.error("Failed to export metrics to {}: {}", target, e.getMessage(), e);
        }
    }

    /**
     * Load the curated control lists when the reference table has no rows for a set.
     */
    static void seedReferenceGenes(PostgresReferenceGeneRepository referenceRepo) {
        CuratedReferenceGeneRepository curated = new CuratedReferenceGeneRepository();
        for (ReferenceSet set : ReferenceSet.values()) {
            if (referenceRepo.findReferenceGenes(set).isEmpty()) {
                int unique = referenceRepo.saveAll(set, curated.findReferenceGenes(set));
                log.info("Seeded {} with {} curated genes", set, unique);
            }
        }
    }

    private static HikariDataSource createDataSource() {
        String url = Env.get("DB_URL", "jdbc:postgresql://localhost:5432/genescore");
        String user = Env.get("DB_USER", "postgres");
        String pass = Env.get("DB_PASS", "postgres");
        int maxPool = Env.getInt("DB_POOL_SIZE", 10);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setPoolName("genescore-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }

    private App() {}
}

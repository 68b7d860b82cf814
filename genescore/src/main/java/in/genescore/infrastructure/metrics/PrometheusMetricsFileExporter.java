package in.genescore.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes a registry in Prometheus text format to a file at the end of a run.
 *
 * Intended for the node_exporter textfile collector:
 * <pre>
 * PrometheusScoringMetrics metrics = new PrometheusScoringMetrics();
 * ... run ...
 * new PrometheusMetricsFileExporter(metrics.getRegistry()).export(Path.of("/var/lib/node_exporter/genescore.prom"));
 * </pre>
 *
 * The file is written next to the target and moved into place, so a scrape never
 * sees a partial file.
 */
public class PrometheusMetricsFileExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsFileExporter.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsFileExporter(CollectorRegistry registry) {
        this.registry = registry;
    }

    /**
     * Current registry contents in text format 0.0.4.
     */
    public String render() throws IOException {
        Writer writer = new StringWriter();
        TextFormat.write004(writer, registry.metricFamilySamples());
        return writer.toString();
    }

    /**
     * @throws IOException if the file cannot be written
     */
    public void export(Path target) throws IOException {
        String metricsOutput = render();

        Path dir = target.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.writeString(tmp, metricsOutput, StandardCharsets.UTF_8);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

        log.info("[PrometheusMetricsFileExporter] Exported metrics to {} ({} bytes)", target, metricsOutput.length());
    }
}

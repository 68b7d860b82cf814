package in.genescore.service.validation;

import in.genescore.domain.model.ScoredGene;
import in.genescore.domain.model.ScoredGeneSet;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Percentile ranks over genes with a composite score.
 *
 * percentile = (r - 1) / (n - 1), where r is the 1-based ascending rank and tied
 * composites share the lowest rank. A single scored gene gets 0.
 */
public final class PercentileRanker {

    public record Entry(ScoredGene gene, double percentile) {}

    /**
     * Rank every scored gene and index by symbol. When several genes share a symbol
     * the highest-ranked one is kept. Genes without a symbol are not indexed.
     */
    public static Map<String, Entry> rankBySymbol(ScoredGeneSet scored) {
        List<ScoredGene> ranked = scored.ranked();
        double[] ascending = ranked.stream().mapToDouble(ScoredGene::compositeScore).sorted().toArray();

        Map<String, Entry> bySymbol = new LinkedHashMap<>();
        for (ScoredGene gene : ranked) {
            if (gene.geneSymbol() == null || bySymbol.containsKey(gene.geneSymbol())) {
                continue;
            }
            bySymbol.put(gene.geneSymbol(), new Entry(gene, percentile(ascending, gene.compositeScore())));
        }
        return bySymbol;
    }

    /**
     * @param ascending all composites, sorted ascending
     */
    static double percentile(double[] ascending, double value) {
        int n = ascending.length;
        if (n <= 1) {
            return 0.0;
        }
        return (double) countBelow(ascending, value) / (n - 1);
    }

    private static int countBelow(double[] ascending, double value) {
        int idx = Arrays.binarySearch(ascending, value);
        if (idx < 0) {
            return -idx - 1;
        }
        while (idx > 0 && ascending[idx - 1] == value) {
            idx--;
        }
        return idx;
    }

    private PercentileRanker() {}
}

package in.genescore.testsupport;

import in.genescore.application.port.output.EvidenceRepository;
import in.genescore.domain.model.EvidenceLayer;
import in.genescore.domain.model.GeneIdentity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Evidence store backed by maps, for engine tests.
 */
public final class InMemoryEvidenceRepository implements EvidenceRepository {

    private final Map<String, GeneIdentity> universe = new LinkedHashMap<>();
    private final Map<String, Map<String, Double>> scoresByLayer = new HashMap<>();
    private final AtomicInteger universeQueries = new AtomicInteger();

    /**
     * Add a gene with its present layer scores; layers not in the map are missing.
     */
    public InMemoryEvidenceRepository gene(String geneId, String symbol, Map<String, Double> scores) {
        universe.put(geneId, new GeneIdentity(geneId, symbol));
        scores.forEach((layer, score) -> scoresByLayer.computeIfAbsent(layer, l -> new HashMap<>()).put(geneId, score));
        return this;
    }

    /**
     * Add a gene with the same score in every given layer.
     */
    public InMemoryEvidenceRepository uniformGene(String geneId, String symbol, List<String> layers, double score) {
        Map<String, Double> scores = new LinkedHashMap<>();
        layers.forEach(l -> scores.put(l, score));
        return gene(geneId, symbol, scores);
    }

    public int universeQueries() {
        return universeQueries.get();
    }

    @Override
    public List<GeneIdentity> findGeneUniverse() {
        universeQueries.incrementAndGet();
        List<GeneIdentity> genes = new ArrayList<>(universe.values());
        genes.sort(Comparator.comparing(GeneIdentity::geneId));
        return genes;
    }

    @Override
    public Map<String, Double> findLayerScores(EvidenceLayer layer, Collection<String> geneIds) {
        Set<String> wanted = new HashSet<>(geneIds);
        Map<String, Double> result = new HashMap<>();
        scoresByLayer.getOrDefault(layer.name(), Map.of()).forEach((id, score) -> {
            if (wanted.contains(id)) {
                result.put(id, score);
            }
        });
        return result;
    }
}

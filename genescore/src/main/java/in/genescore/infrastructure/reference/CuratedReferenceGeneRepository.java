package in.genescore.infrastructure.reference;

import in.genescore.application.port.output.ReferenceGeneRepository;
import in.genescore.domain.model.ReferenceGene;
import in.genescore.domain.model.ReferenceSet;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in curated control gene lists.
 *
 * Positive: OMIM Usher syndrome genes and the SYSCILIA gold standard (SCGS v2) core.
 * Negative: literature-validated housekeeping genes.
 * Provenance is kept per row; symbols present in both positive sources appear twice.
 */
public final class CuratedReferenceGeneRepository implements ReferenceGeneRepository {

    public static final String OMIM_USHER = "omim_usher";
    public static final String SYSCILIA_SCGS_V2 = "syscilia_scgs_v2";
    public static final String LITERATURE_VALIDATED = "literature_validated";

    public static final List<String> OMIM_USHER_GENES = List.of(
        "MYO7A",    // USH1B
        "USH1C",    // USH1C (harmonin)
        "CDH23",    // USH1D
        "PCDH15",   // USH1F
        "USH1G",    // USH1G (SANS)
        "CIB2",     // USH1J
        "USH2A",    // USH2A
        "ADGRV1",   // USH2C
        "WHRN",     // USH2D (whirlin)
        "CLRN1"     // USH3A
    );

    public static final List<String> SYSCILIA_SCGS_V2_CORE = List.of(
        "IFT88", "IFT140", "IFT172",                            // IFT
        "BBS1", "BBS2", "BBS4", "BBS5", "BBS7", "BBS9", "BBS10",  // BBSome
        "RPGRIP1L", "CEP290",                                   // transition zone
        "ARL13B", "INPP5E",                                     // ciliary membrane
        "TMEM67", "CC2D2A", "TMEM216", "TMEM231", "TMEM138",    // MKS/JBTS
        "NPHP1", "NPHP3", "NPHP4",                              // nephronophthisis
        "RPGR",
        "CEP164",
        "OFD1",
        "MKS1",
        "TCTN1", "TCTN2"                                        // tectonic complex
    );

    public static final List<String> HOUSEKEEPING_GENES = List.of(
        "RPL13A", "RPL32", "RPLP0",             // ribosomal
        "GAPDH", "ACTB", "PGK1", "SDHA",        // metabolism / cytoskeleton
        "B2M", "HPRT1", "TBP",
        "PPIA", "UBC", "YWHAZ"
    );

    @Override
    public List<ReferenceGene> findReferenceGenes(ReferenceSet set) {
        List<ReferenceGene> genes = new ArrayList<>();
        switch (set) {
            case POSITIVE_CONTROLS -> {
                OMIM_USHER_GENES.forEach(s -> genes.add(ReferenceGene.high(s, OMIM_USHER)));
                SYSCILIA_SCGS_V2_CORE.forEach(s -> genes.add(ReferenceGene.high(s, SYSCILIA_SCGS_V2)));
            }
            case NEGATIVE_CONTROLS -> HOUSEKEEPING_GENES.forEach(s -> genes.add(ReferenceGene.high(s, LITERATURE_VALIDATED)));
        }
        return List.copyOf(genes);
    }
}

package com.kgagent.service.impl;

import static org.assertj.core.api.Assertions.assertThat;

import com.kgagent.model.Intent;
import com.kgagent.model.SlotValue;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RegexSlotExtractorTest {

    private RegexSlotExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new RegexSlotExtractor();
    }

    @Test
    void extract_experimentAccession_isUppercased() {
        Intent intent = extractor.extract("Which genes are differentially expressed in e-geod-76?", Intent.builder().build());

        assertThat(intent.slotAsString("experiment_id")).isEqualTo("E-GEOD-76");
    }

    @Test
    void extract_neverOverwritesPreseededSlot() {
        Intent seeded = Intent.builder()
                .slot("experiment_id", SlotValue.of("E-MTAB-1"))
                .slot("direction", SlotValue.of("down"))
                .build();

        Intent intent = extractor.extract("Genes upregulated in E-GEOD-76", seeded);

        assertThat(intent.slotAsString("experiment_id")).isEqualTo("E-MTAB-1");
        assertThat(intent.slotAsString("direction")).isEqualTo("down");
    }

    @Test
    void extract_direction() {
        assertThat(extractor.extract("genes upregulated in multiple experiments", Intent.builder().build())
                .slotAsString("direction")).isEqualTo("up");
        assertThat(extractor.extract("downregulated genes", Intent.builder().build())
                .slotAsString("direction")).isEqualTo("down");
    }

    @Test
    void extract_geneSymbols_skipsSentenceWords() {
        Intent intent = extractor.extract("Which experiments show DUSP2 and TP53 upregulated?", Intent.builder().build());

        assertThat(intent.slotAsList("gene_symbols")).containsExactly("TP53", "DUSP2");
        assertThat(intent.slotAsString("gene_symbol")).isEqualTo("TP53");
        assertThat(intent.hasSlot("experiment_id")).isFalse();
    }

    @Test
    void extractGeneSymbols_ranksShortTokensFirst() {
        List<String> symbols = RegexSlotExtractor.extractGeneSymbols("Compare Interleukin with IL6");

        assertThat(symbols.get(0)).isEqualTo("IL6");
    }

    @Test
    void extract_conditionPhrase_setsFactorTermsKeywordsAndEfo() {
        Intent intent = extractor.extract("Find datasets about influenza", Intent.builder().build());

        assertThat(intent.slotAsList("factor_terms")).containsExactly("influenza");
        assertThat(intent.slotAsString("keywords")).isEqualTo("influenza");
        assertThat(intent.slotAsList("disease_efo_ids")).containsExactly("0001072");
    }

    @Test
    void extract_gxaBridgePhrase() {
        Intent intent = extractor.extract("datasets about asthma that contain gene expression data", Intent.builder().build());

        assertThat(intent.slotAsString("include_gxa_bridge")).isEqualTo("true");
    }

    @Test
    void extract_limit_outOfRangeIsIgnored() {
        assertThat(extractor.extract("datasets about asthma limit 20", Intent.builder().build())
                .slotAsString("limit")).isEqualTo("20");
        assertThat(extractor.extract("datasets about asthma limit 50000", Intent.builder().build())
                .hasSlot("limit")).isFalse();
    }

    @Test
    void extract_entityCommand_stripsPrefix() {
        Intent intent = extractor.extract("/entity methotrexate", Intent.builder().build());

        assertThat(intent.slotAsString("q")).isEqualTo("methotrexate");
    }
}

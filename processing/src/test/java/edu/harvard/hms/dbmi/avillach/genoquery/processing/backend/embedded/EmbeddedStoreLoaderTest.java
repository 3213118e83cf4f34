package edu.harvard.hms.dbmi.avillach.genoquery.processing.backend.embedded;

import edu.harvard.hms.dbmi.avillach.genoquery.data.storage.ColumnType;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.TestStudies;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddedStoreLoaderTest {

    private final EmbeddedStoreLoader loader = new EmbeddedStoreLoader();

    @Test
    public void readTable_typedCells_parsedBySchema() throws IOException {
        String tsv = "sj_index\tchromosome\taf_allele_freq\teffect_gene\tnote\n"
                + "7\t1\t0.25\tGENE1:missense|GENE2:intron\tkept as text\n";

        List<Map<String, Object>> rows = loader.readTable(new StringReader(tsv), TestStudies.summarySchema());

        Map<String, Object> row = rows.get(0);
        assertEquals(7, row.get("sj_index"));
        assertEquals("1", row.get("chromosome"));
        assertEquals(0.25, row.get("af_allele_freq"));
        assertEquals("kept as text", row.get("note"));
        assertEquals(List.of(
                Map.of("effect_gene_symbols", "GENE1", "effect_types", "missense"),
                Map.of("effect_gene_symbols", "GENE2", "effect_types", "intron")), row.get("effect_gene"));
    }

    @Test
    public void readTable_emptyCellsAndLists_nullAndSplit() throws IOException {
        String tsv = "family_id\tmembers\tinheritance_in_members\tgenotype\n"
                + "f1\tp1; p2;p3\t\t0/0;1/0;0/1\n";

        Map<String, Object> row = loader.readTable(new StringReader(tsv), TestStudies.familySchema()).get(0);

        assertEquals(List.of("p1", "p2", "p3"), row.get("members"));
        assertNull(row.get("inheritance_in_members"));
        int[][] genotype = (int[][]) row.get("genotype");
        assertArrayEquals(new int[]{0, 1, 0}, genotype[0]);
        assertArrayEquals(new int[]{0, 0, 1}, genotype[1]);
    }

    @Test
    public void readTable_badInteger_reportsColumnAndLine() {
        String tsv = "sj_index\nseven\n";

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> loader.readTable(new StringReader(tsv), Map.of("sj_index", ColumnType.INT)));

        assertTrue(e.getMessage().contains("sj_index"));
        assertTrue(e.getMessage().contains("seven"));
    }

    @Test
    public void parseEffects_missingSeparator_throws() {
        assertThrows(IllegalArgumentException.class, () -> EmbeddedStoreLoader.parseEffects("GENE1"));
    }

    @Test
    public void load_testStudy_allFamilyRowsIndexed() throws IOException {
        EmbeddedVariantStore store = TestStudies.embeddedStore(3);

        assertEquals(3, store.availableConnections());
    }
}

package edu.harvard.hms.dbmi.avillach.genoquery.data.query;

import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class VariantFilterReaderTest {

    @Test
    public void read_allFields_populated() throws IOException {
        String json = "{"
                + "\"regions\": [{\"chromosome\": \"1\", \"start\": 100, \"stop\": 200}],"
                + "\"genes\": [\"CHD8\"],"
                + "\"effectTypes\": [\"missense\"],"
                + "\"familyIds\": [\"f1\"],"
                + "\"inheritance\": [\"denovo\", \"not omission\"],"
                + "\"roles\": \"prb\","
                + "\"realAttrFilter\": {\"score\": {\"min\": 0.5}},"
                + "\"frequencyFilter\": {\"af_allele_freq\": {\"max\": 1.0}},"
                + "\"categoricalAttrFilter\": {\"clinvar\": [\"pathogenic\"]},"
                + "\"ultraRare\": true,"
                + "\"returnReference\": false,"
                + "\"limit\": 10"
                + "}";

        VariantFilter filter = VariantFilterReader.read(json);

        assertEquals(List.of(new Region("1", 100, 200)), filter.getRegions());
        assertEquals(Set.of("CHD8"), filter.getGenes());
        assertEquals(List.of("denovo", "not omission"), filter.getInheritance());
        assertEquals(new ValueRange(0.5, null), filter.getRealAttrFilter().get("score"));
        assertEquals(Map.of("clinvar", List.of("pathogenic")), filter.getCategoricalAttrFilter());
        assertTrue(filter.ultraRareOnly());
        assertFalse(filter.includeReference());
        assertEquals(10, filter.getLimit());
        assertNull(filter.getPersonIds());
        assertTrue(filter.hasFamilyConstraints());
    }

    @Test
    public void read_unknownKey_rejected() {
        assertThrows(UnrecognizedPropertyException.class, () -> VariantFilterReader.read("{\"family_ids\": [\"f1\"]}"));
    }

    @Test
    public void read_emptyFamilyIds_keptDistinctFromAbsent() throws IOException {
        VariantFilter empty = VariantFilterReader.read("{\"familyIds\": []}");
        VariantFilter absent = VariantFilterReader.read("{}");

        assertEquals(Set.of(), empty.getFamilyIds());
        assertNull(absent.getFamilyIds());
        assertFalse(absent.hasFamilyConstraints());
    }

    @Test
    public void write_readBack_equal() throws IOException {
        VariantFilter filter = VariantFilter.builder()
                .regions(List.of(Region.parse("X:1-1000")))
                .frequencyFilter(Map.of("af_allele_freq", ValueRange.atMost(2.0)))
                .variantType("sub or del")
                .build();

        assertEquals(filter, VariantFilterReader.read(VariantFilterReader.write(filter)));
    }
}

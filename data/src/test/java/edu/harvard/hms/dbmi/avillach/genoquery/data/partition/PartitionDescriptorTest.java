package edu.harvard.hms.dbmi.avillach.genoquery.data.partition;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PartitionDescriptorTest {

    private final PartitionDescriptor descriptor = PartitionDescriptor.builder()
            .chromosomes(List.of("1", "2"))
            .regionLength(1000)
            .familyBinSize(10)
            .codingEffectTypes(Set.of("missense", "nonsense"))
            .rareBoundary(5.0)
            .chromosomeLengths(Map.of("1", 2500, "2", 999, "3", 1200))
            .build();

    @Test
    public void makeRegionBin_listedAndOtherChromosomes() {
        assertEquals("1_0", descriptor.makeRegionBin("1", 999));
        assertEquals("1_1", descriptor.makeRegionBin("1", 1000));
        assertEquals("other_2", descriptor.makeRegionBin("X", 2500));
    }

    @Test
    public void makeFrequencyBin_boundaries() {
        assertEquals(0, descriptor.makeFrequencyBin(100, 50.0, true));
        assertEquals(1, descriptor.makeFrequencyBin(1, 0.01, false));
        assertEquals(2, descriptor.makeFrequencyBin(3, 5.0, false));
        assertEquals(3, descriptor.makeFrequencyBin(3, 5.1, false));
    }

    @Test
    public void makeCodingBin_anyCodingEffect() {
        assertEquals(1, descriptor.makeCodingBin(List.of("synonymous", "missense")));
        assertEquals(0, descriptor.makeCodingBin(List.of("intron")));
        assertEquals(0, descriptor.makeCodingBin(List.of()));
    }

    @Test
    public void makeFamilyBin_stableAndInRange() {
        int bin = descriptor.makeFamilyBin("f1");
        assertEquals(bin, descriptor.makeFamilyBin("f1"));
        assertTrue(bin >= 0 && bin < 10);
    }

    @Test
    public void allRegionBins_includesOtherBins() {
        assertEquals(List.of("1_0", "1_1", "1_2", "2_0", "other_0", "other_1"), descriptor.allRegionBins());
    }

    @Test
    public void undefinedDimension_notDefined() {
        PartitionDescriptor empty = PartitionDescriptor.builder().build();

        assertFalse(empty.hasRegionBins());
        assertFalse(empty.hasFamilyBins());
        assertFalse(empty.hasCodingBins());
        assertFalse(empty.hasFrequencyBins());
        assertThrows(IllegalStateException.class, () -> empty.makeRegionBin("1", 1));
        assertEquals(new PartitionKey(null, null, null, null), empty.makeKey("1", 1, 1, 0.1, false, List.of(), "f1"));
    }

    @Test
    public void read_json() throws IOException {
        String json = "{\"chromosomes\": [\"chr1\"], \"regionLength\": 100000, \"rareBoundary\": 5.0}";

        PartitionDescriptor read = PartitionDescriptor.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

        assertTrue(read.hasRegionBins());
        assertTrue(read.hasFrequencyBins());
        assertFalse(read.hasFamilyBins());
        assertEquals(100_000, read.getRegionOverlapMargin());
    }

    @Test
    public void partitionKey_wildcardCovers() {
        PartitionKey selected = new PartitionKey(null, 1, null, null);

        assertTrue(selected.covers(new PartitionKey("1_0", 1, 0, 3)));
        assertFalse(selected.covers(new PartitionKey("1_0", 2, 0, 3)));
    }
}

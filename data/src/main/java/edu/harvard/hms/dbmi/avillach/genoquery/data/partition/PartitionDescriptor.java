package edu.harvard.hms.dbmi.avillach.genoquery.data.partition;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.hash.Hashing;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Describes how a dataset was split into physical partitions. A dimension only exists when its parameters are set:
 * region bins need chromosomes and a region length, family bins a bin count, coding bins a list of coding effect types
 * and frequency bins a rare boundary.
 */
@Jacksonized
@Value
@Builder
public class PartitionDescriptor {

    public static final int FREQUENCY_BIN_DENOVO = 0;
    public static final int FREQUENCY_BIN_ULTRA_RARE = 1;
    public static final int FREQUENCY_BIN_RARE = 2;
    public static final int FREQUENCY_BIN_COMMON = 3;

    private static final ObjectMapper objectMapper = new ObjectMapper();

    @Builder.Default
    List<String> chromosomes = List.of();
    int regionLength;
    int familyBinSize;
    @Builder.Default
    Set<String> codingEffectTypes = Set.of();
    double rareBoundary;
    /**
     * Chromosome lengths of the reference genome, used to enumerate region bins when a query has no region.
     */
    @Builder.Default
    Map<String, Integer> chromosomeLengths = Map.of();
    /**
     * Longest allele span, in base pairs, that region pruning still finds when the allele starts in an earlier bin.
     */
    @Builder.Default
    int regionOverlapMargin = 100_000;

    public static PartitionDescriptor read(InputStream json) throws IOException {
        return objectMapper.readValue(json, PartitionDescriptor.class);
    }

    @JsonIgnore
    public boolean hasRegionBins() {
        return !chromosomes.isEmpty() && regionLength > 0;
    }

    @JsonIgnore
    public boolean hasFamilyBins() {
        return familyBinSize > 0;
    }

    @JsonIgnore
    public boolean hasCodingBins() {
        return !codingEffectTypes.isEmpty();
    }

    @JsonIgnore
    public boolean hasFrequencyBins() {
        return rareBoundary > 0;
    }

    public String makeRegionBin(String chromosome, int position) {
        if (!hasRegionBins()) {
            throw new IllegalStateException("Partition descriptor does not define region bins");
        }
        return regionBinPrefix(chromosome) + "_" + (position / regionLength);
    }

    public String regionBinPrefix(String chromosome) {
        return chromosomes.contains(chromosome) ? chromosome : "other";
    }

    public int makeFamilyBin(String familyId) {
        if (!hasFamilyBins()) {
            throw new IllegalStateException("Partition descriptor does not define family bins");
        }
        byte[] digest = Hashing.sha256().hashString(familyId, StandardCharsets.UTF_8).asBytes();
        return new BigInteger(1, digest).mod(BigInteger.valueOf(familyBinSize)).intValue();
    }

    public int makeCodingBin(Collection<String> effectTypes) {
        if (!hasCodingBins()) {
            throw new IllegalStateException("Partition descriptor does not define coding bins");
        }
        for (String effectType : effectTypes) {
            if (codingEffectTypes.contains(effectType)) {
                return 1;
            }
        }
        return 0;
    }

    public int makeFrequencyBin(int alleleCount, double alleleFrequency, boolean denovo) {
        if (denovo) {
            return FREQUENCY_BIN_DENOVO;
        }
        if (alleleCount <= 1) {
            return FREQUENCY_BIN_ULTRA_RARE;
        }
        if (alleleFrequency <= rareBoundary) {
            return FREQUENCY_BIN_RARE;
        }
        return FREQUENCY_BIN_COMMON;
    }

    /**
     * Every region bin of the dataset, in chromosome order. Empty when chromosome lengths are unknown.
     */
    public List<String> allRegionBins() {
        if (!hasRegionBins() || chromosomeLengths.isEmpty()) {
            return List.of();
        }
        List<String> bins = new ArrayList<>();
        for (String chromosome : chromosomes) {
            Integer length = chromosomeLengths.get(chromosome);
            if (length == null) {
                throw new IllegalStateException("No length known for partition chromosome " + chromosome);
            }
            for (int bin = 0; bin <= length / regionLength; bin++) {
                bins.add(chromosome + "_" + bin);
            }
        }
        int longestOther = chromosomeLengths.entrySet().stream()
                .filter(entry -> !chromosomes.contains(entry.getKey()))
                .mapToInt(Map.Entry::getValue)
                .max().orElse(-1);
        for (int bin = 0; bin <= longestOther / regionLength && longestOther >= 0; bin++) {
            bins.add("other_" + bin);
        }
        return bins;
    }

    /**
     * Partition key of a stored allele. Dimensions the descriptor does not define are left null.
     */
    public PartitionKey makeKey(String chromosome, int position, int alleleCount, double alleleFrequency,
                                boolean denovo, Collection<String> effectTypes, String familyId) {
        return new PartitionKey(
                hasRegionBins() ? makeRegionBin(chromosome, position) : null,
                hasFrequencyBins() ? makeFrequencyBin(alleleCount, alleleFrequency, denovo) : null,
                hasCodingBins() ? makeCodingBin(effectTypes) : null,
                hasFamilyBins() && familyId != null ? makeFamilyBin(familyId) : null
        );
    }
}

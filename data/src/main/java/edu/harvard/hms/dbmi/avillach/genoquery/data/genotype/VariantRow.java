package edu.harvard.hms.dbmi.avillach.genoquery.data.genotype;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A deserialized result row. Summary rows leave the family fields null.
 */
@Value
@Builder(toBuilder = true)
public class VariantRow {

    String chromosome;
    int position;
    Integer endPosition;
    String reference, alternative;
    int alleleIndex;
    Integer variantType;

    String familyId;
    List<String> members;
    /**
     * Allele indexes per chromosome copy, {@code genotype[copy][member]}.
     */
    int[][] genotype;

    @Builder.Default
    Map<String, Object> attributes = Map.of();

    public boolean isFamilyVariant() {
        return familyId != null;
    }

    public String summaryVariantId() {
        return chromosome + ":" + position + ":" + reference + ">" + alternative + "#" + alleleIndex;
    }

    /**
     * Key used to drop the duplicates produced when a row is read through more than one joined effect entry or more
     * than one overlapping partition.
     */
    public String uniqueId() {
        return familyId == null ? summaryVariantId() : familyId + "/" + summaryVariantId();
    }
}

package edu.harvard.hms.dbmi.avillach.genoquery.data.storage;

import edu.harvard.hms.dbmi.avillach.genoquery.data.partition.PartitionDescriptor;
import edu.harvard.hms.dbmi.avillach.genoquery.data.query.Region;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * What the compilers need to know about one study's tables. Family tables are optional; a study without one only
 * answers summary queries.
 */
@Value
@Builder
public class TableMetadata {

    public static final String SUMMARY_ALIAS = "sa";
    public static final String FAMILY_ALIAS = "fa";

    /**
     * Project or catalog qualifying {@link #db}, used by BigQuery.
     */
    String namespace;
    String db;
    String summaryTable;
    String familyTable;
    @Builder.Default
    String joinKey = "sj_index";

    Map<String, ColumnType> summarySchema;
    @Builder.Default
    Map<String, ColumnType> familySchema = Map.of();

    /**
     * Attributes for which a missing value reads as "not observed", so an upper bound alone keeps NULL rows.
     */
    @Builder.Default
    Set<String> frequencyAttributes = Set.of("af_allele_freq", "af_allele_count");

    PartitionDescriptor partitionDescriptor;

    /**
     * Person id to family id, from the study pedigree.
     */
    @Builder.Default
    Map<String, String> personFamilies = Map.of();

    /**
     * Gene symbol to the regions it spans, from the gene models.
     */
    @Builder.Default
    Map<String, List<Region>> geneRegions = Map.of();

    public boolean hasFamilyTable() {
        return familyTable != null;
    }

    public boolean isFrequencyAttribute(String attribute) {
        return frequencyAttributes.contains(attribute);
    }

    public Optional<ColumnType> columnType(String attribute) {
        if (summarySchema.containsKey(attribute)) {
            return Optional.of(summarySchema.get(attribute));
        }
        return Optional.ofNullable(familySchema.get(attribute));
    }

    /**
     * Qualified column for an attribute, summary columns taking precedence over family columns of the same name.
     */
    public Optional<String> accessor(String attribute) {
        if (summarySchema.containsKey(attribute)) {
            return Optional.of(SUMMARY_ALIAS + "." + attribute);
        }
        if (familySchema.containsKey(attribute)) {
            return Optional.of(FAMILY_ALIAS + "." + attribute);
        }
        return Optional.empty();
    }

    public boolean hasSummaryColumn(String column) {
        return summarySchema.containsKey(column);
    }

    public boolean hasFamilyColumn(String column) {
        return familySchema.containsKey(column);
    }
}

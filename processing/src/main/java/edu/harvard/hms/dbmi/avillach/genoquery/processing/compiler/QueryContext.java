package edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler;

import edu.harvard.hms.dbmi.avillach.genoquery.data.query.VariantFilter;
import edu.harvard.hms.dbmi.avillach.genoquery.data.storage.TableMetadata;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.partition.PartitionSelection;

/**
 * Everything one compilation pass reads.
 */
public record QueryContext(VariantFilter filter, TableMetadata metadata, QueryShape shape, PartitionSelection target) {

    public boolean needsEffectJoin() {
        return filter.getGenes() != null || filter.getEffectTypes() != null;
    }
}

package edu.harvard.hms.dbmi.avillach.genoquery.data.genotype;

import java.util.Set;

/**
 * An enum value stored as a single bit in an integer column. Columns hold the OR of the values present on an allele.
 */
public interface MaskedAttribute {

    int mask();

    String name();

    default Set<String> aliases() {
        return Set.of();
    }
}

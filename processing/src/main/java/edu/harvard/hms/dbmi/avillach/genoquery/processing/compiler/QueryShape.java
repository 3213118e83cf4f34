package edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler;

import edu.harvard.hms.dbmi.avillach.genoquery.data.query.VariantFilter;

public enum QueryShape {
    /**
     * Summary alleles only, no family join.
     */
    SUMMARY,
    /**
     * Summary alleles joined with family alleles on the row join key.
     */
    FAMILY;

    /**
     * Any filter that depends on families, members or their genotypes forces the family join.
     */
    public static QueryShape resolve(VariantFilter filter, boolean familyRowsRequested) {
        return filter.hasFamilyConstraints() || familyRowsRequested ? FAMILY : SUMMARY;
    }
}

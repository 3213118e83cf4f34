package edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler;

/**
 * Fixed column names of the summary (sa), family (fa) and exploded effect (eg) relations.
 */
public final class Columns {

    public static final String SUMMARY_INDEX = "sa.summary_index";
    public static final String CHROMOSOME = "sa.chromosome";
    public static final String POSITION = "sa.position";
    public static final String END_POSITION = "sa.end_position";
    public static final String ALLELE_INDEX = "sa.allele_index";
    public static final String VARIANT_TYPE = "sa.variant_type";
    public static final String EFFECT_GENE = "sa.effect_gene";
    public static final String SUMMARY_VARIANT_DATA = "sa.summary_variant_data";

    public static final String FAMILY_INDEX = "fa.family_index";
    public static final String FAMILY_ID = "fa.family_id";
    public static final String ALLELE_IN_MEMBERS = "fa.allele_in_members";
    public static final String INHERITANCE_IN_MEMBERS = "fa.inheritance_in_members";
    public static final String ALLELE_IN_ROLES = "fa.allele_in_roles";
    public static final String ALLELE_IN_SEXES = "fa.allele_in_sexes";
    public static final String ALLELE_IN_STATUSES = "fa.allele_in_statuses";
    public static final String FAMILY_VARIANT_DATA = "fa.family_variant_data";

    public static final String EFFECT_GENE_ALIAS = "eg";
    public static final String EFFECT_GENE_SYMBOLS = "eg.effect_gene_symbols";
    public static final String EFFECT_TYPES = "eg.effect_types";

    public static final String ALLELE_COUNT_ATTRIBUTE = "af_allele_count";
    public static final String EFFECT_GENE_ATTRIBUTE = "effect_gene";

    private Columns() {
    }

    /**
     * @return the column name without its relation alias
     */
    public static String unqualified(String column) {
        return column.substring(column.indexOf('.') + 1);
    }
}

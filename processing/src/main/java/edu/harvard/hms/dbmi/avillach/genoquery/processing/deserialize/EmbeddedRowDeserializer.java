package edu.harvard.hms.dbmi.avillach.genoquery.processing.deserialize;

import edu.harvard.hms.dbmi.avillach.genoquery.data.genotype.VariantRow;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler.Columns;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler.QueryShape;

import java.util.*;

/**
 * Builds rows from the typed, alias qualified columns of the embedded store. Columns outside the fixed set become
 * attributes under their unqualified name; row keys, partition bins and the exploded effect columns are dropped.
 */
public class EmbeddedRowDeserializer implements VariantDeserializer {

    public static final String REFERENCE = "sa.reference";
    public static final String ALTERNATIVE = "sa.alternative";
    public static final String MEMBERS = "fa.members";
    public static final String GENOTYPE = "fa.genotype";

    private static final Set<String> FIXED_COLUMNS = Set.of(
            Columns.CHROMOSOME, Columns.POSITION, Columns.END_POSITION, REFERENCE, ALTERNATIVE, Columns.ALLELE_INDEX,
            Columns.VARIANT_TYPE, Columns.EFFECT_GENE, Columns.FAMILY_ID, MEMBERS, GENOTYPE);

    @Override
    @SuppressWarnings("unchecked")
    public VariantRow deserialize(Map<String, Object> raw, QueryShape shape) {
        Object chromosome = raw.get(Columns.CHROMOSOME);
        Object position = raw.get(Columns.POSITION);
        if (chromosome == null || position == null) {
            return null;
        }
        VariantRow.VariantRowBuilder row = VariantRow.builder()
                .chromosome(chromosome.toString())
                .position(((Number) position).intValue())
                .endPosition(toInteger(raw.get(Columns.END_POSITION)))
                .reference((String) raw.get(REFERENCE))
                .alternative((String) raw.get(ALTERNATIVE))
                .alleleIndex(Optional.ofNullable(toInteger(raw.get(Columns.ALLELE_INDEX))).orElse(0))
                .variantType(toInteger(raw.get(Columns.VARIANT_TYPE)));
        if (shape == QueryShape.FAMILY) {
            row.familyId((String) raw.get(Columns.FAMILY_ID))
                    .members((List<String>) raw.getOrDefault(MEMBERS, List.of()))
                    .genotype((int[][]) raw.get(GENOTYPE));
        }
        Map<String, Object> attributes = new TreeMap<>();
        raw.forEach((column, value) -> {
            if (value == null || FIXED_COLUMNS.contains(column) || column.startsWith(Columns.EFFECT_GENE_ALIAS + ".")
                    || column.endsWith("_index") || column.endsWith("_bin")) {
                return;
            }
            if (shape == QueryShape.SUMMARY && column.startsWith("fa.")) {
                return;
            }
            attributes.put(Columns.unqualified(column), value);
        });
        return row.attributes(Collections.unmodifiableMap(attributes)).build();
    }

    private static Integer toInteger(Object value) {
        return value == null ? null : ((Number) value).intValue();
    }
}

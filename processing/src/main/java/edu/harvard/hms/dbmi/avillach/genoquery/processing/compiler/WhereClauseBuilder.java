package edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler;

import edu.harvard.hms.dbmi.avillach.genoquery.data.query.Region;
import edu.harvard.hms.dbmi.avillach.genoquery.data.query.ValueRange;
import edu.harvard.hms.dbmi.avillach.genoquery.data.query.VariantFilter;
import edu.harvard.hms.dbmi.avillach.genoquery.data.storage.TableMetadata;
import edu.harvard.hms.dbmi.avillach.genoquery.exception.QueryCompileException;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.attribute.AttributeQueryParser;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.attribute.AttributeTransformer;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.expr.Expr;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.partition.PartitionIndex;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.partition.PartitionSelection;

import java.util.*;

import static edu.harvard.hms.dbmi.avillach.genoquery.processing.expr.Exprs.*;

/**
 * Translates a filter into the list of conditions of a WHERE clause. The conditions are dialect neutral and ANDed
 * together by the builders. A filter field that is null produces no condition; an empty collection produces FALSE.
 */
public class WhereClauseBuilder {

    public List<Expr> build(QueryContext context) throws QueryCompileException {
        VariantFilter filter = context.filter();
        TableMetadata metadata = context.metadata();
        List<Expr> where = new ArrayList<>();

        if (filter.getGenes() != null) {
            where.add(in(column(Columns.EFFECT_GENE_SYMBOLS), new TreeSet<>(filter.getGenes())));
        }
        if (filter.getEffectTypes() != null) {
            where.add(in(column(Columns.EFFECT_TYPES), new TreeSet<>(filter.getEffectTypes())));
        }
        if (filter.getRegions() != null) {
            where.add(regions(filter.getRegions()));
        }
        if (filter.getFamilyIds() != null) {
            where.add(in(column(Columns.FAMILY_ID), new TreeSet<>(filter.getFamilyIds())));
        }
        if (filter.getPersonIds() != null) {
            where.add(containsAny(column(Columns.ALLELE_IN_MEMBERS), new TreeSet<>(filter.getPersonIds())));
        }
        if (filter.getInheritance() != null) {
            for (String expression : filter.getInheritance()) {
                where.add(attributeQuery(AttributeQueryParser.INHERITANCE, "inheritance", expression, Columns.INHERITANCE_IN_MEMBERS));
            }
        }
        if (filter.getRoles() != null) {
            where.add(attributeQuery(AttributeQueryParser.ROLES, "roles", filter.getRoles(), Columns.ALLELE_IN_ROLES));
        }
        if (filter.getSexes() != null) {
            where.add(attributeQuery(AttributeQueryParser.SEXES, "sexes", filter.getSexes(), Columns.ALLELE_IN_SEXES));
        }
        if (filter.getAffectedStatuses() != null) {
            where.add(attributeQuery(AttributeQueryParser.STATUSES, "affectedStatuses", filter.getAffectedStatuses(), Columns.ALLELE_IN_STATUSES));
        }
        if (filter.getVariantType() != null) {
            where.add(attributeQuery(AttributeQueryParser.VARIANT_TYPES, "variantType", filter.getVariantType(), Columns.VARIANT_TYPE));
        }
        if (filter.getRealAttrFilter() != null) {
            where.addAll(ranges("realAttrFilter", filter.getRealAttrFilter(), metadata, false));
        }
        if (filter.getCategoricalAttrFilter() != null) {
            where.addAll(categorical(filter.getCategoricalAttrFilter(), metadata));
        }
        if (filter.getFrequencyFilter() != null) {
            where.addAll(ranges("frequencyFilter", filter.getFrequencyFilter(), metadata, true));
        }
        if (filter.ultraRareOnly()) {
            where.add(range(accessor(Columns.ALLELE_COUNT_ATTRIBUTE, "ultraRare", metadata), ValueRange.atMost(1), true));
        }
        Expr returnReference = returnReferenceAndUnknown(filter);
        if (returnReference != null) {
            where.add(returnReference);
        }
        where.addAll(partitionBins(context));
        where.removeIf(TRUE::equals);
        return where;
    }

    /**
     * Overlap of {@code [position, COALESCE(end_position, position)]} with each region, ORed over the regions.
     */
    static Expr regions(List<Region> regions) {
        Expr position = column(Columns.POSITION);
        Expr end = coalesce(column(Columns.END_POSITION), position);
        List<Expr> alternatives = new ArrayList<>();
        for (Region region : regions) {
            Expr chromosome = eq(column(Columns.CHROMOSOME), region.chromosome());
            if (region.isWholeChromosome()) {
                alternatives.add(chromosome);
            } else if (region.start() == null) {
                alternatives.add(and(chromosome, not(gt(position, region.stop()))));
            } else if (region.stop() == null) {
                alternatives.add(and(chromosome, ge(end, region.start())));
            } else {
                alternatives.add(and(chromosome, not(or(lt(end, region.start()), gt(position, region.stop())))));
            }
        }
        return or(alternatives);
    }

    private static Expr attributeQuery(AttributeQueryParser parser, String field, String expression, String column)
            throws QueryCompileException {
        return AttributeTransformer.toExpr(parser.parse(field, expression), column(column));
    }

    private static List<Expr> ranges(String filterName, Map<String, ValueRange> ranges, TableMetadata metadata,
                                     boolean frequency) throws QueryCompileException {
        List<Expr> result = new ArrayList<>();
        for (String attribute : new TreeSet<>(ranges.keySet())) {
            Expr column = accessor(attribute, filterName + "." + attribute, metadata);
            result.add(range(column, ranges.get(attribute), frequency || metadata.isFrequencyAttribute(attribute)));
        }
        return result;
    }

    static Expr range(Expr column, ValueRange range, boolean frequency) {
        if (range.isUnbounded()) {
            return frequency ? TRUE : isNotNull(column);
        }
        if (range.min() == null) {
            Expr atMost = le(column, range.max());
            return frequency ? or(atMost, isNull(column)) : atMost;
        }
        if (range.max() == null) {
            return ge(column, range.min());
        }
        return and(ge(column, range.min()), le(column, range.max()));
    }

    private static List<Expr> categorical(Map<String, List<String>> filters, TableMetadata metadata)
            throws QueryCompileException {
        List<Expr> result = new ArrayList<>();
        for (String attribute : new TreeSet<>(filters.keySet())) {
            Expr column = accessor(attribute, "categoricalAttrFilter." + attribute, metadata);
            List<String> values = filters.get(attribute);
            if (values == null) {
                result.add(isNull(column));
            } else if (values.isEmpty()) {
                result.add(isNotNull(column));
            } else {
                result.add(in(column, new TreeSet<>(values)));
            }
        }
        return result;
    }

    /**
     * Reference alleles have index 0; alleles of unknown genotype are stored with a negative index.
     */
    private static Expr returnReferenceAndUnknown(VariantFilter filter) {
        if (filter.includeReference()) {
            return null;
        }
        if (filter.includeUnknown()) {
            return not(eq(column(Columns.ALLELE_INDEX), 0));
        }
        return gt(column(Columns.ALLELE_INDEX), 0);
    }

    private static Expr accessor(String attribute, String field, TableMetadata metadata) throws QueryCompileException {
        Optional<String> accessor = metadata.accessor(attribute);
        if (accessor.isEmpty()) {
            throw new QueryCompileException(field, "unknown attribute");
        }
        return column(accessor.get());
    }

    /**
     * Partition pruning terms. Frequency bins are per family allele when the family table carries them, since a summary
     * allele can be de novo in one family and inherited in another.
     */
    private static List<Expr> partitionBins(QueryContext context) {
        PartitionSelection target = context.target();
        TableMetadata metadata = context.metadata();
        boolean family = context.shape() == QueryShape.FAMILY;
        List<Expr> result = new ArrayList<>();
        for (String alias : aliases(PartitionIndex.REGION_BIN, metadata, family)) {
            addBinTerm(result, alias, PartitionIndex.REGION_BIN, target.getRegionBins(), -1);
        }
        String frequencyAlias = family && metadata.hasFamilyColumn(PartitionIndex.FREQUENCY_BIN) ? TableMetadata.FAMILY_ALIAS
                : metadata.hasSummaryColumn(PartitionIndex.FREQUENCY_BIN) ? TableMetadata.SUMMARY_ALIAS : null;
        if (frequencyAlias != null) {
            addBinTerm(result, frequencyAlias, PartitionIndex.FREQUENCY_BIN, target.getFrequencyBins(), 4);
        }
        for (String alias : aliases(PartitionIndex.CODING_BIN, metadata, family)) {
            addBinTerm(result, alias, PartitionIndex.CODING_BIN, target.getCodingBins(), 2);
        }
        if (family && metadata.hasFamilyColumn(PartitionIndex.FAMILY_BIN) && metadata.getPartitionDescriptor() != null) {
            addBinTerm(result, TableMetadata.FAMILY_ALIAS, PartitionIndex.FAMILY_BIN, target.getFamilyBins(),
                    metadata.getPartitionDescriptor().getFamilyBinSize());
        }
        return result;
    }

    private static List<String> aliases(String binColumn, TableMetadata metadata, boolean family) {
        List<String> aliases = new ArrayList<>();
        if (metadata.hasSummaryColumn(binColumn)) {
            aliases.add(TableMetadata.SUMMARY_ALIAS);
        }
        if (family && metadata.hasFamilyColumn(binColumn)) {
            aliases.add(TableMetadata.FAMILY_ALIAS);
        }
        return aliases;
    }

    private static void addBinTerm(List<Expr> terms, String alias, String binColumn, Set<?> bins, int possibleBins) {
        if (bins != null && bins.size() != possibleBins) {
            terms.add(in(column(alias + "." + binColumn), bins));
        }
    }
}

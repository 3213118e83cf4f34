package edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler;

import edu.harvard.hms.dbmi.avillach.genoquery.data.query.ValueRange;
import edu.harvard.hms.dbmi.avillach.genoquery.data.query.VariantFilter;
import edu.harvard.hms.dbmi.avillach.genoquery.data.storage.ColumnType;
import edu.harvard.hms.dbmi.avillach.genoquery.data.storage.TableMetadata;
import edu.harvard.hms.dbmi.avillach.genoquery.exception.QueryCompileException;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.attribute.AttributeQueryParser;

import java.util.*;

/**
 * Checks a filter against a study's tables before anything is compiled. All problems are collected and reported
 * together.
 */
public class FilterValidator {

    public void validate(VariantFilter filter, TableMetadata metadata, QueryShape shape) throws QueryCompileException {
        Map<String, List<String>> problems = new LinkedHashMap<>();

        if (shape == QueryShape.FAMILY && !metadata.hasFamilyTable()) {
            addProblem(problems, "familyTable", "study " + metadata.getDb() + " has no family table to answer family level constraints");
        }
        if (filter.getLimit() != null && filter.getLimit() < 0) {
            addProblem(problems, "limit", "limit must not be negative");
        }
        if (filter.getInheritance() != null) {
            if (filter.getInheritance().isEmpty()) {
                addProblem(problems, "inheritance", "at least one inheritance expression is required");
            }
            for (String expression : filter.getInheritance()) {
                checkExpression(problems, AttributeQueryParser.INHERITANCE, "inheritance", expression);
            }
        }
        checkExpression(problems, AttributeQueryParser.ROLES, "roles", filter.getRoles());
        checkExpression(problems, AttributeQueryParser.SEXES, "sexes", filter.getSexes());
        checkExpression(problems, AttributeQueryParser.STATUSES, "affectedStatuses", filter.getAffectedStatuses());
        checkExpression(problems, AttributeQueryParser.VARIANT_TYPES, "variantType", filter.getVariantType());

        checkRanges(problems, "realAttrFilter", filter.getRealAttrFilter(), metadata);
        checkRanges(problems, "frequencyFilter", filter.getFrequencyFilter(), metadata);

        if (filter.getCategoricalAttrFilter() != null) {
            for (String attribute : new TreeSet<>(filter.getCategoricalAttrFilter().keySet())) {
                String field = "categoricalAttrFilter." + attribute;
                Optional<ColumnType> type = metadata.columnType(attribute);
                if (type.isEmpty()) {
                    addProblem(problems, field, "unknown attribute");
                } else if (type.get() != ColumnType.STRING && type.get() != ColumnType.INT) {
                    addProblem(problems, field, "attribute of type " + type.get() + " cannot be matched against values");
                }
            }
        }
        if (filter.ultraRareOnly() && metadata.columnType(Columns.ALLELE_COUNT_ATTRIBUTE).isEmpty()) {
            addProblem(problems, "ultraRare", "study has no " + Columns.ALLELE_COUNT_ATTRIBUTE + " attribute");
        }
        if ((filter.getGenes() != null || filter.getEffectTypes() != null)
                && metadata.getSummarySchema().get(Columns.EFFECT_GENE_ATTRIBUTE) != ColumnType.STRUCT_LIST) {
            addProblem(problems, "genes", "study has no " + Columns.EFFECT_GENE_ATTRIBUTE + " effect list");
        }

        if (!problems.isEmpty()) {
            throw new QueryCompileException(problems);
        }
    }

    private static void checkExpression(Map<String, List<String>> problems, AttributeQueryParser parser, String field,
                                        String expression) {
        if (expression == null) {
            return;
        }
        try {
            parser.parse(field, expression);
        } catch (QueryCompileException e) {
            e.getProblems().forEach((key, values) -> values.forEach(value -> addProblem(problems, key, value)));
        }
    }

    private static void checkRanges(Map<String, List<String>> problems, String filterName, Map<String, ValueRange> ranges,
                                    TableMetadata metadata) {
        if (ranges == null) {
            return;
        }
        for (String attribute : new TreeSet<>(ranges.keySet())) {
            String field = filterName + "." + attribute;
            ValueRange range = ranges.get(attribute);
            Optional<ColumnType> type = metadata.columnType(attribute);
            if (type.isEmpty()) {
                addProblem(problems, field, "unknown attribute");
            } else if (!type.get().isNumeric()) {
                addProblem(problems, field, "attribute of type " + type.get() + " is not numeric");
            }
            if (range == null) {
                addProblem(problems, field, "range is required");
            } else if (range.min() != null && range.max() != null && range.min() > range.max()) {
                addProblem(problems, field, "min " + range.min() + " is greater than max " + range.max());
            }
        }
    }

    private static void addProblem(Map<String, List<String>> problems, String field, String problem) {
        problems.computeIfAbsent(field, key -> new ArrayList<>()).add(problem);
    }
}

package edu.harvard.hms.dbmi.avillach.genoquery.processing.deserialize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.harvard.hms.dbmi.avillach.genoquery.data.genotype.VariantRow;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler.Columns;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler.QueryShape;

import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Reads the JSON blobs the SQL dialects select: {@code summary_variant_data} for the allele and, for family rows,
 * {@code family_variant_data}. A summary blob may hold a single allele or the list of all alleles of the variant, in
 * which case the row's {@code allele_index} picks one.
 */
public class Schema2JsonDeserializer implements VariantDeserializer {

    private static final ObjectMapper mapper = new ObjectMapper();

    private static final Set<String> SUMMARY_FIELDS = Set.of(
            "chromosome", "position", "end_position", "reference", "alternative", "allele_index", "variant_type");
    private static final Set<String> FAMILY_FIELDS = Set.of("family_id", "members", "genotype");

    @Override
    public VariantRow deserialize(Map<String, Object> raw, QueryShape shape) {
        JsonNode summary = readTree(raw.get(Columns.unqualified(Columns.SUMMARY_VARIANT_DATA)));
        if (summary == null) {
            return null;
        }
        Object alleleIndex = raw.get(Columns.unqualified(Columns.ALLELE_INDEX));
        if (summary.isArray()) {
            summary = selectAllele(summary, alleleIndex == null ? null : ((Number) alleleIndex).intValue());
            if (summary == null) {
                return null;
            }
        }
        Map<String, Object> attributes = new TreeMap<>();
        VariantRow.VariantRowBuilder row = VariantRow.builder()
                .chromosome(summary.path("chromosome").asText())
                .position(summary.path("position").asInt())
                .endPosition(optionalInt(summary, "end_position"))
                .reference(textOrNull(summary, "reference"))
                .alternative(textOrNull(summary, "alternative"))
                .alleleIndex(summary.has("allele_index") ? summary.get("allele_index").asInt()
                        : alleleIndex == null ? 0 : ((Number) alleleIndex).intValue())
                .variantType(optionalInt(summary, "variant_type"));
        collectAttributes(summary, SUMMARY_FIELDS, attributes);

        if (shape == QueryShape.FAMILY) {
            JsonNode family = readTree(raw.get(Columns.unqualified(Columns.FAMILY_VARIANT_DATA)));
            if (family == null) {
                return null;
            }
            row.familyId(textOrNull(family, "family_id"))
                    .members(family.has("members") ? mapper.convertValue(family.get("members"), new TypeReference<List<String>>() {}) : List.of())
                    .genotype(family.has("genotype") ? mapper.convertValue(family.get("genotype"), int[][].class) : null);
            collectAttributes(family, FAMILY_FIELDS, attributes);
        }
        return row.attributes(Collections.unmodifiableMap(attributes)).build();
    }

    private static JsonNode selectAllele(JsonNode alleles, Integer alleleIndex) {
        for (JsonNode allele : alleles) {
            if (alleleIndex == null || allele.path("allele_index").asInt(-1) == alleleIndex) {
                return allele;
            }
        }
        return null;
    }

    private static void collectAttributes(JsonNode node, Set<String> fixedFields, Map<String, Object> attributes) {
        node.fields().forEachRemaining(field -> {
            if (!fixedFields.contains(field.getKey()) && !field.getValue().isNull()) {
                attributes.put(field.getKey(), mapper.convertValue(field.getValue(), Object.class));
            }
        });
    }

    private static JsonNode readTree(Object blob) {
        if (blob == null) {
            return null;
        }
        String json = blob instanceof byte[] ? new String((byte[]) blob, StandardCharsets.UTF_8) : blob.toString();
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed variant data: " + e.getOriginalMessage(), e);
        }
    }

    private static Integer optionalInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asInt();
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}

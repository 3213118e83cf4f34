package edu.harvard.hms.dbmi.avillach.genoquery.data.query;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Declarative description of the variants a caller wants back. Every field is optional. A null field places no
 * constraint; an empty collection constrains the result to nothing.
 *
 * <p>The expression fields ({@link #inheritance}, {@link #roles}, {@link #sexes}, {@link #affectedStatuses} and
 * {@link #variantType}) use the attribute query grammar, e.g. {@code "prb and not sib"} or
 * {@code "any(denovo, possible_denovo)"}.</p>
 */
@Jacksonized
@Value
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = false)
public class VariantFilter {

    List<Region> regions;
    Set<String> genes;
    Set<String> effectTypes;

    Set<String> familyIds;
    Set<String> personIds;

    /**
     * Each entry must hold for a row to match.
     */
    List<String> inheritance;
    String roles;
    String sexes;
    String affectedStatuses;
    String variantType;

    Map<String, ValueRange> realAttrFilter;
    Map<String, ValueRange> frequencyFilter;
    /**
     * Attribute to accepted values. A null value list accepts only missing values, an empty one any present value.
     */
    Map<String, List<String>> categoricalAttrFilter;

    Boolean ultraRare;
    Boolean returnReference;
    Boolean returnUnknown;

    Integer limit;

    public boolean ultraRareOnly() {
        return Boolean.TRUE.equals(ultraRare);
    }

    public boolean includeReference() {
        return Boolean.TRUE.equals(returnReference);
    }

    public boolean includeUnknown() {
        return Boolean.TRUE.equals(returnUnknown);
    }

    /**
     * @return true when any constraint can only be evaluated against family rows
     */
    public boolean hasFamilyConstraints() {
        return familyIds != null || personIds != null || inheritance != null
                || roles != null || sexes != null || affectedStatuses != null;
    }
}

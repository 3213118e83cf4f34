package edu.harvard.hms.dbmi.avillach.genoquery.processing.deserialize;

import edu.harvard.hms.dbmi.avillach.genoquery.data.genotype.VariantRow;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler.QueryShape;

import java.util.Map;

/**
 * Turns one raw backend row into a {@link VariantRow}.
 */
public interface VariantDeserializer {

    /**
     * @return the row, or null to skip it
     */
    VariantRow deserialize(Map<String, Object> raw, QueryShape shape);
}

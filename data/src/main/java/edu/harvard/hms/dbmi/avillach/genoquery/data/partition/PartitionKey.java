package edu.harvard.hms.dbmi.avillach.genoquery.data.partition;

import java.util.Objects;

/**
 * Identifies one physical partition. A null component is a wildcard: either the dimension is not defined for the
 * dataset or a selection leaves it unconstrained.
 */
public record PartitionKey(String regionBin, Integer frequencyBin, Integer codingBin, Integer familyBin) {

    /**
     * @return true when {@code stored} falls inside the partitions this key stands for
     */
    public boolean covers(PartitionKey stored) {
        return component(regionBin, stored.regionBin)
                && component(frequencyBin, stored.frequencyBin)
                && component(codingBin, stored.codingBin)
                && component(familyBin, stored.familyBin);
    }

    private static boolean component(Object selected, Object stored) {
        return selected == null || stored == null || Objects.equals(selected, stored);
    }
}

package edu.harvard.hms.dbmi.avillach.genoquery.processing.partition;

import com.google.common.collect.ImmutableSortedSet;
import edu.harvard.hms.dbmi.avillach.genoquery.data.partition.PartitionKey;
import lombok.Value;

import java.util.*;

/**
 * Bins that must be scanned, per partition dimension. A null dimension is unconstrained, either because the dataset
 * does not partition on it or because the filter does not narrow it. An empty dimension means nothing can match.
 */
@Value
public class PartitionSelection {

    public static final PartitionSelection UNCONSTRAINED = new PartitionSelection(null, null, null, null);

    SortedSet<String> regionBins;
    SortedSet<Integer> frequencyBins;
    SortedSet<Integer> codingBins;
    SortedSet<Integer> familyBins;

    public PartitionSelection(Collection<String> regionBins, Collection<Integer> frequencyBins,
                              Collection<Integer> codingBins, Collection<Integer> familyBins) {
        this.regionBins = regionBins == null ? null : ImmutableSortedSet.copyOf(regionBins);
        this.frequencyBins = frequencyBins == null ? null : ImmutableSortedSet.copyOf(frequencyBins);
        this.codingBins = codingBins == null ? null : ImmutableSortedSet.copyOf(codingBins);
        this.familyBins = familyBins == null ? null : ImmutableSortedSet.copyOf(familyBins);
    }

    public PartitionSelection withRegionBins(Collection<String> regionBins) {
        return new PartitionSelection(regionBins, frequencyBins, codingBins, familyBins);
    }

    /**
     * @return true when some dimension admits no bin at all
     */
    public boolean isEmpty() {
        return isEmpty(regionBins) || isEmpty(frequencyBins) || isEmpty(codingBins) || isEmpty(familyBins);
    }

    private static boolean isEmpty(Set<?> bins) {
        return bins != null && bins.isEmpty();
    }

    /**
     * Cartesian product of the selected bins. Unconstrained dimensions appear as null wildcards.
     */
    public Set<PartitionKey> keys() {
        Set<PartitionKey> keys = new LinkedHashSet<>();
        for (String regionBin : orWildcard(regionBins)) {
            for (Integer frequencyBin : orWildcard(frequencyBins)) {
                for (Integer codingBin : orWildcard(codingBins)) {
                    for (Integer familyBin : orWildcard(familyBins)) {
                        keys.add(new PartitionKey(regionBin, frequencyBin, codingBin, familyBin));
                    }
                }
            }
        }
        return keys;
    }

    public boolean covers(PartitionKey stored) {
        return keys().stream().anyMatch(key -> key.covers(stored));
    }

    private static <T> Collection<T> orWildcard(Set<T> bins) {
        if (bins == null) {
            return Collections.singletonList(null);
        }
        return bins;
    }
}

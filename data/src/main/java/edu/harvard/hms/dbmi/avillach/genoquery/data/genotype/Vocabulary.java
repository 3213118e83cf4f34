package edu.harvard.hms.dbmi.avillach.genoquery.data.genotype;

import com.google.common.collect.ImmutableSortedMap;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;

/**
 * Case-insensitive lookup from the names a user may type in an attribute expression to the bit mask they stand for.
 * Group names resolve to the OR of their members.
 */
public class Vocabulary {

    private final ImmutableSortedMap<String, Integer> masks;

    private Vocabulary(Map<String, Integer> masks) {
        this.masks = ImmutableSortedMap.copyOf(masks);
    }

    public Optional<Integer> lookup(String name) {
        return Optional.ofNullable(masks.get(name.toLowerCase(Locale.ROOT)));
    }

    public SortedSet<String> names() {
        return masks.keySet();
    }

    /**
     * @return the OR of every mask in the vocabulary
     */
    public int allMask() {
        return masks.values().stream().reduce(0, (a, b) -> a | b);
    }

    public static <E extends MaskedAttribute> Builder builder(E[] values) {
        Builder builder = new Builder();
        for (E value : values) {
            builder.put(value.name(), value.mask());
            value.aliases().forEach(alias -> builder.put(alias, value.mask()));
        }
        return builder;
    }

    public static class Builder {
        private final Map<String, Integer> masks = new TreeMap<>();

        private Builder put(String name, int mask) {
            Integer previous = masks.put(name.toLowerCase(Locale.ROOT), mask);
            if (previous != null && previous != mask) {
                throw new IllegalArgumentException("Name " + name + " is mapped to two different values");
            }
            return this;
        }

        public Builder group(String name, MaskedAttribute... members) {
            int mask = 0;
            for (MaskedAttribute member : members) {
                mask |= member.mask();
            }
            return put(name, mask);
        }

        public Vocabulary build() {
            return new Vocabulary(masks);
        }
    }
}

package edu.harvard.hms.dbmi.avillach.genoquery.data.genotype;

import java.util.Set;

public enum Sex implements MaskedAttribute {
    male(1, "M", "1"),
    female(1 << 1, "F", "2"),
    unspecified(1 << 2, "U", "0");

    public static final Vocabulary VOCABULARY = Vocabulary.builder(values()).build();

    private final int mask;
    private final Set<String> aliases;

    Sex(int mask, String... aliases) {
        this.mask = mask;
        this.aliases = Set.of(aliases);
    }

    @Override
    public int mask() {
        return mask;
    }

    @Override
    public Set<String> aliases() {
        return aliases;
    }
}

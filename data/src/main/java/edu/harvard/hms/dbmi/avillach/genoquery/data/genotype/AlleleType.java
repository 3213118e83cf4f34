package edu.harvard.hms.dbmi.avillach.genoquery.data.genotype;

import java.util.Set;

public enum AlleleType implements MaskedAttribute {
    substitution(1, "sub"),
    small_insertion(1 << 1, "ins"),
    small_deletion(1 << 2, "del"),
    complex(1 << 3, "comp"),
    large_deletion(1 << 4, "CNV-"),
    large_duplication(1 << 5, "CNV+"),
    tandem_repeat(1 << 6, "TR");

    public static final Vocabulary VOCABULARY = Vocabulary.builder(values())
            .group("cnv", large_deletion, large_duplication)
            .build();

    private final int mask;
    private final Set<String> aliases;

    AlleleType(int mask, String... aliases) {
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

package edu.harvard.hms.dbmi.avillach.genoquery.data.genotype;

import java.util.Set;

/**
 * Position of a family member relative to the proband.
 */
public enum Role implements MaskedAttribute {
    maternal_grandmother(1),
    maternal_grandfather(1 << 1),
    paternal_grandmother(1 << 2),
    paternal_grandfather(1 << 3),
    mom(1 << 4, "mother"),
    dad(1 << 5, "father"),
    parent(1 << 6),
    prb(1 << 7, "proband"),
    sib(1 << 8, "sibling"),
    child(1 << 9),
    maternal_half_sibling(1 << 10),
    paternal_half_sibling(1 << 11),
    half_sibling(1 << 12),
    maternal_aunt(1 << 13),
    maternal_uncle(1 << 14),
    paternal_aunt(1 << 15),
    paternal_uncle(1 << 16),
    maternal_cousin(1 << 17),
    paternal_cousin(1 << 18),
    step_mom(1 << 19),
    step_dad(1 << 20),
    spouse(1 << 21),
    unknown(1 << 22);

    public static final Vocabulary VOCABULARY = Vocabulary.builder(values()).build();

    private final int mask;
    private final Set<String> aliases;

    Role(int mask, String... aliases) {
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

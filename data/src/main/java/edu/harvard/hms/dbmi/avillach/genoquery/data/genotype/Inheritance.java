package edu.harvard.hms.dbmi.avillach.genoquery.data.genotype;

public enum Inheritance implements MaskedAttribute {
    reference(1),
    mendelian(1 << 1),
    denovo(1 << 2),
    possible_denovo(1 << 3),
    omission(1 << 4),
    possible_omission(1 << 5),
    other(1 << 6),
    missing(1 << 7),
    unknown(1 << 8);

    public static final Vocabulary VOCABULARY = Vocabulary.builder(values())
            .group("any_denovo", denovo, possible_denovo)
            .group("any_omission", omission, possible_omission)
            .build();

    private final int mask;

    Inheritance(int mask) {
        this.mask = mask;
    }

    @Override
    public int mask() {
        return mask;
    }
}

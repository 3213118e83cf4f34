package edu.harvard.hms.dbmi.avillach.genoquery.data.genotype;

/**
 * Affected status of a family member.
 */
public enum Status implements MaskedAttribute {
    unaffected(1),
    affected(1 << 1),
    unspecified(1 << 2);

    public static final Vocabulary VOCABULARY = Vocabulary.builder(values()).build();

    private final int mask;

    Status(int mask) {
        this.mask = mask;
    }

    @Override
    public int mask() {
        return mask;
    }
}

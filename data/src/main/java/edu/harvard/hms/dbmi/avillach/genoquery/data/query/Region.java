package edu.harvard.hms.dbmi.avillach.genoquery.data.query;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Genomic interval, 1-based and inclusive on both ends. A null start or stop leaves that side of the chromosome open.
 */
public record Region(String chromosome, Integer start, Integer stop) {

    private static final Pattern REGION_PATTERN = Pattern.compile("^([^:\\s]+)(?::([\\d,]+)(?:-([\\d,]+))?)?$");

    public Region {
        if (chromosome == null || chromosome.isBlank()) {
            throw new IllegalArgumentException("Region chromosome is required");
        }
        if (start != null && stop != null && start > stop) {
            throw new IllegalArgumentException("Region start " + start + " is after stop " + stop + " on " + chromosome);
        }
    }

    public static Region chromosome(String chromosome) {
        return new Region(chromosome, null, null);
    }

    /**
     * Parses {@code chr}, {@code chr:pos} and {@code chr:start-stop}.
     */
    public static Region parse(String region) {
        Matcher matcher = REGION_PATTERN.matcher(region.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Unable to parse region " + region);
        }
        String chromosome = matcher.group(1);
        if (matcher.group(2) == null) {
            return chromosome(chromosome);
        }
        int start = Integer.parseInt(matcher.group(2).replace(",", ""));
        if (matcher.group(3) == null) {
            return new Region(chromosome, start, start);
        }
        return new Region(chromosome, start, Integer.parseInt(matcher.group(3).replace(",", "")));
    }

    @JsonIgnore
    public boolean isWholeChromosome() {
        return start == null && stop == null;
    }

    /**
     * @param endPosition last position covered by the allele, null for single position alleles
     */
    public boolean overlaps(String chromosome, int position, Integer endPosition) {
        if (!this.chromosome.equals(chromosome)) {
            return false;
        }
        int end = endPosition == null ? position : endPosition;
        if (start != null && end < start) {
            return false;
        }
        return stop == null || position <= stop;
    }

    @Override
    public String toString() {
        if (isWholeChromosome()) {
            return chromosome;
        }
        return chromosome + ":" + (start == null ? "" : start) + "-" + (stop == null ? "" : stop);
    }
}

package edu.harvard.hms.dbmi.avillach.genoquery.processing.partition;

import com.google.common.collect.Lists;
import edu.harvard.hms.dbmi.avillach.genoquery.data.genotype.Inheritance;
import edu.harvard.hms.dbmi.avillach.genoquery.data.partition.PartitionDescriptor;
import edu.harvard.hms.dbmi.avillach.genoquery.data.query.Region;
import edu.harvard.hms.dbmi.avillach.genoquery.data.query.ValueRange;
import edu.harvard.hms.dbmi.avillach.genoquery.data.query.VariantFilter;
import edu.harvard.hms.dbmi.avillach.genoquery.data.storage.TableMetadata;
import edu.harvard.hms.dbmi.avillach.genoquery.exception.QueryCompileException;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.attribute.AttributeNode;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.attribute.AttributeQueryParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Maps a filter to the partitions that may hold matching rows. The result is always a superset of the partitions
 * holding matches; narrowing is only applied where a dimension can be proven irrelevant.
 *
 * <p>Pure and side-effect free, so it can be called for planning and explain as often as needed.</p>
 */
public class PartitionIndex {

    private static final Logger log = LoggerFactory.getLogger(PartitionIndex.class);

    /**
     * Beyond this many region bins the region dimension is left unconstrained.
     */
    public static final int REGION_BINS_CUTOFF = 20;
    /**
     * Gene lists longer than this are not turned into regions.
     */
    public static final int GENE_REGIONS_CUTOFF = 20;
    public static final int GENE_REGIONS_EXTEND = 20_000;

    public static final String REGION_BIN = "region_bin";
    public static final String FREQUENCY_BIN = "frequency_bin";
    public static final String CODING_BIN = "coding_bin";
    public static final String FAMILY_BIN = "family_bin";

    private static final String ALLELE_FREQUENCY = "af_allele_freq";
    private static final String ALLELE_COUNT = "af_allele_count";

    public PartitionSelection selectPartitions(VariantFilter filter, TableMetadata metadata) throws QueryCompileException {
        PartitionDescriptor descriptor = metadata.getPartitionDescriptor();
        if (descriptor == null) {
            return PartitionSelection.UNCONSTRAINED;
        }
        PartitionSelection selection = new PartitionSelection(
                regionBins(filter, metadata, descriptor),
                frequencyBins(filter, metadata, descriptor),
                codingBins(filter, metadata, descriptor),
                familyBins(filter, metadata, descriptor)
        );
        log.debug("Selected partitions " + selection);
        return selection;
    }

    /**
     * Splits a selection into scan targets, one runner each. A query narrowed by region, or by frequency and coding bins
     * that already make it selective, stays a single target. Otherwise the dataset's region bins are divided into at
     * most {@code maxTargets} contiguous batches.
     */
    public List<PartitionSelection> planTargets(VariantFilter filter, TableMetadata metadata, int maxTargets)
            throws QueryCompileException {
        PartitionSelection selection = selectPartitions(filter, metadata);
        PartitionDescriptor descriptor = metadata.getPartitionDescriptor();
        if (maxTargets <= 1 || descriptor == null || selection.isEmpty() || selection.getRegionBins() != null
                || !descriptor.hasRegionBins() || !metadata.hasSummaryColumn(REGION_BIN)) {
            return List.of(selection);
        }
        SortedSet<Integer> frequencyBins = selection.getFrequencyBins();
        if (frequencyBins != null && (frequencyBins.contains(PartitionDescriptor.FREQUENCY_BIN_RARE)
                || frequencyBins.contains(PartitionDescriptor.FREQUENCY_BIN_COMMON))) {
            return List.of(selection);
        }
        SortedSet<Integer> codingBins = selection.getCodingBins();
        if (codingBins != null && !codingBins.contains(0)
                && (frequencyBins == null || !frequencyBins.contains(PartitionDescriptor.FREQUENCY_BIN_COMMON))) {
            return List.of(selection);
        }
        List<String> allRegionBins = descriptor.allRegionBins();
        if (allRegionBins.isEmpty()) {
            return List.of(selection);
        }
        int batchSize = (allRegionBins.size() + maxTargets - 1) / maxTargets;
        List<PartitionSelection> targets = new ArrayList<>();
        for (List<String> batch : Lists.partition(allRegionBins, batchSize)) {
            targets.add(selection.withRegionBins(batch));
        }
        return targets;
    }

    Set<String> regionBins(VariantFilter filter, TableMetadata metadata, PartitionDescriptor descriptor) {
        if (!descriptor.hasRegionBins()) {
            return null;
        }
        List<Region> regions = filter.getRegions();
        if (regions == null && filter.getGenes() != null) {
            regions = geneRegions(filter.getGenes(), metadata);
        }
        if (regions == null) {
            return null;
        }
        Set<String> bins = new TreeSet<>();
        for (Region region : regions) {
            Integer stop = region.stop();
            if (stop == null) {
                stop = descriptor.getChromosomeLengths().get(region.chromosome());
                if (stop == null) {
                    return null;
                }
            }
            int start = region.start() == null ? 0 : region.start();
            int firstBin = Math.max(0, start - descriptor.getRegionOverlapMargin()) / descriptor.getRegionLength();
            int lastBin = stop / descriptor.getRegionLength();
            String prefix = descriptor.regionBinPrefix(region.chromosome());
            for (int bin = firstBin; bin <= lastBin; bin++) {
                bins.add(prefix + "_" + bin);
                if (bins.size() > REGION_BINS_CUTOFF) {
                    return null;
                }
            }
        }
        return bins;
    }

    private static List<Region> geneRegions(Set<String> genes, TableMetadata metadata) {
        if (genes.size() > GENE_REGIONS_CUTOFF) {
            return null;
        }
        List<Region> regions = new ArrayList<>();
        for (String gene : new TreeSet<>(genes)) {
            List<Region> spans = metadata.getGeneRegions().get(gene);
            if (spans == null) {
                return null;
            }
            for (Region span : spans) {
                int start = span.start() == null ? 1 : Math.max(1, span.start() - GENE_REGIONS_EXTEND);
                Integer stop = span.stop() == null ? null : span.stop() + GENE_REGIONS_EXTEND;
                regions.add(new Region(span.chromosome(), start, stop));
            }
        }
        return regions;
    }

    Set<Integer> frequencyBins(VariantFilter filter, TableMetadata metadata, PartitionDescriptor descriptor)
            throws QueryCompileException {
        if (!descriptor.hasFrequencyBins()
                || !(metadata.hasSummaryColumn(FREQUENCY_BIN) || metadata.hasFamilyColumn(FREQUENCY_BIN))) {
            return null;
        }
        if (filter.getInheritance() != null && inheritanceDenovoOnly(filter.getInheritance())) {
            return Set.of(PartitionDescriptor.FREQUENCY_BIN_DENOVO);
        }
        Set<Integer> bins = new TreeSet<>(List.of(0, 1, 2, 3));
        if (filter.ultraRareOnly()) {
            bins.retainAll(List.of(PartitionDescriptor.FREQUENCY_BIN_DENOVO, PartitionDescriptor.FREQUENCY_BIN_ULTRA_RARE));
        }
        if (filter.getFrequencyFilter() != null) {
            ValueRange frequency = filter.getFrequencyFilter().get(ALLELE_FREQUENCY);
            if (frequency != null && frequency.max() != null && frequency.max() <= descriptor.getRareBoundary()) {
                bins.remove(PartitionDescriptor.FREQUENCY_BIN_COMMON);
            }
            ValueRange count = filter.getFrequencyFilter().get(ALLELE_COUNT);
            if (count != null && count.max() != null && count.max() < 2) {
                bins.retainAll(List.of(PartitionDescriptor.FREQUENCY_BIN_DENOVO, PartitionDescriptor.FREQUENCY_BIN_ULTRA_RARE));
            }
        }
        return bins.size() == 4 ? null : bins;
    }

    /**
     * True when no allele without the de novo bit can satisfy every inheritance expression.
     */
    static boolean inheritanceDenovoOnly(List<String> inheritance) throws QueryCompileException {
        List<AttributeNode> expressions = new ArrayList<>();
        for (String expression : inheritance) {
            expressions.add(AttributeQueryParser.INHERITANCE.parse("inheritance", expression));
        }
        int all = Inheritance.VOCABULARY.allMask();
        for (int value = 0; value <= all; value++) {
            if ((value & ~all) != 0 || (value & Inheritance.denovo.mask()) != 0) {
                continue;
            }
            final int candidate = value;
            if (expressions.stream().allMatch(expression -> expression.matches(candidate))) {
                return false;
            }
        }
        return true;
    }

    Set<Integer> codingBins(VariantFilter filter, TableMetadata metadata, PartitionDescriptor descriptor) {
        Set<String> effectTypes = filter.getEffectTypes();
        if (effectTypes == null || !descriptor.hasCodingBins() || !metadata.hasSummaryColumn(CODING_BIN)) {
            return null;
        }
        // only the all-coding case narrows: an allele can carry coding and non-coding effects at once
        if (descriptor.getCodingEffectTypes().containsAll(effectTypes)) {
            return Set.of(1);
        }
        return null;
    }

    Set<Integer> familyBins(VariantFilter filter, TableMetadata metadata, PartitionDescriptor descriptor) {
        if (!descriptor.hasFamilyBins() || !metadata.hasFamilyColumn(FAMILY_BIN)) {
            return null;
        }
        if (filter.getFamilyIds() == null && filter.getPersonIds() == null) {
            return null;
        }
        Set<Integer> bins = new TreeSet<>();
        if (filter.getFamilyIds() != null) {
            filter.getFamilyIds().forEach(familyId -> bins.add(descriptor.makeFamilyBin(familyId)));
        }
        if (filter.getPersonIds() != null) {
            if (metadata.getPersonFamilies().isEmpty()) {
                return null;
            }
            for (String personId : filter.getPersonIds()) {
                String familyId = metadata.getPersonFamilies().get(personId);
                if (familyId != null) {
                    bins.add(descriptor.makeFamilyBin(familyId));
                }
            }
        }
        if (!bins.isEmpty() && bins.size() >= descriptor.getFamilyBinSize() / 2) {
            return null;
        }
        return bins;
    }
}

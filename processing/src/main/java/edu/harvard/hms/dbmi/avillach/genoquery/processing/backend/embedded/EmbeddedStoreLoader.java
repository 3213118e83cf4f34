package edu.harvard.hms.dbmi.avillach.genoquery.processing.backend.embedded;

import com.google.common.base.Splitter;
import edu.harvard.hms.dbmi.avillach.genoquery.data.storage.ColumnType;
import edu.harvard.hms.dbmi.avillach.genoquery.data.storage.TableMetadata;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.util.*;

/**
 * Loads an {@link EmbeddedVariantStore} from tab separated files with a header row. Cells are typed by the table
 * schema; columns missing from the schema are read as strings and an empty cell is null.
 *
 * <ul>
 *     <li>STRING_LIST: {@code a;b;c}</li>
 *     <li>STRUCT_LIST effect lists: {@code SYMBOL:effect|SYMBOL:effect}</li>
 *     <li>{@code genotype}: one {@code a/b} pair per member, {@code 0/0;0/1;0/1}</li>
 * </ul>
 */
public class EmbeddedStoreLoader {

    private static final Logger log = LoggerFactory.getLogger(EmbeddedStoreLoader.class);

    public static final String GENOTYPE_COLUMN = "genotype";

    private static final Splitter LIST_SPLITTER = Splitter.on(';').trimResults().omitEmptyStrings();
    private static final Splitter STRUCT_SPLITTER = Splitter.on('|').trimResults().omitEmptyStrings();
    private static final Splitter ALLELE_SPLITTER = Splitter.on('/').trimResults();

    public EmbeddedVariantStore load(TableMetadata metadata, Reader summaryTsv, Reader familyTsv, int maxConnections)
            throws IOException {
        List<Map<String, Object>> summaryRows = readTable(summaryTsv, metadata.getSummarySchema());
        List<Map<String, Object>> familyRows = familyTsv == null ? List.of() : readTable(familyTsv, metadata.getFamilySchema());
        log.info("Loaded embedded study " + metadata.getDb() + ": " + summaryRows.size() + " summary rows, "
                + familyRows.size() + " family rows");
        return new EmbeddedVariantStore(summaryRows, familyRows, metadata.getJoinKey(), maxConnections);
    }

    List<Map<String, Object>> readTable(Reader tsv, Map<String, ColumnType> schema) throws IOException {
        List<Map<String, Object>> rows = new ArrayList<>();
        Iterable<CSVRecord> records = CSVFormat.TDF.withFirstRecordAsHeader().parse(tsv);
        for (CSVRecord record : records) {
            Map<String, Object> row = new HashMap<>();
            record.toMap().forEach((column, cell) -> row.put(column, parseCell(column, cell, schema.get(column), record)));
            rows.add(row);
        }
        return rows;
    }

    private static Object parseCell(String column, String cell, ColumnType type, CSVRecord record) {
        if (cell == null || cell.isEmpty()) {
            return null;
        }
        if (GENOTYPE_COLUMN.equals(column)) {
            return parseGenotype(cell);
        }
        if (type == null) {
            return cell;
        }
        try {
            switch (type) {
                case INT:
                    return Integer.parseInt(cell);
                case FLOAT:
                    return Double.parseDouble(cell);
                case STRING_LIST:
                    return LIST_SPLITTER.splitToList(cell);
                case STRUCT_LIST:
                    return parseEffects(cell);
                default:
                    return cell;
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Bad " + type + " value '" + cell + "' in column " + column
                    + " at line " + record.getRecordNumber(), e);
        }
    }

    /**
     * @return {@code genotype[copy][member]}
     */
    static int[][] parseGenotype(String cell) {
        List<String> members = LIST_SPLITTER.splitToList(cell);
        int[][] genotype = new int[2][members.size()];
        for (int member = 0; member < members.size(); member++) {
            List<String> alleles = ALLELE_SPLITTER.splitToList(members.get(member));
            for (int copy = 0; copy < 2; copy++) {
                genotype[copy][member] = Integer.parseInt(alleles.get(Math.min(copy, alleles.size() - 1)));
            }
        }
        return genotype;
    }

    static List<Map<String, Object>> parseEffects(String cell) {
        List<Map<String, Object>> effects = new ArrayList<>();
        for (String entry : STRUCT_SPLITTER.split(cell)) {
            int separator = entry.indexOf(':');
            if (separator < 0) {
                throw new IllegalArgumentException("Bad effect entry '" + entry + "', expected SYMBOL:effect");
            }
            effects.add(Map.of(
                    "effect_gene_symbols", entry.substring(0, separator),
                    "effect_types", entry.substring(separator + 1)));
        }
        return effects;
    }
}

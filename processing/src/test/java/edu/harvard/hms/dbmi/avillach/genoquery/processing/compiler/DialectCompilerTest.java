package edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler;

import edu.harvard.hms.dbmi.avillach.genoquery.data.query.Region;
import edu.harvard.hms.dbmi.avillach.genoquery.data.query.ValueRange;
import edu.harvard.hms.dbmi.avillach.genoquery.data.query.VariantFilter;
import edu.harvard.hms.dbmi.avillach.genoquery.exception.QueryCompileException;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.TestStudies;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.partition.PartitionIndex;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class DialectCompilerTest {

    private final DialectCompilerFactory factory = new DialectCompilerFactory(new PartitionIndex());

    private static final VariantFilter FAMILY_REGION = VariantFilter.builder()
            .regions(List.of(new Region("1", 1, 1000)))
            .familyIds(Set.of("f1"))
            .build();

    private static final VariantFilter GENE_EFFECT = VariantFilter.builder()
            .genes(Set.of("GENE1"))
            .effectTypes(Set.of("synonymous", "missense"))
            .limit(5)
            .build();

    private String sql(Dialect dialect, VariantFilter filter) throws QueryCompileException {
        return ((SqlText) factory.getCompiler(dialect).compile(filter, TestStudies.metadata()).getPayload()).sql();
    }

    @Test
    public void compile_impalaFamilyRegion_joinsFamilyAndPrunesPartitions() throws QueryCompileException {
        String expected = "SELECT sa.summary_index, sa.allele_index, sa.summary_variant_data, fa.family_index, fa.family_variant_data\n"
                + "FROM study1_db.study1_summary AS sa\n"
                + "JOIN study1_db.study1_family AS fa ON sa.sj_index = fa.sj_index\n"
                + "WHERE (sa.chromosome = '1' AND NOT (COALESCE(sa.end_position, sa.position) < 1 OR sa.position > 1000))"
                + " AND (fa.family_id = 'f1') AND (sa.allele_index > 0) AND (sa.region_bin = '1_0') AND (fa.family_bin = 9)";

        assertEquals(expected, sql(Dialect.IMPALA, FAMILY_REGION));
    }

    @Test
    public void compile_impalaGeneEffect_joinsEffectsGroupsAndLimits() throws QueryCompileException {
        String expected = "SELECT sa.summary_index, sa.allele_index, sa.summary_variant_data\n"
                + "FROM study1_db.study1_summary AS sa\n"
                + "JOIN sa.effect_gene AS eg\n"
                + "WHERE (eg.effect_gene_symbols = 'GENE1') AND (eg.effect_types IN ('missense', 'synonymous'))"
                + " AND (sa.allele_index > 0) AND (sa.region_bin = '1_0') AND (sa.coding_bin = 1)\n"
                + "GROUP BY sa.summary_index, sa.allele_index, sa.summary_variant_data\n"
                + "LIMIT 50";

        assertEquals(expected, sql(Dialect.IMPALA, GENE_EFFECT));
    }

    @Test
    public void compile_bigQueryGeneEffect_unnestsEffectsFromQualifiedTable() throws QueryCompileException {
        String sql = sql(Dialect.BIGQUERY, GENE_EFFECT);

        assertTrue(sql.startsWith("SELECT sa.summary_index, sa.allele_index, sa.summary_variant_data\n"
                + "FROM `gpf-project.study1_db.study1_summary` AS sa\n"
                + "CROSS JOIN UNNEST(sa.effect_gene) AS eg\n"), sql);
        assertTrue(sql.endsWith("GROUP BY sa.summary_index, sa.allele_index, sa.summary_variant_data\nLIMIT 50"), sql);
    }

    @Test
    public void compile_duckDbGeneEffect_bindsValuesAsParameters() throws QueryCompileException {
        CompiledQuery query = factory.getCompiler(Dialect.DUCKDB).compile(GENE_EFFECT, TestStudies.metadata());
        ParameterizedSql payload = (ParameterizedSql) query.getPayload();

        assertEquals("SELECT sa.summary_index, sa.allele_index, sa.summary_variant_data\n"
                + "FROM study1_db.study1_summary AS sa\n"
                + "CROSS JOIN UNNEST(sa.effect_gene) AS t(eg)\n"
                + "WHERE (eg.effect_gene_symbols = ?) AND (eg.effect_types IN (?, ?))"
                + " AND (sa.allele_index > ?) AND (sa.region_bin = ?) AND (sa.coding_bin = ?)\n"
                + "GROUP BY sa.summary_index, sa.allele_index, sa.summary_variant_data\n"
                + "LIMIT 50", payload.sql());
        assertEquals(List.of("GENE1", "missense", "synonymous", 0, "1_0", 1), payload.parameters());
        assertEquals(5, query.getRequestedLimit());
    }

    @Test
    public void compile_duckDbWithoutDb_usesBareTableNames() throws QueryCompileException {
        CompiledQuery query = factory.getCompiler(Dialect.DUCKDB)
                .compile(VariantFilter.builder().build(), TestStudies.metadataBuilder().db(null).build());

        assertTrue(((ParameterizedSql) query.getPayload()).sql().contains("FROM study1_summary AS sa"));
    }

    @Test
    public void compile_emptyFamilyIds_matchesNothing() throws QueryCompileException {
        VariantFilter filter = VariantFilter.builder().familyIds(Set.of()).build();

        String sql = sql(Dialect.IMPALA, filter);

        assertTrue(sql.contains("WHERE (FALSE)"), sql);
        assertTrue(factory.getCompiler(Dialect.IMPALA).compile(filter, TestStudies.metadata()).getTarget().isEmpty());
    }

    @Test
    public void compile_absentFamilyIds_noFamilyPredicate() throws QueryCompileException {
        String sql = sql(Dialect.IMPALA, VariantFilter.builder().build());

        assertFalse(sql.contains("family_id"), sql);
        assertFalse(sql.contains("JOIN"), sql);
    }

    @Test
    public void compile_personIds_usesDialectArraySyntax() throws QueryCompileException {
        VariantFilter filter = VariantFilter.builder().personIds(new LinkedHashSet<>(List.of("p3", "p1"))).build();

        assertTrue(sql(Dialect.IMPALA, filter).contains(
                "(EXISTS (SELECT 1 FROM fa.allele_in_members AS m WHERE m.item IN ('p1', 'p3')))"));
        assertTrue(sql(Dialect.BIGQUERY, filter).contains(
                "(EXISTS (SELECT 1 FROM UNNEST(fa.allele_in_members) AS m WHERE m IN ('p1', 'p3')))"));
        ParameterizedSql duckDb = (ParameterizedSql) factory.getCompiler(Dialect.DUCKDB)
                .compile(filter, TestStudies.metadata()).getPayload();
        assertTrue(duckDb.sql().contains("(list_has_any(fa.allele_in_members, [?, ?]))"), duckDb.sql());
        assertEquals(List.of("p1", "p3"), duckDb.parameters().subList(0, 2));
    }

    @Test
    public void compile_inheritance_rendersBitTestPerDialect() throws QueryCompileException {
        VariantFilter filter = VariantFilter.builder().inheritance(List.of("denovo")).build();

        String impala = sql(Dialect.IMPALA, filter);
        String bigQuery = sql(Dialect.BIGQUERY, filter);

        assertTrue(impala.contains("(BITAND(fa.inheritance_in_members, 4) != 0)"), impala);
        assertTrue(bigQuery.contains("((fa.inheritance_in_members & 4) != 0)"), bigQuery);
        assertTrue(impala.contains("(fa.frequency_bin = 0)"), impala);
        assertFalse(impala.contains("sa.frequency_bin"), impala);
    }

    @Test
    public void compile_sameFilterTwice_identicalPayloads() throws QueryCompileException {
        VariantFilter filter = VariantFilter.builder()
                .genes(new HashSet<>(List.of("GENE9", "GENE1", "GENE3", "GENE5")))
                .familyIds(new HashSet<>(List.of("f2", "f1", "f3")))
                .realAttrFilter(Map.of("cadd_raw", ValueRange.atLeast(20), "af_allele_freq", ValueRange.atMost(1)))
                .categoricalAttrFilter(Map.of("clinvar", List.of("pathogenic", "benign")))
                .roles("prb and not sib")
                .build();

        for (Dialect dialect : Dialect.values()) {
            DialectCompiler compiler = factory.getCompiler(dialect);
            assertEquals(compiler.compile(filter, TestStudies.metadata()), compiler.compile(filter, TestStudies.metadata()));
        }
    }

    @Test
    public void compile_familyFilterOnSummaryOnlyStudy_throws() {
        VariantFilter filter = VariantFilter.builder().familyIds(Set.of("f1")).build();

        QueryCompileException e = assertThrows(QueryCompileException.class,
                () -> factory.getCompiler(Dialect.IMPALA).compile(filter, TestStudies.summaryOnlyMetadata()));
        assertTrue(e.getProblems().containsKey("familyTable"));
    }

    @Test
    public void compile_invalidFilter_reportsEveryProblem() {
        VariantFilter filter = VariantFilter.builder()
                .realAttrFilter(Map.of("nope", ValueRange.atMost(1), "cadd_raw", ValueRange.between(5, 1)))
                .roles("prb and bogus")
                .limit(-1)
                .build();

        QueryCompileException e = assertThrows(QueryCompileException.class,
                () -> factory.getCompiler(Dialect.BIGQUERY).compile(filter, TestStudies.metadata()));
        assertEquals(Set.of("limit", "roles", "realAttrFilter.nope", "realAttrFilter.cadd_raw"), e.getProblems().keySet());
    }

    @Test
    public void compile_embedded_producesPredicateChain() throws QueryCompileException {
        CompiledQuery query = factory.getCompiler(Dialect.EMBEDDED).compile(GENE_EFFECT, TestStudies.metadata());

        EmbeddedPlan plan = (EmbeddedPlan) query.getPayload();
        assertEquals(QueryShape.SUMMARY, plan.shape());
        assertFalse(plan.joinFamily());
        assertTrue(plan.explodeEffects());
        assertTrue(plan.distinctSummary());
        assertEquals(50, plan.limit());
        assertEquals(5, plan.predicates().size());
    }

    @Test
    public void compileTargets_noRegion_splitsRegionBinsIntoBatches() throws QueryCompileException {
        List<CompiledQuery> queries = factory.getCompiler(Dialect.IMPALA)
                .compileTargets(VariantFilter.builder().build(), TestStudies.metadata(), QueryShape.SUMMARY, 4);

        assertEquals(4, queries.size());
        assertEquals(List.of("1_0", "1_1", "1_2", "1_3"), new ArrayList<>(queries.get(0).getTarget().getRegionBins()));
        assertTrue(queries.get(0).describe().contains("(sa.region_bin IN ('1_0', '1_1', '1_2', '1_3'))"));
        assertEquals(List.of("other_2"), new ArrayList<>(queries.get(3).getTarget().getRegionBins()));
    }

    @Test
    public void compileTargets_withRegion_singleTarget() throws QueryCompileException {
        List<CompiledQuery> queries = factory.getCompiler(Dialect.IMPALA)
                .compileTargets(FAMILY_REGION, TestStudies.metadata(), QueryShape.FAMILY, 4);

        assertEquals(1, queries.size());
    }

    @Test
    public void getCompiler_everyDialect_registered() {
        for (Dialect dialect : Dialect.values()) {
            assertEquals(dialect, factory.getCompiler(dialect).dialect());
        }
    }
}

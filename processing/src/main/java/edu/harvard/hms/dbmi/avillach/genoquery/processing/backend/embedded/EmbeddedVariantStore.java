package edu.harvard.hms.dbmi.avillach.genoquery.processing.backend.embedded;

import com.google.common.collect.*;
import edu.harvard.hms.dbmi.avillach.genoquery.data.storage.TableMetadata;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.backend.ConnectionPool;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.backend.QueryConnection;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler.Columns;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler.EmbeddedPlan;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.expr.Expr;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.expr.ExprEvaluator;

import java.util.*;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * In-memory summary and family tables answering {@link EmbeddedPlan}s. Rows handed out are keyed by alias qualified
 * column name ({@code sa.position}, {@code fa.family_id}, {@code eg.effect_types}), the same names the compiled
 * predicates reference.
 */
public class EmbeddedVariantStore implements ConnectionPool {

    private final String joinKey;
    private final List<Map<String, Object>> summaryRows;
    private final ListMultimap<Object, Map<String, Object>> familyRowsByKey;
    private final Semaphore permits;

    public EmbeddedVariantStore(List<Map<String, Object>> summaryRows, List<Map<String, Object>> familyRows,
                                String joinKey, int maxConnections) {
        this.joinKey = joinKey;
        this.summaryRows = qualify(TableMetadata.SUMMARY_ALIAS, summaryRows);
        ImmutableListMultimap.Builder<Object, Map<String, Object>> family = ImmutableListMultimap.builder();
        for (Map<String, Object> row : qualify(TableMetadata.FAMILY_ALIAS, familyRows)) {
            Object key = row.get(TableMetadata.FAMILY_ALIAS + "." + joinKey);
            if (key != null) {
                family.put(key, row);
            }
        }
        this.familyRowsByKey = family.build();
        this.permits = new Semaphore(maxConnections, true);
    }

    @Override
    public QueryConnection acquire(long timeout, TimeUnit unit) throws InterruptedException {
        if (!permits.tryAcquire(timeout, unit)) {
            return null;
        }
        return new EmbeddedConnection(this, permits::release);
    }

    public int availableConnections() {
        return permits.availablePermits();
    }

    /**
     * Lazily evaluates a plan: join, explode effects, filter, deduplicate, limit.
     */
    Iterator<Map<String, Object>> scan(EmbeddedPlan plan) {
        FluentIterable<Map<String, Object>> rows = FluentIterable.from(summaryRows);
        if (plan.joinFamily()) {
            rows = rows.transformAndConcat(this::joinFamily);
        }
        if (plan.explodeEffects()) {
            rows = rows.transformAndConcat(EmbeddedVariantStore::explodeEffects);
        }
        List<Expr> predicates = plan.predicates();
        rows = rows.filter(row -> predicates.stream().allMatch(predicate -> ExprEvaluator.test(predicate, row)));
        if (plan.distinctSummary()) {
            Set<List<Object>> seen = new HashSet<>();
            rows = rows.filter(row -> seen.add(Arrays.asList(row.get(Columns.SUMMARY_INDEX), row.get(Columns.ALLELE_INDEX))));
        }
        if (plan.limit() != null) {
            rows = rows.limit(plan.limit());
        }
        return rows.iterator();
    }

    private List<Map<String, Object>> joinFamily(Map<String, Object> summary) {
        Object key = summary.get(TableMetadata.SUMMARY_ALIAS + "." + joinKey);
        if (key == null) {
            return List.of();
        }
        List<Map<String, Object>> joined = new ArrayList<>();
        for (Map<String, Object> family : familyRowsByKey.get(key)) {
            Map<String, Object> row = new HashMap<>(summary);
            row.putAll(family);
            joined.add(row);
        }
        return joined;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> explodeEffects(Map<String, Object> row) {
        Object effects = row.get(Columns.EFFECT_GENE);
        if (!(effects instanceof List)) {
            return List.of();
        }
        List<Map<String, Object>> exploded = new ArrayList<>();
        for (Map<String, Object> effect : (List<Map<String, Object>>) effects) {
            Map<String, Object> copy = new HashMap<>(row);
            effect.forEach((field, value) -> copy.put(Columns.EFFECT_GENE_ALIAS + "." + field, value));
            exploded.add(copy);
        }
        return exploded;
    }

    private static List<Map<String, Object>> qualify(String alias, List<Map<String, Object>> rows) {
        List<Map<String, Object>> qualified = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> copy = new HashMap<>();
            row.forEach((column, value) -> copy.put(alias + "." + column, value));
            qualified.add(Collections.unmodifiableMap(copy));
        }
        return Collections.unmodifiableList(qualified);
    }
}

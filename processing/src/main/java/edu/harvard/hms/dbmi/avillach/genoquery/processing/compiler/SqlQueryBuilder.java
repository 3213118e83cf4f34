package edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler;

import edu.harvard.hms.dbmi.avillach.genoquery.data.storage.TableMetadata;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.expr.Expr;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.expr.SqlRenderer;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.expr.SqlStyle;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Shared assembly of SQL dialects. Subclasses supply table naming, the effect list join and the rendering style.
 */
public abstract class SqlQueryBuilder extends QueryBuilder {

    private final SqlStyle style;
    private final SqlRenderer renderer;
    private final List<String> clauses = new ArrayList<>();
    private List<String> selectColumns = List.of();

    protected SqlQueryBuilder(QueryContext context, SqlStyle style) {
        super(context);
        this.style = style;
        this.renderer = new SqlRenderer(style);
    }

    /**
     * Fully qualified reference to one of the study's tables.
     */
    protected abstract String tableName(String table);

    /**
     * Clause exploding {@code sa.effect_gene} into rows aliased {@code eg}.
     */
    protected abstract String effectGeneJoin();

    @Override
    public void buildSelect() {
        List<String> columns = new ArrayList<>(List.of(Columns.SUMMARY_INDEX, Columns.ALLELE_INDEX, Columns.SUMMARY_VARIANT_DATA));
        if (context.shape() == QueryShape.FAMILY) {
            columns.add(Columns.FAMILY_INDEX);
            columns.add(Columns.FAMILY_VARIANT_DATA);
        }
        selectColumns = List.copyOf(columns);
        clauses.add("SELECT " + String.join(", ", selectColumns));
    }

    @Override
    public void buildFrom() {
        TableMetadata metadata = context.metadata();
        StringBuilder from = new StringBuilder("FROM ")
                .append(tableName(metadata.getSummaryTable())).append(" AS ").append(TableMetadata.SUMMARY_ALIAS);
        if (context.shape() == QueryShape.FAMILY) {
            String joinKey = metadata.getJoinKey();
            from.append("\nJOIN ").append(tableName(metadata.getFamilyTable())).append(" AS ").append(TableMetadata.FAMILY_ALIAS)
                    .append(" ON ").append(TableMetadata.SUMMARY_ALIAS).append('.').append(joinKey)
                    .append(" = ").append(TableMetadata.FAMILY_ALIAS).append('.').append(joinKey);
        }
        clauses.add(from.toString());
    }

    @Override
    public void buildJoin(boolean effectJoin) {
        if (effectJoin) {
            clauses.add(effectGeneJoin());
        }
    }

    @Override
    public void buildWhere(List<Expr> conditions) {
        if (conditions.isEmpty()) {
            return;
        }
        clauses.add(conditions.stream()
                .map(this::renderCondition)
                .collect(Collectors.joining(" AND ", "WHERE ", "")));
    }

    private String renderCondition(Expr condition) {
        String rendered = renderer.render(condition);
        if (condition instanceof Expr.And || condition instanceof Expr.Or) {
            return rendered;
        }
        return "(" + rendered + ")";
    }

    @Override
    public void buildGroupBy(boolean distinct) {
        if (distinct) {
            clauses.add("GROUP BY " + String.join(", ", selectColumns));
        }
    }

    @Override
    public void buildLimit(Integer limit) {
        if (limit != null) {
            clauses.add("LIMIT " + limit);
        }
    }

    @Override
    public QueryPayload getResult() {
        String sql = String.join("\n", clauses);
        if (style.parameterized()) {
            return new ParameterizedSql(sql, renderer.parameters());
        }
        return new SqlText(sql);
    }
}

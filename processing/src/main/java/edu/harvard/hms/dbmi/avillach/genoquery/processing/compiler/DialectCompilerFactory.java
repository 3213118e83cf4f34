package edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler;

import edu.harvard.hms.dbmi.avillach.genoquery.processing.partition.PartitionIndex;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;

/**
 * One compiler per {@link Dialect}, created once and shared. Compilers are stateless, builders are created per query.
 */
public class DialectCompilerFactory {

    private final Map<Dialect, DialectCompiler> compilers = new EnumMap<>(Dialect.class);

    public DialectCompilerFactory(PartitionIndex partitionIndex) {
        QueryDirector director = new QueryDirector(new WhereClauseBuilder());
        FilterValidator validator = new FilterValidator();
        register(Dialect.EMBEDDED, EmbeddedQueryBuilder::new, director, partitionIndex, validator);
        register(Dialect.IMPALA, ImpalaQueryBuilder::new, director, partitionIndex, validator);
        register(Dialect.DUCKDB, DuckDbQueryBuilder::new, director, partitionIndex, validator);
        register(Dialect.BIGQUERY, BigQueryQueryBuilder::new, director, partitionIndex, validator);
    }

    private void register(Dialect dialect, Function<QueryContext, QueryBuilder> builderFactory, QueryDirector director,
                          PartitionIndex partitionIndex, FilterValidator validator) {
        compilers.put(dialect, new DirectedDialectCompiler(dialect, builderFactory, director, partitionIndex, validator));
    }

    public DialectCompiler getCompiler(Dialect dialect) {
        DialectCompiler compiler = compilers.get(dialect);
        if (compiler == null) {
            throw new IllegalArgumentException("No compiler registered for dialect " + dialect);
        }
        return compiler;
    }
}

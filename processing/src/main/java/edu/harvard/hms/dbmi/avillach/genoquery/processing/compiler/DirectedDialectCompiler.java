package edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler;

import edu.harvard.hms.dbmi.avillach.genoquery.data.query.VariantFilter;
import edu.harvard.hms.dbmi.avillach.genoquery.data.storage.TableMetadata;
import edu.harvard.hms.dbmi.avillach.genoquery.exception.QueryCompileException;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.partition.PartitionIndex;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.partition.PartitionSelection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * A {@link DialectCompiler} that validates the filter, selects partitions and lets the {@link QueryDirector} drive a
 * dialect specific {@link QueryBuilder}.
 */
public class DirectedDialectCompiler implements DialectCompiler {

    private static final Logger log = LoggerFactory.getLogger(DirectedDialectCompiler.class);

    private final Dialect dialect;
    private final Function<QueryContext, QueryBuilder> builderFactory;
    private final QueryDirector director;
    private final PartitionIndex partitionIndex;
    private final FilterValidator validator;

    public DirectedDialectCompiler(Dialect dialect, Function<QueryContext, QueryBuilder> builderFactory,
                                   QueryDirector director, PartitionIndex partitionIndex, FilterValidator validator) {
        this.dialect = dialect;
        this.builderFactory = builderFactory;
        this.director = director;
        this.partitionIndex = partitionIndex;
        this.validator = validator;
    }

    @Override
    public Dialect dialect() {
        return dialect;
    }

    @Override
    public CompiledQuery compile(VariantFilter filter, TableMetadata metadata, QueryShape shape) throws QueryCompileException {
        validator.validate(filter, metadata, shape);
        return compileTarget(filter, metadata, shape, partitionIndex.selectPartitions(filter, metadata));
    }

    @Override
    public List<CompiledQuery> compileTargets(VariantFilter filter, TableMetadata metadata, QueryShape shape,
                                              int maxTargets) throws QueryCompileException {
        validator.validate(filter, metadata, shape);
        List<CompiledQuery> queries = new ArrayList<>();
        for (PartitionSelection target : partitionIndex.planTargets(filter, metadata, maxTargets)) {
            queries.add(compileTarget(filter, metadata, shape, target));
        }
        return queries;
    }

    private CompiledQuery compileTarget(VariantFilter filter, TableMetadata metadata, QueryShape shape,
                                        PartitionSelection target) throws QueryCompileException {
        QueryContext context = new QueryContext(filter, metadata, shape, target);
        CompiledQuery query = CompiledQuery.builder()
                .dialect(dialect)
                .shape(shape)
                .target(target)
                .payload(director.construct(builderFactory.apply(context)))
                .requestedLimit(filter.getLimit())
                .build();
        log.debug("Compiled " + dialect + " query for " + metadata.getDb() + ": " + query.describe());
        return query;
    }
}

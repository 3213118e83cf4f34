package edu.harvard.hms.dbmi.avillach.genoquery.processing.service;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import edu.harvard.hms.dbmi.avillach.genoquery.data.genotype.VariantRow;
import edu.harvard.hms.dbmi.avillach.genoquery.data.query.Region;
import edu.harvard.hms.dbmi.avillach.genoquery.data.query.VariantFilter;
import edu.harvard.hms.dbmi.avillach.genoquery.exception.QueryCompileException;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler.CompiledQuery;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler.DialectCompiler;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler.DialectCompilerFactory;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler.QueryShape;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.result.ResultAggregator;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.runner.QueryRunner;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.runner.ResultItem;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.runner.RunnerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Entry point for variant queries over one or more studies. Every study is compiled for its own dialect and split into
 * scan targets; each target gets a runner, and all runners feed one aggregator.
 */
@Service
public class VariantQueryService {

    private static final Logger log = LoggerFactory.getLogger(VariantQueryService.class);

    private final DialectCompilerFactory compilerFactory;
    private final RunnerSettings runnerSettings;

    @Value("${genoquery.result.queue-capacity:1000}")
    private int queueCapacity = 1000;

    @Value("${genoquery.partition.max-targets:1}")
    private int maxTargets = 1;

    @Autowired
    public VariantQueryService(DialectCompilerFactory compilerFactory, RunnerSettings runnerSettings) {
        this.compilerFactory = compilerFactory;
        this.runnerSettings = runnerSettings;
    }

    public VariantQueryService(DialectCompilerFactory compilerFactory, RunnerSettings runnerSettings,
                               int queueCapacity, int maxTargets) {
        this(compilerFactory, runnerSettings);
        this.queueCapacity = queueCapacity;
        this.maxTargets = maxTargets;
    }

    /**
     * Family variants of studies with family tables, summary variants of the others. The returned aggregator is
     * started; the caller must close it.
     */
    public ResultAggregator queryVariants(VariantFilter filter, List<GenotypeStorage> storages) throws QueryCompileException {
        return run(filter, storages, true);
    }

    /**
     * One row per summary allele, even when family constraints were applied to select them.
     */
    public ResultAggregator querySummaryVariants(VariantFilter filter, List<GenotypeStorage> storages) throws QueryCompileException {
        return run(filter, storages, false);
    }

    /**
     * Rows of {@link #queryVariants} as a {@link Flux}. Cancelling the subscription closes the runners.
     */
    public Flux<VariantRow> queryVariantsFlux(VariantFilter filter, List<GenotypeStorage> storages) {
        return Flux.using(
                () -> queryVariants(filter, storages),
                aggregator -> Flux.fromStream(aggregator.stream()),
                ResultAggregator::close
        ).subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Compiles without running anything.
     */
    public List<CompiledQuery> explain(VariantFilter filter, List<GenotypeStorage> storages, boolean familyRows)
            throws QueryCompileException {
        List<CompiledQuery> queries = new ArrayList<>();
        for (GenotypeStorage storage : storages) {
            queries.addAll(compile(filter, storage, familyRows));
        }
        return queries;
    }

    private ResultAggregator run(VariantFilter filter, List<GenotypeStorage> storages, boolean familyRows)
            throws QueryCompileException {
        List<List<CompiledQuery>> compiled = new ArrayList<>();
        for (GenotypeStorage storage : storages) {
            compiled.add(compile(filter, storage, familyRows));
        }

        BlockingQueue<ResultItem> queue = new ArrayBlockingQueue<>(queueCapacity);
        List<QueryRunner> runners = new ArrayList<>();
        for (int i = 0; i < storages.size(); i++) {
            GenotypeStorage storage = storages.get(i);
            ThreadFactory threadFactory = new ThreadFactoryBuilder()
                    .setDaemon(true)
                    .setNameFormat("query-runner-" + storage.getStudyId() + "-%d")
                    .build();
            int target = 0;
            for (CompiledQuery query : compiled.get(i)) {
                String runnerId = storage.getStudyId() + "-" + target++;
                runners.add(new QueryRunner(runnerId, query, storage.getConnectionPool(), storage.getDeserializer(),
                        queue, runnerSettings, threadFactory).adapt(regionFilter(filter)));
            }
        }
        log.info("Querying " + storages.size() + " studies with " + runners.size() + " runners");

        UnaryOperator<VariantRow> rowView = familyRows ? UnaryOperator.identity() : VariantQueryService::summaryView;
        return new ResultAggregator(queue, runners, filter.getLimit(), true, rowView,
                ResultAggregator.DEFAULT_POLL_TIMEOUT_MS).start();
    }

    private List<CompiledQuery> compile(VariantFilter filter, GenotypeStorage storage, boolean familyRows)
            throws QueryCompileException {
        boolean familyTable = storage.getMetadata().hasFamilyTable();
        QueryShape shape = QueryShape.resolve(filter, familyRows && familyTable);
        DialectCompiler compiler = compilerFactory.getCompiler(storage.getDialect());
        return compiler.compileTargets(filter, storage.getMetadata(), shape, maxTargets);
    }

    /**
     * Rows read through overlapping partitions or an extended gene region are re-checked against the exact regions.
     */
    static Predicate<VariantRow> regionFilter(VariantFilter filter) {
        List<Region> regions = filter.getRegions();
        if (regions == null) {
            return row -> true;
        }
        return row -> regions.stream().anyMatch(region -> region.overlaps(row.getChromosome(), row.getPosition(), row.getEndPosition()));
    }

    static VariantRow summaryView(VariantRow row) {
        if (!row.isFamilyVariant()) {
            return row;
        }
        return row.toBuilder().familyId(null).members(null).genotype(null).build();
    }
}

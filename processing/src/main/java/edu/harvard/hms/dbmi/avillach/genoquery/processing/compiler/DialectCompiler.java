package edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler;

import edu.harvard.hms.dbmi.avillach.genoquery.data.query.VariantFilter;
import edu.harvard.hms.dbmi.avillach.genoquery.data.storage.TableMetadata;
import edu.harvard.hms.dbmi.avillach.genoquery.exception.QueryCompileException;

import java.util.List;

/**
 * Compiles filters into queries one backend dialect understands.
 */
public interface DialectCompiler {

    Dialect dialect();

    /**
     * Compiles with the narrowest shape the filter allows.
     */
    default CompiledQuery compile(VariantFilter filter, TableMetadata metadata) throws QueryCompileException {
        return compile(filter, metadata, QueryShape.resolve(filter, false));
    }

    /**
     * Compiles a single query scanning every partition the filter selects.
     */
    CompiledQuery compile(VariantFilter filter, TableMetadata metadata, QueryShape shape) throws QueryCompileException;

    /**
     * Compiles one query per scan target, at most {@code maxTargets} of them.
     */
    List<CompiledQuery> compileTargets(VariantFilter filter, TableMetadata metadata, QueryShape shape, int maxTargets)
            throws QueryCompileException;
}

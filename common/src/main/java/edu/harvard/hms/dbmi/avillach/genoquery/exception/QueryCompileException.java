package edu.harvard.hms.dbmi.avillach.genoquery.exception;

import com.google.common.base.Joiner;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raised when a filter cannot be translated into an executable query. Nothing has been sent to a backend when this is
 * thrown. Problems are keyed by the filter field that caused them.
 */
public class QueryCompileException extends Exception {

    private static final long serialVersionUID = -4110837268544630171L;

    private final Map<String, List<String>> problems;

    public QueryCompileException(Map<String, List<String>> problems) {
        super(describe(problems));
        this.problems = problems;
    }

    public QueryCompileException(String field, String problem) {
        this(singleProblem(field, problem));
    }

    public Map<String, List<String>> getProblems() {
        return problems;
    }

    private static Map<String, List<String>> singleProblem(String field, String problem) {
        Map<String, List<String>> problems = new LinkedHashMap<>();
        List<String> fieldProblems = new ArrayList<>();
        fieldProblems.add(problem);
        problems.put(field, fieldProblems);
        return problems;
    }

    private static String describe(Map<String, List<String>> problems) {
        return "Unable to compile query: " + Joiner.on("; ").withKeyValueSeparator(" -> ").join(problems);
    }
}

package edu.harvard.hms.dbmi.avillach.genoquery.exception;

/**
 * A failure reported by a storage backend while a query was executing or its rows were being read. Surfaces to the
 * consumer of a result stream at the position where it happened.
 */
public class BackendExecutionException extends RuntimeException {

    private static final long serialVersionUID = 7921655460190132246L;

    private final String runnerId;

    public BackendExecutionException(String runnerId, String message, Throwable cause) {
        super("[" + runnerId + "] " + message, cause);
        this.runnerId = runnerId;
    }

    public BackendExecutionException(String runnerId, String message) {
        this(runnerId, message, null);
    }

    public String getRunnerId() {
        return runnerId;
    }
}

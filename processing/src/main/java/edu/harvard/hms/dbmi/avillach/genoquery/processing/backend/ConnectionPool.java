package edu.harvard.hms.dbmi.avillach.genoquery.processing.backend;

import java.util.concurrent.TimeUnit;

/**
 * Storage-owned source of backend connections. A runner holds at most one connection at a time and closes it to give
 * it back.
 */
public interface ConnectionPool {

    /**
     * @return a connection, or null when none became available within the timeout
     */
    QueryConnection acquire(long timeout, TimeUnit unit) throws InterruptedException;
}

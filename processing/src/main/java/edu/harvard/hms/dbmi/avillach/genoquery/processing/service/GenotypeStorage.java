package edu.harvard.hms.dbmi.avillach.genoquery.processing.service;

import edu.harvard.hms.dbmi.avillach.genoquery.data.storage.TableMetadata;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.backend.ConnectionPool;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler.Dialect;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.deserialize.VariantDeserializer;

/**
 * One study's genotype data as seen by the query service: where it lives, how it is laid out and how to read its rows.
 */
public interface GenotypeStorage {

    String getStudyId();

    Dialect getDialect();

    TableMetadata getMetadata();

    ConnectionPool getConnectionPool();

    VariantDeserializer getDeserializer();
}

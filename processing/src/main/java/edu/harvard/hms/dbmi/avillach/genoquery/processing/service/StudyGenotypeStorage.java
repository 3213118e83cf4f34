package edu.harvard.hms.dbmi.avillach.genoquery.processing.service;

import edu.harvard.hms.dbmi.avillach.genoquery.data.storage.TableMetadata;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.backend.ConnectionPool;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler.Dialect;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.deserialize.VariantDeserializer;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class StudyGenotypeStorage implements GenotypeStorage {

    @NonNull
    String studyId;
    @NonNull
    Dialect dialect;
    @NonNull
    TableMetadata metadata;
    @NonNull
    ConnectionPool connectionPool;
    @NonNull
    VariantDeserializer deserializer;
}

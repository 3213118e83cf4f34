package edu.harvard.hms.dbmi.avillach.genoquery.data.storage;

public enum ColumnType {
    INT,
    FLOAT,
    STRING,
    STRING_LIST,
    STRUCT_LIST,
    BLOB;

    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }
}

package com.modelchain.deployer.schema;

/**
 * Thrown when a contract derivation would silently replace an inherited field
 * and the caller asked for that to be rejected ({@link Contract#extendStrict}).
 */
public class SchemaConflictException extends RuntimeException {

    private final String contractName;
    private final String fieldName;

    public SchemaConflictException(String contractName, String fieldName) {
        super("Contract '" + contractName + "' already declares field '" + fieldName + "'");
        this.contractName = contractName;
        this.fieldName    = fieldName;
    }

    public String getContractName() { return contractName; }
    public String getFieldName()    { return fieldName; }
}

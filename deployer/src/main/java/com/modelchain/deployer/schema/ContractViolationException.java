package com.modelchain.deployer.schema;

/**
 * Thrown when values do not satisfy a contract: a required field is missing,
 * a value has the wrong type, or a JSON body cannot be read.
 */
public class ContractViolationException extends RuntimeException {

    public ContractViolationException(String contractName, String fieldName, String problem) {
        super("Contract '" + contractName + "', field '" + fieldName + "': " + problem);
    }

    public ContractViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}

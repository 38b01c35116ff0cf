package io.tradeload.error;

public class DuplicateEntityException extends PipelineException {
    private final String entityName;

    public DuplicateEntityException(String entityName) {
        super("Entity '" + entityName + "' is already registered");
        this.entityName = entityName;
    }

    public String entityName() { return entityName; }
}

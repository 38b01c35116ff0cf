package io.tradeload.error;

public class UnknownEntityException extends PipelineException {
    private final String entityName;

    public UnknownEntityException(String entityName, java.util.Collection<String> known) {
        super("Entity '" + entityName + "' not registered. Available: " + known);
        this.entityName = entityName;
    }

    public String entityName() { return entityName; }
}

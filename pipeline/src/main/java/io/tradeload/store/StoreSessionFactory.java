package io.tradeload.store;

/** Opens the store session that the orchestrator holds for one run. */
@FunctionalInterface
public interface StoreSessionFactory {
    StoreSession open();
}

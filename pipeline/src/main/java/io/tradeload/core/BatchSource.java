package io.tradeload.core;

import io.tradeload.registry.EntityDescriptor;

import java.io.Closeable;

/**
 * Extraction collaborator. Supplies, per entity type and per run, a batch already parsed from its
 * source format with columns named exactly as the descriptor's columns.
 */
public interface BatchSource extends Closeable {
    Batch extract(EntityDescriptor entity) throws Exception;

    @Override
    default void close() {}
}

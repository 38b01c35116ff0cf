package io.tradeload.runtime;

/** Runs once after a successful pipeline run, for reporting. Failures here never fail the run. */
@FunctionalInterface
public interface PostLoadHook {
    void afterLoad(PipelineRunResult result) throws Exception;
}

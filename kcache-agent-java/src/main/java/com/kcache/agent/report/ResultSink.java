package com.kcache.agent.report;

/** Host-provided consumer of enumerated rows. */
@FunctionalInterface
public interface ResultSink {

    void accept(OperationStats row);
}

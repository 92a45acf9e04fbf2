package org.neuralchilli.stepgraph.worker;

import org.neuralchilli.stepgraph.spi.ComputeResult;
import org.neuralchilli.stepgraph.spi.StepInvocation;

/**
 * The body of one op, as registered with {@link OpRegistryCompute}.
 */
@FunctionalInterface
public interface OpCompute {

    ComputeResult compute(StepInvocation invocation) throws Exception;
}

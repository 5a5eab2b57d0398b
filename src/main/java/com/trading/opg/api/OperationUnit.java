package com.trading.opg.api;

/**
 * Executable body of an operation kind.
 *
 * <p>
 * Implementations must be stateless (or confine their state to a single
 * call): the executor invokes the same unit concurrently for different nodes
 * and again on retry. Any exception fails the attempt.
 */
@FunctionalInterface
public interface OperationUnit {

    /**
     * Runs the operation.
     *
     * @param parameters the node's parameters, already checked for presence of
     *                   the required names
     * @param frame      input columns plus the outputs of completed predecessors
     * @return the output series, published under the node's id
     * @throws Exception if the operation cannot produce a result
     */
    double[] execute(Parameters parameters, ColumnFrame frame) throws Exception;
}

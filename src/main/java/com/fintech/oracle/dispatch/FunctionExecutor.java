package com.fintech.oracle.dispatch;

import java.util.Map;

/**
 * Runs a user function. Implementations may block; callers are dispatch workers.
 */
public interface FunctionExecutor {

    /**
     * @return the function's result, possibly null
     * @throws RuntimeException if the execution fails
     */
    Object execute(String functionId, Map<String, Object> parameters);
}

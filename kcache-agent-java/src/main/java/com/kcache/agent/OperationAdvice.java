package com.kcache.agent;

import net.bytebuddy.asm.Advice;

/**
 * ByteBuddy Advice bracketing every instrumented method as one monitored operation.
 *
 * Symbol format: fully.qualified.Type.method(param.Types)
 *
 * A method that exits by throwing is treated as an aborted operation: its sample is discarded.
 */
public class OperationAdvice {

    /** Returns the entry timestamp, the host's own measure of the operation's duration. */
    @Advice.OnMethodEnter
    public static long onEnter() {
        AgentBootstrap.operationStart();
        return System.nanoTime();
    }

    @Advice.OnMethodExit(onThrowable = Throwable.class)
    public static void onExit(
            @Advice.Enter long startNanos,
            @Advice.Origin("#t.#m#s") String symbol,
            @Advice.Thrown(readOnly = true) Throwable thrown) {

        if (thrown != null) {
            AgentBootstrap.operationAbort();
            return;
        }
        AgentBootstrap.operationEnd(symbol, System.nanoTime() - startNanos);
    }
}

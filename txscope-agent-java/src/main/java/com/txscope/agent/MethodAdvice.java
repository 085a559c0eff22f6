package com.txscope.agent;

import com.txscope.core.ScopeFrame;
import net.bytebuddy.asm.Advice;

import java.lang.reflect.Method;

/**
 * ByteBuddy advice for traced methods. Each call becomes a scope named
 * {@code Custom/<SimpleClassName>/<method>} and is recorded against the enclosing transaction,
 * or unscoped when no transaction is running.
 */
public class MethodAdvice {

    @Advice.OnMethodEnter
    public static ScopeFrame onEnter(@Advice.Origin Method method) {
        return AgentRuntime.enterMethod(method);
    }

    // Also runs on exceptional exit.
    @Advice.OnMethodExit(onThrowable = Throwable.class)
    public static void onExit(@Advice.Enter ScopeFrame frame, @Advice.Origin Method method) {
        AgentRuntime.exitMethod(frame, method);
    }
}

package com.txscope.agent;

import com.txscope.core.ScopeFrame;
import net.bytebuddy.asm.Advice;

import java.lang.reflect.Method;

/**
 * ByteBuddy advice for transaction entry points. The method's call opens a transaction, and
 * every traced method it reaches is scoped to {@code OtherTransaction/<SimpleClassName>/<method>}
 * once it returns.
 */
public class EntryPointAdvice {

    @Advice.OnMethodEnter
    public static ScopeFrame onEnter(@Advice.Origin Method method) {
        return AgentRuntime.enterTransaction(method);
    }

    @Advice.OnMethodExit(onThrowable = Throwable.class)
    public static void onExit(@Advice.Enter ScopeFrame root, @Advice.Origin Method method) {
        AgentRuntime.exitTransaction(root, method);
    }
}

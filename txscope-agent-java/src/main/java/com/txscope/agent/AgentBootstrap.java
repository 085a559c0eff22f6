package com.txscope.agent;

import com.txscope.core.NoopTransactions;
import com.txscope.core.StatsEngine;
import com.txscope.core.TracerConfig;
import com.txscope.core.TransactionSampler;
import com.txscope.core.Transactions;
import net.bytebuddy.agent.builder.AgentBuilder;
import net.bytebuddy.asm.Advice;
import net.bytebuddy.description.method.MethodDescription;
import net.bytebuddy.description.type.TypeDescription;
import net.bytebuddy.matcher.ElementMatcher;
import net.bytebuddy.utility.JavaModule;

import java.lang.instrument.Instrumentation;
import java.util.ArrayList;
import java.util.List;

import static net.bytebuddy.matcher.ElementMatchers.*;

/**
 * Java Agent entry point.
 * Attached to the target application JVM via:
 *   java -javaagent:txscope-agent-java.jar=namespace=com.myapp,entry_points=com.myapp.Jobs#run -jar app.jar
 *
 * Agent args (key=value pairs separated by comma):
 *   namespace                 : class name prefix whose methods are traced (default: "com.")
 *   entry_points              : ';'-separated Class#method list; each call is a transaction
 *   enabled                   : "false" installs the no-op variant and skips instrumentation
 *   transaction_tracer.enabled: notify the transaction sampler of scope events (default: true)
 *   developer_mode            : also notifies the sampler (default: false)
 *   report                    : print harvested metrics on shutdown (default: true)
 */
public class AgentBootstrap {

    public static void premain(String agentArgs, Instrumentation instrumentation) {
        // Allow ByteBuddy to process class file versions newer than it officially supports.
        System.setProperty("net.bytebuddy.experimental", "true");

        AgentConfig config = parseArgs(agentArgs);
        System.err.println("[txscope-agent] enabled=" + config.enabled()
            + " namespace=" + config.namespace() + " entry_points=" + config.entryPoints());

        Transactions transactions = createTransactions(config);
        AgentRuntime.install(transactions);
        if (!config.enabled()) {
            System.err.println("[txscope-agent] tracing disabled, no instrumentation installed");
            return;
        }
        System.err.println("[txscope-agent] transaction_tracer.enabled=" + config.transactionTracerEnabled()
            + " developer_mode=" + config.developerMode());

        if (config.report() && transactions instanceof StatsEngine engine) {
            Runtime.getRuntime().addShutdownHook(new Thread(new ShutdownHook(engine.getStore())));
        }

        new AgentBuilder.Default()
            .with(new AgentBuilder.Listener.Adapter() {
                @Override
                public void onError(String typeName, ClassLoader classLoader,
                                    JavaModule module, boolean loaded, Throwable throwable) {
                    System.err.println("[txscope-agent] TRANSFORM ERROR for " + typeName
                        + ": " + throwable);
                }
            })
            // The agent and core must never trace themselves.
            .type(
                nameStartsWith(config.namespace()).or(namedOneOf(config.entryPointTypes()))
                    .and(not(nameStartsWith("com.txscope.")))
                    .and(not(nameContains("$$EnhancerBySpring")))
                    .and(not(nameContains("$Proxy")))
                    .and(not(nameContains("CGLIB")))
                    .and(not(nameContains("$$Lambda")))
            )
            .transform((builder, typeDescription, classLoader, module, protectionDomain) -> {
                ElementMatcher.Junction<MethodDescription> entryPoints = entryPointMethods(config, typeDescription);
                builder = builder.visit(Advice.to(EntryPointAdvice.class).on(entryPoints));
                if (typeDescription.getName().startsWith(config.namespace())) {
                    builder = builder.visit(Advice.to(MethodAdvice.class).on(tracedMethods().and(not(entryPoints))));
                }
                return builder;
            })
            .installOn(instrumentation);

        System.err.println("[txscope-agent] instrumentation installed");
    }

    /** Called when agent is loaded after JVM startup (dynamic attach). */
    public static void agentmain(String agentArgs, Instrumentation instrumentation) {
        premain(agentArgs, instrumentation);
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    static Transactions createTransactions(AgentConfig config) {
        if (!config.enabled()) return NoopTransactions.INSTANCE;
        return new StatsEngine(config.tracerConfig(), TransactionSampler.NONE);
    }

    static ElementMatcher.Junction<MethodDescription> tracedMethods() {
        return isMethod()
            .and(not(isConstructor()))
            .and(not(isAbstract()))
            .and(not(isNative()))
            .and(not(isSynthetic()));
    }

    static ElementMatcher.Junction<MethodDescription> entryPointMethods(AgentConfig config, TypeDescription type) {
        List<String> methods = new ArrayList<>();
        for (String entryPoint : config.entryPoints()) {
            int hash = entryPoint.indexOf('#');
            if (hash > 0 && entryPoint.substring(0, hash).equals(type.getName())) {
                methods.add(entryPoint.substring(hash + 1));
            }
        }
        if (methods.isEmpty()) return none();
        return tracedMethods().and(namedOneOf(methods.toArray(new String[0])));
    }

    static AgentConfig parseArgs(String agentArgs) {
        String namespace = "com.";
        List<String> entryPoints = new ArrayList<>();
        boolean enabled = true;
        boolean transactionTracerEnabled = true;
        boolean developerMode = false;
        boolean report = true;

        if (agentArgs != null && !agentArgs.isBlank()) {
            for (String part : agentArgs.split(",")) {
                String[] kv = part.split("=", 2);
                if (kv.length == 2) {
                    String value = kv[1].trim();
                    switch (kv[0].trim()) {
                        case "namespace"                  -> namespace                = value;
                        case "enabled"                    -> enabled                  = !"false".equalsIgnoreCase(value);
                        case "transaction_tracer.enabled" -> transactionTracerEnabled = !"false".equalsIgnoreCase(value);
                        case "developer_mode"             -> developerMode            = "true".equalsIgnoreCase(value);
                        case "report"                     -> report                   = !"false".equalsIgnoreCase(value);
                        case "entry_points"               -> {
                            for (String ep : value.split(";")) {
                                if (ep.trim().indexOf('#') > 0) entryPoints.add(ep.trim());
                                else if (!ep.isBlank()) {
                                    System.err.println("[txscope-agent] WARNING: ignoring entry point without '#': " + ep.trim());
                                }
                            }
                        }
                        default -> System.err.println("[txscope-agent] WARNING: unknown agent arg: " + kv[0].trim());
                    }
                }
            }
        }
        return new AgentConfig(namespace, List.copyOf(entryPoints), enabled,
            transactionTracerEnabled, developerMode, report);
    }

    record AgentConfig(
        String namespace,
        List<String> entryPoints,
        boolean enabled,
        boolean transactionTracerEnabled,
        boolean developerMode,
        boolean report
    ) {
        TracerConfig tracerConfig() {
            return new TracerConfig(transactionTracerEnabled, developerMode);
        }

        String[] entryPointTypes() {
            return entryPoints.stream()
                .map(ep -> ep.substring(0, ep.indexOf('#')))
                .distinct()
                .toArray(String[]::new);
        }
    }
}

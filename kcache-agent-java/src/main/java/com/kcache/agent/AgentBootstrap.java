package com.kcache.agent;

import com.kcache.agent.persist.PersistenceManager;
import com.kcache.agent.report.JsonReportWriter;
import com.kcache.agent.sampler.ResourceProbe;
import com.kcache.agent.sampler.ResourceProbes;
import com.kcache.agent.sampler.ResourceSampler;
import com.kcache.agent.sampler.TickDetector;
import net.bytebuddy.agent.builder.AgentBuilder;
import net.bytebuddy.asm.Advice;
import net.bytebuddy.description.type.TypeDescription;
import net.bytebuddy.matcher.ElementMatcher;
import net.bytebuddy.matcher.ElementMatchers;
import net.bytebuddy.utility.JavaModule;

import java.lang.instrument.Instrumentation;
import java.nio.file.Path;
import java.nio.file.Paths;

import static net.bytebuddy.matcher.ElementMatchers.*;

/**
 * Java Agent entry point.
 * Attached to the host JVM at startup via:
 *   java -javaagent:kcache-agent-java.jar=dir=/var/lib/app,namespace=com.myapp,max=5000 -jar app.jar
 *
 * Agent args (key=value pairs separated by comma):
 *   dir       : directory of kcache.stat and kcache_report.json (default: java.io.tmpdir)
 *   namespace : class name prefix to instrument, e.g. "com.company" (default: "com.")
 *   max       : maximum number of tracked identities (default: 5000)
 *   track     : "top", "all" or "none" nesting levels to record (default: top)
 *   linux_hz  : CPU accounting tick rate; -1 detects it at startup (default: -1)
 *   save      : "true"/"false", keep statistics across restarts (default: true)
 *   report    : "true"/"false", write kcache_report.json on shutdown (default: false)
 */
public class AgentBootstrap {

    /** Service reached by OperationAdvice (set during premain). */
    public static volatile KcacheService service;

    static final SymbolRegistry symbols = new SymbolRegistry();

    public static void premain(String agentArgs, Instrumentation instrumentation) {
        // Allow ByteBuddy to process Java versions beyond its officially supported range.
        System.setProperty("net.bytebuddy.experimental", "true");

        AgentConfig config = parseArgs(agentArgs);
        System.err.println("[kcache-agent] attaching to namespace: " + config.namespace());
        System.err.println("[kcache-agent] dir: " + config.dir());
        System.err.println("[kcache-agent] max=" + config.max() + " track=" + config.track()
            + " linux_hz=" + config.linuxHz() + " save=" + config.save() + " report=" + config.report());

        // Table allocated and previous statistics restored before any class is instrumented
        KcacheService s = createService(config);
        s.init(config.max());
        service = s;

        Path reportPath = config.report() ? Paths.get(config.dir(), JsonReportWriter.FILE_NAME) : null;
        Runtime.getRuntime().addShutdownHook(new Thread(new ShutdownHook(s, symbols, reportPath)));

        new AgentBuilder.Default()
            .with(new AgentBuilder.Listener.Adapter() {
                @Override
                public void onError(String typeName, ClassLoader classLoader,
                                    JavaModule module, boolean loaded, Throwable throwable) {
                    System.err.println("[kcache-agent] TRANSFORM ERROR for " + typeName
                        + ": " + throwable);
                }
            })
            .type(instrumentedTypes(config.namespace()))
            .transform((builder, typeDescription, classLoader, module, protectionDomain) ->
                builder.method(
                    isMethod()
                        .and(not(isConstructor()))
                        .and(not(isAbstract()))
                        .and(not(isNative()))
                        .and(not(isSynthetic()))
                )
                .intercept(Advice.to(OperationAdvice.class))
            )
            .installOn(instrumentation);

        System.err.println("[kcache-agent] instrumentation installed");
    }

    /**
     * Dynamic attach is refused: statistics must be restored before the first observation and the
     * capacity must be fixed at startup.
     */
    public static void agentmain(String agentArgs, Instrumentation instrumentation) {
        throw new KcacheService.ConfigurationException(
            "kcache-agent can only be loaded at JVM startup; add -javaagent:kcache-agent-java.jar to the command line");
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    /**
     * Host classes in {@code namespace}. Never the agent itself, the libraries it bundles
     * (the report writer's Gson would otherwise be measured on the shutdown thread),
     * proxies or generated classes.
     */
    static ElementMatcher.Junction<TypeDescription> instrumentedTypes(String namespace) {
        return ElementMatchers.<TypeDescription>nameStartsWith(namespace)
            .and(not(nameStartsWith("com.kcache.agent")))
            .and(not(nameStartsWith("com.google.gson")))
            .and(not(nameStartsWith("net.bytebuddy")))
            .and(not(nameContains("$$EnhancerBySpring")))
            .and(not(nameContains("$Proxy")))
            .and(not(nameContains("CGLIB")))
            .and(not(nameContains("$$Lambda")));
    }

    static KcacheService createService(AgentConfig config) {
        ResourceProbe probe = ResourceProbes.detect();
        int hz = config.linuxHz() > 0 ? config.linuxHz() : TickDetector.detectHz(probe);
        return new KcacheService(
            new ResourceSampler(probe, hz),
            config.track(),
            new PersistenceManager(Paths.get(config.dir())),
            config.save()
        );
    }

    static AgentConfig parseArgs(String agentArgs) {
        String dir = System.getProperty("java.io.tmpdir");
        String namespace = "com.";
        int max = 5000;
        TrackLevel track = TrackLevel.TOP;
        int linuxHz = -1;
        boolean save = true;
        boolean report = false;

        if (agentArgs != null && !agentArgs.isBlank()) {
            for (String part : agentArgs.split(",")) {
                String[] kv = part.split("=", 2);
                if (kv.length == 2) {
                    switch (kv[0].trim()) {
                        case "dir"       -> dir       = kv[1].trim();
                        case "namespace" -> namespace = kv[1].trim();
                        case "save"      -> save      = !"false".equalsIgnoreCase(kv[1].trim());
                        case "report"    -> report    = "true".equalsIgnoreCase(kv[1].trim());
                        case "track"     -> {
                            TrackLevel parsed = TrackLevel.parse(kv[1]);
                            if (parsed != null) {
                                track = parsed;
                            } else {
                                System.err.println("[kcache-agent] WARNING: ignoring track=" + kv[1].trim()
                                    + ", using " + track);
                            }
                        }
                        case "max"       -> {
                            try {
                                max = Integer.parseInt(kv[1].trim());
                            } catch (NumberFormatException e) {
                                System.err.println("[kcache-agent] WARNING: ignoring max=" + kv[1].trim()
                                    + ", using " + max);
                            }
                        }
                        case "linux_hz"  -> {
                            try {
                                linuxHz = Integer.parseInt(kv[1].trim());
                            } catch (NumberFormatException e) {
                                System.err.println("[kcache-agent] WARNING: ignoring linux_hz=" + kv[1].trim()
                                    + ", detecting the tick rate");
                            }
                        }
                    }
                }
            }
        }
        return new AgentConfig(dir, namespace, max, track, linuxHz, save, report);
    }

    // -----------------------------------------------------------------------
    // Public static hooks for OperationAdvice. Inlined bytecode must only
    // reference public members: instrumented classes live in other packages
    // and class loaders.
    // -----------------------------------------------------------------------

    public static void operationStart() {
        KcacheService s = service;
        if (s != null) s.onOperationStart();
    }

    public static void operationEnd(String symbol, long elapsedNanos) {
        KcacheService s = service;
        if (s == null) return;
        s.onOperationEnd(HostContext.identityFor(symbols.register(symbol)), elapsedNanos / 1_000_000_000.0);
    }

    public static void operationAbort() {
        KcacheService s = service;
        if (s != null) s.onOperationAbort();
    }

    record AgentConfig(
        String dir,
        String namespace,
        int max,
        TrackLevel track,
        int linuxHz,
        boolean save,
        boolean report
    ) {}
}

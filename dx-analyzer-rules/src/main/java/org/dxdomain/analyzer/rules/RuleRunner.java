package org.dxdomain.analyzer.rules;

import org.dxdomain.analyzer.common.AnalyzerException;
import org.dxdomain.analyzer.common.TimedLogger;
import org.dxdomain.analyzer.common.cfg.MethodInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/*
Runs a fixed list of rules over many methods. The flow graph of a method is computed once and shared
between the rules, through the caching engine in AnalyzerServices.
 */
public class RuleRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(RuleRunner.class);
    private static final TimedLogger TIMED_LOGGER = new TimedLogger(LOGGER, 1000);

    private final List<Rule> rules;
    private final AnalyzerServices services;
    private final Options options;

    public record Options(boolean parallel, boolean storeErrors) {
        public static class Builder {
            private boolean parallel;
            private boolean storeErrors;

            public Builder setParallel(boolean parallel) {
                this.parallel = parallel;
                return this;
            }

            public Builder setStoreErrors(boolean storeErrors) {
                this.storeErrors = storeErrors;
                return this;
            }

            public Options build() {
                return new Options(parallel, storeErrors);
            }
        }
    }

    public record Output(List<Finding> findings, List<AnalyzerException> analyzerExceptions) {
    }

    private record MethodOutput(List<Finding> findings, AnalyzerException exception) {
    }

    public RuleRunner(List<Rule> rules, AnalyzerServices services) {
        this(rules, services, new Options.Builder().build());
    }

    public RuleRunner(List<Rule> rules, AnalyzerServices services, Options options) {
        this.rules = List.copyOf(rules);
        this.services = services;
        this.options = options;
    }

    public Output run(List<MethodInfo> methods) {
        AtomicInteger count = new AtomicInteger();
        int total = methods.size();
        LOGGER.info("Running {} rules on {} methods", rules.size(), total);
        Stream<MethodInfo> stream = options.parallel ? methods.parallelStream() : methods.stream();
        List<MethodOutput> outputs = stream.map(methodInfo -> {
            MethodOutput output = runOne(methodInfo);
            TIMED_LOGGER.info("Done {} of {} methods", count.incrementAndGet(), total);
            return output;
        }).toList();

        List<Finding> findings = new ArrayList<>();
        List<AnalyzerException> exceptions = new ArrayList<>();
        for (MethodOutput output : outputs) {
            findings.addAll(output.findings);
            if (output.exception != null) exceptions.add(output.exception);
        }
        LOGGER.info("Done: {} findings, {} exceptions", findings.size(), exceptions.size());
        return new Output(List.copyOf(findings), List.copyOf(exceptions));
    }

    private MethodOutput runOne(MethodInfo methodInfo) {
        List<Finding> findings = new ArrayList<>();
        try {
            for (Rule rule : rules) {
                findings.addAll(rule.check(methodInfo, services));
            }
            return new MethodOutput(findings, null);
        } catch (CancellationException ce) {
            throw ce;
        } catch (RuntimeException re) {
            LOGGER.error("Caught exception running rules on {}", methodInfo, re);
            if (options.storeErrors) {
                AnalyzerException ae = re instanceof AnalyzerException analyzerException ? analyzerException
                        : new AnalyzerException(methodInfo.methodRef(), re);
                return new MethodOutput(findings, ae);
            }
            throw re;
        }
    }
}

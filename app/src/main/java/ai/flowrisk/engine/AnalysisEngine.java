package ai.flowrisk.engine;

import ai.flowrisk.analyzer.FunctionNode;
import ai.flowrisk.analyzer.SourceContent;
import ai.flowrisk.analyzer.SourceFile;
import ai.flowrisk.cfg.CfgBuildException;
import ai.flowrisk.cfg.CfgBuilder;
import ai.flowrisk.config.AnalysisConfig;
import ai.flowrisk.discover.FunctionDiscovery;
import ai.flowrisk.discover.TreeSitterFunctionDiscovery;
import ai.flowrisk.metrics.MetricExtractor;
import ai.flowrisk.parse.ParseFailureException;
import ai.flowrisk.parse.ParsedTree;
import ai.flowrisk.parse.SourceParser;
import ai.flowrisk.parse.SyntaxTreeCache;
import ai.flowrisk.parse.TreeSitterSourceParser;
import ai.flowrisk.profile.LanguageProfiles;
import ai.flowrisk.risk.RiskScorer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Runs parse, discovery, flow graph build, metric extraction and scoring over a set of files.
 *
 * <p>Files are parsed once each through a {@link SyntaxTreeCache} scoped to the call. Function builds are independent
 * and run on a fixed pool of {@link AnalysisConfig#workerThreads()} threads. Without a timeout, a single worker runs
 * them inline on the calling thread. A build that exceeds {@link AnalysisConfig#buildTimeoutMillis()} is interrupted and reported as a
 * {@link FailureKind#TIMEOUT} failure. Results never depend on completion order.
 */
public class AnalysisEngine {
    private static final Logger logger = LogManager.getLogger(AnalysisEngine.class);

    private static final Comparator<FunctionReport> REPORT_ORDER = Comparator.comparing(FunctionReport::path)
            .thenComparingInt(r -> r.span().startByte());
    private static final Comparator<FunctionFailure> FAILURE_ORDER =
            Comparator.comparing(FunctionFailure::path).thenComparingInt(FunctionFailure::line);

    private final AnalysisConfig config;
    private final FunctionDiscovery discovery;
    private final SourceParser parser;

    public AnalysisEngine(AnalysisConfig config, FunctionDiscovery discovery, SourceParser parser) {
        this.config = config;
        this.discovery = discovery;
        this.parser = parser;
    }

    public AnalysisEngine(AnalysisConfig config) {
        this(config, new TreeSitterFunctionDiscovery(), new TreeSitterSourceParser());
    }

    public AnalysisEngine() {
        this(AnalysisConfig.defaults());
    }

    public AnalysisConfig config() {
        return config;
    }

    /** One function queued for analysis, with the tree it belongs to. */
    private record Task(Path path, FunctionNode function, ParsedTree tree) {}

    /** Exactly one of the two fields is set. */
    private record Outcome(@Nullable FunctionReport report, @Nullable FunctionFailure failure) {}

    /**
     * Analyzes {@code files}. Per-file and per-function problems are collected into the report; this method only fails
     * when the calling thread is interrupted.
     */
    public AnalysisReport analyze(List<SourceFile> files) throws InterruptedException {
        var reports = new ArrayList<FunctionReport>();
        var failures = new ArrayList<FunctionFailure>();
        var tasks = new ArrayList<Task>();

        try (var cache = new SyntaxTreeCache(parser)) {
            for (int fileIndex = 0; fileIndex < files.size(); fileIndex++) {
                var file = files.get(fileIndex);
                ParsedTree tree;
                try {
                    tree = cache.getOrParse(file.language(), SourceContent.of(file.text()));
                } catch (ParseFailureException e) {
                    logger.warn("Skipping {} file {}: {}", file.language(), file.path(), e.getMessage());
                    failures.add(new FunctionFailure(file.path(), null, 0, FailureKind.PARSE_FAILURE, e.getMessage()));
                    continue;
                }
                for (var function : discovery.discover(fileIndex, tree)) {
                    tasks.add(new Task(file.path(), function, tree));
                }
            }

            for (var outcome : run(tasks)) {
                if (outcome.report() != null) {
                    reports.add(outcome.report());
                } else if (outcome.failure() != null) {
                    failures.add(outcome.failure());
                }
            }
            logger.debug(
                    "Analyzed {} files: {} functions, {} failures, cache {}",
                    files.size(),
                    reports.size(),
                    failures.size(),
                    cache.stats());
        }

        reports.sort(REPORT_ORDER);
        failures.sort(FAILURE_ORDER);
        return new AnalysisReport(reports, failures);
    }

    private List<Outcome> run(List<Task> tasks) throws InterruptedException {
        var outcomes = new ArrayList<Outcome>(tasks.size());
        if (tasks.isEmpty()) {
            return outcomes;
        }
        // inline only when nothing has to be interrupted
        if (config.buildTimeoutMillis() == 0 && (config.workerThreads() == 1 || tasks.size() == 1)) {
            for (var task : tasks) {
                outcomes.add(analyzeFunction(task));
            }
            return outcomes;
        }

        var executor = newPool(Math.min(config.workerThreads(), tasks.size()));
        try {
            var futures = new ArrayList<Future<Outcome>>(tasks.size());
            for (var task : tasks) {
                futures.add(executor.submit(() -> analyzeFunction(task)));
            }
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(futures.get(i), tasks.get(i)));
            }
        } finally {
            executor.shutdownNow();
        }
        return outcomes;
    }

    private Outcome await(Future<Outcome> future, Task task) throws InterruptedException {
        try {
            if (config.buildTimeoutMillis() == 0) {
                return future.get();
            }
            return future.get(config.buildTimeoutMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | CancellationException e) {
            future.cancel(true);
            var function = task.function();
            logger.warn(
                    "Build of {} {} in {} at lines {}-{} timed out after {} ms",
                    function.language(),
                    function.displayName(),
                    task.path(),
                    function.span().startLine(),
                    function.span().endLine(),
                    config.buildTimeoutMillis());
            return failure(
                    task, FailureKind.TIMEOUT, "build exceeded " + config.buildTimeoutMillis() + " ms");
        } catch (ExecutionException e) {
            var cause = e.getCause() != null ? e.getCause() : e;
            logger.error("Unexpected failure analyzing {} in {}", task.function().displayName(), task.path(), cause);
            return failure(task, FailureKind.INTERNAL_ERROR, String.valueOf(cause.getMessage()));
        }
    }

    private Outcome analyzeFunction(Task task) {
        var function = task.function();
        try {
            var profile = LanguageProfiles.forLanguage(function.language());
            var result = CfgBuilder.build(function, profile, task.tree());
            var metrics = MetricExtractor.extract(function, result);
            var scored = RiskScorer.score(metrics, config.weights(), config.thresholds());
            var report = new FunctionReport(
                    task.path(),
                    function.language(),
                    function.name(),
                    function.span(),
                    metrics,
                    scored.components(),
                    scored.score(),
                    scored.band(),
                    function.suppressionReason(),
                    result.callSites(),
                    result.diagnostics(),
                    config.includeCfg() ? result.cfg() : null);
            return new Outcome(report, null);
        } catch (CfgBuildException e) {
            logger.warn(
                    "Skipping {} function {} in {} at lines {}-{}: {}",
                    function.language(),
                    function.displayName(),
                    task.path(),
                    function.span().startLine(),
                    function.span().endLine(),
                    e.toString());
            int line = e.getLine() > 0 ? e.getLine() : function.span().startLine();
            return new Outcome(
                    null,
                    new FunctionFailure(
                            task.path(), function.displayName(), line, FailureKind.of(e.getKind()), e.getMessage()));
        } catch (RuntimeException e) {
            logger.error("Unexpected failure analyzing {} in {}", function.displayName(), task.path(), e);
            return failure(task, FailureKind.INTERNAL_ERROR, String.valueOf(e.getMessage()));
        }
    }

    private static Outcome failure(Task task, FailureKind kind, String message) {
        var function = task.function();
        return new Outcome(
                null,
                new FunctionFailure(task.path(), function.displayName(), function.span().startLine(), kind, message));
    }

    private static ExecutorService newPool(int threads) {
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            var t = new Thread(r, "flowrisk-build-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}

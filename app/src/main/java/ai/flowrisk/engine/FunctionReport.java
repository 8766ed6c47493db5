package ai.flowrisk.engine;

import ai.flowrisk.analyzer.CallSite;
import ai.flowrisk.analyzer.Language;
import ai.flowrisk.analyzer.RawMetrics;
import ai.flowrisk.analyzer.SourceSpan;
import ai.flowrisk.analyzer.cfg.Cfg;
import ai.flowrisk.cfg.BuildDiagnostic;
import ai.flowrisk.risk.RiskBand;
import ai.flowrisk.risk.RiskComponents;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.nio.file.Path;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Everything known about one analyzed function. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FunctionReport(
        Path path,
        Language language,
        @Nullable String name,
        SourceSpan span,
        RawMetrics metrics,
        RiskComponents components,
        double score,
        RiskBand band,
        @Nullable String suppressionReason,
        List<CallSite> callSites,
        List<BuildDiagnostic> diagnostics,
        @Nullable Cfg cfg) {

    public FunctionReport {
        callSites = List.copyOf(callSites);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isSuppressed() {
        return suppressionReason != null;
    }
}

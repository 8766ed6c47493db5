package ai.flowrisk.engine;

import ai.flowrisk.risk.RiskBand;
import java.util.List;
import java.util.Optional;

/** Result of one run. Both lists are sorted by file path, then position in the file. */
public record AnalysisReport(List<FunctionReport> functions, List<FunctionFailure> failures) {
    public AnalysisReport {
        functions = List.copyOf(functions);
        failures = List.copyOf(failures);
    }

    public Optional<FunctionReport> function(String name) {
        return functions.stream().filter(f -> name.equals(f.name())).findFirst();
    }

    public List<FunctionReport> inBand(RiskBand band) {
        return functions.stream().filter(f -> f.band() == band).toList();
    }
}

package ai.flowrisk.analyzer.cfg;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Comparator;
import org.jetbrains.annotations.Nullable;

/** A directed edge. {@code caseIndex} is present exactly for {@link EdgeKind#CASE_MATCH} edges. */
public record CfgEdge(int from, int to, EdgeKind kind, @JsonInclude(JsonInclude.Include.NON_NULL) @Nullable Integer caseIndex)
        implements Comparable<CfgEdge> {

    private static final Comparator<CfgEdge> ORDER = Comparator.comparingInt(CfgEdge::from)
            .thenComparingInt(CfgEdge::to)
            .thenComparing(CfgEdge::kind)
            .thenComparingInt(e -> e.caseIndex() == null ? -1 : e.caseIndex());

    public CfgEdge {
        if ((kind == EdgeKind.CASE_MATCH) != (caseIndex != null)) {
            throw new IllegalArgumentException("caseIndex must be set exactly for CASE_MATCH edges: " + kind);
        }
    }

    public static CfgEdge of(int from, int to, EdgeKind kind) {
        return new CfgEdge(from, to, kind, null);
    }

    public static CfgEdge caseMatch(int from, int to, int caseIndex) {
        return new CfgEdge(from, to, EdgeKind.CASE_MATCH, caseIndex);
    }

    @Override
    public int compareTo(CfgEdge o) {
        return ORDER.compare(this, o);
    }
}

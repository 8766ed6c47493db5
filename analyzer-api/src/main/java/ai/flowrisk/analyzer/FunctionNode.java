package ai.flowrisk.analyzer;

import org.jetbrains.annotations.Nullable;

/**
 * A function found by discovery. Read-only input to the flow graph builder.
 *
 * @param name the declared name, or null for anonymous functions
 * @param span the whole declaration, used for LOC and reporting
 * @param body the node whose statements form the function body
 * @param suppressionReason null when the function is not suppressed; empty when suppressed without a reason
 */
public record FunctionNode(
        FunctionId id,
        @Nullable String name,
        SourceSpan span,
        BodyHandle body,
        Language language,
        @Nullable String suppressionReason) {

    public boolean isSuppressed() {
        return suppressionReason != null;
    }

    public String displayName() {
        return name != null ? name : "<anonymous>@" + span.startLine();
    }
}

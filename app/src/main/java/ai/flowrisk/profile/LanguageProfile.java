package ai.flowrisk.profile;

import ai.flowrisk.analyzer.Language;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Maps the tree-sitter node types of one language onto {@link ConstructCategory}. The flow graph builder is written
 * once against this table; everything language specific lives in a profile.
 *
 * <p>Profiles are immutable and safe to share between threads. Use {@link #builder(Language)}: every category must be
 * declared either with node types or as not applicable, otherwise {@link Builder#build()} fails.
 */
public final class LanguageProfile {
    private final Language language;
    private final ImmutableSetMultimap<ConstructCategory, String> kinds;
    private final ImmutableMap<String, ConstructCategory> structuralIndex;
    private final ImmutableMap<String, LoopKind> loopKinds;
    private final ImmutableSet<String> logicalOperators;
    private final ImmutableList<String> calleeFields;
    private final @Nullable String receiverField;
    private final ImmutableSet<String> panicCallees;
    private final ImmutableSet<String> caseHeaderFields;
    private final ImmutableSet<String> guardFields;
    private final ImmutableSet<String> defaultLabelTexts;
    private final boolean breakableSwitch;
    private final String lineCommentPrefix;

    private LanguageProfile(Builder b, ImmutableMap<String, ConstructCategory> structuralIndex) {
        this.language = b.language;
        this.kinds = b.kinds.build();
        this.structuralIndex = structuralIndex;
        this.loopKinds = ImmutableMap.copyOf(b.loopKinds);
        this.logicalOperators = ImmutableSet.copyOf(b.logicalOperators);
        this.calleeFields = ImmutableList.copyOf(b.calleeFields);
        this.receiverField = b.receiverField;
        this.panicCallees = ImmutableSet.copyOf(b.panicCallees);
        this.caseHeaderFields = ImmutableSet.copyOf(b.caseHeaderFields);
        this.guardFields = ImmutableSet.copyOf(b.guardFields);
        this.defaultLabelTexts = ImmutableSet.copyOf(b.defaultLabelTexts);
        this.breakableSwitch = b.breakableSwitch;
        this.lineCommentPrefix = b.lineCommentPrefix;
    }

    public static Builder builder(Language language) {
        return new Builder(language);
    }

    public Language language() {
        return language;
    }

    public boolean is(ConstructCategory category, String nodeType) {
        return kinds.containsEntry(category, nodeType);
    }

    public boolean is(ConstructCategory category, TSNode node) {
        return is(category, node.getType());
    }

    public Set<String> kindsOf(ConstructCategory category) {
        return kinds.get(category);
    }

    /** The structural category of a node type, if it has one. */
    public Optional<ConstructCategory> structuralCategory(String nodeType) {
        return Optional.ofNullable(structuralIndex.get(nodeType));
    }

    public Optional<LoopKind> loopKind(String nodeType) {
        return Optional.ofNullable(loopKinds.get(nodeType));
    }

    public boolean isLogicalOperator(String operatorText) {
        return logicalOperators.contains(operatorText);
    }

    /** Fields tried in order to render a call's target. */
    public List<String> calleeFields() {
        return calleeFields;
    }

    /** Field holding the receiver of a method call, rendered in front of the callee when present. */
    public Optional<String> receiverField() {
        return Optional.ofNullable(receiverField);
    }

    public boolean isPanicCallee(String callee) {
        return panicCallees.contains(callee);
    }

    public Set<String> caseHeaderFields() {
        return caseHeaderFields;
    }

    public Set<String> guardFields() {
        return guardFields;
    }

    public boolean isDefaultLabel(String labelText) {
        return defaultLabelTexts.contains(labelText);
    }

    /** Whether an unlabeled break inside a switch/match leaves the switch (true) or the enclosing loop (false). */
    public boolean breakableSwitch() {
        return breakableSwitch;
    }

    public String lineCommentPrefix() {
        return lineCommentPrefix;
    }

    @Override
    public String toString() {
        return "LanguageProfile[" + language + ", " + kinds.size() + " kinds]";
    }

    public static final class Builder {
        private final Language language;
        private final ImmutableSetMultimap.Builder<ConstructCategory, String> kinds = ImmutableSetMultimap.builder();
        private final Set<ConstructCategory> declared = EnumSet.noneOf(ConstructCategory.class);
        private final Set<ConstructCategory> notApplicable = EnumSet.noneOf(ConstructCategory.class);
        private final Map<String, LoopKind> loopKinds = new LinkedHashMap<>();
        private final List<String> problems = new ArrayList<>();
        private Set<String> logicalOperators = Set.of();
        private List<String> calleeFields = List.of();
        private @Nullable String receiverField;
        private Set<String> panicCallees = Set.of();
        private Set<String> caseHeaderFields = Set.of();
        private Set<String> guardFields = Set.of();
        private Set<String> defaultLabelTexts = Set.of();
        private boolean breakableSwitch = true;
        private @Nullable String lineCommentPrefix;

        private Builder(Language language) {
            this.language = language;
        }

        public Builder kinds(ConstructCategory category, String... nodeTypes) {
            if (category == ConstructCategory.LOOP) {
                problems.add("LOOP kinds must be declared through loop(LoopKind, ...)");
                return this;
            }
            if (nodeTypes.length == 0) {
                problems.add(category + " declared with no node types; use notApplicable");
            }
            declared.add(category);
            kinds.putAll(category, nodeTypes);
            return this;
        }

        public Builder loop(LoopKind loopKind, String... nodeTypes) {
            declared.add(ConstructCategory.LOOP);
            for (var type : nodeTypes) {
                if (loopKinds.put(type, loopKind) != null) {
                    problems.add("loop type " + type + " declared twice");
                }
                kinds.put(ConstructCategory.LOOP, type);
            }
            return this;
        }

        public Builder notApplicable(ConstructCategory... categories) {
            notApplicable.addAll(List.of(categories));
            return this;
        }

        public Builder logicalOperators(String... operators) {
            this.logicalOperators = Set.of(operators);
            return this;
        }

        public Builder calleeFields(String... fields) {
            this.calleeFields = List.of(fields);
            return this;
        }

        public Builder receiverField(String field) {
            this.receiverField = field;
            return this;
        }

        public Builder panicCallees(String... callees) {
            this.panicCallees = Set.of(callees);
            return this;
        }

        public Builder caseHeaderFields(String... fields) {
            this.caseHeaderFields = Set.of(fields);
            return this;
        }

        public Builder guardFields(String... fields) {
            this.guardFields = Set.of(fields);
            return this;
        }

        public Builder defaultLabelTexts(String... texts) {
            this.defaultLabelTexts = Set.of(texts);
            return this;
        }

        public Builder breakableSwitch(boolean breakableSwitch) {
            this.breakableSwitch = breakableSwitch;
            return this;
        }

        public Builder lineCommentPrefix(String prefix) {
            this.lineCommentPrefix = prefix;
            return this;
        }

        /**
         * Validates and freezes the table.
         *
         * @throws ProfileConfigurationException when a category is undeclared or declared both ways, when a node type
         *     falls into two structural categories, or when required attributes are missing
         */
        public LanguageProfile build() {
            var errors = new ArrayList<>(problems);
            for (var category : ConstructCategory.values()) {
                boolean hasKinds = declared.contains(category);
                boolean isNa = notApplicable.contains(category);
                if (!hasKinds && !isNa) {
                    errors.add(category + " is not declared");
                } else if (hasKinds && isNa) {
                    errors.add(category + " is declared with kinds and as not applicable");
                }
            }
            var built = kinds.build();
            var structural = new HashMap<String, ConstructCategory>();
            for (var entry : built.entries()) {
                if (!entry.getKey().isStructural()) {
                    continue;
                }
                var previous = structural.putIfAbsent(entry.getValue(), entry.getKey());
                if (previous != null && previous != entry.getKey()) {
                    errors.add("node type %s is in both %s and %s".formatted(entry.getValue(), previous, entry.getKey()));
                }
            }
            if (lineCommentPrefix == null || lineCommentPrefix.isBlank()) {
                errors.add("line comment prefix is not set");
            }
            if (declared.contains(ConstructCategory.CALL) && calleeFields.isEmpty()) {
                errors.add("CALL kinds declared without callee fields");
            }
            if (declared.contains(ConstructCategory.LOGICAL_OP) && logicalOperators.isEmpty()) {
                errors.add("LOGICAL_OP kinds declared without operator tokens");
            }
            if (!errors.isEmpty()) {
                throw new ProfileConfigurationException(
                        "Invalid " + language + " profile: " + String.join("; ", errors));
            }
            return new LanguageProfile(this, ImmutableMap.copyOf(structural));
        }
    }
}

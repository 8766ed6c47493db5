package ai.flowrisk.discover;

import static ai.flowrisk.profile.ConstructCategory.DECLARATION_WRAPPER;
import static ai.flowrisk.profile.ConstructCategory.FUNCTION;
import static ai.flowrisk.profile.ConstructCategory.NAMING_PARENT;

import ai.flowrisk.analyzer.BodyHandle;
import ai.flowrisk.analyzer.FunctionId;
import ai.flowrisk.analyzer.FunctionNode;
import ai.flowrisk.analyzer.TreeNodes;
import ai.flowrisk.parse.ParsedTree;
import ai.flowrisk.profile.LanguageProfile;
import ai.flowrisk.profile.LanguageProfiles;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Finds functions by walking the tree for node types in the profile's {@code FUNCTION} category. Declarations without
 * a body (abstract and interface methods, trait signatures) are skipped.
 */
public class TreeSitterFunctionDiscovery implements FunctionDiscovery {
    private static final Logger logger = LogManager.getLogger(TreeSitterFunctionDiscovery.class);

    @Override
    public List<FunctionNode> discover(int fileIndex, ParsedTree tree) {
        var profile = LanguageProfiles.forLanguage(tree.language());
        var source = tree.source();
        var suppressions = new SuppressionExtractor(source.text());

        var declarations = TreeNodes.findAllNodesRecursive(tree.root(), n -> profile.is(FUNCTION, n));
        declarations.sort(Comparator.comparingInt(TSNode::getStartByte));

        var functions = new ArrayList<FunctionNode>(declarations.size());
        for (var declaration : declarations) {
            var body = TreeNodes.field(declaration, "body");
            if (body == null) {
                continue;
            }
            var name = nameOf(declaration, profile, tree);
            var anchor = declarationAnchor(declaration, profile);
            var reason = suppressions.reasonFor(TreeNodes.startLine(anchor), profile.lineCommentPrefix());
            functions.add(new FunctionNode(
                    new FunctionId(fileIndex, functions.size()),
                    name,
                    TreeNodes.span(declaration),
                    new BodyHandle(body.getStartByte(), body.getEndByte(), body.getType()),
                    tree.language(),
                    reason));
        }
        logger.debug("Discovered {} {} functions in file #{}", functions.size(), tree.language(), fileIndex);
        return functions;
    }

    private static @Nullable String nameOf(TSNode declaration, LanguageProfile profile, ParsedTree tree) {
        var name = TreeNodes.field(declaration, "name");
        if (name != null) {
            return TreeNodes.text(name, tree.source());
        }
        var parent = declaration.getParent();
        if (TreeNodes.isPresent(parent) && profile.is(NAMING_PARENT, parent)) {
            var parentName = TreeNodes.field(parent, "name");
            if (parentName != null) {
                return TreeNodes.text(parentName, tree.source());
            }
        }
        return null;
    }

    /** The node whose first line the suppression comment must precede: decorators and export keywords included. */
    private static TSNode declarationAnchor(TSNode declaration, LanguageProfile profile) {
        var anchor = declaration;
        boolean wrapped = false;
        var parent = declaration.getParent();
        while (TreeNodes.isPresent(parent)
                && (profile.is(DECLARATION_WRAPPER, parent) || profile.is(NAMING_PARENT, parent))) {
            anchor = parent;
            wrapped = true;
            parent = parent.getParent();
        }
        // const f = () => ...: the declarator sits inside a lexical declaration
        if (wrapped && TreeNodes.isPresent(parent) && parent.getType().endsWith("declaration")) {
            anchor = parent;
            var grand = parent.getParent();
            if (TreeNodes.isPresent(grand) && profile.is(DECLARATION_WRAPPER, grand)) {
                anchor = grand;
            }
        }
        return anchor;
    }
}

package co.fanki.callgraphmcp.callgraph.domain.cpp;

import co.fanki.callgraphmcp.callgraph.domain.ExtractedFunction;
import co.fanki.callgraphmcp.callgraph.domain.ExtractionResult;
import co.fanki.callgraphmcp.callgraph.domain.ParseUnavailableException;
import co.fanki.callgraphmcp.callgraph.domain.SkippedRegion;
import co.fanki.callgraphmcp.callgraph.domain.SourceExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterCpp;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * C/C++ implementation of {@link SourceExtractor} backed by tree-sitter.
 *
 * <p>tree-sitter recovers from syntax errors locally, so a definition that
 * follows garbage is usually still found. Every {@code function_definition}
 * in the tree is extracted, including those nested in error nodes.</p>
 *
 * <h3>Naming</h3>
 * <p>The defined name is the identifier at the end of the declarator chain:
 * plain ({@code foo}), qualified ({@code Account::deposit}), in-class
 * ({@code deposit}), destructor or operator. Callee names come from the
 * {@code function} part of each call expression: the identifier or
 * qualified identifier as written, the member name for {@code obj.m()} and
 * {@code ptr->m()}, and the template name for {@code f<T>()}. Anything
 * else is kept as written with whitespace collapsed.</p>
 *
 * <p>Calls inside a nested definition (a method of a local class) belong to
 * that definition only.</p>
 *
 * <p>A new parser is created per extraction; {@link TSParser} instances
 * are not shared between threads.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class CppSourceExtractor extends SourceExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(
            CppSourceExtractor.class);

    private static final String FUNCTION_DEFINITION = "function_definition";

    private static final String CALL_EXPRESSION = "call_expression";

    private static final String ERROR = "ERROR";

    /** Declarator wrappers that hold the next declarator in the chain. */
    private static final Set<String> WRAPPING_DECLARATORS = Set.of(
            "function_declarator", "pointer_declarator",
            "reference_declarator", "parenthesized_declarator",
            "attributed_declarator");

    /** Declarator leaves whose text is the function name. */
    private static final Set<String> NAME_DECLARATORS = Set.of(
            "identifier", "field_identifier", "qualified_identifier",
            "destructor_name", "operator_name");

    /** {@inheritDoc} */
    @Override
    public String language() {
        return "cpp";
    }

    /**
     * Parses the source and walks the syntax tree once, in source order.
     *
     * @param source the C/C++ source text
     * @return the extracted definitions and skipped regions
     * @throws ParseUnavailableException if tree-sitter cannot be loaded
     */
    @Override
    protected ExtractionResult doExtract(final String source) {
        final TSTree tree = parse(source);
        final byte[] bytes = source.getBytes(StandardCharsets.UTF_8);

        final List<ExtractedFunction> functions = new ArrayList<>();
        final List<SkippedRegion> skipped = new ArrayList<>();

        final Deque<TSNode> pending = new ArrayDeque<>();
        pending.push(tree.getRootNode());

        while (!pending.isEmpty()) {
            final TSNode node = pending.pop();

            if (ERROR.equals(node.getType())) {
                skipped.add(region(node, "unparseable syntax"));
            } else if (node.isMissing()) {
                skipped.add(region(node, "missing " + node.getType()));
            } else if (FUNCTION_DEFINITION.equals(node.getType())) {
                final String name = functionName(node, bytes);
                if (name != null) {
                    functions.add(new ExtractedFunction(name,
                            calls(node, bytes)));
                } else {
                    LOG.debug("Unnamed function definition at line {}",
                            node.getStartPoint().getRow() + 1);
                }
            }

            pushChildren(pending, node);
        }

        return new ExtractionResult(functions, skipped);
    }

    private TSTree parse(final String source) {
        final TSTree tree;
        try {
            final TSParser parser = new TSParser();
            parser.setLanguage(new TreeSitterCpp());
            tree = parser.parseString(null, source);
        } catch (final LinkageError | RuntimeException e) {
            LOG.error("Failed to run the tree-sitter C++ parser", e);
            throw new ParseUnavailableException(
                    "C++ parser is unavailable: " + e.getMessage(), e);
        }

        if (tree == null) {
            throw new ParseUnavailableException(
                    "C++ parser produced no syntax tree", null);
        }
        return tree;
    }

    /**
     * Follows the declarator chain down to the name.
     *
     * <p>{@code reference_declarator} has no {@code declarator} field, so
     * wrappers fall back to their last named child.</p>
     */
    private String functionName(final TSNode definition, final byte[] bytes) {
        TSNode current = field(definition, "declarator");

        while (current != null) {
            final String type = current.getType();
            if (NAME_DECLARATORS.contains(type)) {
                return collapse(text(current, bytes));
            }
            if ("template_function".equals(type)) {
                final TSNode name = field(current, "name");
                return name == null ? null : collapse(text(name, bytes));
            }
            if (!WRAPPING_DECLARATORS.contains(type)) {
                return null;
            }
            final TSNode inner = field(current, "declarator");
            current = inner != null ? inner : lastNamedChild(current);
        }
        return null;
    }

    /**
     * Collects callee names of a definition, skipping nested definitions.
     */
    private Set<String> calls(final TSNode definition, final byte[] bytes) {
        final Set<String> callees = new LinkedHashSet<>();
        final Deque<TSNode> pending = new ArrayDeque<>();
        pushChildren(pending, definition);

        while (!pending.isEmpty()) {
            final TSNode node = pending.pop();
            final String type = node.getType();

            if (FUNCTION_DEFINITION.equals(type)) {
                continue;
            }
            if (CALL_EXPRESSION.equals(type)) {
                final String callee = calleeName(field(node, "function"),
                        bytes);
                if (callee != null && !callee.isBlank()) {
                    callees.add(callee);
                }
            }
            pushChildren(pending, node);
        }
        return callees;
    }

    private String calleeName(final TSNode function, final byte[] bytes) {
        if (function == null) {
            return null;
        }
        final String type = function.getType();

        if ("field_expression".equals(type)) {
            final TSNode member = field(function, "field");
            if (member != null) {
                return collapse(text(member, bytes));
            }
        } else if ("template_function".equals(type)) {
            final TSNode name = field(function, "name");
            if (name != null) {
                return collapse(text(name, bytes));
            }
        }
        return collapse(text(function, bytes));
    }

    /** Pushes children in reverse so they pop in source order. */
    private static void pushChildren(final Deque<TSNode> pending,
            final TSNode node) {
        for (int i = node.getChildCount() - 1; i >= 0; i--) {
            final TSNode child = node.getChild(i);
            if (child != null && !child.isNull()) {
                pending.push(child);
            }
        }
    }

    private static TSNode field(final TSNode node, final String name) {
        final TSNode child = node.getChildByFieldName(name);
        if (child == null || child.isNull()) {
            return null;
        }
        return child;
    }

    private static TSNode lastNamedChild(final TSNode node) {
        final int count = node.getNamedChildCount();
        if (count == 0) {
            return null;
        }
        final TSNode child = node.getNamedChild(count - 1);
        return child == null || child.isNull() ? null : child;
    }

    private static SkippedRegion region(final TSNode node,
            final String reason) {
        return new SkippedRegion(node.getStartPoint().getRow() + 1,
                node.getEndPoint().getRow() + 1, reason);
    }

    private static String text(final TSNode node, final byte[] bytes) {
        final int start = Math.max(0, node.getStartByte());
        final int end = Math.min(bytes.length, node.getEndByte());
        if (end <= start) {
            return "";
        }
        return new String(bytes, start, end - start, StandardCharsets.UTF_8);
    }

    private static String collapse(final String value) {
        return value.strip().replaceAll("\\s+", " ");
    }

}

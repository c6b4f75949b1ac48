package org.smpels.mcs.frontend.parser;

import org.smpels.mcs.api.SourceInfo;
import org.smpels.mcs.frontend.parser.ast.OperandNode;
import org.smpels.mcs.frontend.parser.ast.ParameterNode;
import org.smpels.mcs.frontend.parser.ast.StatementNode;
import org.smpels.mcs.frontend.segmenter.SpanText;
import org.smpels.mcs.frontend.segmenter.StatementSpan;
import org.smpels.mcs.schema.OperandDefinition;
import org.smpels.mcs.schema.ResolvedStatementName;
import org.smpels.mcs.schema.SchemaStore;
import org.smpels.mcs.schema.StatementDefinition;
import org.smpels.mcs.schema.StatementNameResolver;
import org.smpels.mcs.schema.SubOperandDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a statement span into a {@link StatementNode} with its parameter, operands and sub-operands.
 * The builder never fails: malformed input yields nodes carrying an invalid state
 * (unknown definition, unterminated parameter) which the semantic analysis reports later.
 */
public class TreeBuilder {

    private final StatementNameResolver resolver;

    /**
     * @param schema The catalog used to interpret statement and operand names.
     */
    public TreeBuilder(SchemaStore schema) {
        this.resolver = new StatementNameResolver(Objects.requireNonNull(schema, "schema"));
    }

    /**
     * Builds the node for one statement.
     * @param span The statement span produced by the segmenter.
     * @return The statement node; inline data is attached later by the parser.
     */
    public StatementNode build(StatementSpan span) {
        SpanText text = span.text();
        String source = text.text();

        int nameStart = skipWhitespace(source, 0, source.length());
        int index = nameStart + 2;
        while (index < source.length() && isNameChar(source.charAt(index))) {
            index++;
        }
        String name = source.substring(nameStart, index);
        ResolvedStatementName resolved = resolver.resolve(name);
        StatementDefinition definition = resolved.definition();

        ParameterNode parameter = null;
        int afterName = skipWhitespace(source, index, source.length());
        if (afterName < source.length() && source.charAt(afterName) == '(') {
            Group group = extractGroup(text, afterName, source.length());
            // Statements without a declared parameter ignore a parenthesized group here.
            if (definition != null && definition.hasParameter()) {
                parameter = group.parameter();
            }
            index = group.end();
        }

        List<OperandNode> operands = scan(text, index, source.length(), (token, position, group) -> {
            if (definition != null) {
                return statementOperand(text, token, position, group, definition.findOperand(token).orElse(null));
            }
            if (!isUpperCaseToken(token)) {
                return null;
            }
            return new OperandNode(token, position, null, null, group == null ? null : group.parameter(), null);
        });

        return new StatementNode(name, resolved.languageId(), resolved.kind(),
                text.positionOf(nameStart, name.length()), definition, parameter, operands,
                span.hasTerminator(), span.terminator(), span.unbalancedParens(),
                span.startLine(), span.endLine(), false, 0);
    }

    private OperandNode statementOperand(SpanText text, String token, SourceInfo position, Group group,
                                         OperandDefinition definition) {
        if (group == null) {
            return new OperandNode(token, position, definition, null, null, null);
        }
        if (definition != null && definition.declaresNestedValues() && group.parameter().terminated()) {
            List<OperandNode> subOperands = scan(text, group.contentStart(), group.contentEnd(),
                    (subToken, subPosition, subGroup) -> {
                        SubOperandDefinition valueDefinition = definition.findSubOperand(subToken).orElse(null);
                        return new OperandNode(subToken, subPosition, null, valueDefinition,
                                subGroup == null ? null : subGroup.parameter(), null);
                    });
            return new OperandNode(token, position, definition, null, null, subOperands);
        }
        return new OperandNode(token, position, definition, null, group.parameter(), null);
    }

    /**
     * Scans identifier tokens and their optional parenthesized groups between two offsets.
     * Characters that cannot start a name are skipped; an unterminated group ends the scan.
     */
    private List<OperandNode> scan(SpanText text, int from, int to, OperandFactory factory) {
        String source = text.text();
        List<OperandNode> operands = new ArrayList<>();
        int index = from;
        while (index < to) {
            char c = source.charAt(index);
            if (c == '(') {
                // A group without a name in front of it.
                index = extractGroup(text, index, to).end();
                continue;
            }
            if (!isNameChar(c)) {
                index++;
                continue;
            }
            int start = index;
            while (index < to && isNameChar(source.charAt(index))) {
                index++;
            }
            String token = source.substring(start, index);
            Group group = null;
            if (index < to && source.charAt(index) == '(') {
                group = extractGroup(text, index, to);
                index = group.end();
            }
            OperandNode operand = factory.create(token, text.positionOf(start, token.length()), group);
            if (operand != null) {
                operands.add(operand);
            }
        }
        return operands;
    }

    /**
     * Extracts the balanced group opening at {@code open}. If the matching parenthesis is missing,
     * the group runs to {@code limit} and its parameter is marked unterminated.
     */
    private static Group extractGroup(SpanText text, int open, int limit) {
        String source = text.text();
        int depth = 0;
        for (int i = open; i < limit; i++) {
            char c = source.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    String value = source.substring(open + 1, i);
                    ParameterNode parameter = new ParameterNode(value, text.positionOf(open + 1, value.length()), true);
                    return new Group(parameter, open + 1, i, i + 1);
                }
            }
        }
        String value = source.substring(open + 1, limit);
        ParameterNode parameter = new ParameterNode(value, text.positionOf(open + 1, value.length()), false);
        return new Group(parameter, open + 1, limit, limit);
    }

    private static int skipWhitespace(String source, int from, int to) {
        int index = from;
        while (index < to && Character.isWhitespace(source.charAt(index))) {
            index++;
        }
        return index;
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '@' || c == '#' || c == '$';
    }

    private static boolean isUpperCaseToken(String token) {
        if (!Character.isLetter(token.charAt(0))) {
            return false;
        }
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (Character.isLetter(c) && !Character.isUpperCase(c)) {
                return false;
            }
        }
        return true;
    }

    /**
     * A parenthesized group: its parameter and the offsets of its content and of the first character after it.
     */
    private record Group(ParameterNode parameter, int contentStart, int contentEnd, int end) {
    }

    @FunctionalInterface
    private interface OperandFactory {
        /**
         * @return The node for a token, or {@code null} to skip it.
         */
        OperandNode create(String token, SourceInfo position, Group group);
    }
}

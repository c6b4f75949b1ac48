package org.smpels.mcs.frontend.parser.ast;

import org.smpels.mcs.frontend.TreeWalker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The parsed form of one MCS document: its statements in source order, its comments and the source lines.
 * A document is immutable; every change of the text produces a new one.
 */
public final class Document {

    private final List<String> lines;
    private final List<StatementNode> statements;
    private final List<CommentNode> comments;
    private final Map<AstNode, AstNode> parents = new IdentityHashMap<>();

    /**
     * @param lines      The physical source lines.
     * @param statements The statements in source order.
     * @param comments   The comments outside inline data in source order.
     */
    public Document(List<String> lines, List<StatementNode> statements, List<CommentNode> comments) {
        this.lines = List.copyOf(lines);
        this.statements = List.copyOf(statements);
        this.comments = List.copyOf(comments);
        TreeWalker.walkWithParent(this.statements, (node, parent) -> {
            if (parent != null) {
                parents.put(node, parent);
            }
        });
    }

    /**
     * @return The physical source lines.
     */
    public List<String> lines() {
        return lines;
    }

    /**
     * @return The statements in source order.
     */
    public List<StatementNode> statements() {
        return statements;
    }

    /**
     * @return The comments outside inline data in source order.
     */
    public List<CommentNode> comments() {
        return comments;
    }

    /**
     * @return The statements followed by an inline data block, in source order.
     */
    public List<StatementNode> statementsExpectingInlineData() {
        List<StatementNode> result = new ArrayList<>();
        for (StatementNode statement : statements) {
            if (statement.expectsInlineData()) {
                result.add(statement);
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns the parent of a node. Statements and comments have none.
     * @param node A node of this document.
     * @return The owning node, or empty.
     */
    public Optional<AstNode> parentOf(AstNode node) {
        return Optional.ofNullable(parents.get(node));
    }

    /**
     * Returns the statement a node belongs to.
     * @param node A node of this document.
     * @return The owning statement, or empty for comments and foreign nodes.
     */
    public Optional<StatementNode> statementOf(AstNode node) {
        AstNode current = node;
        while (current != null) {
            if (current instanceof StatementNode statement) {
                return Optional.of(statement);
            }
            current = parents.get(current);
        }
        return Optional.empty();
    }

    /**
     * Finds the innermost node covering a location.
     * @param line      The zero-based line.
     * @param character The zero-based column.
     * @return The deepest node whose position covers the location, or empty.
     */
    public Optional<AstNode> findNodeAt(int line, int character) {
        for (CommentNode comment : comments) {
            if (contains(comment, line, character)) {
                return Optional.of(comment);
            }
        }
        AstNode[] found = new AstNode[1];
        TreeWalker.walkWithParent(statements, (node, parent) -> {
            if (node.position().covers(line, character)) {
                found[0] = node;
            }
        });
        return Optional.ofNullable(found[0]);
    }

    /**
     * Looks up the first occurrence of an operand; later duplicates are ignored.
     * @param statement A statement of this document.
     * @param name      The operand name as written.
     * @return The first operand written with that name, or empty.
     */
    public Optional<OperandNode> firstOperand(StatementNode statement, String name) {
        for (OperandNode operand : statement.operands()) {
            if (operand.name().equals(name)) {
                return Optional.of(operand);
            }
        }
        return Optional.empty();
    }

    private static boolean contains(CommentNode comment, int line, int character) {
        int startLine = comment.position().line();
        if (line < startLine || line > comment.endLine()) {
            return false;
        }
        if (line == startLine && character < comment.position().character()) {
            return false;
        }
        return line != comment.endLine() || character < comment.endCharacter();
    }
}

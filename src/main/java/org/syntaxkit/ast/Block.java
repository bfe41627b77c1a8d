package org.syntaxkit.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * An AST node that represents a named, ordered body of statements forming one lexical scope.
 *
 * <p>A block is assembled with {@link #append(AstNode)} and is treated as read-only once it has
 * been handed to a parent node. Appending is not synchronized.
 */
public final class Block implements AstNode {

    private final String name;
    private final List<Statement> statements = new ArrayList<>();
    private final SourceLocation location;

    /**
     * Creates a block with initial statements.
     *
     * @param name       The block label.
     * @param statements The statements in execution order.
     * @param location   Where the block starts in the source.
     * @throws InvalidNodeTypeException if any element is not a {@link Statement}.
     */
    public Block(String name, List<? extends AstNode> statements, SourceLocation location) {
        if (name == null) {
            throw new AstConstructionException("Block.name must not be null");
        }
        this.name = name;
        this.location = location != null ? location : SourceLocation.NO_SOURCE_LOCATION;
        if (statements != null) {
            statements.forEach(this::append);
        }
    }

    public Block(String name, List<? extends AstNode> statements) {
        this(name, statements, SourceLocation.NO_SOURCE_LOCATION);
    }

    /**
     * Creates an empty block.
     * @param name The block label.
     */
    public Block(String name) {
        this(name, List.of(), SourceLocation.NO_SOURCE_LOCATION);
    }

    /**
     * Appends a statement to the end of the block.
     *
     * @param node The statement to append.
     * @return This block, for chaining.
     * @throws InvalidNodeTypeException if the node is not a {@link Statement}.
     */
    public Block append(AstNode node) {
        if (!(node instanceof Statement statement)) {
            throw InvalidNodeTypeException.of("Block", "statements", Statement.class, node);
        }
        statements.add(statement);
        return this;
    }

    public String name() {
        return name;
    }

    /**
     * @return A read-only view of the statements in execution order.
     */
    public List<Statement> statements() {
        return Collections.unmodifiableList(statements);
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public ASTKind kind() {
        return ASTKind.BLOCK;
    }

    @Override
    public SourceLocation getSourceLocation() {
        return location;
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.unmodifiableList(statements);
    }

    @Override
    public Map<String, Object> getStruct() {
        List<Object> body = new ArrayList<>(statements.size());
        for (Statement statement : statements) {
            body.add(statement.getStruct());
        }
        Map<String, Object> struct = new LinkedHashMap<>();
        struct.put("BLOCK[" + name + "]", body);
        return struct;
    }

    @Override
    public String toString() {
        return statements.stream()
                .map(Statement::toString)
                .collect(Collectors.joining("; ", "Block[" + name + "]{", "}"));
    }
}

package org.syntaxkit.ast.features.with;

import org.syntaxkit.ast.ASTKind;
import org.syntaxkit.ast.AstNode;
import org.syntaxkit.ast.Block;
import org.syntaxkit.ast.EmptyClauseListException;
import org.syntaxkit.ast.InvalidNodeTypeException;
import org.syntaxkit.ast.SourceLocation;
import org.syntaxkit.ast.Statement;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * An AST node for a with-statement: one or more {@link WithItem} clauses sharing a body.
 *
 * <p>Syntax: {@code with <item> [, <item>]* : <body>}
 *
 * <p>Clause order matches the left-to-right order in the source and is kept in both renderings.
 */
public final class WithStmt implements Statement {

    private final List<WithItem> items;
    private final Block body;
    private final SourceLocation location;

    /**
     * @param items    The clauses in source order. Must not be empty.
     * @param body     The body executed inside the contexts.
     * @param location Where the statement starts in the source.
     * @throws EmptyClauseListException if {@code items} is null or empty.
     * @throws InvalidNodeTypeException if an item is not a {@link WithItem} or the body is null.
     */
    public WithStmt(List<WithItem> items, Block body, SourceLocation location) {
        if (items == null || items.isEmpty()) {
            throw new EmptyClauseListException("WithStmt.items must contain at least one WithItem");
        }
        List<WithItem> copy = new ArrayList<>(items.size());
        // Raw or unchecked callers can still smuggle in other objects.
        for (Object item : items) {
            if (!(item instanceof WithItem withItem)) {
                throw InvalidNodeTypeException.of("WithStmt", "items", WithItem.class, item);
            }
            copy.add(withItem);
        }
        if (body == null) {
            throw InvalidNodeTypeException.of("WithStmt", "body", Block.class, null);
        }
        this.items = List.copyOf(copy);
        this.body = body;
        this.location = location != null ? location : SourceLocation.NO_SOURCE_LOCATION;
    }

    public WithStmt(List<WithItem> items, Block body) {
        this(items, body, SourceLocation.NO_SOURCE_LOCATION);
    }

    /**
     * @return The clauses in source order, unmodifiable.
     */
    public List<WithItem> items() {
        return items;
    }

    public Block body() {
        return body;
    }

    @Override
    public ASTKind kind() {
        return ASTKind.WITH_STMT;
    }

    @Override
    public SourceLocation getSourceLocation() {
        return location;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(items.size() + 1);
        children.addAll(items);
        children.add(body);
        return children;
    }

    @Override
    public Map<String, Object> getStruct() {
        List<Object> itemStructs = new ArrayList<>(items.size());
        for (WithItem item : items) {
            itemStructs.add(item.getStruct());
        }
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("items", itemStructs);
        content.put("body", body.getStruct());

        Map<String, Object> struct = new LinkedHashMap<>();
        struct.put("WITH-STMT", content);
        return struct;
    }

    @Override
    public String toString() {
        return items.stream()
                .map(WithItem::toString)
                .collect(Collectors.joining(", ", "WithStmt[", "]"));
    }
}

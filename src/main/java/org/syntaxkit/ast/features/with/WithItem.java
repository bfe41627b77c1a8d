package org.syntaxkit.ast.features.with;

import org.syntaxkit.ast.ASTKind;
import org.syntaxkit.ast.AstNode;
import org.syntaxkit.ast.Expr;
import org.syntaxkit.ast.Identifier;
import org.syntaxkit.ast.MissingContextExpressionException;
import org.syntaxkit.ast.SourceLocation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An AST node for one clause of a with-statement.
 *
 * <p>Syntax: {@code <context_expr> [as <instance_name>]}
 *
 * <p>The instance name is optional. A clause without it binds no name and renders
 * without a trailing {@code as}.
 */
public final class WithItem implements AstNode {

    private final Expr contextExpr;
    private final Identifier instanceName;
    private final SourceLocation location;

    /**
     * @param contextExpr  The expression providing the context manager.
     * @param instanceName The bound name, or null for an anonymous context.
     * @param location     Where the clause starts in the source.
     * @throws MissingContextExpressionException if {@code contextExpr} is null.
     */
    public WithItem(Expr contextExpr, Identifier instanceName, SourceLocation location) {
        if (contextExpr == null) {
            throw new MissingContextExpressionException("WithItem.contextExpr must not be null");
        }
        this.contextExpr = contextExpr;
        this.instanceName = instanceName;
        this.location = location != null ? location : SourceLocation.NO_SOURCE_LOCATION;
    }

    public WithItem(Expr contextExpr, Identifier instanceName) {
        this(contextExpr, instanceName, SourceLocation.NO_SOURCE_LOCATION);
    }

    /**
     * Creates a clause that binds no name.
     * @param contextExpr The expression providing the context manager.
     */
    public WithItem(Expr contextExpr) {
        this(contextExpr, null, SourceLocation.NO_SOURCE_LOCATION);
    }

    public Expr contextExpr() {
        return contextExpr;
    }

    public Optional<Identifier> instanceName() {
        return Optional.ofNullable(instanceName);
    }

    @Override
    public ASTKind kind() {
        return ASTKind.WITH_ITEM;
    }

    @Override
    public SourceLocation getSourceLocation() {
        return location;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(2);
        children.add(contextExpr);
        if (instanceName != null) {
            children.add(instanceName);
        }
        return children;
    }

    /**
     * Returns {@code {"CONTEXT[<expr>]": "AS <name>"}}. Without a bound name the value is the
     * empty string.
     */
    @Override
    public Map<String, Object> getStruct() {
        Map<String, Object> struct = new LinkedHashMap<>();
        struct.put("CONTEXT[" + contextExpr + "]", instanceName != null ? "AS " + instanceName : "");
        return struct;
    }

    @Override
    public String toString() {
        return instanceName != null ? contextExpr + " as " + instanceName : contextExpr.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WithItem other)) return false;
        return contextExpr.equals(other.contextExpr) && Objects.equals(instanceName, other.instanceName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(contextExpr, instanceName);
    }
}

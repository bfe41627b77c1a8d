package org.syntaxkit.ast.features.with;

import org.syntaxkit.ast.ASTKind;
import org.syntaxkit.ast.Block;
import org.syntaxkit.ast.EmptyClauseListException;
import org.syntaxkit.ast.Expr;
import org.syntaxkit.ast.Identifier;
import org.syntaxkit.ast.InvalidNodeTypeException;
import org.syntaxkit.ast.Literal;
import org.syntaxkit.ast.SourceLocation;
import org.syntaxkit.ast.Statement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link WithStmt}: clause ordering, the non-empty clause list and both renderings.
 */
@Tag("unit")
class WithStmtTest {

    private Expr contextExpr;
    private Identifier varName;
    private Block emptyBlock;

    @BeforeEach
    void setUp() {
        contextExpr = new Literal(42, SourceLocation.NO_SOURCE_LOCATION);
        varName = new Identifier("x");
        emptyBlock = new Block("empty_block");
    }

    @Test
    void testInit_StoresItemsBodyAndKind() {
        WithItem item = new WithItem(contextExpr, varName);
        WithStmt stmt = new WithStmt(List.of(item), emptyBlock);

        assertThat(stmt.items()).containsExactly(item);
        assertThat(stmt.body()).isSameAs(emptyBlock);
        assertThat(stmt.kind()).isEqualTo(ASTKind.WITH_STMT);
        assertThat(stmt).isInstanceOf(Statement.class);
    }

    @Test
    void testToString_SingleItem() {
        WithItem item = new WithItem(contextExpr, varName);
        WithStmt stmt = new WithStmt(List.of(item), emptyBlock);

        assertThat(stmt).hasToString("WithStmt[" + contextExpr + " as " + varName + "]");
        assertThat(stmt).hasToString("WithStmt[42 as x]");
    }

    @Test
    void testToString_TwoItems_KeepsClauseOrder() {
        WithItem first = new WithItem(Literal.of("a.txt"), new Identifier("a"));
        WithItem second = new WithItem(new Identifier("lock"));

        WithStmt stmt = new WithStmt(List.of(first, second), emptyBlock);

        assertThat(stmt).hasToString("WithStmt[\"a.txt\" as a, lock]");
        assertThat(new WithStmt(List.of(second, first), emptyBlock))
                .hasToString("WithStmt[lock, \"a.txt\" as a]");
    }

    @Test
    @SuppressWarnings("unchecked")
    void testGetStruct_NestsItemsAndBody() {
        WithItem item = new WithItem(contextExpr, varName);
        WithStmt stmt = new WithStmt(List.of(item), emptyBlock);

        Map<String, Object> struct = stmt.getStruct();

        assertThat(struct).containsOnlyKeys("WITH-STMT");
        assertThat(struct.get("WITH-STMT")).isInstanceOf(Map.class);
        Map<String, Object> content = (Map<String, Object>) struct.get("WITH-STMT");
        assertThat(content).containsOnlyKeys("items", "body");
        assertThat((List<Object>) content.get("items")).containsExactly(item.getStruct());
        assertThat(content.get("body")).isEqualTo(emptyBlock.getStruct());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testGetStruct_TwoItems_KeepsClauseOrder() {
        WithItem first = new WithItem(new Identifier("open_a"), new Identifier("a"));
        WithItem second = new WithItem(new Identifier("open_b"), new Identifier("b"));
        WithStmt stmt = new WithStmt(List.of(first, second), emptyBlock);

        Map<String, Object> content = (Map<String, Object>) stmt.getStruct().get("WITH-STMT");

        assertThat((List<Object>) content.get("items"))
                .containsExactly(Map.of("CONTEXT[open_a]", "AS a"), Map.of("CONTEXT[open_b]", "AS b"));
    }

    @Test
    void testGetStruct_IsDeterministic() {
        WithStmt stmt = new WithStmt(List.of(new WithItem(contextExpr, varName)), emptyBlock);

        assertThat(stmt.getStruct()).isEqualTo(stmt.getStruct());
        assertThat(stmt.toString()).isEqualTo(stmt.toString());
    }

    @Test
    void testNestedWithInBody_RendersRecursively() {
        WithStmt inner = new WithStmt(List.of(new WithItem(new Identifier("b"))), new Block("inner"));
        Block body = new Block("outer_body").append(inner);
        WithStmt outer = new WithStmt(List.of(new WithItem(contextExpr, varName)), body);

        assertThat(outer.body().toString()).isEqualTo("Block[outer_body]{WithStmt[b]}");
        assertThat(outer.getChildren()).hasSize(2).last().isSameAs(body);
    }

    @Test
    void testEmptyItemList_FailsWithEmptyClauseList() {
        assertThatThrownBy(() -> new WithStmt(List.of(), emptyBlock))
                .isInstanceOf(EmptyClauseListException.class)
                .hasMessageContaining("at least one");
        assertThatThrownBy(() -> new WithStmt(null, emptyBlock))
                .isInstanceOf(EmptyClauseListException.class);
    }

    @Test
    void testNullItemOrBody_FailsWithInvalidNodeType() {
        List<WithItem> withNull = new ArrayList<>();
        withNull.add(null);

        assertThatThrownBy(() -> new WithStmt(withNull, emptyBlock))
                .isInstanceOf(InvalidNodeTypeException.class);
        assertThatThrownBy(() -> new WithStmt(List.of(new WithItem(contextExpr)), null))
                .isInstanceOf(InvalidNodeTypeException.class)
                .hasMessageContaining("body");
    }

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    void testWrongCapabilityInItems_FailsWithInvalidNodeType() {
        List raw = new ArrayList();
        raw.add(new Identifier("not_a_clause"));

        assertThatThrownBy(() -> new WithStmt(raw, emptyBlock))
                .isInstanceOf(InvalidNodeTypeException.class)
                .hasMessageContaining("WithItem")
                .hasMessageContaining("Identifier");
    }

    @Test
    void testItemsAreCopiedAtConstruction() {
        List<WithItem> items = new ArrayList<>();
        items.add(new WithItem(contextExpr, varName));
        WithStmt stmt = new WithStmt(items, emptyBlock);

        items.add(new WithItem(new Identifier("late")));

        assertThat(stmt.items()).hasSize(1);
        assertThatThrownBy(() -> stmt.items().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}

package io.spelunk.path;

import static io.spelunk.path.Fixtures.find;
import static io.spelunk.syntax.impl.SimpleSyntaxNode.node;
import static org.junit.jupiter.api.Assertions.*;

import io.spelunk.syntax.api.SyntaxNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StatementScopeTest {

  private final StatementScope scope = new StatementScope();
  private SyntaxNode root;

  @BeforeEach
  void setUp() {
    root = Fixtures.sample();
  }

  @Test
  void containingDeclarations() {
    SyntaxNode ret = find(root, "//return");
    assertEquals("M", scope.containingMethod(ret).orElseThrow().declaredName().orElseThrow());
    assertEquals("A", scope.containingType(ret).orElseThrow().declaredName().orElseThrow());
    assertEquals("M", scope.methodName(ret));
    assertEquals("A", scope.className(ret));
    assertFalse(scope.isTopLevel(ret));
  }

  @Test
  void nestedStatements() {
    assertTrue(scope.isNested(find(root, "//return")));
    assertFalse(scope.isNested(find(root, "//method[@name='M']/block/if")));
    assertFalse(scope.isNested(find(root, "//while")));
  }

  @Test
  void scopeFilters() {
    SyntaxNode ret = find(root, "//return");
    assertTrue(scope.isInScope(ret, "A", "M"));
    assertTrue(scope.isInScope(ret, null, null));
    assertTrue(scope.isInScope(ret, "A", null));
    assertFalse(scope.isInScope(ret, "A", "N"));
    assertFalse(scope.isInScope(ret, "B", null));
  }

  @Test
  void topLevelStatementsBelongToProgramMain() {
    SyntaxNode top = node("unit").child(node("expression").text("Console.WriteLine();")).build();
    SyntaxNode stmt = top.children().get(0);
    assertTrue(scope.isTopLevel(stmt));
    assertEquals(StatementScope.TOP_LEVEL_CLASS, scope.className(stmt));
    assertEquals(StatementScope.TOP_LEVEL_METHOD, scope.methodName(stmt));
    assertTrue(scope.isInScope(stmt, "Program", "Main"));
    assertFalse(scope.isInScope(stmt, "A", null));
  }

  @Test
  void fieldInitializerHasTypeButNoMethod() {
    SyntaxNode tree =
        node("unit").child(node("class").name("C").child(node("field").name("f"))).build();
    SyntaxNode field = find(tree, "//field");
    assertEquals("C", scope.className(field));
    assertEquals("", scope.methodName(field));
  }
}

package io.spelunk.session;

import static io.spelunk.syntax.impl.SimpleSyntaxNode.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import io.spelunk.path.AddressStyle;
import io.spelunk.path.NodeResult;
import io.spelunk.path.SpelunkPathParseException;
import io.spelunk.syntax.api.SymbolInfo;
import io.spelunk.syntax.api.SymbolProvider;
import io.spelunk.syntax.api.SyntaxNode;
import io.spelunk.syntax.api.SyntaxTreeSnapshot;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** End-to-end tests for the query facade with a real session. */
class PathQueryServiceTest {

  private PathQueryService service;
  private SessionContext session;
  private SyntaxTreeSnapshot snapshot;

  @BeforeEach
  void setUp() {
    service = new PathQueryService();
    session = new SessionRegistry().open("test");
    snapshot = TestTrees.snapshot(TestTrees.calc(false));
  }

  @Test
  void findReturnsMatchesInDocumentOrder() {
    List<SyntaxNode> returns = service.find("//return", snapshot, null);
    assertThat(returns)
        .extracting(SyntaxNode::text)
        .containsExactly("return 0;", "return r;", "return a - b;");
  }

  @Test
  void findRejectsMalformedPath() {
    assertThrows(SpelunkPathParseException.class, () -> service.find("//if[", snapshot, null));
  }

  @Test
  void findUsesSymbolProvider() {
    SymbolProvider symbols = mock(SymbolProvider.class);
    when(symbols.resolve(any()))
        .thenAnswer(
            inv -> {
              SyntaxNode n = inv.getArgument(0);
              return n.declaredName().equals(Optional.of("Add"))
                  ? Optional.of(new SymbolInfo("Add", "Method", "int", "Calc"))
                  : Optional.empty();
            });
    assertThat(service.find("//method[@returns='int']", snapshot, symbols))
        .extracting(n -> n.declaredName().orElseThrow())
        .containsExactly("Add");
  }

  @Test
  void findResultsCarryStablePaths() {
    List<NodeResult> results =
        service.findResults("//method[static]//return", snapshot.root(), null);
    assertEquals(1, results.size());
    NodeResult r = results.get(0);
    assertEquals("return", r.nodeType());
    assertEquals("return a - b;", r.text());
    assertEquals("/Calc/Sub/block[1]/return[1]", r.path());
  }

  @Test
  void stablePathAndDepth() {
    SyntaxNode inner = service.find("//if//return", snapshot, null).get(0);
    SyntaxNode add = service.find("//method[@name='Add']", snapshot, null).get(0);
    assertEquals("/Calc/Add/block[1]/if[1]/block[1]/return[1]", service.getStablePath(inner, null));
    assertEquals("/block[1]/if[1]/block[1]/return[1]", service.getStablePath(inner, add));
    assertEquals(3, service.getNestingDepth(inner, null));
  }

  @Test
  void qualifiedAddressStyleFromConfig() {
    var qualified =
        new PathQueryService(new SpelunkConfig(100, 100, false, AddressStyle.QUALIFIED));
    SyntaxNode ifNode = qualified.find("//if", snapshot, null).get(0);
    assertEquals("/class[Calc]/method[Add]/block[1]/if[1]", qualified.getStablePath(ifNode, null));
  }

  @Test
  void strictConfigRejectsUnknownAttributes() {
    assertTrue(service.find("//class[@color='red']", snapshot, null).isEmpty());
    var strict = new PathQueryService(new SpelunkConfig(100, 100, true, AddressStyle.COMPACT));
    assertThrows(
        SpelunkPathParseException.class,
        () -> strict.find("//class[@color='red']", snapshot, null));
  }

  @Test
  void findStatementsSkipsNestedByDefault() {
    List<StatementInfo> top =
        service.findStatements(session, snapshot, "//method[@name='Add']//*", false);
    assertThat(top).extracting(StatementInfo::typeTag).containsExactly("local", "if", "return");

    StatementInfo ifInfo = top.get(1);
    assertEquals("stmt-2", ifInfo.statementId());
    assertEquals("Add", ifInfo.containingMethod());
    assertEquals("Calc", ifInfo.containingClass());
    assertEquals(1, ifInfo.depth());
    assertEquals("/Calc/Add/block[1]/if[1]", ifInfo.stablePath());
    assertEquals(3, session.statements().size());
  }

  @Test
  void findStatementsIncludesNestedOnRequest() {
    List<StatementInfo> all =
        service.findStatements(session, snapshot, "//method[@name='Add']//*", true);
    assertThat(all).extracting(StatementInfo::text).contains("return 0;");
    StatementInfo nested =
        all.stream().filter(s -> s.text().equals("return 0;")).findFirst().orElseThrow();
    assertEquals(3, nested.depth());
  }

  @Test
  void topLevelStatementsReportProgramMain() {
    SyntaxNode script =
        node("unit")
            .child(node("expression").text("Run();"))
            .build();
    var info =
        service.findStatements(session, SyntaxTreeSnapshot.of("script.csx", script), "//*", false);
    assertEquals(1, info.size());
    assertEquals("Program", info.get(0).containingClass());
    assertEquals("Main", info.get(0).containingMethod());
    assertEquals("/expression[1]", info.get(0).stablePath());
  }

  @Test
  void registeredStatementsResolveAgainstLatestSnapshot() {
    List<StatementInfo> found =
        service.findStatements(session, snapshot, "//method[@name='Add']/block/if", false);
    String id = found.get(0).statementId();

    var edited = TestTrees.snapshot(TestTrees.calc(true));
    session.updateSnapshot(edited);
    SyntaxNode resolved = service.resolveStatement(session, id).orElseThrow();
    assertSame(service.find("//if", edited, null).get(0), resolved);
    assertTrue(service.resolveStatement(session, "stmt-999").isEmpty());
  }

  @Test
  void markersSurviveUnrelatedEditsAndVanishWithTheirNode() {
    SyntaxNode sub = service.find("//method[@name='Sub']", snapshot, null).get(0);
    MarkerRecord marker = service.markNode(session, snapshot, sub, "subtraction");
    assertEquals("mark-1", marker.markerId());
    assertEquals("subtraction", marker.label());
    assertSame(sub, service.resolveMarker(session, marker.markerId()).orElseThrow());

    var edited = TestTrees.snapshot(TestTrees.calc(true));
    session.updateSnapshot(edited);
    assertSame(
        service.find("//method[@name='Sub']", edited, null).get(0),
        service.resolveMarker(session, marker.markerId()).orElseThrow());

    SyntaxNode withoutSub =
        node("unit")
            .child(node("class").name("Calc"))
            .build();
    session.updateSnapshot(TestTrees.snapshot(withoutSub));
    assertTrue(service.resolveMarker(session, marker.markerId()).isEmpty());
    assertTrue(session.markers().get(marker.markerId()).isPresent());
  }

  @Test
  void unattachedOrUnknownMarkersResolveToEmpty() {
    String id = session.markers().createMarker("later");
    assertTrue(service.resolveMarker(session, id).isEmpty());
    assertTrue(service.resolveMarker(session, "mark-77").isEmpty());
  }

  @Test
  void markNodeReportsCapacity() {
    var tiny = SessionContext.create("tiny", new SpelunkConfig(1, 10, false, AddressStyle.COMPACT));
    SyntaxNode add = service.find("//method[@name='Add']", snapshot, null).get(0);
    service.markNode(tiny, snapshot, add, null);
    assertThrows(
        MarkerCapacityExceededException.class, () -> service.markNode(tiny, snapshot, add, null));
  }

  @Test
  void markersCanBeFoundByFile() {
    SyntaxNode add = service.find("//method[@name='Add']", snapshot, null).get(0);
    service.markNode(session, snapshot, add, "a");
    session.markers().createMarker("b");
    assertThat(session.markers().find(null, TestTrees.FILE))
        .extracting(MarkerRecord::label)
        .containsExactly("a");
    assertEquals(
        List.of("a", "b"),
        session.markers().find(null, null).stream()
            .map(MarkerRecord::label)
            .collect(Collectors.toList()));
  }
}

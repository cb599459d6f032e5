package io.spelunk.session;

import io.spelunk.path.NodeResult;
import io.spelunk.path.ParseOptions;
import io.spelunk.path.SpelunkPath.Query;
import io.spelunk.path.SpelunkPathEvaluator;
import io.spelunk.path.SpelunkPathParser;
import io.spelunk.path.StablePathBuilder;
import io.spelunk.path.StatementScope;
import io.spelunk.syntax.api.NodeKinds;
import io.spelunk.syntax.api.SymbolProvider;
import io.spelunk.syntax.api.SyntaxNode;
import io.spelunk.syntax.api.SyntaxTreeSnapshot;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for hosts: path queries, stable addressing, statement registration and markers.
 *
 * <p>Query and addressing methods are stateless. Session-scoped methods take the {@link
 * SessionContext} explicitly; the service holds no per-session state.
 */
public final class PathQueryService {

  private static final Logger LOG = LoggerFactory.getLogger(PathQueryService.class);

  private final ParseOptions parseOptions;
  private final StablePathBuilder paths;
  private final StatementScope scope;
  private final NodeKinds kinds;

  public PathQueryService() {
    this(SpelunkConfig.defaults());
  }

  public PathQueryService(SpelunkConfig config) {
    Objects.requireNonNull(config, "config");
    this.parseOptions = config.parseOptions();
    this.paths = config.pathBuilder();
    this.kinds = paths.kinds();
    this.scope = new StatementScope(kinds);
  }

  /**
   * Parses a path with this service's options.
   *
   * @throws io.spelunk.path.SpelunkPathParseException if the path is malformed
   */
  public Query parse(String path) {
    return SpelunkPathParser.parse(path, parseOptions);
  }

  /**
   * Finds the nodes matching {@code path} in the tree rooted at {@code root}.
   *
   * @param symbols optional semantic lookup, may be null
   * @throws io.spelunk.path.SpelunkPathParseException if the path is malformed
   */
  public List<SyntaxNode> find(String path, SyntaxNode root, SymbolProvider symbols) {
    Objects.requireNonNull(root, "root");
    return SpelunkPathEvaluator.evaluate(parse(path), root, symbols);
  }

  public List<SyntaxNode> find(String path, SyntaxTreeSnapshot snapshot, SymbolProvider symbols) {
    return find(path, snapshot.root(), symbols);
  }

  /** Like {@link #find} but bundles each match with its text, span and stable path. */
  public List<NodeResult> findResults(String path, SyntaxNode root, SymbolProvider symbols) {
    List<NodeResult> results = new ArrayList<>();
    for (SyntaxNode node : find(path, root, symbols)) {
      results.add(NodeResult.of(node, paths));
    }
    return results;
  }

  public String getStablePath(SyntaxNode node, SyntaxNode boundary) {
    return paths.buildPath(node, boundary);
  }

  public int getNestingDepth(SyntaxNode node, SyntaxNode boundary) {
    return paths.nestingDepth(node, boundary);
  }

  /**
   * Finds the statements matching {@code path} and registers each in the session's statement
   * registry. The snapshot becomes the session's latest snapshot of its file.
   *
   * @param includeNested whether statements nested in other statements are reported
   */
  public List<StatementInfo> findStatements(
      SessionContext session, SyntaxTreeSnapshot snapshot, String path, boolean includeNested) {
    Objects.requireNonNull(session, "session");
    Objects.requireNonNull(snapshot, "snapshot");
    List<SyntaxNode> matches = find(path, snapshot.root(), null);
    session.updateSnapshot(snapshot);

    List<StatementInfo> result = new ArrayList<>();
    for (SyntaxNode node : matches) {
      if (!kinds.isStatement(node) || (!includeNested && scope.isNested(node))) {
        continue;
      }
      NodeReference reference = NodeReference.of(snapshot, node);
      String id = session.statements().register(reference, snapshot.file(), session.id());
      result.add(
          new StatementInfo(
              id,
              node.typeTag(),
              node.text(),
              node.span(),
              scope.methodName(node),
              scope.className(node),
              paths.nestingDepth(node, null),
              paths.buildPath(node, null)));
    }
    LOG.debug("Registered {} statements for '{}' in session {}", result.size(), path, session.id());
    return result;
  }

  /** Re-resolves a registered statement against the latest snapshot of its file. */
  public Optional<SyntaxNode> resolveStatement(SessionContext session, String statementId) {
    return session
        .statements()
        .lookup(statementId)
        .flatMap(record -> session.resolve(record.reference()));
  }

  /**
   * Marks a node of {@code snapshot}, which becomes the session's latest snapshot of its file.
   *
   * @throws MarkerCapacityExceededException if the session's marker store is full
   */
  public MarkerRecord markNode(
      SessionContext session, SyntaxTreeSnapshot snapshot, SyntaxNode node, String label) {
    Objects.requireNonNull(session, "session");
    Objects.requireNonNull(node, "node");
    session.updateSnapshot(snapshot);
    return session.markers().mark(label, NodeReference.of(snapshot, node));
  }

  /**
   * Resolves a marker to its node in the latest snapshot of the marked file.
   *
   * @return the node, or empty if the marker is unknown, unattached, or its node no longer exists
   */
  public Optional<SyntaxNode> resolveMarker(SessionContext session, String markerId) {
    return session
        .markers()
        .get(markerId)
        .filter(MarkerRecord::isAttached)
        .flatMap(marker -> session.resolve(marker.reference()));
  }
}

package io.spelunk.session;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Unit tests for MarkerStore capacity and lifecycle. */
class MarkerStoreTest {

  private MarkerStore store;
  private NodeReference ref;

  @BeforeEach
  void setUp() {
    store = new MarkerStore();
    ref = new NodeReference("snap-1", "A.cs", "/class[A]/method[M]", "method");
  }

  @Test
  void idsAreSequential() {
    assertEquals("mark-1", store.createMarker("first"));
    assertEquals("mark-2", store.createMarker(null));
    assertEquals(2, store.size());
  }

  @Test
  void hundredAndFirstMarkerFails() {
    List<String> ids = new ArrayList<>();
    for (int i = 0; i < 100; i++) {
      ids.add(store.createMarker("m" + i));
    }
    assertFalse(store.hasCapacity());

    var e = assertThrows(MarkerCapacityExceededException.class, () -> store.createMarker("extra"));
    assertEquals(100, e.capacity());
    assertThrows(MarkerCapacityExceededException.class, () -> store.mark("extra", ref));

    assertEquals(100, store.size());
    for (int i = 0; i < ids.size(); i++) {
      assertEquals("m" + i, store.get(ids.get(i)).orElseThrow().label());
    }
  }

  @Test
  void removingFreesCapacity() {
    var small = new MarkerStore(2);
    String first = small.createMarker(null);
    small.createMarker(null);
    assertThrows(MarkerCapacityExceededException.class, () -> small.createMarker(null));
    assertTrue(small.remove(first));
    assertEquals("mark-3", small.createMarker(null));
  }

  @Test
  void attachSetsReference() {
    String id = store.createMarker("here");
    assertFalse(store.get(id).orElseThrow().isAttached());
    MarkerRecord attached = store.attach(id, ref);
    assertSame(ref, attached.reference());
    assertEquals("here", attached.label());
    assertTrue(store.get(id).orElseThrow().isAttached());
  }

  @Test
  void attachUnknownMarkerThrows() {
    var e = assertThrows(IllegalArgumentException.class, () -> store.attach("mark-9", ref));
    assertEquals("Marker not found: mark-9", e.getMessage());
  }

  @Test
  void findFiltersByIdAndFile() {
    store.mark("a", ref);
    store.mark("b", new NodeReference("snap-1", "B.cs", "/class[B]", "class"));
    store.createMarker("unattached");

    assertEquals(3, store.find(null, null).size());
    assertEquals(List.of("a"), labels(store.find(null, "A.cs")));
    assertEquals(List.of("b"), labels(store.find("mark-2", null)));
    assertTrue(store.find("mark-2", "A.cs").isEmpty());
    assertTrue(store.find("mark-42", null).isEmpty());
  }

  @Test
  void removeUnknownReturnsFalse() {
    assertFalse(store.remove("mark-1"));
    assertTrue(store.get("mark-1").isEmpty());
  }

  @Test
  void clearAllResetsNumbering() {
    store.createMarker(null);
    store.createMarker(null);
    assertEquals(2, store.clearAll());
    assertEquals(0, store.size());
    assertEquals("mark-1", store.createMarker(null));
    assertEquals(1, store.clearAll());
  }

  @Test
  void rejectsInvalidCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new MarkerStore(0));
  }

  private static List<String> labels(List<MarkerRecord> records) {
    List<String> out = new ArrayList<>();
    records.forEach(r -> out.add(r.label()));
    return out;
  }
}

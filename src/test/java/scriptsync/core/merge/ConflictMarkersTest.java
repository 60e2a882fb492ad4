package scriptsync.core.merge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ConflictMarkersTest {
  @Test
  void parse_diff3Style_capturesAllThreeSides() {
    String text =
        "head\n"
            + "<<<<<<< local\n"
            + "mine\n"
            + "||||||| base\n"
            + "original\n"
            + "=======\n"
            + "theirs\n"
            + ">>>>>>> remote\n"
            + "tail\n";

    MergeConflict conflict = ConflictMarkers.parse("a.js", text);

    assertEquals("a.js", conflict.path());
    assertEquals(1, conflict.markers().size());
    ConflictSpan span = conflict.markers().get(0);
    assertEquals("mine\n", span.local());
    assertEquals("original\n", span.base());
    assertEquals("theirs\n", span.remote());
  }

  @Test
  void parse_plainStyle_hasNoBase() {
    String text = "<<<<<<< HEAD\na\n=======\nb\n>>>>>>> other\n<<<<<<< HEAD\nc\n=======\nd\n>>>>>>> other\n";

    MergeConflict conflict = ConflictMarkers.parse("b.js", text);

    assertEquals(2, conflict.markers().size());
    assertNull(conflict.markers().get(1).base());
    assertEquals("d\n", conflict.markers().get(1).remote());
  }

  @Test
  void containsMarkers_onlyMatchesWholeMarkerLines() {
    assertTrue(ConflictMarkers.containsMarkers("x\n<<<<<<< local\ny\n"));
    assertFalse(ConflictMarkers.containsMarkers("const s = '<<<<<<< not at line start';"));
    assertFalse(ConflictMarkers.containsMarkers("======="));
    assertFalse(ConflictMarkers.containsMarkers(null));
  }
}

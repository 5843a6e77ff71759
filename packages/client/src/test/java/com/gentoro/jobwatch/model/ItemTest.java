package com.gentoro.jobwatch.model;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ItemTest {

  @Test
  @DisplayName("a terminal update freezes the item until reset")
  void terminalFreezes() {
    var item = Item.pending(0, "a.mp4");

    assertTrue(item.update(ItemStatus.ERROR, 35, "encode", true));
    assertFalse(item.update(ItemStatus.PROCESSING, 50, "encode", false));
    assertEquals(ItemStatus.ERROR, item.status());
    assertEquals(35, item.progress());

    item.reset();
    assertEquals(ItemStatus.PENDING, item.status());
    assertEquals(0, item.progress());
    assertFalse(item.isTerminalReached());
  }

  @Test
  @DisplayName("progress is clamped and unchanged values report no change")
  void clampsAndDetectsChange() {
    var item = Item.pending(3, "b.mp4");

    assertTrue(item.update(ItemStatus.PROCESSING, 140, null, false));
    assertEquals(100, item.progress());
    assertEquals("", item.stage());
    assertFalse(item.update(ItemStatus.PROCESSING, 100, "", false));
    assertTrue(item.update(ItemStatus.PROCESSING, -5, "", false));
    assertEquals(0, item.progress());
  }

  @Test
  @DisplayName("items need a valid index and a path")
  void validation() {
    assertThrows(IllegalArgumentException.class, () -> Item.pending(-1, "x"));
    assertThrows(NullPointerException.class, () -> Item.pending(0, null));
  }
}

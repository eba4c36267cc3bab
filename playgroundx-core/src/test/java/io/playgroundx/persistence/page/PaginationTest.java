package io.playgroundx.persistence.page;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class PaginationTest {
  private static final LinkBuilder LINKS = (page, size) -> "http://localhost/user?page=" + page + "&size=" + size;

  @Test
  void totalPages_isCeilingOfTotalOverSize() {
    assertEquals(3, Pagination.computeMeta(1, 5, 12).totalPages());
    assertEquals(2, Pagination.computeMeta(1, 5, 10).totalPages());
    assertEquals(1, Pagination.computeMeta(1, 5, 1).totalPages());
    assertEquals(0, Pagination.computeMeta(1, 5, 0).totalPages());
  }

  @Test
  void nonPositiveSize_collapsesToSinglePage() {
    assertEquals(1, Pagination.computeMeta(1, 0, 7).totalPages());
    assertEquals(0, Pagination.computeMeta(1, 0, 0).totalPages());
  }

  @Test
  void meta_carriesRequestAndTotals() {
    PaginationMeta m = Pagination.computeMeta(2, 5, 12);
    assertEquals(new PaginationMeta(2, 5, 12, 3), m);
  }

  @Test
  void firstPage_hasNextButNoPrev() {
    LinksMeta l = Pagination.generateLinks(LINKS, 1, 5, 3);
    assertEquals("http://localhost/user?page=1&size=5", l.self());
    assertEquals("http://localhost/user?page=2&size=5", l.next());
    assertNull(l.prev());
  }

  @Test
  void lastPage_hasPrevButNoNext() {
    LinksMeta l = Pagination.generateLinks(LINKS, 3, 5, 3);
    assertNull(l.next());
    assertEquals("http://localhost/user?page=2&size=5", l.prev());
  }

  @Test
  void pageBeyondTotal_hasNoNext() {
    LinksMeta l = Pagination.generateLinks(LINKS, 9, 5, 3);
    assertEquals("http://localhost/user?page=9&size=5", l.self());
    assertNull(l.next());
    assertNotNull(l.prev());
  }

  @Test
  void singlePage_hasOnlySelf() {
    LinksMeta l = Pagination.generateLinks(LINKS, Pagination.computeMeta(1, 5, 4));
    assertNotNull(l.self());
    assertNull(l.next());
    assertNull(l.prev());
  }
}

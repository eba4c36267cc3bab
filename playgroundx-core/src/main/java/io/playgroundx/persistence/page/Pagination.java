package io.playgroundx.persistence.page;

import java.util.Objects;

/** Page arithmetic and navigation links for offset pagination. */
public final class Pagination {
  private Pagination() {}

  /**
   * {@code totalPages = ceil(totalRecords / size)}.\n
   * A non-positive size means "everything on one page": 1 when there are records, 0 otherwise.
   */
  public static PaginationMeta computeMeta(int page, int size, long totalRecords) {
    if (totalRecords < 0) throw new IllegalArgumentException("totalRecords must be >= 0");
    long totalPages;
    if (size > 0) totalPages = (totalRecords + size - 1) / size;
    else totalPages = totalRecords > 0 ? 1 : 0;
    return new PaginationMeta(page, size, totalRecords, totalPages);
  }

  /** {@code self} always; {@code next} iff page &lt; totalPages; {@code prev} iff page &gt; 1. */
  public static LinksMeta generateLinks(LinkBuilder links, int page, int size, long totalPages) {
    Objects.requireNonNull(links, "links");
    String self = links.build(page, size);
    String next = page < totalPages ? links.build(page + 1, size) : null;
    String prev = page > 1 ? links.build(page - 1, size) : null;
    return new LinksMeta(self, next, prev);
  }

  public static LinksMeta generateLinks(LinkBuilder links, PaginationMeta meta) {
    Objects.requireNonNull(meta, "meta");
    return generateLinks(links, meta.page(), meta.size(), meta.totalPages());
  }
}

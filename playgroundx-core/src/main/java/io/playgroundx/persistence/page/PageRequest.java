package io.playgroundx.persistence.page;

import io.playgroundx.persistence.ValidationException;

/** 1-indexed page request. */
public record PageRequest(int page, int size) {
  public static final int DEFAULT_PAGE = 1;
  public static final int DEFAULT_SIZE = 5;

  public PageRequest {
    if (page < 1) throw new ValidationException("page", "page must be >= 1 (got " + page + ")");
    if (size < 1) throw new ValidationException("size", "size must be >= 1 (got " + size + ")");
  }

  public static PageRequest of(int page, int size) { return new PageRequest(page, size); }

  public static PageRequest defaults() { return new PageRequest(DEFAULT_PAGE, DEFAULT_SIZE); }

  /** Rows to skip: {@code (page - 1) * size}. */
  public long offset() { return (long) (page - 1) * size; }
}

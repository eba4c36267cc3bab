package io.playgroundx.persistence.page;

/** Builds the absolute URL of one page of a listing endpoint. */
@FunctionalInterface
public interface LinkBuilder {
  String build(int page, int size);
}

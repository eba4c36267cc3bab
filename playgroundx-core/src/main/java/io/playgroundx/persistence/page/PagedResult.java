package io.playgroundx.persistence.page;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.playgroundx.persistence.mapping.Row;
import io.playgroundx.persistence.mapping.RowDecoder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Response envelope: one page of data plus optional pagination/link metadata.
 * <p>
 * An empty result never carries metadata.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PagedResult<T>(
    @JsonProperty("data") List<T> data,
    @JsonProperty("_metadata") Metadata metadata
) {
  private static final PagedResult<?> EMPTY = new PagedResult<>(List.of(), null);

  public PagedResult {
    data = data == null ? List.of() : List.copyOf(data);
    if (data.isEmpty()) metadata = null;
  }

  @SuppressWarnings("unchecked")
  public static <T> PagedResult<T> empty() { return (PagedResult<T>) EMPTY; }

  public static <T> PagedResult<T> of(List<T> data, Metadata metadata) { return new PagedResult<>(data, metadata); }

  public static <T> PagedResult<T> unpaged(List<T> data) { return new PagedResult<>(data, null); }

  @JsonIgnore
  public boolean isEmpty() { return data.isEmpty(); }

  @JsonIgnore
  public PaginationMeta pagination() { return metadata == null ? null : metadata.pagination(); }

  /** Converts each element, keeping metadata. */
  public <R> PagedResult<R> map(Function<? super T, ? extends R> fn) {
    Objects.requireNonNull(fn, "fn");
    List<R> out = new ArrayList<>(data.size());
    for (T t : data) out.add(fn.apply(t));
    return new PagedResult<>(out, metadata);
  }

  /** Attaches links when pagination metadata is present; otherwise returns this. */
  public PagedResult<T> withLinks(LinkBuilder links) {
    PaginationMeta p = pagination();
    if (p == null) return this;
    return new PagedResult<>(data, metadata.withLinks(Pagination.generateLinks(links, p)));
  }

  /** Typed decode of a raw row page. */
  public static <R> PagedResult<R> decode(PagedResult<Row> rows, RowDecoder<R> decoder) {
    Objects.requireNonNull(decoder, "decoder");
    return rows.map(decoder::decode);
  }
}

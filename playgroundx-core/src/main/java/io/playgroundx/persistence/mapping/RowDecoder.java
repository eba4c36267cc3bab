package io.playgroundx.persistence.mapping;

/**
 * Explicit, per-entity conversion of a {@link Row} into a typed value.
 * <p>
 * Implementations throw {@link io.playgroundx.persistence.ValidationException} naming the
 * first field that is missing or of the wrong type.
 */
@FunctionalInterface
public interface RowDecoder<T> {
  T decode(Row row);
}

package org.hypertrace.core.filter.service.api;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Holds the values bound to the {@code ?} placeholders of a compiled clause, keyed by their
 * zero-based position in the statement. Each position holds exactly one typed value.
 */
@EqualsAndHashCode
@ToString
public class Params {

  private final Map<Integer, Long> longParams;
  private final Map<Integer, String> stringParams;
  private final Map<Integer, Double> doubleParams;

  @EqualsAndHashCode.Exclude
  @ToString.Exclude
  private final int size;

  private Params(Builder builder) {
    this.longParams = Map.copyOf(builder.longParams);
    this.stringParams = Map.copyOf(builder.stringParams);
    this.doubleParams = Map.copyOf(builder.doubleParams);
    this.size = builder.nextIndex;
  }

  public static Params empty() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public int size() {
    return size;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  /** The value bound at the given position, whatever its type. */
  public Object getValue(int index) {
    for (Map<Integer, ?> typed :
        List.<Map<Integer, ?>>of(longParams, stringParams, doubleParams)) {
      Object value = typed.get(index);
      if (value != null) {
        return value;
      }
    }
    throw new IndexOutOfBoundsException("No param at index " + index + ", size " + size);
  }

  public static class Builder {
    private final Map<Integer, Long> longParams = new HashMap<>();
    private final Map<Integer, String> stringParams = new HashMap<>();
    private final Map<Integer, Double> doubleParams = new HashMap<>();
    private int nextIndex;

    private Builder() {}

    public Builder addLongParam(long paramValue) {
      longParams.put(nextIndex++, paramValue);
      return this;
    }

    public Builder addStringParam(String paramValue) {
      stringParams.put(nextIndex++, paramValue);
      return this;
    }

    public Builder addDoubleParam(double paramValue) {
      doubleParams.put(nextIndex++, paramValue);
      return this;
    }

    public Params build() {
      return new Params(this);
    }
  }
}

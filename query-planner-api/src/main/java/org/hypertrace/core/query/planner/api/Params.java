package org.hypertrace.core.query.planner.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Holds the params that need to be bound to a prepared statement, in the order of the statement's
 * placeholders
 */
public class Params {

  // Map of index to the corresponding param value
  private final Map<Integer, String> stringParams;
  private final Map<Integer, Long> longParams;
  private final int size;

  private Params(Map<Integer, String> stringParams, Map<Integer, Long> longParams, int size) {
    this.stringParams = Collections.unmodifiableMap(stringParams);
    this.longParams = Collections.unmodifiableMap(longParams);
    this.size = size;
  }

  public Map<Integer, String> getStringParams() {
    return stringParams;
  }

  public Map<Integer, Long> getLongParams() {
    return longParams;
  }

  public int size() {
    return size;
  }

  /** Returns the param values ordered by placeholder index. */
  public List<Object> getArguments() {
    List<Object> arguments = new ArrayList<>(size);
    for (int index = 0; index < size; index++) {
      if (stringParams.containsKey(index)) {
        arguments.add(stringParams.get(index));
      } else {
        arguments.add(longParams.get(index));
      }
    }
    return Collections.unmodifiableList(arguments);
  }

  @Override
  public String toString() {
    return getArguments().toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    Params params = (Params) o;

    if (size != params.size) {
      return false;
    }
    if (!stringParams.equals(params.stringParams)) {
      return false;
    }
    return longParams.equals(params.longParams);
  }

  @Override
  public int hashCode() {
    int result = stringParams.hashCode();
    result = 31 * result + longParams.hashCode();
    result = 31 * result + size;
    return result;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {

    private int nextIndex;
    private final Map<Integer, String> stringParams;
    private final Map<Integer, Long> longParams;

    private Builder() {
      nextIndex = 0;
      stringParams = new HashMap<>();
      longParams = new HashMap<>();
    }

    public Builder addStringParam(String paramValue) {
      stringParams.put(nextIndex++, paramValue);
      return this;
    }

    public Builder addLongParam(long paramValue) {
      longParams.put(nextIndex++, paramValue);
      return this;
    }

    public Params build() {
      return new Params(new HashMap<>(stringParams), new HashMap<>(longParams), nextIndex);
    }
  }
}

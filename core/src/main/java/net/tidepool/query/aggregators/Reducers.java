// This file is part of Tidepool.
// Copyright (C) 2018  The Tidepool Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.tidepool.query.aggregators;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

/**
 * Utility class that provides the common reducers. Every factory takes the
 * {@link ValueFilter} applied to the values before reduction and the no-arg
 * variants use {@link ValueFilter#IGNORE_MISSING}.
 * <p>
 * Numeric reducers skip values that are not numbers (e.g. strings), return
 * null if a missing value made it through the filter and return null when
 * no number is left.
 * 
 * @since 1.0
 */
public final class Reducers {

  /** Sum of the values. */
  public static final Reducer SUM = sum(ValueFilter.IGNORE_MISSING);
  
  /** Mean of the values. */
  public static final Reducer AVG = avg(ValueFilter.IGNORE_MISSING);
  
  /** Largest value. */
  public static final Reducer MAX = max(ValueFilter.IGNORE_MISSING);
  
  /** Smallest value. */
  public static final Reducer MIN = min(ValueFilter.IGNORE_MISSING);
  
  /** Number of values. */
  public static final Reducer COUNT = count(ValueFilter.IGNORE_MISSING);
  
  /** First value. */
  public static final Reducer FIRST = first(ValueFilter.IGNORE_MISSING);
  
  /** Last value. */
  public static final Reducer LAST = last(ValueFilter.IGNORE_MISSING);
  
  /** Median of the values, the mean of the middle two for even counts. */
  public static final Reducer MEDIAN = median(ValueFilter.IGNORE_MISSING);
  
  /** Population standard deviation. */
  public static final Reducer STDEV = stdev(ValueFilter.IGNORE_MISSING);
  
  /** Largest minus smallest value. */
  public static final Reducer DIFFERENCE = 
      difference(ValueFilter.IGNORE_MISSING);
  
  /** The value if all values are equal, null otherwise. */
  public static final Reducer KEEP = keep(ValueFilter.IGNORE_MISSING);

  /** Maps a reducer name to its instance. */
  private static final Map<String, Reducer> REDUCERS = 
      ImmutableMap.<String, Reducer>builder()
        .put("sum", SUM)
        .put("avg", AVG)
        .put("mean", AVG)
        .put("max", MAX)
        .put("min", MIN)
        .put("count", COUNT)
        .put("first", FIRST)
        .put("last", LAST)
        .put("median", MEDIAN)
        .put("stdev", STDEV)
        .put("difference", DIFFERENCE)
        .put("keep", KEEP)
        .put("p50", percentile(50, PercentileInterpolation.LINEAR, 
            ValueFilter.IGNORE_MISSING))
        .put("p75", percentile(75, PercentileInterpolation.LINEAR, 
            ValueFilter.IGNORE_MISSING))
        .put("p90", percentile(90, PercentileInterpolation.LINEAR, 
            ValueFilter.IGNORE_MISSING))
        .put("p95", percentile(95, PercentileInterpolation.LINEAR, 
            ValueFilter.IGNORE_MISSING))
        .put("p99", percentile(99, PercentileInterpolation.LINEAR, 
            ValueFilter.IGNORE_MISSING))
        .build();

  private Reducers() {
    // Static only
  }

  /**
   * Returns the reducer with the given name.
   * @param name The name of the reducer, e.g. "sum" or "p95".
   * @return The reducer.
   * @throws IllegalArgumentException if the name was null, empty or 
   * unknown.
   */
  public static Reducer get(final String name) {
    if (Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("Reducer name cannot be null or "
          + "empty.");
    }
    final Reducer reducer = REDUCERS.get(name.toLowerCase());
    if (reducer == null) {
      throw new IllegalArgumentException("No such reducer: " + name);
    }
    return reducer;
  }

  /** @return The names of the registered reducers. */
  public static Iterable<String> names() {
    return REDUCERS.keySet();
  }

  public static Reducer sum(final ValueFilter filter) {
    return new Reducer() {
      @Override
      public Object reduce(final List<Object> values) {
        final double[] numbers = numbers(filter, values);
        if (numbers == null) {
          return null;
        }
        double sum = 0;
        for (final double n : numbers) {
          sum += n;
        }
        return sum;
      }
    };
  }

  public static Reducer avg(final ValueFilter filter) {
    return new Reducer() {
      @Override
      public Object reduce(final List<Object> values) {
        final double[] numbers = numbers(filter, values);
        if (numbers == null) {
          return null;
        }
        double sum = 0;
        for (final double n : numbers) {
          sum += n;
        }
        return sum / numbers.length;
      }
    };
  }

  public static Reducer max(final ValueFilter filter) {
    return new Reducer() {
      @Override
      public Object reduce(final List<Object> values) {
        final double[] numbers = numbers(filter, values);
        if (numbers == null) {
          return null;
        }
        double max = numbers[0];
        for (final double n : numbers) {
          max = Math.max(max, n);
        }
        return max;
      }
    };
  }

  public static Reducer min(final ValueFilter filter) {
    return new Reducer() {
      @Override
      public Object reduce(final List<Object> values) {
        final double[] numbers = numbers(filter, values);
        if (numbers == null) {
          return null;
        }
        double min = numbers[0];
        for (final double n : numbers) {
          min = Math.min(min, n);
        }
        return min;
      }
    };
  }

  /**
   * Counts the values surviving the filter, missing ones included when the
   * filter keeps them.
   * @param filter The non-null filter.
   * @return The reducer, returning a long.
   */
  public static Reducer count(final ValueFilter filter) {
    return new Reducer() {
      @Override
      public Object reduce(final List<Object> values) {
        final List<Object> filtered = filter.apply(values);
        if (filtered == null) {
          return null;
        }
        return (long) filtered.size();
      }
    };
  }

  /**
   * @param filter The non-null filter.
   * @return A reducer returning the first value after filtering, whatever
   * its type.
   */
  public static Reducer first(final ValueFilter filter) {
    return new Reducer() {
      @Override
      public Object reduce(final List<Object> values) {
        final List<Object> filtered = filter.apply(values);
        if (filtered == null || filtered.isEmpty()) {
          return null;
        }
        return filtered.get(0);
      }
    };
  }

  /**
   * @param filter The non-null filter.
   * @return A reducer returning the last value after filtering, whatever
   * its type.
   */
  public static Reducer last(final ValueFilter filter) {
    return new Reducer() {
      @Override
      public Object reduce(final List<Object> values) {
        final List<Object> filtered = filter.apply(values);
        if (filtered == null || filtered.isEmpty()) {
          return null;
        }
        return filtered.get(filtered.size() - 1);
      }
    };
  }

  public static Reducer median(final ValueFilter filter) {
    return new Reducer() {
      @Override
      public Object reduce(final List<Object> values) {
        final double[] numbers = numbers(filter, values);
        if (numbers == null) {
          return null;
        }
        return new Percentile(50)
            .withEstimationType(EstimationType.R_7)
            .evaluate(numbers);
      }
    };
  }

  public static Reducer stdev(final ValueFilter filter) {
    return new Reducer() {
      @Override
      public Object reduce(final List<Object> values) {
        final double[] numbers = numbers(filter, values);
        if (numbers == null) {
          return null;
        }
        // population, not sample, deviation
        return new StandardDeviation(false).evaluate(numbers);
      }
    };
  }

  public static Reducer difference(final ValueFilter filter) {
    return new Reducer() {
      @Override
      public Object reduce(final List<Object> values) {
        final double[] numbers = numbers(filter, values);
        if (numbers == null) {
          return null;
        }
        double min = numbers[0];
        double max = numbers[0];
        for (final double n : numbers) {
          min = Math.min(min, n);
          max = Math.max(max, n);
        }
        return max - min;
      }
    };
  }

  /**
   * @param filter The non-null filter.
   * @return A reducer returning the common value when every value after
   * filtering is equal and null otherwise.
   */
  public static Reducer keep(final ValueFilter filter) {
    return new Reducer() {
      @Override
      public Object reduce(final List<Object> values) {
        final List<Object> filtered = filter.apply(values);
        if (filtered == null || filtered.isEmpty()) {
          return null;
        }
        final Object first = filtered.get(0);
        for (final Object value : filtered) {
          if (!Objects.equal(first, value)) {
            return null;
          }
        }
        return first;
      }
    };
  }

  /**
   * Computes a percentile the way numpy does: the values are sorted, the
   * position {@code (n - 1) * q / 100} is computed and the result 
   * interpolated between the two bracketing values.
   * @param q The percentile from 0 to 100 inclusive.
   * @param interpolation The non-null interpolation mode.
   * @param filter The non-null filter.
   * @return The reducer.
   * @throws IllegalArgumentException if q was out of range.
   */
  public static Reducer percentile(final double q, 
                                   final PercentileInterpolation interpolation,
                                   final ValueFilter filter) {
    if (q < 0 || q > 100 || Double.isNaN(q)) {
      throw new IllegalArgumentException("Percentile must be between 0 and "
          + "100 inclusive: " + q);
    }
    if (interpolation == null) {
      throw new IllegalArgumentException("Interpolation cannot be null.");
    }
    return new Reducer() {
      @Override
      public Object reduce(final List<Object> values) {
        final double[] numbers = numbers(filter, values);
        if (numbers == null) {
          return null;
        }
        Arrays.sort(numbers);
        return percentile(numbers, q, interpolation);
      }
    };
  }

  /**
   * Computes a percentile over sorted values.
   * @param sorted A non-empty, sorted array.
   * @param q The percentile from 0 to 100.
   * @param interpolation The interpolation mode.
   * @return The percentile.
   */
  static double percentile(final double[] sorted, 
                           final double q, 
                           final PercentileInterpolation interpolation) {
    final int size = sorted.length;
    if (size == 1 || q == 0) {
      return sorted[0];
    }
    if (q == 100) {
      return sorted[size - 1];
    }
    final double position = (size - 1) * q / 100;
    final int index = (int) Math.floor(position);
    final double fraction = position - index;
    if (index + 1 >= size) {
      return sorted[size - 1];
    }
    return interpolation.interpolate(sorted[index], sorted[index + 1], 
        fraction);
  }

  /**
   * Filters the values and extracts the numbers.
   * @param filter The filter to apply first.
   * @param values The raw values.
   * @return The numbers or null if the filter nulled the reduction, a 
   * missing value remained or no number was left.
   */
  static double[] numbers(final ValueFilter filter, 
                          final List<Object> values) {
    final List<Object> filtered = filter.apply(values);
    if (filtered == null) {
      return null;
    }
    final double[] numbers = new double[filtered.size()];
    int count = 0;
    for (final Object value : filtered) {
      if (!ValueFilter.isValid(value)) {
        return null;
      }
      if (value instanceof Number) {
        numbers[count++] = ((Number) value).doubleValue();
      }
    }
    if (count == 0) {
      return null;
    }
    return count == numbers.length ? numbers : Arrays.copyOf(numbers, count);
  }
}

/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.solver.constraint;

import java.util.Arrays;
import java.util.Locale;

/** Score of a partial or complete solution: a vector of counters, compared
 * lexicographically. Lower is better.
 *
 * <p>Scores are immutable. */
public final class Score implements Comparable<Score> {
  public static final Score ZERO = new Score(new int[Kind.values().length]);

  private final int[] values;

  private Score(int[] values) {
    this.values = values;
  }

  /** Returns the value of a counter. */
  public int get(Kind kind) {
    return values[kind.ordinal()];
  }

  /** Returns a score with one counter incremented. */
  public Score plus(Kind kind) {
    final int[] values2 = values.clone();
    ++values2[kind.ordinal()];
    return new Score(values2);
  }

  public boolean isZero() {
    return equals(ZERO);
  }

  @Override public int compareTo(Score o) {
    return Arrays.compare(values, o.values);
  }

  @Override public int hashCode() {
    return Arrays.hashCode(values);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Score
        && Arrays.equals(values, ((Score) o).values);
  }

  @Override public String toString() {
    final StringBuilder buf = new StringBuilder("(");
    for (Kind kind : Kind.values()) {
      if (get(kind) != 0) {
        buf.append(buf.length() > 1 ? ", " : "")
            .append(kind.name().toLowerCase(Locale.ROOT))
            .append(' ')
            .append(get(kind));
      }
    }
    return buf.append(')').toString();
  }

  /** Component of a score, most significant first. */
  public enum Kind {
    /** A fix was applied to recover from an error. */
    FIX,
    /** A literal was given a type other than its protocol's default. */
    NON_DEFAULT_LITERAL,
    /** A value was wrapped in an optional. */
    VALUE_TO_OPTIONAL,
    /** A value was converted to an existential. */
    EXISTENTIAL_CONVERSION,
    /** A class instance was converted to its superclass. */
    UPCAST,
    /** The solver chose a disjunct that was not favored. */
    UNFAVORED_CHOICE
  }
}

// End Score.java

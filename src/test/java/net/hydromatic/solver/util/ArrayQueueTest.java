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
package net.hydromatic.solver.util;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsNull.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link ArrayQueue}. */
public class ArrayQueueTest {
  @Test void testFifo() {
    final ArrayQueue<String> q = new ArrayQueue<>();
    assertThat(q.isEmpty(), is(true));
    assertThat(q.poll(), nullValue());
    q.add("a");
    q.add("b");
    q.add("c");
    assertThat(q.size(), is(3));
    assertThat(q.toString(), is("[a, b, c]"));
    assertThat(q.poll(), is("a"));
    q.add("d");
    assertThat(q.asList(), is(ImmutableList.of("b", "c", "d")));
    assertThat(q.asList().get(2), is("d"));
    assertThrows(IndexOutOfBoundsException.class, () -> q.asList().get(3));
  }

  /** Adds more elements than the initial capacity while the head is not at
   * the start of the array. */
  @Test void testGrowWhenWrapped() {
    final ArrayQueue<Integer> q = new ArrayQueue<>();
    for (int i = 0; i < 10; i++) {
      q.add(i);
    }
    for (int i = 0; i < 8; i++) {
      assertThat(q.poll(), is(i));
    }
    for (int i = 10; i < 50; i++) {
      q.add(i);
    }
    assertThat(q.size(), is(42));
    final List<Integer> list = new ArrayList<>();
    q.forEach(list::add);
    assertThat(list.get(0), is(8));
    assertThat(list.get(41), is(49));
    for (int i = 8; i < 50; i++) {
      assertThat(q.poll(), is(i));
    }
    assertThat(q.isEmpty(), is(true));
  }

  @Test void testClear() {
    final ArrayQueue<String> q = new ArrayQueue<>();
    q.add("a");
    q.add("b");
    assertThat(q.poll(), is("a"));
    q.clear();
    assertThat(q.size(), is(0));
    assertThat(q.asList().isEmpty(), is(true));
    q.add("e");
    assertThat(q.poll(), is("e"));
    assertThat(q.isEmpty(), is(true));
  }
}

// End ArrayQueueTest.java

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

import static java.util.Objects.requireNonNull;

import java.util.AbstractList;
import java.util.List;
import java.util.function.Consumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * First-in, first-out queue backed by a circular array.
 *
 * <p>{@link #poll} and {@link #add} are O(1). The constraint system uses it
 * as its work list of active constraints.
 *
 * @param <E> Element type
 */
public class ArrayQueue<E> {
  private @Nullable Object[] elements;
  private int start;
  private int size;

  /** Creates an empty ArrayQueue. */
  public ArrayQueue() {
    elements = new Object[16];
  }

  @Override public String toString() {
    return asList().toString();
  }

  /** Removes the element at the head of this queue, or returns null. */
  public @Nullable E poll() {
    if (size == 0) {
      return null;
    }
    final E e = elementAt(start);
    elements[start] = null;
    start = (start + 1) % elements.length;
    --size;
    return e;
  }

  /** Returns the number of elements in this queue. */
  public int size() {
    return size;
  }

  /** Returns whether this queue is empty. */
  public boolean isEmpty() {
    return size == 0;
  }

  private E get(int i) {
    if (i < 0 || i >= size) {
      throw new IndexOutOfBoundsException();
    }
    return elementAt((start + i) % elements.length);
  }

  /** Adds an element to the tail. */
  public void add(E e) {
    requireNonNull(e);
    if (size == elements.length) {
      grow();
    }
    elements[(start + size) % elements.length] = e;
    ++size;
  }

  /** Removes all elements. */
  public void clear() {
    while (poll() != null) {
      // drain
    }
    start = 0;
  }

  /** Doubles the capacity, moving the elements to the front of the new
   * array. */
  private void grow() {
    final Object[] newElements = new Object[elements.length * 2];
    for (int i = 0; i < size; i++) {
      newElements[i] = elements[(start + i) % elements.length];
    }
    elements = newElements;
    start = 0;
  }

  @SuppressWarnings("unchecked")
  private E elementAt(int k) {
    return (E) requireNonNull(elements[k]);
  }

  /** Returns a read-only view of the contents as a list. */
  public List<E> asList() {
    return new AbstractList<E>() {
      @Override public int size() {
        return ArrayQueue.this.size();
      }

      @Override public E get(int index) {
        return ArrayQueue.this.get(index);
      }
    };
  }

  /** Calls a consumer with each element, in order. */
  public void forEach(Consumer<? super E> consumer) {
    for (int i = 0; i < size; i++) {
      consumer.accept(get(i));
    }
  }
}

// End ArrayQueue.java

/*
 * Copyright 2010 Google Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package constrainedinput;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.primitives.Ints;

import java.util.Arrays;

/**
 * The address of a node in a derivation tree: the sequence of child indices
 * leading to it from the root. Paths are ordered lexicographically, so a node
 * precedes all of its descendants and sorting paths yields pre-order.
 */
public final class Path implements Comparable<Path> {
  public static final Path ROOT = new Path(new int[0]);

  private final int[] indices;

  private Path(int[] indices) {
    this.indices = indices;
  }

  public static Path of(int... indices) {
    return indices.length == 0 ? ROOT : new Path(indices.clone());
  }

  public int length() {
    return indices.length;
  }

  public int get(int i) {
    return indices[i];
  }

  public boolean isRoot() {
    return indices.length == 0;
  }

  /** Returns the path of the index-th child of this path's node. */
  public Path child(int index) {
    int[] extended = Arrays.copyOf(indices, indices.length + 1);
    extended[indices.length] = index;
    return new Path(extended);
  }

  public Path parent() {
    Preconditions.checkState(!isRoot(), "The root has no parent");
    return new Path(Arrays.copyOf(indices, indices.length - 1));
  }

  /** Returns the first length indices. */
  public Path prefix(int length) {
    return length == 0 ? ROOT : new Path(Arrays.copyOf(indices, length));
  }

  /** Appends other to this path. */
  public Path concat(Path other) {
    return new Path(Ints.concat(indices, other.indices));
  }

  /** Whether this path equals other or leads to one of its ancestors. */
  public boolean isPrefixOf(Path other) {
    if (indices.length > other.indices.length) {
      return false;
    }
    for (int i = 0; i < indices.length; i++) {
      if (indices[i] != other.indices[i]) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns whether the subtree at this path lies entirely to the left of the
   * subtree at other, i.e. neither contains the other and this one comes first
   * in pre-order.
   */
  public boolean isBefore(Path other) {
    int common = Math.min(indices.length, other.indices.length);
    for (int i = 0; i < common; i++) {
      if (indices[i] != other.indices[i]) {
        return indices[i] < other.indices[i];
      }
    }
    return false;
  }

  @Override
  public int compareTo(Path other) {
    int common = Math.min(indices.length, other.indices.length);
    for (int i = 0; i < common; i++) {
      if (indices[i] != other.indices[i]) {
        return indices[i] < other.indices[i] ? -1 : 1;
      }
    }
    return Integer.compare(indices.length, other.indices.length);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Path && Arrays.equals(indices, ((Path) obj).indices);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(indices);
  }

  @Override
  public String toString() {
    return "(" + Joiner.on(", ").join(Ints.asList(indices)) + ")";
  }
}

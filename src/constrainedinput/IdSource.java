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

/**
 * Hands out node ids and fresh-name suffixes in increasing order. A solver
 * state records the next unused value, and every transition starts a new
 * source from there, so ids never depend on anything global.
 */
public final class IdSource {
  private long next;

  private IdSource(long next) {
    this.next = next;
  }

  public static IdSource startingAt(long next) {
    return new IdSource(next);
  }

  public long next() {
    return next++;
  }

  /** Returns the value the next call to {@link #next()} will hand out. */
  public long peek() {
    return next;
  }
}

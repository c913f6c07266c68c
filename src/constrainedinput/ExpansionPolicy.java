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

/** How the default expander picks alternatives for unconstrained leaves. */
public enum ExpansionPolicy {
  /** Always the first alternative with the fewest expansions to close. */
  SHORTEST_FIRST,
  /**
   * A random alternative, drawn from a generator seeded with the configured
   * seed, among those that still fit the remaining expansion budget.
   */
  RANDOM
}

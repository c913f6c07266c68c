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

import com.google.common.base.Charsets;
import com.google.common.io.Files;

import java.io.File;
import java.io.IOException;

/**
 * Loads grammar and constraint files relative to a base directory.
 *
 * @author elnatan@google.com (Elnatan Reisner)
 */
public class FileLoader {
  private final String basePath;

  /** Creates a FileLoader that resolves names against the current directory. */
  public FileLoader() {
    this(".");
  }

  /**
   * @param basePath prepended to every relative file name
   */
  public FileLoader(String basePath) {
    this.basePath = new File(basePath).getAbsolutePath() + File.separator;
  }

  /** Reads a whole UTF-8 file. */
  public String toString(String filename) throws IOException {
    return Files.asCharSource(new File(getPath(filename)), Charsets.UTF_8)
        .read();
  }

  /**
   * @throws GrammarException if the file is not a well-formed grammar
   */
  public Grammar loadGrammar(String filename) throws IOException {
    return GrammarFileParser.parse(toString(filename));
  }

  /**
   * @return filename if it is absolute, otherwise filename resolved against
   *         the base path
   */
  public String getPath(String filename) {
    File file = new File(filename);
    if (file.isAbsolute()) {
      return filename;
    }
    return basePath + filename;
  }
}

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

package symbolicchecker.ir;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A range in a specification file, as reported by the front end. Lines and
 * columns start at 1.
 *
 * @author The tla-symbolic-checker Authors
 */
public final class SourceLocation {
  private final String file;
  private final int startLine;
  private final int startColumn;
  private final int endLine;
  private final int endColumn;

  public SourceLocation(String file, int startLine, int startColumn,
      int endLine, int endColumn) {
    Preconditions.checkNotNull(file);
    Preconditions.checkArgument(startLine >= 1 && endLine >= startLine,
        "bad line range %s-%s", startLine, endLine);
    this.file = file;
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  public String getFile() {
    return file;
  }

  public int getStartLine() {
    return startLine;
  }

  public int getStartColumn() {
    return startColumn;
  }

  public int getEndLine() {
    return endLine;
  }

  public int getEndColumn() {
    return endColumn;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof SourceLocation)) {
      return false;
    }
    SourceLocation other = (SourceLocation) obj;
    return file.equals(other.file) && startLine == other.startLine
        && startColumn == other.startColumn && endLine == other.endLine
        && endColumn == other.endColumn;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(file, startLine, startColumn, endLine, endColumn);
  }

  /** Formats as {@code file:line:col-line:col}. */
  @Override
  public String toString() {
    return String.format("%s:%d:%d-%d:%d", file, startLine, startColumn,
        endLine, endColumn);
  }
}

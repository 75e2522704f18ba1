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

import java.util.concurrent.atomic.AtomicLong;

/**
 * A node of the typed specification AST. Nodes are immutable and carry a
 * process-unique identifier, an optional type tag and an optional source
 * location. The core never mutates the trees it receives.
 *
 * @author The tla-symbolic-checker Authors
 */
public abstract class TlaEx {
  /** Used to give unique ids */
  private static final AtomicLong counter = new AtomicLong();

  private final long uid;
  private final CellT typeTag;
  private final SourceLocation location;

  protected TlaEx(CellT typeTag, SourceLocation location) {
    this.uid = counter.getAndIncrement();
    this.typeTag = typeTag == null ? CellT.unknown() : typeTag;
    this.location = location;
  }

  public long getUid() {
    return uid;
  }

  public CellT getTypeTag() {
    return typeTag;
  }

  /** @return the source range of this node, or null if none was given */
  public SourceLocation getLocation() {
    return location;
  }

  public abstract <T> T accept(Visitor<T> visitor);

  /**
   * A visitor over the three node shapes.
   *
   * @param <T> the result type
   */
  public interface Visitor<T> {
    T visitName(NameEx ex);

    T visitVal(ValEx ex);

    T visitOper(OperEx ex);
  }
}

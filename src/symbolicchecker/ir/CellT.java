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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;

import java.util.Map;

/**
 * The type of a specification value. It serves both as the type tag of an
 * expression node and as the type of the arena cell standing for the value.
 * <p>
 * Instances are obtained through the static factories; two types are equal iff
 * their signatures are equal.
 *
 * @author The tla-symbolic-checker Authors
 */
public abstract class CellT {
  private static final CellT BOOL = new BoolT();
  private static final CellT INT = new IntT();
  private static final CellT UNKNOWN = new UnknownT();

  private CellT() {}

  public static CellT bool() {
    return BOOL;
  }

  public static CellT integer() {
    return INT;
  }

  public static CellT unknown() {
    return UNKNOWN;
  }

  public static CellT finSet(CellT elemType) {
    return new FinSetT(elemType);
  }

  public static CellT fun(CellT argType, CellT resultType) {
    return new FunT(argType, resultType);
  }

  public static CellT record(Map<String, CellT> fields) {
    return new RecordT(ImmutableSortedMap.copyOf(fields));
  }

  /** A short textual form, unique per type. */
  public abstract String signature();

  public boolean isFinSet() {
    return false;
  }

  /**
   * @return the element type of a finite set
   * @throws IllegalStateException if this is not a set type
   */
  public CellT elemType() {
    throw new IllegalStateException(signature() + " is not a set type");
  }

  @Override
  public final boolean equals(Object obj) {
    return obj instanceof CellT
        && signature().equals(((CellT) obj).signature());
  }

  @Override
  public final int hashCode() {
    return signature().hashCode();
  }

  @Override
  public String toString() {
    return signature();
  }

  private static final class BoolT extends CellT {
    @Override
    public String signature() {
      return "Bool";
    }
  }

  private static final class IntT extends CellT {
    @Override
    public String signature() {
      return "Int";
    }
  }

  private static final class UnknownT extends CellT {
    @Override
    public String signature() {
      return "Unknown";
    }
  }

  private static final class FinSetT extends CellT {
    private final CellT elem;

    FinSetT(CellT elem) {
      this.elem = Preconditions.checkNotNull(elem);
    }

    @Override
    public boolean isFinSet() {
      return true;
    }

    @Override
    public CellT elemType() {
      return elem;
    }

    @Override
    public String signature() {
      return "Set(" + elem.signature() + ")";
    }
  }

  private static final class FunT extends CellT {
    private final CellT arg;
    private final CellT result;

    FunT(CellT arg, CellT result) {
      this.arg = Preconditions.checkNotNull(arg);
      this.result = Preconditions.checkNotNull(result);
    }

    @Override
    public String signature() {
      return "(" + arg.signature() + " -> " + result.signature() + ")";
    }
  }

  private static final class RecordT extends CellT {
    private final ImmutableSortedMap<String, CellT> fields;

    RecordT(ImmutableSortedMap<String, CellT> fields) {
      this.fields = fields;
    }

    @Override
    public String signature() {
      return "[" + Joiner.on(", ").withKeyValueSeparator(": ").join(fields)
          + "]";
    }
  }
}

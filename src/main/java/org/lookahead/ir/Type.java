/*
 * Copyright 2025 The Lookahead Authors
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

package org.lookahead.ir;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.stream.Collectors;

/**
 * The type of a Value. Types are immutable; integer, float, pointer and void types are canonical
 * (compare them with {@code equals} or {@code ==}), struct and array types compare structurally.
 */
public abstract class Type {

  public static final IntType I1 = new IntType(1);
  public static final IntType I8 = new IntType(8);
  public static final IntType I16 = new IntType(16);
  public static final IntType I32 = new IntType(32);
  public static final IntType I64 = new IntType(64);

  public static final FloatType FLOAT = new FloatType(32);
  public static final FloatType DOUBLE = new FloatType(64);

  /** All pointers share a single opaque type. */
  public static final Type PTR =
      new Type() {
        @Override
        public String toString() {
          return "ptr";
        }
      };

  public static final Type VOID =
      new Type() {
        @Override
        public String toString() {
          return "void";
        }
      };

  private Type() {}

  /** Returns the canonical integer type with the given number of bits. */
  public static IntType intType(int bits) {
    return switch (bits) {
      case 1 -> I1;
      case 8 -> I8;
      case 16 -> I16;
      case 32 -> I32;
      case 64 -> I64;
      default -> new IntType(bits);
    };
  }

  public static StructType struct(Type... fields) {
    return new StructType(ImmutableList.copyOf(fields));
  }

  public static ArrayType array(Type element, long count) {
    return new ArrayType(element, count);
  }

  public final boolean isInteger() {
    return this instanceof IntType;
  }

  public final boolean isPointer() {
    return this == PTR;
  }

  public final boolean isFloatingPoint() {
    return this instanceof FloatType;
  }

  public final boolean isVoid() {
    return this == VOID;
  }

  /** An integer type of any width from 1 to 1024 bits. */
  public static final class IntType extends Type {
    public final int bits;

    private IntType(int bits) {
      Preconditions.checkArgument(bits > 0 && bits <= 1024, "bad integer width %s", bits);
      this.bits = bits;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof IntType other && other.bits == bits;
    }

    @Override
    public int hashCode() {
      return bits;
    }

    @Override
    public String toString() {
      return "i" + bits;
    }
  }

  public static final class FloatType extends Type {
    public final int bits;

    private FloatType(int bits) {
      this.bits = bits;
    }

    @Override
    public String toString() {
      return bits == 32 ? "float" : "double";
    }
  }

  public static final class StructType extends Type {
    public final ImmutableList<Type> fields;

    private StructType(ImmutableList<Type> fields) {
      this.fields = fields;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof StructType other && other.fields.equals(fields);
    }

    @Override
    public int hashCode() {
      return fields.hashCode();
    }

    @Override
    public String toString() {
      return fields.stream().map(Object::toString).collect(Collectors.joining(", ", "{", "}"));
    }
  }

  public static final class ArrayType extends Type {
    public final Type element;
    public final long count;

    private ArrayType(Type element, long count) {
      Preconditions.checkArgument(count >= 0);
      this.element = element;
      this.count = count;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof ArrayType other
          && other.count == count
          && other.element.equals(element);
    }

    @Override
    public int hashCode() {
      return element.hashCode() * 31 + Long.hashCode(count);
    }

    @Override
    public String toString() {
      return "[" + count + " x " + element + "]";
    }
  }
}

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
import org.lookahead.ir.Type.ArrayType;
import org.lookahead.ir.Type.FloatType;
import org.lookahead.ir.Type.IntType;
import org.lookahead.ir.Type.StructType;

/**
 * A TypeLayout with natural alignment: integers are aligned to their size rounded up to a power of
 * two (capped at {@code maxAlignment}), structs are laid out in field order with padding.
 */
public final class DataLayout implements TypeLayout {

  /** 64-bit pointers, 16-byte maximum alignment. */
  public static final DataLayout LP64 = new DataLayout(8, 16);

  private final int pointerSize;
  private final int maxAlignment;

  public DataLayout(int pointerSize, int maxAlignment) {
    Preconditions.checkArgument(Integer.bitCount(pointerSize) == 1);
    Preconditions.checkArgument(Integer.bitCount(maxAlignment) == 1);
    this.pointerSize = pointerSize;
    this.maxAlignment = maxAlignment;
  }

  @Override
  public int pointerSize() {
    return pointerSize;
  }

  @Override
  public long storeSize(Type type) {
    if (type instanceof IntType it) {
      return (it.bits + 7) / 8;
    } else if (type instanceof FloatType ft) {
      return ft.bits / 8;
    } else if (type.isPointer()) {
      return pointerSize;
    } else if (type instanceof StructType || type instanceof ArrayType) {
      return allocSize(type);
    }
    Preconditions.checkArgument(!type.isVoid(), "void has no size");
    throw new AssertionError();
  }

  @Override
  public long allocSize(Type type) {
    if (type instanceof StructType st) {
      int n = st.fields.size();
      if (n == 0) {
        return 0;
      }
      long end = fieldOffset(st, n - 1) + allocSize(st.fields.get(n - 1));
      return alignTo(end, alignment(st));
    } else if (type instanceof ArrayType at) {
      return at.count * allocSize(at.element);
    }
    return alignTo(storeSize(type), alignment(type));
  }

  @Override
  public int alignment(Type type) {
    if (type instanceof StructType st) {
      int result = 1;
      for (Type field : st.fields) {
        result = Math.max(result, alignment(field));
      }
      return result;
    } else if (type instanceof ArrayType at) {
      return alignment(at.element);
    }
    long size = storeSize(type);
    int result = 1;
    while (result < size && result < maxAlignment) {
      result *= 2;
    }
    return result;
  }

  @Override
  public long fieldOffset(StructType struct, int field) {
    Preconditions.checkElementIndex(field, struct.fields.size());
    long offset = 0;
    for (int i = 0; ; i++) {
      Type fieldType = struct.fields.get(i);
      offset = alignTo(offset, alignment(fieldType));
      if (i == field) {
        return offset;
      }
      offset += allocSize(fieldType);
    }
  }

  private static long alignTo(long size, int alignment) {
    return (size + alignment - 1) & -(long) alignment;
  }
}

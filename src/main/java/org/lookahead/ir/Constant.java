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
import java.math.BigInteger;
import org.lookahead.ir.Type.IntType;

/**
 * A literal operand. Only integer constants and the null pointer are modelled; a constant pointer
 * to a global is represented by the GlobalVariable (or Function) itself.
 */
public abstract class Constant extends Value {

  public static final Int TRUE = new Int(Type.I1, BigInteger.ONE);
  public static final Int FALSE = new Int(Type.I1, BigInteger.ZERO);

  public static final Null NULL = new Null();

  private Constant(Type type) {
    super(type, "");
  }

  /** Returns an integer constant of the given type; {@code value} is truncated to fit. */
  public static Int of(IntType type, long value) {
    return of(type, BigInteger.valueOf(value));
  }

  /** Returns an integer constant of the given type; {@code value} is truncated to fit. */
  public static Int of(IntType type, BigInteger value) {
    if (type.bits == 1) {
      return value.testBit(0) ? TRUE : FALSE;
    }
    return new Int(type, value.and(mask(type.bits)));
  }

  public static Int of(boolean b) {
    return b ? TRUE : FALSE;
  }

  /** Returns the all-zero-bits constant of the given integer or pointer type. */
  public static Constant zero(Type type) {
    if (type.isPointer()) {
      return NULL;
    }
    Preconditions.checkArgument(type.isInteger(), "no zero constant of type %s", type);
    return of((IntType) type, 0);
  }

  /** True if this constant's bits are all zero (integer zero or the null pointer). */
  public abstract boolean isZero();

  /** True if every bit of this constant is set. */
  public boolean isAllOnes() {
    return false;
  }

  static BigInteger mask(int bits) {
    return BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
  }

  /**
   * An integer constant. The value is stored as the unsigned interpretation of its bits; use
   * {@link #signedValue} for the two's complement interpretation.
   */
  public static final class Int extends Constant {
    private final BigInteger bits;

    private Int(IntType type, BigInteger bits) {
      super(type);
      this.bits = bits;
    }

    public IntType intType() {
      return (IntType) type();
    }

    public int width() {
      return intType().bits;
    }

    public BigInteger unsignedValue() {
      return bits;
    }

    public BigInteger signedValue() {
      return bits.testBit(width() - 1) ? bits.subtract(BigInteger.ONE.shiftLeft(width())) : bits;
    }

    /** Returns the signed value; should only be called if {@link #width} is at most 64. */
    public long longValue() {
      Preconditions.checkState(width() <= 64);
      return signedValue().longValueExact();
    }

    @Override
    public boolean isZero() {
      return bits.signum() == 0;
    }

    @Override
    public boolean isAllOnes() {
      return bits.equals(mask(width()));
    }

    public boolean isMaxSigned() {
      return bits.equals(mask(width() - 1));
    }

    public boolean isMinSigned() {
      return bits.equals(BigInteger.ONE.shiftLeft(width() - 1));
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Int other && other.type().equals(type()) && other.bits.equals(bits);
    }

    @Override
    public int hashCode() {
      return bits.hashCode() * 31 + width();
    }

    @Override
    public String asOperand() {
      return width() == 1 ? (isZero() ? "false" : "true") : signedValue().toString();
    }
  }

  /** The null pointer. */
  public static final class Null extends Constant {
    private Null() {
      super(Type.PTR);
    }

    @Override
    public boolean isZero() {
      return true;
    }

    @Override
    public String asOperand() {
      return "null";
    }
  }
}

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

package org.lookahead.analysis;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.lookahead.ir.Constant;

/**
 * What is statically known about an instruction's result in one context. Every LatticeValue has
 * one of the following categories:
 *
 * <ul>
 *   <li>UNKNOWN: nothing is known yet; the value may still be refined.
 *   <li>OVERDEF: nothing useful can be known; the value will never change again.
 *   <li>SCALAR: the result is always the same constant.
 *   <li>POINTER: the result points into one of a bounded set of objects, each at a known or
 *       indeterminate offset.
 *   <li>RESOURCE: the result is a handle returned by a specific successful open call.
 *   <li>VARARG: the result points into a variadic argument frame.
 * </ul>
 *
 * <p>LatticeValues are immutable. Operations that combine two LatticeValues are defined on {@link
 * Joiner}.
 */
public interface LatticeValue {

  enum Category {
    UNKNOWN,
    OVERDEF,
    SCALAR,
    POINTER,
    RESOURCE,
    VARARG
  }

  Category category();

  default boolean isUnknown() {
    return category() == Category.UNKNOWN;
  }

  default boolean isOverdef() {
    return category() == Category.OVERDEF;
  }

  /**
   * Splits a multi-candidate value into single-candidate values; returns a singleton list for
   * everything else.
   */
  default ImmutableList<LatticeValue> members() {
    return ImmutableList.of(this);
  }

  /** Returns the constant if this is a Scalar, or null. */
  default @Nullable Constant constant() {
    return null;
  }

  LatticeValue UNKNOWN = new Marker(Category.UNKNOWN, "unknown");

  LatticeValue OVERDEF = new Marker(Category.OVERDEF, "overdef");

  static Scalar scalar(Constant value) {
    return new Scalar(value);
  }

  static PointerBase pointer(MemoryObject object, long offset) {
    return new PointerBase(ImmutableSet.of(new PointerTarget(object, offset)));
  }

  static PointerBase pointer(PointerTarget target) {
    return new PointerBase(ImmutableSet.of(target));
  }

  static Resource resource(ResourceHandle handle) {
    return new Resource(handle);
  }

  static VarArg varArg(VarArgSlot slot) {
    return new VarArg(slot);
  }

  /** The implementation of UNKNOWN and OVERDEF. */
  final class Marker implements LatticeValue {
    private final Category category;
    private final String name;

    private Marker(Category category, String name) {
      this.category = category;
      this.name = name;
    }

    @Override
    public Category category() {
      return category;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  final class Scalar implements LatticeValue {
    public final Constant value;

    private Scalar(Constant value) {
      this.value = value;
    }

    @Override
    public Category category() {
      return Category.SCALAR;
    }

    @Override
    public Constant constant() {
      return value;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Scalar other && other.value.equals(value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public String toString() {
      return value.asOperand();
    }
  }

  /** One or more candidate (object, offset) pairs. */
  final class PointerBase implements LatticeValue {
    public final ImmutableSet<PointerTarget> targets;

    private PointerBase(ImmutableSet<PointerTarget> targets) {
      Preconditions.checkArgument(!targets.isEmpty());
      this.targets = targets;
    }

    @Override
    public Category category() {
      return Category.POINTER;
    }

    /** Returns the only target, or null if there is more than one. */
    public @Nullable PointerTarget single() {
      return targets.size() == 1 ? targets.iterator().next() : null;
    }

    @Override
    public ImmutableList<LatticeValue> members() {
      if (targets.size() == 1) {
        return ImmutableList.of(this);
      }
      return targets.stream().map(LatticeValue::pointer).collect(ImmutableList.toImmutableList());
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof PointerBase other && other.targets.equals(targets);
    }

    @Override
    public int hashCode() {
      return targets.hashCode();
    }

    @Override
    public String toString() {
      return targets.stream().map(Object::toString).collect(Collectors.joining(", ", "ptr{", "}"));
    }
  }

  final class Resource implements LatticeValue {
    public final ResourceHandle handle;

    private Resource(ResourceHandle handle) {
      this.handle = handle;
    }

    @Override
    public Category category() {
      return Category.RESOURCE;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Resource other && other.handle.equals(handle);
    }

    @Override
    public int hashCode() {
      return handle.hashCode();
    }

    @Override
    public String toString() {
      return "fd{" + handle + "}";
    }
  }

  final class VarArg implements LatticeValue {
    public final VarArgSlot slot;

    private VarArg(VarArgSlot slot) {
      this.slot = slot;
    }

    @Override
    public Category category() {
      return Category.VARARG;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof VarArg other && other.slot.equals(slot);
    }

    @Override
    public int hashCode() {
      return slot.hashCode();
    }

    @Override
    public String toString() {
      return "vararg{" + slot + "}";
    }
  }

  /**
   * Computes joins. The public methods handle the cases that are common to all categories (equal
   * values, UNKNOWN, OVERDEF, and differing categories); {@link #joinSameCategory} handles the
   * rest.
   */
  class Joiner {
    /** Pointer-Base values with more candidates than this are Overdef. */
    public final int maxPointerTargets;

    public Joiner(int maxPointerTargets) {
      Preconditions.checkArgument(maxPointerTargets > 0);
      this.maxPointerTargets = maxPointerTargets;
    }

    /**
     * Returns the least value that is at least as general as both arguments. UNKNOWN is the
     * identity and OVERDEF absorbs everything.
     */
    public final LatticeValue join(LatticeValue x, LatticeValue y) {
      if (x.equals(y) || y.isUnknown()) {
        return x;
      } else if (x.isUnknown()) {
        return y;
      } else if (x.isOverdef() || y.isOverdef() || x.category() != y.category()) {
        return OVERDEF;
      }
      return joinSameCategory(x, y);
    }

    /** Called with two different values of the same category, neither UNKNOWN nor OVERDEF. */
    protected LatticeValue joinSameCategory(LatticeValue x, LatticeValue y) {
      if (x instanceof PointerBase px && y instanceof PointerBase py) {
        ImmutableSet<PointerTarget> union =
            ImmutableSet.<PointerTarget>builder().addAll(px.targets).addAll(py.targets).build();
        return (union.size() > maxPointerTargets) ? OVERDEF : new PointerBase(union);
      }
      // Scalars, resources and vararg slots each stand for a single value
      return OVERDEF;
    }
  }
}

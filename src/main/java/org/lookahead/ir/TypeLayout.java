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

/** Answers size, alignment and field-offset questions about types. */
public interface TypeLayout {

  /** The size of a pointer, in bytes. */
  int pointerSize();

  /** The number of bytes written by a store of a value of this type. */
  long storeSize(Type type);

  /**
   * The distance in bytes between consecutive elements of an array of this type, i.e. the store
   * size rounded up to the type's alignment.
   */
  long allocSize(Type type);

  /** The ABI alignment of the type, in bytes. */
  int alignment(Type type);

  /** The byte offset of the given field within a struct. */
  long fieldOffset(Type.StructType struct, int field);
}

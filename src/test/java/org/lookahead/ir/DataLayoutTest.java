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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.lookahead.ir.Type.StructType;

@RunWith(JUnit4.class)
public class DataLayoutTest {

  static final DataLayout LP64 = DataLayout.LP64;

  @Test
  public void scalars() {
    assertThat(LP64.storeSize(Type.I1)).isEqualTo(1);
    assertThat(LP64.storeSize(Type.I32)).isEqualTo(4);
    assertThat(LP64.alignment(Type.I64)).isEqualTo(8);
    assertThat(LP64.storeSize(Type.PTR)).isEqualTo(8);
    assertThat(LP64.storeSize(Type.intType(24))).isEqualTo(3);
    // Rounded up to the alignment
    assertThat(LP64.allocSize(Type.intType(24))).isEqualTo(4);
    assertThat(LP64.alignment(Type.intType(128))).isEqualTo(16);
    assertThat(LP64.storeSize(Type.DOUBLE)).isEqualTo(8);
  }

  @Test
  public void structFields() {
    StructType s = Type.struct(Type.I32, Type.I32, Type.I64);
    assertThat(LP64.fieldOffset(s, 0)).isEqualTo(0);
    assertThat(LP64.fieldOffset(s, 1)).isEqualTo(4);
    assertThat(LP64.fieldOffset(s, 2)).isEqualTo(8);
    assertThat(LP64.allocSize(s)).isEqualTo(16);
  }

  @Test
  public void structPadding() {
    StructType s = Type.struct(Type.I8, Type.I32, Type.I8);
    assertThat(LP64.fieldOffset(s, 1)).isEqualTo(4);
    assertThat(LP64.fieldOffset(s, 2)).isEqualTo(8);
    assertThat(LP64.alignment(s)).isEqualTo(4);
    assertThat(LP64.allocSize(s)).isEqualTo(12);
    StructType tail = Type.struct(Type.I64, Type.I8);
    assertThat(LP64.allocSize(tail)).isEqualTo(16);
    StructType nested = Type.struct(Type.I8, tail);
    assertThat(LP64.fieldOffset(nested, 1)).isEqualTo(8);
    assertThat(LP64.allocSize(nested)).isEqualTo(24);
  }

  @Test
  public void arrays() {
    Type a = Type.array(Type.I16, 3);
    assertThat(LP64.allocSize(a)).isEqualTo(6);
    assertThat(LP64.alignment(a)).isEqualTo(2);
    assertThat(LP64.allocSize(Type.array(Type.struct(Type.I64, Type.I8), 2))).isEqualTo(32);
  }

  @Test
  public void narrowPointers() {
    DataLayout ilp32 = new DataLayout(4, 4);
    assertThat(ilp32.pointerSize()).isEqualTo(4);
    assertThat(ilp32.storeSize(Type.PTR)).isEqualTo(4);
    assertThat(ilp32.alignment(Type.I64)).isEqualTo(4);
    assertThat(ilp32.fieldOffset(Type.struct(Type.I8, Type.I64), 1)).isEqualTo(4);
  }
}

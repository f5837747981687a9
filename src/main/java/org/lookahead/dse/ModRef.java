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

package org.lookahead.dse;

/** Whether a call may read (reference) or write (modify) a memory location. */
public enum ModRef {
  NO_MOD_REF(false, false),
  REF(true, false),
  MOD(false, true),
  MOD_REF(true, true);

  private final boolean ref;
  private final boolean mod;

  ModRef(boolean ref, boolean mod) {
    this.ref = ref;
    this.mod = mod;
  }

  public boolean isRef() {
    return ref;
  }

  public boolean isMod() {
    return mod;
  }
}

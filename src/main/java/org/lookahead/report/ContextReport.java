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

package org.lookahead.report;

import org.lookahead.analysis.Context;

/**
 * The instruction counts for one context.
 *
 * @param total the instructions evaluated in this context (excluding those in loops whose
 *     evaluation is handed to peel iterations)
 * @param eliminated how many of those would disappear if the context were actually duplicated
 */
public record ContextReport(Context context, int total, int eliminated) {

  /** The fraction of instructions eliminated, or 0 if there are none. */
  public double eliminatedFraction() {
    return total == 0 ? 0 : (double) eliminated / total;
  }
}

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
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.lookahead.ir.Block;
import org.lookahead.ir.Edge;
import org.lookahead.ir.Function;
import org.lookahead.ir.Loop;
import org.lookahead.ir.Module;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Tuning parameters for an analysis run. Immutable; create one with {@link #builder}. */
public final class AnalysisOptions {
  private static final Logger logger = LoggerFactory.getLogger(AnalysisOptions.class);

  public static final int DEFAULT_MAX_POINTER_TARGETS = 16;
  public static final int DEFAULT_MALLOC_ALIGNMENT = 16;
  public static final int DEFAULT_MAX_ITERATIONS = 64;

  public static final AnalysisOptions DEFAULTS = builder().build();

  /** Pointer-Base values with more candidates than this become Overdef. */
  public final int maxPointerTargets;

  /** The alignment guaranteed for memory returned by allocation functions. */
  public final int mallocAlignment;

  /** The iteration cap for loops that have no specific cap. */
  public final int defaultMaxIterations;

  private final ImmutableMap<Loop, Edge> optimisticEdges;
  private final ImmutableMap<Loop, Integer> iterationCaps;

  private AnalysisOptions(Builder builder) {
    this.maxPointerTargets = builder.maxPointerTargets;
    this.mallocAlignment = builder.mallocAlignment;
    this.defaultMaxIterations = builder.defaultMaxIterations;
    this.optimisticEdges = ImmutableMap.copyOf(builder.optimisticEdges);
    this.iterationCaps = ImmutableMap.copyOf(builder.iterationCaps);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** The edge assumed not taken in iterations of {@code loop} during the optimistic phase. */
  public @Nullable Edge optimisticEdge(Loop loop) {
    return optimisticEdges.get(loop);
  }

  /** The maximum number of iterations that may be peeled from {@code loop}. */
  public int maxIterations(Loop loop) {
    return iterationCaps.getOrDefault(loop, defaultMaxIterations);
  }

  /**
   * Parses command-line style flags:
   *
   * <ul>
   *   <li>{@code --int-optimistic-loop=f,from,to}: the edge from block {@code from} to block
   *       {@code to} of function {@code f} is the optimistic edge of the innermost loop containing
   *       {@code from}
   *   <li>{@code --int-loop-max=f,header,n}: at most {@code n} iterations of the loop headed by
   *       {@code header}
   *   <li>{@code --int-max-iterations=n}, {@code --int-max-pointer-targets=n}, {@code
   *       --int-malloc-alignment=n}
   * </ul>
   *
   * <p>Flags that control which contexts are created ({@code --int-ignore-loop}, {@code
   * --int-always-inline}, {@code --int-assume-edge}) are accepted and ignored.
   */
  public static AnalysisOptions parse(Module module, List<String> flags) {
    Builder builder = builder();
    for (String flag : flags) {
      int eq = flag.indexOf('=');
      Preconditions.checkArgument(flag.startsWith("--") && eq > 0, "Malformed flag: %s", flag);
      String name = flag.substring(2, eq);
      List<String> args = Splitter.on(',').trimResults().splitToList(flag.substring(eq + 1));
      switch (name) {
        case "int-optimistic-loop" -> {
          checkArgCount(flag, args, 3);
          Function f = function(module, args.get(0));
          Block from = block(f, args.get(1));
          Block to = block(f, args.get(2));
          Loop loop = from.loop();
          Preconditions.checkArgument(loop != null, "%s is not in a loop", from);
          builder.setOptimisticEdge(loop, new Edge(from, to));
        }
        case "int-loop-max" -> {
          checkArgCount(flag, args, 3);
          Function f = function(module, args.get(0));
          Loop loop = f.loopWithHeader(args.get(1));
          Preconditions.checkArgument(loop != null, "No loop headed by %s", args.get(1));
          builder.setMaxIterations(loop, Integer.parseInt(args.get(2)));
        }
        case "int-max-iterations" -> builder.setDefaultMaxIterations(intArg(flag, args));
        case "int-max-pointer-targets" -> builder.setMaxPointerTargets(intArg(flag, args));
        case "int-malloc-alignment" -> builder.setMallocAlignment(intArg(flag, args));
        case "int-ignore-loop", "int-always-inline", "int-assume-edge" ->
            logger.info("Ignoring context-selection flag {}", flag);
        default -> throw new IllegalArgumentException("Unknown flag: " + flag);
      }
    }
    return builder.build();
  }

  private static void checkArgCount(String flag, List<String> args, int expected) {
    Preconditions.checkArgument(args.size() == expected, "%s: expected %s values", flag, expected);
  }

  private static int intArg(String flag, List<String> args) {
    checkArgCount(flag, args, 1);
    return Integer.parseInt(args.get(0));
  }

  private static Function function(Module module, String name) {
    Function f = module.function(name);
    Preconditions.checkArgument(f != null && !f.isDeclaration(), "No function %s", name);
    return f;
  }

  private static Block block(Function f, String name) {
    Block b = f.block(name);
    Preconditions.checkArgument(b != null, "No block %s in %s", name, f.name());
    return b;
  }

  public static final class Builder {
    private int maxPointerTargets = DEFAULT_MAX_POINTER_TARGETS;
    private int mallocAlignment = DEFAULT_MALLOC_ALIGNMENT;
    private int defaultMaxIterations = DEFAULT_MAX_ITERATIONS;
    private final Map<Loop, Edge> optimisticEdges = new LinkedHashMap<>();
    private final Map<Edge, Loop> optimisticEdgeOwners = new HashMap<>();
    private final Map<Loop, Integer> iterationCaps = new LinkedHashMap<>();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setMaxPointerTargets(int maxPointerTargets) {
      Preconditions.checkArgument(maxPointerTargets > 0);
      this.maxPointerTargets = maxPointerTargets;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setMallocAlignment(int mallocAlignment) {
      Preconditions.checkArgument(Integer.bitCount(mallocAlignment) == 1);
      this.mallocAlignment = mallocAlignment;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setDefaultMaxIterations(int defaultMaxIterations) {
      Preconditions.checkArgument(defaultMaxIterations >= 0);
      this.defaultMaxIterations = defaultMaxIterations;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setMaxIterations(Loop loop, int maxIterations) {
      Preconditions.checkArgument(maxIterations >= 0);
      iterationCaps.put(loop, maxIterations);
      return this;
    }

    /**
     * Designates {@code edge} as the optimistic edge of {@code loop}. A loop has at most one
     * optimistic edge, and an edge may be optimistic for at most one loop; conflicting requests
     * are rejected rather than ordered.
     */
    @CanIgnoreReturnValue
    public Builder setOptimisticEdge(Loop loop, Edge edge) {
      Preconditions.checkArgument(
          loop.contains(edge.from()), "%s does not start in %s", edge, loop);
      Preconditions.checkArgument(
          !optimisticEdges.containsKey(loop), "%s already has an optimistic edge", loop);
      Loop other = optimisticEdgeOwners.get(edge);
      Preconditions.checkArgument(
          other == null, "%s is already the optimistic edge of %s", edge, other);
      optimisticEdges.put(loop, edge);
      optimisticEdgeOwners.put(edge, loop);
      return this;
    }

    public AnalysisOptions build() {
      return new AnalysisOptions(this);
    }
  }
}

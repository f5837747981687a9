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

package org.lookahead;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.lookahead.analysis.AnalysisOptions;
import org.lookahead.analysis.Context;
import org.lookahead.analysis.ContextTree;
import org.lookahead.analysis.PeelAttempt;
import org.lookahead.analysis.PeelIteration;
import org.lookahead.analysis.ResourceModel;
import org.lookahead.analysis.Solver;
import org.lookahead.dse.AliasQuery;
import org.lookahead.dse.DeadStoreAnalysis;
import org.lookahead.dse.HypotheticalAliasQuery;
import org.lookahead.ir.Function;
import org.lookahead.report.AnalysisReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Estimates how much of a function would be eliminated if the calls and loops chosen by the
 * caller were inlined and peeled. A typical use:
 *
 * <pre>
 * HypotheticalAnalysis analysis = HypotheticalAnalysis.builder(f).build();
 * InlineAttempt root = analysis.tree().root();
 * root.getOrCreateInlineAttempt(call);
 * root.getOrCreatePeelAttempt(loop).nextIteration();
 * AnalysisReport report = analysis.run();
 * </pre>
 *
 * <p>Contexts may be created, enabled or disabled between runs; each run starts from scratch.
 */
public final class HypotheticalAnalysis {
  private static final Logger logger = LoggerFactory.getLogger(HypotheticalAnalysis.class);

  private final ContextTree tree;
  private final ResourceModel resources;
  private final AliasQuery aliasQuery;
  private final boolean peelUntilTerminated;

  private DeadStoreAnalysis.@Nullable Result deadStores;

  private HypotheticalAnalysis(Builder builder) {
    this.tree = new ContextTree(builder.root, builder.options);
    this.resources = builder.resources;
    this.aliasQuery = new HypotheticalAliasQuery(builder.aliasFallback);
    this.peelUntilTerminated = builder.peelUntilTerminated;
  }

  public static Builder builder(Function root) {
    return new Builder(root);
  }

  public ContextTree tree() {
    return tree;
  }

  /**
   * Solves the tree, finds the dead writers, and returns the resulting counts. If the analysis was
   * built with {@link Builder#setPeelUntilTerminated}, peel attempts are first extended one
   * iteration at a time (re-solving each time) until each one terminates or reaches its cap.
   */
  public AnalysisReport run() {
    Solver solver = new Solver(tree, resources);
    solver.run();
    int rounds = 1;
    while (peelUntilTerminated && addIterations()) {
      solver.run();
      rounds++;
    }
    deadStores = new DeadStoreAnalysis(tree, aliasQuery, resources).run();
    AnalysisReport report = AnalysisReport.build(tree, deadStores);
    logger.info(
        "{}: {} of {} instructions eliminated ({} contexts, {} solver rounds)",
        tree.root().shortHeader(),
        report.eliminatedInstructions(),
        report.totalInstructions(),
        tree.size(),
        rounds);
    return report;
  }

  /** The dead writers found by the last run. */
  public DeadStoreAnalysis.Result deadStores() {
    Preconditions.checkState(deadStores != null, "not run yet");
    return deadStores;
  }

  /**
   * Adds an iteration to each enabled peel attempt whose last iteration may continue around the
   * loop. Returns true if any were added.
   */
  private boolean addIterations() {
    boolean added = false;
    for (Context c : tree.preorder()) {
      if (c.isDead()) {
        continue;
      }
      for (PeelAttempt pa : c.peelAttempts()) {
        int n = pa.numIterations();
        if (!pa.isEnabled() || n == 0 || pa.isTerminated()) {
          continue;
        }
        PeelIteration last = pa.getIteration(n - 1);
        if (last != null && !last.isDead() && pa.nextIteration() != null) {
          added = true;
        }
      }
    }
    return added;
  }

  public static final class Builder {
    private final Function root;
    private AnalysisOptions options = AnalysisOptions.DEFAULTS;
    private ResourceModel resources = ResourceModel.NONE;
    private AliasQuery aliasFallback = AliasQuery.CONSERVATIVE;
    private boolean peelUntilTerminated;

    private Builder(Function root) {
      this.root = root;
    }

    @CanIgnoreReturnValue
    public Builder setOptions(AnalysisOptions options) {
      this.options = options;
      return this;
    }

    /** Parses command-line style flags; see {@link AnalysisOptions#parse}. */
    @CanIgnoreReturnValue
    public Builder setFlags(List<String> flags) {
      this.options = AnalysisOptions.parse(root.module, flags);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setResourceModel(ResourceModel resources) {
      this.resources = resources;
      return this;
    }

    /** The alias query consulted when the lattice cannot answer. */
    @CanIgnoreReturnValue
    public Builder setAliasFallback(AliasQuery aliasFallback) {
      this.aliasFallback = aliasFallback;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setPeelUntilTerminated(boolean peelUntilTerminated) {
      this.peelUntilTerminated = peelUntilTerminated;
      return this;
    }

    public HypotheticalAnalysis build() {
      return new HypotheticalAnalysis(this);
    }
  }
}

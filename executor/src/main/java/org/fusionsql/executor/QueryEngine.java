/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.executor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.fusionsql.catalog.DefaultCatalogService;
import org.fusionsql.common.setting.EngineSettings;
import org.fusionsql.dataframe.DataFrame;
import org.fusionsql.executor.coordinator.DistributedQueryCoordinator;
import org.fusionsql.executor.coordinator.ResultStream;
import org.fusionsql.executor.shuffle.ShuffleService;
import org.fusionsql.executor.worker.Worker;
import org.fusionsql.executor.worker.WorkerFactory;
import org.fusionsql.executor.worker.WorkerPool;
import org.fusionsql.expression.function.FunctionRegistry;
import org.fusionsql.expression.function.FunctionSignature;
import org.fusionsql.expression.function.ScalarFunctionImplementation;
import org.fusionsql.planner.distributed.codec.PhysicalPlanCodec;
import org.fusionsql.planner.distributed.stage.PlanFragmenter;
import org.fusionsql.planner.distributed.stage.StagedPlan;
import org.fusionsql.planner.logical.LogicalPlan;
import org.fusionsql.planner.logical.LogicalPlanPrinter;
import org.fusionsql.planner.optimizer.LogicalPlanOptimizer;
import org.fusionsql.planner.optimizer.LogicalPlanOptimizerFactory;
import org.fusionsql.planner.physical.PhysicalPlan;
import org.fusionsql.planner.physical.PhysicalPlanCompiler;
import org.fusionsql.sql.SqlQueryPlanner;
import org.fusionsql.storage.DataSource;

/**
 * Client entry point. Owns the catalog, the function registry, an in-process worker pool and the
 * coordinator. Queries are optimized, compiled, split into stages and executed across the pool.
 */
@Log4j2
public class QueryEngine implements AutoCloseable {

  @Getter private final EngineSettings settings;
  @Getter private final DefaultCatalogService catalog = new DefaultCatalogService();
  @Getter private final FunctionRegistry functions = FunctionRegistry.createDefault();
  private final ShuffleService shuffle = new ShuffleService();
  private final LogicalPlanOptimizer optimizer = LogicalPlanOptimizerFactory.create();
  private final PhysicalPlanCompiler compiler;
  private final SqlQueryPlanner sqlPlanner;
  private final WorkerPool workerPool;
  private final DistributedQueryCoordinator coordinator;
  private final AtomicLong querySequence = new AtomicLong();

  public QueryEngine(EngineSettings settings) {
    this(settings, WorkerFactory.LOCAL);
  }

  public QueryEngine(EngineSettings settings, WorkerFactory workerFactory) {
    this.settings = settings;
    List<Worker> workers = new ArrayList<>(settings.getWorkerPoolSize());
    for (int i = 0; i < settings.getWorkerPoolSize(); i++) {
      workers.add(
          workerFactory.create(
              "worker-" + i, settings.getWorkerSlots(), catalog, functions, shuffle));
    }
    this.workerPool = new WorkerPool(workers);
    this.compiler = new PhysicalPlanCompiler(settings.getTargetPartitions(), workerPool.size());
    this.sqlPlanner = new SqlQueryPlanner(catalog, functions);
    this.coordinator =
        new DistributedQueryCoordinator(
            workerPool, shuffle, new PhysicalPlanCodec(catalog, functions), settings);
  }

  public void registerTable(String name, DataSource table) {
    catalog.registerTable(name, table);
  }

  public void registerFunction(
      FunctionSignature signature, ScalarFunctionImplementation implementation) {
    functions.register(signature, implementation);
  }

  /** Plans a SQL query without running it. */
  public DataFrame sql(String sql) {
    return sqlPlanner.plan(sql);
  }

  public ResultStream submit(String sql) {
    return submit(sql(sql));
  }

  /** Starts executing a data frame. Results stream back as root tasks produce them. */
  public ResultStream submit(DataFrame dataFrame) {
    String queryId = "query-" + querySequence.incrementAndGet();
    StagedPlan stagedPlan = stage(queryId, dataFrame.logicalPlan());
    log.info("Submitting {} with {} stages", queryId, stagedPlan.getStageCount());
    return coordinator.execute(queryId, stagedPlan);
  }

  /** Renders the optimized logical plan, the physical plan and its stages. */
  public String explain(DataFrame dataFrame) {
    LogicalPlan optimized = optimizer.optimize(dataFrame.logicalPlan());
    PhysicalPlan physical = compiler.compile(optimized);
    return "== Logical Plan ==\n"
        + LogicalPlanPrinter.print(optimized)
        + "\n== Physical Plan ==\n"
        + physical.explain()
        + "\n== Stages ==\n"
        + PlanFragmenter.fragment("explain", physical).explain();
  }

  public String explain(String sql) {
    return explain(sql(sql));
  }

  public DistributedQueryCoordinator getCoordinator() {
    return coordinator;
  }

  @Override
  public void close() {
    coordinator.close();
    workerPool.shutdown();
  }

  private StagedPlan stage(String queryId, LogicalPlan plan) {
    LogicalPlan optimized = optimizer.optimize(plan);
    log.debug("Optimized plan of {}:\n{}", queryId, LogicalPlanPrinter.print(optimized));
    PhysicalPlan physical = compiler.compile(optimized);
    return PlanFragmenter.fragment(queryId, physical);
  }
}

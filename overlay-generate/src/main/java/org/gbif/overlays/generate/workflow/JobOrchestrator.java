/*
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
package org.gbif.overlays.generate.workflow;

import org.gbif.overlays.common.error.DegenerateGeometryException;
import org.gbif.overlays.common.error.ErrorKind;
import org.gbif.overlays.common.error.InvalidInputException;
import org.gbif.overlays.common.error.JobConflictException;
import org.gbif.overlays.common.error.JobTimeoutException;
import org.gbif.overlays.common.error.OverlayException;
import org.gbif.overlays.common.error.PartialTileFailureException;
import org.gbif.overlays.common.error.SourceUnavailableException;
import org.gbif.overlays.common.error.StorageException;
import org.gbif.overlays.common.meta.OverlayMetastore;
import org.gbif.overlays.common.model.ControlPoint;
import org.gbif.overlays.common.model.JobError;
import org.gbif.overlays.common.model.JobStage;
import org.gbif.overlays.common.model.JobStatus;
import org.gbif.overlays.common.model.JobStatusReport;
import org.gbif.overlays.common.model.PageSize;
import org.gbif.overlays.common.model.ProcessingJob;
import org.gbif.overlays.common.model.Tile;
import org.gbif.overlays.common.model.TileAddress;
import org.gbif.overlays.common.model.TileFailure;
import org.gbif.overlays.common.model.TileRange;
import org.gbif.overlays.common.model.TransformKind;
import org.gbif.overlays.common.model.TransformModel;
import org.gbif.overlays.common.points.ControlPointStore;
import org.gbif.overlays.common.projection.SphericalMercator;
import org.gbif.overlays.common.projection.Tiles;
import org.gbif.overlays.common.transform.GeoTransformation;
import org.gbif.overlays.common.transform.SolveResult;
import org.gbif.overlays.common.transform.TransformSolver;
import org.gbif.overlays.generate.raster.Rasterizer;
import org.gbif.overlays.generate.raster.SourcePage;
import org.gbif.overlays.generate.raster.SourcePageReader;
import org.gbif.overlays.tilestore.BlobStore;
import org.gbif.overlays.tilestore.TileStore;
import org.gbif.overlays.tilestore.TransformHistory;

import java.io.Closeable;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.curator.RetryPolicy;
import org.apache.curator.RetrySleeper;
import org.apache.curator.retry.ExponentialBackoffRetry;

import lombok.extern.slf4j.Slf4j;

/**
 * Drives each overlay through {@code PENDING -> SOLVING -> RASTERIZING -> READY}, one job at a time.
 * <p>
 * Commits are validated synchronously, so bad control points never create a job.  A commit for an overlay with an
 * active job is queued behind it.  Across processes, an overlay is owned through a token in the
 * {@link OverlayMetastore} held by this orchestrator while it has jobs for the overlay; a commit for an overlay owned
 * elsewhere is refused with a {@link JobConflictException}.
 * <p>
 * Tiles of a zoom level are rendered in parallel on a worker pool and levels complete in ascending order.  Solve
 * failures are final.  Failures while rasterizing are retried with exponential backoff when their kind is retryable.
 * Each transition is journaled, which allows {@link #resume(String)} to continue a job after the last completed zoom.
 */
@Slf4j
public class JobOrchestrator implements Closeable {
  // the share of progress credited to solving
  static final int SOLVED_PCT = 10;

  private static final RetrySleeper SLEEPER = (time, unit) -> unit.sleep(time);
  // returned by tile tasks which did not run
  private static final TileFailure SKIPPED = TileFailure.builder().message("skipped").build();

  private final OverlayConfiguration config;
  private final ControlPointStore pointStore;
  private final SourcePageReader pageReader;
  private final TransformSolver solver;
  private final Rasterizer rasterizer;
  private final TileStore tileStore;
  private final TransformHistory history;
  private final JobJournal journal;
  private final OverlayMetastore metastore;

  private final String instanceId = "orchestrator-" + UUID.randomUUID();
  private final List<JobListener> listeners = new CopyOnWriteArrayList<>();
  private final ExecutorService jobDrivers;
  private final ExecutorService tileWorkers;
  private final ScheduledExecutorService sweeps;
  // overlays with versions invalidated since their last scheduled sweep
  private final Set<String> sweepable = Sets.newConcurrentHashSet();

  // guarded by this
  private final Map<String, OverlayRun> runs = new HashMap<>();
  private boolean closed;

  /**
   * The jobs of one overlay in this process.
   */
  private static class OverlayRun {
    final Deque<ProcessingJob> queue = new ArrayDeque<>();
    // the job being driven, mutated by its driving thread only
    ProcessingJob active;
    // the latest published snapshot of the active or last job
    ProcessingJob current;
    AtomicBoolean cancelled = new AtomicBoolean();
    final AtomicLong levelTilesDone = new AtomicLong();
  }

  private enum Outcome {
    COMPLETED,
    CANCELLED,
    INTERRUPTED
  }

  public JobOrchestrator(OverlayConfiguration config, ControlPointStore pointStore, SourcePageReader pageReader,
                         TransformSolver solver, Rasterizer rasterizer, TileStore tileStore,
                         TransformHistory history, JobJournal journal, OverlayMetastore metastore) {
    Preconditions.checkArgument(config.getWorkerThreads() > 0, "At least one worker thread is required");
    Preconditions.checkArgument(config.getRetry().getMaxAttempts() > 0, "At least one attempt is required");
    Preconditions.checkArgument(config.getFailedTileThreshold() >= 0 && config.getFailedTileThreshold() <= 1,
                                "The failed tile threshold is a ratio");
    this.config = config;
    this.pointStore = pointStore;
    this.pageReader = pageReader;
    this.solver = solver;
    this.rasterizer = rasterizer;
    this.tileStore = tileStore;
    this.history = history;
    this.journal = journal;
    this.metastore = metastore;

    jobDrivers = Executors.newCachedThreadPool(
      new ThreadFactoryBuilder().setNameFormat("overlay-job-%d").setDaemon(true).build());
    tileWorkers = Executors.newFixedThreadPool(config.getWorkerThreads(),
      new ThreadFactoryBuilder().setNameFormat("overlay-tile-%d").setDaemon(true).build());
    if (config.getSweepIntervalMs() > 0) {
      sweeps = Executors.newSingleThreadScheduledExecutor(
        new ThreadFactoryBuilder().setNameFormat("overlay-sweep-%d").setDaemon(true).build());
      sweeps.scheduleWithFixedDelay(new TileSweeper(tileStore, sweepable, config.getKeepLatestVersions()),
                                    config.getSweepIntervalMs(), config.getSweepIntervalMs(), TimeUnit.MILLISECONDS);
    } else {
      sweeps = null;
    }
    log.info("Orchestrator {} started with {} tile workers", instanceId, config.getWorkerThreads());
  }

  /**
   * Wires an orchestrator with the standard solver, rasterizer and stores over the blob store.
   */
  public static JobOrchestrator create(OverlayConfiguration config, ControlPointStore pointStore,
                                       SourcePageReader pageReader, BlobStore blobs, OverlayMetastore metastore,
                                       MeterRegistry registry) {
    return new JobOrchestrator(
      config,
      pointStore,
      pageReader,
      new TransformSolver(config.getPolynomialOrder(), config.getTpsMaxPoints(), config.getTpsSmoothing()),
      new Rasterizer(new SphericalMercator(config.getTileSize())),
      new TileStore(blobs, metastore, config.getCache(), registry),
      new TransformHistory(blobs),
      new JobJournal(blobs),
      metastore);
  }

  public String getInstanceId() {
    return instanceId;
  }

  public TileStore getTileStore() {
    return tileStore;
  }

  public void addListener(JobListener listener) {
    listeners.add(listener);
  }

  /**
   * Commits the points staged in the control point store for the overlay, at the configured zoom levels.
   */
  public CommitTicket commitStaged(String overlayId, String sourceRef, TransformKind kind) {
    return commit(overlayId, sourceRef, pointStore.list(overlayId), kind, config.getDefaultZoomLevels());
  }

  /**
   * Commits control points for rendering at the configured zoom levels.
   *
   * @see #commit(String, String, List, TransformKind, List)
   */
  public CommitTicket commit(String overlayId, String sourceRef, List<ControlPoint> points, TransformKind kind) {
    return commit(overlayId, sourceRef, points, kind, config.getDefaultZoomLevels());
  }

  /**
   * Validates the control points, replaces the overlay's working set with them and starts or queues a job solving
   * and rendering them.
   *
   * @param sourceRef the key of the source page, as given to the {@link SourcePageReader}
   * @throws InvalidInputException if the page is not registered, a point or zoom level is invalid
   * @throws DegenerateGeometryException if the points cannot determine a transformation of the kind
   * @throws org.gbif.overlays.common.error.TooManyPointsException if the solver refuses that many points
   * @throws JobConflictException if another process owns the overlay
   */
  public CommitTicket commit(String overlayId, String sourceRef, List<ControlPoint> points, TransformKind kind,
                             List<Integer> zoomLevels) {
    Preconditions.checkNotNull(overlayId, "An overlay is required");
    Preconditions.checkNotNull(sourceRef, "A source page is required");
    List<Integer> zooms = checkZooms(zoomLevels);
    PageSize page = pointStore.page(overlayId)
      .orElseThrow(() -> new InvalidInputException("No page is registered for overlay " + overlayId));

    solver.validate(points, kind);

    synchronized (this) {
      Preconditions.checkState(!closed, "Orchestrator is closed");
      OverlayRun run = runs.computeIfAbsent(overlayId, k -> new OverlayRun());
      boolean queued = run.active != null;
      if (!queued) {
        acquire(overlayId);
      }
      List<ControlPoint> stored;
      try {
        stored = pointStore.replaceAll(overlayId, points);
      } catch (OverlayException e) {
        if (!queued) {
          metastore.release(overlayId, instanceId);
        }
        throw e;
      }

      Instant now = Instant.now();
      ProcessingJob job = ProcessingJob.builder()
        .id(UUID.randomUUID().toString())
        .overlayId(overlayId)
        .sourceRef(sourceRef)
        .pageWidth(page.getWidth())
        .pageHeight(page.getHeight())
        .kind(kind)
        .controlPoints(stored)
        .zoomLevels(zooms)
        .stage(JobStage.PENDING)
        .status(JobStatus.PENDING)
        .currentStep("Queued")
        .createdAt(now)
        .updatedAt(now)
        .build();
      journal.record(job.snapshot());

      if (queued) {
        run.queue.add(job);
        log.info("Queued job {} of overlay {} behind job {}", job.getId(), overlayId, run.active.getId());
      } else {
        start(run, job, null);
        log.info("Committed {} control points to overlay {} as job {}", stored.size(), overlayId, job.getId());
      }
      return new CommitTicket(overlayId, job.getId(), queued);
    }
  }

  /**
   * Restores the georeferencing of a retained version by committing its control points again.  The restored
   * transformation becomes a new version and its tiles are rendered afresh.
   *
   * @throws InvalidInputException if the version is not retained
   */
  public CommitTicket rollback(String overlayId, int version) {
    TransformModel model = history.get(overlayId, version)
      .orElseThrow(() -> new InvalidInputException("Overlay " + overlayId + " has no version " + version));
    ProcessingJob latest = journal.latest(overlayId)
      .orElseThrow(() -> new InvalidInputException("No job of overlay " + overlayId + " is known"));
    if (!pointStore.page(overlayId).isPresent()) {
      pointStore.registerPage(overlayId, model.getPageWidth(), model.getPageHeight());
    }
    log.info("Rolling overlay {} back to the georeferencing of version {}", overlayId, version);
    return commit(overlayId, latest.getSourceRef(), model.getControlPoints(), model.getKind(),
                  latest.getZoomLevels());
  }

  /**
   * Continues the most recent job of the overlay if it was interrupted, rendering only the zoom levels above the last
   * one completed.  A job interrupted before its solve completed is solved again.
   *
   * @return true if a job was resumed
   * @throws JobConflictException if another process owns the overlay
   */
  public boolean resume(String overlayId) {
    Optional<ProcessingJob> journaled = journal.latest(overlayId);
    if (!journaled.isPresent() || journaled.get().getStage().isTerminal()) {
      log.info("Overlay {} has no interrupted job", overlayId);
      return false;
    }
    ProcessingJob job = journaled.get();
    TransformModel model = null;
    if (job.getStage() == JobStage.RASTERIZING) {
      model = history.get(overlayId, job.getTransformVersion())
        .orElseThrow(() -> new StorageException(
          "Transform version " + job.getTransformVersion() + " of overlay " + overlayId + " is missing"));
    } else {
      job.setTransformVersion(0);
      job.setHighestCompletedZoom(-1);
    }
    if (!pointStore.page(overlayId).isPresent()) {
      pointStore.registerPage(overlayId, job.getPageWidth(), job.getPageHeight());
    }

    synchronized (this) {
      Preconditions.checkState(!closed, "Orchestrator is closed");
      OverlayRun run = runs.computeIfAbsent(overlayId, k -> new OverlayRun());
      if (run.active != null) {
        log.info("Overlay {} already has job {} running", overlayId, run.active.getId());
        return false;
      }
      acquire(overlayId);
      start(run, job, model);
    }
    log.info("Resuming job {} of overlay {} at stage {} after zoom {}", job.getId(), overlayId, job.getStage(),
             job.getHighestCompletedZoom());
    return true;
  }

  /**
   * Asks the active job of the overlay to stop.  Tiles being rendered complete, and no further tiles are started.
   * Queued commits are unaffected.
   *
   * @return true if there was an active job
   */
  public synchronized boolean cancel(String overlayId) {
    OverlayRun run = runs.get(overlayId);
    if (run == null || run.active == null) {
      return false;
    }
    run.cancelled.set(true);
    log.info("Cancelling job {} of overlay {}", run.active.getId(), overlayId);
    return true;
  }

  /**
   * @return the state of the active job of the overlay, or else of its last job
   */
  public Optional<JobStatusReport> getStatus(String overlayId) {
    ProcessingJob job;
    int queued;
    long levelDone;
    synchronized (this) {
      OverlayRun run = runs.get(overlayId);
      job = run == null ? null : run.current;
      queued = run == null ? 0 : run.queue.size();
      levelDone = run == null ? 0 : run.levelTilesDone.get();
    }
    if (job == null) {
      job = journal.latest(overlayId).orElse(null);
      levelDone = 0;
    }
    if (job == null) {
      return Optional.empty();
    }
    int progress = job.getStage() == JobStage.RASTERIZING
                   ? progress(job.getCompletedTiles() + levelDone, job.getTotalTiles())
                   : job.getProgressPct();
    return Optional.of(JobStatusReport.builder()
                         .overlayId(overlayId)
                         .jobId(job.getId())
                         .stage(job.getStage())
                         .status(job.getStatus())
                         .progressPct(progress)
                         .error(job.getError())
                         .transformVersion(job.getTransformVersion())
                         .failedTiles(job.getTileFailures().size())
                         .queuedCommits(queued)
                         .build());
  }

  public Optional<ProcessingJob> getJob(String overlayId, String jobId) {
    return journal.get(overlayId, jobId);
  }

  /**
   * @return every retained transformation of the overlay, oldest first
   */
  public List<TransformModel> history(String overlayId) {
    return history.history(overlayId);
  }

  /**
   * @return the tile of the version currently served
   */
  public Optional<Tile> getTile(String overlayId, int z, long x, long y) {
    return tileStore.getCurrent(overlayId, z, x, y);
  }

  public Optional<Tile> getTile(String overlayId, int z, long x, long y, int version) {
    return tileStore.get(overlayId, z, x, y, version);
  }

  /**
   * Deletes reclaimable tile versions of the overlay beyond those configured to be kept.
   *
   * @return the versions deleted
   */
  public List<Integer> sweep(String overlayId) {
    return tileStore.evictOlderThan(overlayId, config.getKeepLatestVersions());
  }

  /**
   * @return the number of overlays with an active or queued job in this process
   */
  @VisibleForTesting
  synchronized int trackedOverlays() {
    return runs.size();
  }

  /**
   * Stops all work.  Interrupted jobs keep their journaled stage and may be resumed by another orchestrator.
   */
  @Override
  public void close() {
    synchronized (this) {
      closed = true;
    }
    if (sweeps != null) {
      sweeps.shutdownNow();
    }
    jobDrivers.shutdownNow();
    tileWorkers.shutdownNow();
    try {
      if (!jobDrivers.awaitTermination(10, TimeUnit.SECONDS)) {
        log.warn("Jobs of orchestrator {} did not stop in time", instanceId);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    tileStore.close();
    log.info("Orchestrator {} closed", instanceId);
  }

  private List<Integer> checkZooms(List<Integer> zoomLevels) {
    if (zoomLevels == null || zoomLevels.isEmpty()) {
      throw new InvalidInputException("At least one zoom level is required");
    }
    for (Integer z : zoomLevels) {
      if (z == null || z < 0 || z > Math.min(config.getMaxZoom(), Tiles.MAX_ZOOM)) {
        throw new InvalidInputException("Zoom level " + z + " is outside 0 to " + config.getMaxZoom());
      }
    }
    return ImmutableList.copyOf(new TreeSet<>(zoomLevels));
  }

  private void acquire(String overlayId) {
    if (!metastore.acquire(overlayId, instanceId)) {
      throw new JobConflictException("Overlay " + overlayId + " has an active job owned by "
                                     + metastore.owner(overlayId).orElse("another process"));
    }
  }

  // called holding the lock
  private void start(OverlayRun run, ProcessingJob job, TransformModel resumedModel) {
    run.active = job;
    run.current = job.snapshot();
    run.cancelled = new AtomicBoolean();
    run.levelTilesDone.set(0);
    jobDrivers.submit(() -> drive(run, job, resumedModel));
  }

  private void drive(OverlayRun run, ProcessingJob job, TransformModel resumedModel) {
    Outcome outcome = Outcome.COMPLETED;
    try {
      TransformModel model = resumedModel != null ? resumedModel : solve(run, job);
      if (model != null) {
        outcome = rasterize(run, job, model);
      }
    } catch (RuntimeException e) {
      // past the solver and page reader only storage collaborators remain
      log.error("Job {} of overlay {} failed unexpectedly", job.getId(), job.getOverlayId(), e);
      fail(run, job, ErrorKind.STORAGE_FAILURE, e.toString());
    } finally {
      finish(run, job, outcome);
    }
  }

  /**
   * @return the versioned model, or null if the job ended
   */
  private TransformModel solve(OverlayRun run, ProcessingJob job) {
    String overlayId = job.getOverlayId();
    job.setStartedAt(Instant.now());
    transition(run, job, JobStage.SOLVING, JobStatus.RUNNING, "Solving " + job.getKind() + " transformation");
    TransformModel model;
    try {
      SolveResult result = solveChecked(job);
      if (!result.getOutliers().isEmpty()) {
        log.warn("Control points {} of overlay {} have residuals above {} times the RMSE of {} m",
                 result.getOutliers(), overlayId, TransformSolver.OUTLIER_FACTOR, result.getRmse());
      }
      model = history.save(result.getModel());
      OptionalInt previous = metastore.activeVersion(overlayId);
      metastore.activate(overlayId, model.getVersion());
      if (previous.isPresent() && previous.getAsInt() != model.getVersion()) {
        tileStore.invalidate(overlayId, previous.getAsInt());
        sweepable.add(overlayId);
      }
    } catch (OverlayException e) {
      fail(run, job, e.getKind(), e.getMessage());
      return null;
    }

    job.setTransformVersion(model.getVersion());
    job.setProgressPct(SOLVED_PCT);
    log.info("Overlay {} solved as version {} with RMSE {} m", overlayId, model.getVersion(), model.getRmse());
    if (run.cancelled.get()) {
      end(run, job, JobStage.CANCELLED, JobStatus.CANCELLED, "Cancelled");
      return null;
    }
    return model;
  }

  /**
   * @throws DegenerateGeometryException if the solver fails numerically
   */
  private SolveResult solveChecked(ProcessingJob job) {
    try {
      return solver.solve(job.getOverlayId(), job.getControlPoints(), job.getKind(), job.getPageWidth(),
                          job.getPageHeight());
    } catch (OverlayException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new DegenerateGeometryException("Transformation is numerically degenerate: " + e.getMessage(), e);
    }
  }

  /**
   * @throws SourceUnavailableException if the page cannot be read for any reason other than storage
   */
  private SourcePage readPage(ProcessingJob job) {
    try {
      return pageReader.read(job.getSourceRef());
    } catch (OverlayException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new SourceUnavailableException("Unable to read source page " + job.getSourceRef(), e);
    }
  }

  private Outcome rasterize(OverlayRun run, ProcessingJob job, TransformModel model) {
    long total = 0;
    long completed = 0;
    for (int z : job.getZoomLevels()) {
      long size = rasterizer.tileRange(model, z).size();
      total += size;
      if (z <= job.getHighestCompletedZoom()) {
        completed += size;
      }
    }
    job.setTotalTiles(total);
    job.setCompletedTiles(completed);
    job.setProgressPct(progress(completed, total));
    transition(run, job, JobStage.RASTERIZING, JobStatus.RUNNING, "Reading source page");

    RetryPolicy retryPolicy = new ExponentialBackoffRetry(config.getRetry().getInitialBackoffMs(),
                                                          config.getRetry().getMaxAttempts() - 1,
                                                          config.getRetry().getMaxBackoffMs());
    long started = System.currentTimeMillis();
    int retries = 0;
    while (true) {
      job.setAttemptCount(job.getAttemptCount() + 1);
      try {
        SourcePage page = readPage(job);
        Outcome outcome = rasterizeLevels(run, job, model, page);
        if (outcome == Outcome.COMPLETED) {
          job.setProgressPct(100);
          end(run, job, JobStage.READY, JobStatus.SUCCEEDED, "Ready");
          log.info("Overlay {} version {} is ready, {} tiles failed", job.getOverlayId(), model.getVersion(),
                   job.getTileFailures().size());
        } else if (outcome == Outcome.CANCELLED) {
          end(run, job, JobStage.CANCELLED, JobStatus.CANCELLED, "Cancelled");
        }
        return outcome;
      } catch (OverlayException e) {
        if (e.getKind().isRetryable() && !run.cancelled.get()
            && retryPolicy.allowRetry(retries++, System.currentTimeMillis() - started, SLEEPER)) {
          log.warn("Attempt {} of job {} of overlay {} failed, retrying: {}", job.getAttemptCount(), job.getId(),
                   job.getOverlayId(), e.getMessage());
          job.setCurrentStep("Retrying after: " + e.getMessage());
          publish(run, job);
          continue;
        }
        if (Thread.currentThread().isInterrupted()) {
          return Outcome.INTERRUPTED;
        }
        fail(run, job, e.getKind(), e.getMessage());
        return Outcome.COMPLETED;
      }
    }
  }

  /**
   * Renders the zoom levels above the highest completed one, recording each level as it completes.
   *
   * @throws PartialTileFailureException if too many tiles of a level failed
   * @throws JobTimeoutException if the attempt ran out of time
   * @throws StorageException if a tile could not be stored
   */
  private Outcome rasterizeLevels(OverlayRun run, ProcessingJob job, TransformModel model, SourcePage page) {
    GeoTransformation transformation = GeoTransformation.of(model);
    long deadline = config.getJobTimeoutMs() > 0
                    ? System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.getJobTimeoutMs())
                    : Long.MAX_VALUE;
    AtomicBoolean stop = new AtomicBoolean();
    AtomicBoolean cancelled = run.cancelled;

    for (int z : job.getZoomLevels()) {
      if (z <= job.getHighestCompletedZoom()) {
        continue;
      }
      if (cancelled.get()) {
        return Outcome.CANCELLED;
      }
      TileRange range = rasterizer.tileRange(model, z);
      run.levelTilesDone.set(0);
      job.setCurrentStep("Rendering " + range.size() + " tiles at zoom " + z);
      publish(run, job);

      List<Future<TileFailure>> tasks = new ArrayList<>();
      for (TileAddress address : range) {
        tasks.add(tileWorkers.submit(() -> {
          if (stop.get() || cancelled.get() || System.nanoTime() > deadline) {
            return SKIPPED;
          }
          try {
            tileStore.put(rasterizer.render(model, transformation, page, address));
            return null;
          } catch (OverlayException e) {
            throw e;
          } catch (RuntimeException e) {
            log.warn("Tile {} of overlay {} version {} failed: {}", address, model.getOverlayId(),
                     model.getVersion(), e.getMessage());
            return new TileFailure(address.getZ(), address.getX(), address.getY(), e.getMessage());
          } finally {
            run.levelTilesDone.incrementAndGet();
          }
        }));
      }

      List<TileFailure> failures = new ArrayList<>();
      int skipped = 0;
      try {
        for (Future<TileFailure> task : tasks) {
          TileFailure failure = task.get(remainingNanos(deadline), TimeUnit.NANOSECONDS);
          if (failure == SKIPPED) {
            skipped++;
          } else if (failure != null) {
            failures.add(failure);
          }
        }
      } catch (ExecutionException e) {
        stop.set(true);
        Throwables.throwIfUnchecked(e.getCause());
        throw new IllegalStateException(e.getCause());
      } catch (TimeoutException e) {
        stop.set(true);
        throw new JobTimeoutException("Job " + job.getId() + " exceeded " + config.getJobTimeoutMs() + " ms at zoom "
                                      + z);
      } catch (InterruptedException e) {
        stop.set(true);
        Thread.currentThread().interrupt();
        log.info("Job {} of overlay {} interrupted at zoom {}", job.getId(), job.getOverlayId(), z);
        return Outcome.INTERRUPTED;
      }
      if (cancelled.get()) {
        return Outcome.CANCELLED;
      }
      if (skipped > 0) {
        throw new JobTimeoutException("Job " + job.getId() + " exceeded " + config.getJobTimeoutMs() + " ms at zoom "
                                      + z);
      }

      // failures of earlier attempts at this level are superseded
      List<TileFailure> recorded = job.getTileFailures().stream()
        .filter(f -> f.getZ() != z)
        .collect(Collectors.toList());
      recorded.addAll(failures);
      job.setTileFailures(recorded);

      if ((double) failures.size() / range.size() > config.getFailedTileThreshold()) {
        publish(run, job);
        throw new PartialTileFailureException(z, failures.size(), Math.toIntExact(range.size()),
                                              config.getFailedTileThreshold());
      }
      job.setHighestCompletedZoom(z);
      job.setCompletedTiles(job.getCompletedTiles() + range.size());
      job.setProgressPct(progress(job.getCompletedTiles(), job.getTotalTiles()));
      run.levelTilesDone.set(0);
      log.info("Overlay {} version {} zoom {} complete with {} tiles, {} failed", model.getOverlayId(),
               model.getVersion(), z, range.size(), failures.size());
      publish(run, job);
    }
    return Outcome.COMPLETED;
  }

  private void finish(OverlayRun run, ProcessingJob job, Outcome outcome) {
    synchronized (this) {
      run.active = null;
      if (outcome == Outcome.INTERRUPTED || closed) {
        return;
      }
      ProcessingJob next = run.queue.poll();
      if (next != null) {
        log.info("Starting queued job {} of overlay {}", next.getId(), job.getOverlayId());
        start(run, next, null);
        return;
      }
      // the journal answers for idle overlays
      runs.remove(job.getOverlayId(), run);
      try {
        metastore.release(job.getOverlayId(), instanceId);
      } catch (StorageException e) {
        log.warn("Unable to release overlay {}", job.getOverlayId(), e);
      }
    }
  }

  private void fail(OverlayRun run, ProcessingJob job, ErrorKind kind, String message) {
    log.error("Job {} of overlay {} failed at {} with {}: {}", job.getId(), job.getOverlayId(), job.getStage(), kind,
              message);
    job.setError(new JobError(kind, job.getStage(), message));
    end(run, job, JobStage.FAILED, JobStatus.FAILED, "Failed");
  }

  private void end(OverlayRun run, ProcessingJob job, JobStage stage, JobStatus status, String step) {
    job.setCompletedAt(Instant.now());
    transition(run, job, stage, status, step);
  }

  private void transition(OverlayRun run, ProcessingJob job, JobStage stage, JobStatus status, String step) {
    log.info("Job {} of overlay {}: {} -> {}", job.getId(), job.getOverlayId(), job.getStage(), stage);
    job.setStage(stage);
    job.setStatus(status);
    job.setCurrentStep(step);
    publish(run, job);
  }

  private void publish(OverlayRun run, ProcessingJob job) {
    job.setUpdatedAt(Instant.now());
    ProcessingJob snapshot = job.snapshot();
    synchronized (this) {
      run.current = snapshot;
    }
    journal.record(snapshot);
    for (JobListener listener : listeners) {
      try {
        listener.onTransition(snapshot);
      } catch (RuntimeException e) {
        log.warn("Listener {} failed on job {}", listener, job.getId(), e);
      }
    }
  }

  private static long remainingNanos(long deadline) {
    return deadline == Long.MAX_VALUE ? Long.MAX_VALUE : Math.max(0, deadline - System.nanoTime());
  }

  static int progress(long done, long total) {
    if (total <= 0) {
      return SOLVED_PCT;
    }
    return (int) Math.min(100, SOLVED_PCT + (100 - SOLVED_PCT) * done / total);
  }
}

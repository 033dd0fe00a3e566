// ******************************************************************************
//
// Title:       Solution Density X.
// Description: Solution Density X - Density from Solution Scattering.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2024.
//
// This file is part of Solution Density X.
//
// Solution Density X is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// Solution Density X is distributed in the hope that it will be useful, but
// WITHOUT ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
// FITNESS FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// Solution Density X; if not, write to the Free Software Foundation, Inc., 59
// Temple Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package sdx.saxs;

import org.apache.commons.lang3.time.StopWatch;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

import sdx.realspace.DensityCentering;
import sdx.realspace.DensitySmoother;
import sdx.realspace.RealSpaceConstraint;
import sdx.realspace.ShrinkwrapSchedule;
import sdx.realspace.SupportEstimator;
import sdx.realspace.SupportEstimator.SupportUpdate;

import static java.lang.String.format;

/**
 * The ReconstructionLoop class recovers a real space electron density from a one dimensional
 * scattering profile by alternating projections. Each iteration runs:
 * <ol>
 *   <li>a forward transform, the radial profile and the residual of the current density;</li>
 *   <li>the reciprocal space projection onto the measured shell intensities;</li>
 *   <li>the inverse transform and the real space projection onto the support;</li>
 *   <li>a shrink-wrap support update on the schedule's cadence;</li>
 *   <li>the termination check.</li>
 * </ol>
 *
 * <p>Divergence (repeated bad support masks, a non-finite density, or recurring numerical
 * warnings) restarts the run from a new random density with a derived seed, within the same
 * iteration budget. When the restarts are used up a {@link DivergedReconstructionException} is
 * thrown.
 *
 * <p>Each call to {@link #run()} starts from scratch. A loop instance runs on one thread; separate
 * instances share no state and may run concurrently.
 *
 * @since 1.0
 */
public class ReconstructionLoop implements Terminatable {

  private static final Logger logger = Logger.getLogger(ReconstructionLoop.class.getName());

  /**
   * Seed offset between restarts.
   */
  static final long RESTART_SEED_OFFSET = 7919L;

  private final ScatteringProfile profile;
  private final ReconstructionOptions options;
  private final GridSpace gridSpace;
  private final FourierBridge fourierBridge;
  private final ReciprocalConstraint reciprocalConstraint;
  private final RealSpaceConstraint realSpaceConstraint;
  private final SupportEstimator supportEstimator;
  private final SupportMask initialRegion;
  private ReconstructionListener listener;
  private volatile boolean terminate = false;
  private String divergence;

  /**
   * Constructor for ReconstructionLoop. The profile and the options are checked here, before any
   * iteration.
   *
   * @param profile the measured profile, in inverse Angstrom.
   * @param options the reconstruction options.
   * @throws ConfigurationException for an unusable profile or grid.
   */
  public ReconstructionLoop(ScatteringProfile profile, ReconstructionOptions options) {
    if (profile == null || profile.isEmpty()) {
      throw new ConfigurationException(" The scattering profile is empty.");
    }
    if (profile.isAllZero()) {
      throw new ConfigurationException(" Every intensity of the scattering profile is zero.");
    }
    if (profile.size() < 2) {
      throw new ConfigurationException(" At least two profile points are required.");
    }
    this.profile = profile;
    this.options = options;
    gridSpace = options.createGrid();
    fourierBridge = new FourierBridge(gridSpace);
    ShellBinning binning = fourierBridge.getShellBinning();
    ExperimentalShells experimental =
        new ExperimentalShells(profile, binning, options.chiSquareWeighting);
    reciprocalConstraint = new ReciprocalConstraint(experimental, binning,
        options.scaleMethod, options.amplitudeMode);
    if (options.enforceFlatSolvent) {
      realSpaceConstraint = RealSpaceConstraint.withFlatSolvent(gridSpace,
          options.flatSolventRadiusScale * options.maxDimension);
    } else {
      realSpaceConstraint = new RealSpaceConstraint();
    }
    SupportMask bounding = SupportMask.sphere(gridSpace, options.boundingScale * options.maxDimension);
    supportEstimator = new SupportEstimator(bounding, new DensitySmoother(gridSpace),
        options.monotonicSupport);
    initialRegion = SupportMask.sphere(gridSpace, 0.5 * options.maxDimension);
  }

  public void setListener(ReconstructionListener listener) {
    this.listener = listener;
  }

  public GridSpace getGridSpace() {
    return gridSpace;
  }

  public ReconstructionOptions getOptions() {
    return options;
  }

  /**
   * {@inheritDoc}
   *
   * <p>The request is seen at the next iteration boundary; {@link #run()} then returns a result
   * with {@link TerminationReason#CANCELLED}.
   */
  @Override
  public void terminate() {
    terminate = true;
  }

  /**
   * Run the reconstruction.
   *
   * @return the result.
   * @throws DivergedReconstructionException if every attempt diverged.
   */
  public ReconstructionResult run() {
    StopWatch stopWatch = StopWatch.createStarted();
    logSettings();
    List<NumericalInstabilityWarning> warnings = new ArrayList<>();
    int totalIterations = 0;
    try {
      for (int attempt = 0; ; attempt++) {
        long seed = options.randomSeed + RESTART_SEED_OFFSET * attempt;
        IterationState state = initialize(attempt, seed, warnings, totalIterations);
        TerminationReason reason = iterate(state);
        totalIterations = state.getTotalIterations();
        if (reason != null) {
          return finish(state, reason, stopWatch);
        }
        if (attempt >= options.maxRestarts || totalIterations >= options.maxIterations) {
          String message = format(" Reconstruction diverged after %d iterations and %d restarts: %s",
              totalIterations, attempt, divergence);
          logger.warning(message);
          throw new DivergedReconstructionException(message, state.getResidualHistory(),
              totalIterations, attempt);
        }
        logger.warning(format(" Attempt %d diverged at iteration %d (%s); restarting with seed %d.",
            attempt, state.getIteration(), divergence,
            options.randomSeed + RESTART_SEED_OFFSET * (attempt + 1)));
      }
    } finally {
      terminate = false;
    }
  }

  private IterationState initialize(int attempt, long seed,
                                    List<NumericalInstabilityWarning> warnings,
                                    int totalIterations) {
    Random random = new Random(seed);
    DensityGrid density = new DensityGrid(gridSpace);
    double[] values = density.getValues();
    for (int i = 0; i < values.length; i++) {
      if (initialRegion.get(i)) {
        values[i] = random.nextDouble();
      }
    }
    ConvergenceTracker tracker = new ConvergenceTracker(options.maxIterations,
        options.plateauWindow, options.plateauTolerance, options.convergenceThreshold);
    ShrinkwrapSchedule schedule = new ShrinkwrapSchedule(options.shrinkwrapCadence,
        options.shrinkwrapMinStep, options.sigmaStart, options.sigmaEnd, options.sigmaDecay,
        options.thresholdFraction, options.thresholdFinal, options.thresholdStep,
        options.maxBadMasks);
    divergence = null;
    if (logger.isLoggable(Level.INFO)) {
      logger.info(format("\n Attempt %d (seed %d)\n  Iteration     Residual        Scale     Rg (A)  Support (A^3)  Shrink-wrap",
          attempt, seed));
    }
    return new IterationState(attempt, seed, density, SupportMask.full(gridSpace), tracker,
        schedule, warnings, totalIterations);
  }

  /**
   * Iterate until a termination reason is found.
   *
   * @return the reason, or null when the attempt diverged (the cause is in {@code divergence}).
   */
  private TerminationReason iterate(IterationState state) {
    ShrinkwrapSchedule schedule = state.getSchedule();
    while (true) {
      if (terminate) {
        logger.info(format(" Reconstruction cancelled after %d iterations.", state.getTotalIterations()));
        return TerminationReason.CANCELLED;
      }
      int iteration = state.getIteration();
      List<NumericalInstabilityWarning> iterationWarnings = new ArrayList<>(2);

      // Reciprocal space projection.
      ReciprocalGrid reciprocal = fourierBridge.forward(state.getDensity());
      CalculatedProfile calculated = fourierBridge.radialProfile(reciprocal);
      double scale = reciprocalConstraint.scaleFactor(calculated);
      state.setScale(scale);
      state.recordResidual(reciprocalConstraint.residual(calculated, scale));
      if (ReciprocalConstraint.isValidScale(scale)) {
        reciprocalConstraint.apply(reciprocal, calculated, scale);
      } else {
        iterationWarnings.add(new NumericalInstabilityWarning(iteration,
            NumericalInstabilityWarning.Kind.INVALID_SCALE, scale));
      }
      DensityGrid density = fourierBridge.inverse(reciprocal);
      double imaginary = fourierBridge.getImaginaryResidue();
      if (imaginary > options.imaginaryTolerance) {
        iterationWarnings.add(new NumericalInstabilityWarning(iteration,
            NumericalInstabilityWarning.Kind.IMAGINARY_RESIDUE, imaginary));
      }
      if (!density.isFinite()) {
        iterationWarnings.add(new NumericalInstabilityWarning(iteration,
            NumericalInstabilityWarning.Kind.NON_FINITE_DENSITY, Double.NaN));
        logWarnings(iterationWarnings);
        state.recordWarnings(iterationWarnings);
        state.completeIteration();
        divergence = "non-finite density";
        return null;
      }

      // Real space projection.
      SupportMask support = state.getSupport();
      realSpaceConstraint.apply(density, support);

      // Shrink-wrap.
      if (schedule.isUpdateDue(iteration)) {
        if (options.recenter && schedule.isExploring()) {
          support = DensityCentering.recenter(density, support);
        }
        boolean connectivity = options.enforceConnectivity && iteration >= options.connectivityStep;
        SupportUpdate update = supportEstimator.estimate(density, support, schedule.getSigma(),
            schedule.getFraction(), connectivity);
        if (update.isAccepted()) {
          support = update.mask();
          schedule.accepted();
          realSpaceConstraint.apply(density, support);
        } else {
          logger.warning(format(" Iteration %d: rejected %s support mask (%d consecutive).",
              iteration, update.status(), schedule.getConsecutiveBadMasks() + 1));
          if (schedule.rejected() == ShrinkwrapSchedule.State.DIVERGED) {
            state.setSupport(support);
            state.setDensity(density);
            state.completeIteration();
            divergence = format("%d consecutive bad support masks", schedule.getConsecutiveBadMasks());
            return null;
          }
        }
      }
      if (options.electronCount > 0.0) {
        double sum = density.sum();
        if (sum > 0.0) {
          density.scale(options.electronCount / sum);
        }
      }
      state.setSupport(support);
      state.setDensity(density);

      logWarnings(iterationWarnings);
      int consecutive = state.recordWarnings(iterationWarnings);
      state.completeIteration();
      logProgress(state);
      if (listener != null && !listener.iterationUpdate(state)) {
        terminate = true;
      }
      if (consecutive > options.maxInstabilityWarnings) {
        divergence = format("%d consecutive iterations with numerical warnings", consecutive);
        return null;
      }
      TerminationReason reason = state.getTracker().check(state.getTotalIterations());
      if (reason != null) {
        if (reason.isConverged()) {
          schedule.converged();
          state.setConverged(true);
        }
        logger.info(format(" Reconstruction stopped: %s.", reason.getDescription()));
        return reason;
      }
    }
  }

  private ReconstructionResult finish(IterationState state, TerminationReason reason,
                                      StopWatch stopWatch) {
    DensityGrid density;
    SupportMask support;
    if (reason == TerminationReason.CANCELLED) {
      density = state.getBestDensity();
      support = state.getBestSupport();
    } else {
      density = state.getDensity();
      support = state.getSupport();
    }
    ReciprocalGrid reciprocal = fourierBridge.forward(density);
    CalculatedProfile calculated = fourierBridge.radialProfile(reciprocal);
    double scale = reciprocalConstraint.scaleFactor(calculated);
    double residual = reciprocalConstraint.residual(calculated, scale);
    stopWatch.stop();
    ReconstructionResult result = new ReconstructionResult(density, support,
        state.getResidualHistory(), reason, residual, scale, calculated,
        state.getTotalIterations(), state.getAttempt(), options.randomSeed, state.getWarnings(),
        stopWatch.getTime() * 1.0e-3);
    if (logger.isLoggable(Level.INFO)) {
      StringBuilder sb = new StringBuilder("\n Reconstruction Summary\n");
      sb.append(format("  Termination:        %s\n", reason.getDescription()));
      sb.append(format("  Iterations:         %d (%d restarts)\n", result.getIterations(), result.getRestarts()));
      sb.append(format("  Final residual:     %12.6e\n", residual));
      sb.append(format("  Best residual:      %12.6e\n", result.getBestResidual()));
      sb.append(format("  Radius of gyration: %12.3f A\n", result.getRadiusOfGyration()));
      sb.append(format("  Support volume:     %12.1f A^3\n", result.getSupportVolume()));
      sb.append(format("  Warnings:           %d\n", result.getWarnings().size()));
      sb.append(format("  Time:               %8.3f sec", result.getElapsedSeconds()));
      logger.info(sb.toString());
    }
    return result;
  }

  private void logSettings() {
    if (logger.isLoggable(Level.INFO)) {
      StringBuilder sb = new StringBuilder(options.toString());
      sb.append("\n").append(gridSpace);
      sb.append("\n").append(profile);
      ExperimentalShells experimental = reciprocalConstraint.getExperimental();
      sb.append(format("\n Shells with data:  %d of %d (%s residual)",
          experimental.getCoveredCount(), experimental.getNumberOfShells(),
          experimental.isWeighted() ? "chi-squared" : "relative"));
      logger.info(sb.toString());
    }
  }

  private void logProgress(IterationState state) {
    int iteration = state.getIteration();
    boolean print = iteration % options.printFrequency == 0;
    Level level = print ? Level.INFO : Level.FINE;
    if (logger.isLoggable(level)) {
      DensityGrid density = state.getDensity();
      logger.log(level, format("  %9d %12.6e %12.6e %10.3f %14.1f  %s", iteration,
          state.getResidual(), state.getScale(), density.radiusOfGyration(),
          state.getSupport().volume(), state.getSupportState()));
    }
  }

  private static void logWarnings(List<NumericalInstabilityWarning> warnings) {
    for (NumericalInstabilityWarning warning : warnings) {
      logger.warning(warning.toString());
    }
  }
}

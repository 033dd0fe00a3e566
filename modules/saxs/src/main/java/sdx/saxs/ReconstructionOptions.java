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

import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.ex.ConversionException;
import sdx.utilities.PropertyLoader;

import java.io.File;

import static java.lang.String.format;

/**
 * Immutable settings of one reconstruction. Instances come from a {@link Builder} or from
 * properties with {@link #fromProperties(CompositeConfiguration)}; both validate every value.
 *
 * @since 1.0
 */
public class ReconstructionOptions {

  public final double maxDimension;
  public final double voxelSize;
  public final double oversampling;
  public final int maxGridSize;
  public final int maxIterations;
  public final int shrinkwrapCadence;
  public final int shrinkwrapMinStep;
  public final double thresholdFraction;
  public final double thresholdFinal;
  public final double thresholdStep;
  public final double sigmaStart;
  public final double sigmaEnd;
  public final double sigmaDecay;
  public final double boundingScale;
  public final boolean monotonicSupport;
  public final boolean enforceConnectivity;
  public final int connectivityStep;
  public final boolean recenter;
  public final int maxBadMasks;
  public final int maxRestarts;
  public final int plateauWindow;
  public final double plateauTolerance;
  public final double convergenceThreshold;
  public final long randomSeed;
  public final boolean enforceFlatSolvent;
  public final double flatSolventRadiusScale;
  public final double electronCount;
  public final ScaleMethod scaleMethod;
  public final AmplitudeMode amplitudeMode;
  public final boolean chiSquareWeighting;
  public final double imaginaryTolerance;
  public final int maxInstabilityWarnings;
  public final int printFrequency;

  private ReconstructionOptions(Builder b) {
    maxDimension = b.maxDimension;
    voxelSize = b.voxelSize;
    oversampling = b.oversampling;
    maxGridSize = b.maxGridSize;
    maxIterations = b.maxIterations;
    shrinkwrapCadence = b.shrinkwrapCadence;
    shrinkwrapMinStep = b.shrinkwrapMinStep;
    thresholdFraction = b.thresholdFraction;
    thresholdFinal = Double.isNaN(b.thresholdFinal) ? b.thresholdFraction : b.thresholdFinal;
    thresholdStep = b.thresholdStep;
    sigmaStart = b.sigmaStart;
    sigmaEnd = b.sigmaEnd;
    sigmaDecay = b.sigmaDecay;
    boundingScale = b.boundingScale;
    monotonicSupport = b.monotonicSupport;
    enforceConnectivity = b.enforceConnectivity;
    connectivityStep = b.connectivityStep;
    recenter = b.recenter;
    maxBadMasks = b.maxBadMasks;
    maxRestarts = b.maxRestarts;
    plateauWindow = b.plateauWindow;
    plateauTolerance = b.plateauTolerance;
    convergenceThreshold = b.convergenceThreshold;
    randomSeed = (b.randomSeed != null) ? b.randomSeed : System.nanoTime();
    enforceFlatSolvent = b.enforceFlatSolvent;
    flatSolventRadiusScale = b.flatSolventRadiusScale;
    electronCount = b.electronCount;
    scaleMethod = b.scaleMethod;
    amplitudeMode = b.amplitudeMode;
    chiSquareWeighting = b.chiSquareWeighting;
    imaginaryTolerance = b.imaginaryTolerance;
    maxInstabilityWarnings = b.maxInstabilityWarnings;
    printFrequency = b.printFrequency;
    validate();
  }

  public static Builder builder(double maxDimension) {
    return new Builder().maxDimension(maxDimension);
  }

  /**
   * Read the options for a data file from the system properties, the data file's properties file,
   * the user properties file and the file named by SDX_PROPERTIES, in that order of precedence.
   *
   * @param dataFile the scattering data file.
   * @return the options.
   * @throws ConfigurationException for a missing, malformed or invalid value.
   */
  public static ReconstructionOptions load(File dataFile) {
    return fromProperties(PropertyLoader.loadProperties(dataFile));
  }

  /**
   * Read the options from properties. Keys that are absent take their defaults; "max-dimension"
   * is required.
   *
   * @param properties the properties.
   * @return the options.
   * @throws ConfigurationException for a missing, malformed or invalid value.
   */
  public static ReconstructionOptions fromProperties(CompositeConfiguration properties) {
    if (!properties.containsKey("max-dimension")) {
      throw new ConfigurationException(" The max-dimension property is required.");
    }
    Builder d = new Builder();
    try {
      Builder b = new Builder()
          .maxDimension(properties.getDouble("max-dimension"))
          .voxelSize(properties.getDouble("voxel-size", d.voxelSize))
          .oversampling(properties.getDouble("oversampling", d.oversampling))
          .maxGridSize(properties.getInt("max-grid-size", d.maxGridSize))
          .maxIterations(properties.getInt("max-iterations", d.maxIterations))
          .shrinkwrapCadence(properties.getInt("shrinkwrap-cadence", d.shrinkwrapCadence))
          .shrinkwrapMinStep(properties.getInt("shrinkwrap-min-step", d.shrinkwrapMinStep))
          .thresholdFraction(properties.getDouble("shrinkwrap-threshold-fraction", d.thresholdFraction))
          .thresholdFinal(properties.getDouble("shrinkwrap-threshold-final", d.thresholdFinal))
          .thresholdStep(properties.getDouble("shrinkwrap-threshold-step", d.thresholdStep))
          .sigmaStart(properties.getDouble("shrinkwrap-sigma-start", d.sigmaStart))
          .sigmaEnd(properties.getDouble("shrinkwrap-sigma-end", d.sigmaEnd))
          .sigmaDecay(properties.getDouble("shrinkwrap-sigma-decay", d.sigmaDecay))
          .boundingScale(properties.getDouble("support-bounding-scale", d.boundingScale))
          .monotonicSupport(properties.getBoolean("monotonic-support", d.monotonicSupport))
          .enforceConnectivity(properties.getBoolean("enforce-connectivity", d.enforceConnectivity))
          .connectivityStep(properties.getInt("enforce-connectivity-step", d.connectivityStep))
          .recenter(properties.getBoolean("recenter", d.recenter))
          .maxBadMasks(properties.getInt("max-bad-masks", d.maxBadMasks))
          .maxRestarts(properties.getInt("max-restarts", d.maxRestarts))
          .plateauWindow(properties.getInt("plateau-window", d.plateauWindow))
          .plateauTolerance(properties.getDouble("plateau-tolerance", d.plateauTolerance))
          .convergenceThreshold(properties.getDouble("convergence-threshold", d.convergenceThreshold))
          .enforceFlatSolvent(properties.getBoolean("enforce-flat-solvent", d.enforceFlatSolvent))
          .flatSolventRadiusScale(properties.getDouble("flat-solvent-radius-scale", d.flatSolventRadiusScale))
          .electronCount(properties.getDouble("electron-count", d.electronCount))
          .scaleMethod(ScaleMethod.parse(properties.getString("scale-method", d.scaleMethod.name())))
          .amplitudeMode(AmplitudeMode.parse(properties.getString("amplitude-mode", d.amplitudeMode.name())))
          .chiSquareWeighting(properties.getBoolean("chi-squared-weighting", d.chiSquareWeighting))
          .imaginaryTolerance(properties.getDouble("imaginary-tolerance", d.imaginaryTolerance))
          .maxInstabilityWarnings(properties.getInt("max-instability-warnings", d.maxInstabilityWarnings))
          .printFrequency(properties.getInt("print-frequency", d.printFrequency));
      if (properties.containsKey("random-seed")) {
        b.randomSeed(properties.getLong("random-seed"));
      }
      return b.build();
    } catch (ConversionException e) {
      throw new ConfigurationException(" Malformed reconstruction property: " + e.getMessage(), e);
    }
  }

  private void validate() {
    positive("max-dimension", maxDimension);
    positive("voxel-size", voxelSize);
    if (!(oversampling > 1.0) || Double.isInfinite(oversampling)) {
      fail("oversampling", oversampling, "must exceed 1");
    }
    if (maxGridSize < GridSpace.MIN_GRID_SIZE) {
      fail("max-grid-size", maxGridSize, "must be at least " + GridSpace.MIN_GRID_SIZE);
    }
    atLeast("max-iterations", maxIterations, 1);
    atLeast("shrinkwrap-cadence", shrinkwrapCadence, 1);
    atLeast("shrinkwrap-min-step", shrinkwrapMinStep, 0);
    if (!(thresholdFraction > 0.0 && thresholdFraction <= 1.0)) {
      fail("shrinkwrap-threshold-fraction", thresholdFraction, "must be in (0, 1]");
    }
    if (!(thresholdFinal >= thresholdFraction && thresholdFinal <= 1.0)) {
      fail("shrinkwrap-threshold-final", thresholdFinal, "must be in [start fraction, 1]");
    }
    if (!(thresholdStep >= 0.0)) {
      fail("shrinkwrap-threshold-step", thresholdStep, "must not be negative");
    }
    if (thresholdFinal > thresholdFraction && thresholdStep == 0.0) {
      fail("shrinkwrap-threshold-step", thresholdStep, "must be positive to anneal the threshold");
    }
    if (!(sigmaEnd >= 0.0) || Double.isInfinite(sigmaEnd)) {
      fail("shrinkwrap-sigma-end", sigmaEnd, "must be a non-negative number");
    }
    if (!(sigmaStart >= sigmaEnd) || Double.isInfinite(sigmaStart)) {
      fail("shrinkwrap-sigma-start", sigmaStart, "must be finite and at least shrinkwrap-sigma-end");
    }
    if (!(sigmaDecay > 0.0 && sigmaDecay <= 1.0)) {
      fail("shrinkwrap-sigma-decay", sigmaDecay, "must be in (0, 1]");
    }
    if (sigmaDecay == 1.0 && sigmaStart > sigmaEnd) {
      fail("shrinkwrap-sigma-decay", sigmaDecay, "must be below 1 to narrow the smoothing width");
    }
    positive("support-bounding-scale", boundingScale);
    atLeast("enforce-connectivity-step", connectivityStep, 0);
    atLeast("max-bad-masks", maxBadMasks, 1);
    atLeast("max-restarts", maxRestarts, 0);
    atLeast("plateau-window", plateauWindow, 1);
    if (!(plateauTolerance >= 0.0) || Double.isInfinite(plateauTolerance)) {
      fail("plateau-tolerance", plateauTolerance, "must be a non-negative number");
    }
    if (!(convergenceThreshold >= 0.0) || Double.isInfinite(convergenceThreshold)) {
      fail("convergence-threshold", convergenceThreshold, "must be a non-negative number");
    }
    positive("flat-solvent-radius-scale", flatSolventRadiusScale);
    if (!(electronCount >= 0.0) || Double.isInfinite(electronCount)) {
      fail("electron-count", electronCount, "must be a non-negative number");
    }
    if (scaleMethod == null) {
      throw new ConfigurationException(" A scale method is required.");
    }
    if (amplitudeMode == null) {
      throw new ConfigurationException(" An amplitude mode is required.");
    }
    positive("imaginary-tolerance", imaginaryTolerance);
    atLeast("max-instability-warnings", maxInstabilityWarnings, 1);
    atLeast("print-frequency", printFrequency, 1);
  }

  private static void positive(String key, double value) {
    if (!(value > 0.0) || Double.isInfinite(value)) {
      fail(key, value, "must be a positive number");
    }
  }

  private static void atLeast(String key, int value, int min) {
    if (value < min) {
      fail(key, value, "must be at least " + min);
    }
  }

  private static void fail(String key, Object value, String reason) {
    throw new ConfigurationException(format(" Invalid %s (%s): %s.", key, value, reason));
  }

  /**
   * Build the grid described by these options.
   *
   * @return the grid.
   * @throws ConfigurationException for a degenerate grid.
   */
  public GridSpace createGrid() {
    return GridSpace.create(maxDimension, voxelSize, oversampling, maxGridSize);
  }

  /**
   * A copy of these options with another random seed.
   *
   * @param seed the seed.
   * @return the new options.
   */
  public ReconstructionOptions withSeed(long seed) {
    return toBuilder().randomSeed(seed).build();
  }

  /**
   * A builder initialized with these options.
   *
   * @return the builder.
   */
  public Builder toBuilder() {
    return new Builder()
        .maxDimension(maxDimension).voxelSize(voxelSize).oversampling(oversampling)
        .maxGridSize(maxGridSize).maxIterations(maxIterations)
        .shrinkwrapCadence(shrinkwrapCadence).shrinkwrapMinStep(shrinkwrapMinStep)
        .thresholdFraction(thresholdFraction).thresholdFinal(thresholdFinal)
        .thresholdStep(thresholdStep).sigmaStart(sigmaStart).sigmaEnd(sigmaEnd)
        .sigmaDecay(sigmaDecay).boundingScale(boundingScale).monotonicSupport(monotonicSupport)
        .enforceConnectivity(enforceConnectivity).connectivityStep(connectivityStep)
        .recenter(recenter).maxBadMasks(maxBadMasks).maxRestarts(maxRestarts)
        .plateauWindow(plateauWindow).plateauTolerance(plateauTolerance)
        .convergenceThreshold(convergenceThreshold).randomSeed(randomSeed)
        .enforceFlatSolvent(enforceFlatSolvent).flatSolventRadiusScale(flatSolventRadiusScale)
        .electronCount(electronCount).scaleMethod(scaleMethod).amplitudeMode(amplitudeMode)
        .chiSquareWeighting(chiSquareWeighting).imaginaryTolerance(imaginaryTolerance)
        .maxInstabilityWarnings(maxInstabilityWarnings).printFrequency(printFrequency);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("\n Reconstruction Settings\n");
    sb.append(format("  Maximum dimension:           %10.3f A\n", maxDimension));
    sb.append(format("  Voxel size (requested):      %10.3f A\n", voxelSize));
    sb.append(format("  Oversampling:                %10.3f\n", oversampling));
    sb.append(format("  Maximum iterations:          %10d\n", maxIterations));
    sb.append(format("  Shrink-wrap cadence:         %10d from iteration %d\n",
        shrinkwrapCadence, shrinkwrapMinStep));
    sb.append(format("  Shrink-wrap threshold:       %10.3f to %5.3f by %5.3f\n",
        thresholdFraction, thresholdFinal, thresholdStep));
    sb.append(format("  Shrink-wrap sigma (voxels):  %10.3f to %5.3f, decay %5.3f\n",
        sigmaStart, sigmaEnd, sigmaDecay));
    sb.append(format("  Bounding radius:             %10.3f A\n", boundingScale * maxDimension));
    sb.append(format("  Monotonic support:           %10b\n", monotonicSupport));
    sb.append(format("  Connectivity:                %10b from iteration %d\n",
        enforceConnectivity, connectivityStep));
    sb.append(format("  Recenter:                    %10b\n", recenter));
    sb.append(format("  Bad masks / restarts:        %10d / %d\n", maxBadMasks, maxRestarts));
    sb.append(format("  Plateau window / tolerance:  %10d / %8.2e\n", plateauWindow, plateauTolerance));
    sb.append(format("  Convergence threshold:       %10.3e\n", convergenceThreshold));
    sb.append(format("  Flat solvent:                %10b (radius %8.3f A)\n",
        enforceFlatSolvent, flatSolventRadiusScale * maxDimension));
    if (electronCount > 0.0) {
      sb.append(format("  Electron count:              %10.1f\n", electronCount));
    }
    sb.append(format("  Scale method:                %10s\n", scaleMethod));
    sb.append(format("  Amplitude mode:              %10s\n", amplitudeMode));
    sb.append(format("  Chi-squared weighting:       %10b\n", chiSquareWeighting));
    sb.append(format("  Random seed:                 %10d", randomSeed));
    return sb.toString();
  }

  /**
   * Fluent builder for {@link ReconstructionOptions}, holding the defaults.
   */
  public static class Builder {

    private double maxDimension = Double.NaN;
    private double voxelSize = 5.0;
    private double oversampling = 3.0;
    private int maxGridSize = 256;
    private int maxIterations = 10000;
    private int shrinkwrapCadence = 20;
    private int shrinkwrapMinStep = 100;
    private double thresholdFraction = 0.2;
    private double thresholdFinal = Double.NaN;
    private double thresholdStep = 0.01;
    private double sigmaStart = 3.0;
    private double sigmaEnd = 1.5;
    private double sigmaDecay = 0.99;
    private double boundingScale = 1.0;
    private boolean monotonicSupport = true;
    private boolean enforceConnectivity = true;
    private int connectivityStep = 500;
    private boolean recenter = true;
    private int maxBadMasks = 3;
    private int maxRestarts = 2;
    private int plateauWindow = 100;
    private double plateauTolerance = 1.0e-3;
    private double convergenceThreshold = 0.0;
    private Long randomSeed = null;
    private boolean enforceFlatSolvent = false;
    private double flatSolventRadiusScale = 0.75;
    private double electronCount = 0.0;
    private ScaleMethod scaleMethod = ScaleMethod.LEAST_SQUARES;
    private AmplitudeMode amplitudeMode = AmplitudeMode.RESCALE;
    private boolean chiSquareWeighting = true;
    private double imaginaryTolerance = 1.0e-6;
    private int maxInstabilityWarnings = 25;
    private int printFrequency = 100;

    public Builder maxDimension(double maxDimension) {
      this.maxDimension = maxDimension;
      return this;
    }

    public Builder voxelSize(double voxelSize) {
      this.voxelSize = voxelSize;
      return this;
    }

    public Builder oversampling(double oversampling) {
      this.oversampling = oversampling;
      return this;
    }

    public Builder maxGridSize(int maxGridSize) {
      this.maxGridSize = maxGridSize;
      return this;
    }

    public Builder maxIterations(int maxIterations) {
      this.maxIterations = maxIterations;
      return this;
    }

    public Builder shrinkwrapCadence(int shrinkwrapCadence) {
      this.shrinkwrapCadence = shrinkwrapCadence;
      return this;
    }

    public Builder shrinkwrapMinStep(int shrinkwrapMinStep) {
      this.shrinkwrapMinStep = shrinkwrapMinStep;
      return this;
    }

    public Builder thresholdFraction(double thresholdFraction) {
      this.thresholdFraction = thresholdFraction;
      return this;
    }

    /**
     * Final threshold fraction; NaN (the default) keeps the starting fraction.
     *
     * @param thresholdFinal the final fraction.
     * @return this builder.
     */
    public Builder thresholdFinal(double thresholdFinal) {
      this.thresholdFinal = thresholdFinal;
      return this;
    }

    public Builder thresholdStep(double thresholdStep) {
      this.thresholdStep = thresholdStep;
      return this;
    }

    public Builder sigmaStart(double sigmaStart) {
      this.sigmaStart = sigmaStart;
      return this;
    }

    public Builder sigmaEnd(double sigmaEnd) {
      this.sigmaEnd = sigmaEnd;
      return this;
    }

    public Builder sigmaDecay(double sigmaDecay) {
      this.sigmaDecay = sigmaDecay;
      return this;
    }

    public Builder boundingScale(double boundingScale) {
      this.boundingScale = boundingScale;
      return this;
    }

    public Builder monotonicSupport(boolean monotonicSupport) {
      this.monotonicSupport = monotonicSupport;
      return this;
    }

    public Builder enforceConnectivity(boolean enforceConnectivity) {
      this.enforceConnectivity = enforceConnectivity;
      return this;
    }

    public Builder connectivityStep(int connectivityStep) {
      this.connectivityStep = connectivityStep;
      return this;
    }

    public Builder recenter(boolean recenter) {
      this.recenter = recenter;
      return this;
    }

    public Builder maxBadMasks(int maxBadMasks) {
      this.maxBadMasks = maxBadMasks;
      return this;
    }

    public Builder maxRestarts(int maxRestarts) {
      this.maxRestarts = maxRestarts;
      return this;
    }

    public Builder plateauWindow(int plateauWindow) {
      this.plateauWindow = plateauWindow;
      return this;
    }

    public Builder plateauTolerance(double plateauTolerance) {
      this.plateauTolerance = plateauTolerance;
      return this;
    }

    public Builder convergenceThreshold(double convergenceThreshold) {
      this.convergenceThreshold = convergenceThreshold;
      return this;
    }

    public Builder randomSeed(long randomSeed) {
      this.randomSeed = randomSeed;
      return this;
    }

    public Builder enforceFlatSolvent(boolean enforceFlatSolvent) {
      this.enforceFlatSolvent = enforceFlatSolvent;
      return this;
    }

    public Builder flatSolventRadiusScale(double flatSolventRadiusScale) {
      this.flatSolventRadiusScale = flatSolventRadiusScale;
      return this;
    }

    public Builder electronCount(double electronCount) {
      this.electronCount = electronCount;
      return this;
    }

    public Builder scaleMethod(ScaleMethod scaleMethod) {
      this.scaleMethod = scaleMethod;
      return this;
    }

    public Builder amplitudeMode(AmplitudeMode amplitudeMode) {
      this.amplitudeMode = amplitudeMode;
      return this;
    }

    public Builder chiSquareWeighting(boolean chiSquareWeighting) {
      this.chiSquareWeighting = chiSquareWeighting;
      return this;
    }

    public Builder imaginaryTolerance(double imaginaryTolerance) {
      this.imaginaryTolerance = imaginaryTolerance;
      return this;
    }

    public Builder maxInstabilityWarnings(int maxInstabilityWarnings) {
      this.maxInstabilityWarnings = maxInstabilityWarnings;
      return this;
    }

    public Builder printFrequency(int printFrequency) {
      this.printFrequency = printFrequency;
      return this;
    }

    /**
     * Validate and build the options. Without an explicit seed a time based one is chosen.
     *
     * @return the options.
     * @throws ConfigurationException for an invalid value.
     */
    public ReconstructionOptions build() {
      return new ReconstructionOptions(this);
    }
  }
}

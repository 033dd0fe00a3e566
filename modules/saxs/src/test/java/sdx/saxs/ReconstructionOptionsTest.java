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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.junit.Test;
import sdx.utilities.SDXTest;

/**
 * Tests reading and validating reconstruction options.
 */
public class ReconstructionOptionsTest extends SDXTest {

  private static CompositeConfiguration properties(String... keyValues) {
    PropertiesConfiguration configuration = new PropertiesConfiguration();
    for (int i = 0; i < keyValues.length; i += 2) {
      configuration.addProperty(keyValues[i], keyValues[i + 1]);
    }
    CompositeConfiguration properties = new CompositeConfiguration();
    properties.addConfiguration(configuration);
    return properties;
  }

  @Test
  public void testDefaults() {
    ReconstructionOptions options =
        ReconstructionOptions.fromProperties(properties("max-dimension", "50.0", "random-seed", "17"));
    assertEquals(50.0, options.maxDimension, 0.0);
    assertEquals(5.0, options.voxelSize, 0.0);
    assertEquals(3.0, options.oversampling, 0.0);
    assertEquals(10000, options.maxIterations);
    assertEquals(20, options.shrinkwrapCadence);
    assertEquals(0.2, options.thresholdFraction, 0.0);
    assertEquals(0.2, options.thresholdFinal, 0.0);
    assertEquals(100, options.plateauWindow);
    assertEquals(17L, options.randomSeed);
    assertFalse(options.enforceFlatSolvent);
    assertTrue(options.chiSquareWeighting);
    assertEquals(ScaleMethod.LEAST_SQUARES, options.scaleMethod);
    assertEquals(AmplitudeMode.RESCALE, options.amplitudeMode);
  }

  @Test
  public void testProperties() {
    ReconstructionOptions options = ReconstructionOptions.fromProperties(properties(
        "max-dimension", "80", "voxel-size", "4", "shrinkwrap-cadence", "10",
        "shrinkwrap-threshold-final", "0.3", "enforce-flat-solvent", "true",
        "scale-method", "first-shell", "amplitude-mode", "replace",
        "chi-squared-weighting", "false"));
    assertEquals(80.0, options.maxDimension, 0.0);
    assertEquals(4.0, options.voxelSize, 0.0);
    assertEquals(10, options.shrinkwrapCadence);
    assertEquals(0.3, options.thresholdFinal, 0.0);
    assertTrue(options.enforceFlatSolvent);
    assertEquals(ScaleMethod.FIRST_SHELL, options.scaleMethod);
    assertEquals(AmplitudeMode.REPLACE, options.amplitudeMode);
    assertFalse(options.chiSquareWeighting);
    assertEquals(60, options.createGrid().getN());
  }

  @Test(expected = ConfigurationException.class)
  public void testMissingMaxDimension() {
    ReconstructionOptions.fromProperties(properties("voxel-size", "5.0"));
  }

  @Test(expected = ConfigurationException.class)
  public void testMalformedValue() {
    ReconstructionOptions.fromProperties(properties("max-dimension", "fifty"));
  }

  @Test(expected = ConfigurationException.class)
  public void testOversamplingTooSmall() {
    ReconstructionOptions.builder(50.0).oversampling(1.0).build();
  }

  @Test(expected = ConfigurationException.class)
  public void testUnknownScaleMethod() {
    ReconstructionOptions.fromProperties(properties("max-dimension", "50", "scale-method", "median"));
  }

  @Test(expected = ConfigurationException.class)
  public void testFinalFractionBelowStart() {
    ReconstructionOptions.builder(50.0).thresholdFraction(0.3).thresholdFinal(0.2).build();
  }

  @Test
  public void testWithSeed() {
    ReconstructionOptions options = ReconstructionOptions.builder(50.0).randomSeed(1L).build();
    ReconstructionOptions other = options.withSeed(2L);
    assertEquals(2L, other.randomSeed);
    assertEquals(options.maxDimension, other.maxDimension, 0.0);
    assertTrue(options.toString().contains("Random seed"));
  }

  @Test
  public void testLoadFromDataFile() throws IOException {
    Path dir = createTemporaryDirectory();
    File data = dir.resolve("sphere.dat").toFile();
    Files.writeString(data.toPath(), "0.01 100.0 1.0\n", StandardCharsets.UTF_8);
    Files.writeString(dir.resolve("sphere.properties"),
        "max-dimension = 64.0\nmax-iterations = 500\nrandom-seed = 5\n", StandardCharsets.UTF_8);
    System.setProperty("max-iterations", "250");
    ReconstructionOptions options = ReconstructionOptions.load(data);
    assertEquals(64.0, options.maxDimension, 0.0);
    assertEquals(250, options.maxIterations);
    assertEquals(5L, options.randomSeed);
  }
}

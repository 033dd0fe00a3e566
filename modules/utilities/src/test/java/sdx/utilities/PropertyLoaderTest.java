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
package sdx.utilities;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.commons.configuration2.CompositeConfiguration;
import org.junit.Test;

/**
 * Tests the precedence of the layered property sources.
 */
public class PropertyLoaderTest extends SDXTest {

  @Test
  public void testDataFileProperties() throws IOException {
    Path dir = createTemporaryDirectory();
    File data = dir.resolve("lysozyme.dat").toFile();
    Files.writeString(data.toPath(), "0.01 100.0 1.0\n", StandardCharsets.UTF_8);
    Files.writeString(dir.resolve("lysozyme.properties"),
        "max-dimension = 50.0\nvoxel-size = 4.0\n", StandardCharsets.UTF_8);

    CompositeConfiguration properties = PropertyLoader.loadProperties(data);
    assertEquals(50.0, properties.getDouble("max-dimension"), 0.0);
    assertEquals(4.0, properties.getDouble("voxel-size"), 0.0);
    assertTrue(properties.containsKey("propertyFile"));
  }

  @Test
  public void testSystemPropertiesTakePrecedence() throws IOException {
    Path dir = createTemporaryDirectory();
    File data = dir.resolve("sphere.dat").toFile();
    Files.writeString(data.toPath(), "0.01 100.0 1.0\n", StandardCharsets.UTF_8);
    Files.writeString(dir.resolve("sphere.properties"), "voxel-size = 4.0\n", StandardCharsets.UTF_8);

    System.setProperty("voxel-size", "3.5");
    CompositeConfiguration properties = PropertyLoader.loadProperties(data);
    assertEquals(3.5, properties.getDouble("voxel-size"), 0.0);
  }

  @Test
  public void testMissingDataFileProperties() {
    Path dir = createTemporaryDirectory();
    CompositeConfiguration properties = PropertyLoader.loadProperties(dir.resolve("absent.dat").toFile());
    assertFalse(properties.containsKey("propertyFile"));
    assertEquals(5.0, properties.getDouble("voxel-size", 5.0), 0.0);
  }

  @Test
  public void testPropExtension() throws IOException {
    Path dir = createTemporaryDirectory();
    File data = dir.resolve("insulin.dat").toFile();
    Files.writeString(data.toPath(), "0.01 100.0 1.0\n", StandardCharsets.UTF_8);
    Files.writeString(dir.resolve("insulin.prop"), "max-restarts = 4\n", StandardCharsets.UTF_8);

    CompositeConfiguration properties = PropertyLoader.loadProperties(data);
    assertEquals(4, properties.getInt("max-restarts"));
  }

  @Test
  public void testUserPropertiesBelowDataFile() throws IOException {
    Path userDir = Path.of(System.getProperty("user.home"), ".sdx");
    Files.createDirectories(userDir);
    Files.writeString(userDir.resolve("sdx.properties"),
        "voxel-size = 6.0\nmax-iterations = 500\n", StandardCharsets.UTF_8);
    Path dir = createTemporaryDirectory();
    File data = dir.resolve("sphere.dat").toFile();
    Files.writeString(data.toPath(), "0.01 100.0 1.0\n", StandardCharsets.UTF_8);
    Files.writeString(dir.resolve("sphere.properties"), "voxel-size = 4.0\n", StandardCharsets.UTF_8);

    CompositeConfiguration properties = PropertyLoader.loadProperties(data);
    assertEquals(4.0, properties.getDouble("voxel-size"), 0.0);
    assertEquals(500, properties.getInt("max-iterations"));
  }
}

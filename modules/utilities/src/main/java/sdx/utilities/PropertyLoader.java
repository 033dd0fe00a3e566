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

import java.io.File;
import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.io.FilenameUtils;

/**
 * The PropertyLoader class assembles the layered configuration used by a reconstruction.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class PropertyLoader {

  private static final Logger logger = Logger.getLogger(PropertyLoader.class.getName());

  /**
   * Name of the environment variable that points to a system wide property file.
   */
  public static final String ENVIRONMENT_VARIABLE = "SDX_PROPERTIES";

  /**
   * Location of the user property file relative to the home directory.
   */
  public static final String USER_PROPERTY_FILE = ".sdx" + File.separator + "sdx.properties";

  private PropertyLoader() {
    // Static methods only.
  }

  /**
   * Load properties without a data file specific property file.
   *
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   */
  public static CompositeConfiguration loadProperties() {
    return loadProperties(null);
  }

  /**
   * This method sets up configuration properties in the following precedence order:
   * <p>
   * 1.) Java system properties a.) -Dkey=value from the Java command line b.)
   * System.setProperty("key","value") within Java code.
   * <p>
   * 2.) Data file specific properties (for example lysozyme.properties next to lysozyme.dat)
   * <p>
   * 3.) User specific properties (~/.sdx/sdx.properties)
   * <p>
   * 4.) System wide properties (file defined by environment variable SDX_PROPERTIES)
   *
   * @param file the scattering data file, or null.
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   */
  public static CompositeConfiguration loadProperties(File file) {
    CompositeConfiguration properties = new CompositeConfiguration();

    // JVM system properties are read first.
    PropertiesConfiguration systemConfiguration = new PropertiesConfiguration();
    systemConfiguration.append(new SystemConfiguration());
    systemConfiguration.setHeader("JVM system properties (i.e. command line -Dkey=value pairs).");
    properties.addConfiguration(systemConfiguration);

    // Data file specific options are 2nd.
    if (file != null) {
      String basename = FilenameUtils.removeExtension(file.getAbsolutePath());
      String propertyFilename =
          (new File(basename + ".properties").exists()) ? basename + ".properties"
              : (new File(basename + ".prop").exists()) ? basename + ".prop"
              : null;
      if (propertyFilename != null) {
        File dataPropFile = new File(propertyFilename);
        PropertiesConfiguration dataConfiguration = readPropertyFile(dataPropFile);
        if (dataConfiguration != null) {
          dataConfiguration.setHeader("Data file properties (" + propertyFilename + ").");
          properties.addConfiguration(dataConfiguration);
          try {
            properties.addProperty("propertyFile", dataPropFile.getCanonicalPath());
          } catch (IOException e) {
            logger.log(Level.INFO, " Could not resolve the canonical path of {0}.", propertyFilename);
          }
        }
      }
    }

    // User specific options are 3rd.
    String filename = System.getProperty("user.home") + File.separator + USER_PROPERTY_FILE;
    File userPropFile = new File(filename);
    if (userPropFile.exists()) {
      PropertiesConfiguration userConfiguration = readPropertyFile(userPropFile);
      if (userConfiguration != null) {
        userConfiguration.setHeader("SDX user property file (" + filename + ").");
        properties.addConfiguration(userConfiguration);
      }
    }

    // System wide options are last.
    filename = System.getenv(ENVIRONMENT_VARIABLE);
    if (filename != null) {
      File systemPropFile = new File(filename);
      if (systemPropFile.exists()) {
        PropertiesConfiguration envConfiguration = readPropertyFile(systemPropFile);
        if (envConfiguration != null) {
          envConfiguration.setHeader("Environment variable " + ENVIRONMENT_VARIABLE + " (" + filename + ").");
          properties.addConfiguration(envConfiguration);
        }
      }
    }

    return properties;
  }

  /**
   * Read a single property file.
   *
   * @param propertyFile the file to read.
   * @return the parsed configuration, or null if the file could not be read.
   */
  private static PropertiesConfiguration readPropertyFile(File propertyFile) {
    if (!propertyFile.canRead()) {
      logger.info(String.format(" Property file %s is not readable.", propertyFile));
      return null;
    }
    try {
      FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
          new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
              .configure(new Parameters().properties()
                  .setFile(propertyFile)
                  .setThrowExceptionOnMissing(true)
                  .setIncludesAllowed(false));
      return builder.getConfiguration();
    } catch (ConfigurationException e) {
      logger.log(Level.WARNING, " Error loading " + propertyFile, e);
      return null;
    }
  }
}

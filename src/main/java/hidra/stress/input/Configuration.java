package hidra.stress.input;

import hidra.stress.fields.FuseCriterion;
import hidra.stress.fields.PointList;
import java.io.File;
import java.net.URL;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.XMLConfiguration;
import org.apache.log4j.Logger;

/**
 * Configuration file including the numeric tolerances used when reducing strain and stress fields.
 * These include the resolution below which two sample positions are considered the same point,
 * the criterion used to merge repeated measurements of one point,
 * the tolerances within which reference spacings of different directions must agree,
 * and the highest fitting cost accepted from the peak fits.
 */
public class Configuration {

  private static Configuration instance;

  private static final String DEFAULT_CONFIG_PATH = "stress-suite-config.xml";
  private static final Logger logger = Logger.getLogger(Configuration.class);

  private String loadedConfigPath;

  private double pointResolution = PointList.DEFAULT_RESOLUTION;
  private FuseCriterion fuseCriterion = FuseCriterion.MIN_ERROR;
  private double dReferenceRelativeTolerance = 1.0E-7;
  private double dReferenceAbsoluteTolerance = 0.;
  private double maxChi2 = 1.0E20;

  /**
   * Read in a configuration. If there is no file at the given location, the copy embedded in
   * the program resources is read instead. Values missing from the file keep their defaults.
   *
   * @param configLocation path of the XML configuration file
   */
  private Configuration(String configLocation) {
    logger.info("Attempting reading in config file from " + configLocation);
    loadedConfigPath = configLocation;
    try {
      XMLConfiguration config;
      if (new File(configLocation).exists()) {
        config = new XMLConfiguration(configLocation);
      } else {
        URL embedded = Configuration.class.getClassLoader().getResource(DEFAULT_CONFIG_PATH);
        if (embedded == null) {
          logger.warn("No config file at " + configLocation
              + " and none embedded in resources, using defaults");
          return;
        }
        logger.info("No config file at " + configLocation + ", reading embedded " + embedded);
        config = new XMLConfiguration(embedded);
      }

      pointResolution = config.getDouble("Points.Resolution", pointResolution);
      String criterionParam = config.getString("Fields.FuseCriterion");
      if (criterionParam != null) {
        fuseCriterion = FuseCriterion.fromName(criterionParam);
      }
      dReferenceRelativeTolerance =
          config.getDouble("DReference.RelativeTolerance", dReferenceRelativeTolerance);
      dReferenceAbsoluteTolerance =
          config.getDouble("DReference.AbsoluteTolerance", dReferenceAbsoluteTolerance);
      maxChi2 = config.getDouble("Peaks.MaxChi2", maxChi2);

      logger.info("Succesfully loaded in configuration: " + configLocation);
    } catch (ConfigurationException | IllegalArgumentException e) {
      logger.error("Error encountered while reading XML file, load failed, using defaults", e);
    }
  }

  /**
   * Gets the current instance of the configuration, or creates one if none exists
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance() {
    return getInstance(System.getProperty("user.dir") + File.separator + DEFAULT_CONFIG_PATH);
  }

  /**
   * Gets the current instance of the configuration, or creates one from a specified file if none
   * exists.
   * @param configLocation New configuration file location to read from
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance(String configLocation) {
    if (instance == null) {
      instance = new Configuration(configLocation);
    }
    return instance;
  }

  /**
   * Replaces the current instance with one read from a specified file, discarding any changes
   * made to the settings of the old instance that were not saved.
   * @param configLocation Configuration file location to read from
   * @return the new configuration instance
   */
  synchronized public static Configuration reload(String configLocation) {
    instance = new Configuration(configLocation);
    return instance;
  }

  /**
   * Gets the largest difference along any coordinate axis for which two sample positions are
   * treated as the same point. Defaults to 0.001 (mm) if not specified.
   *
   * The property is defined from Configuration.Points.Resolution
   * @return coordinate tolerance
   */
  public double getPointResolution() {
    return pointResolution;
  }

  public void setPointResolution(double replacement) {
    if (replacement < 0) {
      throw new IllegalArgumentException("Point resolution cannot be negative: " + replacement);
    }
    pointResolution = replacement;
  }

  /**
   * Gets the criterion used to merge repeated measurements of one point (as in stitched runs)
   * before stresses are calculated. Defaults to min_error.
   *
   * The property is defined from Configuration.Fields.FuseCriterion
   * @return criterion for merging measurements
   */
  public FuseCriterion getFuseCriterion() {
    return fuseCriterion;
  }

  public void setFuseCriterion(FuseCriterion replacement) {
    fuseCriterion = replacement;
  }

  /**
   * Gets the relative tolerance within which reference spacings of different directions must
   * agree at a shared point. Defaults to 1e-7.
   *
   * The property is defined from Configuration.DReference.RelativeTolerance
   * @return relative tolerance
   */
  public double getDReferenceRelativeTolerance() {
    return dReferenceRelativeTolerance;
  }

  public void setDReferenceRelativeTolerance(double replacement) {
    dReferenceRelativeTolerance = replacement;
  }

  /**
   * Gets the absolute tolerance within which reference spacings of different directions must
   * agree at a shared point. Defaults to 0.
   *
   * The property is defined from Configuration.DReference.AbsoluteTolerance
   * @return absolute tolerance
   */
  public double getDReferenceAbsoluteTolerance() {
    return dReferenceAbsoluteTolerance;
  }

  public void setDReferenceAbsoluteTolerance(double replacement) {
    dReferenceAbsoluteTolerance = replacement;
  }

  /**
   * Gets the highest peak fitting cost (chi-squared) accepted when screening fits.
   * Defaults to 1e20, which keeps every finite fit.
   *
   * The property is defined from Configuration.Peaks.MaxChi2
   * @return fitting cost ceiling
   */
  public double getMaxChi2() {
    return maxChi2;
  }

  public void setMaxChi2(double replacement) {
    maxChi2 = replacement;
  }

  /**
   * Writes out the current configuration to the file it was read from
   * (or to be created at that location, if the embedded copy was used).
   */
  public void saveCurrentConfig() {
    XMLConfiguration config = new XMLConfiguration();
    config.setRootElementName("Configuration");
    config.setProperty("Points.Resolution", pointResolution);
    config.setProperty("Fields.FuseCriterion", fuseCriterion.getName());
    config.setProperty("DReference.RelativeTolerance", dReferenceRelativeTolerance);
    config.setProperty("DReference.AbsoluteTolerance", dReferenceAbsoluteTolerance);
    config.setProperty("Peaks.MaxChi2", maxChi2);
    try {
      config.save(loadedConfigPath);
      logger.info("Saved configuration to " + loadedConfigPath);
    } catch (ConfigurationException e) {
      logger.error(e);
    }
  }

}

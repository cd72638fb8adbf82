package hidra.stress.input;

import hidra.stress.utils.NumericUtils;
import java.util.Arrays;
import org.apache.commons.math3.util.Pair;
import org.apache.log4j.Logger;

/**
 * Holds the fitted parameters of one diffraction peak over all sub runs (scan points) of a run.
 * The fitting itself is done elsewhere; this class keeps the fitted peak center with its
 * uncertainty, the fitting cost (chi-squared) of each sub run, and the reference (unstrained)
 * lattice spacing used to turn the peak positions into strains.
 *
 * The reference spacing may be a single value for the whole run or one value per sub run.
 * Sub runs whose fit is rejected keep their place but hold NaN parameters.
 */
public class PeakCollection {

  private static final Logger logger = Logger.getLogger(PeakCollection.class);

  private final int runNumber;
  private final String peakTag;
  private final String peakProfile;
  private final String backgroundType;

  private int[] subRuns;
  private double[] centerValues;
  private double[] centerErrors;
  private double[] fitCosts;

  private double dReferenceValue;
  private double dReferenceError;
  private double[] dReferenceValues;
  private double[] dReferenceErrors;

  /**
   * Create an empty collection for a peak of a run
   *
   * @param runNumber Run the peaks were measured in
   * @param peakTag Tag of the peak, such as "Si111"
   * @param peakProfile Name of the fitted peak shape, such as "Gaussian"
   * @param backgroundType Name of the fitted background, such as "Linear"
   */
  public PeakCollection(int runNumber, String peakTag, String peakProfile,
      String backgroundType) {
    this.runNumber = runNumber;
    this.peakTag = peakTag;
    this.peakProfile = peakProfile;
    this.backgroundType = backgroundType;
    subRuns = new int[]{};
    centerValues = new double[]{};
    centerErrors = new double[]{};
    fitCosts = new double[]{};
    dReferenceValue = Double.NaN;
    dReferenceError = 0.;
  }

  /**
   * Set the fitted peak centers for each sub run
   *
   * @param subRuns Sub run numbers
   * @param centers Fitted peak center of each sub run, in degrees two-theta
   * @param centerErrors Fitting uncertainty of each peak center, in degrees
   * @param fitCosts Chi-squared of each fit
   */
  public void setPeakFittingValues(int[] subRuns, double[] centers, double[] centerErrors,
      double[] fitCosts) {
    int count = subRuns.length;
    if (centers.length != count || centerErrors.length != count || fitCosts.length != count) {
      throw new IllegalArgumentException("Peak parameters for run " + runNumber
          + " do not match the number of sub runs (" + count + ")");
    }
    if (dReferenceValues != null && dReferenceValues.length != count) {
      throw new IllegalArgumentException("Reference spacings set for " + dReferenceValues.length
          + " sub runs but " + count + " sub runs were fit");
    }
    this.subRuns = subRuns.clone();
    this.centerValues = centers.clone();
    this.centerErrors = centerErrors.clone();
    this.fitCosts = fitCosts.clone();
  }

  /**
   * Use the same reference spacing for every sub run
   *
   * @param value reference lattice spacing
   * @param error uncertainty of the reference spacing
   */
  public void setDReference(double value, double error) {
    dReferenceValue = value;
    dReferenceError = error;
    dReferenceValues = null;
    dReferenceErrors = null;
  }

  /**
   * Use a different reference spacing for each sub run, in the order of the sub runs
   *
   * @param values reference lattice spacing of each sub run
   * @param errors uncertainty of each reference spacing
   */
  public void setDReference(double[] values, double[] errors) {
    if (values.length != errors.length || values.length != subRuns.length) {
      throw new IllegalArgumentException("Reference spacings for run " + runNumber
          + " do not match the number of sub runs (" + subRuns.length + ")");
    }
    dReferenceValues = values.clone();
    dReferenceErrors = errors.clone();
  }

  /**
   * Reject fits with a bad cost using the ceiling given in the configuration file
   *
   * @return number of sub runs rejected
   */
  public int applyFittingCostCriteria() {
    return applyFittingCostCriteria(Configuration.getInstance().getMaxChi2());
  }

  /**
   * Reject fits whose cost is NaN, infinite or above a ceiling. The rejected sub runs stay in the
   * collection with NaN peak center and uncertainty.
   *
   * @param maxChi2 highest acceptable chi-squared
   * @return number of sub runs rejected
   */
  public int applyFittingCostCriteria(double maxChi2) {
    int rejected = 0;
    for (int i = 0; i < fitCosts.length; ++i) {
      double cost = fitCosts[i];
      if (Double.isNaN(cost) || Double.isInfinite(cost) || cost > maxChi2) {
        centerValues[i] = Double.NaN;
        centerErrors[i] = Double.NaN;
        ++rejected;
      }
    }
    logger.info("Run " + runNumber + " (" + peakTag + "): rejected " + rejected + " of "
        + fitCosts.length + " fits with cost above " + maxChi2);
    return rejected;
  }

  /**
   * Find the position of a sub run within this collection
   *
   * @param subRun sub run number
   * @return 0-based index of the sub run
   * @throws IllegalArgumentException if the sub run was not fit
   */
  public int getSubRunIndex(int subRun) {
    for (int i = 0; i < subRuns.length; ++i) {
      if (subRuns[i] == subRun) {
        return i;
      }
    }
    throw new IllegalArgumentException("Sub run " + subRun + " not found in run " + runNumber);
  }

  /**
   * Get the fitted peak center of one sub run
   *
   * @param subRun sub run number
   * @return Pair of peak center and its uncertainty, in degrees two-theta
   */
  public Pair<Double, Double> getPeakCenter(int subRun) {
    int index = getSubRunIndex(subRun);
    return new Pair<>(centerValues[index], centerErrors[index]);
  }

  /**
   * Convert the peak centers to interplanar spacings using one wavelength for all sub runs
   *
   * @param wavelength wavelength of the incident beam
   * @return Pair of spacing values and their uncertainties, one per sub run
   */
  public Pair<double[], double[]> getDSpacing(double wavelength) {
    double[] wavelengths = new double[subRuns.length];
    Arrays.fill(wavelengths, wavelength);
    return getDSpacing(wavelengths);
  }

  /**
   * Convert the peak centers to interplanar spacings via Bragg's law, propagating the fitting
   * uncertainty of each peak center
   *
   * @param wavelengths wavelength of the incident beam for each sub run
   * @return Pair of spacing values and their uncertainties, one per sub run
   */
  public Pair<double[], double[]> getDSpacing(double[] wavelengths) {
    if (wavelengths.length != subRuns.length) {
      throw new IllegalArgumentException("Got " + wavelengths.length + " wavelengths for "
          + subRuns.length + " sub runs");
    }
    double[] dValues = new double[subRuns.length];
    double[] dErrors = new double[subRuns.length];
    for (int i = 0; i < subRuns.length; ++i) {
      dValues[i] = NumericUtils.twoThetaToDSpacing(centerValues[i], wavelengths[i]);
      dErrors[i] = NumericUtils.dSpacingError(dValues[i], centerValues[i], centerErrors[i]);
    }
    return new Pair<>(dValues, dErrors);
  }

  /**
   * Reference spacing of each sub run, repeating the uniform value if only one was given
   *
   * @return array with one reference spacing per sub run
   */
  public double[] getDReferenceValues() {
    if (dReferenceValues != null) {
      return dReferenceValues.clone();
    }
    double[] uniform = new double[subRuns.length];
    Arrays.fill(uniform, dReferenceValue);
    return uniform;
  }

  /**
   * Uncertainty of the reference spacing of each sub run
   *
   * @return array with one uncertainty per sub run
   */
  public double[] getDReferenceErrors() {
    if (dReferenceErrors != null) {
      return dReferenceErrors.clone();
    }
    double[] uniform = new double[subRuns.length];
    Arrays.fill(uniform, dReferenceError);
    return uniform;
  }

  public boolean isDReferenceUniform() {
    return dReferenceValues == null;
  }

  public int getRunNumber() {
    return runNumber;
  }

  public String getPeakTag() {
    return peakTag;
  }

  public String getPeakProfile() {
    return peakProfile;
  }

  public String getBackgroundType() {
    return backgroundType;
  }

  public int[] getSubRuns() {
    return subRuns.clone();
  }

  public double[] getCenterValues() {
    return centerValues.clone();
  }

  public double[] getCenterErrors() {
    return centerErrors.clone();
  }

  public double[] getFitCosts() {
    return fitCosts.clone();
  }

}

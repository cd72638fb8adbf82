package hidra.stress.input;

import hidra.stress.fields.PointList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Sample logs of a run, recorded once per sub run. The logs of interest here are the
 * sample-frame positions ({@value #VX}, {@value #VY}, {@value #VZ}) of each scan point and the
 * wavelength of the incident beam, which is either the same for all sub runs or given per sub run.
 */
public class ScanWorkspace {

  public static final String VX = "vx";
  public static final String VY = "vy";
  public static final String VZ = "vz";

  private final int[] subRuns;
  private final Map<String, double[]> sampleLogs;
  private double[] wavelengths;

  /**
   * Create a workspace for the given sub runs, initially with no logs and a NaN wavelength
   *
   * @param subRuns sub run numbers in the order the logs will be given
   */
  public ScanWorkspace(int[] subRuns) {
    this.subRuns = subRuns.clone();
    sampleLogs = new HashMap<>();
    wavelengths = new double[subRuns.length];
    Arrays.fill(wavelengths, Double.NaN);
  }

  /**
   * Add or replace a sample log
   *
   * @param logName name of the log, such as {@value #VX}
   * @param values value of the log for each sub run
   */
  public void setSampleLog(String logName, double[] values) {
    if (values.length != subRuns.length) {
      throw new IllegalArgumentException("Log " + logName + " has " + values.length
          + " entries for " + subRuns.length + " sub runs");
    }
    sampleLogs.put(logName, values.clone());
  }

  /**
   * Get a sample log
   *
   * @param logName name of the log
   * @return log value for each sub run of the workspace
   * @throws IllegalArgumentException if the log was never set
   */
  public double[] getSampleLog(String logName) {
    double[] values = sampleLogs.get(logName);
    if (values == null) {
      throw new IllegalArgumentException("Sample log " + logName + " not found");
    }
    return values.clone();
  }

  /**
   * Get a sample log for a selection of sub runs
   *
   * @param logName name of the log
   * @param selectedSubRuns sub run numbers, in the order wanted
   * @return log value of each selected sub run
   */
  public double[] getSampleLog(String logName, int[] selectedSubRuns) {
    double[] values = getSampleLog(logName);
    double[] selected = new double[selectedSubRuns.length];
    for (int i = 0; i < selectedSubRuns.length; ++i) {
      selected[i] = values[getSubRunIndex(selectedSubRuns[i])];
    }
    return selected;
  }

  public Set<String> getSampleLogNames() {
    return sampleLogs.keySet();
  }

  /**
   * Use the same wavelength for every sub run
   *
   * @param wavelength wavelength of the incident beam
   */
  public void setWavelength(double wavelength) {
    Arrays.fill(wavelengths, wavelength);
  }

  /**
   * Set the wavelength of each sub run
   *
   * @param wavelengths wavelength of the incident beam for each sub run
   */
  public void setWavelength(double[] wavelengths) {
    if (wavelengths.length != subRuns.length) {
      throw new IllegalArgumentException("Got " + wavelengths.length + " wavelengths for "
          + subRuns.length + " sub runs");
    }
    this.wavelengths = wavelengths.clone();
  }

  /**
   * Get the wavelength of a selection of sub runs
   *
   * @param selectedSubRuns sub run numbers, in the order wanted
   * @return wavelength of each selected sub run
   */
  public double[] getWavelengths(int[] selectedSubRuns) {
    double[] selected = new double[selectedSubRuns.length];
    for (int i = 0; i < selectedSubRuns.length; ++i) {
      selected[i] = wavelengths[getSubRunIndex(selectedSubRuns[i])];
    }
    return selected;
  }

  /**
   * Positions of a selection of sub runs, built from the vx, vy and vz sample logs
   *
   * @param selectedSubRuns sub run numbers, in the order wanted
   * @return list of the scan point positions
   */
  public PointList getPointList(int[] selectedSubRuns) {
    return new PointList(
        getSampleLog(VX, selectedSubRuns),
        getSampleLog(VY, selectedSubRuns),
        getSampleLog(VZ, selectedSubRuns));
  }

  public int[] getSubRuns() {
    return subRuns.clone();
  }

  private int getSubRunIndex(int subRun) {
    for (int i = 0; i < subRuns.length; ++i) {
      if (subRuns[i] == subRun) {
        return i;
      }
    }
    throw new IllegalArgumentException("Sub run " + subRun + " has no sample logs");
  }
}

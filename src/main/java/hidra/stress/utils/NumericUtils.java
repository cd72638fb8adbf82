package hidra.stress.utils;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import org.apache.commons.math3.util.FastMath;
import org.apache.commons.math3.util.Pair;

/**
 * Class containing methods to serve as math functions for the diffraction calculations,
 * mainly Bragg's law conversions, propagation of fitting uncertainties, and NaN-aware
 * operations over arrays of per-point measurements
 */
public class NumericUtils {

  public static final ThreadLocal<DecimalFormat> DECIMAL_FORMAT =
      ThreadLocal.withInitial(() -> {
        DecimalFormat format = new DecimalFormat("#.###");
        setInfinityPrintable(format);
        return format;
      });

  /**
   * Convert a peak position in two-theta (degrees) into an interplanar spacing via Bragg's law,
   * d = wavelength / (2 sin(two-theta / 2)).
   *
   * @param twoTheta Peak center in degrees two-theta
   * @param wavelength Wavelength of the incident beam, in the units d should be reported in
   * @return Interplanar spacing (NaN if the peak center is NaN)
   */
  public static double twoThetaToDSpacing(double twoTheta, double wavelength) {
    double halfTheta = FastMath.toRadians(twoTheta) * 0.5;
    return wavelength * 0.5 / FastMath.sin(halfTheta);
  }

  /**
   * Propagate the fitting uncertainty of a peak center through Bragg's law.
   * From the derivative of d with respect to two-theta:
   * sigma_d = d * (sigma_2theta / 2) * cot(two-theta / 2), with angles in radians.
   *
   * @param dSpacing Interplanar spacing calculated from the peak center
   * @param twoTheta Peak center in degrees two-theta
   * @param twoThetaError Uncertainty of the peak center in degrees
   * @return Absolute uncertainty of the interplanar spacing
   */
  public static double dSpacingError(double dSpacing, double twoTheta, double twoThetaError) {
    double halfTheta = FastMath.toRadians(twoTheta) * 0.5;
    double halfError = FastMath.toRadians(twoThetaError) * 0.5;
    return FastMath.abs(dSpacing * halfError * FastMath.cos(halfTheta) / FastMath.sin(halfTheta));
  }

  /**
   * Dimensionless strain of a measured spacing relative to its reference spacing
   *
   * @param dSpacing measured interplanar spacing
   * @param dReference unstrained (reference) spacing
   * @return (d - d0) / d0
   */
  public static double strain(double dSpacing, double dReference) {
    return (dSpacing - dReference) / dReference;
  }

  /**
   * Uncertainty of the strain. The spacing and the reference spacing are independent sources,
   * so their relative variances add; the ratio d/d0 scales the result back to an absolute value.
   *
   * @param dSpacing measured interplanar spacing
   * @param dSpacingError uncertainty of the measured spacing
   * @param dReference reference spacing
   * @param dReferenceError uncertainty of the reference spacing
   * @return absolute uncertainty of the strain value
   */
  public static double strainError(double dSpacing, double dSpacingError,
      double dReference, double dReferenceError) {
    double ratio = dSpacing / dReference;
    double relativeD = dSpacingError / dSpacing;
    double relativeD0 = dReferenceError / dReference;
    return FastMath.abs(ratio) * FastMath.sqrt(relativeD * relativeD + relativeD0 * relativeD0);
  }

  /**
   * Inverse-variance weighted mean of a set of measurements of one quantity.
   * Measurements with NaN value are left out. If any of the remaining measurements has zero
   * uncertainty, those exact measurements are averaged plainly and the result is given zero error.
   *
   * @param values measured values
   * @param errors uncertainty of each measured value
   * @return Pair of (mean, uncertainty of the mean); (NaN, NaN) if nothing could be averaged
   */
  public static Pair<Double, Double> weightedMean(double[] values, double[] errors) {
    double exactSum = 0.;
    int exactCount = 0;
    double weightedSum = 0.;
    double weightTotal = 0.;
    for (int i = 0; i < values.length; ++i) {
      if (Double.isNaN(values[i]) || Double.isNaN(errors[i])) {
        continue;
      }
      if (errors[i] == 0.) {
        exactSum += values[i];
        ++exactCount;
        continue;
      }
      double weight = 1. / (errors[i] * errors[i]);
      weightedSum += weight * values[i];
      weightTotal += weight;
    }
    if (exactCount > 0) {
      return new Pair<>(exactSum / exactCount, 0.);
    }
    if (weightTotal == 0.) {
      return new Pair<>(Double.NaN, Double.NaN);
    }
    return new Pair<>(weightedSum / weightTotal, 1. / FastMath.sqrt(weightTotal));
  }

  /**
   * Check two values for agreement in the manner of an all-close comparison:
   * |a - b| &lt;= absoluteTolerance + relativeTolerance * |b|
   *
   * @param a first value
   * @param b second value, which the relative tolerance is scaled by
   * @param relativeTolerance relative tolerance
   * @param absoluteTolerance absolute tolerance
   * @return true if the values agree within tolerance
   */
  public static boolean isClose(double a, double b, double relativeTolerance,
      double absoluteTolerance) {
    return FastMath.abs(a - b) <= absoluteTolerance + relativeTolerance * FastMath.abs(b);
  }

  /**
   * Join two arrays end to end
   *
   * @param first values to appear first
   * @param second values to appear after the first array's values
   * @return new array of length first.length + second.length
   */
  public static double[] concatenate(double[] first, double[] second) {
    double[] joined = new double[first.length + second.length];
    System.arraycopy(first, 0, joined, 0, first.length);
    System.arraycopy(second, 0, joined, first.length, second.length);
    return joined;
  }

  /**
   * Select entries of an array by index, in the order the indices are given
   *
   * @param array source array
   * @param indices 0-based positions into the source array
   * @return new array of the selected entries
   * @throws IndexOutOfBoundsException if any index is outside the array
   */
  public static double[] extract(double[] array, int[] indices) {
    double[] selection = new double[indices.length];
    for (int i = 0; i < indices.length; ++i) {
      int index = indices[i];
      if (index < 0 || index >= array.length) {
        throw new IndexOutOfBoundsException(
            "Index " + index + " out of range for length " + array.length);
      }
      selection[i] = array[index];
    }
    return selection;
  }

  /**
   * Replace NaN entries with zero, as when summing contributions where a missing
   * measurement should not count
   *
   * @param array values which may include NaN
   * @return copy of the array with NaN replaced by 0
   */
  public static double[] nanToZero(double[] array) {
    double[] out = new double[array.length];
    for (int i = 0; i < array.length; ++i) {
      out[i] = Double.isNaN(array[i]) ? 0. : array[i];
    }
    return out;
  }

  /**
   * Sets the infinity symbol for a decimal format as "Inf." rather than the unicode symbol
   * so that reports stay readable in plain-text outputs
   *
   * @param df Decimal format to modify
   */
  public static void setInfinityPrintable(DecimalFormat df) {
    DecimalFormatSymbols symbols = df.getDecimalFormatSymbols();
    symbols.setInfinity("Inf.");
    symbols.setNaN("NaN");
    df.setDecimalFormatSymbols(symbols);
  }

}

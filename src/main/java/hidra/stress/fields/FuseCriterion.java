package hidra.stress.fields;

import hidra.stress.utils.NumericUtils;
import org.apache.commons.math3.util.Pair;

/**
 * Rule deciding the surviving value when several measurements fall on the same location.
 * Each constant resolves the values and errors measured at one location, listed in the order
 * the measurements were found, into a single value and error.
 */
public enum FuseCriterion {

  /**
   * Keep the measurement with the smallest uncertainty. On ties the measurement found first
   * wins. NaN values lose against any finite value.
   */
  MIN_ERROR("min_error") {
    @Override
    public Pair<Double, Double> resolve(double[] values, double[] errors) {
      int best = representative(values, errors);
      return new Pair<>(values[best], errors[best]);
    }

    @Override
    public int representative(double[] values, double[] errors) {
      int best = 0;
      for (int i = 1; i < values.length; ++i) {
        if (isBetter(values[i], errors[i], values[best], errors[best])) {
          best = i;
        }
      }
      return best;
    }
  },
  /**
   * Replace the measurements by their inverse-variance weighted mean
   */
  AVERAGE("average") {
    @Override
    public Pair<Double, Double> resolve(double[] values, double[] errors) {
      Pair<Double, Double> mean = NumericUtils.weightedMean(values, errors);
      if (Double.isNaN(mean.getFirst())) {
        // nothing finite to average
        return new Pair<>(values[0], errors[0]);
      }
      return mean;
    }
  };

  private final String name;

  FuseCriterion(String name) {
    this.name = name;
  }

  /**
   * Get the criterion matching a name such as "min_error" or "average"
   *
   * @param name criterion name (case-insensitive)
   * @return matching criterion
   * @throws IllegalArgumentException if no criterion has that name
   */
  public static FuseCriterion fromName(String name) {
    for (FuseCriterion criterion : values()) {
      if (criterion.name.equalsIgnoreCase(name.trim())) {
        return criterion;
      }
    }
    throw new IllegalArgumentException("Unknown fuse criterion: " + name);
  }

  private static boolean isBetter(double value, double error, double bestValue, double bestError) {
    if (Double.isNaN(value)) {
      return false;
    }
    if (Double.isNaN(bestValue)) {
      return true;
    }
    if (Double.isNaN(error)) {
      return false;
    }
    return Double.isNaN(bestError) || error < bestError;
  }

  public String getName() {
    return name;
  }

  /**
   * Reduce the measurements taken at one location into one value
   *
   * @param values measured values, in the order they were found (at least one)
   * @param errors uncertainty of each measured value
   * @return Pair of surviving value and its uncertainty
   */
  public abstract Pair<Double, Double> resolve(double[] values, double[] errors);

  /**
   * Choose which of the measurements lends its coordinates to the resolved value.
   * Unless a criterion picks a single measurement, this is the first one found.
   *
   * @param values measured values, in the order they were found
   * @param errors uncertainty of each measured value
   * @return index of the representative measurement
   */
  public int representative(double[] values, double[] errors) {
    return 0;
  }

  @Override
  public String toString() {
    return name;
  }
}

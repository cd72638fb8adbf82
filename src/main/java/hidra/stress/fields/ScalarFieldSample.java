package hidra.stress.fields;

import hidra.stress.utils.NumericUtils;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.util.Pair;

/**
 * A scalar quantity (value and uncertainty) sampled at each point of a {@link PointList}.
 *
 * The name identifies the physical quantity ("strain", "d-reference", "stress11"...) and guards
 * against combining fields of different quantities. Missing or invalid measurements are kept as
 * NaN in the values and errors rather than shortening the arrays, so the values, errors and
 * points always have one common length.
 *
 * Fields are immutable once constructed; the set operations (extraction, aggregation, intersection
 * and fusion) return new fields. Operations that match points take an optional coordinate
 * resolution, defaulting to {@link PointList#DEFAULT_RESOLUTION}.
 */
public class ScalarFieldSample {

  private final String name;
  private final double[] values;
  private final double[] errors;
  private final PointList pointList;

  /**
   * Create a field from values, errors and the coordinates they were measured at
   *
   * @param name Name of the physical quantity
   * @param values Value at each point
   * @param errors Uncertainty of each value, in the units of the values
   * @param x x-coordinate of each point
   * @param y y-coordinate of each point
   * @param z z-coordinate of each point
   */
  public ScalarFieldSample(String name, double[] values, double[] errors,
      double[] x, double[] y, double[] z) {
    this(name, values, errors, new PointList(x, y, z));
  }

  /**
   * Create a field from values, errors and the list of points they were measured at
   *
   * @param name Name of the physical quantity
   * @param values Value at each point
   * @param errors Uncertainty of each value, in the units of the values
   * @param pointList Location of each value
   */
  public ScalarFieldSample(String name, double[] values, double[] errors, PointList pointList) {
    if (values.length != errors.length || values.length != pointList.size()) {
      throw new IllegalArgumentException("Field " + name + " has " + values.length
          + " values, " + errors.length + " errors and " + pointList.size() + " points");
    }
    this.name = name;
    this.values = values.clone();
    this.errors = errors.clone();
    this.pointList = pointList;
  }

  public String getName() {
    return name;
  }

  public int size() {
    return values.length;
  }

  public double[] getValues() {
    return values.clone();
  }

  public double[] getErrors() {
    return errors.clone();
  }

  public PointList getPointList() {
    return pointList;
  }

  public double[] getX() {
    return pointList.getX();
  }

  public double[] getY() {
    return pointList.getY();
  }

  public double[] getZ() {
    return pointList.getZ();
  }

  /**
   * Get coordinates of all points
   *
   * @return n x 3 array of {vx, vy, vz}
   */
  public double[][] getCoordinates() {
    return pointList.getCoordinates();
  }

  /**
   * Mask of the points holding an actual measurement
   *
   * @return array with true where the value is neither NaN nor infinite
   */
  public boolean[] isFinite() {
    boolean[] finite = new boolean[values.length];
    for (int i = 0; i < values.length; ++i) {
      finite[i] = Double.isFinite(values[i]);
    }
    return finite;
  }

  /**
   * Restrict the field to a subset of its points
   *
   * @param indices 0-based positions into this field, in the order they should appear
   * @return new field of the same name holding only the selected points
   * @throws IndexOutOfBoundsException if any index is not a position of this field
   */
  public ScalarFieldSample extract(int[] indices) {
    return new ScalarFieldSample(name,
        NumericUtils.extract(values, indices),
        NumericUtils.extract(errors, indices),
        pointList.extract(indices));
  }

  /**
   * Concatenate the points of another field of the same quantity after the points of this field.
   * Points measured in both fields remain as separate entries.
   *
   * @param other field to append
   * @return new field of length size() + other.size()
   * @throws IllegalArgumentException if the two fields are of different quantities
   */
  public ScalarFieldSample aggregate(ScalarFieldSample other) {
    checkSameQuantity(other, "aggregate");
    return new ScalarFieldSample(name,
        NumericUtils.concatenate(values, other.values),
        NumericUtils.concatenate(errors, other.errors),
        pointList.aggregate(other.pointList));
  }

  public ScalarFieldSample intersection(ScalarFieldSample other) {
    return intersection(other, PointList.DEFAULT_RESOLUTION);
  }

  /**
   * Keep only the locations measured in both fields. The measurements of this field at those
   * locations come first, followed by the measurements of the other field at the same locations,
   * so both readings of each common location can be compared before deciding how to merge them.
   *
   * @param other field to intersect with
   * @param resolution coordinate tolerance
   * @return new field of length twice the number of common points
   * @throws IllegalArgumentException if the two fields are of different quantities
   */
  public ScalarFieldSample intersection(ScalarFieldSample other, double resolution) {
    checkSameQuantity(other, "intersect");
    int[] ours = pointList.intersectionIndexes(other.pointList, resolution);
    int[] theirs = other.pointList.intersectionIndexes(pointList, resolution);
    return extract(ours).aggregate(other.extract(theirs));
  }

  public ScalarFieldSample coalesce(FuseCriterion criterion) {
    return coalesce(criterion, PointList.DEFAULT_RESOLUTION);
  }

  /**
   * Merge repeated measurements of the same location within this field, leaving one value per
   * distinct location. Locations are listed in the order they are first found, and the surviving
   * value of a repeated location is chosen by the criterion.
   *
   * @param criterion rule resolving repeated measurements
   * @param resolution coordinate tolerance
   * @return new field with one entry per distinct location
   */
  public ScalarFieldSample coalesce(FuseCriterion criterion, double resolution) {
    int[] groups = pointList.groupIndexes(resolution);
    List<List<Integer>> members = new ArrayList<>();
    for (int i = 0; i < groups.length; ++i) {
      if (groups[i] == members.size()) {
        members.add(new ArrayList<>());
      }
      members.get(groups[i]).add(i);
    }

    int count = members.size();
    double[] fusedValues = new double[count];
    double[] fusedErrors = new double[count];
    int[] representatives = new int[count];
    for (int g = 0; g < count; ++g) {
      List<Integer> group = members.get(g);
      double[] groupValues = new double[group.size()];
      double[] groupErrors = new double[group.size()];
      for (int k = 0; k < group.size(); ++k) {
        groupValues[k] = values[group.get(k)];
        groupErrors[k] = errors[group.get(k)];
      }
      Pair<Double, Double> resolved = criterion.resolve(groupValues, groupErrors);
      fusedValues[g] = resolved.getFirst();
      fusedErrors[g] = resolved.getSecond();
      representatives[g] = group.get(criterion.representative(groupValues, groupErrors));
    }
    return new ScalarFieldSample(name, fusedValues, fusedErrors,
        pointList.extract(representatives));
  }

  public ScalarFieldSample fuse(ScalarFieldSample other, FuseCriterion criterion) {
    return fuse(other, criterion, PointList.DEFAULT_RESOLUTION);
  }

  /**
   * Merge two fields into one holding a single value per distinct location. Locations measured
   * by only one field keep that field's value and error; locations measured by both are resolved
   * by the criterion. Locations are listed in the order they are first found, this field first.
   *
   * @param other field to merge with
   * @param criterion rule resolving locations measured by both fields
   * @param resolution coordinate tolerance
   * @return new fused field
   * @throws IllegalArgumentException if the two fields are of different quantities
   */
  public ScalarFieldSample fuse(ScalarFieldSample other, FuseCriterion criterion,
      double resolution) {
    checkSameQuantity(other, "fuse");
    return aggregate(other).coalesce(criterion, resolution);
  }

  /**
   * Copy of this field under a different quantity name
   *
   * @param newName name of the quantity
   * @return new field with the same values, errors and points
   */
  public ScalarFieldSample rename(String newName) {
    return new ScalarFieldSample(newName, values, errors, pointList);
  }

  private void checkSameQuantity(ScalarFieldSample other, String operation) {
    if (!name.equals(other.name)) {
      throw new IllegalArgumentException("Cannot " + operation
          + " fields of different physical quantities: " + name + " and " + other.name);
    }
  }

  @Override
  public String toString() {
    return "ScalarFieldSample[" + name + ", " + size() + " points]";
  }
}

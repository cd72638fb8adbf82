package hidra.stress.fields;

import hidra.stress.utils.NumericUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;
import org.apache.commons.math3.util.FastMath;

/**
 * Ordered list of sample-frame coordinates (vx, vy, vz) at which a quantity was measured.
 *
 * Two points are considered the same physical location when every one of their coordinates differ
 * by no more than a resolution (an absolute tolerance in the units of the coordinates). All the
 * set operations here, and all the field operations built on top of them, share the single
 * predicate {@link #coincide(PointList, int, PointList, int, double)} so that matching is defined
 * the same way everywhere.
 *
 * A list built from one scan holds each location once. Aggregating lists of several scans keeps
 * repeated locations as separate entries; these are later reconciled by fusing the field values.
 * Point lists are immutable, operations return new lists.
 */
public class PointList {

  /**
   * Default coordinate tolerance, in the units of the coordinates (mm)
   */
  public static final double DEFAULT_RESOLUTION = 1.0E-3;

  private final double[] vx;
  private final double[] vy;
  private final double[] vz;

  /**
   * Create a point list from coordinate arrays, which must all have the same length
   *
   * @param vx x-coordinates
   * @param vy y-coordinates
   * @param vz z-coordinates
   */
  public PointList(double[] vx, double[] vy, double[] vz) {
    if (vx.length != vy.length || vx.length != vz.length) {
      throw new IllegalArgumentException("Coordinate arrays have different lengths: "
          + vx.length + ", " + vy.length + ", " + vz.length);
    }
    this.vx = vx.clone();
    this.vy = vy.clone();
    this.vz = vz.clone();
  }

  /**
   * Check if point i of one list and point j of another list are the same location.
   * This is the only definition of point equality used by the set and field operations.
   *
   * @param first List holding the first point
   * @param i Index of the point in the first list
   * @param second List holding the second point
   * @param j Index of the point in the second list
   * @param resolution Largest difference allowed along each coordinate axis
   * @return True if all three coordinate differences are within resolution
   */
  public static boolean coincide(PointList first, int i, PointList second, int j,
      double resolution) {
    return FastMath.abs(first.vx[i] - second.vx[j]) <= resolution
        && FastMath.abs(first.vy[i] - second.vy[j]) <= resolution
        && FastMath.abs(first.vz[i] - second.vz[j]) <= resolution;
  }

  public int size() {
    return vx.length;
  }

  public double[] getX() {
    return vx.clone();
  }

  public double[] getY() {
    return vy.clone();
  }

  public double[] getZ() {
    return vz.clone();
  }

  /**
   * Get the coordinates of a single point
   *
   * @param index position of the point in the list
   * @return array of {vx, vy, vz}
   */
  public double[] getCoordinates(int index) {
    return new double[]{vx[index], vy[index], vz[index]};
  }

  /**
   * Get all coordinates as an n x 3 array, each row being {vx, vy, vz} of one point
   *
   * @return coordinates by point
   */
  public double[][] getCoordinates() {
    double[][] coordinates = new double[size()][];
    for (int i = 0; i < size(); ++i) {
      coordinates[i] = getCoordinates(i);
    }
    return coordinates;
  }

  /**
   * Find the first position in this list of a point of another list
   *
   * @param other list holding the point to find
   * @param j index of the point in the other list
   * @param resolution coordinate tolerance
   * @return index in this list, or -1 if no point of this list matches
   */
  public int indexOf(PointList other, int j, double resolution) {
    for (int i = 0; i < size(); ++i) {
      if (coincide(this, i, other, j, resolution)) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Find the first position in this list of the given coordinates
   *
   * @param x x-coordinate
   * @param y y-coordinate
   * @param z z-coordinate
   * @param resolution coordinate tolerance
   * @return index in this list, or -1 if no point of this list matches
   */
  public int indexOf(double x, double y, double z, double resolution) {
    PointList single = new PointList(new double[]{x}, new double[]{y}, new double[]{z});
    return indexOf(single, 0, resolution);
  }

  public boolean contains(double x, double y, double z) {
    return contains(x, y, z, DEFAULT_RESOLUTION);
  }

  public boolean contains(double x, double y, double z, double resolution) {
    return indexOf(x, y, z, resolution) >= 0;
  }

  /**
   * For each point of this list, the index of its first match in another list
   *
   * @param other list to search in
   * @param resolution coordinate tolerance
   * @return array of length size(), with -1 where the point has no match in the other list
   */
  public int[] matchingIndexes(PointList other, double resolution) {
    int[] matches = new int[size()];
    for (int i = 0; i < size(); ++i) {
      matches[i] = other.indexOf(this, i, resolution);
    }
    return matches;
  }

  /**
   * Indexes of the points of this list which are also present in another list,
   * in the order they appear in this list
   *
   * @param other list to compare against
   * @param resolution coordinate tolerance
   * @return indexes into this list
   */
  public int[] intersectionIndexes(PointList other, double resolution) {
    int[] matches = matchingIndexes(other, resolution);
    return indexesWhere(matches, true);
  }

  public PointList intersection(PointList other) {
    return intersection(other, DEFAULT_RESOLUTION);
  }

  /**
   * Points of this list present in another list, keeping the order and coordinates of this list
   *
   * @param other list to compare against
   * @param resolution coordinate tolerance
   * @return new list of the common points
   */
  public PointList intersection(PointList other, double resolution) {
    return extract(intersectionIndexes(other, resolution));
  }

  public PointList difference(PointList other) {
    return difference(other, DEFAULT_RESOLUTION);
  }

  /**
   * Points of this list that have no match in another list, in the order of this list
   *
   * @param other list whose points are removed
   * @param resolution coordinate tolerance
   * @return new list of the remaining points
   */
  public PointList difference(PointList other, double resolution) {
    int[] matches = matchingIndexes(other, resolution);
    return extract(indexesWhere(matches, false));
  }

  /**
   * Concatenate another list after this one. Repeated locations are not removed.
   *
   * @param other list whose points go after the points of this list
   * @return new list of size size() + other.size()
   */
  public PointList aggregate(PointList other) {
    return new PointList(
        NumericUtils.concatenate(vx, other.vx),
        NumericUtils.concatenate(vy, other.vy),
        NumericUtils.concatenate(vz, other.vz));
  }

  /**
   * Restrict the list to a selection of its points
   *
   * @param indices 0-based positions into this list, in the order wanted
   * @return new list of the selected points
   * @throws IndexOutOfBoundsException if any index is not a position of this list
   */
  public PointList extract(int[] indices) {
    return new PointList(
        NumericUtils.extract(vx, indices),
        NumericUtils.extract(vy, indices),
        NumericUtils.extract(vz, indices));
  }

  /**
   * Group the points of this list by location. Groups are numbered in the order their first
   * point is found, and a point joins a group when it coincides with that group's first point.
   *
   * @param resolution coordinate tolerance
   * @return group number of each point, array of length size()
   */
  public int[] groupIndexes(double resolution) {
    int[] groups = new int[size()];
    List<Integer> representatives = new ArrayList<>();
    for (int i = 0; i < size(); ++i) {
      int group = -1;
      for (int g = 0; g < representatives.size(); ++g) {
        if (coincide(this, i, this, representatives.get(g), resolution)) {
          group = g;
          break;
        }
      }
      if (group < 0) {
        group = representatives.size();
        representatives.add(i);
      }
      groups[i] = group;
    }
    return groups;
  }

  /**
   * Number of distinct locations in this list
   *
   * @param resolution coordinate tolerance
   * @return count of distinct points
   */
  public int distinctCount(double resolution) {
    int[] groups = groupIndexes(resolution);
    int max = -1;
    for (int group : groups) {
      max = Math.max(max, group);
    }
    return max + 1;
  }

  public boolean isEqualTo(PointList other) {
    return isEqualTo(other, DEFAULT_RESOLUTION);
  }

  /**
   * Compare two lists as sets of locations, regardless of the order of their points.
   * Each point of this list must be matched to a different point of the other list.
   *
   * @param other list to compare against
   * @param resolution coordinate tolerance
   * @return true if the lists hold the same locations
   */
  public boolean isEqualTo(PointList other, double resolution) {
    if (size() != other.size()) {
      return false;
    }
    boolean[] used = new boolean[other.size()];
    for (int i = 0; i < size(); ++i) {
      boolean found = false;
      for (int j = 0; j < other.size(); ++j) {
        if (!used[j] && coincide(this, i, other, j, resolution)) {
          used[j] = true;
          found = true;
          break;
        }
      }
      if (!found) {
        return false;
      }
    }
    return true;
  }

  private static int[] indexesWhere(int[] matches, boolean matched) {
    return IntStream.range(0, matches.length)
        .filter(i -> (matches[i] >= 0) == matched)
        .toArray();
  }

  @Override
  public String toString() {
    return "PointList[" + size() + " points]";
  }
}

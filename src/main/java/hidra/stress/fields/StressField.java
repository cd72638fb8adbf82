package hidra.stress.fields;

import hidra.stress.input.Configuration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import javax.swing.event.ChangeEvent;
import javax.swing.event.ChangeListener;
import javax.swing.event.EventListenerList;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.apache.log4j.Logger;

/**
 * Normal stresses derived from the strains measured along up to three orthogonal directions.
 *
 * The strains of each direction are first reduced to one value per location (stitched runs may
 * scan a location more than once), then restricted to the locations measured along every
 * required direction. Stresses exist only on this common support: a location missing from any
 * direction is dropped rather than given NaN. The formula applied depends on the
 * {@link StressType}; Young's modulus and the Poisson ratio are fixed at construction.
 *
 * Replacing the strain of a direction recalculates the stresses and notifies any registered
 * change listeners, so that views of this field can drop what they derived from the old strains.
 */
public class StressField {

  public static final String DIRECTION_11 = "11";
  public static final String DIRECTION_22 = "22";
  public static final String DIRECTION_33 = "33";
  public static final List<String> DIRECTIONS =
      Arrays.asList(DIRECTION_11, DIRECTION_22, DIRECTION_33);

  private static final Logger logger = Logger.getLogger(StressField.class);

  private final StressType stressType;
  private final double youngsModulus;
  private final double poissonRatio;
  private final double resolution;
  private final FuseCriterion criterion;
  private final EventListenerList eventHelper;

  private StrainField strain11;
  private StrainField strain22;
  private StrainField strain33;

  private PointList pointList;
  private ScalarFieldSample[] strains;
  private ScalarFieldSample[] stresses;

  /**
   * Create a stress field using the point resolution and fuse criterion of the configuration file
   *
   * @param strain11 strain along direction 11
   * @param strain22 strain along direction 22
   * @param strain33 strain along direction 33, null for the in-plane stress types
   * @param youngsModulus Young's modulus E
   * @param poissonRatio Poisson ratio nu
   * @param stressType measurement geometry
   */
  public StressField(StrainField strain11, StrainField strain22, StrainField strain33,
      double youngsModulus, double poissonRatio, StressType stressType) {
    this(strain11, strain22, strain33, youngsModulus, poissonRatio, stressType,
        Configuration.getInstance().getPointResolution(),
        Configuration.getInstance().getFuseCriterion());
  }

  /**
   * Create a stress field
   *
   * @param strain11 strain along direction 11
   * @param strain22 strain along direction 22
   * @param strain33 strain along direction 33, null for the in-plane stress types
   * @param youngsModulus Young's modulus E, must be positive
   * @param poissonRatio Poisson ratio nu, must be within (-1, 0.5)
   * @param stressType measurement geometry
   * @param resolution coordinate tolerance for matching points of different directions
   * @param criterion rule merging repeated measurements of one location within a direction
   */
  public StressField(StrainField strain11, StrainField strain22, StrainField strain33,
      double youngsModulus, double poissonRatio, StressType stressType, double resolution,
      FuseCriterion criterion) {
    if (!(youngsModulus > 0) || Double.isInfinite(youngsModulus)) {
      throw new IllegalArgumentException("Young's modulus must be positive: " + youngsModulus);
    }
    if (!(poissonRatio > -1. && poissonRatio < 0.5)) {
      throw new IllegalArgumentException(
          "Poisson ratio must be within (-1, 0.5): " + poissonRatio);
    }
    if (strain11 == null || strain22 == null) {
      throw new IllegalArgumentException("Strains along 11 and 22 are required");
    }
    checkStrain33(stressType, strain33);

    this.stressType = stressType;
    this.youngsModulus = youngsModulus;
    this.poissonRatio = poissonRatio;
    this.resolution = resolution;
    this.criterion = criterion;
    eventHelper = new EventListenerList();

    this.strain11 = strain11;
    this.strain22 = strain22;
    this.strain33 = strain33;
    calculate();
  }

  private static void checkStrain33(StressType stressType, StrainField strain33) {
    if (stressType == StressType.DIAGONAL && strain33 == null) {
      throw new IllegalArgumentException("Strain along 33 is required for " + stressType);
    }
    if (stressType != StressType.DIAGONAL && strain33 != null) {
      throw new IllegalArgumentException("Strain along 33 is not measured for " + stressType);
    }
  }

  /**
   * Recalculate the common support, the strains aligned to it and the stresses
   */
  private void calculate() {
    List<ScalarFieldSample> measured = new ArrayList<>();
    measured.add(strain11.coalesce(criterion, resolution));
    measured.add(strain22.coalesce(criterion, resolution));
    if (stressType == StressType.DIAGONAL) {
      measured.add(strain33.coalesce(criterion, resolution));
    }

    PointList common = measured.get(0).getPointList();
    for (int i = 1; i < measured.size(); ++i) {
      common = common.intersection(measured.get(i).getPointList(), resolution);
    }
    if (common.size() == 0) {
      logger.warn("No point was measured along all of the " + measured.size()
          + " directions, the stress field is empty");
    }

    RealVector[] values = new RealVector[3];
    RealVector[] errors = new RealVector[3];
    for (int i = 0; i < measured.size(); ++i) {
      ScalarFieldSample aligned =
          measured.get(i).extract(common.matchingIndexes(measured.get(i).getPointList(),
              resolution));
      values[i] = new ArrayRealVector(aligned.getValues(), false);
      errors[i] = new ArrayRealVector(aligned.getErrors(), false);
    }
    if (stressType != StressType.DIAGONAL) {
      RealVector[] derived =
          stressType.outOfPlaneStrain(values[0], values[1], errors[0], errors[1], poissonRatio);
      values[2] = derived[0];
      errors[2] = derived[1];
    }

    RealVector[] stressValues =
        stressType.stressValues(values[0], values[1], values[2], youngsModulus, poissonRatio);
    RealVector[] stressErrors =
        stressType.stressErrors(errors[0], errors[1], errors[2], youngsModulus, poissonRatio);

    pointList = common;
    strains = new ScalarFieldSample[3];
    stresses = new ScalarFieldSample[3];
    for (int i = 0; i < 3; ++i) {
      strains[i] = new ScalarFieldSample(StrainField.NAME, values[i].toArray(),
          errors[i].toArray(), common);
      stresses[i] = new ScalarFieldSample("stress" + DIRECTIONS.get(i),
          stressValues[i].toArray(), stressErrors[i].toArray(), common);
    }
    logger.info("Calculated " + stressType + " stresses at " + common.size() + " points");
  }

  /**
   * Add an object to the list of objects to be notified when a strain of this field is replaced
   *
   * @param listener ChangeListener to be notified (i.e., a facade caching derived fields)
   */
  public void addChangeListener(ChangeListener listener) {
    eventHelper.add(ChangeListener.class, listener);
  }

  public void removeChangeListener(ChangeListener listener) {
    eventHelper.remove(ChangeListener.class, listener);
  }

  private void fireStateChange() {
    ChangeListener[] listeners = eventHelper.getListeners(ChangeListener.class);
    if (listeners != null && listeners.length > 0) {
      ChangeEvent event = new ChangeEvent(this);
      for (ChangeListener listener : listeners) {
        listener.stateChanged(event);
      }
    }
  }

  /**
   * Replace the strain of one direction. Stresses are recalculated and listeners notified if
   * the new strain is a different object than the current one.
   *
   * @param direction one of "11", "22", "33"
   * @param strain new strain of that direction (null only for "33" of an in-plane type)
   */
  public void setStrain(String direction, StrainField strain) {
    if (strain == getStrainField(direction)) {
      return;
    }
    switch (direction) {
      case DIRECTION_11:
        if (strain == null) {
          throw new IllegalArgumentException("Strain along 11 is required");
        }
        strain11 = strain;
        break;
      case DIRECTION_22:
        if (strain == null) {
          throw new IllegalArgumentException("Strain along 22 is required");
        }
        strain22 = strain;
        break;
      default:
        checkStrain33(stressType, strain);
        strain33 = strain;
        break;
    }
    calculate();
    fireStateChange();
  }

  public void setStrain11(StrainField strain) {
    setStrain(DIRECTION_11, strain);
  }

  public void setStrain22(StrainField strain) {
    setStrain(DIRECTION_22, strain);
  }

  public void setStrain33(StrainField strain) {
    setStrain(DIRECTION_33, strain);
  }

  /**
   * The strain given for a direction, as measured (all runs, all points)
   *
   * @param direction one of "11", "22", "33"
   * @return measured strain, or null for "33" of an in-plane type
   */
  public StrainField getStrainField(String direction) {
    switch (checkDirection(direction)) {
      case 0:
        return strain11;
      case 1:
        return strain22;
      default:
        return strain33;
    }
  }

  /**
   * The strain of a direction on the common support of the stresses. Along 33 of an in-plane
   * type this is the strain implied by the geometry rather than a measured one.
   *
   * @param direction one of "11", "22", "33"
   * @return strain at the points of {@link #getPointList()}
   */
  public ScalarFieldSample getStrain(String direction) {
    return strains[checkDirection(direction)];
  }

  /**
   * The stress of a direction
   *
   * @param direction one of "11", "22", "33"
   * @return stress at the points of {@link #getPointList()}
   */
  public ScalarFieldSample getStress(String direction) {
    return stresses[checkDirection(direction)];
  }

  private static int checkDirection(String direction) {
    int index = DIRECTIONS.indexOf(direction);
    if (index < 0) {
      throw new IllegalArgumentException("Unknown direction " + direction
          + ", must be one of " + DIRECTIONS);
    }
    return index;
  }

  public StrainField getStrain11() {
    return strain11;
  }

  public StrainField getStrain22() {
    return strain22;
  }

  public StrainField getStrain33() {
    return strain33;
  }

  public ScalarFieldSample getStress11() {
    return stresses[0];
  }

  public ScalarFieldSample getStress22() {
    return stresses[1];
  }

  public ScalarFieldSample getStress33() {
    return stresses[2];
  }

  /**
   * Locations measured along all the required directions, where stresses are defined
   *
   * @return common support of the stresses
   */
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

  public StressType getStressType() {
    return stressType;
  }

  public double getYoungsModulus() {
    return youngsModulus;
  }

  public double getPoissonRatio() {
    return poissonRatio;
  }

  public double getResolution() {
    return resolution;
  }

  public FuseCriterion getFuseCriterion() {
    return criterion;
  }
}

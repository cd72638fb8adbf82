package hidra.stress;

import hidra.stress.fields.PointList;
import hidra.stress.fields.ScalarFieldSample;
import hidra.stress.fields.StrainField;
import hidra.stress.fields.StressField;
import hidra.stress.fields.StressType;
import hidra.stress.input.Configuration;
import hidra.stress.input.PeakCollection;
import hidra.stress.utils.NumericUtils;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.swing.event.ChangeEvent;
import javax.swing.event.ChangeListener;
import org.apache.log4j.Logger;

/**
 * Single point of access to the strains and stresses of a {@link StressField} for consumers such
 * as plots and exports.
 *
 * A consumer first makes a selection, either a direction ("11", "22", "33") or the number of one
 * of the runs measured along some direction, and then reads the strain or stress of that
 * selection. Stresses need every direction at once, so they can only be read for a direction,
 * never for a single run.
 *
 * Strains and stresses are cached by selection, and the consensus reference spacing is computed on
 * first request and kept. All of these are dropped as soon as a strain of the underlying stress
 * field is replaced, and rebuilt from scratch on the next read.
 */
public class StressFacade implements ChangeListener {

  private static final Logger logger = Logger.getLogger(StressFacade.class);

  private final StressField stressField;
  private String selection;

  private final Map<String, ScalarFieldSample> strainCache;
  private final Map<String, ScalarFieldSample> stressCache;
  // null until computed
  private ScalarFieldSample dReferenceCache;
  private boolean cachesValid;

  /**
   * Create a facade over a stress field, with nothing selected
   *
   * @param stressField strains and stresses to expose
   */
  public StressFacade(StressField stressField) {
    if (stressField == null) {
      throw new IllegalArgumentException("A stress field is required");
    }
    this.stressField = stressField;
    strainCache = new LinkedHashMap<>();
    stressCache = new LinkedHashMap<>();
    stressField.addChangeListener(this);
    updateCaches();
  }

  /**
   * Drop the cached strains, stresses and reference spacing when the stress field changes
   *
   * @param event change event from the stress field
   */
  @Override
  public void stateChanged(ChangeEvent event) {
    invalidateCaches();
  }

  /**
   * Drop all cached fields. They are rebuilt on the next read.
   */
  public void invalidateCaches() {
    logger.debug("Invalidating cached strains, stresses and reference spacing");
    strainCache.clear();
    stressCache.clear();
    dReferenceCache = null;
    cachesValid = false;
  }

  private void updateCaches() {
    if (cachesValid) {
      return;
    }
    logger.debug("Rebuilding strain and stress caches");
    strainCache.clear();
    stressCache.clear();
    for (String direction : StressField.DIRECTIONS) {
      strainCache.put(direction, stressField.getStrain(direction));
      stressCache.put(direction, stressField.getStress(direction));
    }
    for (String direction : StressField.DIRECTIONS) {
      StrainField strain = stressField.getStrainField(direction);
      if (strain == null) {
        continue;
      }
      List<PeakCollection> collections = strain.getPeakCollections();
      List<StrainField> runStrains = strain.getStrains();
      for (int i = 0; i < collections.size(); ++i) {
        String run = String.valueOf(collections.get(i).getRunNumber());
        if (strainCache.containsKey(run)) {
          logger.warn("Run " + run + " appears along more than one direction");
        }
        strainCache.put(run, runStrains.get(i));
      }
    }
    cachesValid = true;
  }

  public String getSelection() {
    return selection;
  }

  /**
   * Pick a scan direction ("11", "22", "33") or the run number of one of the runs
   *
   * @param choice direction or run number
   * @throws IllegalArgumentException if the choice is neither a direction nor a known run
   */
  public void setSelection(String choice) {
    if (choice == null) {
      throw new IllegalArgumentException("Selection cannot be null, use clearSelection()");
    }
    if (!StressField.DIRECTIONS.contains(choice) && !getAllRuns().contains(choice)) {
      if (choice.length() == 2) {
        throw new IllegalArgumentException("Unknown direction " + choice
            + ", must be one of " + StressField.DIRECTIONS);
      }
      throw new IllegalArgumentException("Unknown run number " + choice);
    }
    selection = choice;
  }

  public void clearSelection() {
    selection = null;
  }

  /**
   * Strain of the current selection. For a direction this is the strain on the common support of
   * the stresses; for a run, the strain of that run at all of its scan points.
   *
   * @return selected strain
   * @throws IllegalStateException if nothing is selected, or the selected run is no longer part
   *     of the stress field
   */
  public ScalarFieldSample getStrain() {
    if (selection == null) {
      throw new IllegalStateException("No selection has been entered");
    }
    updateCaches();
    ScalarFieldSample strain = strainCache.get(selection);
    if (strain == null) {
      throw new IllegalStateException("Unknown run number " + selection
          + ", the run was removed from the stress field after it was selected");
    }
    return strain;
  }

  /**
   * Stress along the selected direction
   *
   * @return selected stress
   * @throws IllegalStateException if nothing is selected, or a run rather than a direction is
   */
  public ScalarFieldSample getStress() {
    if (selection == null) {
      throw new IllegalStateException("No selection has been entered");
    }
    if (!StressField.DIRECTIONS.contains(selection)) {
      throw new IllegalStateException("Selection " + selection + " must specify one direction");
    }
    updateCaches();
    return stressCache.get(selection);
  }

  /**
   * Consensus reference spacing of the measured directions. The first call computes it, later
   * calls return the stored value until a strain of the stress field is replaced.
   *
   * Every measured direction contributes its own reference spacings, first reduced to one value
   * per location with the fuse criterion of the stress field (stitched runs of one direction may
   * overlap and need not agree with each other). Where several directions
   * have a (non-NaN) reference spacing at the same location they must agree, and the consensus is
   * their mean; a location with only one contribution takes that value, and one with none is NaN.
   *
   *   vx                 :   0.0  1.0  2.0  3.0  4.0  5.0  6.0  7.0
   *   d0 from strain 11  :   1.0  1.1  1.1  1.2  1.2  1.2  nan  nan
   *   d0 from strain 22  :   nan  1.1  1.1  1.2  1.2  nan  nan  nan
   *   d0 from strain 33  :   nan  nan  1.1  1.2  1.2  1.2  1.2  1.3
   *   consensus d0       :   1.0  1.1  1.1  1.2  1.2  1.2  1.2  1.3
   *
   * @return field named {@value StrainField#D_REFERENCE} over every location of any direction
   * @throws IllegalStateException if directions disagree on the reference spacing of a location
   */
  public ScalarFieldSample getDReference() {
    if (dReferenceCache == null) {
      dReferenceCache = computeDReference();
    }
    return dReferenceCache;
  }

  private ScalarFieldSample computeDReference() {
    Configuration config = Configuration.getInstance();
    double rtol = config.getDReferenceRelativeTolerance();
    double atol = config.getDReferenceAbsoluteTolerance();
    double resolution = stressField.getResolution();

    List<String> measured = measuredDirections();
    logger.debug("Computing consensus reference spacing from directions " + measured);

    // one value per location within each direction, so that only directions are compared
    ScalarFieldSample all = null;
    for (String direction : measured) {
      ScalarFieldSample d0 = stressField.getStrainField(direction).getDReference()
          .coalesce(stressField.getFuseCriterion(), resolution);
      all = (all == null) ? d0 : all.aggregate(d0);
    }
    double[] values = all.getValues();
    double[] errors = all.getErrors();
    int[] groups = all.getPointList().groupIndexes(resolution);

    int count = all.getPointList().distinctCount(resolution);
    int[] firstFound = new int[count];
    double[] sums = new double[count];
    double[] errorSums = new double[count];
    int[] contributions = new int[count];
    double[] reference = new double[count];
    for (int i = groups.length - 1; i >= 0; --i) {
      firstFound[groups[i]] = i;
    }
    for (int g = 0; g < count; ++g) {
      reference[g] = Double.NaN;
    }

    for (int i = 0; i < values.length; ++i) {
      int g = groups[i];
      if (Double.isNaN(values[i])) {
        continue;
      }
      if (contributions[g] == 0) {
        reference[g] = values[i];
      } else if (!NumericUtils.isClose(values[i], reference[g], rtol, atol)) {
        double[] point = all.getPointList().getCoordinates(i);
        throw new IllegalStateException("Reference spacings are different on different "
            + "directions at (" + point[0] + ", " + point[1] + ", " + point[2] + "): "
            + reference[g] + " and " + values[i]);
      }
      sums[g] += values[i];
      errorSums[g] += Double.isNaN(errors[i]) ? 0. : errors[i];
      ++contributions[g];
    }

    double[] consensus = new double[count];
    double[] consensusErrors = new double[count];
    for (int g = 0; g < count; ++g) {
      if (contributions[g] == 0) {
        consensus[g] = Double.NaN;
        consensusErrors[g] = Double.NaN;
      } else {
        consensus[g] = sums[g] / contributions[g];
        consensusErrors[g] = errorSums[g] / contributions[g];
      }
    }
    PointList points = all.getPointList().extract(firstFound);
    return new ScalarFieldSample(StrainField.D_REFERENCE, consensus, consensusErrors, points);
  }

  private List<String> measuredDirections() {
    if (stressField.getStressType() == StressType.DIAGONAL) {
      return StressField.DIRECTIONS;
    }
    return StressField.DIRECTIONS.subList(0, 2);
  }

  /**
   * Run numbers measured along a direction, in the order the runs were stitched
   *
   * @param direction one of "11", "22", "33"
   * @return run numbers as strings; empty for "33" of an in-plane type
   */
  public List<String> runs(String direction) {
    StrainField strain = stressField.getStrainField(direction);
    if (strain == null) {
      return Collections.emptyList();
    }
    List<String> runs = new ArrayList<>();
    for (PeakCollection collection : strain.getPeakCollections()) {
      runs.add(String.valueOf(collection.getRunNumber()));
    }
    return runs;
  }

  /**
   * Run numbers of all directions, direction 11 first
   *
   * @return list of run numbers as strings
   */
  public List<String> getAllRuns() {
    List<String> all = new ArrayList<>();
    for (String direction : StressField.DIRECTIONS) {
      all.addAll(runs(direction));
    }
    return all;
  }

  /**
   * Measured strain of a direction over all of its runs and points
   *
   * @param direction one of "11", "22", "33"
   * @return strain as measured, or null for "33" of an in-plane type
   */
  public StrainField getStrainField(String direction) {
    return stressField.getStrainField(direction);
  }

  public double[] getX() {
    return stressField.getX();
  }

  public double[] getY() {
    return stressField.getY();
  }

  public double[] getZ() {
    return stressField.getZ();
  }

  public double getYoungsModulus() {
    return stressField.getYoungsModulus();
  }

  public double getPoissonRatio() {
    return stressField.getPoissonRatio();
  }

  public StressType getStressType() {
    return stressField.getStressType();
  }

  public StressField getStressField() {
    return stressField;
  }
}

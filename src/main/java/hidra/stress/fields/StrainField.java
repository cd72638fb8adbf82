package hidra.stress.fields;

import hidra.stress.input.PeakCollection;
import hidra.stress.input.ScanWorkspace;
import hidra.stress.utils.NumericUtils;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.math3.util.Pair;
import org.apache.log4j.Logger;

/**
 * Strain along one scan direction, (d - d0) / d0, at each scan point.
 *
 * A strain built from a single run takes the peak centers of one {@link PeakCollection}, turns
 * them into spacings d with the wavelengths and positions recorded in the run's
 * {@link ScanWorkspace}, and compares them to the collection's reference spacing d0. The
 * uncertainty combines the relative variances of d and d0 as independent sources.
 *
 * Several runs scanning the same direction can be stitched into one composite strain. The points
 * of the runs are concatenated in run order, so a location scanned by two runs appears twice until
 * the field is fused. Each point of a composite remembers which run it came from.
 */
public class StrainField extends ScalarFieldSample {

  public static final String NAME = "strain";
  public static final String D_SPACING = "d-spacing";
  public static final String D_REFERENCE = "d-reference";

  private static final Logger logger = Logger.getLogger(StrainField.class);

  private final List<PeakCollection> peakCollections;
  private final List<StrainField> components;
  // index into peakCollections of the run each point came from
  private final int[] sources;
  private final ScalarFieldSample dSpacing;
  private final ScalarFieldSample dReference;

  private StrainField(ScalarFieldSample strain, ScalarFieldSample dSpacing,
      ScalarFieldSample dReference, List<PeakCollection> peakCollections,
      List<StrainField> components, int[] sources) {
    super(NAME, strain.getValues(), strain.getErrors(), strain.getPointList());
    this.dSpacing = dSpacing;
    this.dReference = dReference;
    this.peakCollections = Collections.unmodifiableList(new ArrayList<>(peakCollections));
    this.components = Collections.unmodifiableList(new ArrayList<>(components));
    this.sources = sources;
  }

  /**
   * Calculate the strain of a single run
   *
   * @param workspace sample logs of the run, giving positions and wavelengths
   * @param peakCollection fitted peak of the run, with its reference spacing
   * @return strain at each sub run of the peak collection
   */
  public static StrainField create(ScanWorkspace workspace, PeakCollection peakCollection) {
    int[] subRuns = peakCollection.getSubRuns();
    PointList points = workspace.getPointList(subRuns);
    double[] wavelengths = workspace.getWavelengths(subRuns);

    Pair<double[], double[]> d = peakCollection.getDSpacing(wavelengths);
    double[] dValues = d.getFirst();
    double[] dErrors = d.getSecond();
    double[] d0Values = peakCollection.getDReferenceValues();
    double[] d0Errors = peakCollection.getDReferenceErrors();

    double[] strainValues = new double[subRuns.length];
    double[] strainErrors = new double[subRuns.length];
    int missing = 0;
    for (int i = 0; i < subRuns.length; ++i) {
      strainValues[i] = NumericUtils.strain(dValues[i], d0Values[i]);
      strainErrors[i] =
          NumericUtils.strainError(dValues[i], dErrors[i], d0Values[i], d0Errors[i]);
      if (Double.isNaN(strainValues[i])) {
        ++missing;
      }
    }
    if (missing > 0) {
      logger.info("Run " + peakCollection.getRunNumber() + ": " + missing + " of "
          + subRuns.length + " scan points have no strain");
    }

    ScalarFieldSample strain = new ScalarFieldSample(NAME, strainValues, strainErrors, points);
    ScalarFieldSample dSpacing = new ScalarFieldSample(D_SPACING, dValues, dErrors, points);
    ScalarFieldSample dReference = new ScalarFieldSample(D_REFERENCE, d0Values, d0Errors, points);
    return new StrainField(strain, dSpacing, dReference,
        Collections.singletonList(peakCollection), Collections.emptyList(),
        new int[subRuns.length]);
  }

  /**
   * Stitch the strains of several runs into one, keeping the runs in the order given
   *
   * @param strains strains to stitch (at least one)
   * @return composite strain over all the runs
   */
  public static StrainField stitch(List<StrainField> strains) {
    if (strains.isEmpty()) {
      throw new IllegalArgumentException("No strains to stitch");
    }
    StrainField stitched = strains.get(0);
    for (int i = 1; i < strains.size(); ++i) {
      stitched = stitched.aggregate(strains.get(i));
    }
    return stitched;
  }

  /**
   * Append the runs of another strain after the runs of this one. Points scanned by both are kept
   * as separate entries.
   *
   * @param other strain of the same direction, from different runs
   * @return composite strain
   * @throws IllegalArgumentException if a run is part of both strains
   */
  public StrainField aggregate(StrainField other) {
    for (PeakCollection collection : other.peakCollections) {
      for (PeakCollection ours : peakCollections) {
        if (ours.getRunNumber() == collection.getRunNumber()) {
          throw new IllegalArgumentException(
              "Run " + collection.getRunNumber() + " is already part of this strain");
        }
      }
    }

    List<PeakCollection> joinedCollections = new ArrayList<>(peakCollections);
    joinedCollections.addAll(other.peakCollections);
    List<StrainField> joinedComponents = new ArrayList<>(getStrains());
    joinedComponents.addAll(other.getStrains());

    int[] joinedSources = new int[size() + other.size()];
    System.arraycopy(sources, 0, joinedSources, 0, size());
    for (int i = 0; i < other.size(); ++i) {
      joinedSources[size() + i] = other.sources[i] + peakCollections.size();
    }

    return new StrainField(super.aggregate(other),
        dSpacing.aggregate(other.dSpacing),
        dReference.aggregate(other.dReference),
        joinedCollections, joinedComponents, joinedSources);
  }

  /**
   * Peak collections of the runs making up this strain, in run order
   *
   * @return list with one collection per run
   */
  public List<PeakCollection> getPeakCollections() {
    return peakCollections;
  }

  /**
   * Strains of the individual runs making up this strain, in run order.
   * For a strain of a single run this is a list holding only this strain.
   *
   * @return list with one strain per run
   */
  public List<StrainField> getStrains() {
    if (components.isEmpty()) {
      return Collections.singletonList(this);
    }
    return components;
  }

  /**
   * Run number each point was measured in
   *
   * @return array of run numbers, one per point
   */
  public int[] getRunNumbers() {
    int[] runs = new int[size()];
    for (int i = 0; i < size(); ++i) {
      runs[i] = peakCollections.get(sources[i]).getRunNumber();
    }
    return runs;
  }

  /**
   * Interplanar spacing measured at each point, aligned with the strain's points
   *
   * @return field named {@value #D_SPACING}
   */
  public ScalarFieldSample getDSpacing() {
    return dSpacing;
  }

  /**
   * Reference spacing used at each point, aligned with the strain's points
   *
   * @return field named {@value #D_REFERENCE}
   */
  public ScalarFieldSample getDReference() {
    return dReference;
  }

  @Override
  public String toString() {
    return "StrainField[" + peakCollections.size() + " runs, " + size() + " points]";
  }
}

package hidra.stress.fields;

import static hidra.stress.test.TestUtils.constant;
import static hidra.stress.test.TestUtils.strain;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;
import javax.swing.event.ChangeListener;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.junit.Test;

public class StressFieldTest {

  private static final double E = 200.;
  private static final double NU = 0.3;
  private static final double RESOLUTION = PointList.DEFAULT_RESOLUTION;

  private static final double[] X = {0., 1., 2., 3.};

  private static StressField create(StrainField s11, StrainField s22, StrainField s33,
      StressType type) {
    return new StressField(s11, s22, s33, E, NU, type, RESOLUTION, FuseCriterion.MIN_ERROR);
  }

  @Test
  public void diagonal_hydrostaticStrain() {
    double eps = 0.001;
    StressField field = create(strain(1, X, constant(4, eps)), strain(2, X, constant(4, eps)),
        strain(3, X, constant(4, eps)), StressType.DIAGONAL);

    // sigma = E eps / (1 - 2 nu) for equal strains in all directions
    double expected = E * eps / (1. - 2. * NU);
    for (String direction : StressField.DIRECTIONS) {
      assertArrayEquals(constant(4, expected), field.getStress(direction).getValues(), 1E-9);
      assertArrayEquals(new double[4], field.getStress(direction).getErrors(), 0.);
      assertArrayEquals(constant(4, eps), field.getStrain(direction).getValues(), 1E-9);
    }
    assertEquals("stress11", field.getStress11().getName());
    assertEquals("stress33", field.getStress33().getName());
    assertEquals(4, field.getPointList().size());
  }

  @Test
  public void diagonal_generalStrain() {
    double e11 = 0.001;
    double e22 = -0.0005;
    double e33 = 0.002;
    StressField field = create(strain(1, X, constant(4, e11)), strain(2, X, constant(4, e22)),
        strain(3, X, constant(4, e33)), StressType.DIAGONAL);

    double twoMu = E / (1. + NU);
    double lambda = E * NU / ((1. + NU) * (1. - 2. * NU));
    double trace = e11 + e22 + e33;
    assertEquals(twoMu * e11 + lambda * trace, field.getStress11().getValues()[0], 1E-9);
    assertEquals(twoMu * e22 + lambda * trace, field.getStress22().getValues()[2], 1E-9);
    assertEquals(twoMu * e33 + lambda * trace, field.getStress33().getValues()[3], 1E-9);
  }

  @Test
  public void inPlaneStress_noOutOfPlaneStress() {
    double e11 = 0.001;
    double e22 = 0.002;
    StressField field = create(strain(1, X, constant(4, e11)), strain(2, X, constant(4, e22)),
        null, StressType.IN_PLANE_STRESS);

    double factor = E / (1. - NU * NU);
    assertArrayEquals(constant(4, factor * (e11 + NU * e22)),
        field.getStress11().getValues(), 1E-9);
    assertArrayEquals(constant(4, factor * (e22 + NU * e11)),
        field.getStress22().getValues(), 1E-9);
    assertArrayEquals(new double[4], field.getStress33().getValues(), 0.);
    assertArrayEquals(new double[4], field.getStress33().getErrors(), 0.);
    assertArrayEquals(constant(4, -NU / (1. - NU) * (e11 + e22)),
        field.getStrain(StressField.DIRECTION_33).getValues(), 1E-12);
    assertNull(field.getStrain33());
    assertNull(field.getStrainField(StressField.DIRECTION_33));
  }

  @Test
  public void inPlaneStrain_noOutOfPlaneStrain() {
    double e11 = 0.001;
    double e22 = 0.002;
    StressField field = create(strain(1, X, constant(4, e11)), strain(2, X, constant(4, e22)),
        null, StressType.IN_PLANE_STRAIN);

    double twoMu = E / (1. + NU);
    double lambda = E * NU / ((1. + NU) * (1. - 2. * NU));
    assertArrayEquals(constant(4, twoMu * e11 + lambda * (e11 + e22)),
        field.getStress11().getValues(), 1E-9);
    assertArrayEquals(constant(4, lambda * (e11 + e22)),
        field.getStress33().getValues(), 1E-9);
    assertArrayEquals(new double[4], field.getStrain(StressField.DIRECTION_33).getValues(), 0.);
  }

  @Test
  public void stressErrors_linearCombinationInQuadrature() {
    RealVector s11 = new ArrayRealVector(new double[]{0.1});
    RealVector s22 = new ArrayRealVector(new double[]{0.2});
    RealVector[] errors = StressType.IN_PLANE_STRESS.stressErrors(s11, s22, null, E, NU);
    double factor = E / (1. - NU * NU);
    double expected = Math.sqrt(Math.pow(factor * 0.1, 2) + Math.pow(factor * NU * 0.2, 2));
    assertEquals(expected, errors[0].getEntry(0), 1E-9);
    assertEquals(0., errors[2].getEntry(0), 0.);

    RealVector s33 = new ArrayRealVector(new double[]{0.});
    RealVector[] diagonal = StressType.DIAGONAL.stressErrors(s11, s22, s33, E, NU);
    double twoMu = E / (1. + NU);
    double lambda = E * NU / ((1. + NU) * (1. - 2. * NU));
    double expected22 = Math.sqrt(Math.pow(lambda * 0.1, 2) + Math.pow((twoMu + lambda) * 0.2, 2));
    assertEquals(expected22, diagonal[1].getEntry(0), 1E-9);
  }

  @Test
  public void supportIsTheCommonPoints() {
    StressField field = create(
        strain(1, new double[]{0., 1., 2., 3., 4.}, constant(5, 0.001)),
        strain(2, new double[]{1., 2., 3., 4., 5.}, constant(5, 0.001)),
        strain(3, new double[]{2., 3., 4., 5., 6.}, constant(5, 0.001)),
        StressType.DIAGONAL);
    assertArrayEquals(new double[]{2., 3., 4.}, field.getX(), 0.);
    assertEquals(3, field.getStress22().size());
    assertEquals(3, field.getStrain(StressField.DIRECTION_33).size());
    // measured strains keep all of their points
    assertEquals(5, field.getStrain11().size());
  }

  @Test
  public void directionsAreAlignedPointByPoint() {
    StressField field = create(
        strain(1, new double[]{0., 1., 2.}, new double[]{0.001, 0.002, 0.003}),
        strain(2, new double[]{2., 1., 0.}, new double[]{0.030, 0.020, 0.010}),
        null, StressType.IN_PLANE_STRAIN);
    assertArrayEquals(new double[]{0., 1., 2.}, field.getX(), 0.);
    assertArrayEquals(new double[]{0.010, 0.020, 0.030},
        field.getStrain(StressField.DIRECTION_22).getValues(), 1E-9);
  }

  @Test
  public void disjointDirectionsGiveEmptyField() {
    StressField field = create(strain(1, new double[]{0.}, new double[]{0.}),
        strain(2, new double[]{5.}, new double[]{0.}), null, StressType.IN_PLANE_STRESS);
    assertEquals(0, field.getPointList().size());
    assertEquals(0, field.getStress11().size());
  }

  @Test
  public void repeatedLocationsAreCoalesced() {
    StrainField stitched = StrainField.stitch(Arrays.asList(
        strain(1, new double[]{0., 1.}, new double[]{0.001, 0.001}),
        strain(2, new double[]{1., 2.}, new double[]{0.002, 0.002})));
    StressField field = create(stitched,
        strain(3, new double[]{0., 1., 2.}, constant(3, 0.)),
        null, StressType.IN_PLANE_STRAIN);
    assertEquals(3, field.getPointList().size());
    assertArrayEquals(new double[]{0.001, 0.001, 0.002},
        field.getStrain(StressField.DIRECTION_11).getValues(), 1E-9);
  }

  @Test
  public void invalidConstantsFail() {
    StrainField s = strain(1, X, constant(4, 0.));
    double[][] invalid = {{0., 0.3}, {-1., 0.3}, {Double.NaN, 0.3},
        {Double.POSITIVE_INFINITY, 0.3}, {E, 0.5}, {E, -1.}, {E, Double.NaN}};
    for (double[] constants : invalid) {
      try {
        new StressField(s, s, null, constants[0], constants[1], StressType.IN_PLANE_STRESS,
            RESOLUTION, FuseCriterion.MIN_ERROR);
        fail("Accepted E = " + constants[0] + ", nu = " + constants[1]);
      } catch (IllegalArgumentException e) {
        // expected
      }
    }
  }

  @Test
  public void strain33RequirementFollowsStressType() {
    StrainField s = strain(1, X, constant(4, 0.));
    try {
      create(s, s, null, StressType.DIAGONAL);
      fail();
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("33"));
    }
    try {
      create(s, s, s, StressType.IN_PLANE_STRAIN);
      fail();
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("33"));
    }
  }

  @Test
  public void unknownDirectionFails() {
    StrainField s = strain(1, X, constant(4, 0.));
    StressField field = create(s, s, null, StressType.IN_PLANE_STRESS);
    try {
      field.getStress("12");
      fail();
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("Unknown direction 12"));
    }
  }

  @Test
  public void setStrain_recalculatesAndNotifies() {
    StrainField s11 = strain(1, X, constant(4, 0.));
    StrainField s22 = strain(2, X, constant(4, 0.));
    StressField field = create(s11, s22, null, StressType.IN_PLANE_STRESS);
    AtomicInteger events = new AtomicInteger();
    ChangeListener listener = event -> {
      assertSame(field, event.getSource());
      events.incrementAndGet();
    };
    field.addChangeListener(listener);

    field.setStrain11(s11);
    assertEquals(0, events.get());

    StrainField replacement = strain(3, X, constant(4, 0.001));
    field.setStrain11(replacement);
    assertEquals(1, events.get());
    assertSame(replacement, field.getStrain11());
    double factor = E / (1. - NU * NU);
    assertArrayEquals(constant(4, factor * 0.001), field.getStress11().getValues(), 1E-9);

    field.removeChangeListener(listener);
    field.setStrain22(strain(4, X, constant(4, 0.)));
    assertEquals(1, events.get());
  }

  @Test
  public void setStrain_cannotAddStrain33ToInPlane() {
    StrainField s = strain(1, X, constant(4, 0.));
    StressField field = create(s, s, null, StressType.IN_PLANE_STRESS);
    try {
      field.setStrain33(strain(2, X, constant(4, 0.)));
      fail();
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("33"));
    }
  }

  @Test
  public void stressType_fromName() {
    assertEquals(StressType.IN_PLANE_STRESS, StressType.fromName("in_plane_stress"));
    assertEquals(StressType.IN_PLANE_STRAIN, StressType.fromName("In-Plane-Strain"));
    assertEquals(StressType.DIAGONAL, StressType.fromName("diagonal"));
    assertEquals(3, StressType.DIAGONAL.getMeasuredDirections());
    assertEquals(2, StressType.IN_PLANE_STRAIN.getMeasuredDirections());
  }
}

package hidra.stress.fields;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.stream.IntStream;
import org.junit.Before;
import org.junit.Test;

public class ScalarFieldSampleTest {

  // the last three points of sample1 overlap the first three points of sample2
  // within a resolution of 0.01
  private static final double RESOLUTION = 0.01;

  private ScalarFieldSample sample1;
  private ScalarFieldSample sample2;

  @Before
  public void setUp() {
    double[] zeros = new double[10];
    sample1 = new ScalarFieldSample("lattice",
        new double[]{1.000, 1.010, 1.020, 1.030, 1.040, 1.050, 1.060, 1.070, 1.080, 1.090},
        new double[]{0.000, 0.001, 0.002, 0.003, 0.004, 0.005, 0.006, 0.007, 0.008, 0.009},
        new double[]{0.000, 1.000, 2.000, 3.000, 4.000, 5.000, 6.000, 7.000, 8.000, 9.000},
        zeros, zeros);
    sample2 = new ScalarFieldSample("lattice",
        new double[]{1.071, 1.081, 1.091, 1.10, 1.11, 1.12, 1.13, 1.14, 1.15, 1.16},
        new double[]{0.008, 0.008, 0.008, 0.00, 0.01, 0.02, 0.03, 0.04, 0.05, 0.06},
        new double[]{7.009, 8.001, 9.005, 10.00, 11.00, 12.00, 13.00, 14.00, 15.00, 16.00},
        zeros, zeros);
  }

  private static ScalarFieldSample alongX(String name, double[] values, double[] errors,
      double[] x) {
    return new ScalarFieldSample(name, values, errors, x, new double[x.length],
        new double[x.length]);
  }

  @Test
  public void constructor_oneValueShort_fails() {
    try {
      new ScalarFieldSample("lattice", new double[9], new double[10], new double[10],
          new double[10], new double[10]);
      fail();
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("lattice"));
    }
  }

  @Test
  public void size_isNumberOfPoints() {
    assertEquals(10, sample1.size());
    assertEquals(10, sample1.getPointList().size());
  }

  @Test
  public void getters_returnCopies() {
    double[] values = sample1.getValues();
    values[0] = 100.;
    assertEquals(1.000, sample1.getValues()[0], 0.);
  }

  @Test
  public void extract_selectsInOrder() {
    ScalarFieldSample selection = sample1.extract(new int[]{0, 2, 4, 6, 8});
    assertEquals("lattice", selection.getName());
    assertArrayEquals(new double[]{1.000, 1.020, 1.040, 1.060, 1.080},
        selection.getValues(), 1E-12);
    assertArrayEquals(new double[]{0.000, 0.002, 0.004, 0.006, 0.008},
        selection.getErrors(), 1E-12);
    assertArrayEquals(new double[]{0.000, 2.000, 4.000, 6.000, 8.000}, selection.getX(), 1E-12);
  }

  @Test
  public void extract_fullRangeIsIdentity() {
    ScalarFieldSample same = sample1.extract(IntStream.range(0, sample1.size()).toArray());
    assertEquals(sample1.getName(), same.getName());
    assertArrayEquals(sample1.getValues(), same.getValues(), 0.);
    assertArrayEquals(sample1.getErrors(), same.getErrors(), 0.);
    assertTrue(sample1.getPointList().isEqualTo(same.getPointList()));
  }

  @Test
  public void extract_outOfRangeFails() {
    try {
      sample1.extract(new int[]{3, 10});
      fail();
    } catch (IndexOutOfBoundsException e) {
      // expected
    }
  }

  @Test
  public void aggregate_concatenatesWithoutMerging() {
    ScalarFieldSample sample = sample1.aggregate(sample2);
    assertEquals(20, sample.size());
    // index 9 is the last point of sample1, index 10 the first point of sample2
    assertArrayEquals(new double[]{1.090, 1.071},
        new double[]{sample.getValues()[9], sample.getValues()[10]}, 1E-12);
    assertArrayEquals(new double[]{0.009, 0.008},
        new double[]{sample.getErrors()[9], sample.getErrors()[10]}, 1E-12);
    assertArrayEquals(new double[]{9.000, 7.009},
        new double[]{sample.getX()[9], sample.getX()[10]}, 1E-12);
    double[] head = new double[10];
    System.arraycopy(sample.getValues(), 0, head, 0, 10);
    assertArrayEquals(sample1.getValues(), head, 0.);
  }

  @Test
  public void aggregate_differentQuantitiesFails() {
    try {
      sample1.aggregate(sample2.rename("strain"));
      fail();
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().toLowerCase()
          .contains("cannot aggregate fields of different physical quantities"));
    }
  }

  @Test
  public void intersection_keepsBothReadingsOfCommonPoints() {
    ScalarFieldSample sample = sample1.intersection(sample2, RESOLUTION);
    assertEquals(6, sample.size());
    assertEquals("lattice", sample.getName());
    assertArrayEquals(new double[]{1.070, 1.080, 1.090, 1.071, 1.081, 1.091},
        sample.getValues(), 1E-12);
    assertArrayEquals(new double[]{0.007, 0.008, 0.009, 0.008, 0.008, 0.008},
        sample.getErrors(), 1E-12);
    assertArrayEquals(new double[]{7.000, 8.000, 9.000, 7.009, 8.001, 9.005},
        sample.getX(), 1E-12);
  }

  @Test
  public void intersection_defaultResolutionIsTighter() {
    // 8.001 is within 1e-3 of 8.000, the others are not
    ScalarFieldSample sample = sample1.intersection(sample2);
    assertEquals(2, sample.size());
    assertArrayEquals(new double[]{8.000, 8.001}, sample.getX(), 1E-12);
  }

  @Test
  public void intersection_everyPointInBothOperands() {
    ScalarFieldSample sample = sample1.intersection(sample2, RESOLUTION);
    double[] x = sample.getX();
    for (double xi : x) {
      assertTrue(sample1.getPointList().contains(xi, 0, 0, RESOLUTION));
      assertTrue(sample2.getPointList().contains(xi, 0, 0, RESOLUTION));
    }
  }

  @Test
  public void fuse_minError() {
    ScalarFieldSample sample = sample1.fuse(sample2, FuseCriterion.MIN_ERROR, RESOLUTION);
    // discard the last point from sample1 and the first two points from sample2
    assertEquals(17, sample.size());
    assertEquals("lattice", sample.getName());
    double[] values = new double[5];
    double[] errors = new double[5];
    double[] x = new double[5];
    System.arraycopy(sample.getValues(), 6, values, 0, 5);
    System.arraycopy(sample.getErrors(), 6, errors, 0, 5);
    System.arraycopy(sample.getX(), 6, x, 0, 5);
    assertArrayEquals(new double[]{1.060, 1.070, 1.080, 1.091, 1.10}, values, 1E-12);
    assertArrayEquals(new double[]{0.006, 0.007, 0.008, 0.008, 0.0}, errors, 1E-12);
    assertArrayEquals(new double[]{6.000, 7.000, 8.000, 9.005, 10.00}, x, 1E-12);
  }

  @Test
  public void fuse_average() {
    ScalarFieldSample sample = sample1.fuse(sample2, FuseCriterion.AVERAGE, RESOLUTION);
    assertEquals(17, sample.size());
    // x = 8 has equal errors in both samples, so the plain mean and error / sqrt(2)
    assertEquals((1.080 + 1.081) / 2, sample.getValues()[8], 1E-12);
    assertEquals(0.008 / Math.sqrt(2), sample.getErrors()[8], 1E-12);
    // the average keeps the location of the first measurement
    assertEquals(9.000, sample.getX()[9], 1E-12);
  }

  @Test
  public void fuse_overlappingScans() {
    ScalarFieldSample first = alongX("strain", new double[]{1.0, 1.01, 1.02},
        new double[]{0.1, 0.2, 0.1}, new double[]{0, 1, 2});
    ScalarFieldSample second = alongX("strain", new double[]{1.03, 1.04, 1.05},
        new double[]{0.1, 0.1, 0.3}, new double[]{1, 2, 3});

    ScalarFieldSample aggregated = first.aggregate(second);
    assertEquals(6, aggregated.size());
    assertArrayEquals(new double[]{0, 1, 2, 1, 2, 3}, aggregated.getX(), 0.);

    ScalarFieldSample fused = first.fuse(second, FuseCriterion.MIN_ERROR);
    assertEquals(4, fused.size());
    assertArrayEquals(new double[]{0, 1, 2, 3}, fused.getX(), 0.);
    // x = 1: second has the smaller error; x = 2: a tie keeps the first
    assertArrayEquals(new double[]{1.0, 1.03, 1.02, 1.05}, fused.getValues(), 1E-12);
    assertArrayEquals(new double[]{0.1, 0.1, 0.1, 0.3}, fused.getErrors(), 1E-12);
  }

  @Test
  public void fuse_nanNeverWins() {
    ScalarFieldSample first = alongX("strain", new double[]{Double.NaN, 2.0},
        new double[]{Double.NaN, 0.5}, new double[]{0, 1});
    ScalarFieldSample second = alongX("strain", new double[]{1.0, Double.NaN},
        new double[]{0.9, 0.0}, new double[]{0, 1});
    ScalarFieldSample fused = first.fuse(second, FuseCriterion.MIN_ERROR);
    assertArrayEquals(new double[]{1.0, 2.0}, fused.getValues(), 0.);
  }

  @Test
  public void fuse_differentQuantitiesFails() {
    try {
      sample1.fuse(sample2.rename("strain"), FuseCriterion.MIN_ERROR);
      fail();
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("different physical quantities"));
    }
  }

  @Test
  public void coalesce_withoutRepeatsChangesNothing() {
    ScalarFieldSample same = sample1.coalesce(FuseCriterion.MIN_ERROR);
    assertArrayEquals(sample1.getValues(), same.getValues(), 0.);
    assertArrayEquals(sample1.getX(), same.getX(), 0.);
  }

  @Test
  public void isFinite_flagsMissingMeasurements() {
    ScalarFieldSample field = alongX("strain", new double[]{1.0, Double.NaN, 3.0},
        new double[3], new double[]{0, 1, 2});
    boolean[] finite = field.isFinite();
    assertTrue(finite[0]);
    assertFalse(finite[1]);
    assertTrue(finite[2]);
    assertEquals(3, field.size());
  }
}

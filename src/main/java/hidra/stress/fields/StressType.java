package hidra.stress.fields;

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;

/**
 * Measurement geometry used to collect the strains, which decides how Hooke's law for an
 * isotropic solid turns the normal strains into normal stresses.
 *
 * With lambda = E nu / ((1 + nu)(1 - 2 nu)) and 2 mu = E / (1 + nu), the general relation is
 * sigma_ii = 2 mu eps_ii + lambda (eps11 + eps22 + eps33). Each geometry fills in whatever
 * it does not measure: nothing for three directions, zero out-of-plane stress for in-plane
 * stress, zero out-of-plane strain for in-plane strain.
 *
 * Uncertainties are propagated as a linear combination of independent strain uncertainties.
 */
public enum StressType {

  /**
   * Strains measured along three orthogonal directions
   */
  DIAGONAL("diagonal", 3) {
    @Override
    public RealVector[] stressValues(RealVector e11, RealVector e22, RealVector e33,
        double youngsModulus, double poissonRatio) {
      double twoMu = twoMu(youngsModulus, poissonRatio);
      double lambda = lambda(youngsModulus, poissonRatio);
      RealVector trace = e11.add(e22).add(e33);
      return new RealVector[]{
          e11.mapMultiply(twoMu).add(trace.mapMultiply(lambda)),
          e22.mapMultiply(twoMu).add(trace.mapMultiply(lambda)),
          e33.mapMultiply(twoMu).add(trace.mapMultiply(lambda))
      };
    }

    @Override
    public RealVector[] stressErrors(RealVector s11, RealVector s22, RealVector s33,
        double youngsModulus, double poissonRatio) {
      double own = twoMu(youngsModulus, poissonRatio) + lambda(youngsModulus, poissonRatio);
      double cross = lambda(youngsModulus, poissonRatio);
      return new RealVector[]{
          quadrature(own, s11, cross, s22, cross, s33),
          quadrature(cross, s11, own, s22, cross, s33),
          quadrature(cross, s11, cross, s22, own, s33)
      };
    }

    @Override
    public RealVector[] outOfPlaneStrain(RealVector e11, RealVector e22, RealVector s11,
        RealVector s22, double poissonRatio) {
      throw new UnsupportedOperationException("Strain 33 is measured for " + getName());
    }
  },

  /**
   * Only the in-plane strains are measured, and the out-of-plane stress is zero
   */
  IN_PLANE_STRESS("in-plane-stress", 2) {
    @Override
    public RealVector[] stressValues(RealVector e11, RealVector e22, RealVector e33,
        double youngsModulus, double poissonRatio) {
      double factor = youngsModulus / (1. - poissonRatio * poissonRatio);
      return new RealVector[]{
          e11.add(e22.mapMultiply(poissonRatio)).mapMultiply(factor),
          e22.add(e11.mapMultiply(poissonRatio)).mapMultiply(factor),
          new ArrayRealVector(e11.getDimension())
      };
    }

    @Override
    public RealVector[] stressErrors(RealVector s11, RealVector s22, RealVector s33,
        double youngsModulus, double poissonRatio) {
      double factor = youngsModulus / (1. - poissonRatio * poissonRatio);
      return new RealVector[]{
          quadrature(factor, s11, factor * poissonRatio, s22, 0., null),
          quadrature(factor * poissonRatio, s11, factor, s22, 0., null),
          new ArrayRealVector(s11.getDimension())
      };
    }

    @Override
    public RealVector[] outOfPlaneStrain(RealVector e11, RealVector e22, RealVector s11,
        RealVector s22, double poissonRatio) {
      // from sigma33 = 0: eps33 = -nu / (1 - nu) (eps11 + eps22)
      double factor = poissonRatio / (1. - poissonRatio);
      return new RealVector[]{
          e11.add(e22).mapMultiply(-factor),
          quadrature(factor, s11, factor, s22, 0., null)
      };
    }
  },

  /**
   * Only the in-plane strains are measured, and the out-of-plane strain is zero
   */
  IN_PLANE_STRAIN("in-plane-strain", 2) {
    @Override
    public RealVector[] stressValues(RealVector e11, RealVector e22, RealVector e33,
        double youngsModulus, double poissonRatio) {
      double twoMu = twoMu(youngsModulus, poissonRatio);
      double lambda = lambda(youngsModulus, poissonRatio);
      RealVector trace = e11.add(e22);
      return new RealVector[]{
          e11.mapMultiply(twoMu).add(trace.mapMultiply(lambda)),
          e22.mapMultiply(twoMu).add(trace.mapMultiply(lambda)),
          trace.mapMultiply(lambda)
      };
    }

    @Override
    public RealVector[] stressErrors(RealVector s11, RealVector s22, RealVector s33,
        double youngsModulus, double poissonRatio) {
      double own = twoMu(youngsModulus, poissonRatio) + lambda(youngsModulus, poissonRatio);
      double cross = lambda(youngsModulus, poissonRatio);
      return new RealVector[]{
          quadrature(own, s11, cross, s22, 0., null),
          quadrature(cross, s11, own, s22, 0., null),
          quadrature(cross, s11, cross, s22, 0., null)
      };
    }

    @Override
    public RealVector[] outOfPlaneStrain(RealVector e11, RealVector e22, RealVector s11,
        RealVector s22, double poissonRatio) {
      return new RealVector[]{
          new ArrayRealVector(e11.getDimension()),
          new ArrayRealVector(e11.getDimension())
      };
    }
  };

  private final String name;
  private final int measuredDirections;

  StressType(String name, int measuredDirections) {
    this.name = name;
    this.measuredDirections = measuredDirections;
  }

  /**
   * Get the stress type matching a name such as "diagonal" or "in-plane-stress".
   * Underscores and hyphens are interchangeable.
   *
   * @param name stress type name (case-insensitive)
   * @return matching stress type
   */
  public static StressType fromName(String name) {
    String normalized = name.trim().replace('_', '-');
    for (StressType type : values()) {
      if (type.name.equalsIgnoreCase(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown stress type: " + name);
  }

  static double twoMu(double youngsModulus, double poissonRatio) {
    return youngsModulus / (1. + poissonRatio);
  }

  static double lambda(double youngsModulus, double poissonRatio) {
    return youngsModulus * poissonRatio / ((1. + poissonRatio) * (1. - 2. * poissonRatio));
  }

  /**
   * Uncertainty of c1 x1 + c2 x2 + c3 x3 for independent x1, x2, x3 with uncertainties
   * s1, s2, s3. A null s3 leaves out the third term.
   */
  static RealVector quadrature(double c1, RealVector s1, double c2, RealVector s2,
      double c3, RealVector s3) {
    RealVector variance = s1.ebeMultiply(s1).mapMultiply(c1 * c1)
        .add(s2.ebeMultiply(s2).mapMultiply(c2 * c2));
    if (s3 != null) {
      variance = variance.add(s3.ebeMultiply(s3).mapMultiply(c3 * c3));
    }
    return variance.map(Math::sqrt);
  }

  public String getName() {
    return name;
  }

  /**
   * Number of directions along which strain is measured (3 for diagonal, 2 for in-plane types)
   *
   * @return count of measured directions
   */
  public int getMeasuredDirections() {
    return measuredDirections;
  }

  /**
   * Calculate the three normal stresses at each point
   *
   * @param e11 strain along direction 11
   * @param e22 strain along direction 22
   * @param e33 strain along direction 33 (ignored, and may be null, for in-plane types)
   * @param youngsModulus Young's modulus E
   * @param poissonRatio Poisson ratio nu
   * @return array of {sigma11, sigma22, sigma33}
   */
  public abstract RealVector[] stressValues(RealVector e11, RealVector e22, RealVector e33,
      double youngsModulus, double poissonRatio);

  /**
   * Calculate the uncertainty of the three normal stresses at each point
   *
   * @param s11 uncertainty of strain 11
   * @param s22 uncertainty of strain 22
   * @param s33 uncertainty of strain 33 (ignored, and may be null, for in-plane types)
   * @param youngsModulus Young's modulus E
   * @param poissonRatio Poisson ratio nu
   * @return array of uncertainties of {sigma11, sigma22, sigma33}
   */
  public abstract RealVector[] stressErrors(RealVector s11, RealVector s22, RealVector s33,
      double youngsModulus, double poissonRatio);

  /**
   * Strain along direction 33 implied by an in-plane geometry
   *
   * @param e11 strain along direction 11
   * @param e22 strain along direction 22
   * @param s11 uncertainty of strain 11
   * @param s22 uncertainty of strain 22
   * @param poissonRatio Poisson ratio nu
   * @return array of {strain 33 values, strain 33 uncertainties}
   * @throws UnsupportedOperationException for {@link #DIAGONAL}, where strain 33 is measured
   */
  public abstract RealVector[] outOfPlaneStrain(RealVector e11, RealVector e22, RealVector s11,
      RealVector s22, double poissonRatio);

  @Override
  public String toString() {
    return name;
  }
}

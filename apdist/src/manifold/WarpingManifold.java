package manifold;

import static edu.mines.jtk.util.ArrayMath.*;

import edu.mines.jtk.dsp.Sampling;
import edu.mines.jtk.util.Check;

import srsf.SquareRootSlope;
import util.LinearInterp;
import util.Quadrature;
import util.Samples;

/**
 * Geometry of the space of warping functions on a fixed domain grid.
 * <p>
 * A warping function gamma is represented by psi = sqrt(gamma'). Under
 * the L2 inner product these representations lie on the positive part
 * of the unit Hilbert sphere (for a domain of unit length), so 
 * geodesics, and the logarithm and exponential maps, are those of a
 * sphere.
 */
public class WarpingManifold {

  /**
   * Constructs a warping manifold for the specified domain grid.
   * @param st the domain grid; must have at least two samples.
   */
  public WarpingManifold(Sampling st) {
    Samples.checkSampling(st);
    _st = st;
    _t = st.getValues();
    _n = _t.length;
    _srsf = new SquareRootSlope(st);
  }

  /**
   * Returns the domain grid of this manifold.
   * @return the domain grid.
   */
  public Sampling getSampling() {
    return _st;
  }

  /**
   * Returns the L2 inner product of two vectors, by trapezoid quadrature.
   * @param u array[n] first vector.
   * @param v array[n] second vector.
   * @return the inner product.
   */
  public double innerProduct(double[] u, double[] v) {
    Samples.checkSamples(_n,u,"u");
    Samples.checkSamples(_n,v,"v");
    return Quadrature.trapz(mul(u,v),_t);
  }

  /**
   * Returns the L2 norm of a vector.
   * @param u array[n] vector.
   * @return the norm.
   */
  public double norm(double[] u) {
    return sqrt(max(0.0,innerProduct(u,u)));
  }

  /**
   * Logarithm map: the tangent vector at {@code basePoint} that points 
   * along the geodesic to {@code point}, with length equal to the 
   * geodesic distance. Points closer than 1e-10 radians map to the 
   * zero vector.
   * @param basePoint array[n] point at which the tangent space is taken.
   * @param point array[n] point to be mapped.
   * @return the tangent vector and the angle between the points.
   */
  public Tangent log(double[] basePoint, double[] point) {
    double c = innerProduct(basePoint,point);
    c = max(-1.0,min(1.0,c));
    double theta = acos(c);
    double[] v = new double[_n];
    if (theta>=THETA_MIN) {
      double s = theta/sin(theta);
      double ct = cos(theta);
      for (int i=0; i<_n; i++)
        v[i] = s*(point[i]-ct*basePoint[i]);
    }
    return new Tangent(v,theta);
  }

  /**
   * Exponential map: the point reached by following the geodesic from 
   * {@code basePoint} in the direction of {@code tangentVector} for a
   * distance equal to its norm.
   * @param basePoint array[n] starting point.
   * @param tangentVector array[n] tangent vector at the starting point.
   * @return array[n] point reached; a copy of the base point, if the
   *  tangent vector is zero.
   */
  public double[] exp(double[] basePoint, double[] tangentVector) {
    Samples.checkSamples(_n,basePoint,"basePoint");
    double r = norm(tangentVector);
    if (r==0.0)
      return copy(basePoint);
    double cr = cos(r);
    double sr = sin(r)/r;
    double[] p = new double[_n];
    for (int i=0; i<_n; i++)
      p[i] = cr*basePoint[i]+sr*tangentVector[i];
    return p;
  }

  /**
   * Returns the square-root-slope representation sqrt(gamma') of a 
   * warping function.
   * @param gamma array[n] warping function.
   * @return array[n] representation.
   */
  public double[] toPsi(double[] gamma) {
    return _srsf.sqrtSlope(gamma);
  }

  /**
   * Returns the warping function with values at both ends of the domain
   * equal to the domain's end values, whose representation is 
   * {@code psi}. This is the cumulative integral of psi squared, 
   * rescaled to the domain range.
   * @param psi array[n] square-root-slope representation.
   * @return array[n] warping function.
   */
  public double[] fromPsi(double[] psi) {
    Samples.checkSamples(_n,psi,"psi");
    double[] g = Quadrature.cumtrapz(mul(psi,psi),_t);
    return rescale(g);
  }

  /**
   * Computes the inverse of a warping function. The inverse is 
   * interpolated on the domain grid and then rescaled so that its end
   * values equal the domain's end values.
   * @param gamma array[n] non-decreasing warping function.
   * @return array[n] non-decreasing inverse warping function.
   */
  public double[] inverse(double[] gamma) {
    Samples.checkSamples(_n,gamma,"gamma");
    for (int i=1; i<_n; i++)
      Check.argument(gamma[i]>=gamma[i-1],"gamma is non-decreasing");
    double[] gi = LinearInterp.interpolate(_t,gamma,_t);
    return rescale(gi);
  }

  /**
   * Returns the Karcher mean (center) of one or more warping functions,
   * computed with default settings.
   * @param gammas array[m][n] of warping functions.
   * @return array[n] center.
   * @see KarcherMean
   */
  public double[] center(double[][] gammas) {
    return new KarcherMean(this).compute(gammas).getMean();
  }

  /**
   * Returns the center of a single warping function, its inverse.
   * @param gamma array[n] warping function.
   * @return array[n] center.
   */
  public double[] center(double[] gamma) {
    return inverse(gamma);
  }

  ///////////////////////////////////////////////////////////////////////////
  // private

  private static final double THETA_MIN = 1.0e-10;

  private Sampling _st; // domain grid
  private double[] _t; // domain coordinates
  private int _n; // number of samples
  private SquareRootSlope _srsf; // for derivatives of warping functions

  // Maps the range of g linearly onto the domain range, with exact ends.
  private double[] rescale(double[] g) {
    double gmin = min(g);
    double gmax = max(g);
    Check.argument(gmax>gmin,"warping function is not constant");
    double t0 = _t[0];
    double tn = _t[_n-1];
    double scale = (tn-t0)/(gmax-gmin);
    double[] r = new double[_n];
    for (int i=0; i<_n; i++)
      r[i] = (g[i]-gmin)*scale+t0;
    r[0] = t0;
    r[_n-1] = tn;
    return r;
  }
}

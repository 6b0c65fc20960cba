package srsf;

import static edu.mines.jtk.util.ArrayMath.*;

import edu.mines.jtk.dsp.Sampling;
import edu.mines.jtk.interp.CubicInterpolator;
import edu.mines.jtk.util.Check;

import util.Gradient;
import util.LinearInterp;
import util.Quadrature;
import util.Samples;
import warp.AlignmentOptions;
import warp.WarpingProvider;

/**
 * Square-root slope functions (SRSFs) of functions sampled on a fixed
 * domain grid.
 * <p>
 * The SRSF of a function f is q = f'/sqrt(|f'|+eps). It preserves the
 * sign of the slope, tends to sign(f')sqrt(|f'|) as eps goes to zero,
 * and is exactly zero wherever the estimated slope is zero. The L2
 * distance between SRSFs is unchanged when both functions are warped
 * by the same reparameterization, which is what makes the amplitude
 * distance independent of phase.
 */
public class SquareRootSlope {

  /**
   * Methods for estimating derivatives of sampled functions.
   */
  public enum Derivative {
    GRADIENT,
    SPLINE,
    MONOTONIC
  }

  /**
   * Regularization added to |f'| before the square root.
   */
  public static final double EPSILON = 1.0e-3;

  /**
   * Constructs an SRSF transform for the specified domain, with
   * derivatives estimated by finite differences.
   * @param st the domain grid; must have at least two samples.
   */
  public SquareRootSlope(Sampling st) {
    this(st,Derivative.GRADIENT);
  }

  /**
   * Constructs an SRSF transform for the specified domain.
   * @param st the domain grid; must have at least two samples.
   * @param derivative method used to estimate derivatives of functions
   *  and of warping functions.
   */
  public SquareRootSlope(Sampling st, Derivative derivative) {
    Samples.checkSampling(st);
    Check.argument(derivative!=null,"derivative!=null");
    _st = st;
    _t = st.getValues();
    _n = _t.length;
    _derivative = derivative;
  }

  /**
   * Returns the domain grid of this transform.
   * @return the domain grid.
   */
  public Sampling getSampling() {
    return _st;
  }

  /**
   * Returns the derivative method of this transform.
   * @return the derivative method.
   */
  public Derivative getDerivative() {
    return _derivative;
  }

  /**
   * Computes the SRSF of a function.
   * @param f array[n] of function values.
   * @return array[n] of SRSF values.
   */
  public double[] toSrsf(double[] f) {
    Samples.checkSamples(_n,f,"f");
    double[] d = derivative(f);
    double[] q = new double[_n];
    for (int i=0; i<_n; i++)
      q[i] = d[i]/sqrt(abs(d[i])+EPSILON);
    return q;
  }

  /**
   * Reconstructs a function from its SRSF by cumulative trapezoid
   * integration of q|q|. This is only an approximate inverse of
   * {@link #toSrsf(double[])}.
   * @param q array[n] of SRSF values.
   * @param f0 the function value at the first sample.
   * @return array[n] of function values.
   */
  public double[] fromSrsf(double[] q, double f0) {
    Samples.checkSamples(_n,q,"q");
    double[] qq = new double[_n];
    for (int i=0; i<_n; i++)
      qq[i] = q[i]*abs(q[i]);
    double[] f = Quadrature.cumtrapz(qq,_t);
    for (int i=0; i<_n; i++)
      f[i] += f0;
    return f;
  }

  /**
   * Reconstructs a function from its SRSF, with zero at the first sample.
   * @param q array[n] of SRSF values.
   * @return array[n] of function values.
   */
  public double[] fromSrsf(double[] q) {
    return fromSrsf(q,0.0);
  }

  /**
   * Composes a function with a warping function, f(gamma(t)).
   * @param f array[n] of function values.
   * @param gamma array[n] warping function.
   * @return array[n] of warped function values.
   */
  public double[] warpF(double[] f, double[] gamma) {
    Samples.checkSamples(_n,f,"f");
    Samples.checkSamples(_n,gamma,"gamma");
    return LinearInterp.interpolate(gamma,_t,f);
  }

  /**
   * Warps an SRSF, (q o gamma)sqrt(gamma'). The factor sqrt(gamma') is
   * the chain-rule correction that keeps the result the SRSF of the
   * warped function.
   * @param q array[n] of SRSF values.
   * @param gamma array[n] warping function.
   * @return array[n] of warped SRSF values.
   */
  public double[] warpQ(double[] q, double[] gamma) {
    Samples.checkSamples(_n,q,"q");
    Samples.checkSamples(_n,gamma,"gamma");
    double[] qg = LinearInterp.interpolate(gamma,_t,q);
    double[] sg = sqrtSlope(gamma);
    for (int i=0; i<_n; i++)
      qg[i] *= sg[i];
    return qg;
  }

  /**
   * Returns sqrt(gamma'), the representation of a warping function on
   * the unit Hilbert sphere. Negative slope estimates, which can occur
   * for flat or nearly flat warping functions on non-uniform grids,
   * are clamped to zero.
   * @param gamma array[n] warping function.
   * @return array[n] square root of the warping derivative.
   */
  public double[] sqrtSlope(double[] gamma) {
    Samples.checkSamples(_n,gamma,"gamma");
    double[] d = derivative(gamma);
    for (int i=0; i<_n; i++)
      d[i] = sqrt(max(0.0,d[i]));
    return d;
  }

  /**
   * Estimates the derivative of sampled values with the derivative method
   * of this transform.
   * @param f array[n] of values.
   * @return array[n] of derivative estimates.
   */
  public double[] derivative(double[] f) {
    Check.argument(f.length==_n,"f.length=="+_n);
    switch (_derivative) {
      case GRADIENT:  return Gradient.gradient(f,_t);
      case SPLINE:    return derivative(CubicInterpolator.Method.SPLINE,f);
      case MONOTONIC: return derivative(CubicInterpolator.Method.MONOTONIC,f);
      default: throw new IllegalArgumentException(
          _derivative.toString()+" is not a recognized derivative method.");
    }
  }

  /**
   * Computes the warping function that aligns {@code q2} to {@code q1}.
   * The provider works on the unit interval; the returned warping is
   * mapped onto the range of this domain but, like the provider's
   * result, its end values are not guaranteed to equal the domain's.
   * @param q1 array[n] SRSF of the reference function.
   * @param q2 array[n] SRSF of the function to be aligned.
   * @param provider source of warping functions.
   * @param options alignment options.
   * @return array[n] warping function.
   */
  public double[] getWarping(
      double[] q1, double[] q2, WarpingProvider provider,
      AlignmentOptions options)
  {
    Samples.checkSamples(_n,q1,"q1");
    Samples.checkSamples(_n,q2,"q2");
    Check.argument(provider!=null,"provider!=null");
    Check.argument(options!=null,"options!=null");
    double[] gamma = provider.findWarping(_t,q1,q2,options);
    Check.state(gamma!=null && gamma.length==_n,
        provider.getName()+" returned a warping function of length "+_n);
    double t0 = _t[0];
    double tn = _t[_n-1];
    double[] gw = new double[_n];
    for (int i=0; i<_n; i++)
      gw[i] = (tn-t0)*gamma[i]+t0;
    return gw;
  }

  ///////////////////////////////////////////////////////////////////////////
  // private

  private Sampling _st; // domain grid
  private double[] _t; // domain coordinates
  private int _n; // number of samples
  private Derivative _derivative; // derivative method

  private double[] derivative(CubicInterpolator.Method method, double[] f) {
    float[] x = new float[_n];
    float[] y = new float[_n];
    for (int i=0; i<_n; i++) {
      x[i] = (float)_t[i];
      y[i] = (float)f[i];
    }
    CubicInterpolator ci = new CubicInterpolator(method,x,y);
    double[] d = new double[_n];
    for (int i=0; i<_n; i++)
      d[i] = ci.interpolate1(x[i]);
    return d;
  }
}

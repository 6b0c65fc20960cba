package util;

import edu.mines.jtk.util.Check;

/**
 * Trapezoid quadrature for values sampled on a possibly non-uniform
 * grid.
 */
public class Quadrature {

  /**
   * Integrates {@code y} over the grid {@code x} with the trapezoid rule.
   * @param y the sampled integrand.
   * @param x the grid coordinates.
   * @return the integral.
   */
  public static double trapz(double[] y, double[] x) {
    int n = x.length;
    Check.argument(y.length==n,"y.length==x.length");
    double s = 0.0;
    for (int i=1; i<n; i++)
      s += 0.5*(x[i]-x[i-1])*(y[i]+y[i-1]);
    return s;
  }

  /**
   * Cumulative trapezoid integral of {@code y}, with the value at the
   * first sample equal to zero.
   * @param y the sampled integrand.
   * @param x the grid coordinates.
   * @return array of running integrals, same length as {@code x}.
   */
  public static double[] cumtrapz(double[] y, double[] x) {
    int n = x.length;
    Check.argument(y.length==n,"y.length==x.length");
    double[] c = new double[n];
    for (int i=1; i<n; i++)
      c[i] = c[i-1]+0.5*(x[i]-x[i-1])*(y[i]+y[i-1]);
    return c;
  }
}

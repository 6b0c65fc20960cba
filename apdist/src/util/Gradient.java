package util;

import edu.mines.jtk.util.Check;

/**
 * Finite-difference derivatives on a non-uniform grid.
 * <p>
 * Interior samples use the second-order accurate three-point formula
 * for unequal spacing. The first and last samples use one-sided first
 * differences, so any grid with two or more samples has a finite
 * derivative everywhere.
 */
public class Gradient {

  /**
   * Returns the derivative of {@code f} with respect to {@code x}.
   * @param f the sampled function.
   * @param x the strictly increasing grid coordinates.
   * @return the derivative estimates.
   */
  public static double[] gradient(double[] f, double[] x) {
    int n = x.length;
    int nm1 = n-1;
    Check.argument(n>=2,"x.length>=2");
    Check.argument(f.length==n,"f.length==x.length");
    double[] g = new double[n];
    g[ 0 ] = (f[ 1 ]-f[  0  ])/(x[ 1 ]-x[  0  ]); // forward difference
    g[nm1] = (f[nm1]-f[nm1-1])/(x[nm1]-x[nm1-1]); // backward difference
    for (int i=1; i<nm1; i++) {
      double hs = x[i]-x[i-1];
      double hd = x[i+1]-x[i];
      double hs2 = hs*hs;
      double hd2 = hd*hd;
      g[i] = (hs2*f[i+1]+(hd2-hs2)*f[i]-hd2*f[i-1])/(hs*hd*(hd+hs));
    }
    return g;
  }
}

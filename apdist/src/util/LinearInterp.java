package util;

import static edu.mines.jtk.util.ArrayMath.*;

import edu.mines.jtk.util.Check;

/**
 * Piecewise-linear interpolation of sampled values. Values requested 
 * outside the range of the abscissae are clamped to the first or last
 * sampled value.
 */
public class LinearInterp {

  /**
   * Interpolates {@code y(x)} at every coordinate in {@code xi}.
   * @param xi coordinates at which to interpolate.
   * @param x non-decreasing abscissae.
   * @param y sampled values, one per abscissa.
   * @return array of interpolated values, same length as {@code xi}.
   */
  public static double[] interpolate(double[] xi, double[] x, double[] y) {
    int n = x.length;
    Check.argument(n>=2,"x.length>=2");
    Check.argument(y.length==n,"y.length==x.length");
    int ni = xi.length;
    double[] yi = new double[ni];
    int k = 0;
    for (int i=0; i<ni; i++) {
      double xv = xi[i];
      if (xv<=x[0]) {
        yi[i] = y[0];
      } else if (xv>=x[n-1]) {
        yi[i] = y[n-1];
      } else {
        k = index(xv,x,k);
        double dx = x[k+1]-x[k];
        yi[i] = (dx>0.0)?y[k]+(xv-x[k])*(y[k+1]-y[k])/dx:y[k];
      }
    }
    return yi;
  }

  ///////////////////////////////////////////////////////////////////////////
  // private

  private static int index(double x, double[] xs, int i) {
    i = binarySearch(xs,x,i);
    if (i<0) 
      i = (i<-1)?-2-i:0;
    if (i>=xs.length-1)
      i = xs.length-2;
    return i;
  }
}

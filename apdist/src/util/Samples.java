package util;

import edu.mines.jtk.dsp.Sampling;
import edu.mines.jtk.util.Check;

/**
 * Argument checks for arrays of samples aligned with a domain grid.
 */
public class Samples {

  /**
   * Ensures that {@code f} has one value for every sample of the grid
   * and that all of its values are finite.
   * @param n the number of grid samples.
   * @param f the sampled values.
   * @param name name of the array used in the error message.
   * @throws IllegalArgumentException if the length differs from 
   *  {@code n} or any value is NaN or infinite.
   */
  public static void checkSamples(int n, double[] f, String name) {
    Check.argument(f!=null,name+"!=null");
    Check.argument(f.length==n,name+".length=="+n+": "+f.length+"=="+n);
    checkFinite(f,name);
  }

  /**
   * Ensures that all values are finite.
   * @param f the values.
   * @param name name of the array used in the error message.
   */
  public static void checkFinite(double[] f, String name) {
    int n = f.length;
    for (int i=0; i<n; i++)
      Check.argument(!Double.isNaN(f[i]) && !Double.isInfinite(f[i]),
          name+"["+i+"] is finite: "+f[i]);
  }

  /**
   * Returns a domain grid for the specified coordinates. The grid
   * must have at least two strictly increasing, finite coordinates.
   * @param x array of grid coordinates.
   * @return the sampling.
   */
  public static Sampling sampling(double[] x) {
    Check.argument(x!=null,"x!=null");
    Check.argument(x.length>=2,"x.length>=2: "+x.length+" samples");
    checkFinite(x,"x");
    for (int i=1; i<x.length; i++)
      Check.argument(x[i]>x[i-1],"x is strictly increasing at index "+i);
    return new Sampling(x);
  }

  /**
   * Ensures that a grid can support derivative estimates.
   * @param s the grid.
   */
  public static void checkSampling(Sampling s) {
    Check.argument(s!=null,"sampling!=null");
    Check.argument(s.getCount()>=2,
        "sampling count>=2: "+s.getCount()+" samples");
  }
}

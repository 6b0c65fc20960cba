package util;

import junit.framework.TestCase;
import junit.framework.TestSuite;

public class TestQuadrature extends TestCase {

  public void testTrapzLinearIsExact() {
    double[] x = {0.0,0.1,0.35,0.5,0.9,1.0};
    int n = x.length;
    double[] y = new double[n];
    for (int i=0; i<n; i++)
      y[i] = 2.0*x[i]+1.0;
    assertEquals(2.0,Quadrature.trapz(y,x),1.0e-14);
  }

  public void testCumtrapz() {
    double[] x = {0.0,0.25,0.5,0.75,1.0};
    double[] y = {1.0,1.0,1.0,1.0,1.0};
    double[] c = Quadrature.cumtrapz(y,x);
    assertEquals(0.0,c[0],0.0);
    for (int i=0; i<x.length; i++)
      assertEquals(x[i],c[i],1.0e-15);
    assertEquals(Quadrature.trapz(y,x),c[x.length-1],1.0e-15);
  }

  public void testLengthMismatch() {
    try {
      Quadrature.trapz(new double[3],new double[4]);
      fail("expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  public static junit.framework.Test suite() {
    return new TestSuite(TestQuadrature.class);
  }

  public static void main(String[] args) {
    junit.textui.TestRunner.run(suite());
  }
}

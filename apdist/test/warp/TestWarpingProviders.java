package warp;

import java.io.IOException;
import java.net.URL;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import junit.framework.TestCase;
import junit.framework.TestSuite;

public class TestWarpingProviders extends TestCase {

  public void testIdentity() {
    WarpingProvider wp = WarpingProviders.identity();
    double[] t = {2.0,2.5,3.0,4.0};
    double[] g = wp.findWarping(t,null,null,new AlignmentOptions());
    assertEquals(0.0,g[0],0.0);
    assertEquals(0.25,g[1],0.0);
    assertEquals(0.5,g[2],0.0);
    assertEquals(1.0,g[3],0.0);
    assertNull(wp.getWarning());
    assertFalse(((IdentityWarping)wp).isFallback());
  }

  public void testDynamicProgrammingEngineIsFound() {
    WarpingProvider wp = WarpingProviders.dynamicProgramming();
    assertTrue(wp instanceof DynamicProgrammingWarping);
    assertNull(wp.getWarning());
    assertTrue(wp.getName().contains(StubOptimumReparam.class.getName()));
    AlignmentOptions ao = new AlignmentOptions();
    ao.setLambda(0.25);
    ao.setGridDim(5);
    double[] t = unit(11);
    double[] g = wp.findWarping(t,new double[11],new double[11],ao);
    assertEquals(0.25,StubOptimumReparam.getLastLambda(),0.0);
    assertEquals(5,StubOptimumReparam.getLastGridDim());
    assertEquals(0.5+StubOptimumReparam.BEND*0.25,g[5],1.0e-15);
  }

  public void testDynamicProgrammingFallback() {
    WarpingProvider wp = 
        WarpingProviders.dynamicProgramming(platformLoader());
    assertTrue(wp instanceof IdentityWarping);
    assertTrue(((IdentityWarping)wp).isFallback());
    assertTrue(wp.getWarning().startsWith("dynamic programming"));
    assertTrue(wp.getWarning().contains("identity"));
    double[] t = unit(5);
    double[] g = wp.findWarping(t,new double[5],new double[5],
        new AlignmentOptions());
    for (int i=0; i<5; i++)
      assertEquals(t[i],g[i],0.0);
  }

  public void testResolutionFailure() {
    Resolution<OptimumReparam> r = 
        DynamicProgrammingWarping.resolve(platformLoader());
    assertFalse(r.isAvailable());
    assertTrue(r.getReason().contains("OptimumReparam"));
    try {
      r.get();
      fail("expected IllegalStateException");
    } catch (IllegalStateException e) {
      // expected
    }
    assertTrue(DynamicProgrammingWarping.resolve().isAvailable());
  }

  public void testLearnedEngineIsFound() {
    LearnedOptions lo = new LearnedOptions();
    lo.setRestartCount(3);
    WarpingProvider wp = WarpingProviders.learned(lo);
    assertTrue(wp instanceof LearnedWarping);
    assertNull(wp.getWarning());
    double[] t = unit(9);
    double[] g = wp.findWarping(t,new double[9],new double[9],
        new AlignmentOptions());
    assertSame(lo,StubGradientReparam.getLastOptions());
    for (int i=0; i<9; i++)
      assertEquals(t[i],g[i],1.0e-15);
  }

  public void testLearnedFallback() {
    WarpingProvider wp = 
        WarpingProviders.learned(new LearnedOptions(),platformLoader());
    assertTrue(wp instanceof IdentityWarping);
    assertTrue(wp.getWarning().startsWith("learned"));
  }

  public void testLearnedWithDynamicProgrammingStart() {
    LearnedOptions lo = new LearnedOptions();
    lo.setNumpyInit(true);
    double[] t = unit(11);
    double[] q = new double[11];

    // The dynamic programming warping is returned directly.
    WarpingProvider wp = WarpingProviders.learned(lo);
    double[] g = wp.findWarping(t,q,q,new AlignmentOptions());
    assertEquals(0.5+StubOptimumReparam.BEND*0.25,g[5],1.0e-15);
    assertNull(wp.getWarning());

    // Without any engine, the start is the identity, with its warning.
    wp = WarpingProviders.learned(lo,platformLoader());
    assertTrue(wp instanceof LearnedWarping);
    assertNotNull(wp.getWarning());
    g = wp.findWarping(t,q,q,new AlignmentOptions());
    for (int i=0; i<11; i++)
      assertEquals(t[i],g[i],0.0);
  }

  /*
   * Without a dynamic programming engine, the learned provider warns
   * about the identity start only if the options ask for that start.
   */
  public void testLearnedWarnsOnlyForDynamicProgrammingStart() {
    ClassLoader loader = learnedOnlyLoader();
    assertFalse(DynamicProgrammingWarping.resolve(loader).isAvailable());
    assertTrue(LearnedWarping.resolve(loader).isAvailable());
    Logger logger = Logger.getLogger(WarpingProviders.class.getName());
    final List<LogRecord> records = new ArrayList<LogRecord>();
    Handler handler = new Handler() {
      public void publish(LogRecord record) {
        records.add(record);
      }
      public void flush() {
      }
      public void close() {
      }
    };
    logger.addHandler(handler);
    try {
      WarpingProvider wp = 
          WarpingProviders.learned(new LearnedOptions(),loader);
      assertTrue(wp instanceof LearnedWarping);
      assertNull(wp.getWarning());
      assertTrue(records.isEmpty());

      LearnedOptions lo = new LearnedOptions();
      lo.setNumpyInit(true);
      wp = WarpingProviders.learned(lo,loader);
      assertNotNull(wp.getWarning());
      assertEquals(1,records.size());
    } finally {
      logger.removeHandler(handler);
    }
  }

  public void testLearnedNeedsInitialForDynamicProgrammingStart() {
    LearnedOptions lo = new LearnedOptions();
    lo.setNumpyInit(true);
    try {
      new LearnedWarping(new StubGradientReparam(),null,lo);
      fail("expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  public void testLearnedNeedsEngine() {
    try {
      new LearnedWarping(null,new IdentityWarping(),new LearnedOptions());
      fail("expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  // Sees the test learned engine but no dynamic programming engine.
  private static ClassLoader learnedOnlyLoader() {
    final String hidden = "META-INF/services/"+OptimumReparam.class.getName();
    return new ClassLoader(TestWarpingProviders.class.getClassLoader()) {
      public Enumeration<URL> getResources(String name) throws IOException {
        if (hidden.equals(name))
          return Collections.emptyEnumeration();
        return super.getResources(name);
      }
    };
  }

  private static ClassLoader platformLoader() {
    return ClassLoader.getPlatformClassLoader();
  }

  private static double[] unit(int n) {
    double[] t = new double[n];
    for (int i=0; i<n; i++)
      t[i] = (double)i/(n-1);
    return t;
  }

  public static junit.framework.Test suite() {
    return new TestSuite(TestWarpingProviders.class);
  }

  public static void main(String[] args) {
    junit.textui.TestRunner.run(suite());
  }
}

package warp;

import java.util.HashMap;
import java.util.Map;

import junit.framework.TestCase;
import junit.framework.TestSuite;

public class TestLearnedOptions extends TestCase {

  public void testDefaults() {
    LearnedOptions lo = new LearnedOptions();
    assertEquals(1024,lo.getDomainCount());
    assertEquals(50,lo.getRestartCount());
    assertEquals(100,lo.getIterationCount());
    assertEquals(10,lo.getBasisCount());
    assertEquals(5,lo.getLayerCount());
    assertEquals(LearnedOptions.BasisType.PALAIS,lo.getBasisType());
    assertEquals(0.1,lo.getLearningRate(),0.0);
    assertEquals(0.01,lo.getEps(),0.0);
    assertFalse(lo.isVerbose());
    assertEquals("cpu",lo.getDevice());
    assertFalse(lo.isNumpyInit());
  }

  public void testFromMap() {
    Map<String,Object> m = new HashMap<>();
    m.put("n_domain",256);
    m.put("n_restarts","5");
    m.put("n_iters",20);
    m.put("n_basis",4);
    m.put("n_layers",2);
    m.put("basis_type","sine");
    m.put("lr",0.05);
    m.put("eps","0.001");
    m.put("verbose",true);
    m.put("device","cuda");
    m.put("use_numpy_init","true");
    LearnedOptions lo = LearnedOptions.fromMap(m);
    assertEquals(256,lo.getDomainCount());
    assertEquals(5,lo.getRestartCount());
    assertEquals(20,lo.getIterationCount());
    assertEquals(4,lo.getBasisCount());
    assertEquals(2,lo.getLayerCount());
    assertEquals(LearnedOptions.BasisType.SINE,lo.getBasisType());
    assertEquals(0.05,lo.getLearningRate(),0.0);
    assertEquals(0.001,lo.getEps(),0.0);
    assertTrue(lo.isVerbose());
    assertEquals("cuda",lo.getDevice());
    assertTrue(lo.isNumpyInit());
  }

  public void testBasisKeys() {
    assertEquals(LearnedOptions.BasisType.L2,
        LearnedOptions.BasisType.fromKey("L2"));
    assertEquals("palais",LearnedOptions.BasisType.PALAIS.getKey());
    try {
      LearnedOptions.BasisType.fromKey("fourier");
      fail("expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  public void testBadValues() {
    Map<String,Object> m = new HashMap<>();
    m.put("verbose","maybe");
    try {
      LearnedOptions.fromMap(m);
      fail("expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      // expected
    }
    m.clear();
    m.put("n_basis",0);
    try {
      LearnedOptions.fromMap(m);
      fail("expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      // expected
    }
    m.clear();
    m.put("optim","DP");
    try {
      LearnedOptions.fromMap(m);
      fail("expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  public static junit.framework.Test suite() {
    return new TestSuite(TestLearnedOptions.class);
  }

  public static void main(String[] args) {
    junit.textui.TestRunner.run(suite());
  }
}

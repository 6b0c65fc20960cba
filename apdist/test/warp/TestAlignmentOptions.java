package warp;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import junit.framework.TestCase;
import junit.framework.TestSuite;

public class TestAlignmentOptions extends TestCase {

  public void testDefaults() {
    AlignmentOptions ao = new AlignmentOptions();
    assertEquals("DP",ao.getOptim());
    assertEquals(0.0,ao.getLambda(),0.0);
    assertEquals(7,ao.getGridDim());
  }

  public void testFromMap() {
    Map<String,Object> m = new HashMap<>();
    m.put("optim","DP");
    m.put("lambda",0.5);
    m.put("grid_dim","9");
    AlignmentOptions ao = AlignmentOptions.fromMap(m);
    assertEquals(0.5,ao.getLambda(),0.0);
    assertEquals(9,ao.getGridDim());
  }

  public void testFromProperties() {
    Properties p = new Properties();
    p.setProperty("lambda","1.5");
    p.setProperty("grid_dim","3");
    AlignmentOptions ao = AlignmentOptions.fromProperties(p);
    assertEquals("DP",ao.getOptim());
    assertEquals(1.5,ao.getLambda(),0.0);
    assertEquals(3,ao.getGridDim());
  }

  public void testUnknownOptim() {
    Map<String,Object> m = new HashMap<>();
    m.put("optim","RLBFGS");
    try {
      AlignmentOptions.fromMap(m);
      fail("expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      assertEquals("Method RLBFGS for gamma optimization is not recognized",
          e.getMessage());
    }
  }

  public void testUnknownKey() {
    Map<String,Object> m = new HashMap<>();
    m.put("gridDim",7);
    try {
      AlignmentOptions.fromMap(m);
      fail("expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("gridDim"));
    }
  }

  public void testBadValues() {
    Map<String,Object> m = new HashMap<>();
    m.put("lambda","heavy");
    try {
      AlignmentOptions.fromMap(m);
      fail("expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      // expected
    }
    try {
      new AlignmentOptions().setGridDim(0);
      fail("expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  public static junit.framework.Test suite() {
    return new TestSuite(TestAlignmentOptions.class);
  }

  public static void main(String[] args) {
    junit.textui.TestRunner.run(suite());
  }
}

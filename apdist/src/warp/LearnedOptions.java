package warp;

import java.util.Map;
import java.util.Properties;

import edu.mines.jtk.util.Check;

/**
 * Options for the learned (gradient-descent) warping engine.
 * <p>
 * Recognized keys when read from a map are {@code n_domain}, 
 * {@code n_restarts}, {@code n_iters}, {@code n_basis}, 
 * {@code n_layers}, {@code basis_type}, {@code lr}, {@code eps},
 * {@code verbose}, {@code device} and {@code use_numpy_init}.
 */
public class LearnedOptions {

  /**
   * Bases for the expansion of each warping layer.
   */
  public enum BasisType {
    SINE("sine"),
    L2("L2"),
    PALAIS("palais");

    BasisType(String key) {
      _key = key;
    }

    /**
     * Returns the name of this basis used in option maps.
     * @return the name.
     */
    public String getKey() {
      return _key;
    }

    /**
     * Returns the basis with the specified name.
     * @param key the name; one of sine, L2 or palais.
     * @return the basis.
     */
    public static BasisType fromKey(String key) {
      for (BasisType bt : values()) {
        if (bt._key.equals(key))
          return bt;
      }
      throw new IllegalArgumentException(
          key+" is not a recognized basis type.");
    }

    private String _key;
  }

  /**
   * Constructs default options.
   */
  public LearnedOptions() {
    _nDomain = 1024;
    _nRestarts = 50;
    _nIters = 100;
    _nBasis = 10;
    _nLayers = 5;
    _basisType = BasisType.PALAIS;
    _lr = 1.0e-1;
    _eps = 1.0e-2;
    _verbose = false;
    _device = "cpu";
    _numpyInit = false;
  }

  /**
   * Returns options read from the specified map.
   * @param options map of option names to values; values may be
   *  strings, numbers or booleans.
   * @return the options.
   * @throws IllegalArgumentException if a key is not recognized or a
   *  value is invalid.
   */
  public static LearnedOptions fromMap(Map<String,?> options) {
    LearnedOptions lo = new LearnedOptions();
    for (Map.Entry<String,?> e : options.entrySet()) {
      String key = e.getKey();
      Object v = e.getValue();
      Check.argument(v!=null,"option "+key+" has a value");
      switch (key) {
        case "n_domain":   lo.setDomainCount(OptionValues.toInt(key,v)); break;
        case "n_restarts": lo.setRestartCount(OptionValues.toInt(key,v)); break;
        case "n_iters":    lo.setIterationCount(OptionValues.toInt(key,v)); break;
        case "n_basis":    lo.setBasisCount(OptionValues.toInt(key,v)); break;
        case "n_layers":   lo.setLayerCount(OptionValues.toInt(key,v)); break;
        case "basis_type": lo.setBasisType(BasisType.fromKey(v.toString())); 
                           break;
        case "lr":         lo.setLearningRate(OptionValues.toDouble(key,v)); break;
        case "eps":        lo.setEps(OptionValues.toDouble(key,v)); break;
        case "verbose":    lo.setVerbose(OptionValues.toBoolean(key,v)); break;
        case "device":     lo.setDevice(v.toString()); break;
        case "use_numpy_init": 
                           lo.setNumpyInit(OptionValues.toBoolean(key,v)); break;
        default: throw new IllegalArgumentException(
            key+" is not a recognized learned warping option.");
      }
    }
    return lo;
  }

  /**
   * Returns options read from the specified properties.
   * @param properties the properties.
   * @return the options.
   */
  public static LearnedOptions fromProperties(Properties properties) {
    return fromMap(OptionValues.toMap(properties));
  }

  public void setDomainCount(int nDomain) {
    Check.argument(nDomain>=2,"nDomain>=2");
    _nDomain = nDomain;
  }

  public void setRestartCount(int nRestarts) {
    Check.argument(nRestarts>0,"nRestarts>0");
    _nRestarts = nRestarts;
  }

  public void setIterationCount(int nIters) {
    Check.argument(nIters>0,"nIters>0");
    _nIters = nIters;
  }

  public void setBasisCount(int nBasis) {
    Check.argument(nBasis>0,"nBasis>0");
    _nBasis = nBasis;
  }

  public void setLayerCount(int nLayers) {
    Check.argument(nLayers>0,"nLayers>0");
    _nLayers = nLayers;
  }

  public void setBasisType(BasisType basisType) {
    Check.argument(basisType!=null,"basisType!=null");
    _basisType = basisType;
  }

  public void setLearningRate(double lr) {
    Check.argument(lr>0.0,"lr>0.0");
    _lr = lr;
  }

  /**
   * Sets the error below which the engine may stop its restarts early.
   * @param eps the non-negative error threshold.
   */
  public void setEps(double eps) {
    Check.argument(eps>=0.0,"eps>=0.0");
    _eps = eps;
  }

  public void setVerbose(boolean verbose) {
    _verbose = verbose;
  }

  /**
   * Sets the device on which the engine runs, such as "cpu" or "cuda".
   * @param device the device name.
   */
  public void setDevice(String device) {
    Check.argument(device!=null && !device.isEmpty(),"device is not empty");
    _device = device;
  }

  /**
   * Sets whether the learned provider returns the dynamic programming
   * warping directly instead of running gradient descent.
   * @param numpyInit true, to use the dynamic programming warping.
   */
  public void setNumpyInit(boolean numpyInit) {
    _numpyInit = numpyInit;
  }

  public int getDomainCount() {
    return _nDomain;
  }

  public int getRestartCount() {
    return _nRestarts;
  }

  public int getIterationCount() {
    return _nIters;
  }

  public int getBasisCount() {
    return _nBasis;
  }

  public int getLayerCount() {
    return _nLayers;
  }

  public BasisType getBasisType() {
    return _basisType;
  }

  public double getLearningRate() {
    return _lr;
  }

  public double getEps() {
    return _eps;
  }

  public boolean isVerbose() {
    return _verbose;
  }

  public String getDevice() {
    return _device;
  }

  public boolean isNumpyInit() {
    return _numpyInit;
  }

  ///////////////////////////////////////////////////////////////////////////
  // private

  private int _nDomain;
  private int _nRestarts;
  private int _nIters;
  private int _nBasis;
  private int _nLayers;
  private BasisType _basisType;
  private double _lr;
  private double _eps; // early-stop error threshold
  private boolean _verbose;
  private String _device;
  private boolean _numpyInit; // return DP warping, skip descent
}

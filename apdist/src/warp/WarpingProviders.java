package warp;

import java.util.logging.Logger;

/**
 * Factory methods for warping providers. Engines are looked up when a
 * provider is made, and a provider whose engine is missing is replaced
 * by the identity warping with a warning.
 */
public class WarpingProviders {

  /**
   * Returns the identity warping provider.
   * @return the provider.
   */
  public static WarpingProvider identity() {
    return new IdentityWarping();
  }

  /**
   * Returns a dynamic programming provider, or the identity warping if 
   * no engine is installed. Engines are looked up with the context
   * class loader of the current thread.
   * @return the provider.
   */
  public static WarpingProvider dynamicProgramming() {
    return dynamicProgramming(contextLoader());
  }

  /**
   * Returns a dynamic programming provider, or the identity warping if 
   * no engine can be loaded with the specified class loader.
   * @param loader the class loader used to find engines.
   * @return the provider.
   */
  public static WarpingProvider dynamicProgramming(ClassLoader loader) {
    Resolution<OptimumReparam> r = DynamicProgrammingWarping.resolve(loader);
    if (r.isAvailable())
      return new DynamicProgrammingWarping(r.get());
    return fallback("dynamic programming",r.getReason());
  }

  /**
   * Returns a learned warping provider, or the identity warping if no
   * learned engine is installed and the options do not ask for the 
   * dynamic programming warping.
   * @param options options passed to the engine.
   * @return the provider.
   */
  public static WarpingProvider learned(LearnedOptions options) {
    return learned(options,contextLoader());
  }

  /**
   * Returns a learned warping provider with engines looked up by the 
   * specified class loader. The dynamic programming provider is made
   * only if the options ask for its warping.
   * @param options options passed to the engine.
   * @param loader the class loader used to find engines.
   * @return the provider.
   */
  public static WarpingProvider learned(
      LearnedOptions options, ClassLoader loader) 
  {
    Resolution<GradientReparam> r = LearnedWarping.resolve(loader);
    if (!r.isAvailable() && !options.isNumpyInit())
      return fallback("learned",r.getReason());
    GradientReparam engine = (r.isAvailable())?r.get():null;
    WarpingProvider initial = 
        (options.isNumpyInit())?dynamicProgramming(loader):null;
    return new LearnedWarping(engine,initial,options);
  }

  ///////////////////////////////////////////////////////////////////////////
  // private

  private static final Logger LOG = 
      Logger.getLogger(WarpingProviders.class.getName());

  private static IdentityWarping fallback(String method, String reason) {
    String warning = method+" warping is not available ("+reason+
        "); using identity warping";
    LOG.warning(warning);
    return IdentityWarping.fallback(warning);
  }

  private static ClassLoader contextLoader() {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    return (loader!=null)?loader:WarpingProviders.class.getClassLoader();
  }
}

package warp;

import java.util.Iterator;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Service lookup of optional external engines.
 */
class Engines {

  static <T> Resolution<T> resolve(Class<T> type, ClassLoader loader) {
    ServiceLoader<T> sl = ServiceLoader.load(type,loader);
    try {
      Iterator<T> it = sl.iterator();
      if (it.hasNext())
        return Resolution.success(it.next());
    } catch (ServiceConfigurationError e) {
      return Resolution.failure(
          type.getSimpleName()+" engine could not be loaded: "+e.getMessage());
    }
    return Resolution.failure(
        "no "+type.getName()+" engine is installed");
  }
}

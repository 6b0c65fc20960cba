package warp;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import edu.mines.jtk.util.Check;

/**
 * Conversions of option values read from maps or properties, where
 * values may be strings or already typed.
 */
class OptionValues {

  static double toDouble(String key, Object value) {
    if (value instanceof Number)
      return ((Number)value).doubleValue();
    try {
      return Double.parseDouble(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "option "+key+" is not a number: "+value,e);
    }
  }

  static int toInt(String key, Object value) {
    if (value instanceof Integer || value instanceof Long || 
        value instanceof Short) {
      return ((Number)value).intValue();
    }
    try {
      return Integer.parseInt(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "option "+key+" is not an integer: "+value,e);
    }
  }

  static boolean toBoolean(String key, Object value) {
    if (value instanceof Boolean)
      return (Boolean)value;
    String s = value.toString().trim();
    Check.argument(s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false"),
        "option "+key+" is true or false: "+value);
    return Boolean.parseBoolean(s);
  }

  static Map<String,Object> toMap(Properties properties) {
    Map<String,Object> map = new HashMap<>();
    for (String key : properties.stringPropertyNames())
      map.put(key,properties.getProperty(key));
    return map;
  }
}

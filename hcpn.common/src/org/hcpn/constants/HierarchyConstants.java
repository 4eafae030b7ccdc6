package org.hcpn.constants;

import org.apache.log4j.Logger;

/**
 * Centralized execution settings.
 * 
 * Each value has a default and can be overridden with a system property:
 * 
 *   hcpn.execution.maxDescentSteps    child firings allowed per substitution
 *                                     descent before it counts as a stall (10000)
 *   hcpn.execution.validateBeforeRun  validate a changed hierarchy before
 *                                     executing it (true)
 */
public class HierarchyConstants {
    private static final Logger logger = Logger.getLogger(HierarchyConstants.class);
    
    public static final String MAX_DESCENT_STEPS_PROPERTY = "hcpn.execution.maxDescentSteps";
    public static final String VALIDATE_BEFORE_RUN_PROPERTY = "hcpn.execution.validateBeforeRun";
    
    public static final int DEFAULT_MAX_DESCENT_STEPS = 10000;
    public static final boolean DEFAULT_VALIDATE_BEFORE_RUN = true;
    
    private HierarchyConstants() {
    }
    
    public static int maxDescentSteps() {
        return intProperty(MAX_DESCENT_STEPS_PROPERTY, DEFAULT_MAX_DESCENT_STEPS);
    }
    
    public static boolean validateBeforeRun() {
        String value = System.getProperty(VALIDATE_BEFORE_RUN_PROPERTY);
        return value != null ? Boolean.parseBoolean(value.trim()) : DEFAULT_VALIDATE_BEFORE_RUN;
    }
    
    static int intProperty(String name, int defaultValue) {
        String value = System.getProperty(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed > 0) {
                return parsed;
            }
            logger.warn("Ignoring non-positive " + name + "=" + value + ", using " + defaultValue);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring malformed " + name + "=" + value + ", using " + defaultValue);
        }
        return defaultValue;
    }
}

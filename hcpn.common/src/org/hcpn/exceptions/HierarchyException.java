package org.hcpn.exceptions;

/**
 * Base exception for all structural errors raised while building or checking
 * a hierarchical net.
 * 
 * Every subclass carries an error code (DUPLICATE_NAME, UNKNOWN_MODULE, ...)
 * plus the module and element it refers to, so callers can report the
 * offending identity without parsing the message.
 */
public class HierarchyException extends Exception {
    
    private final String moduleName;
    private final String elementName;
    private final String errorCode;
    
    public HierarchyException(String message, String moduleName, String elementName, String errorCode) {
        super(message);
        this.moduleName = moduleName;
        this.elementName = elementName;
        this.errorCode = errorCode;
    }
    
    // Getters
    public String getModuleName() { 
        return moduleName; 
    }
    
    public String getElementName() { 
        return elementName; 
    }
    
    public String getErrorCode() { 
        return errorCode; 
    }
    
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName());
        if (moduleName != null) {
            sb.append(" [").append(moduleName);
            if (elementName != null) {
                sb.append(".").append(elementName);
            }
            if (errorCode != null) {
                sb.append(" - ").append(errorCode);
            }
            sb.append("]");
        }
        sb.append(": ").append(getMessage());
        return sb.toString();
    }
}

package org.hcpn.logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

/**
 * Hierarchy Event Logger
 * 
 * Records the steps of hierarchical execution:
 * - ordinary and substitution firings
 * - descent into a child module and return to the parent
 * - stalls and the rollback that follows them
 * 
 * Events go to log4j and to an in-memory history that tests and tools can
 * inspect. One logger belongs to one executor.
 */
public class HierarchyEventLogger {
    private static final Logger logger = Logger.getLogger(HierarchyEventLogger.class);
    
    private final List<HierarchyEvent> eventHistory = new ArrayList<>();
    
    // ========== Firing Events ==========
    
    public void logFired(String module, String transition, int depth, Map<String, Object> variables) {
        String message = String.format("FIRED: module=%s, transition=%s, depth=%d, binding=%s",
            module, transition, depth, variables);
        log(message);
        storeEvent(new HierarchyEvent(HierarchyEvent.Type.FIRED, module, transition, depth, message));
    }
    
    public void logNotEnabled(String module, String transition, int depth) {
        String message = String.format("NOT_ENABLED: module=%s, transition=%s, depth=%d",
            module, transition, depth);
        logDebug(message);
        storeEvent(new HierarchyEvent(HierarchyEvent.Type.NOT_ENABLED, module, transition, depth, message));
    }
    
    // ========== Substitution Events ==========
    
    public void logDescend(String module, String transition, String child, int depth, 
                           Map<String, List<Object>> deposited) {
        String message = String.format("DESCEND: module=%s, transition=%s, child=%s, depth=%d, entryTokens=%s",
            module, transition, child, depth, deposited);
        log(message);
        storeEvent(new HierarchyEvent(HierarchyEvent.Type.DESCEND, module, transition, depth, message));
    }
    
    public void logReturn(String module, String transition, String child, int depth, 
                          Map<String, List<Object>> returned) {
        String message = String.format("RETURN: module=%s, transition=%s, child=%s, depth=%d, exitTokens=%s",
            module, transition, child, depth, returned);
        log(message);
        storeEvent(new HierarchyEvent(HierarchyEvent.Type.RETURN, module, transition, depth, message));
    }
    
    public void logStall(String module, String transition, String child, int depth, String reason) {
        String message = String.format("STALL: module=%s, transition=%s, child=%s, depth=%d, reason=%s",
            module, transition, child, depth, reason);
        logWarn(message);
        storeEvent(new HierarchyEvent(HierarchyEvent.Type.STALL, module, transition, depth, message));
    }
    
    public void logRollback(String module, String transition, int depth) {
        String message = String.format("ROLLBACK: module=%s, transition=%s, depth=%d",
            module, transition, depth);
        log(message);
        storeEvent(new HierarchyEvent(HierarchyEvent.Type.ROLLBACK, module, transition, depth, message));
    }
    
    // ========== Helper Methods ==========
    
    private void log(String message) {
        logger.info(message);
    }
    
    private void logDebug(String message) {
        logger.debug(message);
    }
    
    private void logWarn(String message) {
        logger.warn(message);
    }
    
    private void storeEvent(HierarchyEvent event) {
        eventHistory.add(event);
    }
    
    // ========== Query Methods ==========
    
    public List<HierarchyEvent> getEventHistory() {
        return Collections.unmodifiableList(new ArrayList<>(eventHistory));
    }
    
    public List<HierarchyEvent> getEvents(HierarchyEvent.Type type) {
        List<HierarchyEvent> matching = new ArrayList<>();
        for (HierarchyEvent event : eventHistory) {
            if (event.getType() == type) {
                matching.add(event);
            }
        }
        return matching;
    }
}

package org.hcpn.viewer;

import java.util.Objects;

import org.apache.log4j.Logger;

/**
 * Visual options of the hierarchical diagram.
 * 
 * Defaults: places lightblue circles, transitions lightgray boxes,
 * substitution transitions orange, fused places palegreen, substitution
 * links dashed, fusion links dotted, left-to-right layout. Every option can
 * be set through the builder or a {@code hcpn.render.*} system property
 * (see {@link #fromSystemProperties()}).
 */
public final class RenderStyle {
    private static final Logger logger = Logger.getLogger(RenderStyle.class);
    
    public static final String PROPERTY_PREFIX = "hcpn.render.";
    
    private final String placeColor;
    private final String transitionColor;
    private final String substitutionColor;
    private final String fusionColor;
    private final String substitutionEdgeStyle;
    private final String fusionEdgeStyle;
    private final boolean showFusionLinks;
    private final String rankdir;
    private final String fontname;
    private final String dotExecutable;
    
    private RenderStyle(Builder builder) {
        this.placeColor = builder.placeColor;
        this.transitionColor = builder.transitionColor;
        this.substitutionColor = builder.substitutionColor;
        this.fusionColor = builder.fusionColor;
        this.substitutionEdgeStyle = builder.substitutionEdgeStyle;
        this.fusionEdgeStyle = builder.fusionEdgeStyle;
        this.showFusionLinks = builder.showFusionLinks;
        this.rankdir = builder.rankdir;
        this.fontname = builder.fontname;
        this.dotExecutable = builder.dotExecutable;
    }
    
    public static RenderStyle defaults() {
        return builder().build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Defaults overridden by {@code hcpn.render.placeColor},
     * {@code transitionColor}, {@code substitutionColor}, {@code fusionColor},
     * {@code substitutionEdgeStyle}, {@code fusionEdgeStyle},
     * {@code showFusionLinks}, {@code rankdir}, {@code fontname} and
     * {@code dotExecutable}.
     */
    public static RenderStyle fromSystemProperties() {
        Builder builder = builder();
        builder.placeColor(property("placeColor", builder.placeColor));
        builder.transitionColor(property("transitionColor", builder.transitionColor));
        builder.substitutionColor(property("substitutionColor", builder.substitutionColor));
        builder.fusionColor(property("fusionColor", builder.fusionColor));
        builder.substitutionEdgeStyle(property("substitutionEdgeStyle", builder.substitutionEdgeStyle));
        builder.fusionEdgeStyle(property("fusionEdgeStyle", builder.fusionEdgeStyle));
        builder.showFusionLinks(Boolean.parseBoolean(property("showFusionLinks", String.valueOf(builder.showFusionLinks))));
        builder.rankdir(property("rankdir", builder.rankdir));
        builder.fontname(property("fontname", builder.fontname));
        builder.dotExecutable(property("dotExecutable", builder.dotExecutable));
        return builder.build();
    }
    
    private static String property(String key, String defaultValue) {
        String value = System.getProperty(PROPERTY_PREFIX + key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        logger.debug("Render option " + key + " overridden: " + value);
        return value.trim();
    }
    
    public String getPlaceColor() { return placeColor; }
    public String getTransitionColor() { return transitionColor; }
    public String getSubstitutionColor() { return substitutionColor; }
    public String getFusionColor() { return fusionColor; }
    public String getSubstitutionEdgeStyle() { return substitutionEdgeStyle; }
    public String getFusionEdgeStyle() { return fusionEdgeStyle; }
    public boolean isShowFusionLinks() { return showFusionLinks; }
    public String getRankdir() { return rankdir; }
    public String getFontname() { return fontname; }
    public String getDotExecutable() { return dotExecutable; }
    
    public static final class Builder {
        private String placeColor = "lightblue";
        private String transitionColor = "lightgray";
        private String substitutionColor = "orange";
        private String fusionColor = "palegreen";
        private String substitutionEdgeStyle = "dashed";
        private String fusionEdgeStyle = "dotted";
        private boolean showFusionLinks = true;
        private String rankdir = "LR";
        private String fontname = "Helvetica";
        private String dotExecutable = "dot";
        
        private Builder() {
        }
        
        public Builder placeColor(String value) { this.placeColor = Objects.requireNonNull(value); return this; }
        public Builder transitionColor(String value) { this.transitionColor = Objects.requireNonNull(value); return this; }
        public Builder substitutionColor(String value) { this.substitutionColor = Objects.requireNonNull(value); return this; }
        public Builder fusionColor(String value) { this.fusionColor = Objects.requireNonNull(value); return this; }
        public Builder substitutionEdgeStyle(String value) { this.substitutionEdgeStyle = Objects.requireNonNull(value); return this; }
        public Builder fusionEdgeStyle(String value) { this.fusionEdgeStyle = Objects.requireNonNull(value); return this; }
        public Builder showFusionLinks(boolean value) { this.showFusionLinks = value; return this; }
        public Builder rankdir(String value) { this.rankdir = Objects.requireNonNull(value); return this; }
        public Builder fontname(String value) { this.fontname = Objects.requireNonNull(value); return this; }
        public Builder dotExecutable(String value) { this.dotExecutable = Objects.requireNonNull(value); return this; }
        
        public RenderStyle build() {
            return new RenderStyle(this);
        }
    }
}

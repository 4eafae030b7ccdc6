package org.hcpn.net;

import java.util.*;

/**
 * Parsed arc inscription of the reference engine.
 * 
 * An inscription is a comma separated list of terms, each optionally prefixed
 * by a multiplicity ({@code 2`x}). A term is an integer literal, a quoted
 * string, {@code true}/{@code false}, {@code ()} for the unit token, or a
 * variable name. Anything richer belongs to a real expression language.
 */
public final class ArcInscription {
    
    public static final class Term {
        public final String variable; // null for constants
        public final Object constant;
        
        private Term(String variable, Object constant) {
            this.variable = variable;
            this.constant = constant;
        }
        
        public boolean isVariable() {
            return variable != null;
        }
        
        public Object evaluate(Map<String, Object> binding) {
            if (!isVariable()) {
                return constant;
            }
            Object value = binding.get(variable);
            if (value == null) {
                throw new IllegalStateException("Variable '" + variable + "' is not bound");
            }
            return value;
        }
        
        @Override
        public String toString() {
            return isVariable() ? variable : String.valueOf(constant);
        }
    }
    
    private final String text;
    private final List<Term> terms;
    
    private ArcInscription(String text, List<Term> terms) {
        this.text = text;
        this.terms = Collections.unmodifiableList(terms);
    }
    
    public static ArcInscription parse(String text) {
        List<Term> terms = new ArrayList<>();
        for (String part : splitTopLevel(text)) {
            String token = part.trim();
            if (token.isEmpty()) {
                continue;
            }
            int count = 1;
            int tick = token.indexOf('`');
            if (tick > 0 && isInteger(token.substring(0, tick).trim())) {
                count = Integer.parseInt(token.substring(0, tick).trim());
                token = token.substring(tick + 1).trim();
            }
            Term term = parseTerm(token);
            for (int i = 0; i < count; i++) {
                terms.add(term);
            }
        }
        return new ArcInscription(text, terms);
    }
    
    private static Term parseTerm(String token) {
        if (isInteger(token)) {
            return new Term(null, Integer.valueOf(token));
        }
        if (token.length() >= 2 && (token.startsWith("'") && token.endsWith("'") 
                || token.startsWith("\"") && token.endsWith("\""))) {
            return new Term(null, token.substring(1, token.length() - 1));
        }
        if ("true".equals(token) || "false".equals(token)) {
            return new Term(null, Boolean.valueOf(token));
        }
        if ("()".equals(token)) {
            return new Term(null, ValueDomain.Unit.UNIT);
        }
        if (!Character.isJavaIdentifierStart(token.charAt(0))) {
            throw new IllegalArgumentException("Unsupported arc inscription term: " + token);
        }
        for (char c : token.toCharArray()) {
            if (!Character.isJavaIdentifierPart(c)) {
                throw new IllegalArgumentException("Unsupported arc inscription term: " + token);
            }
        }
        return new Term(token, null);
    }
    
    private static boolean isInteger(String s) {
        return s.matches("-?\\d+");
    }
    
    private static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        for (char c : text.toCharArray()) {
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
                current.append(c);
            } else if (c == '\'' || c == '"') {
                quote = c;
                current.append(c);
            } else if (c == ',') {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        parts.add(current.toString());
        return parts;
    }
    
    public List<Term> getTerms() {
        return terms;
    }
    
    public List<Object> evaluate(Map<String, Object> binding) {
        List<Object> values = new ArrayList<>();
        for (Term term : terms) {
            values.add(term.evaluate(binding));
        }
        return values;
    }
    
    @Override
    public String toString() {
        return text;
    }
}

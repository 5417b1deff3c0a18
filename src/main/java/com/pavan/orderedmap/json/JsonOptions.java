package com.pavan.orderedmap.json;

/**
 * Settings for encoding an {@link com.pavan.orderedmap.collection.OrderedMap} to JSON and back.
 * Instances are immutable; use {@link #builder()} or {@link #defaults()}.
 */
public final class JsonOptions {
    
    private static final JsonOptions DEFAULTS = builder().build();
    
    private final boolean forceTextKeys;
    private final boolean preserveNumericType;
    private final boolean prettyPrint;
    
    private JsonOptions(Builder builder) {
        this.forceTextKeys = builder.forceTextKeys;
        this.preserveNumericType = builder.preserveNumericType;
        this.prettyPrint = builder.prettyPrint;
    }
    
    /**
     * Text keys forced, no numeric type preservation, compact output.
     */
    public static JsonOptions defaults() {
        return DEFAULTS;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    static JsonOptions orDefaults(JsonOptions options) {
        return options == null ? DEFAULTS : options;
    }
    
    /**
     * On output, write every key as its string form; when off, non-string keys are an error.
     * On input, keep member names as strings; when off, numeric-looking names become
     * {@code Long} or {@code Double} keys.
     */
    public boolean isForceTextKeys() {
        return forceTextKeys;
    }
    
    /**
     * On output, string values holding a number are written as JSON numbers.
     * On input, integers decode to {@code Long}/{@code BigInteger} and other numbers to
     * {@code BigDecimal}; when off, every number decodes to {@code Double}.
     */
    public boolean isPreserveNumericType() {
        return preserveNumericType;
    }
    
    public boolean isPrettyPrint() {
        return prettyPrint;
    }
    
    @Override
    public String toString() {
        return "JsonOptions{" +
                "forceTextKeys=" + forceTextKeys +
                ", preserveNumericType=" + preserveNumericType +
                ", prettyPrint=" + prettyPrint +
                '}';
    }
    
    public static final class Builder {
        
        private boolean forceTextKeys = true;
        private boolean preserveNumericType = false;
        private boolean prettyPrint = false;
        
        private Builder() {
        }
        
        public Builder forceTextKeys(boolean forceTextKeys) {
            this.forceTextKeys = forceTextKeys;
            return this;
        }
        
        public Builder preserveNumericType(boolean preserveNumericType) {
            this.preserveNumericType = preserveNumericType;
            return this;
        }
        
        public Builder prettyPrint(boolean prettyPrint) {
            this.prettyPrint = prettyPrint;
            return this;
        }
        
        public JsonOptions build() {
            return new JsonOptions(this);
        }
    }
}

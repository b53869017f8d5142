package com.investigator.core.model;

/**
 * Reference to a cloud or platform resource.
 * Either part may be unknown when extracted from free text.
 */
public record ResourceRef(
    String type,
    String id
) {
    public static final String UNKNOWN = "unknown";
    
    public static ResourceRef of(String type, String id) {
        return new ResourceRef(type, id);
    }
    
    public boolean hasType() {
        return type != null && !type.isBlank();
    }
    
    public boolean hasId() {
        return id != null && !id.isBlank();
    }
    
    @Override
    public String toString() {
        return (hasType() ? type : UNKNOWN) + "/" + (hasId() ? id : UNKNOWN);
    }
}

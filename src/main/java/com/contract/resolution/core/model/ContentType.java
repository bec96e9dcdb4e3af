package com.contract.resolution.core.model;

/**
 * Kind of content a chunk carries.
 */
public enum ContentType {
    TEXT,
    TABLE,
    FORM,
    METADATA,
    HEADING
}

package com.finexec.domain.model;

/**
 * Level of a row in the statement table
 */
public enum RowKind {
    CATEGORY,
    SUBCATEGORY,
    ACTIVITY
}

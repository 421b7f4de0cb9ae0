package com.crudbase.model;

import java.util.Map;

/**
 * Caller-supplied field values for a create or a partial update. For updates only the keys
 * present are changed; a key mapped to null sets the column to null.
 */
public interface EntityInput {

  Map<String, Object> fieldValues();
}

package com.aerojob.survey.support;

import com.aerojob.survey.error.exception.InvalidReferenceException;
import org.bson.types.ObjectId;

/**
 * Boundary check for ids taken from paths, query strings and tokens.
 */
public final class ObjectIds {

    private ObjectIds() {
    }

    public static String requireValid(String value, String kind) {
        if (value == null || !ObjectId.isValid(value)) {
            throw new InvalidReferenceException(kind, value);
        }
        return value;
    }

    public static String newId() {
        return new ObjectId().toHexString();
    }
}

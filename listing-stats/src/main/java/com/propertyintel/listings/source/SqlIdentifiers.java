package com.propertyintel.listings.source;

import com.propertyintel.listings.config.InvalidPipelineConfigException;

import java.util.regex.Pattern;

/**
 * Table names come from configuration and are spliced into SQL, so they are
 * restricted to plain or double-quoted identifiers, optionally schema-qualified.
 */
public final class SqlIdentifiers {

    private static final String PART = "(\"[^\"]+\"|[A-Za-z_][A-Za-z0-9_$]*)";
    private static final Pattern QUALIFIED_NAME = Pattern.compile(PART + "(\\." + PART + ")*");

    private SqlIdentifiers() {
    }

    public static String requireTableName(String name, String property) {
        if (name == null || !QUALIFIED_NAME.matcher(name).matches()) {
            throw new InvalidPipelineConfigException(property + " is not a valid table name: " + name);
        }
        return name;
    }
}

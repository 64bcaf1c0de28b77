package com.library.registry.association;

import java.util.regex.Pattern;

/**
 * One orientation of a many-to-many join table: which column holds the owner's id, which
 * holds the linked entity's id, and which table the linked ids must exist in.
 *
 * <p>The names are concatenated into SQL by {@link AssociationSynchronizer}, so only plain
 * lower-case identifiers are accepted.
 */
public record JoinTableMapping(String table, String ownerColumn, String otherColumn, String otherTable) {

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

    public JoinTableMapping {
        requireIdentifier(table);
        requireIdentifier(ownerColumn);
        requireIdentifier(otherColumn);
        requireIdentifier(otherTable);
    }

    /**
     * The same join table seen from the other side.
     *
     * @param ownerTable table holding the current owner's rows, which becomes the table the
     *                   new orientation validates ids against
     */
    public JoinTableMapping inverse(String ownerTable) {
        return new JoinTableMapping(table, otherColumn, ownerColumn, ownerTable);
    }

    private static void requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier: " + name);
        }
    }
}

package com.hcltech.textres.resources.table;

/** What to do when two files of one group resolve to the same locale. */
public enum CollisionPolicy {
    /** Keep the first file located; later ones are dropped without merging. */
    FIRST_WINS,
    /** Refuse to build the table. */
    FAIL
}

package org.kestrel.cli;

/**
 * How the {@code parse} command prints a program.
 */
public enum OutputFormat {
    /** The canonical source rendering, one top-level statement per line. */
    SOURCE,
    /** An indented tree with one node per line. */
    TREE
}

package org.maptracker.merge.tile;

/**
 * How the alignment direction of a non-standard sized tile was decided.
 */
public enum AlignMode {
    AUTO, MANUAL
}

package org.Aayush.guna.dosha;

/**
 * Reference point from which the Mars house is counted.
 */
public enum ManglikReference {
    /** Ascendant; Mars house taken as given. */
    LAGNA,
    /** House of the natal Moon. */
    MOON,
    /** House of natal Venus. */
    VENUS
}

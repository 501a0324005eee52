package org.Aayush.guna.tables;

/**
 * Natural disposition of one planet toward another.
 */
public enum PlanetaryRelation {
    FRIEND,
    NEUTRAL,
    ENEMY
}

package org.Aayush.guna.dosha;

import lombok.Builder;
import lombok.Value;
import org.Aayush.guna.tables.House;
import org.Aayush.guna.tables.Rashi;

/**
 * Chart positions read by {@link ManglikAnalyzer}; every field except the ascendant is optional.
 */
@Value
@Builder(toBuilder = true)
public class ManglikChart {
    Rashi ascendant;
    Rashi moonRashi;
    House marsHouse;
    Rashi marsRashi;
    House venusHouse;
    House jupiterHouse;
}

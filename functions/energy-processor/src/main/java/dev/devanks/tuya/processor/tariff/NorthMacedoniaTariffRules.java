package dev.devanks.tuya.processor.tariff;

import lombok.RequiredArgsConstructor;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static java.time.DayOfWeek.MONDAY;
import static java.time.DayOfWeek.SATURDAY;
import static java.time.DayOfWeek.SUNDAY;

/**
 * Household two-tariff schedule used in North Macedonia.
 * <ul>
 *     <li>weekend: Saturday 22:00 until Monday 07:00</li>
 *     <li>midday: 13:00 until 15:00 every day</li>
 *     <li>nightly: 22:00 until 07:00 every day</li>
 * </ul>
 * Everything else is billed at the high tariff.
 */
@RequiredArgsConstructor
public class NorthMacedoniaTariffRules implements TariffRules {

    public static final String JURISDICTION = "north-macedonia";
    public static final ZoneId DEFAULT_ZONE = ZoneId.of("Europe/Skopje");

    private static final int NIGHT_START_HOUR = 22;
    private static final int NIGHT_END_HOUR = 7;
    private static final int MIDDAY_START_HOUR = 13;
    private static final int MIDDAY_END_HOUR = 15;

    private final ZoneId zone;

    public NorthMacedoniaTariffRules() {
        this(DEFAULT_ZONE);
    }

    @Override
    public String jurisdiction() {
        return JURISDICTION;
    }

    @Override
    public ZoneId zone() {
        return zone;
    }

    @Override
    public boolean isLowTariff(Instant instant) {
        ZonedDateTime local = instant.atZone(zone);
        int hour = local.getHour();
        DayOfWeek day = local.getDayOfWeek();

        return isWeekendWindow(day, hour) || isMiddayWindow(hour) || isNightlyWindow(hour);
    }

    private static boolean isWeekendWindow(DayOfWeek day, int hour) {
        return (day == SATURDAY && hour >= NIGHT_START_HOUR)
                || day == SUNDAY
                || (day == MONDAY && hour < NIGHT_END_HOUR);
    }

    private static boolean isMiddayWindow(int hour) {
        return hour >= MIDDAY_START_HOUR && hour < MIDDAY_END_HOUR;
    }

    private static boolean isNightlyWindow(int hour) {
        return hour >= NIGHT_START_HOUR || hour < NIGHT_END_HOUR;
    }
}

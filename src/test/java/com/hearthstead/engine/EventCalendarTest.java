package com.hearthstead.engine;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class EventCalendarTest {

    private final EventCalendar calendar = new EventCalendar(30, 150, 20);

    @Test
    void hostilityOutsideEveryWindowIsNeutral() {
        assertEquals(1.0, calendar.hostilityModifier(0));
        assertEquals(1.0, calendar.hostilityModifier(51));
        assertNull(calendar.activeWindow(100));
    }

    @Test
    void primaryWindowIsInclusive() {
        assertEquals(2.0, calendar.hostilityModifier(30));
        assertEquals(2.0, calendar.hostilityModifier(50));
        assertTrue(calendar.isPrimaryActive(40));
        assertEquals(EventCalendar.PRIMARY_MARKET_MODIFIER, calendar.marketEventModifier(40));
        assertEquals(1.0, calendar.marketEventModifier(29));
    }

    @Test
    void laterWindowsDampenProduction() {
        assertEquals(0.1, calendar.hostilityModifier(150));
        assertEquals(0.1, calendar.hostilityModifier(190));
        assertEquals(0.01, calendar.hostilityModifier(300));
        assertEquals(0.001, calendar.hostilityModifier(750));
        assertEquals("great_silence", calendar.activeWindow(850).getName());
    }

    @Test
    void generatedParametersStayInRange() {
        Random random = new Random(3);
        for (int i = 0; i < 100; i++) {
            EventCalendar c = EventCalendar.generate(random);
            assertTrue(c.getPrimaryStart() >= 20 && c.getPrimaryStart() <= 60);
            assertTrue(c.getSecondaryStart() >= 120 && c.getSecondaryStart() <= 180);
            assertTrue(c.getDuration() >= 20 && c.getDuration() <= 60);
        }
    }

    @Test
    void sameSeedSameCalendar() {
        EventCalendar a = EventCalendar.generate(new Random(99));
        EventCalendar b = EventCalendar.generate(new Random(99));
        assertEquals(a.getPrimaryStart(), b.getPrimaryStart());
        assertEquals(a.getSecondaryStart(), b.getSecondaryStart());
        assertEquals(a.getDuration(), b.getDuration());
    }
}

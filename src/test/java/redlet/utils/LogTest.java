package redlet.utils;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

public class LogTest {

    private final Locale original = Locale.getDefault();

    @AfterEach
    public void tearDown() {
        Locale.setDefault(original);
        Log.setLevel("INFO");
    }

    @Test
    public void testLevelNamesIgnoreCase() {
        Log.setLevel("debug");
        assertTrue(Log.isDebugEnabled());

        Log.setLevel("Info");
        assertFalse(Log.isDebugEnabled());
    }

    @Test
    public void testLevelNamesUnderTurkishLocale() {
        Locale.setDefault(new Locale("tr", "TR"));

        Log.setLevel("debug");
        assertTrue(Log.isDebugEnabled());

        // "info".toUpperCase() is "İNFO" in this locale
        Log.setLevel("info");
        assertFalse(Log.isDebugEnabled());
    }

    @Test
    public void testUnknownLevelKeepsCurrent() {
        Log.setLevel("debug");
        Log.setLevel("chatty");
        assertTrue(Log.isDebugEnabled());
    }
}

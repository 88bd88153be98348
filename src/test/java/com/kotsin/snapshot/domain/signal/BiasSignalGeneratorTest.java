package com.kotsin.snapshot.domain.signal;

import com.kotsin.snapshot.domain.model.Bias;
import com.kotsin.snapshot.domain.model.CorrectedSnapshot;
import com.kotsin.snapshot.domain.model.Feed;
import com.kotsin.snapshot.domain.record.BiasRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Classification of the last trade price against a corrected band.
 * Band used throughout: lower 6430, reference 6440, upper 6454 (width 24).
 */
@DisplayName("BiasSignalGenerator")
class BiasSignalGeneratorTest {

    private static final double EPSILON = 1e-9;

    private final BiasSignalGenerator generator = new BiasSignalGenerator();
    private final Feed feed = Feed.of("ES-CH4", 0.25);

    private static CorrectedSnapshot band() {
        return CorrectedSnapshot.builder()
            .reference(6440.0).upper(6454.0).lower(6430.0).barIndex(42).build();
    }

    // ========== BREAKOUTS ==========

    @Test
    @DisplayName("Price above upper: BREAKOUT_UP, targets [reference, upper]")
    void testBreakoutUp() {
        BiasRecord record = generator.generate(feed, band(), 6460.0);

        assertEquals(Bias.BREAKOUT_UP, record.getBias());
        assertEquals(0.25, record.getConfidence(), EPSILON);
        assertEquals(List.of(6440.0, 6454.0), record.getTargets());
        assertEquals("ES-CH4", record.getFeedId());
        assertEquals(42, record.getBarIndex());
        assertEquals(6460.0, record.getLastPrice());
    }

    @Test
    @DisplayName("Price below lower: BREAKOUT_DOWN, targets [reference, lower]")
    void testBreakoutDown() {
        BiasRecord record = generator.generate(feed, band(), 6424.0);

        assertEquals(Bias.BREAKOUT_DOWN, record.getBias());
        assertEquals(0.25, record.getConfidence(), EPSILON);
        assertEquals(6440.0, record.getPrimaryTarget());
        assertEquals(6430.0, record.getSecondaryTarget());
    }

    @ParameterizedTest(name = "lastPrice={0} saturates at 1.0")
    @ValueSource(doubles = {6478.0, 6500.0, 6406.0, 6300.0})
    @DisplayName("Breakout confidence saturates at 1")
    void testBreakoutConfidenceCapped(double lastPrice) {
        BiasRecord record = generator.generate(feed, band(), lastPrice);

        assertTrue(record.getBias().isBreakout());
        assertEquals(1.0, record.getConfidence(), EPSILON);
    }

    // ========== INSIDE BAND ==========

    @Test
    @DisplayName("Price inside the band: confidence falls with distance from reference")
    void testInsideBand() {
        BiasRecord record = generator.generate(feed, band(), 6443.0);

        assertEquals(Bias.INSIDE_BAND, record.getBias());
        assertEquals(0.75, record.getConfidence(), EPSILON);
        assertEquals(List.of(6440.0, 6440.0), record.getTargets());
    }

    @Test
    @DisplayName("Price on the reference: full confidence")
    void testOnReference() {
        assertEquals(1.0, generator.generate(feed, band(), 6440.0).getConfidence(), EPSILON);
    }

    @Test
    @DisplayName("Price on a band edge is inside, confidence clamped to 0")
    void testOnEdge() {
        BiasRecord onUpper = generator.generate(feed, band(), 6454.0);
        BiasRecord onLower = generator.generate(feed, band(), 6430.0);

        assertEquals(Bias.INSIDE_BAND, onUpper.getBias());
        assertEquals(Bias.INSIDE_BAND, onLower.getBias());
        assertEquals(0.0, onUpper.getConfidence(), EPSILON);
        assertEquals(0.0, onLower.getConfidence(), EPSILON);
    }

    // ========== DEGENERATE BAND ==========

    @Test
    @DisplayName("Zero-width band uses the tick size as range")
    void testZeroWidthBand() {
        CorrectedSnapshot flat = CorrectedSnapshot.builder()
            .reference(6430.0).upper(6430.0).lower(6430.0).barIndex(1).build();

        BiasRecord inside = generator.generate(feed, flat, 6430.0);
        BiasRecord up = generator.generate(feed, flat, 6430.125);

        assertEquals(Bias.INSIDE_BAND, inside.getBias());
        assertEquals(1.0, inside.getConfidence(), EPSILON);
        assertEquals(Bias.BREAKOUT_UP, up.getBias());
        assertEquals(0.5, up.getConfidence(), EPSILON);
    }

    @Test
    @DisplayName("Same inputs give the same record")
    void testDeterministic() {
        assertEquals(generator.generate(feed, band(), 6447.5), generator.generate(feed, band(), 6447.5));
    }

    @Test
    @DisplayName("BiasRecord refuses confidence outside [0, 1]")
    void testRecordGuards() {
        assertThrows(IllegalArgumentException.class, () -> BiasRecord.builder()
            .feedId("ES").bias(Bias.BREAKOUT_UP).confidence(1.5).build());
        assertThrows(IllegalArgumentException.class, () -> BiasRecord.builder()
            .feedId("ES").confidence(0.5).build());
    }
}

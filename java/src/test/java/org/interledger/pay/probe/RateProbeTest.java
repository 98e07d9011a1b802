package org.interledger.pay.probe;

import org.interledger.pay.model.Amount;
import org.interledger.pay.model.Ratio;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RateProbeTest {

    private static ProbeResult arrived(long sent, long delivered) {
        return ProbeResult.of(Amount.fromLong(sent), ProbeReply.receiverReject(Amount.fromLong(delivered), List.of()));
    }

    @Test
    void boundsTightenAcrossProbes() {
        RateProbe probe = new RateProbe();
        probe.apply(List.of(arrived(10, 8), arrived(1000, 805)));
        probe.apply(List.of(arrived(100, 80)));

        assertEquals(Ratio.of(805, 1000), probe.getLowerBound().orElseThrow());
        assertEquals(Ratio.of(806, 1000), probe.getUpperBound().orElseThrow());
    }

    @Test
    void ignoresProbesThatNeverArrived() {
        RateProbe probe = new RateProbe();
        probe.apply(List.of(
                ProbeResult.of(Amount.fromLong(1000), ProbeReply.reject(IlpErrorCode.F08_AMOUNT_TOO_LARGE)),
                ProbeResult.unreachable(Amount.ONE),
                arrived(0, 0)));

        assertFalse(probe.hasRate());
        assertTrue(probe.getLowerBound().isEmpty());
    }

    @Test
    void zeroDeliveryGivesZeroLowerBound() {
        RateProbe probe = new RateProbe();
        probe.apply(List.of(arrived(1000, 0)));

        assertTrue(probe.hasRate());
        assertEquals(Ratio.ZERO, probe.getLowerBound().orElseThrow());
        assertEquals(Ratio.of(1, 1000), probe.getUpperBound().orElseThrow());
    }
}

package com.gridvault.core.replay;

import com.gridvault.core.model.Address;
import com.gridvault.core.runtime.JournaledState;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Highest processed signId per asset.
 *
 * Only decides whether a deposit may trigger a reserve sweep. Replay rejection is the
 * job of {@link ReplayGuard}.
 */
public class SignIdWatermark extends JournaledState {

    private final Map<Address, BigInteger> last = new HashMap<>();

    public BigInteger last(Address asset) {
        return last.getOrDefault(asset, BigInteger.ZERO);
    }

    /**
     * Moves the watermark forward.
     *
     * @return true only if {@code signId} is strictly greater than the current watermark
     */
    public boolean advance(Address asset, BigInteger signId) {
        if (asset == null || signId == null) {
            throw new IllegalArgumentException("Asset and signId cannot be null");
        }
        if (signId.compareTo(last(asset)) <= 0) {
            return false;
        }
        journalEntry(last, asset);
        last.put(asset, signId);
        return true;
    }
}

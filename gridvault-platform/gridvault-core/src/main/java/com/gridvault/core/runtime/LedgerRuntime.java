package com.gridvault.core.runtime;

import com.gridvault.core.event.EventLog;
import com.gridvault.core.model.Address;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.function.Supplier;

/**
 * Serialized, all-or-nothing execution of vault operations.
 *
 * Every invocation opens a frame: attached value moves from the caller to the target,
 * then the body runs. Registered state journals each change it makes in the frame; if
 * the body throws, those changes are undone and the frame's events are dropped. Frames
 * nest, so a receive hook calling back into a vault gets its own frame inside the outer one.
 */
public class LedgerRuntime {

    private static final Logger log = LoggerFactory.getLogger(LedgerRuntime.class);
    private static final BigInteger CONTRACT_ADDRESS_BASE = new BigInteger("c0de000000000000000000000000000000000000", 16);

    private final long chainId;
    private final LedgerClock clock;
    private final EventLog events;
    private final AssetCustody custody;
    private final UndoLog undoLog = new UndoLog();
    private long deployments;
    private int depth;

    public LedgerRuntime(long chainId, LedgerClock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        if (chainId <= 0) {
            throw new IllegalArgumentException("Chain id must be positive");
        }
        this.chainId = chainId;
        this.clock = clock;
        this.events = new EventLog(clock);
        this.custody = new AssetCustody(this);
        custody.attach(undoLog);
    }

    public LedgerRuntime(long chainId) {
        this(chainId, new LedgerClock());
    }

    /**
     * Allocates a fresh contract address.
     */
    public Address deploy(String contractName) {
        deployments++;
        Address address = Address.fromNumber(CONTRACT_ADDRESS_BASE.add(BigInteger.valueOf(deployments)));
        log.info("Deployed {} at {} on chain {}", contractName, address, chainId);
        return address;
    }

    /**
     * Registers state whose changes are undone when an invocation fails.
     */
    public void register(Journaled state) {
        if (state == null) {
            throw new IllegalArgumentException("State cannot be null");
        }
        if (depth > 0) {
            throw new IllegalStateException("Cannot register state inside an invocation");
        }
        state.attach(undoLog);
    }

    /**
     * Runs an operation against {@code target} and returns its result.
     */
    public <T> T invoke(Address target, Call call, Supplier<T> body) {
        if (target == null || call == null || body == null) {
            throw new IllegalArgumentException("Target, call and body cannot be null");
        }
        int undoMark = undoLog.begin();
        int mark = events.openFrame();
        depth++;
        boolean success = false;
        try {
            if (call.hasValue()) {
                custody.transfer(Address.NATIVE, call.caller(), target, call.value());
            }
            T result = body.get();
            success = true;
            return result;
        } finally {
            depth--;
            if (success) {
                undoLog.commit(undoMark);
            } else {
                undoLog.rollback(undoMark);
                log.debug("Rolled back call from {} to {}", call.caller(), target);
            }
            events.closeFrame(mark, success);
        }
    }

    /**
     * Runs an operation with no result.
     */
    public void execute(Address target, Call call, Runnable body) {
        invoke(target, call, () -> {
            body.run();
            return null;
        });
    }

    public boolean inInvocation() {
        return depth > 0;
    }

    /**
     * Undo entries held for the currently open frames.
     */
    public int pendingUndoEntries() {
        return undoLog.pending();
    }

    public long chainId() {
        return chainId;
    }

    public LedgerClock clock() {
        return clock;
    }

    public long now() {
        return clock.now();
    }

    public EventLog events() {
        return events;
    }

    public AssetCustody custody() {
        return custody;
    }
}

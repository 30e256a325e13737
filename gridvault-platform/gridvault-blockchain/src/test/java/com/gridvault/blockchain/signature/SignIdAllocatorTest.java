package com.gridvault.blockchain.signature;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class SignIdAllocatorTest {

    @Test
    void idsIncreasePerScope() {
        SignIdAllocator allocator = new SignIdAllocator();

        assertThat(allocator.allocate("bank")).isEqualTo(BigInteger.ONE);
        assertThat(allocator.allocate("bank")).isEqualTo(BigInteger.TWO);
        assertThat(allocator.allocate("grid")).isEqualTo(BigInteger.ONE);
        assertThat(allocator.lastIssued("bank")).isEqualTo(BigInteger.TWO);
        assertThat(allocator.lastIssued("unused")).isZero();
    }

    @Test
    void advancePastSkipsSeenIds() {
        SignIdAllocator allocator = new SignIdAllocator();
        allocator.allocate("grid");

        allocator.advancePast("grid", BigInteger.valueOf(40));
        allocator.advancePast("grid", BigInteger.valueOf(12));

        assertThat(allocator.allocate("grid")).isEqualTo(BigInteger.valueOf(41));
    }

    @Test
    void blankScopeIsRejected() {
        SignIdAllocator allocator = new SignIdAllocator();

        assertThatThrownBy(() -> allocator.allocate(" "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> allocator.advancePast("grid", BigInteger.valueOf(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void concurrentAllocationsNeverCollide() throws InterruptedException {
        SignIdAllocator allocator = new SignIdAllocator();
        Set<BigInteger> issued = ConcurrentHashMap.newKeySet();
        ExecutorService pool = Executors.newFixedThreadPool(8);

        for (int i = 0; i < 1_000; i++) {
            pool.submit(() -> issued.add(allocator.allocate("bank")));
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(issued).hasSize(1_000);
        assertThat(allocator.lastIssued("bank")).isEqualTo(BigInteger.valueOf(1_000));
    }
}

package com.leasehold.service.infrastructure.chain;

import com.leasehold.access.vault.CallResult;
import com.leasehold.access.vault.ExternalCallPort;
import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.web3j.utils.Numeric;

/**
 * {@link ExternalCallPort} for environments without a chain connection. Every call succeeds with
 * empty return data and is logged with its selector.
 */
@Component
public class SimulatedExternalCallPort implements ExternalCallPort {

    private static final Logger log = LoggerFactory.getLogger(SimulatedExternalCallPort.class);

    private final AtomicLong callCount = new AtomicLong();

    @Override
    public CallResult call(String from, String to, BigInteger value, byte[] payload) {
        long n = callCount.incrementAndGet();
        String selector = payload.length >= 4 ? Numeric.toHexString(payload, 0, 4, true) : "none";
        log.info("Simulated call #{} from {} to {} value={} selector={}", n, from, to, value, selector);
        return CallResult.ok();
    }

    public long callCount() {
        return callCount.get();
    }
}

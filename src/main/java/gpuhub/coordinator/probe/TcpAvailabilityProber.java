package gpuhub.coordinator.probe;

import gpuhub.coordinator.model.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

/**
 * Probes a worker by opening a TCP connection to its host and port.
 */
public final class TcpAvailabilityProber implements AvailabilityProber {

    private static final Logger log = LoggerFactory.getLogger(TcpAvailabilityProber.class);

    private final int timeoutMillis;

    public TcpAvailabilityProber(Duration timeout) {
        this.timeoutMillis = (int) Math.max(1, Math.min(Integer.MAX_VALUE, timeout.toMillis()));
    }

    @Override
    public boolean probe(Worker worker) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(worker.host(), worker.port()), timeoutMillis);
            return true;
        } catch (IOException | IllegalArgumentException e) {
            log.debug("Worker {} at {}:{} unreachable: {}", worker.id(), worker.host(), worker.port(), e.getMessage());
            return false;
        }
    }
}
